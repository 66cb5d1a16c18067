package com.questrail.shellpipe.codec;

/**
 * Base type for failures to open a sealed bundle.
 *
 * <p>Both subtypes are non-fatal to the relay: the offending unit is dropped
 * and the pump carries on.</p>
 */
public class PacketCodecException extends RuntimeException
{
    public PacketCodecException(String message) {
        super(message);
    }

    public PacketCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
