package com.questrail.shellpipe.relay;

import java.io.InputStream;
import java.io.OutputStream;

/**
 * WireFormat
 * -----------------------------------------------------------------------------
 * How units are represented on the transport side of a pump.
 *
 * <ul>
 *   <li>{@link PlainWireFormat}: raw bytes, no framing</li>
 *   <li>{@link SealedWireFormat}: one sealed bundle per line</li>
 * </ul>
 *
 * <p>The local side of a pump (command host, console) is always raw.</p>
 */
public interface WireFormat
{
    /**
     * @param transportIn bytes received from the peer
     * @return a source yielding decoded units
     */
    UnitSource source(InputStream transportIn);

    /**
     * @param transportOut bytes sent to the peer
     * @return a sink encoding each unit for the wire
     */
    UnitSink sink(OutputStream transportOut);

    /**
     * @return {@code true} if units are encrypted on the wire
     */
    boolean isSealed();
}
