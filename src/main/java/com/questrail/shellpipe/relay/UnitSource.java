package com.questrail.shellpipe.relay;

import java.io.IOException;
import java.util.Optional;

/**
 * Pull side of a pump: yields one unit per call.
 *
 * <p>Return values:</p>
 * <ul>
 *   <li>{@link Optional#empty()}: end-of-stream; the pump terminates</li>
 *   <li>a zero-length array: a unit that was read but carries nothing to
 *       forward (e.g. a record that failed to open); the pump moves on</li>
 *   <li>anything else: bytes to forward</li>
 * </ul>
 */
@FunctionalInterface
public interface UnitSource
{
    Optional<byte[]> next() throws IOException;

    /**
     * @return number of units this source has read and discarded so far
     */
    default long droppedUnits()
    {
        return 0;
    }
}
