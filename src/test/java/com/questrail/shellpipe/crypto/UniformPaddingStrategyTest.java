package com.questrail.shellpipe.crypto;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class UniformPaddingStrategyTest
{
    @Test
    void lengthsStayWithinInclusiveBounds()
    {
        UniformPaddingStrategy padding = new UniformPaddingStrategy(4, 8);
        Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            int length = padding.nextPadding().length;
            assertTrue(length >= 4 && length <= 8, "length " + length);
            seen.add(length);
        }
        assertTrue(seen.contains(4));
        assertTrue(seen.contains(8));
    }

    @Test
    void equalBoundsGiveFixedLength()
    {
        UniformPaddingStrategy padding = new UniformPaddingStrategy(16, 16);
        assertEquals(16, padding.nextPadding().length);
        assertEquals(16, padding.nextPadding().length);
    }

    @Test
    void zeroLengthPaddingIsAllowed()
    {
        assertEquals(0, new UniformPaddingStrategy(0, 0).nextPadding().length);
    }

    @Test
    void defaultsMatchDocumentedWindow()
    {
        UniformPaddingStrategy padding = new UniformPaddingStrategy();
        assertEquals(32, padding.minLength());
        assertEquals(1024, padding.maxLength());
    }

    @Test
    void invalidBoundsAreRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> new UniformPaddingStrategy(-1, 4));
        assertThrows(IllegalArgumentException.class, () -> new UniformPaddingStrategy(8, 4));
    }

    @Test
    void widestWindowIsCapped()
    {
        assertThrows(IllegalArgumentException.class, () -> new UniformPaddingStrategy(0, Integer.MAX_VALUE));
        assertThrows(IllegalArgumentException.class,
                () -> new UniformPaddingStrategy(0, UniformPaddingStrategy.MAX_LENGTH_LIMIT + 1));

        UniformPaddingStrategy widest = new UniformPaddingStrategy(0, UniformPaddingStrategy.MAX_LENGTH_LIMIT);
        int length = widest.nextPadding().length;
        assertTrue(length >= 0 && length <= UniformPaddingStrategy.MAX_LENGTH_LIMIT);
    }
}
