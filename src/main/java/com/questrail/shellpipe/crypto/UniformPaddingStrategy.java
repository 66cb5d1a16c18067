package com.questrail.shellpipe.crypto;

import java.security.SecureRandom;
import java.util.Objects;

/**
 * {@link PaddingStrategy} drawing each block length uniformly from
 * {@code [minLength, maxLength]} (both inclusive) and filling it with random
 * bytes. {@code maxLength} is capped at {@value #MAX_LENGTH_LIMIT}.
 */
public final class UniformPaddingStrategy implements PaddingStrategy
{
    public static final int DEFAULT_MIN_LENGTH = 32;
    public static final int DEFAULT_MAX_LENGTH = 1024;
    public static final int MAX_LENGTH_LIMIT = 1024 * 1024;

    private final int minLength;
    private final int maxLength;
    private final SecureRandom random;

    public UniformPaddingStrategy()
    {
        this(DEFAULT_MIN_LENGTH, DEFAULT_MAX_LENGTH, new SecureRandom());
    }

    public UniformPaddingStrategy(int minLength, int maxLength)
    {
        this(minLength, maxLength, new SecureRandom());
    }

    public UniformPaddingStrategy(int minLength, int maxLength, SecureRandom random)
    {
        if (minLength < 0) {
            throw new IllegalArgumentException("minLength must be non-negative");
        }
        if (maxLength < minLength) {
            throw new IllegalArgumentException("maxLength must be >= minLength");
        }
        if (maxLength > MAX_LENGTH_LIMIT) {
            throw new IllegalArgumentException("maxLength must not exceed " + MAX_LENGTH_LIMIT);
        }
        this.minLength = minLength;
        this.maxLength = maxLength;
        this.random = Objects.requireNonNull(random, "random");
    }

    public int minLength()
    {
        return minLength;
    }

    public int maxLength()
    {
        return maxLength;
    }

    @Override
    public byte[] nextPadding()
    {
        int length = minLength + random.nextInt(maxLength - minLength + 1);
        byte[] padding = new byte[length];
        random.nextBytes(padding);
        return padding;
    }
}
