package com.questrail.shellpipe.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Arrays;
import java.util.Objects;

/**
 * EncryptedPacket
 * =============================================================================
 * Plaintext envelope sealed inside an {@link EncryptedBundle}.
 *
 * <p>The real {@code payload} sits between two blocks of random decoy padding
 * whose lengths are drawn independently on every encryption. Their only job is
 * to make the ciphertext size and content differ for identical payloads; the
 * receiver discards them.</p>
 *
 * <p>Wire tags: {@code Dummy1} (prefix), {@code Data} (payload),
 * {@code Dummy2} (suffix).</p>
 */
@JsonPropertyOrder({"Dummy1", "Data", "Dummy2"})
public record EncryptedPacket(
        @JsonProperty("Dummy1") byte[] decoyPrefix,
        @JsonProperty("Data") byte[] payload,
        @JsonProperty("Dummy2") byte[] decoySuffix
) {
    public EncryptedPacket {
        decoyPrefix = Objects.requireNonNull(decoyPrefix, "decoyPrefix").clone();
        payload = Objects.requireNonNull(payload, "payload").clone();
        decoySuffix = Objects.requireNonNull(decoySuffix, "decoySuffix").clone();
    }

    @Override
    @JsonProperty("Dummy1")
    public byte[] decoyPrefix() {
        return decoyPrefix.clone();
    }

    @Override
    @JsonProperty("Data")
    public byte[] payload() {
        return payload.clone();
    }

    @Override
    @JsonProperty("Dummy2")
    public byte[] decoySuffix() {
        return decoySuffix.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EncryptedPacket other)) {
            return false;
        }
        return Arrays.equals(decoyPrefix, other.decoyPrefix)
                && Arrays.equals(payload, other.payload)
                && Arrays.equals(decoySuffix, other.decoySuffix);
    }

    @Override
    public int hashCode() {
        int h = Arrays.hashCode(decoyPrefix);
        h = 31 * h + Arrays.hashCode(payload);
        h = 31 * h + Arrays.hashCode(decoySuffix);
        return h;
    }

    @Override
    public String toString() {
        return "EncryptedPacket[decoyPrefix=" + decoyPrefix.length + "B, payload=" + payload.length
                + "B, decoySuffix=" + decoySuffix.length + "B]";
    }
}
