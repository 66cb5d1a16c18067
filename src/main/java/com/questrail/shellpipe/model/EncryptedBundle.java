package com.questrail.shellpipe.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Arrays;
import java.util.Objects;

/**
 * EncryptedBundle
 * =============================================================================
 * The wire-visible unit of the sealed channel: AES-GCM ciphertext plus
 * everything the receiver needs to open it.
 *
 * <ul>
 *   <li>{@code ciphertext}: the sealed {@link EncryptedPacket} envelope</li>
 *   <li>{@code nonce}: GCM nonce, fresh per bundle</li>
 *   <li>{@code tag}: GCM authentication tag</li>
 *   <li>{@code salt}: key-derivation salt, fresh per bundle</li>
 * </ul>
 *
 * <p>On the wire the fields are tagged {@code Data}, {@code Nonce}, {@code Tag}
 * and {@code Salt}, each rendered as Base64.</p>
 *
 * <p>Bundles are built at encrypt time and discarded after decrypt; they are
 * never persisted.</p>
 */
@JsonPropertyOrder({"Data", "Nonce", "Tag", "Salt"})
public record EncryptedBundle(
        @JsonProperty("Data") byte[] ciphertext,
        @JsonProperty("Nonce") byte[] nonce,
        @JsonProperty("Tag") byte[] tag,
        @JsonProperty("Salt") byte[] salt
) {
    public EncryptedBundle {
        ciphertext = Objects.requireNonNull(ciphertext, "ciphertext").clone();
        nonce = Objects.requireNonNull(nonce, "nonce").clone();
        tag = Objects.requireNonNull(tag, "tag").clone();
        salt = Objects.requireNonNull(salt, "salt").clone();
    }

    @Override
    @JsonProperty("Data")
    public byte[] ciphertext() {
        return ciphertext.clone();
    }

    @Override
    @JsonProperty("Nonce")
    public byte[] nonce() {
        return nonce.clone();
    }

    @Override
    @JsonProperty("Tag")
    public byte[] tag() {
        return tag.clone();
    }

    @Override
    @JsonProperty("Salt")
    public byte[] salt() {
        return salt.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EncryptedBundle other)) {
            return false;
        }
        return Arrays.equals(ciphertext, other.ciphertext)
                && Arrays.equals(nonce, other.nonce)
                && Arrays.equals(tag, other.tag)
                && Arrays.equals(salt, other.salt);
    }

    @Override
    public int hashCode() {
        int h = Arrays.hashCode(ciphertext);
        h = 31 * h + Arrays.hashCode(nonce);
        h = 31 * h + Arrays.hashCode(tag);
        h = 31 * h + Arrays.hashCode(salt);
        return h;
    }

    @Override
    public String toString() {
        return "EncryptedBundle[ciphertext=" + ciphertext.length + "B, nonce=" + nonce.length
                + "B, tag=" + tag.length + "B, salt=" + salt.length + "B]";
    }
}
