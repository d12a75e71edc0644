/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.kms.provider.masterkey;

import java.util.HexFormat;
import java.util.Objects;

import io.keyseal.kms.service.DestroyableRawSecretKey;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A master key together with its id, as given in the form {@code <key-id>:<64 hex digits>}.
 */
public final class MasterKeySpec {

    static final int MASTER_KEY_LENGTH = 32;

    private final String keyId;
    private final DestroyableRawSecretKey key;

    private MasterKeySpec(String keyId, DestroyableRawSecretKey key) {
        this.keyId = keyId;
        this.key = key;
    }

    /**
     * Parses a master key spec.
     * @param spec The spec, in the form {@code <key-id>:<64 hex digits>}.
     * @return The parsed spec.
     * @throws IllegalArgumentException If the spec is malformed. The message never includes the key.
     */
    public static @NonNull MasterKeySpec parse(@NonNull String spec) {
        Objects.requireNonNull(spec);
        int sep = spec.lastIndexOf(':');
        if (sep < 0) {
            throw new IllegalArgumentException("Master key must have the form <key-id>:<hex key>");
        }
        String keyId = spec.substring(0, sep).strip();
        if (keyId.isEmpty()) {
            throw new IllegalArgumentException("Master key id must not be empty");
        }
        return new MasterKeySpec(keyId, parseKey(spec.substring(sep + 1)));
    }

    /**
     * Decodes a hex-encoded master key.
     * @param hex 64 hexadecimal digits.
     * @return The key.
     * @throws IllegalArgumentException If the key is not 64 hexadecimal digits. The message never includes the key.
     */
    public static @NonNull DestroyableRawSecretKey parseKey(@NonNull String hex) {
        String stripped = Objects.requireNonNull(hex).strip();
        if (stripped.length() != MASTER_KEY_LENGTH * 2) {
            throw new IllegalArgumentException("Master key must be " + (MASTER_KEY_LENGTH * 2) + " hexadecimal digits, but has " + stripped.length());
        }
        for (int i = 0; i < stripped.length(); i++) {
            if (!HexFormat.isHexDigit(stripped.charAt(i))) {
                throw new IllegalArgumentException("Master key contains a non-hexadecimal character at index " + i);
            }
        }
        return DestroyableRawSecretKey.takeOwnershipOf(HexFormat.of().parseHex(stripped), KeyDerivation.ALGORITHM);
    }

    public @NonNull String keyId() {
        return keyId;
    }

    public @NonNull DestroyableRawSecretKey key() {
        return key;
    }

    @Override
    public String toString() {
        return "MasterKeySpec[keyId=" + keyId + ", key=*******]";
    }
}
