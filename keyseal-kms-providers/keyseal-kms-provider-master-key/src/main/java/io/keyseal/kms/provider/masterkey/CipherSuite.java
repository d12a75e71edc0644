/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.kms.provider.masterkey;

import java.security.spec.AlgorithmParameterSpec;

import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.IvParameterSpec;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The authenticated ciphers which can seal data keys.
 * Each suite uses a 256-bit key, a 96-bit nonce and a 128-bit authentication tag.
 */
public enum CipherSuite {

    AES_256_GCM((byte) 0x00, "AES/GCM/NoPadding", "AES") {
        @Override
        AlgorithmParameterSpec parameterSpec(byte[] nonce) {
            return new GCMParameterSpec(TAG_LENGTH * Byte.SIZE, nonce);
        }
    },
    CHACHA20_POLY1305((byte) 0x01, "ChaCha20-Poly1305", "ChaCha20") {
        @Override
        AlgorithmParameterSpec parameterSpec(byte[] nonce) {
            return new IvParameterSpec(nonce);
        }
    };

    static final int NONCE_LENGTH = 12;
    static final int TAG_LENGTH = 16;

    private final byte code;
    private final String transformation;
    private final String keyAlgorithm;

    CipherSuite(byte code, String transformation, String keyAlgorithm) {
        this.code = code;
        this.transformation = transformation;
        this.keyAlgorithm = keyAlgorithm;
    }

    /**
     * @return The code which identifies this suite in a sealed key.
     */
    public byte code() {
        return code;
    }

    /**
     * @return The JCA cipher transformation.
     */
    public @NonNull String transformation() {
        return transformation;
    }

    /**
     * @return The JCA algorithm of keys used with this suite.
     */
    public @NonNull String keyAlgorithm() {
        return keyAlgorithm;
    }

    abstract AlgorithmParameterSpec parameterSpec(byte[] nonce);

    /**
     * @param code A suite code.
     * @return The suite with the given code, or null if there is no such suite.
     */
    static CipherSuite fromCode(byte code) {
        for (CipherSuite suite : values()) {
            if (suite.code == code) {
                return suite;
            }
        }
        return null;
    }
}
