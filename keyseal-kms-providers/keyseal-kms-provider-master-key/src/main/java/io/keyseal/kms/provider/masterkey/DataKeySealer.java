/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.kms.provider.masterkey;

import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Objects;

import javax.annotation.concurrent.ThreadSafe;
import javax.crypto.Cipher;

import io.keyseal.kms.service.DestroyableRawSecretKey;

/**
 * <p>Seals small secrets (such as data keys) with an authenticated cipher.</p>
 *
 * <p>A sealed secret has the following layout:</p>
 * <pre>
 *   version (1 byte, 0x01)
 *   cipher suite code (1 byte)
 *   plaintext length (2 bytes, unsigned big-endian)
 *   nonce (12 bytes)
 *   ciphertext (plaintext length bytes)
 *   authentication tag (16 bytes)
 * </pre>
 * <p>The first 16 bytes (the header) are authenticated as additional data.
 * A sealed secret is therefore always exactly {@link #OVERHEAD} bytes longer than the plaintext.</p>
 *
 * <p>Unsealing uses the cipher suite recorded in the header, not the suite this sealer seals with.</p>
 */
@ThreadSafe
class DataKeySealer {

    static final byte VERSION = 0x01;
    static final int HEADER_LENGTH = 4 + CipherSuite.NONCE_LENGTH;
    static final int OVERHEAD = HEADER_LENGTH + CipherSuite.TAG_LENGTH;
    static final int MAX_PLAINTEXT_LENGTH = 0xFFFF;

    private final CipherSuite cipherSuite;
    private final SecureRandom random;

    DataKeySealer(CipherSuite cipherSuite, SecureRandom random) {
        this.cipherSuite = Objects.requireNonNull(cipherSuite);
        this.random = Objects.requireNonNull(random);
    }

    CipherSuite cipherSuite() {
        return cipherSuite;
    }

    /**
     * Seals the given plaintext.
     * @param key The sealing key, which must be 32 bytes.
     * @param plaintext The plaintext.
     * @return The sealed plaintext.
     * @throws GeneralSecurityException If the cipher fails, or writes other than {@code plaintext.length + 16} bytes.
     */
    byte[] seal(DestroyableRawSecretKey key, byte[] plaintext) throws GeneralSecurityException {
        if (plaintext.length > MAX_PLAINTEXT_LENGTH) {
            throw new IllegalArgumentException("Plaintext too long: " + plaintext.length + " bytes");
        }
        byte[] nonce = new byte[CipherSuite.NONCE_LENGTH];
        random.nextBytes(nonce);

        byte[] sealed = new byte[plaintext.length + OVERHEAD];
        ByteBuffer.wrap(sealed)
                .put(VERSION)
                .put(cipherSuite.code())
                .putShort((short) plaintext.length)
                .put(nonce);

        var suiteKey = DestroyableRawSecretKey.takeCopyOf(key.getEncoded(), cipherSuite.keyAlgorithm());
        try {
            Cipher cipher = newCipher(cipherSuite);
            cipher.init(Cipher.ENCRYPT_MODE, suiteKey, cipherSuite.parameterSpec(nonce));
            cipher.updateAAD(sealed, 0, HEADER_LENGTH);
            int written = cipher.doFinal(plaintext, 0, plaintext.length, sealed, HEADER_LENGTH);
            if (HEADER_LENGTH + written != sealed.length) {
                throw new GeneralSecurityException("Cipher wrote " + written + " bytes, expected " + (sealed.length - HEADER_LENGTH));
            }
        }
        finally {
            suiteKey.destroy();
        }
        return sealed;
    }

    /**
     * Authenticates and unseals the given sealed plaintext.
     * @param key The sealing key.
     * @param sealed The sealed plaintext.
     * @return The plaintext.
     * @throws GeneralSecurityException If the sealed plaintext is malformed, or fails authentication.
     */
    byte[] unseal(DestroyableRawSecretKey key, byte[] sealed) throws GeneralSecurityException {
        if (sealed.length < OVERHEAD) {
            throw new GeneralSecurityException("Sealed secret is too short");
        }
        var header = ByteBuffer.wrap(sealed, 0, HEADER_LENGTH);
        if (header.get() != VERSION) {
            throw new GeneralSecurityException("Unsupported sealed secret version");
        }
        CipherSuite suite = CipherSuite.fromCode(header.get());
        if (suite == null) {
            throw new GeneralSecurityException("Unknown cipher suite");
        }
        int plaintextLength = Short.toUnsignedInt(header.getShort());
        if (plaintextLength != sealed.length - OVERHEAD) {
            throw new GeneralSecurityException("Sealed secret length does not match header");
        }
        byte[] nonce = new byte[CipherSuite.NONCE_LENGTH];
        header.get(nonce);

        var suiteKey = DestroyableRawSecretKey.takeCopyOf(key.getEncoded(), suite.keyAlgorithm());
        try {
            Cipher cipher = newCipher(suite);
            cipher.init(Cipher.DECRYPT_MODE, suiteKey, suite.parameterSpec(nonce));
            cipher.updateAAD(sealed, 0, HEADER_LENGTH);
            return cipher.doFinal(sealed, HEADER_LENGTH, sealed.length - HEADER_LENGTH);
        }
        finally {
            suiteKey.destroy();
        }
    }

    Cipher newCipher(CipherSuite suite) throws GeneralSecurityException {
        return Cipher.getInstance(suite.transformation());
    }
}
