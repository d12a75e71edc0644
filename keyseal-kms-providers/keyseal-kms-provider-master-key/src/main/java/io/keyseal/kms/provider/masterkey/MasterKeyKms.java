/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.kms.provider.masterkey;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import javax.annotation.concurrent.ThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.keyseal.kms.service.DataKeyPair;
import io.keyseal.kms.service.DestroyableRawSecretKey;
import io.keyseal.kms.service.FatalFailureHandler;
import io.keyseal.kms.service.Kms;
import io.keyseal.kms.service.KmsContext;
import io.keyseal.kms.service.KmsException;
import io.keyseal.kms.service.KmsInfo;
import io.keyseal.kms.service.UnsealException;
import io.keyseal.kms.service.UnsupportedKmsOperationException;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>A {@link Kms} backed by a single, statically configured, 256-bit master key.</p>
 *
 * <p>Data keys are 32 random bytes. Each is sealed under a key derived from the master key,
 * the requested key id and the context (see {@link KeyDerivation}), so unsealing requires the same key id and context.
 * Sealed keys are always {@value #SEALED_KEY_LENGTH} bytes.</p>
 *
 * <p>Failure of the random source, or of the sealing cipher, is fatal: it is reported to the
 * {@link FatalFailureHandler} and then thrown as a {@link io.keyseal.kms.service.FatalKmsError}.</p>
 *
 * <p>Once the master key has been destroyed (by closing the {@link MasterKeyKmsService} that built this KMS)
 * both {@link #generateKey(String, KmsContext)} and {@link #unsealKey(String, byte[], KmsContext)} throw
 * {@link KmsException}.</p>
 */
@ThreadSafe
public class MasterKeyKms implements Kms {

    private static final Logger LOGGER = LoggerFactory.getLogger(MasterKeyKms.class);

    static final int DATA_KEY_LENGTH = 32;
    static final int SEALED_KEY_LENGTH = DATA_KEY_LENGTH + DataKeySealer.OVERHEAD;
    static final String DATA_KEY_ALGORITHM = "AES";
    static final int FATAL_EXIT_STATUS = 1;

    static final String MASTER_KEY_DESTROYED = "Master key has been destroyed, the KMS service that built this KMS is closed";

    private static final KmsInfo INFO = new KmsInfo(List.of(), "", "master-key");

    private final String keyId;
    private final DestroyableRawSecretKey masterKey;
    private final DataKeySealer sealer;
    private final SecureRandom random;
    private final FatalFailureHandler fatalFailureHandler;

    /**
     * Creates a KMS which seals with AES-256-GCM and halts the JVM on fatal failure.
     * @param keyId The id of the master key.
     * @param masterKey The 32-byte master key.
     */
    public MasterKeyKms(@NonNull String keyId, @NonNull DestroyableRawSecretKey masterKey) {
        this(keyId, masterKey, CipherSuite.AES_256_GCM, new SecureRandom(), FatalFailureHandler.halting(FATAL_EXIT_STATUS));
    }

    public MasterKeyKms(@NonNull String keyId,
                        @NonNull DestroyableRawSecretKey masterKey,
                        @NonNull CipherSuite cipherSuite,
                        @NonNull SecureRandom random,
                        @NonNull FatalFailureHandler fatalFailureHandler) {
        this(keyId, masterKey, new DataKeySealer(cipherSuite, random), random, fatalFailureHandler);
    }

    MasterKeyKms(String keyId,
                 DestroyableRawSecretKey masterKey,
                 DataKeySealer sealer,
                 SecureRandom random,
                 FatalFailureHandler fatalFailureHandler) {
        this.keyId = Objects.requireNonNull(keyId);
        this.masterKey = Objects.requireNonNull(masterKey);
        if (masterKey.numKeyBytes() != MasterKeySpec.MASTER_KEY_LENGTH) {
            throw new IllegalArgumentException("Master key must be " + MasterKeySpec.MASTER_KEY_LENGTH + " bytes, but was " + masterKey.numKeyBytes());
        }
        this.sealer = Objects.requireNonNull(sealer);
        this.random = Objects.requireNonNull(random);
        this.fatalFailureHandler = Objects.requireNonNull(fatalFailureHandler);
    }

    /**
     * Creates a KMS from a master key spec of the form {@code <key-id>:<64 hex digits>}.
     * @param spec The spec.
     * @return The KMS.
     * @throws IllegalArgumentException If the spec is malformed.
     */
    public static @NonNull MasterKeyKms fromSpec(@NonNull String spec) {
        var parsed = MasterKeySpec.parse(spec);
        return new MasterKeyKms(parsed.keyId(), parsed.key());
    }

    @NonNull
    @Override
    public String defaultKeyId() {
        return keyId;
    }

    /**
     * Always fails: a static master key cannot create further keys.
     * @throws UnsupportedKmsOperationException always
     */
    @Override
    public void createKey(@NonNull String keyId) {
        throw new UnsupportedKmsOperationException("Creating keys is not supported by a static master key");
    }

    @NonNull
    @Override
    public DataKeyPair generateKey(@NonNull String keyId, @Nullable KmsContext context) {
        Objects.requireNonNull(keyId);
        checkMasterKeyAvailable();
        var ctx = KmsContext.orEmpty(context);
        warnIfNotEscaped(keyId, ctx);

        var derivedKey = deriveSealingKey(keyId, ctx);
        byte[] dataKey = new byte[DATA_KEY_LENGTH];
        byte[] sealed;
        try {
            try {
                random.nextBytes(dataKey);
            }
            catch (RuntimeException e) {
                throw fatalFailureHandler.fatal("Unable to read random bytes for a data key", e);
            }
            try {
                sealed = sealer.seal(derivedKey, dataKey);
            }
            catch (GeneralSecurityException | RuntimeException e) {
                Arrays.fill(dataKey, (byte) 0);
                throw fatalFailureHandler.fatal("Unable to seal a data key", e);
            }
        }
        finally {
            derivedKey.destroy();
        }
        if (sealed.length != SEALED_KEY_LENGTH) {
            Arrays.fill(dataKey, (byte) 0);
            throw fatalFailureHandler.fatal("Sealed data key has " + sealed.length + " bytes, expected " + SEALED_KEY_LENGTH, null);
        }
        LOGGER.debug("Generated data key sealed under key id '{}' using {}", keyId, sealer.cipherSuite());
        return new DataKeyPair(DestroyableRawSecretKey.takeOwnershipOf(dataKey, DATA_KEY_ALGORITHM), sealed);
    }

    @NonNull
    @Override
    public DestroyableRawSecretKey unsealKey(@NonNull String keyId,
                                             @NonNull byte[] sealedKey,
                                             @Nullable KmsContext context) {
        Objects.requireNonNull(keyId);
        checkMasterKeyAvailable();
        if (sealedKey == null || sealedKey.length != SEALED_KEY_LENGTH) {
            LOGGER.debug("Rejected sealed data key for key id '{}' with wrong length", keyId);
            throw new UnsealException();
        }
        var ctx = KmsContext.orEmpty(context);
        warnIfNotEscaped(keyId, ctx);

        var derivedKey = deriveSealingKey(keyId, ctx);
        byte[] dataKey;
        try {
            dataKey = sealer.unseal(derivedKey, sealedKey);
        }
        catch (GeneralSecurityException e) {
            LOGGER.debug("Failed to unseal data key for key id '{}'", keyId);
            throw new UnsealException();
        }
        finally {
            derivedKey.destroy();
        }
        if (dataKey.length != DATA_KEY_LENGTH) {
            Arrays.fill(dataKey, (byte) 0);
            throw new UnsealException();
        }
        LOGGER.debug("Unsealed data key for key id '{}'", keyId);
        return DestroyableRawSecretKey.takeOwnershipOf(dataKey, DATA_KEY_ALGORITHM);
    }

    @NonNull
    @Override
    public KmsInfo info() {
        return INFO;
    }

    private void checkMasterKeyAvailable() {
        if (masterKey.isDestroyed()) {
            throw new KmsException(MASTER_KEY_DESTROYED);
        }
    }

    private DestroyableRawSecretKey deriveSealingKey(String keyId, KmsContext context) {
        try {
            return KeyDerivation.deriveKey(masterKey, keyId, context);
        }
        catch (GeneralSecurityException e) {
            throw new KmsException("Unable to derive sealing key", e);
        }
        catch (IllegalStateException e) {
            // master key destroyed by a concurrent close
            throw new KmsException(MASTER_KEY_DESTROYED, e);
        }
    }

    private static void warnIfNotEscaped(String keyId, KmsContext context) {
        if (context.containsUnescapedJsonCharacters()) {
            LOGGER.warn("Context for key id '{}' contains '\"' or '\\' which are not escaped in its canonical encoding, so it may derive the same key as a different context",
                    keyId);
        }
    }
}
