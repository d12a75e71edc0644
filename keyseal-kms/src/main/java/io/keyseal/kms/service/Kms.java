/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.kms.service;

import javax.annotation.concurrent.ThreadSafe;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>An active connection to a Key Management System (KMS), supporting the generation of data keys
 * and the unsealing of previously generated data keys.</p>
 *
 * <p>The {@link KmsContext} given when a key is generated is cryptographically bound to the sealed key.
 * The same key id and context must be presented in order to unseal it.</p>
 *
 * <p>Implementations must be safe for concurrent use.</p>
 */
@ThreadSafe
public interface Kms {

    /**
     * Returns the id of the master key to use when a caller requests KMS based encryption
     * without specifying a key id explicitly.
     *
     * @return The default key id.
     */
    @NonNull
    String defaultKeyId();

    /**
     * Creates a new master key with the given id at the KMS.
     *
     * @param keyId The id of the key to create.
     * @throws UnsupportedKmsOperationException If this KMS does not support the creation of keys.
     * @throws KmsException For other exceptions.
     */
    void createKey(@NonNull String keyId);

    /**
     * Generates a new random data key and seals it using the master key given by the {@code keyId}.
     * The returned sealed key can later be unsealed with {@link #unsealKey(String, byte[], KmsContext)},
     * given the same key id and context.
     *
     * <p><strong>Note:</strong> The caller owns the returned plaintext key and should
     * {@linkplain DestroyableRawSecretKey#destroy() destroy} it once it is no longer needed.</p>
     *
     * @param keyId The master key used to seal the generated data key.
     * @param context The context to bind to the generated key. A null context is treated as the empty context.
     * @return The plaintext and sealed data key.
     * @throws KmsException If the key could not be generated.
     * @throws FatalKmsError If the KMS is unable to produce a key that meets its security guarantees.
     */
    @NonNull
    DataKeyPair generateKey(@NonNull String keyId,
                            @Nullable KmsContext context);

    /**
     * Unseals a data key that was {@linkplain #generateKey(String, KmsContext) previously generated}.
     *
     * @param keyId The master key that was used to seal the key.
     * @param sealedKey The sealed data key.
     * @param context The context that was given when the key was generated. A null context is treated as the empty context.
     * @return The plaintext data key.
     * @throws UnsealException If the key could not be unsealed, for example because the key id or context differ from those used
     * when the key was generated, or because the sealed key has been corrupted.
     * @throws KmsException For other exceptions.
     */
    @NonNull
    DestroyableRawSecretKey unsealKey(@NonNull String keyId,
                                      @NonNull byte[] sealedKey,
                                      @Nullable KmsContext context);

    /**
     * @return Descriptive, non-secret information about this KMS.
     */
    @NonNull
    KmsInfo info();
}
