/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.kms.provider.masterkey;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;

import javax.crypto.Mac;

import io.keyseal.kms.service.DestroyableRawSecretKey;
import io.keyseal.kms.service.KmsContext;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Derives the key that seals a data key from the master key, the key id and the context.
 * The derived key is HMAC-SHA256, keyed by the master key, over the UTF-8 key id immediately
 * followed by the canonical encoding of the context.
 */
final class KeyDerivation {

    static final String ALGORITHM = "HmacSHA256";
    static final int DERIVED_KEY_LENGTH = 32;

    private KeyDerivation() {
    }

    static @NonNull DestroyableRawSecretKey deriveKey(@NonNull DestroyableRawSecretKey masterKey,
                                                      @NonNull String keyId,
                                                      @Nullable KmsContext context)
            throws GeneralSecurityException {
        Mac mac = Mac.getInstance(ALGORITHM);
        mac.init(masterKey);
        mac.update(keyId.getBytes(StandardCharsets.UTF_8));
        mac.update(KmsContext.orEmpty(context).toCanonicalBytes());
        return DestroyableRawSecretKey.takeOwnershipOf(mac.doFinal(), ALGORITHM);
    }
}
