/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.kms.provider.masterkey;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.junit.jupiter.api.Test;

import io.keyseal.kms.service.DestroyableRawSecretKey;
import io.keyseal.kms.service.KmsContext;

import static org.assertj.core.api.Assertions.assertThat;

class KeyDerivationTest {

    private static final byte[] MASTER_KEY_BYTES = new byte[32];
    private final DestroyableRawSecretKey masterKey = DestroyableRawSecretKey.takeCopyOf(MASTER_KEY_BYTES, KeyDerivation.ALGORITHM);

    @Test
    void derivesHmacOfKeyIdFollowedByCanonicalContext() throws Exception {
        var context = KmsContext.of("object", "o1", "bucket", "b1");

        var derived = KeyDerivation.deriveKey(masterKey, "default", context);

        var mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(MASTER_KEY_BYTES, "HmacSHA256"));
        var input = new ByteArrayOutputStream();
        input.writeBytes("default".getBytes(StandardCharsets.UTF_8));
        input.writeBytes("{\"bucket\":\"b1\",\"object\":\"o1\"}".getBytes(StandardCharsets.UTF_8));
        assertThat(derived.getEncoded()).isEqualTo(mac.doFinal(input.toByteArray()));
        assertThat(derived.numKeyBytes()).isEqualTo(KeyDerivation.DERIVED_KEY_LENGTH);
    }

    @Test
    void nullContextDerivesSameKeyAsEmptyContext() throws Exception {
        var fromNull = KeyDerivation.deriveKey(masterKey, "k", null);
        var fromEmpty = KeyDerivation.deriveKey(masterKey, "k", KmsContext.empty());
        assertThat(fromNull.getEncoded()).isEqualTo(fromEmpty.getEncoded());
    }

    @Test
    void derivationIsDeterministic() throws Exception {
        var context = KmsContext.of("a", "1");
        assertThat(KeyDerivation.deriveKey(masterKey, "k", context).getEncoded())
                .isEqualTo(KeyDerivation.deriveKey(masterKey, "k", context).getEncoded());
    }

    @Test
    void differentInputsDeriveDifferentKeys() throws Exception {
        var context = KmsContext.of("a", "1");
        var base = KeyDerivation.deriveKey(masterKey, "k", context).getEncoded();
        assertThat(KeyDerivation.deriveKey(masterKey, "k2", context).getEncoded()).isNotEqualTo(base);
        assertThat(KeyDerivation.deriveKey(masterKey, "k", KmsContext.of("a", "2")).getEncoded()).isNotEqualTo(base);
        var otherMaster = DestroyableRawSecretKey.takeCopyOf(new byte[]{ 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16,
                17, 18, 19, 20, 21, 22, 23, 24, 25, 26, 27, 28, 29, 30, 31, 32 }, KeyDerivation.ALGORITHM);
        assertThat(KeyDerivation.deriveKey(otherMaster, "k", context).getEncoded()).isNotEqualTo(base);
    }
}
