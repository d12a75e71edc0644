/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.kms.service;

import java.util.Arrays;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * <p>A data key as both plaintext and sealed.</p>
 *
 * <p>The sealed key is safe to persist. The plaintext key should be {@linkplain DestroyableRawSecretKey#destroy() destroyed}
 * once it is no longer needed.</p>
 * @param dataKey The plaintext data key.
 * @param sealedKey The sealed data key.
 */
public record DataKeyPair(
                          @NonNull DestroyableRawSecretKey dataKey,
                          @NonNull byte[] sealedKey) {

    public DataKeyPair {
        Objects.requireNonNull(dataKey);
        Objects.requireNonNull(sealedKey);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DataKeyPair that = (DataKeyPair) o;
        return dataKey.equals(that.dataKey) && Arrays.equals(sealedKey, that.sealedKey);
    }

    @Override
    public int hashCode() {
        int result = dataKey.hashCode();
        result = 31 * result + Arrays.hashCode(sealedKey);
        return result;
    }

    @Override
    public String toString() {
        return "DataKeyPair[dataKey=*******, sealedKey=" + sealedKey.length + " bytes]";
    }
}
