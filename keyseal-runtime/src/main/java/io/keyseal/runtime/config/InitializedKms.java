/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.runtime.config;

import java.util.Objects;

import io.keyseal.kms.service.Kms;
import io.keyseal.kms.service.KmsService;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A {@link Kms} together with the service that built it.
 * Closing this closes the service, after which the KMS must not be used.
 * @param kms The KMS.
 * @param service The service which built the KMS.
 */
public record InitializedKms(@NonNull Kms kms,
                             @NonNull KmsService<?> service)
        implements AutoCloseable {

    public InitializedKms {
        Objects.requireNonNull(kms);
        Objects.requireNonNull(service);
    }

    @Override
    public void close() {
        service.close();
    }
}
