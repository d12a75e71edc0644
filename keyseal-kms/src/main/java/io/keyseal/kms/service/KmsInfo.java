/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.kms.service;

import java.util.List;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Descriptive information about a KMS. None of it is secret.
 * @param endpoints The endpoints the KMS is reached at, empty for a KMS which runs in-process.
 * @param name A name for the KMS, possibly empty.
 * @param authType How the KMS authenticates.
 */
public record KmsInfo(@NonNull List<String> endpoints,
                      @NonNull String name,
                      @NonNull String authType) {

    public KmsInfo {
        endpoints = List.copyOf(endpoints);
        Objects.requireNonNull(name);
        Objects.requireNonNull(authType);
    }
}
