/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.kms.service;

import javax.annotation.concurrent.ThreadSafe;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Service interface for KMSs
 * @param <C> The config type
 */
@ThreadSafe
public interface KmsService<C> extends AutoCloseable {

    /**
     * Initialises the service.  This method must be invoked exactly once
     * before {@link #buildKms()} is called.
     *
     * @param config KMS service configuration
     */
    void initialize(C config);

    /**
     * Builds a KMS.
     * {@link #initialize(Object)} must have been called before this method is invoked.
     *
     * @return the KMS.
     * @throws IllegalStateException if the KMS Service has not been initialised or the KMS service is closed.
     */
    @NonNull
    Kms buildKms() throws IllegalStateException;

    /**
     * Closes the service, releasing any key material it holds. Once the service is closed,
     * {@link #buildKms()} throws {@link IllegalStateException}, and operations on previously built
     * {@link Kms}s that need that key material throw {@link KmsException}. Such a failure is never
     * reported as a {@link FatalKmsError}.
     * <br/>
     * Implementations of this method must be idempotent.
     * <br/>
     * Close implementations must tolerate the closing of service that has not been initialized or
     * one for which initialization did not fully complete without further exception.
     */
    @Override
    default void close() {
    }
}
