/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.kms.service;

/**
 * Represents a KMS under test, and the configuration needed to reach it.
 * @param <C> The config type
 */
public interface TestKmsFacade<C> extends AutoCloseable {

    /**
     * Returns true of this facade is available, or false otherwise.
     * @return true if available, false otherwise.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Starts the underlying KMS.
     */
    void start();

    /**
     * Stops the underlying KMS.
     */
    void stop();

    /**
     * Gets the service class used with the underlying KMS.
     *
     * @return service class
     */
    Class<? extends KmsService<C>> getKmsServiceClass();

    /**
     * Gets the configuration the service needs to use the underlying KMS.
     * @return service configuration.
     */
    C getKmsServiceConfig();

    /**
     * Returns a {@link Kms} for the underlying KMS.  This is an optional method.
     *
     * @return kms instance
     * @throws UnsupportedOperationException operation is not supported.
     */
    default Kms getKms() {
        throw new UnsupportedOperationException();
    }

    @Override
    default void close() {
        stop();
    }

}
