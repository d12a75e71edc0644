/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.kms.service;

/**
 * <p>Thrown when a KMS cannot guarantee the security of the keys it produces, for example because
 * the source of randomness has failed, or an encryption primitive did not behave as specified.</p>
 *
 * <p>This is an {@link Error}, not a {@link KmsException}: applications should not try to recover from it.
 * The KMS reports it to its {@link FatalFailureHandler} before throwing it.</p>
 */
public class FatalKmsError extends Error {

    public FatalKmsError(String message, Throwable cause) {
        super(message, cause);
    }

    public FatalKmsError(String message) {
        super(message);
    }
}
