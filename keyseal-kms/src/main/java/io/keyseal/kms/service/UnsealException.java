/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.kms.service;

/**
 * Thrown when a sealed data key cannot be unsealed.
 * The message is deliberately the same whatever the reason, so that the exception
 * cannot be used to learn which of the key id, the context or the sealed key was wrong.
 */
public class UnsealException extends KmsException {

    static final String MESSAGE = "Unable to unseal data key: the key id, context or sealed key does not match";

    public UnsealException() {
        super(MESSAGE);
    }
}
