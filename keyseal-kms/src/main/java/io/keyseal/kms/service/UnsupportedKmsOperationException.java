/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.kms.service;

/**
 * Thrown when a KMS is asked to perform an operation which it does not support.
 * E.g. when a KMS with a single, externally supplied, master key is asked to create a key.
 */
public class UnsupportedKmsOperationException extends KmsException {

    public UnsupportedKmsOperationException(String message) {
        super(message);
    }
}
