/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.plugin;

/**
 * A reference to a plugin instance, by name, could not be resolved to a plugin implementation.
 */
public class UnknownPluginInstanceException extends RuntimeException {

    public UnknownPluginInstanceException(String message) {
        super(message);
    }
}
