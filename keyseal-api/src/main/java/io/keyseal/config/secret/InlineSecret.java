/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.config.secret;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A secret expressed directly in the model, in plain text.
 * <strong>Not recommended for production use.</strong>
 * @param secret the secret
 */
public record InlineSecret(@JsonProperty(value = "secret", required = true) String secret) implements SecretProvider {

    public InlineSecret {
        Objects.requireNonNull(secret);
    }

    @Override
    public String getProvidedSecret() {
        return secret;
    }

    @Override
    public String toString() {
        return "InlineSecret[secret=*******]";
    }

}
