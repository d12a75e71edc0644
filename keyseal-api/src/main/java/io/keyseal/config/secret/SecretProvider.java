/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.config.secret;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A SecretProvider is an abstract source of a secret, such as a textual encoding of key material.
 * The concrete type is deduced from the properties present in configuration.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.DEDUCTION)
@JsonSubTypes({ @JsonSubTypes.Type(InlineSecret.class), @JsonSubTypes.Type(FileSecret.class) })
public interface SecretProvider {
    String getProvidedSecret();
}
