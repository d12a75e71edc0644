/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.runtime.config;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Names a {@link io.keyseal.kms.service.KmsService} implementation, and holds its (not yet typed) configuration.
 * <pre>
 * type: MasterKeyKmsService
 * config:
 *   keyId: my-key
 *   masterKey:
 *     secretFile: /etc/keyseal/master.key
 * </pre>
 * @param type The simple or fully qualified class name of the service.
 * @param config The configuration for the service, converted to the service's config type when the service is initialized.
 */
public record KmsDefinition(@JsonProperty(value = "type", required = true) String type,
                            @JsonProperty("config") @Nullable JsonNode config) {

    public KmsDefinition {
        Objects.requireNonNull(type);
    }
}
