/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.runtime.config;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.keyseal.kms.service.KmsService;
import io.keyseal.plugin.PluginConfigurationException;
import io.keyseal.plugin.UnknownPluginInstanceException;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Creates initialized KMSs from {@link KmsDefinition}s.
 */
public class KmsFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(KmsFactory.class);

    private final ConfigParser configParser;

    public KmsFactory() {
        this(new ConfigParser());
    }

    public KmsFactory(@NonNull ConfigParser configParser) {
        this.configParser = Objects.requireNonNull(configParser);
    }

    /**
     * Resolves the service named by the definition, initializes it with the definition's config, and builds a KMS.
     * @param definition The definition.
     * @return The KMS and its service.
     * @throws UnknownPluginInstanceException If there is no service with the given name.
     * @throws PluginConfigurationException If the service's configuration is missing or invalid.
     */
    @SuppressWarnings({ "unchecked", "rawtypes" })
    public @NonNull InitializedKms create(@NonNull KmsDefinition definition) {
        Objects.requireNonNull(definition);
        PluginFactory<KmsService> pluginFactory = configParser.pluginFactory(KmsService.class);
        KmsService service = pluginFactory.pluginInstance(definition.type());
        Class<?> configType = pluginFactory.configType(definition.type());
        try {
            Object config = configParser.convertConfig(definition.type(), definition.config(), configType);
            service.initialize(config);
            var kms = service.buildKms();
            LOGGER.info("Created KMS '{}' with default key id '{}'", definition.type(), kms.defaultKeyId());
            return new InitializedKms(kms, service);
        }
        catch (RuntimeException e) {
            service.close();
            throw e;
        }
    }

    /**
     * Parses a YAML KMS definition, then {@linkplain #create(KmsDefinition) creates} the KMS.
     * @param yaml The YAML definition.
     * @return The KMS and its service.
     */
    public @NonNull InitializedKms create(@NonNull String yaml) {
        return create(configParser.parseKmsDefinition(yaml));
    }
}
