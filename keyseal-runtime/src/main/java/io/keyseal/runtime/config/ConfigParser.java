/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.runtime.config;

import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.ConstructorDetector;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import io.keyseal.plugin.PluginConfigurationException;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Parses YAML KMS definitions, and converts their config to the types declared by plugins.
 */
public class ConfigParser implements PluginFactoryRegistry {

    private static final ObjectMapper MAPPER = createObjectMapper();
    private static final ServiceBasedPluginFactoryRegistry pluginFactoryRegistry = new ServiceBasedPluginFactoryRegistry();

    @Override
    public <T> PluginFactory<T> pluginFactory(Class<T> pluginClass) {
        return pluginFactoryRegistry.pluginFactory(pluginClass);
    }

    public KmsDefinition parseKmsDefinition(String definition) {
        try {
            return MAPPER.readValue(definition, KmsDefinition.class);
        }
        catch (IOException e) {
            throw new IllegalArgumentException("Couldn't parse KMS definition", e);
        }
    }

    public KmsDefinition parseKmsDefinition(InputStream definition) {
        try {
            return MAPPER.readValue(definition, KmsDefinition.class);
        }
        catch (IOException e) {
            throw new IllegalArgumentException("Couldn't parse KMS definition", e);
        }
    }

    public String toYaml(KmsDefinition definition) {
        try {
            return MAPPER.writeValueAsString(definition);
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode KMS definition as YAML", e);
        }
    }

    /**
     * Converts plugin configuration to the plugin's config type.
     * @param pluginName The name the plugin was referred to by.
     * @param config The configuration, possibly null.
     * @param configType The plugin's config type.
     * @return The typed configuration, or null if there was none.
     * @param <C> The config type.
     * @throws PluginConfigurationException If the configuration does not match the config type.
     */
    public <C> @Nullable C convertConfig(String pluginName, @Nullable JsonNode config, Class<C> configType) {
        if (config == null || config.isNull()) {
            return null;
        }
        try {
            return MAPPER.treeToValue(config, configType);
        }
        catch (JsonProcessingException e) {
            throw new PluginConfigurationException("Invalid configuration for plugin '" + pluginName + "': " + e.getOriginalMessage(), e);
        }
    }

    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper(new YAMLFactory())
                .registerModule(new ParameterNamesModule())
                .registerModule(new Jdk8Module())
                .setVisibility(PropertyAccessor.ALL, Visibility.NONE)
                .setVisibility(PropertyAccessor.FIELD, Visibility.ANY)
                .setVisibility(PropertyAccessor.CREATOR, Visibility.ANY)
                .setConstructorDetector(ConstructorDetector.USE_PROPERTIES_BASED)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }
}
