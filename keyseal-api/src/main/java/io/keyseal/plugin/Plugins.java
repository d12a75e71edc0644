/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.plugin;

import edu.umd.cs.findbugs.annotations.Nullable;

public class Plugins {
    private Plugins() {
    }

    /**
     * Checks that the given {@code config} is not null, throwing {@link PluginConfigurationException} if it is.
     * @param pluginImpl The plugin consuming the config
     * @param config The possibly null config
     * @return The non-null config
     * @param <C> The type of the config
     */
    public static <C> C requireConfig(Object pluginImpl, @Nullable C config) {
        if (config == null) {
            throw new PluginConfigurationException(pluginImpl.getClass().getSimpleName() + " requires configuration, but config object is null");
        }
        return config;
    }

    /**
     * Checks that the given config {@code property} is not null, throwing {@link PluginConfigurationException} if it is.
     * @param pluginImpl The plugin consuming the config
     * @param propertyName The name of the property, as it appears in configuration
     * @param property The possibly null property value
     * @return The non-null property value
     * @param <T> The type of the property
     */
    public static <T> T requireProperty(Object pluginImpl, String propertyName, @Nullable T property) {
        if (property == null) {
            throw new PluginConfigurationException(pluginImpl.getClass().getSimpleName() + " requires '" + propertyName + "', but it is absent");
        }
        return property;
    }
}
