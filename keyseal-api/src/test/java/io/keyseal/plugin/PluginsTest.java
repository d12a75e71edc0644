/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.plugin;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PluginsTest {

    @Test
    void shouldThrowIfRequiredConfigIsAbsent() {
        assertThatThrownBy(() -> Plugins.requireConfig(this, null))
                .isInstanceOf(PluginConfigurationException.class)
                .hasMessage("PluginsTest requires configuration, but config object is null");
    }

    @Test
    void shouldReturnPresentConfig() {
        var config = new Object();
        assertThat(Plugins.requireConfig(this, config)).isSameAs(config);
    }

    @Test
    void shouldThrowIfRequiredPropertyIsAbsent() {
        assertThatThrownBy(() -> Plugins.requireProperty(this, "keyId", null))
                .isInstanceOf(PluginConfigurationException.class)
                .hasMessage("PluginsTest requires 'keyId', but it is absent");
    }

    @Test
    void shouldReturnPresentProperty() {
        assertThat(Plugins.requireProperty(this, "keyId", "my-key")).isEqualTo("my-key");
    }

}
