/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.runtime.config;

import java.io.IOException;

import org.junit.jupiter.api.Test;

import io.keyseal.config.secret.InlineSecret;
import io.keyseal.kms.provider.masterkey.CipherSuite;
import io.keyseal.kms.provider.masterkey.MasterKeyKmsService;
import io.keyseal.plugin.PluginConfigurationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigParserTest {

    private final ConfigParser configParser = new ConfigParser();

    @Test
    void parsesDefinitionFromStream() throws IOException {
        try (var in = ConfigParserTest.class.getResourceAsStream("/master-key-kms.yaml")) {
            var definition = configParser.parseKmsDefinition(in);

            assertThat(definition.type()).isEqualTo("MasterKeyKmsService");
            assertThat(definition.config().get("keyId").asText()).isEqualTo("my-app-key");
        }
    }

    @Test
    void convertsConfigToPluginConfigType() {
        var definition = configParser.parseKmsDefinition("""
                type: MasterKeyKmsService
                config:
                  keyId: my-key
                  masterKey:
                    secret: abc
                """);

        var config = configParser.convertConfig(definition.type(), definition.config(), MasterKeyKmsService.Config.class);

        assertThat(config.keyId()).isEqualTo("my-key");
        assertThat(config.masterKey()).isEqualTo(new InlineSecret("abc"));
        assertThat(config.cipherSuite()).isEqualTo(CipherSuite.AES_256_GCM);
        assertThat(config.onFatalFailure()).isEqualTo(MasterKeyKmsService.FatalFailureMode.HALT);
    }

    @Test
    void absentConfigConvertsToNull() {
        var definition = configParser.parseKmsDefinition("type: MasterKeyKmsService");
        assertThat(configParser.convertConfig(definition.type(), definition.config(), MasterKeyKmsService.Config.class)).isNull();
    }

    @Test
    void unknownConfigPropertyIsRejected() {
        var definition = configParser.parseKmsDefinition("""
                type: MasterKeyKmsService
                config:
                  keyId: my-key
                  masterKey:
                    secret: abc
                  rotation: daily
                """);
        var config = definition.config();

        assertThatThrownBy(() -> configParser.convertConfig("MasterKeyKmsService", config, MasterKeyKmsService.Config.class))
                .isInstanceOf(PluginConfigurationException.class)
                .hasMessageContaining("MasterKeyKmsService")
                .hasMessageContaining("rotation");
    }

    @Test
    void unknownTopLevelPropertyIsRejected() {
        assertThatThrownBy(() -> configParser.parseKmsDefinition("""
                type: MasterKeyKmsService
                kind: other
                """))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Couldn't parse KMS definition");
    }

    @Test
    void duplicateKeysAreRejected() {
        assertThatThrownBy(() -> configParser.parseKmsDefinition("""
                type: MasterKeyKmsService
                type: FailingKmsService
                """))
                .isInstanceOf(IllegalArgumentException.class)
                .cause()
                .hasMessageContaining("Duplicate field 'type'");
    }

    @Test
    void missingTypeIsRejected() {
        assertThatThrownBy(() -> configParser.parseKmsDefinition("config: {}"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toYamlIncludesTypeAndConfig() {
        var definition = configParser.parseKmsDefinition("""
                type: FailingKmsService
                config:
                  reason: testing
                """);

        var yaml = configParser.toYaml(definition);

        assertThat(configParser.parseKmsDefinition(yaml)).isEqualTo(definition);
    }
}
