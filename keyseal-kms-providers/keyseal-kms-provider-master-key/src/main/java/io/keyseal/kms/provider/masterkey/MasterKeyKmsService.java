/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.kms.provider.masterkey;

import java.security.SecureRandom;
import java.util.Objects;

import javax.annotation.concurrent.ThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.keyseal.config.secret.SecretProvider;
import io.keyseal.kms.service.DestroyableRawSecretKey;
import io.keyseal.kms.service.FatalFailureHandler;
import io.keyseal.kms.service.KmsService;
import io.keyseal.plugin.Plugin;
import io.keyseal.plugin.PluginConfigurationException;
import io.keyseal.plugin.Plugins;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The service for {@link MasterKeyKms}.
 * The master key is read when the service is initialized, and destroyed when it is closed.
 * All KMSs built by the same service share the master key.
 */
@Plugin(configType = MasterKeyKmsService.Config.class)
@ThreadSafe
public class MasterKeyKmsService implements KmsService<MasterKeyKmsService.Config> {

    private static final Logger LOGGER = LoggerFactory.getLogger(MasterKeyKmsService.class);

    /**
     * What to do when the KMS cannot guarantee the security of a generated key.
     */
    public enum FatalFailureMode {
        /** Log, then halt the JVM. */
        HALT,
        /** Log, then throw {@link io.keyseal.kms.service.FatalKmsError} to the caller. */
        THROW
    }

    /**
     * Configuration for the master key KMS.
     * @param keyId The id of the master key.
     * @param masterKey The master key, as 64 hexadecimal digits.
     * @param cipherSuite The cipher used to seal data keys, defaulting to AES-256-GCM.
     * @param onFatalFailure What to do on fatal failure, defaulting to halting the JVM.
     */
    public record Config(@JsonProperty(value = "keyId", required = true) String keyId,
                         @JsonProperty(value = "masterKey", required = true) SecretProvider masterKey,
                         @JsonProperty("cipherSuite") @Nullable CipherSuite cipherSuite,
                         @JsonProperty("onFatalFailure") @Nullable FatalFailureMode onFatalFailure) {

        @JsonCreator
        public Config {
            cipherSuite = cipherSuite == null ? CipherSuite.AES_256_GCM : cipherSuite;
            onFatalFailure = onFatalFailure == null ? FatalFailureMode.HALT : onFatalFailure;
        }

        public Config(String keyId, SecretProvider masterKey) {
            this(keyId, masterKey, null, null);
        }
    }

    private Config config;
    private DestroyableRawSecretKey masterKey;
    private SecureRandom random;
    private boolean closed = false;

    @Override
    public synchronized void initialize(@NonNull Config config) {
        if (this.config != null) {
            throw new IllegalStateException("KMS service is already initialized");
        }
        Plugins.requireConfig(this, config);
        String keyId = Plugins.requireProperty(this, "keyId", config.keyId());
        if (keyId.isBlank()) {
            throw new PluginConfigurationException("MasterKeyKmsService requires a non-blank 'keyId'");
        }
        SecretProvider secret = Plugins.requireProperty(this, "masterKey", config.masterKey());
        try {
            this.masterKey = MasterKeySpec.parseKey(secret.getProvidedSecret());
        }
        catch (IllegalArgumentException e) {
            throw new PluginConfigurationException("Invalid 'masterKey' for key id '" + keyId + "': " + e.getMessage());
        }
        this.random = new SecureRandom();
        this.config = config;
        LOGGER.info("Initialized master key KMS with key id '{}', sealing with {}, {} on fatal failure",
                keyId, config.cipherSuite(), config.onFatalFailure());
    }

    @NonNull
    @Override
    public synchronized MasterKeyKms buildKms() {
        if (closed) {
            throw new IllegalStateException("KMS service is closed");
        }
        if (config == null) {
            throw new IllegalStateException("KMS service not initialized");
        }
        return new MasterKeyKms(config.keyId(), masterKey, config.cipherSuite(), random, fatalFailureHandler(config.onFatalFailure()));
    }

    private static FatalFailureHandler fatalFailureHandler(FatalFailureMode mode) {
        Objects.requireNonNull(mode);
        return switch (mode) {
            case HALT -> FatalFailureHandler.halting(MasterKeyKms.FATAL_EXIT_STATUS);
            case THROW -> FatalFailureHandler.logging();
        };
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (masterKey != null) {
            masterKey.destroy();
        }
    }
}
