/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.kms.service;

import java.util.function.IntConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the failure, then halts the JVM without running shutdown hooks,
 * so that no further work is done in an inconsistent security state.
 */
class HaltingFatalFailureHandler implements FatalFailureHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(HaltingFatalFailureHandler.class);

    private final int status;
    private final IntConsumer halt;

    HaltingFatalFailureHandler(int status, IntConsumer halt) {
        this.status = status;
        this.halt = halt;
    }

    @Override
    public void onFatalFailure(FatalKmsError error) {
        LOGGER.error("Fatal KMS failure, halting with status {}: {}", status, error.getMessage(), error);
        halt.accept(status);
    }
}
