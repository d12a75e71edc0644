/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.kms.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class LoggingFatalFailureHandler implements FatalFailureHandler {

    static final LoggingFatalFailureHandler INSTANCE = new LoggingFatalFailureHandler();

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingFatalFailureHandler.class);

    private LoggingFatalFailureHandler() {
    }

    @Override
    public void onFatalFailure(FatalKmsError error) {
        LOGGER.error("Fatal KMS failure: {}", error.getMessage(), error);
    }
}
