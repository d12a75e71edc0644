/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.kms.service;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A process-level handler for {@link FatalKmsError}s.
 * A KMS invokes its handler before throwing the error, giving the handler the opportunity to halt the process.
 */
@FunctionalInterface
public interface FatalFailureHandler {

    /**
     * Handles a fatal failure. Implementations may return normally, in which case the KMS throws the error.
     * @param error The error.
     */
    void onFatalFailure(@NonNull FatalKmsError error);

    /**
     * Creates a {@link FatalKmsError}, reports it to this handler, and returns it for the caller to throw.
     * @param message The error message.
     * @param cause The cause, if any.
     * @return The error.
     */
    default @NonNull FatalKmsError fatal(@NonNull String message, @Nullable Throwable cause) {
        var error = cause == null ? new FatalKmsError(message) : new FatalKmsError(message, cause);
        onFatalFailure(error);
        return error;
    }

    /**
     * @return A handler which logs the failure and returns.
     */
    static @NonNull FatalFailureHandler logging() {
        return LoggingFatalFailureHandler.INSTANCE;
    }

    /**
     * @param status The exit status.
     * @return A handler which logs the failure and then halts the JVM with the given status.
     */
    static @NonNull FatalFailureHandler halting(int status) {
        return new HaltingFatalFailureHandler(status, s -> Runtime.getRuntime().halt(s));
    }
}
