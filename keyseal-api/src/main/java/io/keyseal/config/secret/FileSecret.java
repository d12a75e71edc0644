/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.config.secret;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A reference to the file containing a nonempty plain text secret in UTF-8 encoding.  If the file
 * contains more than one line, only the characters of the first line are taken to be the secret,
 * excluding the line ending.  Subsequent lines are ignored.
 * Leading and trailing whitespace on that line is removed.
 *
 * @param secretFile file containing the secret.
 */
public record FileSecret(@JsonProperty(value = "secretFile", required = true) String secretFile) implements SecretProvider {

    public FileSecret {
        Objects.requireNonNull(secretFile);
    }

    @Override
    public String getProvidedSecret() {
        return readSecretFile(secretFile);
    }

    @Override
    public String toString() {
        return "FileSecret[" +
                "secretFile=" + secretFile + ']';
    }

    static String readSecretFile(String secretFile) {
        try (var fr = new BufferedReader(new FileReader(secretFile, StandardCharsets.UTF_8))) {
            String line = fr.readLine();
            if (line == null || line.isBlank()) {
                throw new IOException("Empty file");
            }
            return line.strip();
        }
        catch (IOException e) {
            throw new UncheckedIOException("Exception reading " + secretFile, e);
        }
    }

}
