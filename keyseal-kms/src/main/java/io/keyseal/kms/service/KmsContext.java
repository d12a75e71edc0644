/*
 * Copyright Keyseal Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.keyseal.kms.service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import javax.annotation.concurrent.Immutable;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>A set of key-value pairs that is cryptographically bound to a generated data key.
 * The same context must be presented again in order to unseal the key.</p>
 *
 * <p>A context has a canonical encoding, which is used as input to key derivation.
 * The encoding has the shape of a JSON object, {@code {"k1":"v1","k2":"v2"}}, with the keys in ascending
 * order of their UTF-8 bytes (compared as unsigned bytes) and no whitespace. The empty context
 * is encoded as {@code {}}.
 * Two contexts with the same entries always have byte-identical encodings, regardless of the
 * order in which the entries were supplied.</p>
 *
 * <p><strong>Note:</strong> neither keys nor values are escaped. A key or value containing {@code "} or
 * {@code \} results in an encoding that is not valid JSON, and which may coincide with the encoding of a
 * different context. See {@link #containsUnescapedJsonCharacters()}.</p>
 */
@Immutable
public final class KmsContext {

    private static final KmsContext EMPTY = new KmsContext(Map.of());

    private static final byte[] EMPTY_ENCODING = { '{', '}' };

    private static final Comparator<EncodedKey> UTF8_ORDER = (a, b) -> Arrays.compareUnsigned(a.utf8(), b.utf8());

    private final Map<String, String> entries;

    private KmsContext(Map<String, String> entries) {
        this.entries = entries;
    }

    /**
     * @return The context with no entries.
     */
    public static @NonNull KmsContext empty() {
        return EMPTY;
    }

    /**
     * Creates a context holding a copy of the given entries.
     * @param entries The entries.
     * @return The context.
     * @throws NullPointerException If the map, or any of its keys or values, is null.
     */
    public static @NonNull KmsContext of(@NonNull Map<String, String> entries) {
        Objects.requireNonNull(entries);
        if (entries.isEmpty()) {
            return EMPTY;
        }
        return new KmsContext(Map.copyOf(entries));
    }

    public static @NonNull KmsContext of(@NonNull String key, @NonNull String value) {
        return new KmsContext(Map.of(key, value));
    }

    public static @NonNull KmsContext of(@NonNull String k1, @NonNull String v1,
                                         @NonNull String k2, @NonNull String v2) {
        return new KmsContext(Map.of(k1, v1, k2, v2));
    }

    /**
     * @param context A possibly null context.
     * @return The given context, or the {@linkplain #empty() empty context} if it was null.
     */
    public static @NonNull KmsContext orEmpty(@Nullable KmsContext context) {
        return context == null ? EMPTY : context;
    }

    public static @NonNull Builder builder() {
        return new Builder();
    }

    /**
     * @return An unmodifiable view of the entries in this context, in no particular order.
     */
    public @NonNull Map<String, String> asMap() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * @return true if any key or value contains a character ({@code "} or {@code \}) which JSON would require to be escaped.
     */
    public boolean containsUnescapedJsonCharacters() {
        for (var entry : entries.entrySet()) {
            if (needsEscaping(entry.getKey()) || needsEscaping(entry.getValue())) {
                return true;
            }
        }
        return false;
    }

    private static boolean needsEscaping(String s) {
        return s.indexOf('"') >= 0 || s.indexOf('\\') >= 0;
    }

    /**
     * Appends the canonical encoding of this context to the given buffer.
     * @param dst The buffer to append to.
     */
    public void appendTo(@NonNull ByteArrayOutputStream dst) {
        dst.writeBytes(toCanonicalBytes());
    }

    /**
     * Writes the canonical encoding of this context to the given stream.
     * @param out The stream to write to.
     * @return The number of bytes written.
     * @throws IOException If the stream could not be written to.
     */
    public long writeTo(@NonNull OutputStream out) throws IOException {
        byte[] encoded = toCanonicalBytes();
        out.write(encoded);
        return encoded.length;
    }

    /**
     * @return A new array holding the canonical encoding of this context.
     */
    public @NonNull byte[] toCanonicalBytes() {
        if (entries.isEmpty()) {
            return EMPTY_ENCODING.clone();
        }
        if (entries.size() == 1) {
            // nothing to sort
            var entry = entries.entrySet().iterator().next();
            var out = new ByteArrayOutputStream(6 + entry.getKey().length() + entry.getValue().length());
            out.write('{');
            writeEntry(out, entry.getKey().getBytes(StandardCharsets.UTF_8), entry.getValue());
            out.write('}');
            return out.toByteArray();
        }

        List<EncodedKey> sortedKeys = new ArrayList<>(entries.size());
        int estimatedSize = 2;
        for (var entry : entries.entrySet()) {
            sortedKeys.add(new EncodedKey(entry.getKey(), entry.getKey().getBytes(StandardCharsets.UTF_8)));
            estimatedSize += 6 + entry.getKey().length() + entry.getValue().length();
        }
        sortedKeys.sort(UTF8_ORDER);

        var out = new ByteArrayOutputStream(estimatedSize);
        out.write('{');
        for (int i = 0; i < sortedKeys.size(); i++) {
            if (i > 0) {
                out.write(',');
            }
            EncodedKey key = sortedKeys.get(i);
            writeEntry(out, key.utf8(), entries.get(key.text()));
        }
        out.write('}');
        return out.toByteArray();
    }

    /**
     * @return The canonical encoding of this context, as a string.
     */
    public @NonNull String toCanonicalString() {
        return new String(toCanonicalBytes(), StandardCharsets.UTF_8);
    }

    private static void writeEntry(ByteArrayOutputStream out, byte[] key, String value) {
        out.write('"');
        out.writeBytes(key);
        out.write('"');
        out.write(':');
        out.write('"');
        out.writeBytes(value.getBytes(StandardCharsets.UTF_8));
        out.write('"');
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        KmsContext that = (KmsContext) o;
        return entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "KmsContext" + toCanonicalString();
    }

    private record EncodedKey(String text, byte[] utf8) {}

    /**
     * Builds a {@link KmsContext} an entry at a time.
     */
    public static final class Builder {
        private final Map<String, String> entries = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Adds an entry.
         * @param key The key.
         * @param value The value.
         * @return This builder.
         * @throws NullPointerException If the key or value is null.
         * @throws IllegalArgumentException If the key has already been added.
         */
        public @NonNull Builder put(@NonNull String key, @NonNull String value) {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
            if (entries.putIfAbsent(key, value) != null) {
                throw new IllegalArgumentException("Duplicate context key '" + key + "'");
            }
            return this;
        }

        public @NonNull KmsContext build() {
            if (entries.isEmpty()) {
                return EMPTY;
            }
            return new KmsContext(Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
        }
    }
}
