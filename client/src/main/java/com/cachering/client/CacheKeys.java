package com.cachering.client;

import com.google.common.base.Preconditions;

import java.nio.charset.StandardCharsets;

/**
 * Applies the key prefix and checks the result against the memcached key rules:
 * at most 250 bytes, no whitespace or control characters, ASCII unless unicode
 * keys are allowed.
 */
public final class CacheKeys {
    public static final int MAX_KEY_LENGTH = 250;

    private final String prefix;
    private final boolean allowUnicode;

    public CacheKeys(String prefix, boolean allowUnicode) {
        this.prefix = prefix == null ? "" : prefix;
        this.allowUnicode = allowUnicode;
    }

    /**
     * @return {@code prefix + key}
     * @throws IllegalArgumentException if the prefixed key is not a valid memcached key
     */
    public String toWireKey(String key) {
        Preconditions.checkArgument(key != null, "key must not be null");
        String full = prefix + key;
        Preconditions.checkArgument(!full.isEmpty(), "key must not be empty");

        for (int i = 0; i < full.length(); i++) {
            char c = full.charAt(i);
            if (c <= ' ' || c == 0x7f || Character.isWhitespace(c) || Character.isISOControl(c)) {
                throw new IllegalArgumentException("key contains whitespace or control characters: '" + full + "'");
            }
            if (c > 0x7f && !allowUnicode) {
                throw new IllegalArgumentException("non-ASCII key while unicode keys are disabled: '" + full + "'");
            }
        }

        int length = full.getBytes(StandardCharsets.UTF_8).length;
        if (length > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException("key is " + length + " bytes, limit is " + MAX_KEY_LENGTH);
        }
        return full;
    }
}
