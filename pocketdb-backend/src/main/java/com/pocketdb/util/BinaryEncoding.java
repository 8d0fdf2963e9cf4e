package com.pocketdb.util;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;

/**
 * How binary column and field payloads are rendered as canonical strings.
 */
public enum BinaryEncoding {
    /** Lossy: invalid UTF-8 sequences become U+FFFD. */
    UTF8,
    BASE64;

    public String encode(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        if (this == BASE64) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Parse a configuration value.
     *
     * @param value {@code utf8}, {@code utf-8} or {@code base64}; blank means UTF8
     * @return encoding
     */
    public static BinaryEncoding fromName(String value) {
        if (value == null || value.isBlank()) {
            return UTF8;
        }
        String v = value.trim().toLowerCase(Locale.ROOT).replace("-", "");
        if ("base64".equals(v)) {
            return BASE64;
        }
        if ("utf8".equals(v)) {
            return UTF8;
        }
        throw new IllegalArgumentException("Unsupported binary encoding: " + value);
    }
}
