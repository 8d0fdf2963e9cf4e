package com.pocketdb.redis;

import io.lettuce.core.protocol.ProtocolKeyword;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Command keyword typed by the user rather than taken from Lettuce's command table.
 */
final class RawCommandType implements ProtocolKeyword {
    private final String name;
    private final byte[] bytes;

    RawCommandType(String name) {
        this.name = name.toUpperCase(Locale.ROOT);
        this.bytes = this.name.getBytes(StandardCharsets.US_ASCII);
    }

    @Override
    public byte[] getBytes() {
        return bytes;
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
