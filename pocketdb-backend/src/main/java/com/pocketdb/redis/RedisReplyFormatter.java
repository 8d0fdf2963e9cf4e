package com.pocketdb.redis;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a raw reply as the text a command-line client would show.
 */
final class RedisReplyFormatter {

    private RedisReplyFormatter() {
    }

    static String format(Object reply) {
        if (reply == null) {
            return "(nil)";
        }
        if (reply instanceof String text) {
            return text;
        }
        if (reply instanceof Long || reply instanceof Integer) {
            return reply.toString();
        }
        if (reply instanceof List<?> items) {
            return items.stream()
                    .map(RedisReplyFormatter::format)
                    .collect(Collectors.joining(", ", "[", "]"));
        }
        return "Debug(" + reply + ")";
    }
}
