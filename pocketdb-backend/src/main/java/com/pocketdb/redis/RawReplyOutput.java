package com.pocketdb.redis;

import io.lettuce.core.codec.StringCodec;
import io.lettuce.core.output.CommandOutput;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Collects a reply of any shape into plain Java values: {@code null}, {@link Long}, {@link Double},
 * {@link Boolean}, {@link String} (bulk and status replies, decoded as UTF-8 with replacement) and
 * nested {@link List}s for arrays.
 */
class RawReplyOutput extends CommandOutput<String, String, Object> {
    private final Deque<Frame> frames = new ArrayDeque<>();

    RawReplyOutput() {
        super(StringCodec.UTF8, null);
    }

    @Override
    public void set(ByteBuffer bytes) {
        append(bytes == null ? null : StandardCharsets.UTF_8.decode(bytes).toString());
    }

    @Override
    public void set(long integer) {
        append(integer);
    }

    @Override
    public void set(double number) {
        append(number);
    }

    @Override
    public void set(boolean value) {
        append(value);
    }

    @Override
    public void multi(int count) {
        if (count < 0) {
            append(null);
            return;
        }
        List<Object> items = new ArrayList<>(count);
        attach(items);
        frames.push(new Frame(items, count));
        popCompleted();
    }

    private void append(Object value) {
        attach(value);
        popCompleted();
    }

    private void attach(Object value) {
        Frame top = frames.peek();
        if (top == null) {
            output = value;
            return;
        }
        top.items.add(value);
        top.remaining--;
    }

    private void popCompleted() {
        while (!frames.isEmpty() && frames.peek().remaining <= 0) {
            frames.pop();
        }
    }

    private static final class Frame {
        private final List<Object> items;
        private int remaining;

        private Frame(List<Object> items, int remaining) {
            this.items = items;
            this.remaining = remaining;
        }
    }
}
