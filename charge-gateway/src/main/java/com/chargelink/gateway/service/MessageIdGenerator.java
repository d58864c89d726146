package com.chargelink.gateway.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide 16-bit message id sequence: 1..65535, wrapping back to 1. Zero is never issued.
 */
@Component
public class MessageIdGenerator {

    private static final int MAX_MESSAGE_ID = 0xFFFF;

    private final AtomicInteger current;

    public MessageIdGenerator() {
        this(0);
    }

    MessageIdGenerator(int start) {
        this.current = new AtomicInteger(start);
    }

    public int next() {
        return current.updateAndGet(id -> id >= MAX_MESSAGE_ID ? 1 : id + 1);
    }
}
