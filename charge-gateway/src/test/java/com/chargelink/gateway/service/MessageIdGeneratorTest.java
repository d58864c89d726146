package com.chargelink.gateway.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class MessageIdGeneratorTest {

    @Test
    @DisplayName("Ids start at 1 and increase")
    void shouldStartAtOne() {
        MessageIdGenerator generator = new MessageIdGenerator();

        assertThat(generator.next()).isEqualTo(1);
        assertThat(generator.next()).isEqualTo(2);
    }

    @Test
    @DisplayName("The sequence wraps from 0xFFFF to 1, skipping 0")
    void shouldWrapWithoutZero() {
        MessageIdGenerator generator = new MessageIdGenerator(0xFFFE);

        assertThat(generator.next()).isEqualTo(0xFFFF);
        assertThat(generator.next()).isEqualTo(1);
    }

    @Test
    @DisplayName("Concurrent callers never receive the same id")
    void shouldIssueUniqueIdsConcurrently() {
        MessageIdGenerator generator = new MessageIdGenerator();
        Set<Integer> ids = ConcurrentHashMap.newKeySet();

        IntStream.range(0, 10_000).parallel().forEach(i -> ids.add(generator.next()));

        assertThat(ids).hasSize(10_000).doesNotContain(0);
    }
}
