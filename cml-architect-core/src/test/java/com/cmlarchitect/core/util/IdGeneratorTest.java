package com.cmlarchitect.core.util;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link IdGenerator}.
 */
class IdGeneratorTest {

    @Test
    void newId_returnsUuid() {
        String id = IdGenerator.newId();

        assertThatCode(() -> UUID.fromString(id)).doesNotThrowAnyException();
    }

    @Test
    void newId_repeatedCalls_returnDistinctIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(IdGenerator.newId());
        }

        assertThat(ids).hasSize(1000);
    }
}
