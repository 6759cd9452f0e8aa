package com.example.scenegen_backend.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IdempotencyKeysTest {

    @Test
    void sameInputsGiveSameKey() {
        String a = IdempotencyKeys.compute("u1", "projA", "u1/projA/photos/a.jpg", "u1/projA/photos/b.jpg", "st-1", "dolly in");
        String b = IdempotencyKeys.compute("u1", "projA", "u1/projA/photos/a.jpg", "u1/projA/photos/b.jpg", "st-1", "dolly in");

        assertThat(a).isEqualTo(b).hasSize(64).matches("[0-9a-f]+");
    }

    @Test
    void anyFieldChangeGivesDifferentKey() {
        String base = IdempotencyKeys.compute("u1", "projA", "a.jpg", "b.jpg", "st-1", "dolly in");

        assertThat(IdempotencyKeys.compute("u2", "projA", "a.jpg", "b.jpg", "st-1", "dolly in")).isNotEqualTo(base);
        assertThat(IdempotencyKeys.compute("u1", "projB", "a.jpg", "b.jpg", "st-1", "dolly in")).isNotEqualTo(base);
        assertThat(IdempotencyKeys.compute("u1", "projA", "b.jpg", "a.jpg", "st-1", "dolly in")).isNotEqualTo(base);
        assertThat(IdempotencyKeys.compute("u1", "projA", "a.jpg", "b.jpg", "st-2", "dolly in")).isNotEqualTo(base);
        assertThat(IdempotencyKeys.compute("u1", "projA", "a.jpg", "b.jpg", "st-1", "dolly out")).isNotEqualTo(base);
    }

    @Test
    void absentEndKeyDiffersFromEmptyAndFieldsDoNotBleed() {
        String absent = IdempotencyKeys.compute("u1", "p", "a.jpg", null, "st", "x");
        String empty = IdempotencyKeys.compute("u1", "p", "a.jpg", "", "st", "x");
        assertThat(absent).isNotEqualTo(empty);

        String left = IdempotencyKeys.compute("u1", "p|q", "a", null, "st", "x");
        String right = IdempotencyKeys.compute("u1", "p", "q|a", null, "st", "x");
        assertThat(left).isNotEqualTo(right);
    }
}
