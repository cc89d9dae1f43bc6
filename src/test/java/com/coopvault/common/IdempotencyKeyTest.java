package com.coopvault.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IdempotencyKeyTest {

    @Test
    void testGeneratedKeysAreValidAndDistinct() {
        String first = IdempotencyKey.generate();
        String second = IdempotencyKey.generate();

        assertTrue(IdempotencyKey.isValid(first));
        assertNotEquals(first, second);
    }

    @Test
    void testWalletScopedKeyIsAccepted() {
        assertDoesNotThrow(() -> IdempotencyKey.validate("0xabc123:redeem:42"));
    }

    @Test
    void testMalformedKeysAreRejected() {
        assertFalse(IdempotencyKey.isValid(null));
        assertFalse(IdempotencyKey.isValid(""));
        assertFalse(IdempotencyKey.isValid("has space"));
        assertFalse(IdempotencyKey.isValid("x".repeat(IdempotencyKey.MAX_LENGTH + 1)));
        assertTrue(IdempotencyKey.isValid("x".repeat(IdempotencyKey.MAX_LENGTH)));

        assertThrows(IllegalArgumentException.class, () -> IdempotencyKey.validate("bad/key"));
    }
}
