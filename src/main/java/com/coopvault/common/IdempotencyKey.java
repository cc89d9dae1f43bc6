package com.coopvault.common;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Client-supplied keys that make a redemption submission safe to retry.
 *
 * A key is an opaque token of up to {@value #MAX_LENGTH} characters drawn from letters,
 * digits, '-', '_' and ':'. UUIDs qualify, as do wallet-scoped keys such as
 * {@code 0xabc:redeem:42}.
 */
public final class IdempotencyKey {

    public static final int MAX_LENGTH = 128;

    private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9_:\\-]+");

    private IdempotencyKey() {
    }

    public static String generate() {
        return UUID.randomUUID().toString();
    }

    public static boolean isValid(String key) {
        return key != null
            && !key.isEmpty()
            && key.length() <= MAX_LENGTH
            && ALLOWED.matcher(key).matches();
    }

    public static void validate(String key) {
        if (!isValid(key)) {
            throw new IllegalArgumentException("Invalid idempotency key: " + key);
        }
    }
}
