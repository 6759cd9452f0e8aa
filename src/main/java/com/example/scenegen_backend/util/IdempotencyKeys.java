package com.example.scenegen_backend.util;

/**
 * Deterministic digest of a logical generation request. Fields are length-prefixed so that no two
 * different field tuples serialize to the same string; an absent end key has its own marker.
 */
public final class IdempotencyKeys {
    private IdempotencyKeys() {
    }

    public static String compute(String ownerId,
                                 String projectId,
                                 String startKey,
                                 String endKey,
                                 String shotTypeId,
                                 String prompt) {
        StringBuilder sb = new StringBuilder("scene-gen:v1");
        append(sb, ownerId);
        append(sb, projectId);
        append(sb, startKey);
        append(sb, endKey);
        append(sb, shotTypeId);
        append(sb, prompt);
        return Hmacs.digestHex(sb.toString());
    }

    private static void append(StringBuilder sb, String value) {
        sb.append('|');
        if (value == null) {
            sb.append('~');
        } else {
            sb.append(value.length()).append(':').append(value);
        }
    }
}
