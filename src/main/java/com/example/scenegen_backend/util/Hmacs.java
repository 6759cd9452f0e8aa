package com.example.scenegen_backend.util;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

public final class Hmacs {
    private static final String HMAC_SHA256 = "HmacSHA256";

    private Hmacs() {
    }

    public static byte[] sha256(String secret, byte[] body) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            return mac.doFinal(body);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    public static String sha256Hex(String secret, String value) {
        return HexFormat.of().formatHex(sha256(secret, value.getBytes(StandardCharsets.UTF_8)));
    }

    public static String digestHex(String value) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    /** Compares two hex strings without short-circuiting on the first differing byte. */
    public static boolean constantTimeEquals(String expectedHex, String providedHex) {
        if (expectedHex == null || providedHex == null) return false;
        return MessageDigest.isEqual(
                expectedHex.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII),
                providedHex.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII));
    }
}
