package com.cosave.backend.auth.token.support;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Refresh secret 해시 유틸
 *
 * DB에는 secret 원문 대신 sha256 hex만 저장하고, 비교는
 *   incoming secret -> sha256Hex -> secret_hash 와 상수 시간 비교
 */
public final class TokenHashUtils {
    private TokenHashUtils() {}

    /** raw 문자열을 SHA-256 해시 후 소문자 hex(64 chars)로 반환 */
    public static String sha256Hex(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("raw secret must not be null/blank");
        }

        byte[] digest = sha256(raw.getBytes(StandardCharsets.UTF_8));
        return toHex(digest);
    }

    /** raw secret이 저장된 해시와 일치하는지 (타이밍 차이 없이) */
    public static boolean matches(String raw, String expectedHex) {
        if (raw == null || raw.isBlank() || expectedHex == null) return false;

        byte[] actual = sha256Hex(raw).getBytes(StandardCharsets.US_ASCII);
        byte[] expected = expectedHex.getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(actual, expected);
    }

    private static byte[] sha256(byte[] input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return md.digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String toHex(byte[] bytes) {
        char[] hex = new char[bytes.length * 2];
        final char[] digits = "0123456789abcdef".toCharArray();

        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            hex[i * 2] = digits[v >>> 4];
            hex[i * 2 + 1] = digits[v & 0x0F];
        }
        return new String(hex);
    }
}
