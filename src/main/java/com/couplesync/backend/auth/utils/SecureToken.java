package com.couplesync.backend.auth.utils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;

public final class SecureToken {
    private static final SecureRandom SR = new SecureRandom();

    private SecureToken() {}

    public static String newTokenHex(int bytes) {
        byte[] buf = new byte[bytes];
        SR.nextBytes(buf);
        return HexFormat.of().formatHex(buf);
    }

    /** DB 只存 refresh token 的 sha256，不存原文 */
    public static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA256_UNAVAILABLE", e);
        }
    }
}
