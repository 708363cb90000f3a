package com.couplesync.backend.common.crypto;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;

public final class HmacSha256 {

    private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();

    private HmacSha256() {}

    public static byte[] raw(String secret, String msg) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return mac.doFinal(msg.getBytes(StandardCharsets.UTF_8));
        } catch (Exception e) {
            throw new IllegalStateException("HMAC_SHA256_FAILED", e);
        }
    }

    /** token 簽章用：base64url（無 padding） */
    public static String base64Url(String secret, String msg) {
        return B64URL.encodeToString(raw(secret, msg));
    }

    /** 常數時間比較，避免 timing 洩漏 */
    public static boolean verifyBase64Url(String secret, String msg, String signature) {
        if (signature == null) return false;
        byte[] expected = base64Url(secret, msg).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = signature.getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }
}
