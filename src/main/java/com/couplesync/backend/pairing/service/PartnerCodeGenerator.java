package com.couplesync.backend.pairing.service;

import com.couplesync.backend.common.error.DomainException;
import com.couplesync.backend.common.error.ErrorKind;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Random;
import java.util.function.Predicate;

/**
 * 6 碼 A-Z0-9 邀請碼；撞碼就重抽，最多 10 次
 */
@Component
public class PartnerCodeGenerator {

    static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    static final int LENGTH = 6;
    static final int MAX_ATTEMPTS = 10;

    private final Random random;

    public PartnerCodeGenerator() {
        this(new SecureRandom());
    }

    PartnerCodeGenerator(Random random) {
        this.random = random;
    }

    public String generate(Predicate<String> isAvailable) {
        for (int i = 0; i < MAX_ATTEMPTS; i++) {
            String code = next();
            if (isAvailable.test(code)) return code;
        }
        throw new DomainException(ErrorKind.STORE_ERROR, "CODE_GENERATION_EXHAUSTED");
    }

    public static boolean isWellFormed(String code) {
        if (code == null || code.length() != LENGTH) return false;
        for (int i = 0; i < code.length(); i++) {
            if (ALPHABET.indexOf(code.charAt(i)) < 0) return false;
        }
        return true;
    }

    private String next() {
        char[] buf = new char[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            buf[i] = ALPHABET.charAt(random.nextInt(ALPHABET.length()));
        }
        return new String(buf);
    }
}
