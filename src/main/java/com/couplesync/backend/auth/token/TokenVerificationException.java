package com.couplesync.backend.auth.token;

public class TokenVerificationException extends RuntimeException {

    public enum Failure { EXPIRED, INVALID_SIGNATURE, MALFORMED }

    private final Failure failure;

    public TokenVerificationException(Failure failure) {
        super("TOKEN_" + failure.name());
        this.failure = failure;
    }

    public Failure failure() { return failure; }

    public boolean isExpired() { return failure == Failure.EXPIRED; }
}
