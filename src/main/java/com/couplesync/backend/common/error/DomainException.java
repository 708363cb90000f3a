package com.couplesync.backend.common.error;

/**
 * 業務錯誤：message 即為穩定的錯誤碼（例如 PAIRING_NOT_FOUND）
 */
public class DomainException extends RuntimeException {

    private final ErrorKind kind;

    public DomainException(ErrorKind kind, String code) {
        super(code);
        this.kind = kind;
    }

    public DomainException(ErrorKind kind, String code, Throwable cause) {
        super(code, cause);
        this.kind = kind;
    }

    public ErrorKind kind() { return kind; }
    public String code() { return getMessage(); }

    public static DomainException notFound(String code) { return new DomainException(ErrorKind.NOT_FOUND, code); }
    public static DomainException forbidden(String code) { return new DomainException(ErrorKind.FORBIDDEN, code); }
    public static DomainException conflict(String code) { return new DomainException(ErrorKind.CONFLICT, code); }
    public static DomainException invalid(String code) { return new DomainException(ErrorKind.INVALID_INPUT, code); }
}
