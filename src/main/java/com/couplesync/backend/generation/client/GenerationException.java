package com.couplesync.backend.generation.client;

import com.couplesync.backend.common.error.DomainException;
import com.couplesync.backend.common.error.ErrorKind;

public class GenerationException extends DomainException {

    public GenerationException(String code) {
        super(ErrorKind.GENERATION_ERROR, code);
    }

    public GenerationException(String code, Throwable cause) {
        super(ErrorKind.GENERATION_ERROR, code, cause);
    }
}
