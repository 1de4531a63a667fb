package com.makerhedge.exception;

public class SigningException extends BaseException {

    public SigningException(String message, Throwable cause) {
        super(ErrorCode.SIGNING_ERROR, message, cause);
    }
}
