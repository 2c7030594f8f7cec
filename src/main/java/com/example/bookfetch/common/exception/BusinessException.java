package com.example.bookfetch.common.exception;

public class BusinessException extends RuntimeException {

    private final String code;
    private final String userAction;

    public BusinessException(String code, String message) {
        this(code, message, null);
    }

    public BusinessException(String code, String message, String userAction) {
        super(message);
        this.code = code;
        this.userAction = userAction;
    }

    public static BusinessException notFound(String message) {
        return new BusinessException("404", message);
    }

    public static BusinessException conflict(String message, String userAction) {
        return new BusinessException("409", message, userAction);
    }

    public static BusinessException badRequest(String message) {
        return new BusinessException("400", message);
    }

    public String getCode() {
        return code;
    }

    public String getUserAction() {
        return userAction;
    }
}
