package com.eduhub.learning_backend.common.exception;

/**
 * 业务异常 / Business exception carrying an HTTP-aligned code.
 */
public class BizException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int code;

    public BizException(String message) {
        super(message);
        this.code = 400; // 默认400 - 业务错误
    }

    public BizException(int code, String message) {
        super(message);
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
