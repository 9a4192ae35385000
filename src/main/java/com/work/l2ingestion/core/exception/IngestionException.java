package com.work.l2ingestion.core.exception;

/**
 * 组件内部的统一异常类型，ingestion 循环在边界处统一捕获并按 ErrorPolicy 处理。
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
