package com.work.l2ingestion.core.exception;

/**
 * 区块 / 交易载荷格式错误，无法转换为领域记录。
 */
public class DecodeException extends IngestionException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
