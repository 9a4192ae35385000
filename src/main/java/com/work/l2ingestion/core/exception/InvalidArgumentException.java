package com.work.l2ingestion.core.exception;

/**
 * 非法的写入请求（空批次、index 非严格递增、index 越界等），属于编程错误。
 */
public class InvalidArgumentException extends IngestionException {

    public InvalidArgumentException(String message) {
        super(message);
    }
}
