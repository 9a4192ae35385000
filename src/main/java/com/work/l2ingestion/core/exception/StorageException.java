package com.work.l2ingestion.core.exception;

/**
 * 存储后端 I/O 失败。
 */
public class StorageException extends IngestionException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
