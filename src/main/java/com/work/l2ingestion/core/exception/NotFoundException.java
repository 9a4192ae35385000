package com.work.l2ingestion.core.exception;

/**
 * key / cursor 不存在。调用方通常在本地兜底（例如同步游标默认从 1 开始）。
 */
public class NotFoundException extends IngestionException {

    public NotFoundException(String message) {
        super(message);
    }
}
