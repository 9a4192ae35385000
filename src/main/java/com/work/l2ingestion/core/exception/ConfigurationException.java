package com.work.l2ingestion.core.exception;

/**
 * 启动参数非法，仅在构造 IngestionSettings 时抛出一次。
 */
public class ConfigurationException extends IngestionException {

    public ConfigurationException(String message) {
        super(message);
    }
}
