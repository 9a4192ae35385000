package com.work.l2ingestion.core.exception;

/**
 * 远端节点调用失败：传输错误、超时、JSON-RPC error 或无法解析的响应。
 */
public class RpcException extends IngestionException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
