package com.work.l2ingestion.ingestion.chain;

import com.fasterxml.jackson.databind.JsonNode;
import org.web3j.protocol.core.Response;

/**
 * eth_getBlockByNumber 的原始响应。
 */
public class RawBlockResponse extends Response<JsonNode> {
}
