package com.work.l2ingestion.ingestion.chain;

import com.fasterxml.jackson.databind.JsonNode;
import org.web3j.protocol.core.Response;

import java.util.List;

/**
 * eth_getBlockRange 的原始响应。
 */
public class RawBlockListResponse extends Response<List<JsonNode>> {
}
