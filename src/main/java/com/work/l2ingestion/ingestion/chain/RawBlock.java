package com.work.l2ingestion.ingestion.chain;

import com.fasterxml.jackson.databind.JsonNode;
import com.work.l2ingestion.core.exception.RpcException;
import org.web3j.utils.Numeric;

import java.util.Comparator;
import java.util.Objects;

/**
 * 节点返回的原始区块（JSON 树）。保留 rollup 特有的交易字段（queueOrigin、l1TxOrigin 等），
 * web3j 自带的 EthBlock 模型会丢弃这些字段。
 */
public final class RawBlock {

    /**
     * 按区块自身 number 升序，fan-in 阶段唯一使用的排序规则。
     */
    public static final Comparator<RawBlock> BY_NUMBER = Comparator.comparingLong(RawBlock::getNumber);

    private final JsonNode node;
    private final long number;

    public RawBlock(JsonNode node) {
        this.node = Objects.requireNonNull(node, "node");
        this.number = parseNumber(node);
    }

    public JsonNode getNode() {
        return node;
    }

    public long getNumber() {
        return number;
    }

    private static long parseNumber(JsonNode node) {
        JsonNode numberNode = node.get("number");
        if (numberNode == null || !numberNode.isTextual()) {
            throw new RpcException("malformed block: missing number");
        }
        try {
            return Numeric.decodeQuantity(numberNode.asText()).longValueExact();
        } catch (RuntimeException e) {
            throw new RpcException("malformed block number: " + numberNode.asText(), e);
        }
    }

    @Override
    public String toString() {
        return "RawBlock{number=" + number + "}";
    }
}
