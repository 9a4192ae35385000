package com.work.l2ingestion.ingestion.chain;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.work.l2ingestion.core.exception.RpcException;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存版 sequencer 链，仅用于本地运行，真实部署请使用 Web3jBlockFetcher。
 *
 * 每次 currentHeight() 链高 +1；同一高度生成的区块内容固定，重放时与首次拉取完全一致。
 */
public class MockBlockFetcher implements BlockFetcher {

    private static final String SEQUENCER_TARGET = "0x4200000000000000000000000000000000000005";

    private final ObjectMapper objectMapper;
    private final long chainId;
    private final AtomicLong height;

    public MockBlockFetcher(ObjectMapper objectMapper, long chainId, long initialHeight) {
        this.objectMapper = objectMapper;
        this.chainId = chainId;
        this.height = new AtomicLong(initialHeight);
    }

    @Override
    public long currentHeight() {
        return height.getAndIncrement();
    }

    @Override
    public List<RawBlock> fetchRange(long start, long end) {
        long head = height.get();
        if (end > head) {
            throw new RpcException("block " + end + " is beyond mock head " + head);
        }
        List<RawBlock> blocks = new ArrayList<>();
        for (long n = start; n <= end; n++) {
            blocks.add(new RawBlock(buildBlock(n)));
        }
        return blocks;
    }

    private ObjectNode buildBlock(long number) {
        ObjectNode block = objectMapper.createObjectNode();
        block.put("number", RpcHex.toRpcHexString(number));
        block.put("hash", digest("block", number));
        block.put("timestamp", RpcHex.toRpcHexString(1_600_000_000L + number));
        block.put("stateRoot", digest("stateRoot", number));

        ObjectNode tx = objectMapper.createObjectNode();
        tx.put("hash", digest("tx", number));
        tx.put("blockNumber", RpcHex.toRpcHexString(number));
        tx.put("from", "0x" + digest("from", number).substring(26));
        tx.put("to", SEQUENCER_TARGET);
        tx.put("gas", RpcHex.toRpcHexString(21_000L));
        tx.put("gasPrice", RpcHex.toRpcHexString(15_000_000L));
        tx.put("nonce", RpcHex.toRpcHexString(number - 1));
        tx.put("value", "0x0");
        tx.put("input", "0x");
        tx.put("v", RpcHex.toRpcHexString(chainId * 2 + 35 + (number % 2)));
        tx.put("r", digest("r", number));
        tx.put("s", digest("s", number));
        tx.put("queueOrigin", "sequencer");
        tx.putNull("l1TxOrigin");
        tx.put("l1BlockNumber", RpcHex.toRpcHexString(number / 10));
        tx.put("l1Timestamp", RpcHex.toRpcHexString(1_600_000_000L + number));
        tx.put("index", RpcHex.toRpcHexString(number - 1));
        tx.putNull("queueIndex");

        ArrayNode txs = block.putArray("transactions");
        txs.add(tx);
        return block;
    }

    private static String digest(String label, long number) {
        byte[] seed = (label + ":" + number).getBytes(StandardCharsets.UTF_8);
        return Numeric.toHexStringWithPrefixZeroPadded(new BigInteger(1, Hash.sha3(seed)), 64);
    }
}
