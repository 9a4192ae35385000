package com.work.l2ingestion.ingestion.chain;

import com.fasterxml.jackson.databind.JsonNode;
import com.work.l2ingestion.core.exception.RpcException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.Web3jService;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthBlockNumber;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * 基于 Web3j 的区块拉取实现：
 * - 查询最新区块号 eth_blockNumber
 * - BULK 模式：eth_getBlockRange(start, end, true)
 * - COMPATIBILITY 模式：并行 eth_getBlockByNumber(n, true)，经 {@link OrderedBlockCollector} 排序
 *
 * 说明：
 * 区块以 JsonNode 原样返回，字段解析交给 decoder。
 */
public class Web3jBlockFetcher implements BlockFetcher {

    private static final Logger log = LoggerFactory.getLogger(Web3jBlockFetcher.class);

    private final Web3jService web3jService;
    private final Web3j web3j;
    private final FetchStrategy strategy;
    private final ExecutorService fanOutExecutor;

    public Web3jBlockFetcher(Web3jService web3jService, FetchStrategy strategy, ExecutorService fanOutExecutor) {
        this.web3jService = Objects.requireNonNull(web3jService, "web3jService");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.fanOutExecutor = Objects.requireNonNull(fanOutExecutor, "fanOutExecutor");
        this.web3j = Web3j.build(web3jService);
    }

    @Override
    public long currentHeight() {
        try {
            EthBlockNumber resp = web3j.ethBlockNumber().send();
            checkResponse(resp, "eth_blockNumber");
            return resp.getBlockNumber().longValueExact();
        } catch (IOException e) {
            throw new RpcException("eth_blockNumber failed: " + e.getMessage(), e);
        } catch (ArithmeticException e) {
            throw new RpcException("eth_blockNumber out of range", e);
        }
    }

    @Override
    public List<RawBlock> fetchRange(long start, long end) {
        if (start > end) {
            return Collections.emptyList();
        }
        if (strategy == FetchStrategy.COMPATIBILITY) {
            return fetchEachBlock(start, end);
        }
        return fetchBulk(start, end);
    }

    private List<RawBlock> fetchBulk(long start, long end) {
        Request<Object, RawBlockListResponse> request = new Request<>("eth_getBlockRange",
                Arrays.<Object>asList(RpcHex.toRpcHexString(start), RpcHex.toRpcHexString(end), Boolean.TRUE),
                web3jService, RawBlockListResponse.class);
        RawBlockListResponse resp = send(request, "eth_getBlockRange");
        List<RawBlock> blocks = new ArrayList<>(resp.getResult().size());
        for (JsonNode node : resp.getResult()) {
            if (node == null || node.isNull()) {
                throw new RpcException("eth_getBlockRange returned a null block in [" + start + ", " + end + "]");
            }
            RawBlock block = new RawBlock(node);
            long expected = start + blocks.size();
            if (block.getNumber() != expected) {
                throw new RpcException("eth_getBlockRange returned block " + block.getNumber()
                        + " where " + expected + " was expected");
            }
            blocks.add(block);
        }
        // 少返回的区块会在 unconfirmed index 中留下永久空洞
        if (blocks.size() != end - start + 1) {
            throw new RpcException("eth_getBlockRange returned " + blocks.size() + " blocks for ["
                    + start + ", " + end + "]");
        }
        return blocks;
    }

    private List<RawBlock> fetchEachBlock(long start, long end) {
        List<CompletableFuture<RawBlock>> pending = new ArrayList<>((int) (end - start + 1));
        for (long n = start; n <= end; n++) {
            final long blockNumber = n;
            pending.add(CompletableFuture.supplyAsync(() -> fetchBlock(blockNumber), fanOutExecutor));
        }
        return OrderedBlockCollector.collect(pending);
    }

    private RawBlock fetchBlock(long blockNumber) {
        Request<Object, RawBlockResponse> request = new Request<>("eth_getBlockByNumber",
                Arrays.<Object>asList(RpcHex.toRpcHexString(blockNumber), Boolean.TRUE),
                web3jService, RawBlockResponse.class);
        RawBlockResponse resp = send(request, "eth_getBlockByNumber");
        if (resp.getResult().isNull()) {
            throw new RpcException("block " + blockNumber + " not found");
        }
        RawBlock block = new RawBlock(resp.getResult());
        if (block.getNumber() != blockNumber) {
            throw new RpcException("requested block " + blockNumber + " but got " + block.getNumber());
        }
        return block;
    }

    private <T extends Response<?>> T send(Request<?, T> request, String method) {
        try {
            T resp = request.send();
            checkResponse(resp, method);
            return resp;
        } catch (IOException e) {
            log.warn("Web3j {} failed. params={} err={}", method, request.getParams(), e.getMessage());
            throw new RpcException(method + " failed: " + e.getMessage(), e);
        }
    }

    private static void checkResponse(Response<?> resp, String method) {
        if (resp == null) {
            throw new RpcException(method + " returned no response");
        }
        if (resp.hasError()) {
            throw new RpcException(method + " returned error code=" + resp.getError().getCode()
                    + " message=" + resp.getError().getMessage());
        }
        if (resp.getResult() == null) {
            throw new RpcException(method + " returned null result");
        }
    }
}
