package com.work.l2ingestion.ingestion.chain;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.work.l2ingestion.core.exception.DecodeException;
import com.work.l2ingestion.core.exception.RpcException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

public class OrderedBlockCollectorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static RawBlock block(long number) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("number", RpcHex.toRpcHexString(number));
        return new RawBlock(node);
    }

    @Test
    public void completion_order_does_not_leak_into_result() {
        CompletableFuture<RawBlock> second = new CompletableFuture<>();
        CompletableFuture<RawBlock> first = new CompletableFuture<>();
        // block 3 arrives before block 2
        second.complete(block(3));
        first.complete(block(2));

        List<RawBlock> blocks = OrderedBlockCollector.collect(Arrays.asList(second, first));

        assertEquals(2, blocks.size());
        assertEquals(2L, blocks.get(0).getNumber());
        assertEquals(3L, blocks.get(1).getNumber());
    }

    @Test
    public void ingestion_failure_is_rethrown_as_is() {
        CompletableFuture<RawBlock> failed = new CompletableFuture<>();
        failed.completeExceptionally(new DecodeException("bad"));

        DecodeException e = assertThrows(DecodeException.class,
                () -> OrderedBlockCollector.collect(Arrays.asList(CompletableFuture.completedFuture(block(1)), failed)));
        assertEquals("bad", e.getMessage());
    }

    @Test
    public void foreign_failure_becomes_rpc_error() {
        CompletableFuture<RawBlock> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("socket closed"));

        assertThrows(RpcException.class, () -> OrderedBlockCollector.collect(Arrays.asList(failed)));
    }

    @Test
    public void raw_block_requires_hex_number() {
        assertThrows(RpcException.class, () -> new RawBlock(MAPPER.createObjectNode()));
        ObjectNode bad = MAPPER.createObjectNode();
        bad.put("number", "zz");
        assertThrows(RpcException.class, () -> new RawBlock(bad));
    }
}
