package com.work.l2ingestion.ingestion.chain;

import java.util.List;

/**
 * 远端链节点的最小端口。
 *
 * 所有方法在传输失败、超时或响应格式错误时抛出 {@link com.work.l2ingestion.core.exception.RpcException}，
 * 由 engine 的 ErrorPolicy 决定是否重试，这里不做补救。
 */
public interface BlockFetcher {

    /**
     * 节点报告的最新区块高度。
     */
    long currentHeight();

    /**
     * 拉取 {@code [start, end]}（闭区间）的区块，按 number 升序返回。
     */
    List<RawBlock> fetchRange(long start, long end);
}
