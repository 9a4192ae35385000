package com.work.l2ingestion.ingestion.chain;

/**
 * 区块拉取策略。
 *
 * BULK: 单次 eth_getBlockRange，信任节点按升序返回
 * COMPATIBILITY: 每个区块一次 eth_getBlockByNumber 并行请求，结果在 fan-in 处重新排序；用于不支持区间查询的老 sequencer
 */
public enum FetchStrategy {
    BULK,
    COMPATIBILITY
}
