package com.work.l2ingestion.ingestion.decoder;

import com.work.l2ingestion.core.store.OrderedStore;
import com.work.l2ingestion.ingestion.chain.RawBlock;

/**
 * 区块解码端口：engine 只负责顺序调用，不关心交易如何分类、签名如何处理。
 */
public interface SequencerBlockDecoder {

    /**
     * 将原始区块转换为领域记录。同一区块必须得到完全相同的结果（重放幂等依赖这一点）。
     *
     * @throws com.work.l2ingestion.core.exception.DecodeException 区块或交易编码非法
     */
    SequencerBlockEntry parseBlock(RawBlock block, long chainId);

    /**
     * 持久化该区块的记录及其派生记录。
     */
    void storeBlock(SequencerBlockEntry entry, OrderedStore store);
}
