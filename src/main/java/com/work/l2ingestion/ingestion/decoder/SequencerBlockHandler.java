package com.work.l2ingestion.ingestion.decoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.work.l2ingestion.core.exception.DecodeException;
import com.work.l2ingestion.core.model.DecodedTransaction;
import com.work.l2ingestion.core.model.QueueOrigin;
import com.work.l2ingestion.core.model.StateRootEntry;
import com.work.l2ingestion.core.model.TransactionEntry;
import com.work.l2ingestion.core.model.TransactionSignature;
import com.work.l2ingestion.core.model.TransactionType;
import com.work.l2ingestion.core.store.OrderedStore;
import com.work.l2ingestion.core.store.RecordKind;
import com.work.l2ingestion.ingestion.chain.RawBlock;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Collections;

/**
 * 默认的 sequencer 区块处理器。
 *
 * <p>每个 L2 区块恰好包含一笔交易。交易 index 取交易自身的 {@code index} 字段，缺失时为 {@code blockNumber - 1}。
 * sequencer 来源的交易带 decoded 部分，签名 v 按 chainId 归一化为 recovery id；L1 来源的交易 decoded 为 null。</p>
 *
 * <p>结果写入 unconfirmed 命名空间，永远不会覆盖 L1 已确认的记录。</p>
 */
public class SequencerBlockHandler implements SequencerBlockDecoder {

    private static final int WORD_HEX_LENGTH = 64;
    private static final long ETH_SIGN_V_BASE = 27L;
    private static final long EIP155_V_OFFSET = 35L;

    @Override
    public SequencerBlockEntry parseBlock(RawBlock block, long chainId) {
        JsonNode node = block.getNode();
        JsonNode transactions = node.get("transactions");
        if (transactions == null || !transactions.isArray() || transactions.size() == 0) {
            throw new DecodeException("block " + block.getNumber() + " carries no transaction");
        }
        JsonNode tx = transactions.get(0);
        if (!tx.isObject()) {
            throw new DecodeException("block " + block.getNumber() + " was fetched without transaction bodies");
        }

        long index = hasValue(tx, "index") ? quantity(tx, "index") : block.getNumber() - 1;
        if (index < 0) {
            throw new DecodeException("block " + block.getNumber() + " maps to a negative transaction index");
        }

        TransactionEntry entry = new TransactionEntry();
        entry.setIndex(index);
        entry.setBatchIndex(null);
        entry.setBlockNumber(quantity(tx, "l1BlockNumber"));
        entry.setTimestamp(quantity(tx, "l1Timestamp"));
        entry.setGasLimit(quantity(tx, "gas"));
        entry.setTarget(optionalText(tx, "to"));

        QueueOrigin origin = queueOrigin(tx);
        entry.setQueueOrigin(origin);
        if (origin == QueueOrigin.SEQUENCER) {
            entry.setOrigin(null);
            entry.setQueueIndex(null);
            entry.setData(hasValue(tx, "rawTransaction") ? text(tx, "rawTransaction") : text(tx, "input"));
            decodeSequencerTransaction(tx, chainId, entry);
        } else {
            entry.setOrigin(optionalText(tx, "l1TxOrigin"));
            entry.setQueueIndex(hasValue(tx, "queueIndex") ? Long.valueOf(quantity(tx, "queueIndex")) : null);
            entry.setData(text(tx, "input"));
            entry.setType(null);
            entry.setDecoded(null);
        }

        StateRootEntry stateRoot = new StateRootEntry();
        stateRoot.setIndex(index);
        stateRoot.setBatchIndex(null);
        stateRoot.setValue(text(node, "stateRoot"));

        return new SequencerBlockEntry(block.getNumber(), entry, stateRoot);
    }

    @Override
    public void storeBlock(SequencerBlockEntry entry, OrderedStore store) {
        store.putIndexed(RecordKind.UNCONFIRMED_TRANSACTION, Collections.singletonList(entry.getTransactionEntry()));
        store.putIndexed(RecordKind.UNCONFIRMED_STATE_ROOT, Collections.singletonList(entry.getStateRootEntry()));
    }

    private void decodeSequencerTransaction(JsonNode tx, long chainId, TransactionEntry entry) {
        long v = quantity(tx, "v");
        long recoveryId;
        TransactionType type;
        if (v == ETH_SIGN_V_BASE || v == ETH_SIGN_V_BASE + 1) {
            recoveryId = v - ETH_SIGN_V_BASE;
            type = TransactionType.ETH_SIGN;
        } else {
            recoveryId = v - (chainId * 2 + EIP155_V_OFFSET);
            type = TransactionType.EIP155;
        }
        if (recoveryId != 0 && recoveryId != 1) {
            throw new DecodeException("unrecoverable signature: v=" + v + " does not match chainId=" + chainId);
        }

        TransactionSignature sig = new TransactionSignature(word(tx, "r"), word(tx, "s"),
                Numeric.toHexStringWithPrefixZeroPadded(BigInteger.valueOf(recoveryId), 2));

        DecodedTransaction decoded = new DecodedTransaction();
        decoded.setSig(sig);
        decoded.setGasLimit(quantity(tx, "gas"));
        decoded.setGasPrice(quantity(tx, "gasPrice"));
        decoded.setNonce(quantity(tx, "nonce"));
        decoded.setTarget(optionalText(tx, "to"));
        decoded.setData(text(tx, "input"));

        entry.setType(type);
        entry.setDecoded(decoded);
    }

    private static QueueOrigin queueOrigin(JsonNode tx) {
        String value = text(tx, "queueOrigin");
        try {
            return QueueOrigin.fromWireName(value);
        } catch (IllegalArgumentException e) {
            throw new DecodeException("unknown queueOrigin: " + value, e);
        }
    }

    private static boolean hasValue(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull();
    }

    private static String text(JsonNode node, String field) {
        if (!hasValue(node, field)) {
            throw new DecodeException("missing field: " + field);
        }
        return node.get(field).asText();
    }

    private static String optionalText(JsonNode node, String field) {
        return hasValue(node, field) ? node.get(field).asText() : null;
    }

    private static long quantity(JsonNode node, String field) {
        String value = text(node, field);
        try {
            return Numeric.decodeQuantity(value).longValueExact();
        } catch (RuntimeException e) {
            throw new DecodeException("malformed quantity " + field + "=" + value, e);
        }
    }

    /**
     * r / s 左补零到 32 字节。
     */
    private static String word(JsonNode node, String field) {
        String value = text(node, field);
        try {
            BigInteger number = Numeric.toBigInt(value);
            if (number.bitLength() > WORD_HEX_LENGTH * 4) {
                throw new DecodeException("signature component " + field + " exceeds 32 bytes");
            }
            return Numeric.toHexStringWithPrefixZeroPadded(number, WORD_HEX_LENGTH);
        } catch (NumberFormatException e) {
            throw new DecodeException("malformed signature component " + field + "=" + value, e);
        }
    }
}
