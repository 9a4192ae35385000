package com.work.l2ingestion.core.store;

import com.work.l2ingestion.core.exception.InvalidArgumentException;

import java.math.BigInteger;

/**
 * 持久化 key 编码。格式需与已有部署数据逐字节一致，不得修改。
 *
 * <p>index 统一左补零到 32 位十进制，保证字节序 == 数值序（index &lt; 10^32）。</p>
 */
public final class KeyCodec {

    public static final int INDEX_WIDTH = 32;
    public static final String SYNCED_HIGHEST_KEY = "synced:highest";
    private static final String EVENT_CURSOR_PREFIX = "event:latest:";
    private static final BigInteger INDEX_BOUND = BigInteger.TEN.pow(INDEX_WIDTH);

    private KeyCodec() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static String indexKey(RecordKind<?> kind, long index) {
        return indexKey(kind.indexNamespace(), BigInteger.valueOf(index));
    }

    public static String indexKey(String namespace, BigInteger index) {
        return namespace + ":" + padIndex(index);
    }

    public static String padIndex(BigInteger index) {
        if (index == null || index.signum() < 0) {
            throw new InvalidArgumentException("index must be non-negative: " + index);
        }
        if (index.compareTo(INDEX_BOUND) >= 0) {
            throw new InvalidArgumentException("index exceeds " + INDEX_WIDTH + " decimal digits: " + index);
        }
        String digits = index.toString();
        StringBuilder sb = new StringBuilder(INDEX_WIDTH);
        for (int i = digits.length(); i < INDEX_WIDTH; i++) {
            sb.append('0');
        }
        return sb.append(digits).toString();
    }

    public static String eventCursorKey(String watcherName) {
        return EVENT_CURSOR_PREFIX + watcherName;
    }
}
