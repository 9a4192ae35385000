package com.work.l2ingestion.ingestion.chain;

import org.web3j.utils.Numeric;

import java.math.BigInteger;

/**
 * JSON-RPC 数量编码：0x 前缀、无前导零，0 编码为 0x0。
 */
public final class RpcHex {

    private RpcHex() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static String toRpcHexString(long value) {
        return Numeric.encodeQuantity(BigInteger.valueOf(value));
    }
}
