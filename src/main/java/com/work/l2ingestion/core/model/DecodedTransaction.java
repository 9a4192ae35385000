package com.work.l2ingestion.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * sequencer 交易的解码结果，L1 来源交易没有该部分（为 null）。
 */
@JsonPropertyOrder({"sig", "gasLimit", "gasPrice", "nonce", "target", "data"})
public class DecodedTransaction {

    private TransactionSignature sig;
    private long gasLimit;
    private long gasPrice;
    private long nonce;
    private String target;
    private String data;

    public TransactionSignature getSig() {
        return sig;
    }

    public void setSig(TransactionSignature sig) {
        this.sig = sig;
    }

    public long getGasLimit() {
        return gasLimit;
    }

    public void setGasLimit(long gasLimit) {
        this.gasLimit = gasLimit;
    }

    public long getGasPrice() {
        return gasPrice;
    }

    public void setGasPrice(long gasPrice) {
        this.gasPrice = gasPrice;
    }

    public long getNonce() {
        return nonce;
    }

    public void setNonce(long nonce) {
        this.nonce = nonce;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public String getData() {
        return data;
    }

    public void setData(String data) {
        this.data = data;
    }
}
