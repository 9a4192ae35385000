package com.work.l2ingestion.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * 解码后的签名：r / s 为 32 字节 hex，v 为归一化后的 recovery id（hex）。
 */
@JsonPropertyOrder({"r", "s", "v"})
public class TransactionSignature {

    private String r;
    private String s;
    private String v;

    public TransactionSignature() {
    }

    public TransactionSignature(String r, String s, String v) {
        this.r = r;
        this.s = s;
        this.v = v;
    }

    public String getR() {
        return r;
    }

    public void setR(String r) {
        this.r = r;
    }

    public String getS() {
        return s;
    }

    public void setS(String s) {
        this.s = s;
    }

    public String getV() {
        return v;
    }

    public void setV(String v) {
        this.v = v;
    }
}
