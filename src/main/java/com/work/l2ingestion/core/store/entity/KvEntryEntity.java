package com.work.l2ingestion.core.store.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

@TableName("l2_kv_store")
public class KvEntryEntity {

    @TableId(type = IdType.INPUT)
    private String kvKey;

    private byte[] kvValue;

    private Instant updatedAt;

    public String getKvKey() {
        return kvKey;
    }

    public void setKvKey(String kvKey) {
        this.kvKey = kvKey;
    }

    public byte[] getKvValue() {
        return kvValue;
    }

    public void setKvValue(byte[] kvValue) {
        this.kvValue = kvValue;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
