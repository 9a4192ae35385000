package com.work.l2ingestion.core.store.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.l2ingestion.core.store.entity.KvEntryEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.Instant;
import java.util.List;

/**
 * l2_kv_store 表 Mapper。kv_key 列使用 COLLATE "C"，比较与排序均为字节序。
 */
public interface KvEntryMapper extends BaseMapper<KvEntryEntity> {

    @Select("SELECT kv_key, kv_value, updated_at FROM l2_kv_store WHERE kv_key = #{key}")
    KvEntryEntity selectByKey(@Param("key") String key);

    /**
     * 同 key 覆盖写，重放同一区间时保持幂等
     */
    @Insert("INSERT INTO l2_kv_store(kv_key, kv_value, updated_at) " +
            "VALUES(#{key}, #{value}, #{updatedAt}) " +
            "ON CONFLICT(kv_key) " +
            "DO UPDATE SET kv_value = EXCLUDED.kv_value, updated_at = EXCLUDED.updated_at")
    int upsert(@Param("key") String key,
               @Param("value") byte[] value,
               @Param("updatedAt") Instant updatedAt);

    @Select("SELECT kv_key, kv_value, updated_at FROM l2_kv_store " +
            "WHERE kv_key >= #{gte} AND kv_key < #{lt} " +
            "ORDER BY kv_key ASC")
    List<KvEntryEntity> scanRange(@Param("gte") String gte, @Param("lt") String lt);
}
