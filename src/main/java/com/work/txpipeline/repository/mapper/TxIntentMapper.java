package com.work.txpipeline.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.txpipeline.repository.entity.TxIntentEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;
import java.util.List;

/**
 * tx_intents Mapper
 */
@Mapper
public interface TxIntentMapper extends BaseMapper<TxIntentEntity> {

    String COLUMNS = "id, intent_key, status, signing_address, chain_id, built_call, intent_metadata, allocated_nonce, " +
            "max_fee_per_gas, max_priority_fee_per_gas, gas_limit, replacement_count, last_error, created_at, updated_at";

    /**
     * intent_key 冲突时不插入，返回 0；成功时回填 id。
     */
    @Insert("INSERT INTO tx_intents(intent_key, status, signing_address, chain_id, built_call, intent_metadata, " +
            "replacement_count, created_at, updated_at) " +
            "VALUES(#{intentKey}, #{status}, #{signingAddress}, #{chainId}, #{builtCall}, #{intentMetadata}, 0, #{createdAt}, #{updatedAt}) " +
            "ON CONFLICT (intent_key) DO NOTHING")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insertIfAbsent(TxIntentEntity intent);

    @Select("SELECT " + COLUMNS + " FROM tx_intents WHERE id = #{id}")
    TxIntentEntity selectIntent(@Param("id") long id);

    @Select("SELECT " + COLUMNS + " FROM tx_intents WHERE intent_key = #{intentKey}")
    TxIntentEntity selectByIntentKey(@Param("intentKey") String intentKey);

    @Select("SELECT " + COLUMNS + " FROM tx_intents WHERE status = #{status} AND updated_at < #{before} " +
            "ORDER BY created_at LIMIT #{limit}")
    List<TxIntentEntity> listByStatusUpdatedBefore(@Param("status") String status,
                                                   @Param("before") Instant before,
                                                   @Param("limit") int limit);

    /**
     * 状态 compare-and-set，同时覆盖 last_error（null 即清空）。
     */
    @Update("UPDATE tx_intents SET status = #{next}, last_error = #{lastError}, updated_at = #{now} " +
            "WHERE id = #{id} AND status = #{expected}")
    int casStatus(@Param("id") long id,
                  @Param("expected") String expected,
                  @Param("next") String next,
                  @Param("lastError") String lastError,
                  @Param("now") Instant now);

    /**
     * 首次分配：CREATED -> ALLOCATED 并写入分配记录。
     */
    @Update("UPDATE tx_intents SET status = 'ALLOCATED', allocated_nonce = #{nonce}, max_fee_per_gas = #{maxFee}, " +
            "max_priority_fee_per_gas = #{priorityFee}, gas_limit = #{gasLimit}, updated_at = #{now} " +
            "WHERE id = #{id} AND status = 'CREATED'")
    int recordFirstAllocation(@Param("id") long id,
                              @Param("nonce") long nonce,
                              @Param("maxFee") long maxFee,
                              @Param("priorityFee") long priorityFee,
                              @Param("gasLimit") long gasLimit,
                              @Param("now") Instant now);

    /**
     * 重新分配（nonce 冲突或费用调整）：仍为 ALLOCATED 且分配记录未被他人改写。
     */
    @Update("UPDATE tx_intents SET allocated_nonce = #{nonce}, max_fee_per_gas = #{maxFee}, " +
            "max_priority_fee_per_gas = #{priorityFee}, gas_limit = #{gasLimit}, updated_at = #{now} " +
            "WHERE id = #{id} AND status = 'ALLOCATED' AND allocated_nonce = #{previousNonce}")
    int recordReallocation(@Param("id") long id,
                           @Param("previousNonce") long previousNonce,
                           @Param("nonce") long nonce,
                           @Param("maxFee") long maxFee,
                           @Param("priorityFee") long priorityFee,
                           @Param("gasLimit") long gasLimit,
                           @Param("now") Instant now);

    /**
     * 替换交易：Intent 保持 SENT，记录最新费用并累加替换次数。
     */
    @Update("UPDATE tx_intents SET max_fee_per_gas = #{maxFee}, max_priority_fee_per_gas = #{priorityFee}, " +
            "replacement_count = replacement_count + 1, status = 'SENT', updated_at = #{now} " +
            "WHERE id = #{id} AND status IN ('SENT', 'REPLACED')")
    int recordReplacement(@Param("id") long id,
                          @Param("maxFee") long maxFee,
                          @Param("priorityFee") long priorityFee,
                          @Param("now") Instant now);
}
