package com.work.txpipeline.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.txpipeline.repository.entity.TxSendEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

/**
 * tx_sends Mapper
 */
@Mapper
public interface TxSendMapper extends BaseMapper<TxSendEntity> {

    String COLUMNS = "s.id, s.intent_id, s.chain_id, s.signing_address, s.nonce, s.max_fee_per_gas, " +
            "s.max_priority_fee_per_gas, s.gas_limit, s.raw_tx, s.tx_hash, s.sent_at, s.sent_block, s.replaced_by";

    @Insert("INSERT INTO tx_sends(intent_id, chain_id, signing_address, nonce, max_fee_per_gas, max_priority_fee_per_gas, " +
            "gas_limit, raw_tx, tx_hash, sent_at, sent_block, replaced_by) " +
            "VALUES(#{intentId}, #{chainId}, #{signingAddress}, #{nonce}, #{maxFeePerGas}, #{maxPriorityFeePerGas}, " +
            "#{gasLimit}, #{rawTx}, #{txHash}, #{sentAt}, #{sentBlock}, #{replacedBy}) " +
            "ON CONFLICT (tx_hash) DO NOTHING")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insertIfAbsent(TxSendEntity send);

    @Select("SELECT " + COLUMNS + " FROM tx_sends s WHERE s.tx_hash = #{txHash}")
    TxSendEntity selectByTxHash(@Param("txHash") String txHash);

    @Select("SELECT " + COLUMNS + " FROM tx_sends s WHERE s.intent_id = #{intentId} ORDER BY s.id")
    List<TxSendEntity> listByIntentId(@Param("intentId") long intentId);

    /**
     * 在途 Intent 下所有还没有 receipt 的 Send（含已被替换的，旧交易仍可能先上链）。
     */
    @Select("SELECT " + COLUMNS + " FROM tx_sends s " +
            "JOIN tx_intents i ON i.id = s.intent_id " +
            "LEFT JOIN tx_receipts r ON r.tx_hash = s.tx_hash " +
            "WHERE i.status IN ('SENT', 'REPLACED') AND r.tx_hash IS NULL " +
            "ORDER BY s.sent_at LIMIT #{limit}")
    List<TxSendEntity> listPending(@Param("limit") int limit);

    @Update("UPDATE tx_sends SET replaced_by = #{replacedBy} WHERE tx_hash = #{txHash}")
    int updateReplacedBy(@Param("txHash") String txHash, @Param("replacedBy") String replacedBy);

    /**
     * 只有仍未被替换的 Send 才能被认领，并发替换同一笔时只有一方成功。
     */
    @Update("UPDATE tx_sends SET replaced_by = #{replacedBy} WHERE tx_hash = #{txHash} AND replaced_by IS NULL")
    int claimReplacedBy(@Param("txHash") String txHash, @Param("replacedBy") String replacedBy);
}
