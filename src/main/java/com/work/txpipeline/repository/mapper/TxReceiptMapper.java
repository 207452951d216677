package com.work.txpipeline.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.txpipeline.repository.entity.TxReceiptEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface TxReceiptMapper extends BaseMapper<TxReceiptEntity> {

    @Insert("INSERT INTO tx_receipts(tx_hash, status, block_number, gas_used, effective_gas_price, mined_at) " +
            "VALUES(#{txHash}, #{status}, #{blockNumber}, #{gasUsed}, #{effectiveGasPrice}, #{minedAt}) " +
            "ON CONFLICT (tx_hash) DO NOTHING")
    int insertIfAbsent(TxReceiptEntity receipt);

    @Select("SELECT id, tx_hash, status, block_number, gas_used, effective_gas_price, mined_at " +
            "FROM tx_receipts WHERE tx_hash = #{txHash}")
    TxReceiptEntity selectByTxHash(@Param("txHash") String txHash);
}
