package com.work.txpipeline.vault.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.txpipeline.vault.repository.entity.WalletEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

@Mapper
public interface WalletMapper extends BaseMapper<WalletEntity> {

    @Select("SELECT id, user_id, address, privkey_enc, created_at FROM wallets WHERE address = #{address}")
    WalletEntity selectByAddress(@Param("address") String address);

    @Select("SELECT id, user_id, address, privkey_enc, created_at FROM wallets WHERE id > #{afterId} ORDER BY id LIMIT #{limit}")
    List<WalletEntity> listAfterId(@Param("afterId") long afterId, @Param("limit") int limit);

    /**
     * 仅当存储的密文仍是 expected 时替换，避免覆盖并发写入。
     */
    @Update("UPDATE wallets SET privkey_enc = #{next} WHERE id = #{id} AND privkey_enc = #{expected}")
    int replaceKeyBlob(@Param("id") long id, @Param("expected") byte[] expected, @Param("next") byte[] next);
}
