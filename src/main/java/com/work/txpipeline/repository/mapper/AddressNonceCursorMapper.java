package com.work.txpipeline.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.txpipeline.repository.entity.AddressNonceCursorEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;

/**
 * 账本侧 nonce 游标。
 */
@Mapper
public interface AddressNonceCursorMapper extends BaseMapper<AddressNonceCursorEntity> {

    @Select("SELECT next_nonce FROM address_nonce_cursor WHERE chain_id = #{chainId} AND address = #{address}")
    Long selectNextNonce(@Param("chainId") long chainId, @Param("address") String address);

    /**
     * 只前进不后退。
     */
    @Insert("INSERT INTO address_nonce_cursor(chain_id, address, next_nonce, updated_at) " +
            "VALUES(#{chainId}, #{address}, #{nextNonce}, #{now}) " +
            "ON CONFLICT (chain_id, address) DO UPDATE SET " +
            "next_nonce = GREATEST(address_nonce_cursor.next_nonce, EXCLUDED.next_nonce), updated_at = EXCLUDED.updated_at")
    int advance(@Param("chainId") long chainId,
                @Param("address") String address,
                @Param("nextNonce") long nextNonce,
                @Param("now") Instant now);

    @Update("UPDATE address_nonce_cursor SET next_nonce = #{newNext}, updated_at = #{now} " +
            "WHERE chain_id = #{chainId} AND address = #{address} AND next_nonce = #{expectedNext}")
    int rollback(@Param("chainId") long chainId,
                 @Param("address") String address,
                 @Param("expectedNext") long expectedNext,
                 @Param("newNext") long newNext,
                 @Param("now") Instant now);
}
