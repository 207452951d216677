package com.work.txpipeline.vault.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.txpipeline.vault.repository.entity.ApiCredentialEntity;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;
import java.util.List;

@Mapper
public interface ApiCredentialMapper extends BaseMapper<ApiCredentialEntity> {

    @Insert("INSERT INTO api_credentials(user_id, provider, secret_enc, meta_enc, created_at, updated_at) " +
            "VALUES(#{userId}, #{provider}, #{secretEnc}, #{metaEnc}, #{now}, #{now}) " +
            "ON CONFLICT (user_id, provider) DO UPDATE SET secret_enc = EXCLUDED.secret_enc, " +
            "meta_enc = EXCLUDED.meta_enc, updated_at = EXCLUDED.updated_at")
    int upsert(@Param("userId") long userId,
               @Param("provider") String provider,
               @Param("secretEnc") byte[] secretEnc,
               @Param("metaEnc") byte[] metaEnc,
               @Param("now") Instant now);

    @Select("SELECT id, user_id, provider, secret_enc, meta_enc, created_at, updated_at FROM api_credentials " +
            "WHERE user_id = #{userId} AND provider = #{provider}")
    ApiCredentialEntity selectByUserAndProvider(@Param("userId") long userId, @Param("provider") String provider);

    @Delete("DELETE FROM api_credentials WHERE user_id = #{userId} AND provider = #{provider}")
    int deleteByUserAndProvider(@Param("userId") long userId, @Param("provider") String provider);

    @Select("SELECT id, user_id, provider, secret_enc, meta_enc, created_at, updated_at FROM api_credentials " +
            "WHERE id > #{afterId} ORDER BY id LIMIT #{limit}")
    List<ApiCredentialEntity> listAfterId(@Param("afterId") long afterId, @Param("limit") int limit);

    /**
     * 轮换用：以 secret_enc 做 compare-and-set，不修改 updated_at。
     */
    @Update("UPDATE api_credentials SET secret_enc = #{secretEnc}, meta_enc = #{metaEnc} " +
            "WHERE id = #{id} AND secret_enc = #{expectedSecretEnc}")
    int replaceBlobs(@Param("id") long id,
                     @Param("expectedSecretEnc") byte[] expectedSecretEnc,
                     @Param("secretEnc") byte[] secretEnc,
                     @Param("metaEnc") byte[] metaEnc);
}
