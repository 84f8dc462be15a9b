package com.work.relay.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.relay.core.repository.entity.QuotaEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * quotas / profiles 表 Mapper
 */
public interface QuotaMapper extends BaseMapper<QuotaEntity> {

    String COLUMNS = "id, profile_address, monthly_allowance, used, created_at, updated_at";

    /**
     * profile 懒注册（PostgreSQL 的 ON CONFLICT 语法）
     */
    @Insert("INSERT INTO profiles(address, created_at) VALUES(#{address}, #{now}) " +
            "ON CONFLICT(address) DO NOTHING")
    int insertProfileIfAbsent(@Param("address") String address, @Param("now") Instant now);

    @Insert("INSERT INTO quotas(profile_address, monthly_allowance, used, created_at, updated_at) " +
            "VALUES(#{profile}, #{monthlyAllowance}, 0, #{now}, #{now}) " +
            "ON CONFLICT(profile_address) DO NOTHING")
    int insertQuotaIfAbsent(@Param("profile") String profile,
                            @Param("monthlyAllowance") long monthlyAllowance,
                            @Param("now") Instant now);

    @Select("SELECT " + COLUMNS + " FROM quotas WHERE profile_address = #{profile}")
    QuotaEntity selectByProfile(@Param("profile") String profile);

    /**
     * 使用 SELECT FOR UPDATE 锁定 quota 行
     */
    @Select("SELECT " + COLUMNS + " FROM quotas WHERE profile_address = #{profile} FOR UPDATE")
    QuotaEntity lockByProfile(@Param("profile") String profile);

    @Select("<script>SELECT " + COLUMNS + " FROM quotas WHERE profile_address IN " +
            "<foreach collection='profiles' item='p' open='(' separator=',' close=')'>#{p}</foreach>" +
            "</script>")
    List<QuotaEntity> selectByProfiles(@Param("profiles") Collection<String> profiles);

    /**
     * 带额度守卫的扣费：超出额度时影响 0 行
     */
    @Update("UPDATE quotas SET used = used + #{gas}, updated_at = #{now} " +
            "WHERE id = #{id} AND used + #{gas} <= monthly_allowance")
    int addUsed(@Param("id") long id, @Param("gas") long gas, @Param("now") Instant now);
}
