package com.work.relay.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.relay.core.repository.entity.DelegationEntity;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;
import java.util.List;

/**
 * delegations 表 Mapper，列表查询一律按 id 升序，保证付费方选择的顺序稳定
 */
public interface DelegationMapper extends BaseMapper<DelegationEntity> {

    String COLUMNS = "id, approver_address, approved_address, monthly_allowance, used, created_at, updated_at";

    @Select("SELECT " + COLUMNS + " FROM delegations WHERE approved_address = #{approved} ORDER BY id ASC FOR UPDATE")
    List<DelegationEntity> lockByApproved(@Param("approved") String approved);

    @Select("SELECT " + COLUMNS + " FROM delegations WHERE approved_address = #{approved} ORDER BY id ASC")
    List<DelegationEntity> selectByApproved(@Param("approved") String approved);

    @Select("SELECT " + COLUMNS + " FROM delegations WHERE approver_address = #{approver} ORDER BY id ASC")
    List<DelegationEntity> selectByApprover(@Param("approver") String approver);

    @Select("SELECT " + COLUMNS + " FROM delegations WHERE approver_address = #{approver} AND approved_address = #{approved}")
    DelegationEntity selectByPair(@Param("approver") String approver, @Param("approved") String approved);

    /**
     * 按有序对 upsert，已用量保留
     */
    @Insert("INSERT INTO delegations(approver_address, approved_address, monthly_allowance, used, created_at, updated_at) " +
            "VALUES(#{approver}, #{approved}, #{monthlyAllowance}, 0, #{now}, #{now}) " +
            "ON CONFLICT(approver_address, approved_address) " +
            "DO UPDATE SET monthly_allowance = #{monthlyAllowance}, updated_at = #{now}")
    int upsert(@Param("approver") String approver,
               @Param("approved") String approved,
               @Param("monthlyAllowance") long monthlyAllowance,
               @Param("now") Instant now);

    @Delete("DELETE FROM delegations WHERE approver_address = #{approver} AND approved_address = #{approved}")
    int deleteByPair(@Param("approver") String approver, @Param("approved") String approved);

    @Update("UPDATE delegations SET used = used + #{gas}, updated_at = #{now} " +
            "WHERE id = #{id} AND used + #{gas} <= monthly_allowance")
    int addUsed(@Param("id") long id, @Param("gas") long gas, @Param("now") Instant now);
}
