package com.work.relay.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.relay.core.repository.entity.RelayTransactionEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;
import java.util.List;

/**
 * relay_transactions 表 Mapper（插入走 BaseMapper#insert 回填自增 id）
 */
public interface RelayTransactionMapper extends BaseMapper<RelayTransactionEntity> {

    String COLUMNS = "id, profile_address, call_nonce, signature, call_data, channel_id, status, signer_address, " +
            "relayer_nonce, relayer_address, estimated_gas, gas_used, settled_hash, payer_quota_id, payer_delegation_id, " +
            "key_manager, gas_price, handed_off_at, broadcast_at, created_at, updated_at";

    /**
     * 事务级 advisory lock，事务结束自动释放
     */
    @Select("SELECT 1 FROM (SELECT pg_advisory_xact_lock(hashtext(#{relayer}))) AS l")
    Integer advisoryLockRelayer(@Param("relayer") String relayer);

    @Select("SELECT relayer_nonce FROM relay_transactions " +
            "WHERE relayer_address = #{relayer} AND status = 'PENDING' " +
            "ORDER BY relayer_nonce DESC LIMIT 1")
    Long selectLatestPendingRelayerNonce(@Param("relayer") String relayer);

    @Select("SELECT " + COLUMNS + " FROM relay_transactions WHERE id = #{id}")
    RelayTransactionEntity selectByTxId(@Param("id") long id);

    @Select("SELECT " + COLUMNS + " FROM relay_transactions WHERE profile_address = #{profile} " +
            "ORDER BY created_at DESC, id DESC")
    List<RelayTransactionEntity> selectByProfile(@Param("profile") String profile);

    @Select("SELECT " + COLUMNS + " FROM relay_transactions WHERE status = 'PENDING' " +
            "ORDER BY relayer_nonce ASC LIMIT #{limit}")
    List<RelayTransactionEntity> selectPending(@Param("limit") int limit);

    /**
     * 已投递但迟迟没有广播的 PENDING 交易（投递失败或执行器在 ACK 前宕机）
     */
    @Select("SELECT " + COLUMNS + " FROM relay_transactions " +
            "WHERE status = 'PENDING' AND broadcast_at IS NULL AND handed_off_at < #{before} " +
            "ORDER BY relayer_nonce ASC LIMIT #{limit}")
    List<RelayTransactionEntity> selectUndispatched(@Param("before") Instant before, @Param("limit") int limit);

    @Update("UPDATE relay_transactions SET handed_off_at = #{now} " +
            "WHERE id = #{id} AND status = 'PENDING' AND broadcast_at IS NULL")
    int updateHandedOff(@Param("id") long id, @Param("now") Instant now);

    @Update("UPDATE relay_transactions SET broadcast_at = #{now} WHERE id = #{id} AND broadcast_at IS NULL")
    int updateBroadcast(@Param("id") long id, @Param("now") Instant now);

    /**
     * 仅 PENDING 可推进到终态
     */
    @Update("UPDATE relay_transactions SET status = #{status}, gas_used = #{gasUsed}, updated_at = #{now} " +
            "WHERE id = #{id} AND status = 'PENDING'")
    int updateStatusFromPending(@Param("id") long id,
                                @Param("status") String status,
                                @Param("gasUsed") long gasUsed,
                                @Param("now") Instant now);
}
