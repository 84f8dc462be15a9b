package com.work.relay.core.repository.impl;

import com.work.relay.core.exception.QuotaExceededException;
import com.work.relay.core.exception.RelayErrorCode;
import com.work.relay.core.exception.RelayException;
import com.work.relay.core.model.Quota;
import com.work.relay.core.repository.QuotaRepository;
import com.work.relay.core.repository.entity.QuotaEntity;
import com.work.relay.core.repository.mapper.QuotaMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import static com.work.relay.core.support.ValidationUtils.requireNonEmpty;
import static com.work.relay.core.support.ValidationUtils.requireNonNegative;

/**
 * 基于 PostgreSQL + MyBatis-Plus 的 QuotaRepository 实现
 * <p>
 * 所有方法都必须在事务中调用，事务边界由 Service 层统一管理。
 */
@Repository
public class PostgresQuotaRepository implements QuotaRepository {

    private final QuotaMapper quotaMapper;

    public PostgresQuotaRepository(QuotaMapper quotaMapper) {
        this.quotaMapper = quotaMapper;
    }

    @Override
    public Quota ensureQuota(String profileAddress, long defaultMonthlyAllowance) {
        requireNonEmpty(profileAddress, "profileAddress");
        requireNonNegative(defaultMonthlyAllowance, "defaultMonthlyAllowance");

        Instant now = Instant.now();
        // 两条 insert 都是 on conflict do nothing，并发首访只会有一方真正写入
        quotaMapper.insertProfileIfAbsent(profileAddress, now);
        quotaMapper.insertQuotaIfAbsent(profileAddress, defaultMonthlyAllowance, now);

        QuotaEntity entity = quotaMapper.selectByProfile(profileAddress);
        if (entity == null) {
            throw new RelayException(RelayErrorCode.INTERNAL, "failed to get quota",
                    "quota 初始化后仍不存在: " + profileAddress);
        }
        return toQuota(entity);
    }

    @Override
    public Quota lockByProfile(String profileAddress) {
        requireNonEmpty(profileAddress, "profileAddress");
        QuotaEntity entity = quotaMapper.lockByProfile(profileAddress);
        return entity == null ? null : toQuota(entity);
    }

    @Override
    public Quota findByProfile(String profileAddress) {
        requireNonEmpty(profileAddress, "profileAddress");
        QuotaEntity entity = quotaMapper.selectByProfile(profileAddress);
        return entity == null ? null : toQuota(entity);
    }

    @Override
    public List<Quota> findByProfiles(Collection<String> profileAddresses) {
        if (profileAddresses == null || profileAddresses.isEmpty()) {
            return Collections.emptyList();
        }
        List<QuotaEntity> entities = quotaMapper.selectByProfiles(profileAddresses);
        List<Quota> result = new ArrayList<>(entities.size());
        for (QuotaEntity entity : entities) {
            result.add(toQuota(entity));
        }
        return result;
    }

    @Override
    public void addUsed(long quotaId, long gas) {
        requireNonNegative(gas, "gas");
        int updated = quotaMapper.addUsed(quotaId, gas, Instant.now());
        if (updated != 1) {
            throw new QuotaExceededException("quota 扣费被额度守卫拒绝: quotaId=" + quotaId + ", gas=" + gas);
        }
    }

    private Quota toQuota(QuotaEntity e) {
        return new Quota(e.getId(), e.getProfileAddress(), e.getMonthlyAllowance(), e.getUsed(),
                e.getCreatedAt(), e.getUpdatedAt());
    }
}
