package com.work.relay.core.repository;

import com.work.relay.core.model.Quota;

import java.util.Collection;
import java.util.List;

/**
 * quota 存储抽象。带 lock 前缀的方法必须在事务中调用，锁随事务结束释放。
 */
public interface QuotaRepository {

    /**
     * 幂等地确保 profile 与其 quota 存在（insert ... on conflict do nothing），返回当前 quota。
     * 这是 profile/quota 懒创建的唯一入口。
     */
    Quota ensureQuota(String profileAddress, long defaultMonthlyAllowance);

    /**
     * 行锁加载，不存在返回 null。
     */
    Quota lockByProfile(String profileAddress);

    Quota findByProfile(String profileAddress);

    List<Quota> findByProfiles(Collection<String> profileAddresses);

    /**
     * used += gas，并在存储层再次校验 used <= monthly_allowance；校验失败抛 QuotaExceededException。
     */
    void addUsed(long quotaId, long gas);
}
