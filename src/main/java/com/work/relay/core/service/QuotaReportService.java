package com.work.relay.core.service;

import com.work.relay.core.config.RelayConfig;
import com.work.relay.core.model.Delegation;
import com.work.relay.core.model.Quota;
import com.work.relay.core.model.QuotaStatus;
import com.work.relay.core.repository.DelegationRepository;
import com.work.relay.core.repository.QuotaRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.work.relay.core.support.ValidationUtils.requireNonEmpty;
import static com.work.relay.core.support.ValidationUtils.requireNonNull;

/**
 * 额度汇总（只读视图）。
 * <p>
 * 与 {@link QuotaResolver} 的选择算法刻意不同：这里回答“一共还能花多少”，不决定下一笔谁付。
 */
@Service
public class QuotaReportService {

    private final QuotaRepository quotaRepository;
    private final DelegationRepository delegationRepository;
    private final RelayConfig config;
    private final Clock clock;

    public QuotaReportService(QuotaRepository quotaRepository,
                              DelegationRepository delegationRepository,
                              RelayConfig config,
                              Clock clock) {
        this.quotaRepository = requireNonNull(quotaRepository, "quotaRepository");
        this.delegationRepository = requireNonNull(delegationRepository, "delegationRepository");
        this.config = requireNonNull(config, "config");
        this.clock = requireNonNull(clock, "clock");
    }

    /**
     * total = 自身额度 + Σ min(委托额度, approver 剩余额度)；used = 自身 used + Σ 委托 used。
     * approver 没有剩余额度时该委托对 total 贡献 0，但其 used 照常计入。
     */
    public QuotaStatus computeAvailableQuota(String profile) {
        requireNonEmpty(profile, "profile");
        Quota own = quotaRepository.ensureQuota(profile, config.getDefaultMonthlyAllowance());
        long total = own.getMonthlyAllowance();
        long used = own.getUsed();

        List<Delegation> delegations = delegationRepository.findGrantedTo(profile);
        if (!delegations.isEmpty()) {
            List<String> approvers = new ArrayList<>(delegations.size());
            for (Delegation d : delegations) {
                approvers.add(d.getApproverAddress());
            }
            Map<String, Quota> approverQuotas = new HashMap<>();
            for (Quota q : quotaRepository.findByProfiles(approvers)) {
                approverQuotas.put(q.getProfileAddress(), q);
            }
            for (Delegation d : delegations) {
                Quota approverQuota = approverQuotas.get(d.getApproverAddress());
                long headroom = approverQuota == null ? 0L : approverQuota.headroom();
                total += Math.min(d.getMonthlyAllowance(), headroom);
                used += d.getUsed();
            }
        }
        return new QuotaStatus(used, total, nextResetDate());
    }

    /**
     * 下个月 1 号 00:00（配置时区）的 epoch 毫秒。
     */
    long nextResetDate() {
        LocalDate firstOfNextMonth = LocalDate.now(clock.withZone(config.getResetZone()))
                .withDayOfMonth(1)
                .plusMonths(1);
        return ZonedDateTime.of(firstOfNextMonth.atStartOfDay(), config.getResetZone()).toInstant().toEpochMilli();
    }
}
