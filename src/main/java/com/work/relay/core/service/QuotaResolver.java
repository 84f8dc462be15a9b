package com.work.relay.core.service;

import com.work.relay.core.config.RelayConfig;
import com.work.relay.core.exception.QuotaExceededException;
import com.work.relay.core.model.Delegation;
import com.work.relay.core.model.PayerRef;
import com.work.relay.core.model.Quota;
import com.work.relay.core.repository.DelegationRepository;
import com.work.relay.core.repository.QuotaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

import static com.work.relay.core.support.ValidationUtils.requireNonEmpty;
import static com.work.relay.core.support.ValidationUtils.requireNonNegative;
import static com.work.relay.core.support.ValidationUtils.requireNonNull;

/**
 * 决定“这一笔由谁付”：先看自身 quota，再按 id 升序遍历授予给自己的委托。
 * <p>
 * 注意：两个方法都必须在 {@link RelayTransactionLedger} 打开的事务内调用，
 * 读到的行在事务结束前保持行锁，扣费与选择之间不会被其他请求插入。
 */
@Service
public class QuotaResolver {

    private static final Logger log = LoggerFactory.getLogger(QuotaResolver.class);

    private final QuotaRepository quotaRepository;
    private final DelegationRepository delegationRepository;
    private final RelayConfig config;

    public QuotaResolver(QuotaRepository quotaRepository,
                         DelegationRepository delegationRepository,
                         RelayConfig config) {
        this.quotaRepository = requireNonNull(quotaRepository, "quotaRepository");
        this.delegationRepository = requireNonNull(delegationRepository, "delegationRepository");
        this.config = requireNonNull(config, "config");
    }

    public PayerRef resolvePayer(String profile, long estimatedGas) {
        requireNonEmpty(profile, "profile");
        requireNonNegative(estimatedGas, "estimatedGas");

        // 懒创建 profile + quota（幂等），随后加行锁重新读取
        quotaRepository.ensureQuota(profile, config.getDefaultMonthlyAllowance());
        Quota own = quotaRepository.lockByProfile(profile);
        if (own.canCover(estimatedGas)) {
            return PayerRef.ownQuota(own);
        }

        List<Delegation> delegations = delegationRepository.lockGrantedTo(profile);
        if (delegations.isEmpty()) {
            log.warn("[relay] 自身额度不足且无委托, profile={}, used={}, allowance={}, gas={}",
                    profile, own.getUsed(), own.getMonthlyAllowance(), estimatedGas);
            throw new QuotaExceededException("profile " + profile + " 额度不足且无可用委托");
        }

        for (Delegation delegation : delegations) {
            if (!delegation.canCover(estimatedGas)) {
                continue;
            }
            Quota approverQuota = quotaRepository.lockByProfile(delegation.getApproverAddress());
            if (approverQuota != null && approverQuota.canCover(estimatedGas)) {
                log.debug("[relay] 由委托付费, profile={}, delegationId={}, approver={}",
                        profile, delegation.getId(), delegation.getApproverAddress());
                return PayerRef.delegation(delegation, approverQuota);
            }
        }

        log.warn("[relay] 所有委托均无法覆盖, profile={}, delegations={}, gas={}",
                profile, delegations.size(), estimatedGas);
        throw new QuotaExceededException("profile " + profile + " 的 " + delegations.size() + " 条委托均无法覆盖 " + estimatedGas);
    }

    /**
     * 扣费。委托付费时委托行与 approver 的 quota 同时累加。
     */
    public void debit(PayerRef payer, long estimatedGas) {
        requireNonNull(payer, "payer");
        if (payer.getKind() == PayerRef.Kind.DELEGATION) {
            delegationRepository.addDelegationUsed(payer.getDelegationId(), estimatedGas);
        }
        quotaRepository.addUsed(payer.getQuotaId(), estimatedGas);
    }
}
