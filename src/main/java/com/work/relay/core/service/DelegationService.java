package com.work.relay.core.service;

import com.work.relay.core.config.RelayConfig;
import com.work.relay.core.model.Delegation;
import com.work.relay.core.repository.DelegationRepository;
import com.work.relay.core.repository.QuotaRepository;
import com.work.relay.core.support.RelayMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

import static com.work.relay.core.support.ValidationUtils.requireAddress;
import static com.work.relay.core.support.ValidationUtils.requireHex;
import static com.work.relay.core.support.ValidationUtils.requireNonNegative;
import static com.work.relay.core.support.ValidationUtils.requireNonNull;

/**
 * 委托索引的管理入口。授予与撤销都需要 approver 的 signer 对时间戳签名。
 * <p>
 * 撤销的签名原文与授予相同，allowance 固定为 0。
 */
@Service
public class DelegationService {

    private static final Logger log = LoggerFactory.getLogger(DelegationService.class);

    private final QuotaRepository quotaRepository;
    private final DelegationRepository delegationRepository;
    private final AuthorizationService authorizationService;
    private final RelayConfig config;

    public DelegationService(QuotaRepository quotaRepository,
                             DelegationRepository delegationRepository,
                             AuthorizationService authorizationService,
                             RelayConfig config) {
        this.quotaRepository = requireNonNull(quotaRepository, "quotaRepository");
        this.delegationRepository = requireNonNull(delegationRepository, "delegationRepository");
        this.authorizationService = requireNonNull(authorizationService, "authorizationService");
        this.config = requireNonNull(config, "config");
    }

    public Delegation grant(String approverAddress, String approvedAddress, long monthlyAllowance,
                            long timestampMillis, String signature) {
        String approver = requireAddress(approverAddress, "approver");
        String approved = requireAddress(approvedAddress, "approved");
        requireNonNegative(monthlyAllowance, "monthlyAllowance");
        String sig = requireHex(signature, "signature");
        if (approver.equals(approved)) {
            throw new IllegalArgumentException("approver and approved must differ");
        }
        byte[] digest = RelayMessages.delegationAttestationDigest(approver, approved, monthlyAllowance, timestampMillis);
        String signer = authorizationService.verifyAttestation(approver, timestampMillis, sig, digest);

        // 两端 profile 都需要先存在（外键）
        quotaRepository.ensureQuota(approver, config.getDefaultMonthlyAllowance());
        quotaRepository.ensureQuota(approved, config.getDefaultMonthlyAllowance());
        Delegation delegation = delegationRepository.upsert(approver, approved, monthlyAllowance);
        log.info("[relay] 委托已授予, approver={}, approved={}, allowance={}, signer={}",
                approver, approved, monthlyAllowance, signer);
        return delegation;
    }

    /**
     * @return false 表示该委托本就不存在
     */
    public boolean revoke(String approverAddress, String approvedAddress, long timestampMillis, String signature) {
        String approver = requireAddress(approverAddress, "approver");
        String approved = requireAddress(approvedAddress, "approved");
        String sig = requireHex(signature, "signature");
        byte[] digest = RelayMessages.delegationAttestationDigest(approver, approved, 0L, timestampMillis);
        String signer = authorizationService.verifyAttestation(approver, timestampMillis, sig, digest);

        boolean removed = delegationRepository.delete(approver, approved);
        log.info("[relay] 委托撤销, approver={}, approved={}, removed={}, signer={}", approver, approved, removed, signer);
        return removed;
    }

    /**
     * 授予给该 profile 的委托（它是 approved 一方）。
     */
    public List<Delegation> listGrantedTo(String profileAddress) {
        return delegationRepository.findGrantedTo(requireAddress(profileAddress, "address"));
    }

    /**
     * 该 profile 授予出去的委托（它是 approver 一方）。
     */
    public List<Delegation> listGrantedBy(String profileAddress) {
        return delegationRepository.findGrantedBy(requireAddress(profileAddress, "address"));
    }
}
