package com.work.relay.core.service;

import com.work.relay.core.chain.PermissionChecker;
import com.work.relay.core.chain.SignatureVerifier;
import com.work.relay.core.config.RelayConfig;
import com.work.relay.core.exception.UnauthorizedException;
import com.work.relay.core.support.RelayMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;

import static com.work.relay.core.support.ValidationUtils.requireNonNull;

/**
 * 授权检查：恢复 signer，再询问外部权限谓词。必须在任何扣费/落库之前通过。
 */
@Service
public class AuthorizationService {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationService.class);

    private final SignatureVerifier signatureVerifier;
    private final PermissionChecker permissionChecker;
    private final RelayConfig config;
    private final Clock clock;

    public AuthorizationService(SignatureVerifier signatureVerifier,
                                PermissionChecker permissionChecker,
                                RelayConfig config,
                                Clock clock) {
        this.signatureVerifier = requireNonNull(signatureVerifier, "signatureVerifier");
        this.permissionChecker = requireNonNull(permissionChecker, "permissionChecker");
        this.config = requireNonNull(config, "config");
        this.clock = requireNonNull(clock, "clock");
    }

    /**
     * 校验 executeRelayCall 的签名，返回有权限的 signer 地址。
     */
    public String authorizeRelayCall(String profile, String keyManager, BigInteger callNonce,
                                     String callData, String signature) {
        byte[] digest = RelayMessages.relayCallDigest(config.getChainId(), keyManager, callNonce, callData);
        String signer = signatureVerifier.recoverSigner(digest, signature);
        return requirePermission(profile, signer);
    }

    /**
     * 校验带时间戳的自签名（查询额度、管理委托）。
     * <p>
     * 时间戳超出窗口直接拒绝，不看签名是否有效。
     */
    public String verifyAttestation(String profile, long timestampMillis, String signature, byte[] digest) {
        requireFresh(timestampMillis);
        String signer = signatureVerifier.recoverSigner(digest, signature);
        return requirePermission(profile, signer);
    }

    void requireFresh(long timestampMillis) {
        long skew = clock.millis() - timestampMillis;
        long window = config.getAttestationWindow().toMillis();
        if (skew > window || skew < -window) {
            throw new IllegalArgumentException("timestamp must be +/- " + window + " ms");
        }
    }

    private String requirePermission(String profile, String signer) {
        if (!permissionChecker.hasPermission(profile, signer)) {
            log.warn("[relay] signer 无执行权限, profile={}, signer={}", profile, signer);
            throw new UnauthorizedException("signer " + signer + " 无 profile " + profile + " 的执行权限");
        }
        return signer;
    }
}
