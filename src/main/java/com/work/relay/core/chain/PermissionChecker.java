package com.work.relay.core.chain;

/**
 * 外部权限判定：signer 能否代表 profile 执行调用。
 */
public interface PermissionChecker {

    boolean hasPermission(String profileAddress, String signerAddress);
}
