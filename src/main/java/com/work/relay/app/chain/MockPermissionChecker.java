package com.work.relay.app.chain;

import com.work.relay.core.chain.PermissionChecker;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * mock 模式的权限谓词：未配置白名单时放行所有 signer。
 */
public class MockPermissionChecker implements PermissionChecker {

    private final Set<String> allowedSigners = new HashSet<>();

    public MockPermissionChecker(Collection<String> allowedSigners) {
        if (allowedSigners != null) {
            for (String signer : allowedSigners) {
                this.allowedSigners.add(signer.toLowerCase(Locale.ROOT));
            }
        }
    }

    @Override
    public boolean hasPermission(String profileAddress, String signerAddress) {
        return allowedSigners.isEmpty() || allowedSigners.contains(signerAddress.toLowerCase(Locale.ROOT));
    }
}
