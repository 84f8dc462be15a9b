package com.work.relay.app.web.dto;

import java.util.List;

/**
 * grantedTo：别人授予给该 profile 的委托；grantedBy：该 profile 授予出去的委托。
 */
public class DelegationListResponse {

    private final List<DelegationView> grantedTo;
    private final List<DelegationView> grantedBy;

    public DelegationListResponse(List<DelegationView> grantedTo, List<DelegationView> grantedBy) {
        this.grantedTo = grantedTo;
        this.grantedBy = grantedBy;
    }

    public List<DelegationView> getGrantedTo() {
        return grantedTo;
    }

    public List<DelegationView> getGrantedBy() {
        return grantedBy;
    }
}
