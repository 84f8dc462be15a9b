package com.work.relay.app.web;

import com.work.relay.app.web.dto.DelegationListResponse;
import com.work.relay.app.web.dto.DelegationRequest;
import com.work.relay.app.web.dto.DelegationView;
import com.work.relay.core.model.Delegation;
import com.work.relay.core.service.DelegationService;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 委托管理接口：授予/撤销由 approver 的 signer 签名，查询无需签名。
 */
@RestController
@RequestMapping("/api/v1/delegations")
public class DelegationController {

    private final DelegationService delegationService;

    public DelegationController(DelegationService delegationService) {
        this.delegationService = delegationService;
    }

    @PostMapping
    public ResponseEntity<DelegationView> grant(@Validated @RequestBody DelegationRequest request) {
        if (request.getMonthlyAllowance() == null) {
            throw new IllegalArgumentException("monthlyAllowance must be present");
        }
        Delegation delegation = delegationService.grant(request.getApprover(), request.getApproved(),
                request.getMonthlyAllowance(), request.getTimestamp(), request.getSignature());
        return ResponseEntity.ok(DelegationView.from(delegation));
    }

    @DeleteMapping
    public ResponseEntity<Void> revoke(@Validated @RequestBody DelegationRequest request) {
        boolean removed = delegationService.revoke(request.getApprover(), request.getApproved(),
                request.getTimestamp(), request.getSignature());
        return removed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @GetMapping("/{address}")
    public ResponseEntity<DelegationListResponse> list(@PathVariable String address) {
        return ResponseEntity.ok(new DelegationListResponse(
                toViews(delegationService.listGrantedTo(address)),
                toViews(delegationService.listGrantedBy(address))));
    }

    private static List<DelegationView> toViews(List<Delegation> delegations) {
        return delegations.stream().map(DelegationView::from).collect(Collectors.toList());
    }
}
