package com.work.relay.app.web;

import com.work.relay.app.web.dto.ExecuteRelayRequest;
import com.work.relay.app.web.dto.ExecuteRelayResponse;
import com.work.relay.app.web.dto.QuotaRequest;
import com.work.relay.app.web.dto.QuotaResponse;
import com.work.relay.app.web.dto.TransactionListResponse;
import com.work.relay.app.web.dto.TransactionView;
import com.work.relay.app.web.dto.UpdateStatusRequest;
import com.work.relay.core.model.RelayTransaction;
import com.work.relay.core.model.RelayTxStatus;
import com.work.relay.core.service.RelayOrchestrator;
import com.work.relay.core.service.RelayTransactionLedger;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * relay 对外接口：执行、额度查询、交易查询，以及结算通知。
 */
@RestController
@RequestMapping("/api/v1/relay")
public class RelayController {

    private final RelayOrchestrator orchestrator;
    private final RelayTransactionLedger ledger;

    public RelayController(RelayOrchestrator orchestrator, RelayTransactionLedger ledger) {
        this.orchestrator = orchestrator;
        this.ledger = ledger;
    }

    @PostMapping("/execute")
    public ResponseEntity<ExecuteRelayResponse> execute(@Validated @RequestBody ExecuteRelayRequest request) {
        ExecuteRelayRequest.SignedCall call = request.getTransaction();
        String hash = orchestrator.execute(request.getAddress(), call.getNonce(), call.getAbi(), call.getSignature());
        return ResponseEntity.ok(new ExecuteRelayResponse(hash));
    }

    @PostMapping("/quota")
    public ResponseEntity<QuotaResponse> quota(@Validated @RequestBody QuotaRequest request) {
        return ResponseEntity.ok(QuotaResponse.from(
                orchestrator.quotaStatus(request.getAddress(), request.getTimestamp(), request.getSignature())));
    }

    @GetMapping("/transactions/{address}")
    public ResponseEntity<TransactionListResponse> list(@PathVariable String address) {
        List<TransactionView> views = orchestrator.listTransactions(address).stream()
                .map(TransactionView::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(new TransactionListResponse(views));
    }

    @GetMapping("/transaction/{id}")
    public ResponseEntity<TransactionView> get(@PathVariable long id) {
        return ResponseEntity.ok(TransactionView.from(ledger.getTransaction(id)));
    }

    @PostMapping("/transaction/{id}/status")
    public ResponseEntity<TransactionView> updateStatus(@PathVariable long id,
                                                        @Validated @RequestBody UpdateStatusRequest request) {
        RelayTransaction updated = ledger.updateStatus(id, parseStatus(request.getStatus()), request.getGasUsed());
        return ResponseEntity.ok(TransactionView.from(updated));
    }

    private static RelayTxStatus parseStatus(String raw) {
        try {
            return RelayTxStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("status must be CONFIRMED or FAILED", e);
        }
    }
}
