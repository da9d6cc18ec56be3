package com.flagship.custody_ledger.access;

import com.flagship.custody_ledger.access.dto.LedgerResponse;
import com.flagship.custody_ledger.access.dto.OpenLedgerRequest;
import com.flagship.custody_ledger.access.dto.PrincipalRequest;
import com.flagship.custody_ledger.disbursement.DisbursementService;
import com.flagship.custody_ledger.disbursement.ReconciliationReport;
import com.flagship.custody_ledger.identity.CallerContext;
import com.flagship.custody_ledger.record.CustodyEngine;
import com.flagship.custody_ledger.store.HistoryPage;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Ledger lifecycle, membership and the audit surface shared by every ledger kind.
 */
@RestController
@RequestMapping("/api/ledgers")
@RequiredArgsConstructor
public class LedgerController {

    private final AccessControlService accessControl;
    private final CustodyEngine engine;
    private final DisbursementService disbursement;

    @PostMapping
    public ResponseEntity<LedgerResponse> openLedger(
            @RequestHeader(CallerContext.CALLER_HEADER) String callerId,
            @Valid @RequestBody OpenLedgerRequest request) {
        LedgerInstance ledger = accessControl.openLedger(CallerContext.of(callerId), request.getKind(),
                request.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(LedgerResponse.from(ledger, List.of()));
    }

    @GetMapping("/{ledgerId}")
    public ResponseEntity<LedgerResponse> getLedger(@PathVariable("ledgerId") UUID ledgerId) {
        LedgerInstance ledger = accessControl.getLedger(ledgerId);
        return ResponseEntity.ok(LedgerResponse.from(ledger, accessControl.members(ledgerId)));
    }

    @GetMapping("/{ledgerId}/members")
    public ResponseEntity<List<String>> members(@PathVariable("ledgerId") UUID ledgerId) {
        return ResponseEntity.ok(accessControl.members(ledgerId));
    }

    @GetMapping("/{ledgerId}/members/{principal}")
    public ResponseEntity<Map<String, Object>> membership(@PathVariable("ledgerId") UUID ledgerId,
                                                          @PathVariable("principal") String principal) {
        return ResponseEntity.ok(Map.of(
                "principal", principal,
                "member", accessControl.isMember(ledgerId, principal)));
    }

    @PostMapping("/{ledgerId}/members")
    public ResponseEntity<List<String>> addMember(
            @PathVariable("ledgerId") UUID ledgerId,
            @RequestHeader(CallerContext.CALLER_HEADER) String callerId,
            @Valid @RequestBody PrincipalRequest request) {
        accessControl.addMember(ledgerId, CallerContext.of(callerId), request.getPrincipal());
        return ResponseEntity.status(HttpStatus.CREATED).body(accessControl.members(ledgerId));
    }

    @DeleteMapping("/{ledgerId}/members/{principal}")
    public ResponseEntity<List<String>> removeMember(
            @PathVariable("ledgerId") UUID ledgerId,
            @PathVariable("principal") String principal,
            @RequestHeader(CallerContext.CALLER_HEADER) String callerId) {
        accessControl.removeMember(ledgerId, CallerContext.of(callerId), principal);
        return ResponseEntity.ok(accessControl.members(ledgerId));
    }

    @PutMapping("/{ledgerId}/owner")
    public ResponseEntity<LedgerResponse> transferOwnership(
            @PathVariable("ledgerId") UUID ledgerId,
            @RequestHeader(CallerContext.CALLER_HEADER) String callerId,
            @Valid @RequestBody PrincipalRequest request) {
        LedgerInstance ledger = accessControl.transferOwnership(ledgerId, CallerContext.of(callerId),
                request.getPrincipal());
        return ResponseEntity.ok(LedgerResponse.from(ledger, accessControl.members(ledgerId)));
    }

    /**
     * Most recent history first. Pass {@code next_cursor} from the previous page as
     * {@code before} to continue.
     */
    @GetMapping("/{ledgerId}/history")
    public ResponseEntity<HistoryPage> history(
            @PathVariable("ledgerId") UUID ledgerId,
            @RequestParam(value = "limit", defaultValue = "20") int limit,
            @RequestParam(value = "before", required = false) Long before) {
        return ResponseEntity.ok(engine.historyPage(ledgerId, before, limit));
    }

    @GetMapping("/{ledgerId}/reconciliation")
    public ResponseEntity<ReconciliationReport> reconcile(@PathVariable("ledgerId") UUID ledgerId) {
        accessControl.getLedger(ledgerId);
        return ResponseEntity.ok(disbursement.reconcile(ledgerId));
    }
}
