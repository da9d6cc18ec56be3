package com.flagship.custody_ledger.treasury;

import com.flagship.custody_ledger.access.AccessControlService;
import com.flagship.custody_ledger.access.LedgerInstance;
import com.flagship.custody_ledger.error.CustodyRejectedException;
import com.flagship.custody_ledger.identity.CallerContext;
import com.flagship.custody_ledger.observability.OperationObserver;
import com.flagship.custody_ledger.record.CustodyEngine;
import com.flagship.custody_ledger.record.CustodyRecord;
import com.flagship.custody_ledger.record.RecordView;
import com.flagship.custody_ledger.store.RecordStore;
import com.flagship.custody_ledger.treasury.dto.TreasuryBalanceResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.UUID;

/**
 * Shared treasury: anyone deposits into the pool, the owner and members withdraw
 * with a stated reason.
 */
@Service
@RequiredArgsConstructor
public class TreasuryService {

    private final CustodyEngine engine;
    private final AccessControlService accessControl;
    private final RecordStore recordStore;
    private final OperationObserver observer;
    private final Clock clock;

    public RecordView deposit(UUID ledgerId, CallerContext caller, String note) {
        return observer.observe("treasury.deposit", ledgerId, CustodyEngine.POOL_KEY,
                () -> RecordView.of(engine.deposit(ledgerId, caller, note), clock.instant()));
    }

    public RecordView withdraw(UUID ledgerId, CallerContext caller, String recipient,
                               BigDecimal amount, String reason) {
        return observer.observe("treasury.withdraw", ledgerId, CustodyEngine.POOL_KEY,
                () -> RecordView.of(engine.withdraw(ledgerId, caller, recipient, amount, reason), clock.instant()));
    }

    @Transactional(readOnly = true, noRollbackFor = CustodyRejectedException.class)
    public TreasuryBalanceResponse balance(UUID ledgerId) {
        LedgerInstance ledger = accessControl.getLedger(ledgerId);
        BigDecimal balance = recordStore.find(ledgerId, CustodyEngine.POOL_KEY)
                .map(CustodyRecord::getValue)
                .orElse(BigDecimal.ZERO);
        return TreasuryBalanceResponse.builder()
                .ledgerId(ledgerId)
                .owner(ledger.getOwner())
                .members(accessControl.members(ledgerId))
                .balance(balance)
                .build();
    }
}
