package com.flagship.custody_ledger.warranty;

import com.flagship.custody_ledger.error.CustodyRejectedException;
import com.flagship.custody_ledger.identity.CallerContext;
import com.flagship.custody_ledger.observability.OperationObserver;
import com.flagship.custody_ledger.record.CustodyEngine;
import com.flagship.custody_ledger.record.NewRecord;
import com.flagship.custody_ledger.record.RecordKind;
import com.flagship.custody_ledger.record.RecordView;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Warranty registry: the owner registers warranties, holders pass them on,
 * and the owner voids tampered ones. Warranties carry no value.
 */
@Service
@RequiredArgsConstructor
public class WarrantyService {

    private final CustodyEngine engine;
    private final OperationObserver observer;
    private final Clock clock;

    public RecordView register(UUID ledgerId, CallerContext caller, String serialNumber,
                               String holder, long durationDays, String productDetails) {
        return observer.observe("warranty.register", ledgerId, serialNumber, () -> {
            if (durationDays <= 0) {
                throw CustodyRejectedException.invalidInput("Duration must be positive");
            }
            Instant now = clock.instant();
            NewRecord request = NewRecord.builder()
                    .key(serialNumber)
                    .kind(RecordKind.WARRANTY)
                    .beneficiary(holder)
                    .payload(productDetails)
                    .expiresAt(now.plus(Duration.ofDays(durationDays)))
                    .build();
            return RecordView.of(engine.create(ledgerId, caller, request), now);
        });
    }

    public RecordView inspect(UUID ledgerId, String serialNumber) {
        return engine.inspect(ledgerId, serialNumber);
    }

    public RecordView transfer(UUID ledgerId, CallerContext caller, String serialNumber, String newHolder) {
        return observer.observe("warranty.transfer", ledgerId, serialNumber,
                () -> RecordView.of(engine.transfer(ledgerId, caller, serialNumber, newHolder), clock.instant()));
    }

    public RecordView voidWarranty(UUID ledgerId, CallerContext caller, String serialNumber, String reason) {
        return observer.observe("warranty.void", ledgerId, serialNumber,
                () -> RecordView.of(engine.voidRecord(ledgerId, caller, serialNumber, reason), clock.instant()));
    }
}
