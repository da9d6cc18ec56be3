package com.flagship.custody_ledger.event;

import com.flagship.custody_ledger.store.HistoryEntry;
import com.flagship.custody_ledger.store.HistoryLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Records a committed transition twice: as a history entry for the audit trail
 * and as an event for observers. Both carry the same instant and the same facts.
 *
 * Called last in every operation, after effects and any payout, so a rollback
 * discards both.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransitionJournal {

    private final HistoryLog historyLog;
    private final EventLog eventLog;
    private final Clock clock;

    public HistoryEntry record(UUID ledgerId, String recordKey, EventKind kind,
                               String actor, String counterparty, BigDecimal amount, String reason) {
        Instant now = clock.instant();

        HistoryEntry entry = historyLog.append(HistoryEntry.builder()
                .ledgerId(ledgerId)
                .recordKey(recordKey)
                .action(kind)
                .actor(actor)
                .counterparty(counterparty)
                .amount(amount)
                .reason(reason)
                .occurredAt(now)
                .build());

        List<String> principals = new ArrayList<>();
        principals.add(actor);
        if (counterparty != null && !counterparty.equals(actor)) {
            principals.add(counterparty);
        }

        eventLog.emit(LedgerEvent.builder()
                .eventId(UUID.randomUUID())
                .eventKind(kind)
                .ledgerId(ledgerId)
                .recordKey(recordKey)
                .principals(List.copyOf(principals))
                .amount(amount)
                .reason(reason)
                .occurredAt(now)
                .build());

        log.debug("Journaled {} on {}/{} (sequence {})", kind, ledgerId, recordKey, entry.getSequence());
        return entry;
    }
}
