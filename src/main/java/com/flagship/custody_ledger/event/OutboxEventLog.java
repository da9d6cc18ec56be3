package com.flagship.custody_ledger.event;

import com.flagship.custody_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Event log backed by the transactional outbox.
 */
@Component
@RequiredArgsConstructor
public class OutboxEventLog implements EventLog {

    private final OutboxService outboxService;

    @Override
    public void emit(LedgerEvent event) {
        outboxService.saveEvent(event.getEventId(), event.getLedgerId(), event.getRecordKey(),
                event.getEventKind().name(), event);
    }
}
