package com.flagship.custody_ledger.observability;

import com.flagship.custody_ledger.error.CustodyRejectedException;
import com.flagship.custody_ledger.error.TransferFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Wraps a custody operation with MDC context, logging and metrics.
 *
 * Rejections log at warn, transfer failures and unexpected errors at error.
 * MDC values present before the call are restored afterwards, so a reentrant
 * operation does not clobber the context of the one it runs inside.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OperationObserver {

    private final CustodyMetrics metrics;

    public <T> T observe(String operation, UUID ledgerId, String recordKey, Supplier<T> action) {
        long startTime = System.currentTimeMillis();
        String previousLedger = MDC.get(CorrelationContext.LEDGER_ID_MDC_KEY);
        String previousKey = MDC.get(CorrelationContext.RECORD_KEY_MDC_KEY);
        putOrRemove(CorrelationContext.LEDGER_ID_MDC_KEY, ledgerId != null ? ledgerId.toString() : null);
        putOrRemove(CorrelationContext.RECORD_KEY_MDC_KEY, recordKey);

        try {
            T result = action.get();
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(operation, "success");
            log.info("{} completed: duration={}ms", operation, duration);
            return result;

        } catch (CustodyRejectedException e) {
            metrics.recordOperation(operation, e.getError().name().toLowerCase(Locale.ROOT));
            log.warn("{} rejected: error={}, message={}", operation, e.getError(), e.getMessage());
            throw e;
        } catch (TransferFailedException e) {
            metrics.recordOperation(operation, "transfer_failed");
            log.error("{} rolled back, transfer failed: recipient={}, amount={}, message={}",
                    operation, e.getRecipient(), e.getAmount(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordOperation(operation, "error");
            log.error("{} failed: error={}", operation, e.getMessage(), e);
            throw e;
        } finally {
            metrics.recordLatency(operation, Duration.ofMillis(System.currentTimeMillis() - startTime));
            putOrRemove(CorrelationContext.LEDGER_ID_MDC_KEY, previousLedger);
            putOrRemove(CorrelationContext.RECORD_KEY_MDC_KEY, previousKey);
        }
    }

    private static void putOrRemove(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
