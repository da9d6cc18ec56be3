package com.flagship.custody_ledger.giftcard;

import com.flagship.custody_ledger.identity.CallerContext;
import com.flagship.custody_ledger.observability.OperationObserver;
import com.flagship.custody_ledger.record.Commitments;
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
 * Hash-locked gift cards. A card is keyed by the SHA-256 commitment of a secret;
 * whoever presents the secret collects the value. A named beneficiary can also
 * collect without the secret, and the sender can take back an unredeemed card.
 * The beneficiary can hand the card on. The ledger owner can void a card; its
 * value then stays in custody and nobody is paid.
 */
@Service
@RequiredArgsConstructor
public class GiftCardService {

    private final CustodyEngine engine;
    private final OperationObserver observer;
    private final Clock clock;

    public RecordView issue(UUID ledgerId, CallerContext caller, String commitment, String beneficiary,
                            Long expiresInSeconds, String message) {
        String key = Commitments.normalize(commitment);
        return observer.observe("giftcard.issue", ledgerId, key, () -> {
            Instant now = clock.instant();
            NewRecord request = NewRecord.builder()
                    .key(key)
                    .kind(RecordKind.GIFT_CARD)
                    .beneficiary(beneficiary == null || beneficiary.isBlank() ? null : beneficiary.trim())
                    .value(caller.getAttachedValue())
                    .payload(message)
                    .expiresAt(expiresInSeconds == null ? null : now.plus(Duration.ofSeconds(expiresInSeconds)))
                    .build();
            return RecordView.of(engine.create(ledgerId, caller, request), now);
        });
    }

    public RecordView inspect(UUID ledgerId, String commitment) {
        return engine.inspect(ledgerId, Commitments.normalize(commitment));
    }

    public RecordView redeemWithSecret(UUID ledgerId, CallerContext caller, String secret, String message) {
        return observer.observe("giftcard.redeem", ledgerId, null,
                () -> RecordView.of(engine.redeemBySecret(ledgerId, caller, secret, message), clock.instant()));
    }

    public RecordView redeemAsBeneficiary(UUID ledgerId, CallerContext caller, String commitment, String message) {
        String key = Commitments.normalize(commitment);
        return observer.observe("giftcard.claim", ledgerId, key,
                () -> RecordView.of(engine.redeemAsBeneficiary(ledgerId, caller, key, message), clock.instant()));
    }

    public RecordView cancel(UUID ledgerId, CallerContext caller, String commitment) {
        String key = Commitments.normalize(commitment);
        return observer.observe("giftcard.cancel", ledgerId, key,
                () -> RecordView.of(engine.cancel(ledgerId, caller, key), clock.instant()));
    }

    public RecordView transfer(UUID ledgerId, CallerContext caller, String commitment, String newBeneficiary) {
        String key = Commitments.normalize(commitment);
        return observer.observe("giftcard.transfer", ledgerId, key,
                () -> RecordView.of(engine.transfer(ledgerId, caller, key, newBeneficiary), clock.instant()));
    }

    public RecordView voidCard(UUID ledgerId, CallerContext caller, String commitment, String reason) {
        String key = Commitments.normalize(commitment);
        return observer.observe("giftcard.void", ledgerId, key,
                () -> RecordView.of(engine.voidRecord(ledgerId, caller, key, reason), clock.instant()));
    }
}
