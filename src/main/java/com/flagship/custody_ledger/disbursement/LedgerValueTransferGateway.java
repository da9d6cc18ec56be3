package com.flagship.custody_ledger.disbursement;

import com.flagship.custody_ledger.bookkeeping.Account;
import com.flagship.custody_ledger.bookkeeping.AccountService;
import com.flagship.custody_ledger.bookkeeping.BookkeepingService;
import com.flagship.custody_ledger.bookkeeping.TransactionRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Default gateway: value moves between accounts of the internal double-entry books.
 *
 * Each hosted ledger has one custody account; each principal has one wallet.
 * Postings join the caller's transaction, so a rolled back operation leaves the
 * books untouched.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerValueTransferGateway implements ValueTransferGateway {

    private final AccountService accountService;
    private final BookkeepingService bookkeepingService;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public TransferResult receive(UUID ledgerId, String payer, BigDecimal amount, String memo) {
        Account custody = custodyAccount(ledgerId);
        Account wallet = walletAccount(payer);

        UUID transactionId = bookkeepingService.post(
                TransactionRequest.transfer(memo, custody.getId(), wallet.getId(), amount));

        log.debug("Received {} from {} into {}: tx={}", amount, payer, custody.getAccountNumber(), transactionId);
        return TransferResult.succeeded(transactionId);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public TransferResult transfer(UUID ledgerId, String recipient, BigDecimal amount, String memo) {
        Account custody = custodyAccount(ledgerId);
        BigDecimal held = bookkeepingService.balanceOf(custody);
        if (held.compareTo(amount) < 0) {
            return TransferResult.failed(String.format(
                    "custody account %s holds %s, cannot send %s", custody.getAccountNumber(), held, amount));
        }

        Account wallet = walletAccount(recipient);
        UUID transactionId = bookkeepingService.post(
                TransactionRequest.transfer(memo, wallet.getId(), custody.getId(), amount));

        log.debug("Sent {} from {} to {}: tx={}", amount, custody.getAccountNumber(), recipient, transactionId);
        return TransferResult.succeeded(transactionId);
    }

    @Override
    public BigDecimal custodyBalance(UUID ledgerId) {
        return accountService.findByNumber(Account.custodyAccountNumber(ledgerId))
                .map(bookkeepingService::balanceOf)
                .orElse(BigDecimal.ZERO);
    }

    private Account custodyAccount(UUID ledgerId) {
        return accountService.findOrCreate(Account.custodyAccountNumber(ledgerId), Account.AccountType.ASSET);
    }

    private Account walletAccount(String principal) {
        return accountService.findOrCreate(Account.walletAccountNumber(principal), Account.AccountType.LIABILITY);
    }
}
