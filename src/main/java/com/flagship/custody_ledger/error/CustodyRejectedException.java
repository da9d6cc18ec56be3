package com.flagship.custody_ledger.error;

/**
 * Raised when an operation is refused by a precondition check.
 *
 * Rejections are always raised before the operation writes anything, so the
 * surrounding transaction is not marked rollback-only for them. A rejected
 * reentrant call leaves the outer payout intact.
 */
public class CustodyRejectedException extends RuntimeException {

    private final CustodyError error;

    public CustodyRejectedException(CustodyError error, String message) {
        super(message);
        if (error == CustodyError.TRANSFER_FAILED) {
            throw new IllegalArgumentException("Transfer failures are reported with TransferFailedException");
        }
        this.error = error;
    }

    public CustodyError getError() {
        return error;
    }

    public static CustodyRejectedException unauthorized(String message) {
        return new CustodyRejectedException(CustodyError.UNAUTHORIZED, message);
    }

    public static CustodyRejectedException alreadyExists(String message) {
        return new CustodyRejectedException(CustodyError.ALREADY_EXISTS, message);
    }

    public static CustodyRejectedException notFound(String message) {
        return new CustodyRejectedException(CustodyError.NOT_FOUND, message);
    }

    public static CustodyRejectedException invalidInput(String message) {
        return new CustodyRejectedException(CustodyError.INVALID_INPUT, message);
    }

    public static CustodyRejectedException invalidState(String message) {
        return new CustodyRejectedException(CustodyError.INVALID_STATE, message);
    }

    public static CustodyRejectedException expired(String message) {
        return new CustodyRejectedException(CustodyError.EXPIRED, message);
    }

    public static CustodyRejectedException capacityExceeded(String message) {
        return new CustodyRejectedException(CustodyError.CAPACITY_EXCEEDED, message);
    }
}
