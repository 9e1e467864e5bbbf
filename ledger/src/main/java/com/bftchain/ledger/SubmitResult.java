package com.bftchain.ledger;

/**
 * Outcome of handing a transaction to the pool.
 */
public class SubmitResult {
    private final boolean accepted;
    private final String transactionId;
    private final String error;

    private SubmitResult(boolean accepted, String transactionId, String error) {
        this.accepted = accepted;
        this.transactionId = transactionId;
        this.error = error;
    }

    public static SubmitResult accepted(String transactionId) {
        return new SubmitResult(true, transactionId, null);
    }

    public static SubmitResult rejected(String transactionId, String error) {
        return new SubmitResult(false, transactionId, error);
    }

    public boolean isAccepted() {
        return accepted;
    }

    public String getTransactionId() {
        return transactionId;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "SubmitResult [accepted=" + accepted + ", transactionId=" + transactionId + ", error=" + error + "]";
    }
}
