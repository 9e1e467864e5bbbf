package com.bftchain.ledger;

import java.nio.charset.StandardCharsets;

import com.bftchain.crypto.CanonicalEncoding;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Opaque client payload. Two transactions with the same payload are the same
 * transaction.
 */
@Getter
@ToString
@EqualsAndHashCode(of = "id")
public class Transaction {
    private final String id;
    private final String payload;
    private final long receivedAt;

    public Transaction(String payload) {
        this(payload, System.currentTimeMillis());
    }

    public Transaction(String payload, long receivedAt) {
        if (payload == null || payload.isEmpty()) {
            throw new IllegalArgumentException("Transaction payload cannot be empty");
        }
        this.id = idOf(payload);
        this.payload = payload;
        this.receivedAt = receivedAt;
    }

    public static String idOf(String payload) {
        return CanonicalEncoding.sha256Hex(payload.getBytes(StandardCharsets.UTF_8));
    }
}
