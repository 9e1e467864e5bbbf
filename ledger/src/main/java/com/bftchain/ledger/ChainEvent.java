package com.bftchain.ledger;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class ChainEvent {
    private final long height;
    private final String blockId;
    private final String previousBlockId;
    private final int transactionCount;
    private final long timestamp;

    public ChainEvent(long height, String blockId, String previousBlockId, int transactionCount) {
        this.height = height;
        this.blockId = blockId;
        this.previousBlockId = previousBlockId;
        this.transactionCount = transactionCount;
        this.timestamp = System.currentTimeMillis();
    }
}
