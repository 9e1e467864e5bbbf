package com.bftchain.model;

import java.util.ArrayList;
import java.util.List;

import com.bftchain.crypto.CanonicalEncoding;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Block payload agreed on by consensus. The block id is the hex SHA-256 of
 * the canonical encoding of every other field.
 */
@Data
@NoArgsConstructor
public class Block {
    private long height;
    private String previousBlockId;
    private String proposerId;
    private long timestamp;
    private List<String> transactions = new ArrayList<>();
    private String blockId;

    public Block(long height, String previousBlockId, String proposerId, long timestamp, List<String> transactions) {
        this.height = height;
        this.previousBlockId = previousBlockId;
        this.proposerId = proposerId;
        this.timestamp = timestamp;
        this.transactions = new ArrayList<>(transactions);
        this.blockId = computeBlockId();
    }

    public String computeBlockId() {
        return CanonicalEncoding.sha256Hex(CanonicalEncoding.encodeBlock(this));
    }

    /**
     * @return true if the stored id matches the content
     */
    public boolean hasValidId() {
        return blockId != null && blockId.equals(computeBlockId());
    }

    @Override
    public String toString() {
        return "Block [height=" + height + ", id=" + blockId + ", previous=" + previousBlockId + ", proposer="
                + proposerId + ", txs=" + (transactions == null ? 0 : transactions.size()) + "]";
    }
}
