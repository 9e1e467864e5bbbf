package com.bftchain.store;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.bftchain.model.Vote;
import com.bftchain.validator.ValidatorSet;

/**
 * Votes of one type for one (height, round). Keeps at most one vote per
 * validator and the power behind every candidate block, so quorum checks do
 * not depend on the order votes arrived in.
 */
class VoteSet {
    // nil votes are tallied under this key, block ids are hex and never empty
    private static final String NIL_KEY = "";

    private final ValidatorSet validatorSet;
    private final Map<String, Vote> votesByValidator = new HashMap<>();
    private final Map<String, Long> powerByBlock = new HashMap<>();
    private long totalPower;

    VoteSet(ValidatorSet validatorSet) {
        this.validatorSet = validatorSet;
    }

    /**
     * @return previous vote of the same validator, or null
     */
    Vote put(Vote vote) {
        long power = validatorSet.getPower(vote.getValidatorId());
        Vote previous = votesByValidator.put(vote.getValidatorId(), vote);
        if (previous != null) {
            powerByBlock.merge(key(previous.getBlockId()), -power, Long::sum);
            totalPower -= power;
        }
        powerByBlock.merge(key(vote.getBlockId()), power, Long::sum);
        totalPower += power;
        return previous;
    }

    long powerFor(String blockId) {
        return powerByBlock.getOrDefault(key(blockId), 0L);
    }

    long totalPower() {
        return totalPower;
    }

    Set<String> voters() {
        return Collections.unmodifiableSet(votesByValidator.keySet());
    }

    Set<Vote> votes() {
        return new HashSet<>(votesByValidator.values());
    }

    /**
     * The single block (or nil) holding a quorum. With more than two thirds
     * required there can be at most one.
     */
    Optional<Majority> twoThirdsMajority() {
        for (Map.Entry<String, Long> entry : powerByBlock.entrySet()) {
            if (validatorSet.hasQuorum(entry.getValue())) {
                String blockId = NIL_KEY.equals(entry.getKey()) ? null : entry.getKey();
                return Optional.of(new Majority(blockId, entry.getValue()));
            }
        }
        return Optional.empty();
    }

    private static String key(String blockId) {
        return blockId == null ? NIL_KEY : blockId;
    }
}
