package com.bftchain.store;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import com.bftchain.crypto.CanonicalEncoding;
import com.bftchain.crypto.Signer;
import com.bftchain.model.Vote;
import com.bftchain.model.VoteType;
import com.bftchain.validator.ValidatorSet;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Signed votes of the current height and the next one.
 * <p>
 * Accepts votes for heights in {@code [currentHeight, currentHeight + 1]} so
 * early votes of the next height are not lost. Votes of a height are purged
 * once {@link #advanceTo(long, ValidatorSet)} moves past it.
 * <p>
 * Not thread safe: owned by the consensus event loop.
 */
@Slf4j
public class VoteStore {
    private final Signer signer;
    private final Map<Long, ValidatorSet> validatorSets = new HashMap<>();
    private final Map<VoteSetKey, VoteSet> voteSets = new HashMap<>();
    private long currentHeight;

    public VoteStore(Signer signer, long currentHeight, ValidatorSet validatorSet) {
        this.signer = signer;
        this.currentHeight = currentHeight;
        this.validatorSets.put(currentHeight, validatorSet);
    }

    /**
     * Adds a vote after checking signature, height window and membership.
     * A second vote of the same validator for the same (height, round, type)
     * replaces the first.
     */
    public AddVoteResult addVote(Vote vote) {
        if (vote == null || vote.getType() == null || vote.getValidatorId() == null) {
            log.debug("Rejecting malformed vote {}", vote);
            return AddVoteResult.REJECTED;
        }
        if (vote.getHeight() < currentHeight || vote.getHeight() > currentHeight + 1 || vote.getRound() < 0) {
            log.debug("Rejecting vote outside height window (current {}): {}", currentHeight, vote);
            return AddVoteResult.REJECTED;
        }
        ValidatorSet validatorSet = validatorSetFor(vote.getHeight());
        if (!validatorSet.contains(vote.getValidatorId())) {
            log.debug("Rejecting vote from unknown validator: {}", vote);
            return AddVoteResult.REJECTED;
        }
        if (!signer.verify(vote.getValidatorId(), CanonicalEncoding.encodeVote(vote), vote.getSignature())) {
            log.warn("Rejecting vote with invalid signature: {}", vote);
            return AddVoteResult.REJECTED;
        }
        VoteSetKey key = new VoteSetKey(vote.getHeight(), vote.getRound(), vote.getType());
        VoteSet voteSet = voteSets.computeIfAbsent(key, k -> new VoteSet(validatorSet));
        Vote previous = voteSet.put(vote);
        return previous == null ? AddVoteResult.ACCEPTED : AddVoteResult.REPLACED;
    }

    public Set<Vote> getVotes(long height, int round, VoteType type) {
        VoteSet voteSet = voteSets.get(new VoteSetKey(height, round, type));
        return voteSet == null ? Collections.emptySet() : voteSet.votes();
    }

    /**
     * Power of the stored votes for the given block, {@code null} meaning nil.
     */
    public long powerForBlock(long height, int round, VoteType type, String blockId) {
        VoteSet voteSet = voteSets.get(new VoteSetKey(height, round, type));
        return voteSet == null ? 0 : voteSet.powerFor(blockId);
    }

    public Optional<Majority> twoThirdsMajority(long height, int round, VoteType type) {
        VoteSet voteSet = voteSets.get(new VoteSetKey(height, round, type));
        return voteSet == null ? Optional.empty() : voteSet.twoThirdsMajority();
    }

    /**
     * True when more than two thirds of the power voted, whatever for.
     */
    public boolean hasTwoThirdsAny(long height, int round, VoteType type) {
        VoteSet voteSet = voteSets.get(new VoteSetKey(height, round, type));
        return voteSet != null && validatorSetFor(height).hasQuorum(voteSet.totalPower());
    }

    /**
     * Power of the distinct validators that sent any vote for the round.
     */
    public long votingPowerInRound(long height, int round) {
        Set<String> voters = new HashSet<>();
        for (VoteType type : VoteType.values()) {
            VoteSet voteSet = voteSets.get(new VoteSetKey(height, round, type));
            if (voteSet != null) {
                voters.addAll(voteSet.voters());
            }
        }
        ValidatorSet validatorSet = validatorSetFor(height);
        long power = 0;
        for (String voter : voters) {
            power += validatorSet.getPower(voter);
        }
        return power;
    }

    /**
     * Rounds of the given height that hold at least one vote, ascending.
     */
    public Set<Integer> roundsWithVotes(long height) {
        Set<Integer> rounds = new TreeSet<>();
        for (VoteSetKey key : voteSets.keySet()) {
            if (key.getHeight() == height) {
                rounds.add(key.getRound());
            }
        }
        return rounds;
    }

    /**
     * Moves the window to a new height. Votes below {@code height} are
     * dropped. The validator set applies from {@code height} on.
     */
    public void advanceTo(long height, ValidatorSet validatorSet) {
        if (height < currentHeight) {
            throw new IllegalArgumentException("Vote store cannot move back from " + currentHeight + " to " + height);
        }
        this.currentHeight = height;
        validatorSets.put(height, validatorSet);
        Iterator<Map.Entry<VoteSetKey, VoteSet>> it = voteSets.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<VoteSetKey, VoteSet> entry = it.next();
            VoteSetKey key = entry.getKey();
            if (key.getHeight() < height) {
                it.remove();
            } else if (key.getHeight() == height) {
                // buffered early votes were tallied against the previous set
                entry.setValue(retally(entry.getValue(), validatorSet));
            }
        }
        validatorSets.keySet().removeIf(h -> h < height);
        log.debug("Vote store advanced to height {}, {} vote sets retained", height, voteSets.size());
    }

    public long getCurrentHeight() {
        return currentHeight;
    }

    int voteSetCount() {
        return voteSets.size();
    }

    private static VoteSet retally(VoteSet buffered, ValidatorSet validatorSet) {
        VoteSet voteSet = new VoteSet(validatorSet);
        for (Vote vote : buffered.votes()) {
            if (validatorSet.contains(vote.getValidatorId())) {
                voteSet.put(vote);
            }
        }
        return voteSet;
    }

    private ValidatorSet validatorSetFor(long height) {
        ValidatorSet validatorSet = validatorSets.get(height);
        if (validatorSet == null) {
            // next height before the boundary: the current set is the best guess
            validatorSet = validatorSets.get(currentHeight);
        }
        return validatorSet;
    }

    @Value
    static class VoteSetKey {
        long height;
        int round;
        VoteType type;
    }
}
