package com.bftchain.validator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.bftchain.model.Vote;

import lombok.EqualsAndHashCode;

/**
 * Voting power of every validator for one height.
 * <p>
 * Immutable. Validators are enumerated in lexicographic order of their
 * identity, which is what proposer selection indexes into, so every node
 * holding the same set picks the same proposer.
 */
@EqualsAndHashCode(of = "validators")
public final class ValidatorSet {
    private final TreeMap<String, Long> validators;
    private final List<String> orderedIds;
    private final long totalPower;

    public ValidatorSet(Map<String, Long> validators) {
        if (validators == null || validators.isEmpty()) {
            throw new IllegalArgumentException("Validator set must not be empty");
        }
        TreeMap<String, Long> sorted = new TreeMap<>();
        long total = 0;
        for (Map.Entry<String, Long> entry : validators.entrySet()) {
            String id = entry.getKey();
            Long power = entry.getValue();
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Validator id must not be blank");
            }
            if (!isValidId(id)) {
                throw new IllegalArgumentException("Validator id '" + id
                        + "' must not contain whitespace, control characters, ',' or '='");
            }
            if (power == null || power <= 0) {
                throw new IllegalArgumentException("Voting power of " + id + " must be positive, got " + power);
            }
            sorted.put(id, power);
            total = Math.addExact(total, power);
        }
        this.validators = sorted;
        this.orderedIds = Collections.unmodifiableList(new ArrayList<>(sorted.keySet()));
        this.totalPower = total;
    }

    /**
     * Convenience factory giving every validator the same power.
     */
    public static ValidatorSet ofEqualPower(Collection<String> ids, long power) {
        Map<String, Long> map = new TreeMap<>();
        for (String id : ids) {
            map.put(id, power);
        }
        return new ValidatorSet(map);
    }

    // ids are stored as comma separated id:power pairs in the state file
    private static boolean isValidId(String id) {
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            if (c == ',' || c == '=' || Character.isWhitespace(c) || Character.isISOControl(c)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Round-robin proposer: index {@code (height + round) mod N} over the
     * sorted validator list.
     */
    public String getProposer(long height, int round) {
        if (height < 0 || round < 0) {
            throw new IllegalArgumentException("height and round must be non-negative");
        }
        int index = (int) Math.floorMod(height + round, (long) orderedIds.size());
        return orderedIds.get(index);
    }

    /**
     * True iff the votes, counting one vote per known validator, carry
     * strictly more than two thirds of the total power. The caller is expected
     * to pass votes for a single block.
     */
    public boolean hasQuorum(Collection<Vote> votes) {
        Set<String> counted = new HashSet<>();
        long power = 0;
        for (Vote vote : votes) {
            String id = vote.getValidatorId();
            if (contains(id) && counted.add(id)) {
                power += validators.get(id);
            }
        }
        return hasQuorum(power);
    }

    public boolean hasQuorum(long power) {
        return power * 3 > totalPower * 2;
    }

    /**
     * More than one third of the power: at least one honest validator is
     * among the holders.
     */
    public boolean hasOneThirdPlus(long power) {
        return power * 3 > totalPower;
    }

    public boolean contains(String validatorId) {
        return validatorId != null && validators.containsKey(validatorId);
    }

    /**
     * @return the voting power of the validator, or 0 if unknown
     */
    public long getPower(String validatorId) {
        if (validatorId == null) {
            return 0;
        }
        Long power = validators.get(validatorId);
        return power != null ? power : 0;
    }

    public long getTotalPower() {
        return totalPower;
    }

    public int size() {
        return orderedIds.size();
    }

    public List<String> getValidatorIds() {
        return orderedIds;
    }

    public Map<String, Long> asMap() {
        return Collections.unmodifiableMap(validators);
    }

    @Override
    public String toString() {
        return "ValidatorSet " + validators + " total=" + totalPower;
    }
}
