package com.bftchain.engine;

import com.bftchain.state.Step;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Step timeouts. Each grows linearly with the round so that, once enough
 * validators are in sync, some round is long enough to finish.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ConsensusConfig {
    private long timeoutProposeMs = 3000;
    private long timeoutProposeDeltaMs = 500;
    private long timeoutPrevoteMs = 1000;
    private long timeoutPrevoteDeltaMs = 500;
    private long timeoutPrecommitMs = 1000;
    private long timeoutPrecommitDeltaMs = 500;
    // pause after a commit so late precommits and new transactions can arrive
    private long timeoutCommitMs = 1000;
    private long maxTimeoutMs = 60_000;

    public long timeoutFor(Step step, int round) {
        long base;
        long delta;
        switch (step) {
            case PROPOSE:
                base = timeoutProposeMs;
                delta = timeoutProposeDeltaMs;
                break;
            case PREVOTE:
                base = timeoutPrevoteMs;
                delta = timeoutPrevoteDeltaMs;
                break;
            case PRECOMMIT:
                base = timeoutPrecommitMs;
                delta = timeoutPrecommitDeltaMs;
                break;
            case NEW_HEIGHT:
                return timeoutCommitMs;
            default:
                throw new IllegalArgumentException("No timeout for step " + step);
        }
        long timeout = base + delta * Math.max(round, 0);
        return Math.min(timeout, Math.max(maxTimeoutMs, base));
    }

    /**
     * Short timeouts for tests and in-process clusters
     */
    public static ConsensusConfig fast() {
        return new ConsensusConfig(200, 50, 100, 50, 100, 50, 20, 5_000);
    }
}
