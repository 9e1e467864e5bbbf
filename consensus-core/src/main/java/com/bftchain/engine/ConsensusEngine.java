package com.bftchain.engine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

import com.bftchain.app.BlockApplication;
import com.bftchain.app.BlockApplicationException;
import com.bftchain.crypto.CanonicalEncoding;
import com.bftchain.crypto.Signer;
import com.bftchain.model.Block;
import com.bftchain.model.Proposal;
import com.bftchain.model.Vote;
import com.bftchain.model.VoteType;
import com.bftchain.persistence.CommitRecord;
import com.bftchain.persistence.ConsensusStateStore;
import com.bftchain.state.ConsensusState;
import com.bftchain.state.Step;
import com.bftchain.store.AddVoteResult;
import com.bftchain.store.Majority;
import com.bftchain.store.VoteStore;
import com.bftchain.timer.RoundTimer;
import com.bftchain.timer.TimeoutInfo;
import com.bftchain.transport.Transport;
import com.bftchain.validator.ValidatorSet;

import lombok.extern.slf4j.Slf4j;

/**
 * Round based consensus state machine of one validator.
 * <p>
 * Each round runs propose, prevote and precommit. A block is committed once
 * more than two thirds of the voting power precommit it. A validator that
 * precommits a block locks on it and prevotes nil for anything else at the
 * same height, until a later round shows a prevote quorum for another block.
 * <p>
 * All state is touched only from the injected executor, normally an
 * {@link com.bftchain.concurrent.EventLoop}. Transport and timer threads only
 * enqueue work. After every event the engine re-evaluates its rules until
 * none of them moves the state any further.
 */
@Slf4j
public class ConsensusEngine {
    private static final int MAX_BUFFERED_PROPOSALS = 64;

    private final String nodeId;
    private final Signer signer;
    private final Transport transport;
    private final BlockApplication application;
    private final RoundTimer timer;
    private final ConsensusStateStore stateStore;
    private final ConsensusConfig config;
    private final Executor executor;
    private final CopyOnWriteArrayList<ConsensusListener> listeners = new CopyOnWriteArrayList<>();

    private final ConsensusState state = new ConsensusState();
    private volatile ValidatorSet validatorSet;
    private ValidatorSet nextValidatorSet;
    private VoteStore voteStore;

    // accepted proposal of each round of the current height
    private final Map<Integer, Proposal> proposals = new HashMap<>();
    // proposals for height + 1 that arrived early
    private final Map<Integer, Proposal> futureProposals = new HashMap<>();

    private int enteredRound = -1;
    private int failedCommitRound = -1;
    private volatile boolean running = false;

    public ConsensusEngine(Signer signer, ValidatorSet validatorSet, Transport transport,
            BlockApplication application, RoundTimer timer, ConsensusStateStore stateStore, ConsensusConfig config,
            Executor executor) {
        this.nodeId = signer.getValidatorId();
        this.signer = signer;
        this.validatorSet = validatorSet;
        this.transport = transport;
        this.application = application;
        this.timer = timer;
        this.stateStore = stateStore;
        this.config = config;
        this.executor = executor;
        this.voteStore = new VoteStore(signer, state.getHeight(), validatorSet);

        // Setup timer callback
        this.timer.setTimeoutHandler(this::onTimeout);

        // Register inbound message handlers
        this.transport.registerProposalHandler(this::receiveProposal);
        this.transport.registerVoteHandler(this::receiveVote);
    }

    public void addListener(ConsensusListener listener) {
        listeners.add(listener);
    }

    /**
     * Restores the last commit from the state store and starts the following
     * height. An engine restarted at the height it was stopped in moves on to
     * the next round, so it never signs twice in a round.
     *
     * @throws com.bftchain.persistence.CorruptedStateException if the stored
     *                                                          state cannot be
     *                                                          read
     */
    public void start() {
        if (running) {
            return;
        }
        final int round = recover();
        log.info("{}: Starting consensus at height {} with {}", nodeId, state.getHeight(), validatorSet);
        running = true;
        transport.start();
        final long height = state.getHeight();
        executor.execute(() -> {
            enterNewRound(height, round);
            evaluate();
        });
    }

    public void stop() {
        log.info("{}: Stopping consensus at height {} round {}", nodeId, state.getHeight(), state.getRound());
        running = false;
        timer.cancel();
        transport.stop();
    }

    private int recover() {
        long stoppedAt = state.getHeight();
        Optional<CommitRecord> record;
        try {
            record = stateStore.load();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read consensus state of " + nodeId, e);
        }
        if (record.isPresent()) {
            CommitRecord r = record.get();
            log.info("{}: Recovered last commit at height {} ({})", nodeId, r.getHeight(), r.getBlockId());
            state.setLastCommittedHeight(r.getHeight());
            state.setLastCommittedBlockId(r.getBlockId());
            validatorSet = r.getNextValidatorSet();
            if (state.getHeight() != r.getHeight() + 1) {
                state.startHeight(r.getHeight() + 1);
            }
        }
        int round = 0;
        if (voteStore != null && state.getHeight() == stoppedAt) {
            if (enteredRound >= 0) {
                round = enteredRound + 1;
            }
        } else {
            proposals.clear();
            futureProposals.clear();
            voteStore = new VoteStore(signer, state.getHeight(), validatorSet);
        }
        enteredRound = -1;
        failedCommitRound = -1;
        return round;
    }

    /**
     * Entry point for proposals from peers, safe to call from any thread
     */
    public void receiveProposal(Proposal proposal) {
        if (!running) {
            return;
        }
        executor.execute(() -> handleProposal(proposal));
    }

    /**
     * Entry point for votes from peers, safe to call from any thread
     */
    public void receiveVote(Vote vote) {
        if (!running) {
            return;
        }
        executor.execute(() -> handleVote(vote));
    }

    /**
     * Stages the validator set for the height after the next commit.
     * Membership never changes in the middle of a height.
     */
    public void scheduleValidatorSet(ValidatorSet next) {
        executor.execute(() -> {
            log.info("{}: Validator set {} staged for height {}", nodeId, next, state.getHeight() + 1);
            nextValidatorSet = next;
        });
    }

    private void onTimeout(TimeoutInfo timeout) {
        executor.execute(() -> handleTimeout(timeout));
    }

    void handleTimeout(TimeoutInfo timeout) {
        if (!running) {
            return;
        }
        if (timeout.getHeight() != state.getHeight() || timeout.getRound() != state.getRound()
                || timeout.getStep() != state.getStep()) {
            log.debug("{}: Ignoring stale timeout {}", nodeId, timeout);
            return;
        }
        log.info("{}: {} timeout at height {} round {}", nodeId, timeout.getStep(), timeout.getHeight(),
                timeout.getRound());
        switch (timeout.getStep()) {
            case PROPOSE:
                enterPrevote(timeout.getHeight(), timeout.getRound());
                break;
            case PREVOTE:
                enterPrecommit(timeout.getHeight(), timeout.getRound());
                break;
            case PRECOMMIT:
                enterNewRound(timeout.getHeight(), timeout.getRound() + 1);
                break;
            case NEW_HEIGHT:
                enterNewRound(timeout.getHeight(), 0);
                break;
            default:
                break;
        }
        evaluate();
    }

    void handleProposal(Proposal proposal) {
        if (!running) {
            return;
        }
        if (proposal == null || proposal.getBlock() == null || proposal.getBlockId() == null) {
            log.debug("{}: Dropping malformed proposal {}", nodeId, proposal);
            return;
        }
        long height = state.getHeight();
        if (proposal.getHeight() == height + 1) {
            // checked again against the set in force once we get there
            ValidatorSet next = nextValidatorSet != null ? nextValidatorSet : validatorSet;
            if (futureProposals.containsKey(proposal.getRound()) || !isValidProposal(proposal, next)) {
                return;
            }
            if (futureProposals.size() < MAX_BUFFERED_PROPOSALS) {
                futureProposals.put(proposal.getRound(), proposal);
            }
            return;
        }
        if (proposal.getHeight() != height) {
            log.debug("{}: Dropping proposal for height {} at height {}", nodeId, proposal.getHeight(), height);
            return;
        }
        if (proposals.containsKey(proposal.getRound())) {
            log.debug("{}: Already have a proposal for round {}, ignoring {}", nodeId, proposal.getRound(),
                    proposal);
            return;
        }
        if (!isValidProposal(proposal, validatorSet)) {
            return;
        }
        log.debug("{}: Accepted {}", nodeId, proposal);
        proposals.put(proposal.getRound(), proposal);
        evaluate();
    }

    void handleVote(Vote vote) {
        if (!running) {
            return;
        }
        if (vote == null) {
            return;
        }
        long height = state.getHeight();
        if (vote.getHeight() < height || vote.getHeight() > height + 1) {
            log.debug("{}: Dropping vote for height {} at height {}", nodeId, vote.getHeight(), height);
            return;
        }
        AddVoteResult result = voteStore.addVote(vote);
        if (result == AddVoteResult.REJECTED) {
            return;
        }
        if (result == AddVoteResult.REPLACED) {
            log.debug("{}: Replaced earlier vote with {}", nodeId, vote);
        }
        if (vote.getHeight() == height) {
            evaluate();
        }
    }

    /**
     * Structural checks of a proposal: right proposer in {@code validators},
     * valid signature, and a payload that hashes to the announced id at the
     * announced height.
     */
    private boolean isValidProposal(Proposal proposal, ValidatorSet validators) {
        if (proposal.getRound() < 0) {
            return false;
        }
        String expected = validators.getProposer(proposal.getHeight(), proposal.getRound());
        if (!expected.equals(proposal.getProposerId())) {
            log.warn("{}: Proposal from {} but proposer of h={} r={} is {}", nodeId, proposal.getProposerId(),
                    proposal.getHeight(), proposal.getRound(), expected);
            return false;
        }
        if (!signer.verify(proposal.getProposerId(), CanonicalEncoding.encodeProposal(proposal),
                proposal.getSignature())) {
            log.warn("{}: Bad signature on {}", nodeId, proposal);
            return false;
        }
        Block block = proposal.getBlock();
        if (block.getHeight() != proposal.getHeight() || !proposal.getBlockId().equals(block.getBlockId())
                || !block.hasValidId()) {
            log.warn("{}: Payload of {} does not match its block id", nodeId, proposal);
            return false;
        }
        return true;
    }

    /**
     * Applies rules until the state stops changing.
     */
    private void evaluate() {
        boolean progressed = true;
        while (progressed && running) {
            progressed = applyRules();
        }
    }

    /**
     * @return true if a rule moved the engine to another height, round or
     *         step
     */
    private boolean applyRules() {
        final long height = state.getHeight();
        final int round = state.getRound();

        for (int r : voteStore.roundsWithVotes(height)) {
            // commit: a precommit quorum for a known block in any round
            Optional<Majority> precommits = voteStore.twoThirdsMajority(height, r, VoteType.PRECOMMIT);
            if (precommits.isPresent() && !precommits.get().isNil() && r > failedCommitRound) {
                Block block = findBlock(precommits.get().getBlockId());
                if (block != null) {
                    finalizeCommit(height, r, block);
                    return true;
                }
            }

            // catch up with a round that more than a third of the power moved to
            if (r > round && validatorSet.hasOneThirdPlus(voteStore.votingPowerInRound(height, r))) {
                log.info("{}: Skipping from round {} to round {} at height {}", nodeId, round, r, height);
                enterNewRound(height, r);
                return true;
            }

            updateValidBlock(height, r);
        }

        switch (state.getStep()) {
            case PROPOSE:
                if (proposals.containsKey(round)) {
                    enterPrevote(height, round);
                    return true;
                }
                break;
            case PREVOTE:
                if (voteStore.twoThirdsMajority(height, round, VoteType.PREVOTE).isPresent()) {
                    enterPrecommit(height, round);
                    return true;
                }
                break;
            case PRECOMMIT:
                Optional<Majority> precommits = voteStore.twoThirdsMajority(height, round, VoteType.PRECOMMIT);
                if (precommits.isPresent() && precommits.get().isNil()) {
                    log.info("{}: Precommit quorum for nil at height {} round {}", nodeId, height, round);
                    enterNewRound(height, round + 1);
                    return true;
                }
                break;
            default:
                break;
        }
        return false;
    }

    private void updateValidBlock(long height, int round) {
        if (round <= state.getValidRound()) {
            return;
        }
        Optional<Majority> prevotes = voteStore.twoThirdsMajority(height, round, VoteType.PREVOTE);
        if (prevotes.isPresent() && !prevotes.get().isNil()) {
            Block block = findBlock(prevotes.get().getBlockId());
            if (block != null) {
                state.setValidBlock(block);
                state.setValidRound(round);
            }
        }
    }

    private void enterNewRound(long height, int round) {
        if (state.getHeight() != height || round <= enteredRound) {
            return;
        }
        log.info("{}: Entering height {} round {}", nodeId, height, round);
        enteredRound = round;
        state.setRound(round);
        state.setStep(Step.PROPOSE);
        for (ConsensusListener listener : listeners) {
            listener.onNewRound(height, round);
        }
        enterPropose(height, round);
    }

    private void enterPropose(long height, int round) {
        timer.schedule(timeout(height, round, Step.PROPOSE));
        if (validatorSet.contains(nodeId) && nodeId.equals(validatorSet.getProposer(height, round))) {
            propose(height, round);
        }
    }

    private void propose(long height, int round) {
        Block block = state.getValidBlock();
        if (block == null) {
            try {
                block = application.createBlock(height, nodeId, state.getLastCommittedBlockId());
            } catch (RuntimeException e) {
                log.error("{}: Application failed to create block for height {}", nodeId, height, e);
                return;
            }
        }
        Proposal proposal = new Proposal(height, round, nodeId, block.getBlockId(), block,
                System.currentTimeMillis(), null);
        proposal.setSignature(signer.sign(CanonicalEncoding.encodeProposal(proposal)));
        log.info("{}: Proposing {} at height {} round {}", nodeId, block.getBlockId(), height, round);
        proposals.putIfAbsent(round, proposal);
        transport.broadcastProposal(proposal);
    }

    private void enterPrevote(long height, int round) {
        if (state.getHeight() != height || state.getRound() != round || state.getStep() != Step.PROPOSE) {
            return;
        }
        state.setStep(Step.PREVOTE);
        timer.schedule(timeout(height, round, Step.PREVOTE));
        castVote(VoteType.PREVOTE, decidePrevote(round));
    }

    private String decidePrevote(int round) {
        Proposal proposal = proposals.get(round);
        if (proposal == null) {
            log.info("{}: No proposal in round {}, prevoting nil", nodeId, round);
            return null;
        }
        Block locked = state.getLockedBlock();
        if (locked != null) {
            if (locked.getBlockId().equals(proposal.getBlockId())) {
                return proposal.getBlockId();
            }
            log.info("{}: Locked on {} since round {}, prevoting nil for {}", nodeId, locked.getBlockId(),
                    state.getLockedRound(), proposal.getBlockId());
            return null;
        }
        boolean valid;
        try {
            valid = application.validateBlock(proposal.getBlock());
        } catch (RuntimeException e) {
            log.warn("{}: Application failed validating {}", nodeId, proposal.getBlockId(), e);
            valid = false;
        }
        if (!valid) {
            log.info("{}: Proposed block {} is invalid, prevoting nil", nodeId, proposal.getBlockId());
            return null;
        }
        return proposal.getBlockId();
    }

    private void enterPrecommit(long height, int round) {
        if (state.getHeight() != height || state.getRound() != round || state.getStep() != Step.PREVOTE) {
            return;
        }
        state.setStep(Step.PRECOMMIT);
        timer.schedule(timeout(height, round, Step.PRECOMMIT));

        String precommitFor = null;
        Optional<Majority> prevotes = voteStore.twoThirdsMajority(height, round, VoteType.PREVOTE);
        if (prevotes.isPresent() && !prevotes.get().isNil()) {
            Block block = findBlock(prevotes.get().getBlockId());
            if (block != null) {
                if (state.getLockedBlock() != null && !block.getBlockId().equals(state.getLockedBlockId())) {
                    log.info("{}: Prevote quorum in round {} moves lock from {} to {}", nodeId, round,
                            state.getLockedBlockId(), block.getBlockId());
                }
                state.setLockedBlock(block);
                state.setLockedRound(round);
                state.setValidBlock(block);
                state.setValidRound(round);
                precommitFor = block.getBlockId();
            } else {
                log.warn("{}: Prevote quorum for unknown block {}, precommitting nil", nodeId,
                        prevotes.get().getBlockId());
            }
        }
        castVote(VoteType.PRECOMMIT, precommitFor);
    }

    private void castVote(VoteType type, String blockId) {
        if (!validatorSet.contains(nodeId)) {
            return;
        }
        Vote vote = Vote.unsigned(nodeId, blockId, state.getHeight(), state.getRound(), type,
                System.currentTimeMillis());
        vote.setSignature(signer.sign(CanonicalEncoding.encodeVote(vote)));
        log.debug("{}: Casting {}", nodeId, vote);
        voteStore.addVote(vote);
        transport.broadcastVote(vote);
    }

    private void finalizeCommit(long height, int round, Block block) {
        state.setStep(Step.COMMIT);
        timer.cancel();
        try {
            application.onCommit(height, block.getBlockId(), block);
        } catch (BlockApplicationException | RuntimeException e) {
            log.error("{}: Application failed to commit {} at height {}, retrying in a new round", nodeId,
                    block.getBlockId(), height, e);
            failedCommitRound = Math.max(failedCommitRound, Math.max(round, state.getRound()));
            for (ConsensusListener listener : listeners) {
                listener.onCommitFailed(height, round, block, e);
            }
            enterNewRound(height, state.getRound() + 1);
            return;
        }

        ValidatorSet next = nextValidatorSet != null ? nextValidatorSet : validatorSet;
        try {
            stateStore.save(new CommitRecord(height, block.getBlockId(), next));
        } catch (IOException e) {
            log.error("{}: Could not persist commit of height {}, stopping", nodeId, height, e);
            stop();
            throw new UncheckedIOException("Failed to persist commit of height " + height, e);
        }
        log.info("{}: Committed {} at height {} round {}", nodeId, block.getBlockId(), height, round);
        state.setLastCommittedHeight(height);
        state.setLastCommittedBlockId(block.getBlockId());
        for (ConsensusListener listener : listeners) {
            listener.onCommitted(height, block);
        }
        advanceHeight(height + 1, next);
    }

    private void advanceHeight(long newHeight, ValidatorSet next) {
        validatorSet = next;
        nextValidatorSet = null;
        state.startHeight(newHeight);
        enteredRound = -1;
        failedCommitRound = -1;
        proposals.clear();
        voteStore.advanceTo(newHeight, next);

        Map<Integer, Proposal> buffered = new HashMap<>(futureProposals);
        futureProposals.clear();
        for (Proposal proposal : buffered.values()) {
            if (isValidProposal(proposal, next)) {
                proposals.putIfAbsent(proposal.getRound(), proposal);
            }
        }
        long commitWait = config.timeoutFor(Step.NEW_HEIGHT, 0);
        if (commitWait > 0) {
            state.setStep(Step.NEW_HEIGHT);
            timer.schedule(new TimeoutInfo(newHeight, 0, Step.NEW_HEIGHT, commitWait));
        } else {
            enterNewRound(newHeight, 0);
        }
    }

    /**
     * Looks up a payload by id among this height's proposals and the locked
     * and valid blocks.
     */
    private Block findBlock(String blockId) {
        for (Proposal proposal : proposals.values()) {
            if (blockId.equals(proposal.getBlockId())) {
                return proposal.getBlock();
            }
        }
        if (blockId.equals(state.getLockedBlockId())) {
            return state.getLockedBlock();
        }
        if (blockId.equals(state.getValidBlockId())) {
            return state.getValidBlock();
        }
        return null;
    }

    private TimeoutInfo timeout(long height, int round, Step step) {
        return new TimeoutInfo(height, round, step, config.timeoutFor(step, round));
    }

    public String getNodeId() {
        return nodeId;
    }

    public long getHeight() {
        return state.getHeight();
    }

    public int getRound() {
        return state.getRound();
    }

    public Step getStep() {
        return state.getStep();
    }

    public String getLockedBlockId() {
        return state.getLockedBlockId();
    }

    public int getLockedRound() {
        return state.getLockedRound();
    }

    public String getValidBlockId() {
        return state.getValidBlockId();
    }

    public long getLastCommittedHeight() {
        return state.getLastCommittedHeight();
    }

    public String getLastCommittedBlockId() {
        return state.getLastCommittedBlockId();
    }

    public ValidatorSet getValidatorSet() {
        return validatorSet;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Read-only view for status reporting; the engine keeps writing to it
     */
    public ConsensusState getState() {
        return state;
    }
}
