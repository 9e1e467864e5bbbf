package com.bftchain.node_runner.service;

import java.util.ArrayList;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.stereotype.Service;

import com.bftchain.engine.ConsensusEngine;
import com.bftchain.engine.ConsensusListener;
import com.bftchain.ledger.LedgerApplication;
import com.bftchain.ledger.SubmitResult;
import com.bftchain.model.Block;
import com.bftchain.networking.rpc.HttpTransport;
import com.bftchain.node_runner.config.NodeConfig;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class ConsensusNodeManager implements ConsensusListener {

    private final NodeConfig config;
    private final LedgerApplication ledger;
    private final HttpTransport transport;
    private final AtomicLong failedCommits = new AtomicLong();

    @Getter
    private final ConsensusEngine consensusEngine;

    public ConsensusNodeManager(NodeConfig config, ConsensusEngine consensusEngine, LedgerApplication ledger,
            HttpTransport transport) {
        this.config = config;
        this.consensusEngine = consensusEngine;
        this.ledger = ledger;
        this.transport = transport;
    }

    @PostConstruct
    public void start() {
        log.info("ConsensusNodeManager starting validator: {}", config.getValidatorId());
        consensusEngine.addListener(this);
        consensusEngine.start();
        if (consensusEngine.getLastCommittedHeight() > ledger.getChain().getHeight()) {
            // the chain is not persisted, blocks past the recovered height will not validate
            log.warn("Recovered commit height {} is ahead of the local chain at {}",
                    consensusEngine.getLastCommittedHeight(), ledger.getChain().getHeight());
        }
    }

    @PreDestroy
    public void stop() {
        if (consensusEngine != null) {
            consensusEngine.stop();
        }
    }

    @Override
    public void onCommitted(long height, Block block) {
        log.debug("Committed block {} at height {}", block.getBlockId(), height);
    }

    @Override
    public void onCommitFailed(long height, int round, Block block, Exception error) {
        long failures = failedCommits.incrementAndGet();
        log.error("Ledger refused block {} at height {} round {} ({} failures so far): {}", block.getBlockId(),
                height, round, failures, error.getMessage());
    }

    public ChainStatus getStatus() {
        return new ChainStatus(
                config.getValidatorId(),
                consensusEngine.isRunning(),
                consensusEngine.getHeight(),
                consensusEngine.getRound(),
                consensusEngine.getStep().name(),
                consensusEngine.getLastCommittedHeight(),
                consensusEngine.getLastCommittedBlockId(),
                consensusEngine.getLockedBlockId(),
                consensusEngine.getLockedRound(),
                ledger.getChain().getHeight(),
                ledger.getPool().size(),
                failedCommits.get(),
                consensusEngine.getValidatorSet().getValidatorIds(),
                new ArrayList<>(transport.getUnreachablePeers()));
    }

    public Optional<Block> getBlock(long height) {
        return ledger.getChain().getBlock(height);
    }

    public Optional<Block> getLatestBlock() {
        return ledger.getChain().getLatestBlock();
    }

    public SubmitResult submitTransaction(String payload) {
        SubmitResult result = ledger.submit(payload);
        if (result.isAccepted()) {
            log.debug("Accepted transaction {}", result.getTransactionId());
        } else {
            log.debug("Rejected transaction {}: {}", result.getTransactionId(), result.getError());
        }
        return result;
    }

    public String getValidatorId() {
        return config.getValidatorId();
    }

    public long getFailedCommits() {
        return failedCommits.get();
    }
}
