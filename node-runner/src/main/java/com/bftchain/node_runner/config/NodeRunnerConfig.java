package com.bftchain.node_runner.config;

import java.io.IOException;
import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.bftchain.concurrent.EventLoop;
import com.bftchain.crypto.Ed25519Signer;
import com.bftchain.engine.ConsensusEngine;
import com.bftchain.ledger.Blockchain;
import com.bftchain.ledger.InMemoryBlockchain;
import com.bftchain.ledger.LedgerApplication;
import com.bftchain.ledger.TransactionPool;
import com.bftchain.ledger.listener.LoggingListener;
import com.bftchain.networking.config.NetworkConfig;
import com.bftchain.networking.rpc.HttpTransport;
import com.bftchain.persistence.ConsensusStateStore;
import com.bftchain.persistence.FileConsensusStateStore;
import com.bftchain.timer.RoundTimer;
import com.bftchain.timer.RoundTimerImpl;
import com.bftchain.validator.ValidatorSet;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
@RequiredArgsConstructor
public class NodeRunnerConfig {
    private final NodeConfig nodeConfig;

    @Bean
    public Ed25519Signer signer() {
        String validatorId = nodeConfig.getValidatorId();
        if (validatorId == null || validatorId.isBlank()) {
            throw new IllegalStateException("consensus.validator-id is not set");
        }
        if (nodeConfig.getPrivateKeySeed() == null || nodeConfig.getPrivateKeySeed().isBlank()) {
            throw new IllegalStateException("consensus.private-key-seed is not set for " + validatorId);
        }
        Map<String, String> publicKeys = nodeConfig.publicKeys();
        Ed25519Signer signer = Ed25519Signer.fromHex(validatorId, nodeConfig.getPrivateKeySeed(), publicKeys);
        String derived = signer.getPublicKeyHex();
        String configured = publicKeys.get(validatorId);
        if (configured != null && !configured.equalsIgnoreCase(derived)) {
            throw new IllegalStateException("Configured public key of " + validatorId + " does not match its seed");
        }
        log.info("Validator {} public key: {}", validatorId, derived);
        return signer;
    }

    @Bean
    public ValidatorSet validatorSet() {
        ValidatorSet validatorSet = nodeConfig.toValidatorSet();
        if (!validatorSet.contains(nodeConfig.getValidatorId())) {
            log.warn("{} is not in the validator set {}, running as observer", nodeConfig.getValidatorId(),
                    validatorSet);
        }
        return validatorSet;
    }

    @Bean
    public ConsensusStateStore consensusStateStore() throws IOException {
        FileConsensusStateStore stateStore = new FileConsensusStateStore(
                nodeConfig.getStorageDir(),
                nodeConfig.getValidatorId());
        stateStore.initialize();
        return stateStore;
    }

    @Bean(destroyMethod = "shutdown")
    public RoundTimer roundTimer() {
        return new RoundTimerImpl(nodeConfig.getValidatorId());
    }

    @Bean(destroyMethod = "shutdown")
    public EventLoop eventLoop() {
        return new EventLoop(nodeConfig.getValidatorId());
    }

    @Bean
    public NetworkConfig networkConfig() {
        NetworkConfig networkConfig = new NetworkConfig();
        networkConfig.setConnectionTimeoutMs(nodeConfig.getConnectionTimeoutMs());
        networkConfig.setReadTimeoutMs(nodeConfig.getReadTimeoutMs());
        networkConfig.setFailureThreshold(nodeConfig.getFailureThreshold());
        for (NodeConfig.ValidatorProperties validator : nodeConfig.getValidators()) {
            String url = validator.getUrl();
            if (url == null || url.isBlank()) {
                url = networkConfig.resolveNodeUrl(validator.getId());
            }
            networkConfig.addNodeUrl(validator.getId(), url);
        }
        return networkConfig;
    }

    @Bean
    public HttpTransport httpTransport(NetworkConfig networkConfig) {
        return new HttpTransport(nodeConfig.getValidatorId(), networkConfig);
    }

    @Bean
    public TransactionPool transactionPool() {
        return new TransactionPool(nodeConfig.getPoolCapacity());
    }

    @Bean
    public Blockchain blockchain() {
        InMemoryBlockchain blockchain = new InMemoryBlockchain();
        blockchain.addListener(new LoggingListener());
        return blockchain;
    }

    @Bean
    public LedgerApplication ledgerApplication(TransactionPool transactionPool, Blockchain blockchain) {
        return new LedgerApplication(transactionPool, blockchain, nodeConfig.getMaxBlockTransactions());
    }

    @Bean
    public ConsensusEngine consensusEngine(
            Ed25519Signer signer,
            ValidatorSet validatorSet,
            HttpTransport transport,
            LedgerApplication ledgerApplication,
            RoundTimer roundTimer,
            ConsensusStateStore consensusStateStore,
            EventLoop eventLoop) {
        return new ConsensusEngine(signer, validatorSet, transport, ledgerApplication, roundTimer,
                consensusStateStore, nodeConfig.toConsensusConfig(), eventLoop);
    }
}
