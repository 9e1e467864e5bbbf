package com.bftchain.node_runner.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import com.bftchain.engine.ConsensusConfig;
import com.bftchain.ledger.TransactionPool;
import com.bftchain.validator.ValidatorSet;

import lombok.Data;

@Configuration
@ConfigurationProperties(prefix = "consensus")
@Data
public class NodeConfig {
    private String validatorId;
    // hex encoded 32 byte Ed25519 seed
    private String privateKeySeed;
    private List<ValidatorProperties> validators = new ArrayList<>();
    private String storageDir = "data";

    private long timeoutProposeMs = 3000;
    private long timeoutProposeDeltaMs = 500;
    private long timeoutPrevoteMs = 1000;
    private long timeoutPrevoteDeltaMs = 500;
    private long timeoutPrecommitMs = 1000;
    private long timeoutPrecommitDeltaMs = 500;
    private long timeoutCommitMs = 1000;
    private long maxTimeoutMs = 60_000;

    private int maxBlockTransactions = 500;
    private int poolCapacity = TransactionPool.DEFAULT_CAPACITY;

    private int connectionTimeoutMs = 2000;
    private int readTimeoutMs = 2000;
    private int failureThreshold = 3;

    @Data
    public static class ValidatorProperties {
        private String id;
        private long power = 1;
        private String publicKey;
        // base URL of the validator's HTTP endpoint, resolved from the id when empty
        private String url;
    }

    public ValidatorSet toValidatorSet() {
        if (validators.isEmpty()) {
            throw new IllegalStateException("consensus.validators must list at least one validator");
        }
        Map<String, Long> powers = new LinkedHashMap<>();
        for (ValidatorProperties validator : validators) {
            if (powers.put(validator.getId(), validator.getPower()) != null) {
                throw new IllegalStateException("Validator " + validator.getId() + " is listed twice");
            }
        }
        return new ValidatorSet(powers);
    }

    public ConsensusConfig toConsensusConfig() {
        return new ConsensusConfig(timeoutProposeMs, timeoutProposeDeltaMs, timeoutPrevoteMs, timeoutPrevoteDeltaMs,
                timeoutPrecommitMs, timeoutPrecommitDeltaMs, timeoutCommitMs, maxTimeoutMs);
    }

    /**
     * Configured public keys by validator id, validators without one left out
     */
    public Map<String, String> publicKeys() {
        Map<String, String> keys = new LinkedHashMap<>();
        for (ValidatorProperties validator : validators) {
            if (validator.getPublicKey() != null && !validator.getPublicKey().isBlank()) {
                keys.put(validator.getId(), validator.getPublicKey());
            }
        }
        return keys;
    }
}
