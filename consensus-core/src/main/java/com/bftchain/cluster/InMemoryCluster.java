package com.bftchain.cluster;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;

import com.bftchain.app.InMemoryBlockApplication;
import com.bftchain.concurrent.EventLoop;
import com.bftchain.crypto.CanonicalEncoding;
import com.bftchain.crypto.Ed25519Signer;
import com.bftchain.engine.ConsensusConfig;
import com.bftchain.engine.ConsensusEngine;
import com.bftchain.model.Block;
import com.bftchain.persistence.InMemoryConsensusStateStore;
import com.bftchain.timer.RoundTimer;
import com.bftchain.timer.RoundTimerImpl;
import com.bftchain.transport.InMemoryNetwork;
import com.bftchain.validator.ValidatorSet;

import lombok.extern.slf4j.Slf4j;

/**
 * A set of validators running in one process on real timers and event loops,
 * connected by an immediate {@link InMemoryNetwork}.
 */
@Slf4j
public class InMemoryCluster {
    private final Map<String, ConsensusEngine> engines = new LinkedHashMap<>();
    private final Map<String, InMemoryBlockApplication> applications = new HashMap<>();
    private final Map<String, EventLoop> eventLoops = new HashMap<>();
    private final Map<String, RoundTimer> timers = new HashMap<>();
    private final InMemoryNetwork network = new InMemoryNetwork(true);
    private final ValidatorSet validatorSet;
    private final ConsensusConfig config;

    public InMemoryCluster(List<String> nodeIds) {
        this(ValidatorSet.ofEqualPower(nodeIds, 1), ConsensusConfig.fast());
    }

    public InMemoryCluster(ValidatorSet validatorSet, ConsensusConfig config) {
        this.validatorSet = validatorSet;
        this.config = config;
    }

    /**
     * Deterministic key of a cluster member; only fit for in-process use
     */
    public static Ed25519PrivateKeyParameters keyFor(String nodeId) {
        byte[] seed = CanonicalEncoding.sha256(("in-memory-cluster:" + nodeId).getBytes(StandardCharsets.UTF_8));
        return Ed25519Signer.privateKeyFromSeed(seed);
    }

    // Initializes the cluster by creating all nodes and their components
    public void init() {
        Map<String, Ed25519PublicKeyParameters> publicKeys = new HashMap<>();
        for (String nodeId : validatorSet.getValidatorIds()) {
            publicKeys.put(nodeId, keyFor(nodeId).generatePublicKey());
        }
        for (String nodeId : validatorSet.getValidatorIds()) {
            Ed25519Signer signer = new Ed25519Signer(nodeId, keyFor(nodeId), publicKeys);
            EventLoop eventLoop = new EventLoop(nodeId);
            RoundTimer timer = new RoundTimerImpl(nodeId);
            InMemoryBlockApplication application = new InMemoryBlockApplication();
            ConsensusEngine engine = new ConsensusEngine(signer, validatorSet, network.join(nodeId), application,
                    timer, new InMemoryConsensusStateStore(), config, eventLoop);
            engines.put(nodeId, engine);
            applications.put(nodeId, application);
            eventLoops.put(nodeId, eventLoop);
            timers.put(nodeId, timer);
        }
    }

    /**
     * Start all nodes in the cluster
     */
    public void startAll() {
        for (ConsensusEngine engine : engines.values()) {
            engine.start();
        }
    }

    /**
     * Stops all nodes and releases their threads
     */
    public void stopAll() {
        for (String nodeId : engines.keySet()) {
            engines.get(nodeId).stop();
            timers.get(nodeId).shutdown();
            eventLoops.get(nodeId).shutdown();
        }
    }

    /**
     * Cuts a node off the network; it keeps running rounds on its own
     */
    public void disconnect(String nodeId) {
        log.info("Disconnecting {}", nodeId);
        network.isolate(nodeId);
    }

    public void reconnect(String nodeId) {
        log.info("Reconnecting {}", nodeId);
        network.reconnect(nodeId);
    }

    /**
     * Stops a node; its messages no longer reach anyone
     */
    public void stopNode(String nodeId) {
        ConsensusEngine engine = engines.get(nodeId);
        if (engine == null) {
            log.warn("Node {} not found", nodeId);
            return;
        }
        network.isolate(nodeId);
        engine.stop();
    }

    /**
     * Lowest committed height across running nodes
     */
    public long minCommittedHeight() {
        long min = Long.MAX_VALUE;
        for (ConsensusEngine engine : engines.values()) {
            if (engine.isRunning()) {
                min = Math.min(min, engine.getLastCommittedHeight());
            }
        }
        return min == Long.MAX_VALUE ? 0 : min;
    }

    public boolean waitForCommittedHeight(long height, int waitTimeoutSec) throws InterruptedException {
        long deadline = System.currentTimeMillis() + waitTimeoutSec * 1000L;
        while (System.currentTimeMillis() < deadline) {
            if (minCommittedHeight() >= height) {
                return true;
            }
            Thread.sleep(20);
        }
        return minCommittedHeight() >= height;
    }

    /**
     * True if no two nodes committed different blocks at the same height
     */
    public boolean committedChainsAgree() {
        Map<Long, String> decided = new HashMap<>();
        for (Map.Entry<String, InMemoryBlockApplication> entry : applications.entrySet()) {
            for (Block block : entry.getValue().getCommitted()) {
                String previous = decided.putIfAbsent(block.getHeight(), block.getBlockId());
                if (previous != null && !previous.equals(block.getBlockId())) {
                    log.error("Conflicting commits at height {}: {} vs {} (on {})", block.getHeight(), previous,
                            block.getBlockId(), entry.getKey());
                    return false;
                }
            }
        }
        return true;
    }

    public ConsensusEngine getEngine(String nodeId) {
        return engines.get(nodeId);
    }

    public InMemoryBlockApplication getApplication(String nodeId) {
        return applications.get(nodeId);
    }

    public List<String> getNodeIds() {
        return new ArrayList<>(engines.keySet());
    }

    public InMemoryNetwork getNetwork() {
        return network;
    }
}
