package com.bftchain.networking.rpc;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import lombok.extern.slf4j.Slf4j;

/**
 * Counts consecutive failed sends per peer. A peer is suspected once the
 * count reaches the threshold and cleared by the next successful send.
 * Suspected peers are still sent to: a vote may be what they need to catch
 * up once they are back.
 */
@Slf4j
public class PeerFailureDetector {
    private final Map<String, AtomicInteger> failureCounters = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final Consumer<String> peerDownHandler;
    private final Consumer<String> peerUpHandler;

    public PeerFailureDetector(int failureThreshold, Consumer<String> peerDownHandler,
            Consumer<String> peerUpHandler) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("Failure threshold must be positive: " + failureThreshold);
        }
        this.failureThreshold = failureThreshold;
        this.peerDownHandler = peerDownHandler;
        this.peerUpHandler = peerUpHandler;
    }

    /**
     * Record a successful send to a peer
     *
     * @return true if the peer was suspected until now
     */
    public boolean recordSuccess(String peerId) {
        AtomicInteger counter = failureCounters.get(peerId);
        if (counter == null) {
            return false;
        }
        int previous = counter.getAndSet(0);
        if (previous >= failureThreshold) {
            log.debug("Peer {} answered after {} failed sends", peerId, previous);
            if (peerUpHandler != null) {
                peerUpHandler.accept(peerId);
            }
            return true;
        }
        return false;
    }

    /**
     * Record a failed send to a peer
     *
     * @return true exactly when this failure crosses the threshold
     */
    public boolean recordFailure(String peerId) {
        AtomicInteger counter = failureCounters.computeIfAbsent(peerId, k -> new AtomicInteger(0));
        int failures = counter.incrementAndGet();
        log.debug("Recorded failure #{} for peer {}", failures, peerId);
        if (failures == failureThreshold) {
            log.debug("Peer {} reached failure threshold ({})", peerId, failures);
            if (peerDownHandler != null) {
                peerDownHandler.accept(peerId);
            }
            return true;
        }
        return false;
    }

    public boolean isSuspected(String peerId) {
        AtomicInteger counter = failureCounters.get(peerId);
        return counter != null && counter.get() >= failureThreshold;
    }

    public int getFailureCount(String peerId) {
        AtomicInteger counter = failureCounters.get(peerId);
        return counter != null ? counter.get() : 0;
    }

    public Set<String> getSuspectedPeers() {
        Set<String> suspected = new TreeSet<>();
        for (Map.Entry<String, AtomicInteger> entry : failureCounters.entrySet()) {
            if (entry.getValue().get() >= failureThreshold) {
                suspected.add(entry.getKey());
            }
        }
        return suspected;
    }
}
