package com.bftchain.networking.rpc;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.bftchain.model.Proposal;
import com.bftchain.model.Vote;
import com.bftchain.networking.config.NetworkConfig;
import com.bftchain.transport.Transport;

import lombok.extern.slf4j.Slf4j;

/**
 * Broadcasts consensus messages as JSON POSTs to every other validator.
 * Sends are fire and forget: a lost message is covered by the round
 * timeouts, so failures are only counted and logged.
 */
@Slf4j
public class HttpTransport implements Transport {
    public static final String PROPOSAL_PATH = "/consensus/proposal";
    public static final String VOTE_PATH = "/consensus/vote";

    private final String nodeId;
    private final RestTemplate restTemplate;
    private final NetworkConfig networkConfig;
    private final PeerFailureDetector failureDetector;
    private volatile boolean running = false;

    // inbound handlers
    private volatile Consumer<Proposal> proposalHandler;
    private volatile Consumer<Vote> voteHandler;

    public HttpTransport(String nodeId, NetworkConfig networkConfig) {
        this.nodeId = nodeId;
        this.networkConfig = networkConfig;
        this.restTemplate = networkConfig.createRestTemplate();
        this.failureDetector = new PeerFailureDetector(networkConfig.getFailureThreshold(),
                peerId -> log.warn("{}: Peer {} unreachable, will keep retrying", nodeId, peerId),
                peerId -> log.info("{}: Peer {} reachable again", nodeId, peerId));
    }

    @Override
    public void broadcastProposal(Proposal proposal) {
        broadcast(PROPOSAL_PATH, proposal);
    }

    @Override
    public void broadcastVote(Vote vote) {
        broadcast(VOTE_PATH, vote);
    }

    private void broadcast(String path, Object message) {
        if (!running) {
            log.debug("{}: transport stopped, not sending {}", nodeId, message);
            return;
        }
        for (String peerId : networkConfig.getPeerIds(nodeId)) {
            sendTo(peerId, path, message).exceptionally(e -> {
                log.error("{}: Error sending {} to {}", nodeId, message, peerId, e);
                return false;
            });
        }
    }

    /**
     * @return completes with true if the peer accepted the message
     */
    CompletableFuture<Boolean> sendTo(String peerId, String path, Object message) {
        if (!running) {
            return CompletableFuture.failedFuture(new IllegalStateException("Transport not started"));
        }
        return CompletableFuture.supplyAsync(() -> {
            String url = networkConfig.getNodeUrl(peerId) + path;
            try {
                log.trace("{}: Sending {} to {} at {}", nodeId, message, peerId, url);
                restTemplate.postForObject(url, message, Void.class);
                failureDetector.recordSuccess(peerId);
                return true;
            } catch (RestClientException e) {
                failureDetector.recordFailure(peerId);
                log.debug("{}: Failed to send to {}: {}", nodeId, peerId, e.getMessage());
                return false;
            }
        });
    }

    @Override
    public void registerProposalHandler(Consumer<Proposal> handler) {
        this.proposalHandler = handler;
    }

    @Override
    public void registerVoteHandler(Consumer<Vote> handler) {
        this.voteHandler = handler;
    }

    @Override
    public void start() {
        running = true;
        log.info("{}: HTTP transport started, peers {}", nodeId, networkConfig.getPeerIds(nodeId));
    }

    @Override
    public void stop() {
        running = false;
        log.info("{}: HTTP transport stopped", nodeId);
    }

    // For use by ConsensusController
    public void handleProposal(Proposal proposal) {
        Consumer<Proposal> handler = proposalHandler;
        if (!running || handler == null) {
            throw new IllegalStateException("Transport not ready to handle proposals");
        }
        handler.accept(proposal);
    }

    // For use by ConsensusController
    public void handleVote(Vote vote) {
        Consumer<Vote> handler = voteHandler;
        if (!running || handler == null) {
            throw new IllegalStateException("Transport not ready to handle votes");
        }
        handler.accept(vote);
    }

    public Set<String> getUnreachablePeers() {
        return failureDetector.getSuspectedPeers();
    }

    public List<String> getPeerIds() {
        return new ArrayList<>(networkConfig.getPeerIds(nodeId));
    }

    public boolean isRunning() {
        return running;
    }
}
