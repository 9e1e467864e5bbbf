package com.bftchain.transport;

import java.util.function.Consumer;

import com.bftchain.model.Proposal;
import com.bftchain.model.Vote;

import lombok.extern.slf4j.Slf4j;

/**
 * Transport endpoint of one node on an {@link InMemoryNetwork}.
 */
@Slf4j
public class InMemoryTransport implements Transport {
    private final String nodeId;
    private final InMemoryNetwork network;
    private volatile Consumer<Proposal> proposalHandler;
    private volatile Consumer<Vote> voteHandler;
    private volatile boolean running = false;

    InMemoryTransport(String nodeId, InMemoryNetwork network) {
        this.nodeId = nodeId;
        this.network = network;
    }

    @Override
    public void broadcastProposal(Proposal proposal) {
        if (!running) {
            log.debug("{}: transport stopped, not sending {}", nodeId, proposal);
            return;
        }
        network.send(nodeId, proposal);
    }

    @Override
    public void broadcastVote(Vote vote) {
        if (!running) {
            log.debug("{}: transport stopped, not sending {}", nodeId, vote);
            return;
        }
        network.send(nodeId, vote);
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
    }

    @Override
    public void stop() {
        running = false;
    }

    public String getNodeId() {
        return nodeId;
    }

    public boolean isRunning() {
        return running;
    }

    void deliver(Object message) {
        if (!running) {
            return;
        }
        if (message instanceof Proposal) {
            Consumer<Proposal> handler = proposalHandler;
            if (handler != null) {
                handler.accept((Proposal) message);
            }
        } else if (message instanceof Vote) {
            Consumer<Vote> handler = voteHandler;
            if (handler != null) {
                handler.accept((Vote) message);
            }
        }
    }
}
