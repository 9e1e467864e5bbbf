package com.bftchain.transport;

import java.util.function.Consumer;

import com.bftchain.model.Proposal;
import com.bftchain.model.Vote;

public interface Transport {
    /**
     * Sends a proposal to every other validator. Delivery is best effort;
     * failures are absorbed by the transport.
     */
    void broadcastProposal(Proposal proposal);

    /**
     * Sends a vote to every other validator, best effort
     */
    void broadcastVote(Vote vote);

    /**
     * Registers the handler for proposals received from peers. Handlers may be
     * called from any thread.
     */
    void registerProposalHandler(Consumer<Proposal> handler);

    /**
     * Registers the handler for votes received from peers
     */
    void registerVoteHandler(Consumer<Vote> handler);

    /**
     * Start the transport
     */
    void start();

    /**
     * Stops the transport and release resources
     */
    void stop();
}
