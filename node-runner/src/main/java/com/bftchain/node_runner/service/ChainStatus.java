package com.bftchain.node_runner.service;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of a node served by the status endpoint
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChainStatus {
    private String validatorId;
    private boolean running;
    private long height;
    private int round;
    private String step;
    private long lastCommittedHeight;
    private String lastCommittedBlockId;
    private String lockedBlockId;
    private int lockedRound;
    private long chainHeight;
    private int pendingTransactions;
    private long failedCommits;
    private List<String> validators;
    private List<String> unreachablePeers;
}
