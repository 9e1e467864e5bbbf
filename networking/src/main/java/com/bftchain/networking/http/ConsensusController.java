package com.bftchain.networking.http;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.bftchain.model.Proposal;
import com.bftchain.model.Vote;
import com.bftchain.networking.rpc.HttpTransport;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Inbound side of {@link HttpTransport}. Messages are only queued here, so
 * a 202 says nothing about whether the engine accepted them.
 */
@RestController
@RequestMapping("/consensus")
@RequiredArgsConstructor
@Slf4j
public class ConsensusController {
    private final HttpTransport transport;

    @PostMapping("/proposal")
    public ResponseEntity<Void> proposal(@RequestBody Proposal proposal) {
        log.debug("Received proposal: {}", proposal);
        transport.handleProposal(proposal);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/vote")
    public ResponseEntity<Void> vote(@RequestBody Vote vote) {
        log.debug("Received vote: {}", vote);
        transport.handleVote(vote);
        return ResponseEntity.accepted().build();
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<String> notReady(IllegalStateException e) {
        log.debug("Rejecting consensus message: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(e.getMessage());
    }
}
