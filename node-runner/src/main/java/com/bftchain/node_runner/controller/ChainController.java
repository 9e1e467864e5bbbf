package com.bftchain.node_runner.controller;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.bftchain.ledger.SubmitResult;
import com.bftchain.model.Block;
import com.bftchain.node_runner.service.ChainStatus;
import com.bftchain.node_runner.service.ConsensusNodeManager;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/v1/chain")
@RequiredArgsConstructor
@Slf4j
public class ChainController {
    private final ConsensusNodeManager nodeManager;

    @GetMapping("/status")
    public ResponseEntity<ChainStatus> status() {
        return ResponseEntity.ok(nodeManager.getStatus());
    }

    @GetMapping("/blocks/latest")
    public ResponseEntity<?> latestBlock() {
        Optional<Block> block = nodeManager.getLatestBlock();
        if (block.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("No block committed yet");
        }
        return ResponseEntity.ok(block.get());
    }

    @GetMapping("/blocks/{height}")
    public ResponseEntity<?> block(@PathVariable long height) {
        log.debug("Received block request - height: {}", height);
        if (height < 1) {
            return ResponseEntity.badRequest().body("Height must be positive");
        }
        Optional<Block> block = nodeManager.getBlock(height);
        if (block.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("No block at height " + height);
        }
        return ResponseEntity.ok(block.get());
    }

    /**
     * Queues the raw request body as one transaction. The returned id is the
     * hex SHA-256 of the payload.
     */
    @PostMapping("/transactions")
    public ResponseEntity<?> submit(@RequestBody(required = false) String payload) {
        if (payload == null || payload.isEmpty()) {
            return ResponseEntity.badRequest().body("Transaction payload cannot be empty");
        }
        SubmitResult result = nodeManager.submitTransaction(payload);
        if (result.isAccepted()) {
            Map<String, String> body = new LinkedHashMap<>();
            body.put("transactionId", result.getTransactionId());
            return ResponseEntity.accepted().body(body);
        }
        String error = result.getError();
        if (error != null && error.contains("already")) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
        }
        if (error != null && error.contains("full")) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
        }
        return ResponseEntity.badRequest().body(error);
    }
}
