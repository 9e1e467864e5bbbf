package com.bftchain.node_runner.controller;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.bftchain.ledger.SubmitResult;
import com.bftchain.model.Block;
import com.bftchain.node_runner.service.ChainStatus;
import com.bftchain.node_runner.service.ConsensusNodeManager;

@ExtendWith(MockitoExtension.class)
public class ChainControllerTest {
    @Mock
    private ConsensusNodeManager nodeManager;

    @InjectMocks
    private ChainController chainController;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(chainController).build();
    }

    @Test
    void testStatus() throws Exception {
        ChainStatus status = new ChainStatus();
        status.setValidatorId("val1");
        status.setHeight(7);
        status.setStep("PRECOMMIT");
        when(nodeManager.getStatus()).thenReturn(status);

        mockMvc.perform(get("/api/v1/chain/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.validatorId").value("val1"))
                .andExpect(jsonPath("$.height").value(7))
                .andExpect(jsonPath("$.step").value("PRECOMMIT"));
    }

    @Test
    void testBlockByHeight() throws Exception {
        Block block = new Block(2, "parent", "val2", 10, List.of("tx-a", "tx-b"));
        when(nodeManager.getBlock(2)).thenReturn(Optional.of(block));

        mockMvc.perform(get("/api/v1/chain/blocks/2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.blockId").value(block.getBlockId()))
                .andExpect(jsonPath("$.previousBlockId").value("parent"))
                .andExpect(jsonPath("$.transactions[1]").value("tx-b"));
    }

    @Test
    void testMissingBlockIsNotFound() throws Exception {
        when(nodeManager.getBlock(9)).thenReturn(Optional.empty());
        mockMvc.perform(get("/api/v1/chain/blocks/9")).andExpect(status().isNotFound());
    }

    @Test
    void testNonPositiveHeightIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/chain/blocks/0")).andExpect(status().isBadRequest());
        verifyNoInteractions(nodeManager);
    }

    @Test
    void testLatestBlockBeforeFirstCommit() throws Exception {
        when(nodeManager.getLatestBlock()).thenReturn(Optional.empty());
        mockMvc.perform(get("/api/v1/chain/blocks/latest")).andExpect(status().isNotFound());
    }

    @Test
    void testSubmitAccepted() throws Exception {
        when(nodeManager.submitTransaction("pay:alice:bob:5")).thenReturn(SubmitResult.accepted("id-1"));

        mockMvc.perform(post("/api/v1/chain/transactions").contentType(MediaType.TEXT_PLAIN)
                .content("pay:alice:bob:5"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.transactionId").value("id-1"));
        verify(nodeManager).submitTransaction("pay:alice:bob:5");
    }

    @Test
    void testSubmitDuplicateIsConflict() throws Exception {
        when(nodeManager.submitTransaction("tx")).thenReturn(
                SubmitResult.rejected("id-1", "Transaction already pending"));

        mockMvc.perform(post("/api/v1/chain/transactions").contentType(MediaType.TEXT_PLAIN).content("tx"))
                .andExpect(status().isConflict());
    }

    @Test
    void testSubmitToFullPoolIsUnavailable() throws Exception {
        when(nodeManager.submitTransaction("tx")).thenReturn(
                SubmitResult.rejected("id-1", "Transaction pool is full"));

        mockMvc.perform(post("/api/v1/chain/transactions").contentType(MediaType.TEXT_PLAIN).content("tx"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void testSubmitEmptyPayloadIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/chain/transactions").contentType(MediaType.TEXT_PLAIN).content(""))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(nodeManager);
    }
}
