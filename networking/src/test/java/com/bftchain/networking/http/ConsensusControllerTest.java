package com.bftchain.networking.http;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.bftchain.model.Block;
import com.bftchain.model.Proposal;
import com.bftchain.model.Vote;
import com.bftchain.model.VoteType;
import com.bftchain.networking.rpc.HttpTransport;

@ExtendWith(MockitoExtension.class)
public class ConsensusControllerTest {
    @Mock
    private HttpTransport transport;

    @InjectMocks
    private ConsensusController consensusController;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(consensusController).build();
    }

    @Test
    void testHandleProposal() {
        Block block = new Block(1, null, "val2", 10, List.of("tx"));
        Proposal proposal = new Proposal(1, 0, "val2", block.getBlockId(), block, 11, new byte[] { 1 });

        ResponseEntity<Void> response = consensusController.proposal(proposal);
        assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
        verify(transport).handleProposal(proposal);
    }

    @Test
    void testVoteJsonIsDecoded() throws Exception {
        String json = "{\"validatorId\":\"val2\",\"blockId\":\"abc\",\"height\":3,\"round\":1,"
                + "\"type\":\"PRECOMMIT\",\"timestamp\":5,\"signature\":\"AQID\",\"nil\":false}";
        mockMvc.perform(post("/consensus/vote").contentType(MediaType.APPLICATION_JSON).content(json))
                .andExpect(status().isAccepted());

        ArgumentCaptor<Vote> captor = ArgumentCaptor.forClass(Vote.class);
        verify(transport).handleVote(captor.capture());
        Vote vote = captor.getValue();
        assertEquals("val2", vote.getValidatorId());
        assertEquals("abc", vote.getBlockId());
        assertEquals(3, vote.getHeight());
        assertEquals(1, vote.getRound());
        assertEquals(VoteType.PRECOMMIT, vote.getType());
        assertArrayEquals(new byte[] { 1, 2, 3 }, vote.getSignature());
    }

    @Test
    void testNotReadyAnswersServiceUnavailable() throws Exception {
        doThrow(new IllegalStateException("Transport not ready to handle votes")).when(transport)
                .handleVote(any());
        mockMvc.perform(post("/consensus/vote").contentType(MediaType.APPLICATION_JSON)
                .content("{\"validatorId\":\"val2\",\"height\":1,\"round\":0,\"type\":\"PREVOTE\"}"))
                .andExpect(status().isServiceUnavailable());
    }
}
