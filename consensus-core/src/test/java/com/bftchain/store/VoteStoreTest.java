package com.bftchain.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.bftchain.TestValidators;
import com.bftchain.model.Vote;
import com.bftchain.model.VoteType;
import com.bftchain.validator.ValidatorSet;

public class VoteStoreTest {
    private TestValidators validators;
    private VoteStore store;

    @BeforeEach
    public void setup() {
        validators = TestValidators.equalPower("val1", "val2", "val3", "val4");
        store = new VoteStore(validators.signer("val1"), 5, validators.getValidatorSet());
    }

    @Nested
    @DisplayName("Adding votes")
    class AddVoteTests {
        @Test
        @DisplayName("First vote is accepted, second from the same validator replaces it")
        void testAcceptAndReplace() {
            assertEquals(AddVoteResult.ACCEPTED, store.addVote(validators.vote("val2", "A", 5, 0, VoteType.PREVOTE)));
            assertEquals(1, store.powerForBlock(5, 0, VoteType.PREVOTE, "A"));

            assertEquals(AddVoteResult.REPLACED, store.addVote(validators.vote("val2", "B", 5, 0, VoteType.PREVOTE)));
            assertEquals(0, store.powerForBlock(5, 0, VoteType.PREVOTE, "A"));
            assertEquals(1, store.powerForBlock(5, 0, VoteType.PREVOTE, "B"));
            assertEquals(1, store.getVotes(5, 0, VoteType.PREVOTE).size());
        }

        @Test
        @DisplayName("Prevotes and precommits are tallied separately")
        void testTypesAreSeparate() {
            store.addVote(validators.vote("val2", "A", 5, 0, VoteType.PREVOTE));
            assertEquals(AddVoteResult.ACCEPTED, store.addVote(validators.vote("val2", "A", 5, 0, VoteType.PRECOMMIT)));
            assertEquals(1, store.powerForBlock(5, 0, VoteType.PRECOMMIT, "A"));
        }

        @Test
        @DisplayName("Votes from unknown validators are rejected")
        void testUnknownValidator() {
            Vote vote = Vote.unsigned("mallory", "A", 5, 0, VoteType.PREVOTE, 0);
            vote.setSignature(new byte[64]);
            assertEquals(AddVoteResult.REJECTED, store.addVote(vote));
        }

        @Test
        @DisplayName("Votes with a bad signature are rejected")
        void testBadSignature() {
            Vote vote = validators.vote("val2", "A", 5, 0, VoteType.PREVOTE);
            vote.setBlockId("B");
            assertEquals(AddVoteResult.REJECTED, store.addVote(vote));

            Vote unsigned = Vote.unsigned("val3", "A", 5, 0, VoteType.PREVOTE, 0);
            assertEquals(AddVoteResult.REJECTED, store.addVote(unsigned));
            assertEquals(0, store.powerForBlock(5, 0, VoteType.PREVOTE, "A"));
        }

        @Test
        @DisplayName("Only the current and the next height are kept")
        void testHeightWindow() {
            assertEquals(AddVoteResult.ACCEPTED, store.addVote(validators.vote("val2", "A", 5, 0, VoteType.PRECOMMIT)));
            assertEquals(AddVoteResult.ACCEPTED, store.addVote(validators.vote("val2", "A", 6, 0, VoteType.PREVOTE)));
            assertEquals(AddVoteResult.REJECTED, store.addVote(validators.vote("val2", "A", 4, 0, VoteType.PRECOMMIT)));
            assertEquals(AddVoteResult.REJECTED, store.addVote(validators.vote("val2", "A", 7, 0, VoteType.PREVOTE)));
            assertEquals(AddVoteResult.REJECTED, store.addVote(validators.vote("val2", "A", 5, -1, VoteType.PREVOTE)));
            assertEquals(AddVoteResult.REJECTED, store.addVote(null));
        }
    }

    @Nested
    @DisplayName("Majorities")
    class MajorityTests {
        @Test
        @DisplayName("Three of four matching votes form a majority")
        void testBlockMajority() {
            store.addVote(validators.vote("val1", "A", 5, 0, VoteType.PREVOTE));
            store.addVote(validators.vote("val2", "A", 5, 0, VoteType.PREVOTE));
            assertFalse(store.twoThirdsMajority(5, 0, VoteType.PREVOTE).isPresent());

            store.addVote(validators.vote("val3", "A", 5, 0, VoteType.PREVOTE));
            Optional<Majority> majority = store.twoThirdsMajority(5, 0, VoteType.PREVOTE);
            assertTrue(majority.isPresent());
            assertEquals("A", majority.get().getBlockId());
            assertEquals(3, majority.get().getPower());
        }

        @Test
        @DisplayName("Nil can hold the majority")
        void testNilMajority() {
            store.addVote(validators.vote("val1", null, 5, 2, VoteType.PRECOMMIT));
            store.addVote(validators.vote("val2", null, 5, 2, VoteType.PRECOMMIT));
            store.addVote(validators.vote("val3", null, 5, 2, VoteType.PRECOMMIT));
            Optional<Majority> majority = store.twoThirdsMajority(5, 2, VoteType.PRECOMMIT);
            assertTrue(majority.isPresent());
            assertTrue(majority.get().isNil());
        }

        @Test
        @DisplayName("A split vote has two thirds overall but no majority")
        void testSplitVote() {
            store.addVote(validators.vote("val1", "A", 5, 0, VoteType.PREVOTE));
            store.addVote(validators.vote("val2", "A", 5, 0, VoteType.PREVOTE));
            store.addVote(validators.vote("val3", "B", 5, 0, VoteType.PREVOTE));
            store.addVote(validators.vote("val4", null, 5, 0, VoteType.PREVOTE));
            assertTrue(store.hasTwoThirdsAny(5, 0, VoteType.PREVOTE));
            assertFalse(store.twoThirdsMajority(5, 0, VoteType.PREVOTE).isPresent());
        }

        @Test
        @DisplayName("Arrival order does not change the tally")
        void testOrderIndependence() {
            List<Vote> votes = new ArrayList<>();
            votes.add(validators.vote("val1", "A", 5, 1, VoteType.PREVOTE));
            votes.add(validators.vote("val2", "B", 5, 1, VoteType.PREVOTE));
            votes.add(validators.vote("val2", "A", 5, 1, VoteType.PREVOTE));
            votes.add(validators.vote("val3", "A", 5, 1, VoteType.PREVOTE));
            votes.add(validators.vote("val4", null, 5, 1, VoteType.PREVOTE));

            Random random = new Random(7);
            for (int i = 0; i < 20; i++) {
                List<Vote> shuffled = new ArrayList<>(votes);
                Collections.shuffle(shuffled, random);
                VoteStore fresh = new VoteStore(validators.signer("val1"), 5, validators.getValidatorSet());
                shuffled.forEach(fresh::addVote);
                // val2 ends on whichever of its votes came last
                long expectedA = shuffled.indexOf(votes.get(2)) > shuffled.indexOf(votes.get(1)) ? 3 : 2;
                assertEquals(expectedA, fresh.powerForBlock(5, 1, VoteType.PREVOTE, "A"));
                assertEquals(4, fresh.votingPowerInRound(5, 1));
            }
        }

        @Test
        void testVotingPowerCountsValidatorsOnce() {
            store.addVote(validators.vote("val2", "A", 5, 3, VoteType.PREVOTE));
            store.addVote(validators.vote("val2", "A", 5, 3, VoteType.PRECOMMIT));
            store.addVote(validators.vote("val3", null, 5, 3, VoteType.PRECOMMIT));
            assertEquals(2, store.votingPowerInRound(5, 3));
            assertEquals(0, store.votingPowerInRound(5, 4));
            assertEquals(List.of(3), new ArrayList<>(store.roundsWithVotes(5)));
        }
    }

    @Nested
    @DisplayName("Advancing height")
    class AdvanceTests {
        @Test
        @DisplayName("Votes of the committed height are purged")
        void testPurge() {
            store.addVote(validators.vote("val2", "A", 5, 0, VoteType.PRECOMMIT));
            store.addVote(validators.vote("val2", "B", 6, 0, VoteType.PREVOTE));
            assertEquals(2, store.voteSetCount());

            store.advanceTo(6, validators.getValidatorSet());
            assertEquals(6, store.getCurrentHeight());
            assertEquals(1, store.voteSetCount());
            assertTrue(store.getVotes(5, 0, VoteType.PRECOMMIT).isEmpty());
            assertEquals(AddVoteResult.REJECTED, store.addVote(validators.vote("val3", "A", 5, 0, VoteType.PRECOMMIT)));
            assertEquals(1, store.powerForBlock(6, 0, VoteType.PREVOTE, "B"));
        }

        @Test
        @DisplayName("Buffered votes are re-tallied against the new validator set")
        void testRetally() {
            store.addVote(validators.vote("val2", "B", 6, 0, VoteType.PREVOTE));
            store.addVote(validators.vote("val4", "B", 6, 0, VoteType.PREVOTE));

            ValidatorSet next = ValidatorSet.ofEqualPower(List.of("val1", "val2", "val3"), 2);
            store.advanceTo(6, next);
            // val4 left the set, val2 now weighs 2
            assertEquals(2, store.powerForBlock(6, 0, VoteType.PREVOTE, "B"));
            assertEquals(1, store.getVotes(6, 0, VoteType.PREVOTE).size());
        }

        @Test
        void testCannotMoveBack() {
            assertThrows(IllegalArgumentException.class, () -> store.advanceTo(4, validators.getValidatorSet()));
        }
    }
}
