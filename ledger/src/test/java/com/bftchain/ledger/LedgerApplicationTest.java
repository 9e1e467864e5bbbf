package com.bftchain.ledger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.bftchain.app.BlockApplicationException;
import com.bftchain.model.Block;

public class LedgerApplicationTest {
    private TransactionPool pool;
    private InMemoryBlockchain chain;
    private LedgerApplication application;

    @BeforeEach
    public void setup() {
        pool = new TransactionPool(100);
        chain = new InMemoryBlockchain();
        application = new LedgerApplication(pool, chain, 2);
    }

    @Nested
    @DisplayName("Block creation")
    class CreateTests {
        @Test
        @DisplayName("A new block takes the oldest pending transactions up to the limit")
        void testCreateFromPool() {
            application.submit("a");
            application.submit("b");
            application.submit("c");

            Block block = application.createBlock(1, "val1", null);
            assertEquals(1, block.getHeight());
            assertNull(block.getPreviousBlockId());
            assertEquals("val1", block.getProposerId());
            assertEquals(List.of("a", "b"), block.getTransactions());
            assertTrue(block.hasValidId());
        }

        @Test
        @DisplayName("An empty pool still produces a block")
        void testEmptyBlock() {
            Block block = application.createBlock(1, "val1", null);
            assertTrue(block.getTransactions().isEmpty());
            assertTrue(application.validateBlock(block));
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {
        @Test
        void testAcceptsNextBlock() {
            assertTrue(application.validateBlock(new Block(1, null, "val2", 1, List.of("x", "y"))));
        }

        @Test
        void testRejectsWrongHeightOrParent() {
            assertFalse(application.validateBlock(new Block(2, null, "val2", 1, List.of())));
            assertFalse(application.validateBlock(new Block(1, "parent", "val2", 1, List.of())));
        }

        @Test
        void testRejectsOversizedBlock() {
            assertFalse(application.validateBlock(new Block(1, null, "val2", 1, List.of("x", "y", "z"))));
        }

        @Test
        void testRejectsDuplicateTransactions() {
            assertFalse(application.validateBlock(new Block(1, null, "val2", 1, List.of("x", "x"))));
        }

        @Test
        @DisplayName("Transactions already on the chain cannot be replayed")
        void testRejectsReplay() throws BlockApplicationException {
            Block first = new Block(1, null, "val2", 1, List.of("x"));
            application.onCommit(1, first.getBlockId(), first);
            assertFalse(application.validateBlock(new Block(2, first.getBlockId(), "val3", 2, List.of("x"))));
            assertTrue(application.validateBlock(new Block(2, first.getBlockId(), "val3", 2, List.of("y"))));
        }
    }

    @Nested
    @DisplayName("Commit")
    class CommitTests {
        @Test
        @DisplayName("Committing appends to the chain and prunes the pool")
        void testCommitPrunesPool() throws BlockApplicationException {
            application.submit("a");
            application.submit("b");
            application.submit("c");
            Block block = application.createBlock(1, "val1", null);

            application.onCommit(1, block.getBlockId(), block);

            assertEquals(1, chain.getHeight());
            assertEquals(1, pool.size());
            assertTrue(pool.contains(Transaction.idOf("c")));
        }

        @Test
        @DisplayName("A block committed out of order raises an application error")
        void testOutOfOrderCommit() {
            Block block = new Block(2, "parent", "val1", 1, List.of());
            assertThrows(BlockApplicationException.class, () -> application.onCommit(2, block.getBlockId(), block));
        }

        @Test
        @DisplayName("Committed payloads are refused on resubmission")
        void testSubmitCommittedPayload() throws BlockApplicationException {
            application.submit("a");
            Block block = application.createBlock(1, "val1", null);
            application.onCommit(1, block.getBlockId(), block);

            SubmitResult result = application.submit("a");
            assertFalse(result.isAccepted());
            assertEquals("Transaction already committed", result.getError());
            assertFalse(application.submit("").isAccepted());
        }
    }
}
