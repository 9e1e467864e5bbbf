package com.bftchain.crypto;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;

import com.bftchain.model.Block;
import com.bftchain.model.Proposal;
import com.bftchain.model.Vote;

/**
 * Byte layout that gets signed and hashed. Every node must produce the same
 * bytes for the same logical message, so the layout is fixed: a one byte
 * domain tag, then fields in declaration order, integers big-endian, strings
 * as a presence byte, a 4 byte length and UTF-8 bytes.
 * <p>
 * Timestamps and signatures are not part of the vote sign bytes; two votes
 * for the same decision sign the same bytes.
 */
public final class CanonicalEncoding {
    private static final byte VOTE_TAG = 0x01;
    private static final byte PROPOSAL_TAG = 0x02;
    private static final byte BLOCK_TAG = 0x03;

    private CanonicalEncoding() {
    }

    public static byte[] encodeVote(Vote vote) {
        Writer w = new Writer(VOTE_TAG);
        w.writeString(vote.getValidatorId());
        w.writeLong(vote.getHeight());
        w.writeInt(vote.getRound());
        w.writeInt(vote.getType() == null ? -1 : vote.getType().ordinal());
        w.writeString(vote.getBlockId());
        return w.toByteArray();
    }

    public static byte[] encodeProposal(Proposal proposal) {
        Writer w = new Writer(PROPOSAL_TAG);
        w.writeString(proposal.getProposerId());
        w.writeLong(proposal.getHeight());
        w.writeInt(proposal.getRound());
        w.writeString(proposal.getBlockId());
        w.writeLong(proposal.getTimestamp());
        return w.toByteArray();
    }

    public static byte[] encodeBlock(Block block) {
        Writer w = new Writer(BLOCK_TAG);
        w.writeLong(block.getHeight());
        w.writeString(block.getPreviousBlockId());
        w.writeString(block.getProposerId());
        w.writeLong(block.getTimestamp());
        List<String> txs = block.getTransactions();
        w.writeInt(txs == null ? 0 : txs.size());
        if (txs != null) {
            for (String tx : txs) {
                w.writeString(tx);
            }
        }
        return w.toByteArray();
    }

    public static String sha256Hex(byte[] data) {
        return Hex.toHexString(sha256(data));
    }

    public static byte[] sha256(byte[] data) {
        SHA256Digest digest = new SHA256Digest();
        digest.update(data, 0, data.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }

    private static final class Writer {
        private final ByteArrayOutputStream out = new ByteArrayOutputStream(128);
        private final ByteBuffer scratch = ByteBuffer.allocate(Long.BYTES);

        Writer(byte tag) {
            out.write(tag);
        }

        void writeLong(long value) {
            scratch.clear();
            scratch.putLong(value);
            out.write(scratch.array(), 0, Long.BYTES);
        }

        void writeInt(int value) {
            scratch.clear();
            scratch.putInt(value);
            out.write(scratch.array(), 0, Integer.BYTES);
        }

        void writeString(String value) {
            if (value == null) {
                out.write(0);
                return;
            }
            out.write(1);
            byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
            writeInt(bytes.length);
            out.write(bytes, 0, bytes.length);
        }

        byte[] toByteArray() {
            return out.toByteArray();
        }
    }
}
