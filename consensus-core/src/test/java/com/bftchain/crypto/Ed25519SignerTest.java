package com.bftchain.crypto;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.bftchain.cluster.InMemoryCluster;

public class Ed25519SignerTest {
    private Ed25519Signer alice;
    private Ed25519Signer bob;

    @BeforeEach
    public void setup() {
        Ed25519PrivateKeyParameters aliceKey = InMemoryCluster.keyFor("alice");
        Ed25519PrivateKeyParameters bobKey = InMemoryCluster.keyFor("bob");
        Map<String, String> publicKeys = new HashMap<>();
        publicKeys.put("alice", Ed25519Signer.publicKeyHex(aliceKey));
        publicKeys.put("bob", Ed25519Signer.publicKeyHex(bobKey));
        alice = Ed25519Signer.fromHex("alice", Hex.toHexString(aliceKey.getEncoded()), publicKeys);
        bob = Ed25519Signer.fromHex("bob", Hex.toHexString(bobKey.getEncoded()), publicKeys);
    }

    @Test
    public void testSignAndVerify() {
        byte[] message = "prevote".getBytes(StandardCharsets.UTF_8);
        byte[] signature = alice.sign(message);
        assertEquals(64, signature.length);
        assertTrue(bob.verify("alice", message, signature));
        assertTrue(alice.verify("alice", message, signature));
    }

    @Test
    public void testSignatureIsDeterministic() {
        byte[] message = "precommit".getBytes(StandardCharsets.UTF_8);
        assertArrayEquals(alice.sign(message), alice.sign(message));
    }

    @Test
    public void testWrongIdentityFails() {
        byte[] message = "prevote".getBytes(StandardCharsets.UTF_8);
        byte[] signature = alice.sign(message);
        assertFalse(bob.verify("bob", message, signature));
        assertFalse(bob.verify("carol", message, signature));
    }

    @Test
    public void testTamperedMessageFails() {
        byte[] message = "prevote".getBytes(StandardCharsets.UTF_8);
        byte[] signature = alice.sign(message);
        message[0] ^= 1;
        assertFalse(bob.verify("alice", message, signature));
    }

    @Test
    public void testMissingSignatureFails() {
        assertFalse(bob.verify("alice", new byte[] { 1 }, null));
        assertFalse(bob.verify("alice", new byte[] { 1 }, new byte[3]));
    }

    @Test
    public void testSeedLengthIsChecked() {
        assertThrows(IllegalArgumentException.class, () -> Ed25519Signer.privateKeyFromSeed(new byte[16]));
    }
}
