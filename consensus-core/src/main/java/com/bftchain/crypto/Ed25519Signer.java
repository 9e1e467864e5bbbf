package com.bftchain.crypto;

import java.util.HashMap;
import java.util.Map;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.util.encoders.Hex;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class Ed25519Signer implements Signer {
    public static final int KEY_LENGTH = Ed25519PrivateKeyParameters.KEY_SIZE;

    private final String validatorId;
    private final Ed25519PrivateKeyParameters privateKey;
    private final Map<String, Ed25519PublicKeyParameters> publicKeys;

    /**
     * @param validatorId identity of the local validator
     * @param privateKey  local signing key
     * @param publicKeys  verification keys of every validator, the local one
     *                    included or not
     */
    public Ed25519Signer(String validatorId, Ed25519PrivateKeyParameters privateKey,
            Map<String, Ed25519PublicKeyParameters> publicKeys) {
        this.validatorId = validatorId;
        this.privateKey = privateKey;
        this.publicKeys = new HashMap<>(publicKeys);
        this.publicKeys.put(validatorId, privateKey.generatePublicKey());
    }

    /**
     * Builds a signer from a hex 32 byte seed and hex encoded public keys.
     */
    public static Ed25519Signer fromHex(String validatorId, String privateSeedHex, Map<String, String> publicKeysHex) {
        Ed25519PrivateKeyParameters privateKey = privateKeyFromSeed(Hex.decode(privateSeedHex));
        Map<String, Ed25519PublicKeyParameters> keys = new HashMap<>();
        for (Map.Entry<String, String> entry : publicKeysHex.entrySet()) {
            if (entry.getValue() == null || entry.getValue().isBlank()) {
                continue;
            }
            keys.put(entry.getKey(), new Ed25519PublicKeyParameters(Hex.decode(entry.getValue()), 0));
        }
        return new Ed25519Signer(validatorId, privateKey, keys);
    }

    public static Ed25519PrivateKeyParameters privateKeyFromSeed(byte[] seed) {
        if (seed.length != KEY_LENGTH) {
            throw new IllegalArgumentException("Ed25519 seed must be " + KEY_LENGTH + " bytes, got " + seed.length);
        }
        return new Ed25519PrivateKeyParameters(seed, 0);
    }

    public static String publicKeyHex(Ed25519PrivateKeyParameters privateKey) {
        return Hex.toHexString(privateKey.generatePublicKey().getEncoded());
    }

    @Override
    public String getValidatorId() {
        return validatorId;
    }

    public String getPublicKeyHex() {
        return publicKeyHex(privateKey);
    }

    @Override
    public byte[] sign(byte[] message) {
        org.bouncycastle.crypto.signers.Ed25519Signer signer = new org.bouncycastle.crypto.signers.Ed25519Signer();
        signer.init(true, privateKey);
        signer.update(message, 0, message.length);
        return signer.generateSignature();
    }

    @Override
    public boolean verify(String signerId, byte[] message, byte[] signature) {
        if (signature == null || message == null) {
            return false;
        }
        Ed25519PublicKeyParameters publicKey = publicKeys.get(signerId);
        if (publicKey == null) {
            log.debug("No public key registered for {}", signerId);
            return false;
        }
        org.bouncycastle.crypto.signers.Ed25519Signer verifier = new org.bouncycastle.crypto.signers.Ed25519Signer();
        verifier.init(false, publicKey);
        verifier.update(message, 0, message.length);
        return verifier.verifySignature(signature);
    }
}
