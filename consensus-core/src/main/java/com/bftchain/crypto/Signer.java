package com.bftchain.crypto;

/**
 * Signing capability of one validator plus verification of every
 * validator's signatures.
 */
public interface Signer {
    /**
     * @return identity of the validator whose key this signer holds
     */
    String getValidatorId();

    /**
     * Signs the given canonical bytes with this validator's key
     */
    byte[] sign(byte[] message);

    /**
     * Verifies a signature produced by the given validator
     *
     * @return false for unknown identities or bad signatures, never throws
     */
    boolean verify(String validatorId, byte[] message, byte[] signature);
}
