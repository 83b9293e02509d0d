package com.prediction.worthhub.worth_hub.crypto;

import org.bouncycastle.crypto.digests.KeccakDigest;

/**
 * Keccak-256 as used by the ledger (original Keccak padding, not NIST SHA3-256).
 */
public final class Keccak256 {

    public static final int DIGEST_LENGTH = 32;

    private Keccak256() {
    }

    /**
     * Hash the concatenation of all parts.
     */
    public static byte[] hash(byte[]... parts) {
        KeccakDigest digest = new KeccakDigest(256);
        for (byte[] part : parts) {
            digest.update(part, 0, part.length);
        }
        byte[] out = new byte[DIGEST_LENGTH];
        digest.doFinal(out, 0);
        return out;
    }
}
