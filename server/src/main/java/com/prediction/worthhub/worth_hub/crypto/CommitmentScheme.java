package com.prediction.worthhub.worth_hub.crypto;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.security.MessageDigest;

import com.prediction.worthhub.worth_hub.entity.Identity;
import com.prediction.worthhub.worth_hub.error.ErrorCode;
import com.prediction.worthhub.worth_hub.error.WorthHubException;

/**
 * Binding, hiding commitment over a prediction:
 *
 * <pre>
 * hash = keccak256(prediction_value as 8 little-endian bytes ‖ salt[32] ‖ participant[32])
 * </pre>
 *
 * Binding the participant identity into the preimage stops one participant
 * from copying another's commitment. The salt is generated and kept by the
 * participant; without it the commitment can never be revealed.
 */
public class CommitmentScheme {

    public static final int SALT_LENGTH = 32;
    public static final int HASH_LENGTH = Keccak256.DIGEST_LENGTH;

    public byte[] compute(long predictionValue, byte[] salt, Identity participant) {
        requireSalt(salt);
        byte[] prediction = ByteBuffer.allocate(Long.BYTES)
                .order(ByteOrder.LITTLE_ENDIAN)
                .putLong(predictionValue)
                .array();
        return Keccak256.hash(prediction, salt, participant.toBytes());
    }

    /**
     * Recompute and compare in constant time.
     *
     * @return true if the revealed values open {@code commitmentHash}
     */
    public boolean verify(byte[] commitmentHash, long predictionValue, byte[] salt, Identity participant) {
        requireHash(commitmentHash);
        return MessageDigest.isEqual(commitmentHash, compute(predictionValue, salt, participant));
    }

    public static void requireHash(byte[] commitmentHash) {
        if (commitmentHash == null || commitmentHash.length != HASH_LENGTH) {
            throw new WorthHubException(ErrorCode.InvalidCommitmentHash);
        }
    }

    public static void requireSalt(byte[] salt) {
        if (salt == null || salt.length != SALT_LENGTH) {
            throw new WorthHubException(ErrorCode.InvalidSalt);
        }
    }
}
