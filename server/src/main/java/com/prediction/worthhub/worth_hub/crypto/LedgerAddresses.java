package com.prediction.worthhub.worth_hub.crypto;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

import com.prediction.worthhub.worth_hub.entity.Identity;

/**
 * Deterministic record addresses.
 *
 * topic      = derive("topic", topicId as u64 LE)
 * vault      = derive("vault", topic)
 * commitment = derive("commitment", topic, participant)
 *
 * Seeds are length-prefixed so that distinct seed lists never collide.
 */
public final class LedgerAddresses {

    private static final byte[] NAMESPACE = "worth_hub".getBytes(StandardCharsets.UTF_8);

    private LedgerAddresses() {
    }

    public static Identity topic(long topicId) {
        byte[] id = ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN).putLong(topicId).array();
        return derive(seed("topic"), id);
    }

    public static Identity vault(Identity topicAddress) {
        return derive(seed("vault"), topicAddress.toBytes());
    }

    public static Identity commitment(Identity topicAddress, Identity participant) {
        return derive(seed("commitment"), topicAddress.toBytes(), participant.toBytes());
    }

    private static Identity derive(byte[]... seeds) {
        int length = NAMESPACE.length;
        for (byte[] s : seeds) {
            length += 1 + s.length;
        }
        ByteBuffer buffer = ByteBuffer.allocate(length).put(NAMESPACE);
        for (byte[] s : seeds) {
            buffer.put((byte) s.length).put(s);
        }
        return Identity.of(Keccak256.hash(buffer.array()));
    }

    private static byte[] seed(String label) {
        return label.getBytes(StandardCharsets.UTF_8);
    }
}
