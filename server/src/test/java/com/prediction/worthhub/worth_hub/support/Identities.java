package com.prediction.worthhub.worth_hub.support;

import java.util.Arrays;

import com.prediction.worthhub.worth_hub.entity.Identity;

public final class Identities {

    private Identities() {
    }

    /** 32 bytes all set to {@code fill}. */
    public static Identity identity(int fill) {
        byte[] bytes = new byte[Identity.LENGTH];
        Arrays.fill(bytes, (byte) fill);
        return Identity.of(bytes);
    }

    public static byte[] salt(int fill) {
        byte[] salt = new byte[32];
        Arrays.fill(salt, (byte) fill);
        return salt;
    }
}
