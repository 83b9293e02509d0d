package com.prediction.worthhub.worth_hub.support;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;

import com.prediction.worthhub.worth_hub.error.ErrorCode;
import com.prediction.worthhub.worth_hub.error.WorthHubException;

public final class ErrorAssertions {

    private ErrorAssertions() {
    }

    public static void assertRejected(ThrowingCallable call, ErrorCode expected) {
        assertThatThrownBy(call)
                .isInstanceOfSatisfying(WorthHubException.class,
                        e -> assertThat(e.getCode()).isEqualTo(expected));
    }
}
