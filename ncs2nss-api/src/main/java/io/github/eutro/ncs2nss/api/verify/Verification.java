package io.github.eutro.ncs2nss.api.verify;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The outcome of recompiling decompiled source.
 */
public final class Verification {
    public enum Status {
        PASSED,
        FAILED,
        /**
         * The user declined to run the verifier.
         */
        DECLINED,
    }

    @NotNull
    public final Status status;
    public final List<String> messages;

    public Verification(@NotNull Status status, List<String> messages) {
        this.status = status;
        this.messages = Collections.unmodifiableList(new ArrayList<>(messages));
    }

    public static Verification passed(String... messages) {
        return new Verification(Status.PASSED, Arrays.asList(messages));
    }

    public static Verification failed(String... messages) {
        return new Verification(Status.FAILED, Arrays.asList(messages));
    }

    public static Verification declined() {
        return new Verification(Status.DECLINED, Collections.emptyList());
    }

    public boolean isSuccess() {
        return status == Status.PASSED;
    }

    @Override
    public String toString() {
        return messages.isEmpty() ? status.toString() : status + ": " + String.join("; ", messages);
    }
}
