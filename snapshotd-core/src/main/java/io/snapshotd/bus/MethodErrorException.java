package io.snapshotd.bus;

import java.util.Objects;

/**
 * Error reply received by a caller of {@link LocalMessageBus#invoke}.
 */
public final class MethodErrorException extends RuntimeException {

    private final String errorName;

    public MethodErrorException(String errorName, String message) {
        super(message);
        this.errorName = Objects.requireNonNull(errorName, "errorName");
    }

    public String errorName() {
        return errorName;
    }
}
