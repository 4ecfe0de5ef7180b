package org.calista.accuracy.error;

import java.util.Objects;

/**
 * Raised by the convenience wrappers ({@code of(...)}, {@code orElseThrow()}) when a caller
 * treats invalid construction as a programmer error.
 *
 * <p>The failable factories never throw this; they return an {@link Outcome}.
 */
public final class AccuracyException extends IllegalArgumentException {

    private final ErrorCode code;

    public AccuracyException(String subject, ErrorCode code) {
        super("Invalid " + subject + ": " + Objects.requireNonNull(code, "code").label());
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
