package org.huarongdao;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Base of every solver failure, carrying a deterministic reason code.
 *
 * <p>Messages are prefixed with {@code [REASON_CODE]} so callers and logs can match on the
 * failure class without parsing free text.</p>
 */
@Getter
@Accessors(fluent = true)
public abstract class PuzzleException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    protected PuzzleException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     * @param cause underlying exception.
     */
    protected PuzzleException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
