package org.Aayush.sparse.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Sparse-matrix contract violation with a deterministic reason code.
 *
 * <p>Raised for misuse that the type system cannot rule out: wrong coordinate
 * arity, negative coordinates, stepping past either end of an iteration, or
 * an unresolvable store configuration.</p>
 */
@Getter
public final class MatrixContractException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded contract failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public MatrixContractException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded contract failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public MatrixContractException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Prefixes the message with its reason code, as in {@code [SM_ARITY_MISMATCH] expected 2 coordinates}.
     */
    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    /**
     * Rejects null or blank reason codes.
     */
    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
