package com.tanmi.core.error;

/**
 * Typed failure raised by the engine's services.
 *
 * <p>The caller is usually an autonomous agent, so rejections may carry a
 * {@link #getSuggestion() suggestion} describing the action that would succeed.
 */
public class TanmiException extends RuntimeException {

    private final ErrorCode code;
    private final String suggestion;

    public TanmiException(ErrorCode code, String message) {
        this(code, message, null);
    }

    public TanmiException(ErrorCode code, String message, String suggestion) {
        super(message);
        this.code = code;
        this.suggestion = suggestion;
    }

    public ErrorCode getCode() {
        return code;
    }

    /** Remediation hint, or null when none applies. */
    public String getSuggestion() {
        return suggestion;
    }

    @Override
    public String toString() {
        return suggestion == null
                ? "%s: %s".formatted(code, getMessage())
                : "%s: %s (%s)".formatted(code, getMessage(), suggestion);
    }
}
