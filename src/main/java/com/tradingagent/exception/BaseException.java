package com.tradingagent.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the agent's own failures. The {@link ErrorCode} decides how the failure surfaces
 * over HTTP; {@code details} carries the identifiers an operator needs (asset pair,
 * reservation id, call name) and ends up verbatim in the error response.
 *
 * <p>Inside the trading loop only two families are expected: {@link VenueException} and
 * {@link CollaboratorUnavailableException} degrade the current stage, while an
 * {@link InvariantViolationException} aborts the cycle and faults the agent.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    /** True when the agent, not the caller, is at fault. */
    public boolean isServerSide() {
        return errorCode.getHttpStatus() >= 500;
    }
}
