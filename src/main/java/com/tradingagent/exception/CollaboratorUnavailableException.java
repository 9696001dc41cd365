package com.tradingagent.exception;

import java.util.Map;
import lombok.Getter;

/**
 * An external call exhausted its call policy (attempts or time budget).
 * Stages map this to their safe fallback transition.
 */
@Getter
public class CollaboratorUnavailableException extends BaseException {

    private final String callName;
    private final boolean timedOut;

    public CollaboratorUnavailableException(String callName, boolean timedOut, Throwable cause) {
        super(
                ErrorCode.COLLABORATOR_UNAVAILABLE,
                (timedOut ? "Timed out calling " : "Failed calling ") + callName
                        + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""),
                Map.of("call", callName, "timedOut", timedOut),
                cause);
        this.callName = callName;
        this.timedOut = timedOut;
    }
}
