package com.tradingagent.exception;

import java.util.Map;

/**
 * A capital-safety or lifecycle invariant was broken. Always a programming error:
 * the current cycle is aborted and the agent stays faulted until
 * {@code TradingLoopAgent.recoverFromFault()} is called.
 */
public class InvariantViolationException extends BaseException {

    public InvariantViolationException(String message) {
        super(ErrorCode.INVARIANT_VIOLATION, message);
    }

    public InvariantViolationException(String message, Map<String, Object> details) {
        super(ErrorCode.INVARIANT_VIOLATION, message, details);
    }
}
