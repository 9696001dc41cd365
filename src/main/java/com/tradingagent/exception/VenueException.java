package com.tradingagent.exception;

import java.util.Map;

/** Thrown by {@code TradingPlatformGateway} implementations when the venue refuses or fails a request. */
public class VenueException extends BaseException {

    public VenueException(String message) {
        super(ErrorCode.VENUE_ERROR, message);
    }

    public VenueException(String message, Map<String, Object> details) {
        super(ErrorCode.VENUE_ERROR, message, details);
    }

    public VenueException(String message, Throwable cause) {
        super(ErrorCode.VENUE_ERROR, message, cause);
    }
}
