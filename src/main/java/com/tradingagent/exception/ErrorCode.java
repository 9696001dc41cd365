package com.tradingagent.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    AGENT_STATE_CONFLICT("AGENT_STATE_CONFLICT", 409),
    INVARIANT_VIOLATION("INVARIANT_VIOLATION", 500),
    PERSISTENCE_ERROR("PERSISTENCE_ERROR", 500),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    VENUE_ERROR("VENUE_ERROR", 502),
    COLLABORATOR_UNAVAILABLE("COLLABORATOR_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
