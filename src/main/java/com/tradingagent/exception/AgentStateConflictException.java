package com.tradingagent.exception;

import java.util.Map;

public class AgentStateConflictException extends BaseException {

    public AgentStateConflictException(String message, Map<String, Object> details) {
        super(ErrorCode.AGENT_STATE_CONFLICT, message, details);
    }
}
