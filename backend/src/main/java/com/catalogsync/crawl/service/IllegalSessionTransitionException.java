package com.catalogsync.crawl.service;

import com.catalogsync.crawl.model.SessionStatus;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class IllegalSessionTransitionException extends RuntimeException {
    private final String sessionId;
    private final SessionStatus from;
    private final SessionStatus to;

    public IllegalSessionTransitionException(String sessionId, SessionStatus from, SessionStatus to) {
        super("Session " + sessionId + " cannot move from " + label(from) + " to " + label(to));
        this.sessionId = sessionId;
        this.from = from;
        this.to = to;
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionStatus getFrom() {
        return from;
    }

    public SessionStatus getTo() {
        return to;
    }

    private static String label(SessionStatus status) {
        return status == null ? "none" : status.dbValue();
    }
}
