package org.stocktake.exception;

public class SessionConflictException extends StockSessionException {

    private final String existingSessionId;

    public SessionConflictException(String existingSessionId, String message) {
        super("SESSION_CONFLICT", message);
        this.existingSessionId = existingSessionId;
    }

    public String getExistingSessionId() {
        return existingSessionId;
    }
}
