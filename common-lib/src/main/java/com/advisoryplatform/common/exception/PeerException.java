package com.advisoryplatform.common.exception;

/**
 * Raised inside a peer call chain when a peer answered but the answer is unusable
 * (non-2xx status). Always recovered by the acquirer; never reaches advisory callers.
 */
public class PeerException extends RuntimeException {
    private final String coreName;
    private final int statusCode;

    public PeerException(String coreName, int statusCode, String message) {
        super("[" + coreName + "] HTTP " + statusCode + " " + message);
        this.coreName   = coreName;
        this.statusCode = statusCode;
    }

    public String getCoreName() {
        return coreName;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
