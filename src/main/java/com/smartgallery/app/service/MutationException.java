package com.smartgallery.app.service;

/** A rejected or failed index mutation. {@link #reason()} tells handlers how to report it. */
public class MutationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        INVALID_NAME,
        NOT_FOUND,
        CONFLICT,
        SAME_NAME,
        IO_FAILURE
    }

    private final Reason reason;

    public MutationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public MutationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
