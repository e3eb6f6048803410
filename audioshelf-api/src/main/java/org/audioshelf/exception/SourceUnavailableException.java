package org.audioshelf.exception;

import lombok.Getter;

/**
 * A source adapter could not be reached (transport failure, timeout, auth). Never fatal: the
 * cascade moves on to the next source.
 */
@Getter
public class SourceUnavailableException extends Exception {

    private final String source;

    public SourceUnavailableException(String source, String message) {
        super(message);
        this.source = source;
    }

    public SourceUnavailableException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }
}
