package org.audioshelf.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * An audio container could not be read. Scoped to one member file.
 */
@Getter
public class ExtractionException extends Exception {

    private final Path file;

    public ExtractionException(Path file, String message, Throwable cause) {
        super(message, cause);
        this.file = file;
    }
}
