package org.audioshelf.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ApiError {
    ENTITY_NOT_FOUND(HttpStatus.NOT_FOUND, "Book entity not found with id: %s"),
    INVALID_STATUS(HttpStatus.BAD_REQUEST, "Invalid approval status: %s"),
    DIRECTORY_NOT_FOUND(HttpStatus.BAD_REQUEST, "Directory does not exist or is not readable: %s"),
    LIBRARY_ROOT_NOT_CONFIGURED(HttpStatus.BAD_REQUEST, "No scan root given and app.library-root is not set"),
    SCAN_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to scan directory %s: %s");

    private final HttpStatus status;
    private final String message;

    ApiError(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    public APIException createException(Object... details) {
        String formattedMessage = (details.length > 0) ? String.format(message, details) : message;
        return new APIException(formattedMessage, this.status);
    }
}
