package uk.gegc.readlater.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Raised when a bulk action request cannot be executed: the action kind is missing
 * or unsupported, or a label action arrives without labels. Always thrown before
 * any row is written.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidBulkActionException extends RuntimeException {

    public InvalidBulkActionException(String message) {
        super(message);
    }
}
