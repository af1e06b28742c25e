package com.flagship.marketplace.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Closed set of failures a caller can receive from an offer, transaction,
 * evidence or message operation.
 */
@Getter
public enum ErrorKind {
    NOT_FOUND(HttpStatus.NOT_FOUND, false),
    /** Wrong role or party for the action. */
    NOT_AUTHORIZED(HttpStatus.FORBIDDEN, false),
    /** Action not valid from the entity's current status. */
    INVALID_STATE(HttpStatus.CONFLICT, false),
    INVALID_AMOUNT(HttpStatus.UNPROCESSABLE_ENTITY, false),
    SELF_DEALING(HttpStatus.UNPROCESSABLE_ENTITY, false),
    /** A concurrent write won; re-read and re-evaluate before retrying. */
    VERSION_CONFLICT(HttpStatus.CONFLICT, true),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, false),
    /** Storage or a collaborator is down; nothing was written. */
    UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, true);

    private final HttpStatus httpStatus;
    private final boolean retryable;

    ErrorKind(HttpStatus httpStatus, boolean retryable) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }
}
