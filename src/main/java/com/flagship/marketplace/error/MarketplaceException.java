package com.flagship.marketplace.error;

import lombok.Getter;

import java.util.UUID;

/**
 * Recoverable failure of a marketplace operation.
 *
 * The message always names the precondition that failed, for example
 * "Offer 3f2a... is already ACCEPTED", because clients race each other on
 * the same offer or transaction and need to know which check lost.
 */
@Getter
public class MarketplaceException extends RuntimeException {

    private final ErrorKind kind;

    public MarketplaceException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MarketplaceException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static MarketplaceException notFound(String entityName, Object id) {
        return new MarketplaceException(ErrorKind.NOT_FOUND, entityName + " " + id + " not found");
    }

    public static MarketplaceException notAuthorized(String message) {
        return new MarketplaceException(ErrorKind.NOT_AUTHORIZED, message);
    }

    public static MarketplaceException invalidState(String message) {
        return new MarketplaceException(ErrorKind.INVALID_STATE, message);
    }

    public static MarketplaceException invalidAmount(String message) {
        return new MarketplaceException(ErrorKind.INVALID_AMOUNT, message);
    }

    public static MarketplaceException selfDealing(UUID userId) {
        return new MarketplaceException(ErrorKind.SELF_DEALING,
                "User " + userId + " cannot trade with themselves");
    }

    public static MarketplaceException validation(String message) {
        return new MarketplaceException(ErrorKind.VALIDATION_ERROR, message);
    }

    public static MarketplaceException unavailable(String message, Throwable cause) {
        return new MarketplaceException(ErrorKind.UNAVAILABLE, message, cause);
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
