package com.flagship.marketplace.error;

import lombok.Getter;

import java.util.UUID;

/**
 * A version-checked write lost against a concurrent writer.
 * No state was changed by the losing call.
 */
@Getter
public class VersionConflictException extends MarketplaceException {

    private final String entityName;
    private final UUID entityId;
    private final long expectedVersion;
    private final Long actualVersion;

    public VersionConflictException(String entityName, UUID entityId, long expectedVersion, long actualVersion) {
        super(ErrorKind.VERSION_CONFLICT, String.format(
                "%s %s was modified concurrently: expected version %d but found %d",
                entityName, entityId, expectedVersion, actualVersion));
        this.entityName = entityName;
        this.entityId = entityId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public VersionConflictException(String entityName, UUID entityId, long expectedVersion, Throwable cause) {
        super(ErrorKind.VERSION_CONFLICT, String.format(
                "%s %s was modified concurrently while applying version %d",
                entityName, entityId, expectedVersion), cause);
        this.entityName = entityName;
        this.entityId = entityId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = null;
    }
}
