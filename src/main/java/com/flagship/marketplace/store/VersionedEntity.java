package com.flagship.marketplace.store;

import java.util.UUID;

/**
 * JPA entity whose rows are only changed through {@link VersionedEntityStore#update}.
 *
 * @param <D> immutable domain type mapped by the entity
 */
public interface VersionedEntity<D> {

    UUID getId();

    long getVersion();

    D toDomain();

    /**
     * Copies the mutable fields of the domain value into the entity.
     * Identity, parties, amount and version are never copied.
     */
    void updateFromDomain(D domain);
}
