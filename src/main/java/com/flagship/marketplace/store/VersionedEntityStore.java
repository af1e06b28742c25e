package com.flagship.marketplace.store;

import com.flagship.marketplace.error.MarketplaceException;
import com.flagship.marketplace.error.VersionConflictException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.OptimisticLockException;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.StaleStateException;
import org.hibernate.exception.ConstraintViolationException;
import org.hibernate.exception.JDBCConnectionException;
import org.hibernate.exception.LockAcquisitionException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Durable storage for a top-level aggregate with optimistic version stamps.
 *
 * <ul>
 *   <li>{@code create} stores a new row at version 1.</li>
 *   <li>{@code update} compares the stored version with the caller's expected
 *   version, applies the mutator to the current domain value and writes it
 *   with a versioned UPDATE, so the first writer wins and every other
 *   writer of the same version gets {@link VersionConflictException}.</li>
 *   <li>Unique-constraint violations and deadlocks raised by concurrent
 *   writers are reported as version conflicts too; a lost database connection is
 *   reported as UNAVAILABLE.</li>
 * </ul>
 *
 * Writes join the caller's database transaction, so several updates and the
 * messages and notifications they cause commit or roll back together.
 *
 * @param <D> immutable domain type
 * @param <E> JPA entity type
 */
@Slf4j
public abstract class VersionedEntityStore<D, E extends VersionedEntity<D>> {

    public static final long INITIAL_VERSION = 1L;

    @PersistenceContext
    private EntityManager entityManager;

    private final Class<E> entityType;
    private final String entityName;

    protected VersionedEntityStore(Class<E> entityType, String entityName) {
        this.entityType = entityType;
        this.entityName = entityName;
    }

    /**
     * Builds a new entity at {@link #INITIAL_VERSION} from a domain value.
     */
    protected abstract E newEntity(D domain);

    protected EntityManager entityManager() {
        return entityManager;
    }

    @Transactional(readOnly = true)
    public Optional<D> find(UUID id) {
        return Optional.ofNullable(entityManager.find(entityType, id)).map(VersionedEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public D get(UUID id) {
        return find(id).orElseThrow(() -> MarketplaceException.notFound(entityName, id));
    }

    @Transactional
    public D create(D domain) {
        E entity = newEntity(domain);
        try {
            entityManager.persist(entity);
            entityManager.flush();
        } catch (PersistenceException e) {
            throw translate(e, entity.getId(), INITIAL_VERSION);
        }
        log.debug("Created {} {} at version {}", entityName, entity.getId(), entity.getVersion());
        return entity.toDomain();
    }

    @Transactional
    public D update(UUID id, long expectedVersion, UnaryOperator<D> mutator) {
        E entity = entityManager.find(entityType, id);
        if (entity == null) {
            throw MarketplaceException.notFound(entityName, id);
        }
        if (entity.getVersion() != expectedVersion) {
            throw new VersionConflictException(entityName, id, expectedVersion, entity.getVersion());
        }

        D updated = mutator.apply(entity.toDomain());
        entity.updateFromDomain(updated);

        try {
            entityManager.flush();
        } catch (PersistenceException e) {
            throw translate(e, id, expectedVersion);
        } catch (OptimisticLockingFailureException e) {
            throw new VersionConflictException(entityName, id, expectedVersion, e);
        }

        log.debug("Updated {} {} from version {} to {}", entityName, id, expectedVersion, entity.getVersion());
        return entity.toDomain();
    }

    private RuntimeException translate(PersistenceException e, UUID id, long expectedVersion) {
        if (e instanceof OptimisticLockException || hasCause(e, StaleStateException.class)) {
            return new VersionConflictException(entityName, id, expectedVersion, e);
        }
        if (hasCause(e, LockAcquisitionException.class)) {
            log.info("Write on {} {} lost a lock race: {}", entityName, id, e.getMessage());
            return new VersionConflictException(entityName, id, expectedVersion, e);
        }
        if (hasCause(e, ConstraintViolationException.class)) {
            log.info("Concurrent write on {} {} violated a unique constraint: {}", entityName, id, e.getMessage());
            return new VersionConflictException(entityName, id, expectedVersion, e);
        }
        if (hasCause(e, JDBCConnectionException.class)) {
            return MarketplaceException.unavailable("Storage unavailable while writing " + entityName + " " + id, e);
        }
        return e;
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (type.isInstance(current)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }
}
