package io.scoreline.tx.core.store.jpa;

import io.scoreline.tx.core.store.IsolationLevel;
import io.scoreline.tx.core.store.StorageScope;
import io.scoreline.tx.core.store.TransactionalStore;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.EntityTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Resource-local JPA store. Every scope gets its own {@link EntityManager} and
 * {@link EntityTransaction}; the entity manager is closed when the scope ends.
 */
public class JpaTransactionalStore implements TransactionalStore {

    private static final Logger log = LoggerFactory.getLogger(JpaTransactionalStore.class);

    private static final boolean HIBERNATE_PRESENT = isPresent("org.hibernate.Session");

    private final EntityManagerFactory entityManagerFactory;
    private final AtomicLong scopeSequence = new AtomicLong(0);

    public JpaTransactionalStore(EntityManagerFactory entityManagerFactory) {
        if (entityManagerFactory == null) {
            throw new IllegalArgumentException("EntityManagerFactory must not be null");
        }
        this.entityManagerFactory = entityManagerFactory;
        log.info("JpaTransactionalStore initialized (hibernate session tuning: {})",
            HIBERNATE_PRESENT ? "enabled" : "unavailable");
    }

    @Override
    public StorageScope beginTransaction(IsolationLevel isolationLevel, boolean readOnly) {
        EntityManager em = entityManagerFactory.createEntityManager();
        try {
            if (HIBERNATE_PRESENT) {
                HibernateSessionSupport.configure(em, isolationLevel, readOnly);
            } else if (isolationLevel != IsolationLevel.READ_COMMITTED) {
                log.warn("Isolation {} requested but cannot be applied without Hibernate", isolationLevel);
            }
            EntityTransaction tx = em.getTransaction();
            tx.begin();
            String id = "jpa-" + scopeSequence.incrementAndGet();
            log.debug("Opened JPA scope {} ({}, readOnly={})", id, isolationLevel, readOnly);
            return new JpaStorageScope(id, em, tx, isolationLevel, readOnly);
        } catch (RuntimeException e) {
            closeQuietly(em);
            throw JpaExceptionTranslator.translate(e);
        }
    }

    @Override
    public void commit(StorageScope scope) {
        JpaStorageScope jpaScope = ownScope(scope);
        if (!jpaScope.isActive()) {
            throw new IllegalStateException("Scope " + scope.getId() + " is no longer active");
        }
        try {
            jpaScope.getTransaction().commit();
            log.debug("Committed JPA scope {}", scope.getId());
        } catch (RuntimeException e) {
            EntityTransaction tx = jpaScope.getTransaction();
            if (tx.isActive()) {
                try {
                    tx.rollback();
                } catch (RuntimeException rollbackError) {
                    log.error("Rollback after failed commit also failed for scope {}", scope.getId(), rollbackError);
                }
            }
            throw JpaExceptionTranslator.translate(e);
        } finally {
            jpaScope.close();
        }
    }

    @Override
    public void rollback(StorageScope scope) {
        JpaStorageScope jpaScope = ownScope(scope);
        if (jpaScope.isClosed()) {
            log.trace("Rollback ignored for closed scope {}", scope.getId());
            return;
        }
        try {
            EntityTransaction tx = jpaScope.getTransaction();
            if (tx.isActive()) {
                tx.rollback();
            }
            log.debug("Rolled back JPA scope {}", scope.getId());
        } finally {
            jpaScope.close();
        }
    }

    private static JpaStorageScope ownScope(StorageScope scope) {
        if (!(scope instanceof JpaStorageScope)) {
            throw new IllegalArgumentException("Scope " + (scope == null ? null : scope.getId())
                + " was not opened by a JPA store");
        }
        return (JpaStorageScope) scope;
    }

    private static void closeQuietly(EntityManager em) {
        try {
            if (em.isOpen()) {
                em.close();
            }
        } catch (RuntimeException e) {
            log.warn("Failed to close EntityManager: {}", e.getMessage());
        }
    }

    private static boolean isPresent(String className) {
        try {
            Class.forName(className, false, JpaTransactionalStore.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }
}
