package io.scoreline.tx.core.store.jpa;

import io.scoreline.tx.core.store.IsolationLevel;
import jakarta.persistence.EntityManager;
import org.hibernate.Session;

/**
 * Hibernate-specific session tuning. Only loaded when Hibernate is on the classpath.
 */
final class HibernateSessionSupport {

    private HibernateSessionSupport() {
    }

    static void configure(EntityManager entityManager, IsolationLevel isolationLevel, boolean readOnly) {
        Session session = entityManager.unwrap(Session.class);
        session.doWork(connection -> connection.setTransactionIsolation(isolationLevel.getJdbcLevel()));
        if (readOnly) {
            session.setDefaultReadOnly(true);
        }
    }
}
