package io.scoreline.tx.core.store.jpa;

import io.scoreline.tx.core.exception.TransientStorageException;
import io.scoreline.tx.core.store.IsolationLevel;
import io.scoreline.tx.core.store.StorageScope;
import io.scoreline.tx.core.support.TestRow;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.EntityTransaction;
import jakarta.persistence.PersistenceException;
import jakarta.persistence.PessimisticLockException;
import org.hibernate.Session;
import org.hibernate.jdbc.Work;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JpaTransactionalStoreTest {

    @Mock private EntityManagerFactory entityManagerFactory;
    @Mock private EntityManager entityManager;
    @Mock private EntityTransaction transaction;
    @Mock private Session session;
    @Mock private Connection connection;

    private JpaTransactionalStore store;

    @BeforeEach
    void setUp() throws Exception {
        when(entityManagerFactory.createEntityManager()).thenReturn(entityManager);
        when(entityManager.unwrap(Session.class)).thenReturn(session);
        when(entityManager.getTransaction()).thenReturn(transaction);
        doAnswer(invocation -> {
            Work work = invocation.getArgument(0);
            work.execute(connection);
            return null;
        }).when(session).doWork(any(Work.class));
        store = new JpaTransactionalStore(entityManagerFactory);
    }

    @Test
    void beginTransaction_appliesIsolationAndStartsTransaction() throws SQLException {
        StorageScope scope = store.beginTransaction(IsolationLevel.SERIALIZABLE, true);

        verify(connection).setTransactionIsolation(Connection.TRANSACTION_SERIALIZABLE);
        verify(session).setDefaultReadOnly(true);
        verify(transaction).begin();
        assertEquals(IsolationLevel.SERIALIZABLE, scope.getIsolationLevel());
        assertTrue(scope.getId().startsWith("jpa-"));
    }

    @Test
    void commit_commitsAndClosesEntityManager() {
        when(transaction.isActive()).thenReturn(true);
        when(entityManager.isOpen()).thenReturn(true);
        StorageScope scope = store.beginTransaction(IsolationLevel.READ_COMMITTED);

        store.commit(scope);

        verify(transaction).commit();
        verify(entityManager).close();
        assertFalse(scope.isActive());
    }

    @Test
    void commit_translatesLockFailures() {
        when(transaction.isActive()).thenReturn(true);
        doThrow(new PessimisticLockException("row locked")).when(transaction).commit();
        StorageScope scope = store.beginTransaction(IsolationLevel.READ_COMMITTED);

        TransientStorageException ex = assertThrows(TransientStorageException.class, () -> store.commit(scope));

        assertInstanceOf(PessimisticLockException.class, ex.getCause());
        verify(transaction).rollback();
    }

    @Test
    void rollback_rollsBackActiveTransactionOnce() {
        when(transaction.isActive()).thenReturn(true);
        when(entityManager.isOpen()).thenReturn(true);
        StorageScope scope = store.beginTransaction(IsolationLevel.READ_COMMITTED);

        store.rollback(scope);
        store.rollback(scope);

        verify(transaction, times(1)).rollback();
        verify(entityManager, times(1)).close();
    }

    @Test
    void scope_delegatesCrudToEntityManager() {
        when(transaction.isActive()).thenReturn(true);
        TestRow existing = new TestRow("a", "1");
        TestRow replacement = new TestRow("a", "2");
        when(entityManager.find(TestRow.class, "a")).thenReturn(existing);
        when(entityManager.merge(replacement)).thenReturn(replacement);
        StorageScope scope = store.beginTransaction(IsolationLevel.READ_COMMITTED);

        assertEquals(Optional.of(existing), scope.find(TestRow.class, "a"));
        assertSame(replacement, scope.upsert(replacement));
        assertTrue(scope.delete(TestRow.class, "a"));
        assertFalse(scope.delete(TestRow.class, "missing"));
        scope.insert(new TestRow("b", "1"));

        verify(entityManager).remove(existing);
        verify(entityManager).persist(new TestRow("b", "1"));
        verify(entityManager, times(3)).flush();
    }

    @Test
    void scope_translatesTransientSqlStateFromFlush() {
        when(transaction.isActive()).thenReturn(true);
        doThrow(new PersistenceException("flush", new SQLException("deadlock", "40P01")))
            .when(entityManager).flush();
        StorageScope scope = store.beginTransaction(IsolationLevel.READ_COMMITTED);

        assertThrows(TransientStorageException.class, () -> scope.insert(new TestRow("b", "1")));
    }

    @Test
    void scope_passesThroughNonTransientErrors() {
        when(transaction.isActive()).thenReturn(true);
        PersistenceException constraint = new PersistenceException("unique",
            new SQLException("duplicate key", "23505"));
        doThrow(constraint).when(entityManager).flush();
        StorageScope scope = store.beginTransaction(IsolationLevel.READ_COMMITTED);

        assertSame(constraint, assertThrows(PersistenceException.class,
            () -> scope.insert(new TestRow("b", "1"))));
    }
}
