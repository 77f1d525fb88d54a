package io.scoreline.tx.core.store;

/**
 * Entities kept by the in-memory store expose their primary key through this
 * interface. JPA-mapped entities may implement it as well; the JPA store relies
 * on the mapping instead.
 */
public interface Identifiable {

    Object getId();
}
