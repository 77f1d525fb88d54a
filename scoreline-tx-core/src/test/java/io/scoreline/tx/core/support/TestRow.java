package io.scoreline.tx.core.support;

import io.scoreline.tx.core.store.Identifiable;

import java.util.Objects;

public class TestRow implements Identifiable {

    private final String id;
    private final String value;

    public TestRow(String id, String value) {
        this.id = id;
        this.value = value;
    }

    @Override
    public String getId() {
        return id;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TestRow)) return false;
        TestRow that = (TestRow) o;
        return id.equals(that.id) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, value);
    }

    @Override
    public String toString() {
        return "TestRow{" + id + "=" + value + '}';
    }
}
