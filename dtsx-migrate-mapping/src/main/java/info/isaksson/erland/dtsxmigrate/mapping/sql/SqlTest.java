package info.isaksson.erland.dtsxmigrate.mapping.sql;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A column-level data test attached to a model, e.g. {@code not_null}. */
@JsonPropertyOrder({"model","column","test"})
public final class SqlTest {
    public static final String NOT_NULL = "not_null";

    public final String model;
    public final String column;
    public final String test;

    public SqlTest(String model, String column, String test) {
        this.model = Objects.requireNonNull(model, "model");
        this.column = Objects.requireNonNull(column, "column");
        this.test = Objects.requireNonNull(test, "test");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SqlTest)) return false;
        SqlTest that = (SqlTest) o;
        return model.equals(that.model) && column.equals(that.column) && test.equals(that.test);
    }

    @Override
    public int hashCode() {
        return Objects.hash(model, column, test);
    }

    @Override
    public String toString() {
        return test + "(" + model + "." + column + ")";
    }
}
