package info.isaksson.erland.dtsxmigrate.mapping.sql;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Materialization {
    VIEW,
    TABLE,
    INCREMENTAL,
    /** Statement run for its side effect (DML/DDL); produces no relation. */
    OPERATION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
