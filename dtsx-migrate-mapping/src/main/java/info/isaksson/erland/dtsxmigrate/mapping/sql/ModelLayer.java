package info.isaksson.erland.dtsxmigrate.mapping.sql;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Layer of a generated model; also its name prefix. */
public enum ModelLayer {
    STAGING("stg"),
    INTERMEDIATE("int"),
    MART("mart"),
    SQL_TASK("sql");

    private final String prefix;

    ModelLayer(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
