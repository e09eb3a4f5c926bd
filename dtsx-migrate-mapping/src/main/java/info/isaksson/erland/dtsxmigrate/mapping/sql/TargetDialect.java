package info.isaksson.erland.dtsxmigrate.mapping.sql;

/** Warehouse dialect that rewritten SQL targets. */
public enum TargetDialect {
    SNOWFLAKE,
    ANSI
}
