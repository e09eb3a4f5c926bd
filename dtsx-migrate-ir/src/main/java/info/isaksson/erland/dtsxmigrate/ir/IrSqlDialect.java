package info.isaksson.erland.dtsxmigrate.ir;

public enum IrSqlDialect {
    TSQL,
    ANSI
}
