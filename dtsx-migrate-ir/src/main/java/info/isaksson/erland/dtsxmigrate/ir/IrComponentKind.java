package info.isaksson.erland.dtsxmigrate.ir;

public enum IrComponentKind {
    SOURCE,
    DERIVED_COLUMN,
    LOOKUP,
    CONDITIONAL_SPLIT,
    UNION_ALL,
    AGGREGATE,
    SORT,
    DESTINATION,
    UNKNOWN
}
