package info.isaksson.erland.dtsxmigrate.mapping.workflow;

/** Kind of workflow task an executable is mapped to. */
public enum OperatorKind {
    /** Runs a SQL statement against a connection. */
    SQL,
    /** Runs the SQL-project models generated for a warehouse-bound data flow. */
    DBT_RUN,
    /** Moves data between non-warehouse endpoints. */
    DATA_TRANSFER,
    PYTHON,
    TASK_GROUP,
    /** A task group expanded once per enumerated item. */
    MAPPED_TASK_GROUP,
    /** Triggers the workflow generated for another package. */
    TRIGGER_WORKFLOW,
    /** No faithful mapping exists; a human has to fill in the task. */
    PLACEHOLDER
}
