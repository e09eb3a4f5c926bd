package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonValue;

/** Which target graph(s) a project is mapped to. */
public enum IrStrategy {
    DBT_ONLY("dbt_only"),
    DBT_WITH_ORCHESTRATION("dbt_with_orchestration"),
    AIRFLOW_ONLY("airflow_only"),
    MIXED("mixed");

    private final String wireName;

    IrStrategy(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean needsSqlProject() {
        return this != AIRFLOW_ONLY;
    }

    public boolean needsWorkflow() {
        return this != DBT_ONLY;
    }
}
