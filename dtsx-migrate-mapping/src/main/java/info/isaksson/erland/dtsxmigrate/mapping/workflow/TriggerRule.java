package info.isaksson.erland.dtsxmigrate.mapping.workflow;

import com.fasterxml.jackson.annotation.JsonValue;

/** When a task runs relative to the outcome of its upstream tasks. */
public enum TriggerRule {
    ALL_SUCCESS("all_success"),
    ONE_SUCCESS("one_success"),
    ONE_FAILED("one_failed"),
    ALL_DONE("all_done");

    private final String wireName;

    TriggerRule(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
