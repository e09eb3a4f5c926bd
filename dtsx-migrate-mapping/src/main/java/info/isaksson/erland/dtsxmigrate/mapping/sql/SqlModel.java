package info.isaksson.erland.dtsxmigrate.mapping.sql;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A generated SQL model.
 *
 * <p>{@link #originId} is the executable or component the model was derived from;
 * {@link #appliedRewrites} names the dialect rules that changed {@link #sql}.</p>
 */
@JsonPropertyOrder({"name","packageName","layer","materialization","originId","targetTable","dependsOn","appliedRewrites","sql"})
public final class SqlModel {
    public final String name;
    public final String packageName;
    public final ModelLayer layer;
    public final Materialization materialization;
    public final String originId;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String targetTable;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> dependsOn;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> appliedRewrites;

    public final String sql;

    public SqlModel(String name, String packageName, ModelLayer layer, Materialization materialization, String originId,
                    String targetTable, List<String> dependsOn, List<String> appliedRewrites, String sql) {
        this.name = Objects.requireNonNull(name, "name");
        this.packageName = Objects.requireNonNull(packageName, "packageName");
        this.layer = Objects.requireNonNull(layer, "layer");
        this.materialization = Objects.requireNonNull(materialization, "materialization");
        this.originId = originId;
        this.targetTable = targetTable;
        this.dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        this.appliedRewrites = appliedRewrites == null ? List.of() : List.copyOf(appliedRewrites);
        this.sql = sql == null ? "" : sql;
    }

    @Override
    public String toString() {
        return name + " (" + materialization.wireName() + ")";
    }
}
