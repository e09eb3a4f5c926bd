package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

@JsonPropertyOrder({"kind","id","name","classId","inputPorts","outputPorts","connectionRef","groupBy","aggregations","properties"})
public final class IrAggregateComponent extends IrComponent {
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> groupBy;

    /** Output column name to aggregate function applied to its source column, e.g. {@code SUM(Amount)}. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<IrNamedExpression> aggregations;

    @JsonCreator
    public IrAggregateComponent(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("classId") String classId,
            @JsonProperty("inputPorts") List<String> inputPorts,
            @JsonProperty("outputPorts") List<String> outputPorts,
            @JsonProperty("connectionRef") String connectionRef,
            @JsonProperty("properties") Map<String, String> properties,
            @JsonProperty("groupBy") List<String> groupBy,
            @JsonProperty("aggregations") List<IrNamedExpression> aggregations
    ) {
        super(IrComponentKind.AGGREGATE, id, name, classId, inputPorts, outputPorts, connectionRef, properties);
        this.groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
        this.aggregations = aggregations == null ? List.of() : List.copyOf(aggregations);
    }
}
