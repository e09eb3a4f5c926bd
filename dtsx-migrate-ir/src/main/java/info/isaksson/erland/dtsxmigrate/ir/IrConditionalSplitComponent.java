package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

@JsonPropertyOrder({"kind","id","name","classId","inputPorts","outputPorts","connectionRef","conditions","defaultOutput","properties"})
public final class IrConditionalSplitComponent extends IrComponent {
    /** Conditions in evaluation order; the name is the output the rows are routed to. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<IrNamedExpression> conditions;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String defaultOutput;

    @JsonCreator
    public IrConditionalSplitComponent(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("classId") String classId,
            @JsonProperty("inputPorts") List<String> inputPorts,
            @JsonProperty("outputPorts") List<String> outputPorts,
            @JsonProperty("connectionRef") String connectionRef,
            @JsonProperty("properties") Map<String, String> properties,
            @JsonProperty("conditions") List<IrNamedExpression> conditions,
            @JsonProperty("defaultOutput") String defaultOutput
    ) {
        super(IrComponentKind.CONDITIONAL_SPLIT, id, name, classId, inputPorts, outputPorts, connectionRef, properties);
        this.conditions = conditions == null ? List.of() : List.copyOf(conditions);
        this.defaultOutput = defaultOutput;
    }
}
