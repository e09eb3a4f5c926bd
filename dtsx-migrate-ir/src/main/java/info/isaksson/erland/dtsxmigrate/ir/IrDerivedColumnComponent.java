package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

@JsonPropertyOrder({"kind","id","name","classId","inputPorts","outputPorts","connectionRef","columns","properties"})
public final class IrDerivedColumnComponent extends IrComponent {
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<IrNamedExpression> columns;

    @JsonCreator
    public IrDerivedColumnComponent(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("classId") String classId,
            @JsonProperty("inputPorts") List<String> inputPorts,
            @JsonProperty("outputPorts") List<String> outputPorts,
            @JsonProperty("connectionRef") String connectionRef,
            @JsonProperty("properties") Map<String, String> properties,
            @JsonProperty("columns") List<IrNamedExpression> columns
    ) {
        super(IrComponentKind.DERIVED_COLUMN, id, name, classId, inputPorts, outputPorts, connectionRef, properties);
        this.columns = columns == null ? List.of() : List.copyOf(columns);
    }
}
