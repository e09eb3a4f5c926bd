package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

@JsonPropertyOrder({"kind","id","name","classId","inputPorts","outputPorts","connectionRef","tableName","accessMode","writeMode","binding","properties"})
public final class IrDestinationComponent extends IrComponent {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String tableName;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String accessMode;

    public final IrWriteMode writeMode;
    public final IrEndpointBinding binding;

    @JsonCreator
    public IrDestinationComponent(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("classId") String classId,
            @JsonProperty("inputPorts") List<String> inputPorts,
            @JsonProperty("outputPorts") List<String> outputPorts,
            @JsonProperty("connectionRef") String connectionRef,
            @JsonProperty("properties") Map<String, String> properties,
            @JsonProperty("tableName") String tableName,
            @JsonProperty("accessMode") String accessMode,
            @JsonProperty("writeMode") IrWriteMode writeMode,
            @JsonProperty("binding") IrEndpointBinding binding
    ) {
        super(IrComponentKind.DESTINATION, id, name, classId, inputPorts, outputPorts, connectionRef, properties);
        this.tableName = tableName;
        this.accessMode = accessMode;
        this.writeMode = writeMode == null ? IrWriteMode.INSERT : writeMode;
        this.binding = binding == null ? IrEndpointBinding.UNKNOWN : binding;
    }
}
