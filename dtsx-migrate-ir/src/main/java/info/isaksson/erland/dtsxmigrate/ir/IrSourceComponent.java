package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

@JsonPropertyOrder({"kind","id","name","classId","inputPorts","outputPorts","connectionRef","query","tableName","accessMode","outputPort","binding","properties"})
public final class IrSourceComponent extends IrComponent {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String query;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String tableName;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String accessMode;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String outputPort;

    public final IrEndpointBinding binding;

    @JsonCreator
    public IrSourceComponent(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("classId") String classId,
            @JsonProperty("inputPorts") List<String> inputPorts,
            @JsonProperty("outputPorts") List<String> outputPorts,
            @JsonProperty("connectionRef") String connectionRef,
            @JsonProperty("properties") Map<String, String> properties,
            @JsonProperty("query") String query,
            @JsonProperty("tableName") String tableName,
            @JsonProperty("accessMode") String accessMode,
            @JsonProperty("outputPort") String outputPort,
            @JsonProperty("binding") IrEndpointBinding binding
    ) {
        super(IrComponentKind.SOURCE, id, name, classId, inputPorts, outputPorts, connectionRef, properties);
        this.query = query;
        this.tableName = tableName;
        this.accessMode = accessMode;
        this.outputPort = outputPort;
        this.binding = binding == null ? IrEndpointBinding.UNKNOWN : binding;
    }
}
