package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

/** Placeholder for a component whose class id is not recognized; {@link #classId} keeps the raw identifier. */
@JsonPropertyOrder({"kind","id","name","classId","inputPorts","outputPorts","connectionRef","properties"})
public final class IrUnknownComponent extends IrComponent {
    @JsonCreator
    public IrUnknownComponent(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("classId") String classId,
            @JsonProperty("inputPorts") List<String> inputPorts,
            @JsonProperty("outputPorts") List<String> outputPorts,
            @JsonProperty("connectionRef") String connectionRef,
            @JsonProperty("properties") Map<String, String> properties
    ) {
        super(IrComponentKind.UNKNOWN, id, name, classId, inputPorts, outputPorts, connectionRef, properties);
    }
}
