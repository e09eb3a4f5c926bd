package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

@JsonPropertyOrder({"kind","id","name","classId","inputPorts","outputPorts","connectionRef","joinKeys","referenceTarget","noMatchBehavior","properties"})
public final class IrLookupComponent extends IrComponent {
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> joinKeys;

    /** Reference query or table name. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String referenceTarget;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String noMatchBehavior;

    @JsonCreator
    public IrLookupComponent(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("classId") String classId,
            @JsonProperty("inputPorts") List<String> inputPorts,
            @JsonProperty("outputPorts") List<String> outputPorts,
            @JsonProperty("connectionRef") String connectionRef,
            @JsonProperty("properties") Map<String, String> properties,
            @JsonProperty("joinKeys") List<String> joinKeys,
            @JsonProperty("referenceTarget") String referenceTarget,
            @JsonProperty("noMatchBehavior") String noMatchBehavior
    ) {
        super(IrComponentKind.LOOKUP, id, name, classId, inputPorts, outputPorts, connectionRef, properties);
        this.joinKeys = joinKeys == null ? List.of() : List.copyOf(joinKeys);
        this.referenceTarget = referenceTarget;
        this.noMatchBehavior = noMatchBehavior;
    }
}
