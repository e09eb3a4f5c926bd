package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

@JsonPropertyOrder({"kind","id","name","classId","inputPorts","outputPorts","connectionRef","sortKeys","removeDuplicates","properties"})
public final class IrSortComponent extends IrComponent {
    /** Keys in sort-position order, each {@code "column ASC"} or {@code "column DESC"}. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> sortKeys;

    public final boolean removeDuplicates;

    @JsonCreator
    public IrSortComponent(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("classId") String classId,
            @JsonProperty("inputPorts") List<String> inputPorts,
            @JsonProperty("outputPorts") List<String> outputPorts,
            @JsonProperty("connectionRef") String connectionRef,
            @JsonProperty("properties") Map<String, String> properties,
            @JsonProperty("sortKeys") List<String> sortKeys,
            @JsonProperty("removeDuplicates") boolean removeDuplicates
    ) {
        super(IrComponentKind.SORT, id, name, classId, inputPorts, outputPorts, connectionRef, properties);
        this.sortKeys = sortKeys == null ? List.of() : List.copyOf(sortKeys);
        this.removeDuplicates = removeDuplicates;
    }
}
