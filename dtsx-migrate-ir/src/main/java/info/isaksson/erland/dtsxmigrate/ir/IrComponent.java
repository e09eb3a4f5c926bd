package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A node of a data-flow component graph. Closed set of variants, see {@link IrComponentKind}.
 *
 * <p>Port identifiers are unique within the owning data flow; {@link IrPath} edges connect an
 * output port of one component to an input port of another.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = IrSourceComponent.class, name = "SOURCE"),
        @JsonSubTypes.Type(value = IrDerivedColumnComponent.class, name = "DERIVED_COLUMN"),
        @JsonSubTypes.Type(value = IrLookupComponent.class, name = "LOOKUP"),
        @JsonSubTypes.Type(value = IrConditionalSplitComponent.class, name = "CONDITIONAL_SPLIT"),
        @JsonSubTypes.Type(value = IrUnionAllComponent.class, name = "UNION_ALL"),
        @JsonSubTypes.Type(value = IrAggregateComponent.class, name = "AGGREGATE"),
        @JsonSubTypes.Type(value = IrSortComponent.class, name = "SORT"),
        @JsonSubTypes.Type(value = IrDestinationComponent.class, name = "DESTINATION"),
        @JsonSubTypes.Type(value = IrUnknownComponent.class, name = "UNKNOWN")
})
public abstract class IrComponent {
    public final IrComponentKind kind;
    public final String id;
    public final String name;
    public final String classId;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> inputPorts;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> outputPorts;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String connectionRef;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final Map<String, String> properties;

    IrComponent(IrComponentKind kind, String id, String name, String classId,
                List<String> inputPorts, List<String> outputPorts, String connectionRef, Map<String, String> properties) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.id = Objects.requireNonNull(id, "id");
        this.name = name == null ? id : name;
        this.classId = classId == null ? "" : classId;
        this.inputPorts = inputPorts == null ? List.of() : List.copyOf(inputPorts);
        this.outputPorts = outputPorts == null ? List.of() : List.copyOf(outputPorts);
        this.connectionRef = connectionRef;
        this.properties = properties == null || properties.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(properties));
    }
}
