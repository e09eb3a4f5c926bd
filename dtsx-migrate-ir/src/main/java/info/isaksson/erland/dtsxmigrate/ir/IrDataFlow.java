package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * A data-flow task. {@link #components} are in topological order of the {@link #paths} graph.
 */
@JsonPropertyOrder({"kind","id","name","typeTag","parentId","description","disabled","components","paths"})
public final class IrDataFlow extends IrExecutable {
    public final List<IrComponent> components;
    public final List<IrPath> paths;

    @JsonCreator
    public IrDataFlow(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("typeTag") String typeTag,
            @JsonProperty("parentId") String parentId,
            @JsonProperty("description") String description,
            @JsonProperty("disabled") boolean disabled,
            @JsonProperty("components") List<IrComponent> components,
            @JsonProperty("paths") List<IrPath> paths
    ) {
        super(IrExecutableKind.DATA_FLOW, id, name, typeTag, parentId, description, disabled);
        this.components = components == null ? List.of() : List.copyOf(components);
        this.paths = paths == null ? List.of() : List.copyOf(paths);
    }

    public IrComponent component(String componentId) {
        for (IrComponent c : components) {
            if (c.id.equals(componentId)) return c;
        }
        return null;
    }

    /** True when every source and destination reads from or writes to the warehouse. */
    public boolean warehouseBound() {
        for (IrComponent c : components) {
            if (c instanceof IrSourceComponent && ((IrSourceComponent) c).binding != IrEndpointBinding.WAREHOUSE) return false;
            if (c instanceof IrDestinationComponent && ((IrDestinationComponent) c).binding != IrEndpointBinding.WAREHOUSE) return false;
        }
        return true;
    }
}
