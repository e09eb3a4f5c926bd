package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A data-flow edge from an output port of one component to an input port of another. */
@JsonPropertyOrder({"id","name","startPort","endPort","fromComponent","toComponent"})
public final class IrPath {
    public final String id;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String name;

    public final String startPort;
    public final String endPort;
    public final String fromComponent;
    public final String toComponent;

    @JsonCreator
    public IrPath(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("startPort") String startPort,
            @JsonProperty("endPort") String endPort,
            @JsonProperty("fromComponent") String fromComponent,
            @JsonProperty("toComponent") String toComponent
    ) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.startPort = startPort;
        this.endPort = endPort;
        this.fromComponent = Objects.requireNonNull(fromComponent, "fromComponent");
        this.toComponent = Objects.requireNonNull(toComponent, "toComponent");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrPath)) return false;
        IrPath that = (IrPath) o;
        return id.equals(that.id) && Objects.equals(name, that.name)
                && Objects.equals(startPort, that.startPort) && Objects.equals(endPort, that.endPort)
                && fromComponent.equals(that.fromComponent) && toComponent.equals(that.toComponent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, startPort, endPort);
    }
}
