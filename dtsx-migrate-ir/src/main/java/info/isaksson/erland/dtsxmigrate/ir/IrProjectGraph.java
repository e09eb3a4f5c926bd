package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Project-scope graph of packages linked by Execute Package invocations.
 *
 * <p>When {@link #cycle} is non-empty the graph is not a DAG: {@link #executionOrder} is then empty
 * and the cycle lists the package names in call order, without repeating the first one.</p>
 */
@JsonPropertyOrder({"packages","edges","entryPoints","isolatedPackages","executionOrder","cycle"})
public final class IrProjectGraph {
    public final List<String> packages;
    public final List<IrCrossPackageEdge> edges;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> entryPoints;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> isolatedPackages;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> executionOrder;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> cycle;

    @JsonCreator
    public IrProjectGraph(
            @JsonProperty("packages") List<String> packages,
            @JsonProperty("edges") List<IrCrossPackageEdge> edges,
            @JsonProperty("entryPoints") List<String> entryPoints,
            @JsonProperty("isolatedPackages") List<String> isolatedPackages,
            @JsonProperty("executionOrder") List<String> executionOrder,
            @JsonProperty("cycle") List<String> cycle
    ) {
        this.packages = packages == null ? List.of() : List.copyOf(packages);
        this.edges = edges == null ? List.of() : List.copyOf(edges);
        this.entryPoints = entryPoints == null ? List.of() : List.copyOf(entryPoints);
        this.isolatedPackages = isolatedPackages == null ? List.of() : List.copyOf(isolatedPackages);
        this.executionOrder = executionOrder == null ? List.of() : List.copyOf(executionOrder);
        this.cycle = cycle == null ? List.of() : List.copyOf(cycle);
    }

    public boolean acyclic() {
        return cycle.isEmpty();
    }
}
