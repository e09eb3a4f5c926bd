package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The project-level strategy and the per-package classifications it was derived from.
 *
 * <p>Derived data: recomputing it from the same IR always yields an equal decision.</p>
 */
@JsonPropertyOrder({"strategy","crossPackageEdges","classifications"})
public final class IrStrategyDecision {
    public final IrStrategy strategy;
    public final boolean crossPackageEdges;
    public final List<IrPackageClassification> classifications;

    @JsonCreator
    public IrStrategyDecision(
            @JsonProperty("strategy") IrStrategy strategy,
            @JsonProperty("crossPackageEdges") boolean crossPackageEdges,
            @JsonProperty("classifications") List<IrPackageClassification> classifications
    ) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.crossPackageEdges = crossPackageEdges;
        this.classifications = classifications == null ? List.of() : List.copyOf(classifications);
    }

    public Optional<IrPackageClassification> classificationOf(String packageName) {
        return classifications.stream().filter(c -> c.packageName.equals(packageName)).findFirst();
    }
}
