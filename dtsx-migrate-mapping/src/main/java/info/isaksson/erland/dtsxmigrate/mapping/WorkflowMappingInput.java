package info.isaksson.erland.dtsxmigrate.mapping;

import info.isaksson.erland.dtsxmigrate.ir.IrCrossPackageEdge;
import info.isaksson.erland.dtsxmigrate.ir.IrPackage;
import info.isaksson.erland.dtsxmigrate.ir.IrStrategyDecision;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only input of a {@link WorkflowGenerator}: the validated packages (sorted by name), the
 * cross-package edges and the strategy decision.
 */
public final class WorkflowMappingInput {
    public final List<IrPackage> packages;
    public final List<IrCrossPackageEdge> crossPackageEdges;
    public final IrStrategyDecision decision;

    public WorkflowMappingInput(List<IrPackage> packages, List<IrCrossPackageEdge> crossPackageEdges, IrStrategyDecision decision) {
        List<IrPackage> sorted = new ArrayList<>(Objects.requireNonNull(packages, "packages"));
        sorted.sort(Comparator.comparing(p -> p.name));
        this.packages = List.copyOf(sorted);
        this.crossPackageEdges = crossPackageEdges == null ? List.of() : List.copyOf(crossPackageEdges);
        this.decision = Objects.requireNonNull(decision, "decision");
    }

    public Optional<IrPackage> packageNamed(String name) {
        return packages.stream().filter(p -> p.name.equals(name)).findFirst();
    }

    /** The cross-package edge created by an Execute Package task, if its reference was resolved. */
    public Optional<IrCrossPackageEdge> callFrom(String packageName, String executableId) {
        return crossPackageEdges.stream()
                .filter(e -> e.callerPackage.equals(packageName) && e.callerExecutableId.equals(executableId))
                .findFirst();
    }
}
