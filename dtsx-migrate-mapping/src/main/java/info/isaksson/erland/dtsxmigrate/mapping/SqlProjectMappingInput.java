package info.isaksson.erland.dtsxmigrate.mapping;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.dtsxmigrate.ir.IrDataFlow;
import info.isaksson.erland.dtsxmigrate.ir.IrExecutable;
import info.isaksson.erland.dtsxmigrate.ir.IrExecuteSql;
import info.isaksson.erland.dtsxmigrate.ir.IrPackage;
import info.isaksson.erland.dtsxmigrate.ir.IrPackageClassKind;
import info.isaksson.erland.dtsxmigrate.ir.IrPackageClassification;
import info.isaksson.erland.dtsxmigrate.ir.IrStrategyDecision;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Read-only input of a {@link SqlProjectGenerator}: the transform-eligible executables of every
 * classified package plus the source-to-sink chains of their data flows.
 *
 * <p>Eligibility follows the package classification. A TRANSFORM package contributes every
 * executable, a MIXED package only its Execute SQL tasks and warehouse-bound data flows, an
 * INGESTION package nothing. Packages without a classification are left out.</p>
 */
public final class SqlProjectMappingInput {

    @JsonPropertyOrder({"packageName","classification","executables","chains"})
    public static final class PackageSlice {
        @JsonIgnore
        public final IrPackage pkg;
        public final String packageName;
        public final IrPackageClassKind classification;
        public final List<IrExecutable> executables;

        /** Data-flow id to its chains, ordered by data-flow id. */
        public final Map<String, List<DataFlowChain>> chains;

        public PackageSlice(IrPackage pkg, IrPackageClassKind classification, List<IrExecutable> executables,
                            Map<String, List<DataFlowChain>> chains) {
            this.pkg = Objects.requireNonNull(pkg, "pkg");
            this.packageName = pkg.name;
            this.classification = Objects.requireNonNull(classification, "classification");
            this.executables = List.copyOf(executables);
            this.chains = Collections.unmodifiableMap(new TreeMap<>(chains));
        }

        public List<DataFlowChain> chainsOf(String dataFlowId) {
            return chains.getOrDefault(dataFlowId, List.of());
        }
    }

    public final List<PackageSlice> packages;
    public final IrStrategyDecision decision;

    public SqlProjectMappingInput(List<PackageSlice> packages, IrStrategyDecision decision) {
        this.packages = List.copyOf(packages);
        this.decision = Objects.requireNonNull(decision, "decision");
    }

    public static SqlProjectMappingInput of(List<IrPackage> packages, IrStrategyDecision decision) {
        List<IrPackage> sorted = new ArrayList<>(packages);
        sorted.sort(Comparator.comparing(p -> p.name));
        List<PackageSlice> slices = new ArrayList<>();
        for (IrPackage pkg : sorted) {
            Optional<IrPackageClassification> classification = decision.classificationOf(pkg.name);
            if (classification.isEmpty()) continue;
            IrPackageClassKind kind = classification.get().kind;
            List<IrExecutable> eligible = new ArrayList<>();
            Map<String, List<DataFlowChain>> chains = new TreeMap<>();
            for (IrExecutable exe : pkg.executables) {
                if (!eligible(kind, exe)) continue;
                eligible.add(exe);
                if (exe instanceof IrDataFlow) {
                    chains.put(exe.id, DataFlowChain.of((IrDataFlow) exe));
                }
            }
            slices.add(new PackageSlice(pkg, kind, eligible, chains));
        }
        return new SqlProjectMappingInput(slices, decision);
    }

    static boolean eligible(IrPackageClassKind kind, IrExecutable exe) {
        switch (kind) {
            case TRANSFORM:
                return true;
            case MIXED:
                return exe instanceof IrExecuteSql
                        || (exe instanceof IrDataFlow && ((IrDataFlow) exe).warehouseBound());
            default:
                return false;
        }
    }
}
