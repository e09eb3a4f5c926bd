package info.isaksson.erland.dtsxmigrate.strategy;

import info.isaksson.erland.dtsxmigrate.ir.IrCrossPackageEdge;
import info.isaksson.erland.dtsxmigrate.ir.IrPackage;
import info.isaksson.erland.dtsxmigrate.ir.IrPackageClassKind;
import info.isaksson.erland.dtsxmigrate.ir.IrPackageClassification;
import info.isaksson.erland.dtsxmigrate.ir.IrStrategy;
import info.isaksson.erland.dtsxmigrate.ir.IrStrategyDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the project strategy from the package classifications.
 *
 * <table>
 *   <caption>Decision</caption>
 *   <tr><th>Packages</th><th>Cross-package edges</th><th>Strategy</th></tr>
 *   <tr><td>all TRANSFORM (or none)</td><td>no</td><td>dbt_only</td></tr>
 *   <tr><td>all TRANSFORM</td><td>yes</td><td>dbt_with_orchestration</td></tr>
 *   <tr><td>some TRANSFORM, some not</td><td>any</td><td>mixed</td></tr>
 *   <tr><td>no TRANSFORM</td><td>any</td><td>airflow_only</td></tr>
 * </table>
 */
public final class StrategyClassifier {

    private static final Logger logger = LoggerFactory.getLogger(StrategyClassifier.class);

    private final PackageClassifier packageClassifier = new PackageClassifier();

    public IrStrategyDecision decide(List<IrPackage> packages, List<IrCrossPackageEdge> edges) {
        if (packages == null) throw new IllegalArgumentException("packages must not be null");
        List<IrPackage> sorted = new ArrayList<>(packages);
        sorted.sort(Comparator.comparing((IrPackage p) -> p.name));

        List<IrPackageClassification> classifications = new ArrayList<>();
        for (IrPackage p : sorted) classifications.add(packageClassifier.classify(p));

        boolean hasEdges = edges != null && !edges.isEmpty();
        IrStrategy strategy = decide(classifications, hasEdges);
        logger.info("Strategy {} for {} package(s), cross-package edges: {}", strategy.wireName(), classifications.size(), hasEdges);
        return new IrStrategyDecision(strategy, hasEdges, classifications);
    }

    static IrStrategy decide(List<IrPackageClassification> classifications, boolean crossPackageEdges) {
        long transform = classifications.stream().filter(c -> c.kind == IrPackageClassKind.TRANSFORM).count();
        if (transform == classifications.size()) {
            return crossPackageEdges ? IrStrategy.DBT_WITH_ORCHESTRATION : IrStrategy.DBT_ONLY;
        }
        return transform > 0 ? IrStrategy.MIXED : IrStrategy.AIRFLOW_ONLY;
    }
}
