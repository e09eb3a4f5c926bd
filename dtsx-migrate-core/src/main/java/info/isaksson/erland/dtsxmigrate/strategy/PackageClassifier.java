package info.isaksson.erland.dtsxmigrate.strategy;

import info.isaksson.erland.dtsxmigrate.extract.ExecutableTypes;
import info.isaksson.erland.dtsxmigrate.ir.IrComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrConnectionManager;
import info.isaksson.erland.dtsxmigrate.ir.IrDataFlow;
import info.isaksson.erland.dtsxmigrate.ir.IrDestinationComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrEndpointBinding;
import info.isaksson.erland.dtsxmigrate.ir.IrExecutable;
import info.isaksson.erland.dtsxmigrate.ir.IrExecuteSql;
import info.isaksson.erland.dtsxmigrate.ir.IrPackage;
import info.isaksson.erland.dtsxmigrate.ir.IrPackageClassKind;
import info.isaksson.erland.dtsxmigrate.ir.IrPackageClassification;
import info.isaksson.erland.dtsxmigrate.ir.IrScript;
import info.isaksson.erland.dtsxmigrate.ir.IrScriptIoIntent;
import info.isaksson.erland.dtsxmigrate.ir.IrSourceComponent;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Classifies one package as {@code TRANSFORM}, {@code INGESTION} or {@code MIXED}.
 *
 * <p>Ingestion-side signals are work that leaves the warehouse or cannot be expressed as SQL:
 * external I/O (scripts, file/HTTP connections in use, file/API endpoints, I/O tasks) and
 * orchestration-only work (scripts without detectable I/O, unsupported executables, endpoints of
 * unknown binding). Transform signals are Execute SQL tasks and warehouse-bound data flows.
 * Containers and Execute Package tasks are neutral.</p>
 *
 * <p>Signals are short strings such as {@code script_io:Upload} in executable order, so the result
 * explains itself in reports.</p>
 */
public final class PackageClassifier {

    public IrPackageClassification classify(IrPackage pkg) {
        if (pkg == null) throw new IllegalArgumentException("pkg must not be null");
        List<String> ingestion = new ArrayList<>();
        List<String> transform = new ArrayList<>();

        for (IrExecutable e : pkg.executables) {
            switch (e.kind) {
                case EXECUTE_SQL:
                    transform.add("execute_sql:" + e.id);
                    break;
                case DATA_FLOW: {
                    IrDataFlow df = (IrDataFlow) e;
                    if (df.warehouseBound()) {
                        transform.add("warehouse_data_flow:" + e.id);
                    } else {
                        endpointSignals(df, ingestion);
                    }
                    break;
                }
                case SCRIPT:
                    ingestion.add(((IrScript) e).ioIntent == IrScriptIoIntent.EXTERNAL_IO
                            ? "script_io:" + e.id
                            : "script:" + e.id);
                    break;
                case UNKNOWN:
                    ingestion.add((ExecutableTypes.ioTask(e.typeTag) ? "io_task:" : "unknown:")
                            + e.id + ":" + ExecutableTypes.shortName(e.typeTag));
                    break;
                default:
                    break;
            }
        }

        for (IrConnectionManager cm : pkg.connectionManagers) {
            if (cm.kind.external() && used(pkg, cm)) {
                ingestion.add("connection:" + cm.name + ":" + cm.kind.name().toLowerCase(Locale.ROOT));
            }
        }

        IrPackageClassKind kind;
        if (!ingestion.isEmpty() && !transform.isEmpty()) {
            kind = IrPackageClassKind.MIXED;
        } else if (!ingestion.isEmpty()) {
            kind = IrPackageClassKind.INGESTION;
        } else {
            kind = IrPackageClassKind.TRANSFORM;
        }
        return new IrPackageClassification(pkg.name, kind, ingestion, transform);
    }

    private static void endpointSignals(IrDataFlow df, List<String> out) {
        for (IrComponent c : df.components) {
            IrEndpointBinding binding = null;
            if (c instanceof IrSourceComponent) binding = ((IrSourceComponent) c).binding;
            if (c instanceof IrDestinationComponent) binding = ((IrDestinationComponent) c).binding;
            if (binding == null || binding == IrEndpointBinding.WAREHOUSE) continue;
            out.add("endpoint:" + df.id + "/" + c.id + ":" + binding.name().toLowerCase(Locale.ROOT));
        }
    }

    /** Referenced by an Execute SQL task or any data-flow component. */
    static boolean used(IrPackage pkg, IrConnectionManager cm) {
        for (IrExecutable e : pkg.executables) {
            if (e instanceof IrExecuteSql && cm.matches(((IrExecuteSql) e).connectionRef)) return true;
            if (e instanceof IrDataFlow) {
                for (IrComponent c : ((IrDataFlow) e).components) {
                    if (cm.matches(c.connectionRef)) return true;
                }
            }
        }
        return false;
    }
}
