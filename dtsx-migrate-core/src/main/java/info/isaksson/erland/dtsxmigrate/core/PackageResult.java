package info.isaksson.erland.dtsxmigrate.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.dtsxmigrate.ir.IrPackage;
import info.isaksson.erland.dtsxmigrate.ir.diag.Diagnostics;
import info.isaksson.erland.dtsxmigrate.ir.diag.IrDiagnostic;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of migrating one package.
 *
 * <p>A {@link PackageStatus#FAILED} result keeps its diagnostics but has no {@link #ir}.</p>
 */
@JsonPropertyOrder({"sourceName","packageName","status","ir","diagnostics"})
public final class PackageResult {
    public final String sourceName;

    /** Package name when it could be read, else the source name. */
    public final String packageName;

    public final PackageStatus status;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final IrPackage ir;

    public final List<IrDiagnostic> diagnostics;

    PackageResult(String sourceName, String packageName, PackageStatus status, IrPackage ir, List<IrDiagnostic> diagnostics) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.packageName = packageName == null ? sourceName : packageName;
        this.status = Objects.requireNonNull(status, "status");
        this.ir = ir;
        this.diagnostics = diagnostics == null ? List.of() : Diagnostics.sorted(diagnostics);
    }

    static PackageResult ok(IrPackage ir, List<IrDiagnostic> diagnostics) {
        return new PackageResult(ir.sourceName, ir.name, PackageStatus.OK, ir, diagnostics);
    }

    static PackageResult failed(String sourceName, String packageName, List<IrDiagnostic> diagnostics) {
        return new PackageResult(sourceName, packageName, PackageStatus.FAILED, null, diagnostics);
    }

    public boolean ok() {
        return status == PackageStatus.OK;
    }

    @Override
    public String toString() {
        return packageName + " (" + status + ", " + diagnostics.size() + " diagnostics)";
    }
}
