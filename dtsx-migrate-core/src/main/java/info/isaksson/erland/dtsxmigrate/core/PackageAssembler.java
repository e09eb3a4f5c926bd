package info.isaksson.erland.dtsxmigrate.core;

import info.isaksson.erland.dtsxmigrate.extract.ExtractedPackage;
import info.isaksson.erland.dtsxmigrate.ir.IrDataFlow;
import info.isaksson.erland.dtsxmigrate.ir.IrExecutable;
import info.isaksson.erland.dtsxmigrate.ir.IrForEachLoop;
import info.isaksson.erland.dtsxmigrate.ir.IrNormalizer;
import info.isaksson.erland.dtsxmigrate.ir.IrPackage;
import info.isaksson.erland.dtsxmigrate.ir.IrPrecedenceEdge;
import info.isaksson.erland.dtsxmigrate.ir.IrScript;
import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticCode;
import info.isaksson.erland.dtsxmigrate.ir.diag.Diagnostics;
import info.isaksson.erland.dtsxmigrate.ir.diag.IrDiagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns an {@link ExtractedPackage} into a validated, normalized {@link PackageResult}.
 *
 * <p>Only violations found by {@link IrValidator} on the assembled IR fail the package. Errors the
 * extractors already recovered from (e.g. an invalid data flow kept as an Unknown executable) stay
 * in the diagnostics without failing it.</p>
 */
public final class PackageAssembler {

    private static final Logger logger = LoggerFactory.getLogger(PackageAssembler.class);

    private final IrValidator validator = new IrValidator();

    public PackageResult assemble(ExtractedPackage extracted) {
        if (extracted == null) throw new IllegalArgumentException("extracted must not be null");
        Diagnostics diagnostics = extracted.diagnostics;

        IrPackage raw = extracted.toPackage();
        IrPackage ir = IrNormalizer.normalize(new IrPackage(
                raw.schemaVersion, raw.name, raw.sourceName, raw.protectionLevel,
                raw.creatorName, raw.creationDate, raw.versionBuild, raw.versionComments,
                raw.variables, raw.parameters, raw.connectionManagers, raw.executables,
                uniqueEdgeIds(raw.precedenceEdges), raw.expressions));

        List<IrDiagnostic> violations = validator.validate(ir);
        if (!violations.isEmpty()) {
            diagnostics.addAll(violations);
            logger.warn("{}: package {} failed validation with {} violation(s), first: {}",
                    extracted.sourceName, ir.name, violations.size(), violations.get(0).message);
            return PackageResult.failed(extracted.sourceName, ir.name, diagnostics.toDeterministicList());
        }

        addReviewAdvisories(ir, diagnostics);

        logger.info("{}: {} executables, {} components, {} edges, {} diagnostics",
                ir.name, ir.executables.size(), componentCount(ir), ir.precedenceEdges.size(), diagnostics.size());
        return PackageResult.ok(ir, diagnostics.toDeterministicList());
    }

    /** Sorts the edges and suffixes repeated ids with {@code #2}, {@code #3}, ... */
    static List<IrPrecedenceEdge> uniqueEdgeIds(List<IrPrecedenceEdge> edges) {
        Map<String, Integer> seen = new HashMap<>();
        List<IrPrecedenceEdge> out = new ArrayList<>();
        for (IrPrecedenceEdge e : IrNormalizer.normalizeEdges(edges)) {
            int n = seen.merge(e.id, 1, Integer::sum);
            out.add(n == 1 ? e : e.withId(e.id + "#" + n));
        }
        return out;
    }

    private static void addReviewAdvisories(IrPackage ir, Diagnostics d) {
        for (IrExecutable e : ir.executables) {
            if (e instanceof IrScript) {
                d.executable(DiagnosticCode.MANUAL_REVIEW, e.id, "Script task " + e.name + " must be ported by hand", "reason", "script");
            } else if (e instanceof IrForEachLoop) {
                d.executable(DiagnosticCode.MANUAL_REVIEW, e.id,
                        "ForEach loop " + e.name + " needs its enumerator checked against the mapped task group", "reason", "foreach");
            }
        }
        boolean encrypted = false;
        for (IrDiagnostic existing : d.toDeterministicList()) {
            if (existing.code == DiagnosticCode.ENCRYPTED_PACKAGE || existing.code == DiagnosticCode.DECRYPTION_FAILED) {
                encrypted = true;
                break;
            }
        }
        if (encrypted) {
            d.report(DiagnosticCode.MANUAL_REVIEW, "Package has encrypted content that was not extracted", "reason", "encrypted");
        }
    }

    private static int componentCount(IrPackage ir) {
        int n = 0;
        for (IrDataFlow df : ir.executablesOf(IrDataFlow.class)) n += df.components.size();
        return n;
    }
}
