package info.isaksson.erland.dtsxmigrate.project;

import info.isaksson.erland.dtsxmigrate.ir.IrExpression;
import info.isaksson.erland.dtsxmigrate.ir.IrExpressionScope;
import info.isaksson.erland.dtsxmigrate.ir.IrPackage;
import info.isaksson.erland.dtsxmigrate.ir.IrParameter;
import info.isaksson.erland.dtsxmigrate.ir.IrPropertyValue;
import info.isaksson.erland.dtsxmigrate.ir.IrReference;
import info.isaksson.erland.dtsxmigrate.ir.IrReferenceKind;
import info.isaksson.erland.dtsxmigrate.ir.IrVariable;
import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticCode;
import info.isaksson.erland.dtsxmigrate.ir.diag.Diagnostics;
import info.isaksson.erland.dtsxmigrate.ir.diag.IrDiagnostic;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Checks packages against the project parameters.
 *
 * <ul>
 *   <li>{@code PROJECT_SCOPE_CONFLICT}: a package variable or parameter has the name of a project
 *   parameter but a different literal or expression. Neither value is preferred.</li>
 *   <li>{@code UNRESOLVED_REFERENCE}: an expression uses {@code $Project::x} and the project declares
 *   no {@code x}. Only checked when a {@code Project.params} document was supplied.</li>
 * </ul>
 */
public final class ProjectScopeChecker {

    public List<IrDiagnostic> check(List<IrPackage> packages, List<IrParameter> projectParameters, boolean paramsProvided) {
        if (packages == null) throw new IllegalArgumentException("packages must not be null");
        Map<String, IrParameter> byName = new HashMap<>();
        if (projectParameters != null) {
            for (IrParameter p : projectParameters) byName.putIfAbsent(p.name, p);
        }

        List<IrDiagnostic> out = new ArrayList<>();
        for (IrPackage pkg : packages) {
            Diagnostics d = new Diagnostics(pkg.name);
            for (IrVariable v : pkg.variables) {
                IrParameter project = byName.get(v.name);
                if (project != null && conflicts(v.value, project.value)) conflict(d, v.scopedName, v.value, project);
            }
            for (IrParameter p : pkg.parameters) {
                if (IrParameter.PROJECT_NAMESPACE.equals(p.namespace)) continue;
                IrParameter project = byName.get(p.name);
                if (project != null && conflicts(p.value, project.value)) conflict(d, p.scopedName, p.value, project);
            }
            if (paramsProvided) unresolved(pkg, byName, d);
            out.addAll(d.toDeterministicList());
        }
        return Diagnostics.sorted(out);
    }

    static boolean conflicts(IrPropertyValue local, IrPropertyValue project) {
        if (!Objects.equals(local.expression, project.expression)) return true;
        if (local.redactedValue() || project.redactedValue()) return false;
        return !Objects.equals(local.literal, project.literal);
    }

    private static void conflict(Diagnostics d, String localName, IrPropertyValue local, IrParameter project) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put("local", localName);
        ctx.put("project", project.scopedName);
        if (!project.sensitive && !local.redactedValue()) {
            ctx.put("localValue", String.valueOf(local));
            ctx.put("projectValue", String.valueOf(project.value));
        }
        d.add(DiagnosticCode.PROJECT_SCOPE_CONFLICT, null, null,
                localName + " shadows " + project.scopedName + " with a different value; resolve by hand", ctx);
    }

    private static void unresolved(IrPackage pkg, Map<String, IrParameter> byName, Diagnostics d) {
        Set<String> seen = new HashSet<>();
        for (IrExpression e : pkg.expressions) {
            for (IrReference r : e.references) {
                if (r.kind != IrReferenceKind.PROJECT_PARAMETER) continue;
                String name = r.scopedName.substring(r.scopedName.indexOf("::") + 2);
                if (byName.containsKey(name) || !seen.add(e.ownerId + "|" + r.scopedName)) continue;
                String exeId = e.scope == IrExpressionScope.EXECUTABLE ? e.ownerId : null;
                d.executable(DiagnosticCode.UNRESOLVED_REFERENCE, exeId,
                        "Expression on " + e.property + " references " + r.scopedName + ", which Project.params does not declare",
                        "reference", r.scopedName, "owner", e.ownerId);
            }
        }
    }
}
