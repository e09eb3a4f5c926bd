package info.isaksson.erland.dtsxmigrate.extract;

import info.isaksson.erland.dtsxmigrate.ir.IrExpression;
import info.isaksson.erland.dtsxmigrate.ir.IrExpressionScope;
import info.isaksson.erland.dtsxmigrate.ir.IrPropertyValue;
import info.isaksson.erland.dtsxmigrate.ir.IrReference;
import info.isaksson.erland.dtsxmigrate.ir.IrReferenceKind;
import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticCode;
import info.isaksson.erland.dtsxmigrate.ir.diag.Diagnostics;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code @[Namespace::Name]} references in property expressions against the package's
 * variables and parameters, and records every property expression it sees.
 *
 * <p>{@code System::} references always resolve. {@code $Project::} references are left unresolved
 * without a warning: they are checked at project scope once {@code Project.params} is known.</p>
 */
public final class ExpressionResolver {

    private static final Pattern REFERENCE = Pattern.compile("@\\[([^\\]]+)\\]");

    private final Set<String> variables;
    private final Set<String> variableNames;
    private final Set<String> packageParameters;
    private final Diagnostics diagnostics;
    private final int complexThreshold;
    private final List<IrExpression> recorded = new ArrayList<>();
    private final Set<String> warned = new HashSet<>();

    public ExpressionResolver(Set<String> variableScopedNames, Set<String> packageParameterNames, Diagnostics diagnostics, int complexThreshold) {
        this.variables = Set.copyOf(variableScopedNames);
        this.packageParameters = Set.copyOf(packageParameterNames);
        this.diagnostics = diagnostics;
        this.complexThreshold = complexThreshold;
        Set<String> names = new HashSet<>();
        for (String v : variableScopedNames) {
            int idx = v.indexOf("::");
            names.add(idx < 0 ? v : v.substring(idx + 2));
        }
        this.variableNames = names;
    }

    /** Parse the references in {@code text} without recording anything. */
    public List<IrReference> references(String text) {
        if (text == null || text.isEmpty()) return List.of();
        Set<IrReference> out = new LinkedHashSet<>();
        Matcher m = REFERENCE.matcher(text);
        while (m.find()) {
            out.add(reference(m.group(1).trim()));
        }
        return List.copyOf(out);
    }

    /** Whether a bare scoped name such as {@code User::BatchID} names a known variable or parameter. */
    public boolean known(String scopedName) {
        if (scopedName == null) return false;
        return reference(scopedName.trim()).resolved;
    }

    /**
     * Record a property expression and return it.
     *
     * <p>Emits {@code UNRESOLVED_REFERENCE} once per owner and reference, and {@code COMPLEX_EXPRESSION}
     * for expressions longer than the configured threshold.</p>
     */
    public IrExpression record(IrExpressionScope scope, String ownerId, String property, String text) {
        List<IrReference> refs = references(text);
        String executableId = scope == IrExpressionScope.EXECUTABLE ? ownerId : null;
        for (IrReference r : refs) {
            if (r.resolved || r.kind == IrReferenceKind.PROJECT_PARAMETER) continue;
            if (warned.add(ownerId + "|" + r.scopedName)) {
                diagnostics.executable(DiagnosticCode.UNRESOLVED_REFERENCE, executableId,
                        "Expression on " + ownerId + "." + property + " references unknown " + r.scopedName,
                        "reference", r.scopedName);
            }
        }
        if (text != null && text.length() > complexThreshold) {
            diagnostics.executable(DiagnosticCode.COMPLEX_EXPRESSION, executableId,
                    "Expression on " + ownerId + "." + property + " is " + text.length() + " characters long",
                    "property", property);
        }
        IrExpression expr = new IrExpression(scope, ownerId, property, text, refs);
        recorded.add(expr);
        return expr;
    }

    /** Record an expression override and attach it to {@code literal}. */
    public IrPropertyValue override(IrPropertyValue literal, IrExpressionScope scope, String ownerId, String property, String text) {
        IrExpression expr = record(scope, ownerId, property, text);
        IrPropertyValue base = literal == null ? IrPropertyValue.ofLiteral(null) : literal;
        return base.withExpression(expr.text, expr.references);
    }

    public List<IrExpression> expressions() {
        return List.copyOf(recorded);
    }

    private IrReference reference(String inner) {
        int idx = inner.indexOf("::");
        if (idx < 0) {
            return new IrReference(IrReferenceKind.VARIABLE, inner, variableNames.contains(inner));
        }
        String ns = inner.substring(0, idx);
        String name = inner.substring(idx + 2);
        if ("System".equalsIgnoreCase(ns)) {
            return new IrReference(IrReferenceKind.SYSTEM, "System::" + name, true);
        }
        if ("$Project".equalsIgnoreCase(ns)) {
            return new IrReference(IrReferenceKind.PROJECT_PARAMETER, "$Project::" + name, false);
        }
        if ("$Package".equalsIgnoreCase(ns)) {
            return new IrReference(IrReferenceKind.PACKAGE_PARAMETER, "$Package::" + name, packageParameters.contains(name));
        }
        return new IrReference(IrReferenceKind.VARIABLE, inner, variables.contains(inner));
    }
}
