package info.isaksson.erland.dtsxmigrate.extract;

import info.isaksson.erland.dtsxmigrate.ir.IrExpressionScope;
import info.isaksson.erland.dtsxmigrate.ir.IrPrecedenceCondition;
import info.isaksson.erland.dtsxmigrate.ir.IrPrecedenceEdge;
import info.isaksson.erland.dtsxmigrate.ir.IrPrecedenceEvalOp;
import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticCode;
import info.isaksson.erland.dtsxmigrate.xml.DtsxElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads {@code DTS:PrecedenceConstraint} elements of the package and of every container.
 *
 * <table>
 *   <caption>Constraint value</caption>
 *   <tr><td>{@code 0}, {@code Success}</td><td>{@link IrPrecedenceCondition#SUCCESS}</td></tr>
 *   <tr><td>{@code 1}, {@code Failure}</td><td>{@link IrPrecedenceCondition#FAILURE}</td></tr>
 *   <tr><td>{@code 2}, {@code Completion}</td><td>{@link IrPrecedenceCondition#COMPLETION}</td></tr>
 *   <tr><td>{@code 3}, {@code Expression}</td><td>expression edge (older files)</td></tr>
 *   <tr><td>absent</td><td>{@link IrPrecedenceCondition#SUCCESS}</td></tr>
 * </table>
 *
 * <p>Unrecognized values and expression edges without an expression fall back to
 * {@link IrPrecedenceCondition#COMPLETION}, never to success, and are reported. An unrecognized value
 * on an edge evaluated by {@code Expression} or {@code ExpressionAndConstraint} keeps the expression;
 * only the constraint part is dropped.</p>
 */
final class PrecedenceResolver {

    List<IrPrecedenceEdge> resolve(DtsxElement root, ExtractContext ctx) {
        List<IrPrecedenceEdge> out = new ArrayList<>();
        for (DtsxElement c : root.descendants("DTS:PrecedenceConstraint")) {
            IrPrecedenceEdge edge = read(c, ctx);
            if (edge != null) out.add(edge);
        }
        return out;
    }

    private IrPrecedenceEdge read(DtsxElement c, ExtractContext ctx) {
        String from = PackageHeaderExtractor.blankToNull(c.attrOrProperty("From"));
        String to = PackageHeaderExtractor.blankToNull(c.attrOrProperty("To"));
        for (DtsxElement ref : c.children("DTS:Executable")) {
            String idref = PackageHeaderExtractor.blankToNull(ref.attr("IDREF"));
            if (idref == null) continue;
            if (VariableExtractor.truthy(ref.attr("IsFrom"))) {
                if (from == null) from = idref;
            } else if (to == null) {
                to = idref;
            }
        }
        String label = PackageHeaderExtractor.blankToNull(c.attrOrProperty("refId"));
        if (label == null) label = PackageHeaderExtractor.blankToNull(c.attrOrProperty("ObjectName"));
        if (from == null || to == null) {
            ctx.diagnostics.report(DiagnosticCode.MALFORMED_CONSTRAINT,
                    "Precedence constraint " + (label == null ? "" : label + " ") + "is missing its "
                            + (from == null ? "From" : "To") + " reference and was skipped",
                    "constraint", label == null ? "" : label);
            return null;
        }
        String fromId = resolveId(from, ctx);
        String toId = resolveId(to, ctx);

        String rawValue = PackageHeaderExtractor.blankToNull(c.attrOrProperty("Value"));
        String rawEvalOp = PackageHeaderExtractor.blankToNull(c.attrOrProperty("EvalOp"));
        String expression = expression(c);
        boolean logicalAnd = logicalAnd(c.attrOrProperty("LogicalAnd"));

        boolean legacyExpression = "3".equals(rawValue) || "expression".equalsIgnoreCase(rawValue);
        IrPrecedenceCondition value = legacyExpression ? IrPrecedenceCondition.SUCCESS : constraintValue(rawValue);
        IrPrecedenceEvalOp evalOp = legacyExpression ? IrPrecedenceEvalOp.EXPRESSION : evalOp(rawEvalOp);

        if (value == null && expression != null
                && (evalOp == IrPrecedenceEvalOp.EXPRESSION || evalOp == IrPrecedenceEvalOp.EXPRESSION_AND_CONSTRAINT)) {
            ctx.diagnostics.executable(DiagnosticCode.UNRECOGNIZED_PRECEDENCE_VALUE, toId,
                    "Precedence constraint " + fromId + " -> " + toId + " has unrecognized value '" + rawValue
                            + "'; the expression is kept, the constraint part ignored",
                    "value", rawValue);
            ctx.expressions.record(IrExpressionScope.EXECUTABLE, toId, "Precedence[" + fromId + "]", expression);
            return new IrPrecedenceEdge(null, fromId, toId, IrPrecedenceCondition.EXPRESSION, expression, evalOp,
                    IrPrecedenceCondition.COMPLETION, logicalAnd);
        }
        if (value == null || evalOp == null) {
            String raw = value == null ? rawValue : rawEvalOp;
            ctx.diagnostics.executable(DiagnosticCode.UNRECOGNIZED_PRECEDENCE_VALUE, toId,
                    "Precedence constraint " + fromId + " -> " + toId + " has unrecognized value '" + raw + "', treated as Completion",
                    "value", raw);
            return new IrPrecedenceEdge(null, fromId, toId, IrPrecedenceCondition.COMPLETION, null,
                    IrPrecedenceEvalOp.CONSTRAINT, IrPrecedenceCondition.COMPLETION, logicalAnd);
        }

        if (evalOp.usesExpression()) {
            if (expression == null) {
                ctx.diagnostics.executable(DiagnosticCode.EXPRESSION_DOWNGRADED, toId,
                        "Expression constraint " + fromId + " -> " + toId + " has no expression, treated as Completion",
                        "from", fromId);
                return new IrPrecedenceEdge(null, fromId, toId, IrPrecedenceCondition.COMPLETION, null,
                        IrPrecedenceEvalOp.CONSTRAINT, IrPrecedenceCondition.COMPLETION, logicalAnd);
            }
            ctx.expressions.record(IrExpressionScope.EXECUTABLE, toId, "Precedence[" + fromId + "]", expression);
            return new IrPrecedenceEdge(null, fromId, toId, IrPrecedenceCondition.EXPRESSION, expression, evalOp, value, logicalAnd);
        }
        return new IrPrecedenceEdge(null, fromId, toId, value, null, evalOp, value, logicalAnd);
    }

    private static String resolveId(String ref, ExtractContext ctx) {
        String id = ctx.executableId(ref);
        return id != null ? id : ref.trim();
    }

    static IrPrecedenceCondition constraintValue(String raw) {
        if (raw == null) return IrPrecedenceCondition.SUCCESS;
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "0":
            case "success":
                return IrPrecedenceCondition.SUCCESS;
            case "1":
            case "failure":
                return IrPrecedenceCondition.FAILURE;
            case "2":
            case "completion":
                return IrPrecedenceCondition.COMPLETION;
            default:
                return null;
        }
    }

    static IrPrecedenceEvalOp evalOp(String raw) {
        if (raw == null) return IrPrecedenceEvalOp.CONSTRAINT;
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "1":
            case "expression":
                return IrPrecedenceEvalOp.EXPRESSION;
            case "2":
            case "constraint":
                return IrPrecedenceEvalOp.CONSTRAINT;
            case "3":
            case "expressionandconstraint":
                return IrPrecedenceEvalOp.EXPRESSION_AND_CONSTRAINT;
            case "4":
            case "expressionorconstraint":
                return IrPrecedenceEvalOp.EXPRESSION_OR_CONSTRAINT;
            default:
                return null;
        }
    }

    private static String expression(DtsxElement c) {
        String e = PackageHeaderExtractor.blankToNull(c.attrOrProperty("Expression"));
        if (e == null) e = c.child("DTS:Expression").map(DtsxElement::text).map(PackageHeaderExtractor::blankToNull).orElse(null);
        if (e == null) e = c.child("DTS:ObjectData").map(od -> PackageHeaderExtractor.blankToNull(od.attr("Expression"))).orElse(null);
        return e;
    }

    private static boolean logicalAnd(String raw) {
        if (raw == null || raw.isBlank()) return true;
        return VariableExtractor.truthy(raw);
    }
}
