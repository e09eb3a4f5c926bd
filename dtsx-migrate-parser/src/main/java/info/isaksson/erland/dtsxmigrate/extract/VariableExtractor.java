package info.isaksson.erland.dtsxmigrate.extract;

import info.isaksson.erland.dtsxmigrate.ir.IrExpressionScope;
import info.isaksson.erland.dtsxmigrate.ir.IrParameter;
import info.isaksson.erland.dtsxmigrate.ir.IrPropertyValue;
import info.isaksson.erland.dtsxmigrate.ir.IrVariable;
import info.isaksson.erland.dtsxmigrate.xml.DtsxElement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads variables and package parameters, then sets up the {@link ExpressionResolver} of the context.
 *
 * <p>Two passes: names first (so expressions may reference variables declared later), values second.
 * Variables of every container scope are collected; the first declaration of a scoped name wins.</p>
 */
final class VariableExtractor {

    private static final class RawVariable {
        String namespace;
        String name;
        String dataType;
        String value;
        String expression;
        boolean readOnly;
    }

    void extract(DtsxElement root, ExtractContext ctx, ExtractedPackage out) {
        Map<String, RawVariable> raw = new LinkedHashMap<>();
        for (DtsxElement vars : root.descendants("DTS:Variables")) {
            for (DtsxElement v : vars.children("DTS:Variable")) {
                RawVariable rv = readVariable(v);
                if (rv != null) raw.putIfAbsent(rv.namespace + "::" + rv.name, rv);
            }
        }

        List<DtsxElement> paramElements = new ArrayList<>(root.descendants("DTS:PackageParameter"));
        paramElements.addAll(root.descendants("DTS:Parameter"));
        Set<String> paramNames = new LinkedHashSet<>();
        for (DtsxElement p : paramElements) {
            String n = PackageHeaderExtractor.blankToNull(p.attrOrProperty("ObjectName"));
            if (n == null) n = PackageHeaderExtractor.blankToNull(p.attr("Name"));
            if (n != null) paramNames.add(n);
        }

        ctx.expressions = new ExpressionResolver(raw.keySet(), paramNames, ctx.diagnostics, ctx.options.complexExpressionThreshold);

        for (Map.Entry<String, RawVariable> e : raw.entrySet()) {
            RawVariable rv = e.getValue();
            IrPropertyValue value = IrPropertyValue.ofLiteral(rv.value);
            if (rv.expression != null) {
                value = ctx.expressions.override(value, IrExpressionScope.VARIABLE, e.getKey(), "Value", rv.expression);
            }
            out.variables.add(new IrVariable(rv.namespace, rv.name, e.getKey(), rv.dataType, rv.readOnly, value));
        }

        Set<String> seen = new LinkedHashSet<>();
        for (DtsxElement p : paramElements) {
            IrParameter param = readParameter(p, ctx);
            if (param != null && seen.add(param.name)) out.parameters.add(param);
        }
    }

    private static RawVariable readVariable(DtsxElement v) {
        String objectName = PackageHeaderExtractor.blankToNull(v.attrOrProperty("ObjectName"));
        if (objectName == null) return null;
        RawVariable rv = new RawVariable();
        String ns = PackageHeaderExtractor.blankToNull(v.attrOrProperty("Namespace"));
        int idx = objectName.indexOf("::");
        if (idx >= 0) {
            if (ns == null) ns = objectName.substring(0, idx);
            objectName = objectName.substring(idx + 2);
        }
        rv.namespace = ns == null ? "User" : ns;
        rv.name = objectName;

        DtsxElement valueEl = v.child("DTS:VariableValue").orElse(null);
        if (valueEl != null) {
            rv.value = valueEl.text();
            rv.dataType = valueEl.attr("DTS:DataType");
        } else {
            rv.value = v.property("Value");
        }
        if (rv.dataType == null) rv.dataType = v.attrOrProperty("DataType");

        String expression = PackageHeaderExtractor.blankToNull(v.attrOrProperty("Expression"));
        String evaluate = v.attrOrProperty("EvaluateAsExpression");
        if (expression != null && (evaluate == null || truthy(evaluate))) rv.expression = expression;
        rv.readOnly = truthy(v.attrOrProperty("ReadOnly"));
        return rv;
    }

    private static IrParameter readParameter(DtsxElement p, ExtractContext ctx) {
        String name = PackageHeaderExtractor.blankToNull(p.attrOrProperty("ObjectName"));
        if (name == null) name = PackageHeaderExtractor.blankToNull(p.attr("Name"));
        if (name == null) return null;

        String dataType = p.attrOrProperty("DataType");
        boolean sensitive = truthy(p.attrOrProperty("Sensitive"));
        boolean required = truthy(p.attrOrProperty("Required"));

        String literal = null;
        boolean valueFlagged = false;
        for (Map.Entry<String, DtsxElement> e : p.properties().entrySet()) {
            if ("ParameterValue".equals(e.getKey()) || "Value".equals(e.getKey())) {
                literal = e.getValue().text();
                valueFlagged = truthy(e.getValue().attr("Sensitive"));
                break;
            }
        }
        if (literal == null) literal = p.child("ParameterValue").map(DtsxElement::text).orElse(null);

        IrPropertyValue value = sensitive || valueFlagged
                ? ctx.redaction.apply(IrParameter.PACKAGE_NAMESPACE + "::" + name, "Value", literal, true)
                : IrPropertyValue.ofLiteral(literal);
        return new IrParameter(IrParameter.PACKAGE_NAMESPACE, name, null, dataType, sensitive || valueFlagged, required, value);
    }

    static boolean truthy(String s) {
        if (s == null) return false;
        String v = s.trim();
        return v.equalsIgnoreCase("true") || v.equals("1") || v.equals("-1");
    }
}
