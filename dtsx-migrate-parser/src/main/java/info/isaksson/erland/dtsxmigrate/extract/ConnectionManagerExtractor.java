package info.isaksson.erland.dtsxmigrate.extract;

import info.isaksson.erland.dtsxmigrate.ir.IrConnectionKind;
import info.isaksson.erland.dtsxmigrate.ir.IrConnectionManager;
import info.isaksson.erland.dtsxmigrate.ir.IrExpressionScope;
import info.isaksson.erland.dtsxmigrate.ir.IrPropertyValue;
import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticCode;
import info.isaksson.erland.dtsxmigrate.xml.DtsxElement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads {@code DTS:ConnectionManager} declarations.
 *
 * <p>Properties are gathered from {@code DTS:Property} children, the attributes of the inner
 * {@code ObjectData/ConnectionManager} element and {@code DTS:Password} elements. Sensitive values go
 * through the {@link RedactionPolicy}; {@code DTS:PropertyExpression} children become expression
 * overrides.</p>
 */
final class ConnectionManagerExtractor {

    private static final Set<String> RESERVED = Set.of("CreationName", "ObjectName", "DTSID", "refId", "Description");

    List<IrConnectionManager> extract(DtsxElement root, ExtractContext ctx) {
        List<IrConnectionManager> out = new ArrayList<>();
        List<DtsxElement> declarations = new ArrayList<>();
        for (DtsxElement group : root.children("DTS:ConnectionManagers")) {
            declarations.addAll(group.children("DTS:ConnectionManager"));
        }
        for (DtsxElement cmEl : declarations) {
            out.add(read(cmEl, ctx));
        }
        return out;
    }

    private IrConnectionManager read(DtsxElement cmEl, ExtractContext ctx) {
        String name = PackageHeaderExtractor.blankToNull(cmEl.attrOrProperty("ObjectName"));
        String dtsId = PackageHeaderExtractor.blankToNull(cmEl.attrOrProperty("DTSID"));
        String refId = PackageHeaderExtractor.blankToNull(cmEl.attrOrProperty("refId"));
        String id = refId != null ? refId
                : dtsId != null ? dtsId
                : "Package.ConnectionManagers[" + (name == null ? "?" : name) + "]";
        if (name == null) name = id;
        String creationName = PackageHeaderExtractor.blankToNull(cmEl.attrOrProperty("CreationName"));

        IrConnectionKind kind = kindOf(creationName);
        if (kind == IrConnectionKind.UNKNOWN) {
            ctx.diagnostics.report(DiagnosticCode.UNKNOWN_CONNECTION_KIND,
                    "Connection manager " + name + " has unrecognized type '" + (creationName == null ? "" : creationName) + "'",
                    "connection", id);
        }

        Map<String, String> rawValues = new LinkedHashMap<>();
        Map<String, Boolean> flagged = new LinkedHashMap<>();
        for (Map.Entry<String, DtsxElement> p : cmEl.properties().entrySet()) {
            if (RESERVED.contains(p.getKey())) continue;
            rawValues.put(p.getKey(), p.getValue().text());
            flagged.put(p.getKey(), VariableExtractor.truthy(p.getValue().attr("Sensitive")));
        }
        DtsxElement inner = cmEl.path("DTS:ObjectData", "DTS:ConnectionManager").orElse(null);
        if (inner != null) {
            for (Map.Entry<String, String> a : inner.attributes().entrySet()) {
                if (RESERVED.contains(a.getKey())) continue;
                rawValues.put(a.getKey(), a.getValue());
                flagged.putIfAbsent(a.getKey(), false);
            }
            for (Map.Entry<String, DtsxElement> p : inner.properties().entrySet()) {
                rawValues.putIfAbsent(p.getKey(), p.getValue().text());
                flagged.putIfAbsent(p.getKey(), VariableExtractor.truthy(p.getValue().attr("Sensitive")));
            }
            for (DtsxElement pw : inner.children("DTS:Password")) {
                String pwName = pw.attr("Name", "Password");
                rawValues.put(pwName, pw.text());
                flagged.put(pwName, true);
            }
        }

        Map<String, IrPropertyValue> props = new LinkedHashMap<>();
        boolean sensitive = false;
        for (Map.Entry<String, String> e : rawValues.entrySet()) {
            boolean isFlagged = Boolean.TRUE.equals(flagged.get(e.getKey()));
            IrPropertyValue v = ctx.redaction.apply(id, e.getKey(), e.getValue(), isFlagged);
            if (ctx.redaction.sensitive(e.getKey(), e.getValue(), isFlagged)) sensitive = true;
            props.put(e.getKey(), v);
        }
        for (DtsxElement pe : cmEl.children("DTS:PropertyExpression")) {
            String prop = pe.attr("Name");
            if (prop == null || pe.text().isEmpty()) continue;
            props.put(prop, ctx.expressions.override(props.get(prop), IrExpressionScope.CONNECTION, id, prop, pe.text()));
        }
        return new IrConnectionManager(id, dtsId, name, kind, creationName, sensitive, props);
    }

    static IrConnectionKind kindOf(String creationName) {
        if (creationName == null) return IrConnectionKind.UNKNOWN;
        String c = creationName.trim().toUpperCase(Locale.ROOT);
        int colon = c.indexOf(':');
        if (colon > 0) c = c.substring(0, colon);
        switch (c) {
            case "OLEDB":
            case "ADO.NET":
            case "ADO":
            case "ODBC":
            case "MSOLAP100":
            case "MSOLAP":
                return IrConnectionKind.RELATIONAL;
            case "FLATFILE":
            case "FILE":
            case "MULTIFILE":
            case "MULTIFLATFILE":
            case "EXCEL":
            case "FTP":
                return IrConnectionKind.FILE;
            case "HTTP":
            case "ODATA":
            case "WEBSERVICE":
                return IrConnectionKind.HTTP;
            case "SNOWFLAKE":
            case "AZURESQLDW":
            case "SYNAPSE":
            case "REDSHIFT":
                return IrConnectionKind.WAREHOUSE;
            default:
                return IrConnectionKind.UNKNOWN;
        }
    }
}
