package info.isaksson.erland.dtsxmigrate.extract;

import info.isaksson.erland.dtsxmigrate.ir.IrConnectionManager;
import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticCode;
import info.isaksson.erland.dtsxmigrate.ir.diag.Diagnostics;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** State shared by the extractors of one package. Never shared across packages. */
final class ExtractContext {
    final ExtractOptions options;
    final Diagnostics diagnostics;
    final RedactionPolicy redaction;
    ExpressionResolver expressions;
    List<IrConnectionManager> connections = List.of();

    /** refId, DTSID and id of every executable seen so far, mapped to its IR id. */
    final Map<String, String> executableAliases = new HashMap<>();

    ExtractContext(ExtractOptions options, Diagnostics diagnostics, RedactionPolicy redaction) {
        this.options = options;
        this.diagnostics = diagnostics;
        this.redaction = redaction;
    }

    /** The IR id an executable reference (refId or DTSID) points at, or null. */
    String executableId(String ref) {
        if (ref == null) return null;
        String r = ref.trim();
        String id = executableAliases.get(r);
        return id != null ? id : executableAliases.get(r.toUpperCase(Locale.ROOT));
    }

    IrConnectionManager connection(String ref) {
        if (ref == null || ref.isBlank()) return null;
        for (IrConnectionManager cm : connections) {
            if (cm.matches(ref)) return cm;
        }
        return null;
    }

    /**
     * Resolve a connection reference to the connection manager id; unknown references are kept as
     * written and reported.
     */
    String connectionId(String ref, String executableId) {
        if (ref == null || ref.isBlank()) return null;
        IrConnectionManager cm = connection(ref);
        if (cm != null) return cm.id;
        diagnostics.executable(DiagnosticCode.UNRESOLVED_CONNECTION_REFERENCE, executableId,
                "Connection reference " + ref + " does not name a connection manager of this package", "connection", ref);
        return ref.trim();
    }
}
