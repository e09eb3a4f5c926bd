package info.isaksson.erland.dtsxmigrate.ir.diag;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects diagnostics for one package (or the project scope when {@code packageName} is null).
 *
 * <p>Diagnostics are deterministic: final output is sorted by (package, code, executable, component,
 * message, contextString).</p>
 */
public final class Diagnostics {

    public static final Comparator<IrDiagnostic> ORDER = Comparator
            .comparing((IrDiagnostic d) -> safe(d.packageName))
            .thenComparing(d -> d.code.name())
            .thenComparing(d -> safe(d.executableId))
            .thenComparing(d -> safe(d.componentId))
            .thenComparing(d -> d.message)
            .thenComparing(d -> contextString(d.context));

    private final String packageName;
    private final List<IrDiagnostic> items = new ArrayList<>();

    public Diagnostics(String packageName) {
        this.packageName = packageName;
    }

    public String packageName() {
        return packageName;
    }

    public void report(DiagnosticCode code, String message) {
        add(code, null, null, message, null);
    }

    public void report(DiagnosticCode code, String message, String k1, String v1) {
        add(code, null, null, message, ctx(k1, v1));
    }

    public void executable(DiagnosticCode code, String executableId, String message) {
        add(code, executableId, null, message, null);
    }

    public void executable(DiagnosticCode code, String executableId, String message, String k1, String v1) {
        add(code, executableId, null, message, ctx(k1, v1));
    }

    public void executable(DiagnosticCode code, String executableId, String message, String k1, String v1, String k2, String v2) {
        Map<String, String> c = ctx(k1, v1);
        c.put(k2, v2);
        add(code, executableId, null, message, c);
    }

    public void component(DiagnosticCode code, String executableId, String componentId, String message, String k1, String v1) {
        add(code, executableId, componentId, message, ctx(k1, v1));
    }

    public void add(DiagnosticCode code, String executableId, String componentId, String message, Map<String, String> context) {
        items.add(new IrDiagnostic(code, null, packageName, executableId, componentId, message, context));
    }

    public void add(IrDiagnostic d) {
        if (d != null) items.add(d);
    }

    public void addAll(Collection<IrDiagnostic> ds) {
        if (ds == null) return;
        for (IrDiagnostic d : ds) add(d);
    }

    public boolean hasErrors() {
        for (IrDiagnostic d : items) {
            if (d.error()) return true;
        }
        return false;
    }

    public long count(DiagnosticKind kind) {
        return items.stream().filter(d -> d.kind == kind).count();
    }

    public int size() {
        return items.size();
    }

    public List<IrDiagnostic> toDeterministicList() {
        return sorted(items);
    }

    public static List<IrDiagnostic> sorted(Collection<IrDiagnostic> in) {
        List<IrDiagnostic> out = new ArrayList<>(in);
        out.sort(ORDER);
        return Collections.unmodifiableList(out);
    }

    private static Map<String, String> ctx(String k1, String v1) {
        Map<String, String> c = new LinkedHashMap<>();
        c.put(k1, v1 == null ? "" : v1);
        return c;
    }

    private static String contextString(Map<String, String> ctx) {
        if (ctx == null || ctx.isEmpty()) return "";
        // stable serialization: key-sorted
        List<String> keys = new ArrayList<>(ctx.keySet());
        keys.sort(String::compareTo);
        StringBuilder sb = new StringBuilder();
        for (String k : keys) {
            sb.append(k).append('=').append(ctx.get(k)).append(';');
        }
        return sb.toString();
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
