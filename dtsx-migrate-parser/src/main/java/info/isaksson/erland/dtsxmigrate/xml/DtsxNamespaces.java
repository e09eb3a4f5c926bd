package info.isaksson.erland.dtsxmigrate.xml;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Prefix to namespace-URI map used to resolve qualified names such as {@code DTS:Executable}.
 *
 * <p>Namespace URIs are compared case-insensitively: designers and hand-written packages disagree on
 * the casing of the task namespaces.</p>
 */
public final class DtsxNamespaces {

    public static final String DTS = "www.microsoft.com/SqlServer/Dts";
    public static final String SQL_TASK = "www.microsoft.com/sqlserver/dts/tasks/sqltask";
    public static final String PIPELINE = "www.microsoft.com/sqlserver/dts/pipeline";
    public static final String SCRIPT_TASK = "www.microsoft.com/sqlserver/dts/tasks/scripttask";
    public static final String FOREACH = "www.microsoft.com/sqlserver/dts/tasks/foreachloop";
    public static final String EXECUTE_PACKAGE_TASK = "www.microsoft.com/SqlServer/Dts/Tasks/ExecutePackageTask";
    public static final String SSIS = "www.microsoft.com/SqlServer/SSIS";

    private final Map<String, String> byPrefix;

    public DtsxNamespaces(Map<String, String> byPrefix) {
        this.byPrefix = Map.copyOf(Objects.requireNonNull(byPrefix, "byPrefix"));
    }

    public static DtsxNamespaces defaults() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("DTS", DTS);
        m.put("SQLTask", SQL_TASK);
        m.put("pipeline", PIPELINE);
        m.put("ScriptTask", SCRIPT_TASK);
        m.put("ForEachLoop", FOREACH);
        m.put("ExecutePackageTask", EXECUTE_PACKAGE_TASK);
        m.put("SSIS", SSIS);
        return new DtsxNamespaces(m);
    }

    /** Namespace URI for {@code prefix}, or null when the prefix is not mapped. */
    public String uri(String prefix) {
        return byPrefix.get(prefix);
    }

    public static boolean sameNamespace(String a, String b) {
        if (a == null || b == null) return a == null && b == null;
        return a.equalsIgnoreCase(b);
    }
}
