package info.isaksson.erland.dtsxmigrate.extract;

import info.isaksson.erland.dtsxmigrate.ir.IrConnectionManager;
import info.isaksson.erland.dtsxmigrate.ir.IrExecutable;
import info.isaksson.erland.dtsxmigrate.ir.IrExecutableKind;
import info.isaksson.erland.dtsxmigrate.ir.IrExecutePackage;
import info.isaksson.erland.dtsxmigrate.ir.IrExecuteSql;
import info.isaksson.erland.dtsxmigrate.ir.IrExpressionScope;
import info.isaksson.erland.dtsxmigrate.ir.IrForEachLoop;
import info.isaksson.erland.dtsxmigrate.ir.IrParameterBinding;
import info.isaksson.erland.dtsxmigrate.ir.IrPropertyValue;
import info.isaksson.erland.dtsxmigrate.ir.IrScript;
import info.isaksson.erland.dtsxmigrate.ir.IrSequenceContainer;
import info.isaksson.erland.dtsxmigrate.ir.IrUnknownExecutable;
import info.isaksson.erland.dtsxmigrate.ir.IrUnknownReason;
import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticCode;
import info.isaksson.erland.dtsxmigrate.xml.DtsxElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Walks the {@code DTS:Executables} tree and produces flat IR executables.
 *
 * <p>Each executable is mapped by its type tag. Unsupported types become {@link IrUnknownExecutable}
 * with exactly one {@code UNKNOWN_EXECUTABLE} warning, and their children are still walked.</p>
 */
final class ControlFlowExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ControlFlowExtractor.class);

    private final DataFlowBuilder dataFlows = new DataFlowBuilder();
    private final ScriptIntentDetector scriptIntent = new ScriptIntentDetector();

    void extract(DtsxElement root, ExtractContext ctx, ExtractedPackage out) {
        String rootId = PackageHeaderExtractor.blankToNull(root.attrOrProperty("refId"));
        if (rootId == null) rootId = "Package";
        recordPropertyExpressions(root, IrExpressionScope.PACKAGE, out.name, ctx);
        walkChildren(root, null, rootId, ctx, out);
    }

    private List<String> walkChildren(DtsxElement container, String parentId, String parentPath, ExtractContext ctx, ExtractedPackage out) {
        List<String> ids = new ArrayList<>();
        for (DtsxElement group : container.children("DTS:Executables")) {
            for (DtsxElement exe : group.children("DTS:Executable")) {
                ids.add(extractExecutable(exe, parentId, parentPath, ctx, out));
            }
        }
        return ids;
    }

    private String extractExecutable(DtsxElement exe, String parentId, String parentPath, ExtractContext ctx, ExtractedPackage out) {
        String name = PackageHeaderExtractor.blankToNull(exe.attrOrProperty("ObjectName"));
        String refId = PackageHeaderExtractor.blankToNull(exe.attrOrProperty("refId"));
        String dtsId = PackageHeaderExtractor.blankToNull(exe.attrOrProperty("DTSID"));
        String id = refId != null ? refId
                : dtsId != null ? dtsId
                : parentPath + "\\" + (name == null ? "Executable" + out.executables.size() : name);

        String typeTag = PackageHeaderExtractor.blankToNull(exe.attrOrProperty("ExecutableType"));
        if (typeTag == null) typeTag = PackageHeaderExtractor.blankToNull(exe.attrOrProperty("CreationName"));
        ExecutableHeader header = new ExecutableHeader(id, name, typeTag, parentId,
                PackageHeaderExtractor.blankToNull(exe.attrOrProperty("Description")),
                VariableExtractor.truthy(exe.attrOrProperty("Disabled")));

        registerAliases(ctx, id, refId, dtsId);
        Map<String, String> expressions = recordPropertyExpressions(exe, IrExpressionScope.EXECUTABLE, id, ctx);

        IrExecutableKind kind = ExecutableTypes.kindOf(typeTag);
        logger.debug("Executable {} ({}) -> {}", id, typeTag, kind);
        IrExecutable result;
        switch (kind) {
            case EXECUTE_SQL:
                result = executeSql(exe, header, expressions, ctx);
                break;
            case DATA_FLOW:
                result = dataFlows.build(exe, header, ctx);
                break;
            case SCRIPT:
                result = script(exe, header);
                break;
            case SEQUENCE_CONTAINER:
                result = new IrSequenceContainer(id, name, typeTag, parentId, header.description, header.disabled,
                        walkChildren(exe, id, id, ctx, out));
                break;
            case FOR_EACH_LOOP:
                result = forEach(exe, header, ctx, walkChildren(exe, id, id, ctx, out));
                break;
            case EXECUTE_PACKAGE:
                result = executePackage(exe, header, ctx);
                break;
            default:
                result = unknown(header, ctx, walkChildren(exe, id, id, ctx, out));
                break;
        }
        out.executables.add(result);
        return id;
    }

    private static void registerAliases(ExtractContext ctx, String id, String refId, String dtsId) {
        ctx.executableAliases.put(id, id);
        if (refId != null) ctx.executableAliases.put(refId, id);
        if (dtsId != null) {
            ctx.executableAliases.put(dtsId, id);
            ctx.executableAliases.put(dtsId.toUpperCase(Locale.ROOT), id);
        }
    }

    /** Record {@code DTS:PropertyExpression} children; returns property name to expression text. */
    static Map<String, String> recordPropertyExpressions(DtsxElement owner, IrExpressionScope scope, String ownerId, ExtractContext ctx) {
        Map<String, String> out = new LinkedHashMap<>();
        for (DtsxElement pe : owner.children("DTS:PropertyExpression")) {
            String prop = pe.attr("Name");
            String text = pe.text();
            if (prop == null || text.isEmpty()) continue;
            ctx.expressions.record(scope, ownerId, prop, text);
            out.put(prop, text);
        }
        return out;
    }

    private IrExecutable executeSql(DtsxElement exe, ExecutableHeader h, Map<String, String> expressions, ExtractContext ctx) {
        DtsxElement data = exe.descendants("SqlTaskData").stream().findFirst().orElse(null);
        String statement = null;
        String sourceType = null;
        String connection = null;
        List<IrParameterBinding> bindings = new ArrayList<>();
        if (data != null) {
            statement = valueOf(data, "SqlStatementSource");
            sourceType = valueOf(data, "SqlStatementSourceType");
            connection = valueOf(data, "Connection");
            for (DtsxElement b : data.children("ParameterBinding")) {
                String variable = b.attr("DtsVariableName");
                boolean resolved = ctx.expressions.known(variable);
                if (variable != null && !resolved) {
                    ctx.diagnostics.executable(DiagnosticCode.UNRESOLVED_REFERENCE, h.id,
                            "Parameter binding references unknown variable " + variable, "reference", variable);
                }
                bindings.add(new IrParameterBinding(b.attr("ParameterName"), variable, b.attr("ParameterDirection"),
                        b.attr("DataType"), resolved));
            }
        }

        IrPropertyValue sql;
        String overrideText = expressions.get("SqlStatementSource");
        if ("Variable".equalsIgnoreCase(sourceType) && statement != null && !statement.isBlank()) {
            String ref = "@[" + statement.trim() + "]";
            sql = ctx.expressions.override(IrPropertyValue.ofLiteral(null), IrExpressionScope.EXECUTABLE, h.id, "SqlStatementSource", ref);
        } else {
            sql = IrPropertyValue.ofLiteral(statement);
        }
        if (overrideText != null) {
            sql = sql.withExpression(overrideText, ctx.expressions.references(overrideText));
        }
        if (SqlHeuristics.hardcodedCredential(statement)) {
            ctx.diagnostics.executable(DiagnosticCode.HARDCODED_CREDENTIAL, h.id,
                    "SQL statement of " + h.name + " appears to contain a credential", "property", "SqlStatementSource");
        }
        String connectionRef = ctx.connectionId(connection, h.id);
        return new IrExecuteSql(h.id, h.name, h.typeTag, h.parentId, h.description, h.disabled,
                sql, sourceType, connectionRef, SqlHeuristics.dialect(statement), bindings);
    }

    private IrExecutable script(DtsxElement exe, ExecutableHeader h) {
        DtsxElement taskData = exe.descendants("ScriptTaskData").stream().findFirst().orElse(null);
        DtsxElement project = exe.descendants("ScriptProject").stream().findFirst().orElse(null);

        String language = firstNonBlank(attr(taskData, "ScriptLanguage"), attr(project, "Language"));
        String projectName = firstNonBlank(attr(taskData, "ScriptProjectName"), attr(project, "Name"));
        String readOnly = firstNonBlank(attr(taskData, "ReadOnlyVariables"), attr(project, "ReadOnlyVariables"));
        String readWrite = firstNonBlank(attr(taskData, "ReadWriteVariables"), attr(project, "ReadWriteVariables"));

        List<String> sources = new ArrayList<>();
        for (DtsxElement item : exe.descendants("ProjectItem")) {
            String itemName = item.attr("Name", "").toLowerCase(Locale.ROOT);
            if (itemName.endsWith(".cs") || itemName.endsWith(".vb") || itemName.isEmpty()) {
                sources.add(item.rawText());
            }
        }
        ScriptIntentDetector.Result intent = scriptIntent.detect(sources, h.name, h.description);
        return new IrScript(h.id, h.name, h.typeTag, h.parentId, h.description, h.disabled,
                language, projectName, splitList(readOnly), splitList(readWrite), intent.intent, intent.evidence);
    }

    private IrExecutable forEach(DtsxElement exe, ExecutableHeader h, ExtractContext ctx, List<String> childIds) {
        DtsxElement enumerator = exe.child("DTS:ForEachEnumerator").orElse(null);
        String enumeratorType = null;
        Map<String, IrPropertyValue> props = new LinkedHashMap<>();
        if (enumerator != null) {
            enumeratorType = PackageHeaderExtractor.blankToNull(enumerator.attrOrProperty("CreationName"));
            String ownerId = h.id + ".ForEachEnumerator";
            DtsxElement data = enumerator.child("DTS:ObjectData").orElse(null);
            if (data != null) {
                data.walk(e -> {
                    for (Map.Entry<String, String> a : e.attributes().entrySet()) {
                        props.putIfAbsent(a.getKey(), ctx.redaction.apply(ownerId, a.getKey(), a.getValue(), false));
                    }
                });
            }
            for (DtsxElement pe : enumerator.children("DTS:PropertyExpression")) {
                String prop = pe.attr("Name");
                if (prop == null || pe.text().isEmpty()) continue;
                props.put(prop, ctx.expressions.override(props.get(prop), IrExpressionScope.EXECUTABLE, h.id, prop, pe.text()));
            }
        }

        List<DtsxElement> mappings = new ArrayList<>();
        for (DtsxElement group : exe.children("DTS:ForEachVariableMappings")) {
            mappings.addAll(group.children("DTS:ForEachVariableMapping"));
        }
        mappings.sort(Comparator.comparingInt(m -> parseIndex(m.attrOrProperty("ValueIndex"))));
        List<String> variables = new ArrayList<>();
        for (DtsxElement m : mappings) {
            String v = PackageHeaderExtractor.blankToNull(m.attrOrProperty("VariableName"));
            if (v != null) variables.add(v);
        }
        return new IrForEachLoop(h.id, h.name, h.typeTag, h.parentId, h.description, h.disabled,
                enumeratorType, props, variables, childIds);
    }

    private IrExecutable executePackage(DtsxElement exe, ExecutableHeader h, ExtractContext ctx) {
        DtsxElement data = exe.descendants("ExecutePackageTask").stream().findFirst().orElse(null);
        String packageName = null;
        String connection = null;
        boolean useProjectReference = false;
        if (data != null) {
            packageName = valueOf(data, "PackageName");
            connection = valueOf(data, "Connection");
            useProjectReference = VariableExtractor.truthy(valueOf(data, "UseProjectReference"));
        }
        if (packageName == null) packageName = PackageHeaderExtractor.blankToNull(exe.attrOrProperty("PackageName"));

        String raw = packageName;
        if (raw == null && connection != null) {
            IrConnectionManager cm = ctx.connection(connection);
            IrPropertyValue cs = cm == null ? null : cm.properties.get("ConnectionString");
            raw = cs != null && cs.literal != null && !cs.literal.isBlank() ? cs.literal : connection;
        }
        return new IrExecutePackage(h.id, h.name, h.typeTag, h.parentId, h.description, h.disabled,
                packageReference(raw), raw, useProjectReference);
    }

    private IrExecutable unknown(ExecutableHeader h, ExtractContext ctx, List<String> childIds) {
        String tag = h.typeTag == null ? "" : h.typeTag;
        ctx.diagnostics.executable(DiagnosticCode.UNKNOWN_EXECUTABLE, h.id,
                "Executable " + (h.name == null ? h.id : h.name) + " of type '" + tag + "' is not supported; kept as placeholder",
                "typeTag", tag);
        return new IrUnknownExecutable(h.id, h.name, h.typeTag, h.parentId, h.description, h.disabled,
                IrUnknownReason.UNRECOGNIZED_TYPE, childIds);
    }

    /** Package name from a reference: directories and the {@code .dtsx} extension are removed. */
    static String packageReference(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String r = raw.trim();
        int slash = Math.max(r.lastIndexOf('\\'), r.lastIndexOf('/'));
        if (slash >= 0) r = r.substring(slash + 1);
        if (r.toLowerCase(Locale.ROOT).endsWith(".dtsx")) r = r.substring(0, r.length() - 5);
        return r.isEmpty() ? null : r;
    }

    /** Attribute in any namespace, else the text of a child element of that local name. */
    private static String valueOf(DtsxElement el, String name) {
        String v = el.attr(name);
        if (v == null) v = el.child(name).map(DtsxElement::text).orElse(null);
        return PackageHeaderExtractor.blankToNull(v);
    }

    private static String attr(DtsxElement el, String name) {
        return el == null ? null : PackageHeaderExtractor.blankToNull(el.attr(name));
    }

    private static String firstNonBlank(String a, String b) {
        return a != null ? a : b;
    }

    private static List<String> splitList(String csv) {
        if (csv == null || csv.isBlank()) return List.of();
        List<String> out = new ArrayList<>();
        for (String s : Arrays.asList(csv.split(","))) {
            if (!s.isBlank()) out.add(s.trim());
        }
        return out;
    }

    private static int parseIndex(String s) {
        if (s == null) return Integer.MAX_VALUE;
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }
}
