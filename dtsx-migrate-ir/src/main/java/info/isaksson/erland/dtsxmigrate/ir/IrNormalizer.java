package info.isaksson.erland.dtsxmigrate.ir;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Produces a stable, deterministic ordering of all IR lists so JSON output is reproducible.
 *
 * <p>Normalization rules are based on stable keys: connection managers and executables by id,
 * precedence edges by (from, to, condition, id), expressions by (scope, ownerId, property),
 * data-flow paths by (fromComponent, toComponent, id).</p>
 *
 * <p>IMPORTANT: variable and parameter order is preserved as declared, and data-flow components keep
 * their topological order (do not sort).</p>
 */
public final class IrNormalizer {

    private IrNormalizer() {}

    public static IrPackage normalize(IrPackage in) {
        if (in == null) return null;

        List<IrConnectionManager> cms = new ArrayList<>(in.connectionManagers);
        cms.sort(Comparator.comparing((IrConnectionManager c) -> safe(c.id)).thenComparing(c -> safe(c.name)));

        List<IrExecutable> exes = new ArrayList<>(in.executables.size());
        for (IrExecutable e : in.executables) {
            if (e == null) continue;
            exes.add(e instanceof IrDataFlow df ? normalizeDataFlow(df) : e);
        }
        exes.sort(Comparator.comparing((IrExecutable e) -> safe(e.id)));

        return new IrPackage(
                in.schemaVersion,
                in.name,
                in.sourceName,
                in.protectionLevel,
                in.creatorName,
                in.creationDate,
                in.versionBuild,
                in.versionComments,
                in.variables,
                in.parameters,
                List.copyOf(cms),
                List.copyOf(exes),
                normalizeEdges(in.precedenceEdges),
                normalizeExpressions(in.expressions)
        );
    }

    public static List<IrPrecedenceEdge> normalizeEdges(List<IrPrecedenceEdge> in) {
        if (in == null) return List.of();
        List<IrPrecedenceEdge> out = new ArrayList<>(in);
        out.removeIf(e -> e == null);
        out.sort(Comparator
                .comparing((IrPrecedenceEdge e) -> safe(e.from))
                .thenComparing(e -> safe(e.to))
                .thenComparing(e -> e.condition.name())
                .thenComparing(e -> safe(e.id)));
        return List.copyOf(out);
    }

    private static List<IrExpression> normalizeExpressions(List<IrExpression> in) {
        if (in == null) return List.of();
        List<IrExpression> out = new ArrayList<>(in);
        out.removeIf(e -> e == null);
        out.sort(Comparator
                .comparing((IrExpression e) -> e.scope.name())
                .thenComparing(e -> safe(e.ownerId))
                .thenComparing(e -> safe(e.property))
                .thenComparing(e -> safe(e.text)));
        return List.copyOf(out);
    }

    private static IrDataFlow normalizeDataFlow(IrDataFlow df) {
        List<IrPath> paths = new ArrayList<>(df.paths);
        paths.sort(Comparator
                .comparing((IrPath p) -> safe(p.fromComponent))
                .thenComparing(p -> safe(p.toComponent))
                .thenComparing(p -> safe(p.id)));
        // Keep component order (topological) as assembled - do not sort.
        return new IrDataFlow(df.id, df.name, df.typeTag, df.parentId, df.description, df.disabled, df.components, paths);
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
