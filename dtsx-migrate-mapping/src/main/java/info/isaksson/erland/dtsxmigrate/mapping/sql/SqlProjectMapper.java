package info.isaksson.erland.dtsxmigrate.mapping.sql;

import info.isaksson.erland.dtsxmigrate.ir.IrAggregateComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrConditionalSplitComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrConnectionManager;
import info.isaksson.erland.dtsxmigrate.ir.IrDataFlow;
import info.isaksson.erland.dtsxmigrate.ir.IrDerivedColumnComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrDestinationComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrExecutable;
import info.isaksson.erland.dtsxmigrate.ir.IrExecuteSql;
import info.isaksson.erland.dtsxmigrate.ir.IrLookupComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrNamedExpression;
import info.isaksson.erland.dtsxmigrate.ir.IrPackage;
import info.isaksson.erland.dtsxmigrate.ir.IrPath;
import info.isaksson.erland.dtsxmigrate.ir.IrSortComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrSourceComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrWriteMode;
import info.isaksson.erland.dtsxmigrate.mapping.DataFlowChain;
import info.isaksson.erland.dtsxmigrate.mapping.MappingNames;
import info.isaksson.erland.dtsxmigrate.mapping.SqlProjectGenerator;
import info.isaksson.erland.dtsxmigrate.mapping.SqlProjectMappingInput;
import info.isaksson.erland.dtsxmigrate.mapping.SqlProjectMappingInput.PackageSlice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps the transform-eligible slice of a project to a {@link SqlProject}.
 *
 * <p>Per data flow: a staging view per Source, an intermediate table per source-to-sink chain and a
 * mart per Destination, the mart being incremental when the destination appends. Each Execute SQL
 * task becomes a table model when its statement is a query and an operation otherwise.</p>
 *
 * <p>Model names are {@code <layer>_<package>__<name>}, slugged and made unique across the project
 * in generation order.</p>
 */
public final class SqlProjectMapper implements SqlProjectGenerator<SqlProject> {

    private static final Logger logger = LoggerFactory.getLogger(SqlProjectMapper.class);

    private final TargetDialect dialect;
    private final SqlDialectRewriter rewriter;

    public SqlProjectMapper() {
        this(true, TargetDialect.SNOWFLAKE);
    }

    public SqlProjectMapper(boolean rewriteDialect, TargetDialect dialect) {
        this.dialect = dialect == null ? TargetDialect.SNOWFLAKE : dialect;
        this.rewriter = rewriteDialect ? new SqlDialectRewriter(this.dialect) : null;
    }

    @Override
    public SqlProject generate(SqlProjectMappingInput input) {
        Build build = new Build();
        for (PackageSlice slice : input.packages) {
            for (IrExecutable exe : slice.executables) {
                if (exe instanceof IrExecuteSql) {
                    sqlTask(slice.pkg, (IrExecuteSql) exe, build);
                } else if (exe instanceof IrDataFlow) {
                    dataFlow(slice.pkg, (IrDataFlow) exe, slice.chainsOf(exe.id), build);
                }
            }
        }
        logger.info("Mapped {} package(s) to {} model(s), {} source(s), {} test(s)",
                input.packages.size(), build.models.size(), build.sources.size(), build.tests.size());
        return new SqlProject(dialect, new ArrayList<>(build.sources), build.models, new ArrayList<>(build.tests));
    }

    private void sqlTask(IrPackage pkg, IrExecuteSql task, Build build) {
        String name = build.name(ModelLayer.SQL_TASK, pkg.name, MappingNames.executablePath(pkg, task));
        String statement = task.statement();
        if (statement.isBlank() && task.sql.hasExpression()) {
            build.model(pkg, name, ModelLayer.SQL_TASK, Materialization.OPERATION, task.id, null, List.of(),
                    "-- statement is built at run time by the expression:\n-- " + task.sql.expression.replace("\n", "\n-- "),
                    false);
            return;
        }
        Materialization materialization = SqlStatements.isQuery(statement) ? Materialization.TABLE : Materialization.OPERATION;
        build.model(pkg, name, ModelLayer.SQL_TASK, materialization, task.id, null, List.of(), statement.strip(), true);
    }

    private void dataFlow(IrPackage pkg, IrDataFlow df, List<DataFlowChain> chains, Build build) {
        Map<String, String> staging = new HashMap<>();
        for (IrComponent c : df.components) {
            if (c instanceof IrSourceComponent) {
                staging.put(c.id, stagingModel(pkg, (IrSourceComponent) c, build));
            }
        }

        Map<String, List<String>> intoDestination = new LinkedHashMap<>();
        for (int i = 0; i < chains.size(); i++) {
            DataFlowChain chain = chains.get(i);
            String name = build.name(ModelLayer.INTERMEDIATE, pkg.name, MappingNames.join(df.name, String.valueOf(i + 1)));
            String upstream = staging.get(chain.startId());
            String sql = chainSql(df, chain, upstream);
            build.model(pkg, name, ModelLayer.INTERMEDIATE, Materialization.TABLE, df.id, null,
                    upstream == null ? List.of() : List.of(upstream), sql, true);
            for (String id : chain.componentIds) {
                IrComponent c = df.component(id);
                if (c instanceof IrLookupComponent) {
                    for (String key : ((IrLookupComponent) c).joinKeys) {
                        build.tests.add(new SqlTest(name, key, SqlTest.NOT_NULL));
                    }
                }
            }
            if (df.component(chain.endId()) instanceof IrDestinationComponent) {
                intoDestination.computeIfAbsent(chain.endId(), k -> new ArrayList<>()).add(name);
            }
        }

        for (IrComponent c : df.components) {
            if (!(c instanceof IrDestinationComponent)) continue;
            IrDestinationComponent dest = (IrDestinationComponent) c;
            List<String> inputs = intoDestination.getOrDefault(dest.id, List.of());
            String name = build.name(ModelLayer.MART, pkg.name, MappingNames.slug(dest.name));
            Materialization materialization = dest.writeMode == IrWriteMode.APPEND ? Materialization.INCREMENTAL : Materialization.TABLE;
            StringBuilder sql = new StringBuilder();
            if (inputs.isEmpty()) {
                sql.append("-- no chain reaches ").append(dest.name).append('\n').append("select null as placeholder");
            }
            for (int i = 0; i < inputs.size(); i++) {
                if (i > 0) sql.append("\nunion all\n");
                sql.append("select * from ").append(ref(inputs.get(i)));
            }
            build.model(pkg, name, ModelLayer.MART, materialization, dest.id, SqlStatements.tableName(dest.tableName),
                    inputs, sql.toString(), false);
        }
    }

    private String stagingModel(IrPackage pkg, IrSourceComponent source, Build build) {
        String name = build.name(ModelLayer.STAGING, pkg.name, MappingNames.slug(source.name));
        String table = SqlStatements.tableName(source.tableName);
        String sql;
        boolean rewrite = false;
        if (table != null) {
            String sourceName = sourceName(pkg, source.connectionRef);
            build.sources.add(new SqlSource(sourceName, table, pkg.name));
            sql = "select * from {{ source('" + sourceName + "', '" + table + "') }}";
        } else if (source.query != null && !source.query.isBlank()) {
            sql = source.query.strip();
            rewrite = true;
        } else {
            sql = "-- " + source.name + " has neither a table nor a query\nselect null as placeholder";
        }
        build.model(pkg, name, ModelLayer.STAGING, Materialization.VIEW, source.id, null, List.of(), sql, rewrite);
        return name;
    }

    private static String sourceName(IrPackage pkg, String connectionRef) {
        if (connectionRef == null) return MappingNames.slug(pkg.name);
        return pkg.connection(connectionRef)
                .map((IrConnectionManager cm) -> MappingNames.slug(cm.name))
                .orElse(MappingNames.slug(pkg.name));
    }

    /** One CTE per transforming component of the chain; endpoints contribute no step. */
    private static String chainSql(IrDataFlow df, DataFlowChain chain, String upstreamModel) {
        List<String> names = new ArrayList<>();
        for (String id : chain.componentIds) {
            IrComponent c = df.component(id);
            names.add(c == null ? id : c.name);
        }
        List<String> steps = new ArrayList<>();
        if (upstreamModel != null) {
            steps.add("select * from " + ref(upstreamModel));
        } else {
            steps.add("-- chain does not start at a source\nselect null as placeholder");
        }
        for (int i = 0; i < chain.componentIds.size(); i++) {
            IrComponent c = df.component(chain.componentIds.get(i));
            if (c == null || c instanceof IrSourceComponent || c instanceof IrDestinationComponent) continue;
            IrPath out = i < chain.pathIds.size() ? path(df, chain.pathIds.get(i)) : null;
            steps.add(step(c, out, "step_" + (steps.size() - 1)));
        }

        StringBuilder sql = new StringBuilder("-- ").append(df.name).append(": ").append(String.join(" -> ", names)).append('\n');
        if (steps.size() == 1) {
            return sql.append(steps.get(0)).toString();
        }
        sql.append("with ");
        for (int i = 0; i < steps.size(); i++) {
            if (i > 0) sql.append(",\n");
            sql.append("step_").append(i).append(" as (\n").append(SqlStatements.indent(steps.get(i))).append("\n)");
        }
        return sql.append("\nselect * from step_").append(steps.size() - 1).toString();
    }

    private static String step(IrComponent c, IrPath out, String prev) {
        switch (c.kind) {
            case DERIVED_COLUMN: {
                List<String> cols = new ArrayList<>();
                for (IrNamedExpression col : ((IrDerivedColumnComponent) c).columns) {
                    cols.add(SqlStatements.expression(col.displayExpression()) + " as " + col.name);
                }
                return cols.isEmpty() ? "select * from " + prev : "select *, " + String.join(", ", cols) + "\nfrom " + prev;
            }
            case LOOKUP: {
                IrLookupComponent lookup = (IrLookupComponent) c;
                if (lookup.referenceTarget == null || lookup.joinKeys.isEmpty()) {
                    return "-- lookup " + c.name + " has no reference or join keys\nselect * from " + prev;
                }
                String reference = SqlStatements.isQuery(lookup.referenceTarget)
                        ? "(\n" + SqlStatements.indent(lookup.referenceTarget.strip()) + "\n)"
                        : SqlStatements.tableName(lookup.referenceTarget);
                if (out != null && out.startPort != null && out.startPort.contains("No Match")) {
                    List<String> match = new ArrayList<>();
                    for (String key : lookup.joinKeys) match.add(prev + "." + key + " = lkp." + key);
                    return "select * from " + prev + "\nwhere not exists (\n    select 1 from " + reference + " as lkp\n    where "
                            + String.join(" and ", match) + "\n)";
                }
                String join = lookup.noMatchBehavior == null ? "left join" : "inner join";
                return "select *\nfrom " + prev + "\n" + join + " " + reference + " as lkp using ("
                        + String.join(", ", lookup.joinKeys) + ")";
            }
            case CONDITIONAL_SPLIT:
                return "select * from " + prev + "\nwhere " + splitPredicate((IrConditionalSplitComponent) c, out);
            case AGGREGATE: {
                IrAggregateComponent agg = (IrAggregateComponent) c;
                List<String> cols = new ArrayList<>(agg.groupBy);
                for (IrNamedExpression a : agg.aggregations) cols.add(a.expression + " as " + a.name);
                if (cols.isEmpty()) return "select * from " + prev;
                String sql = "select " + String.join(", ", cols) + "\nfrom " + prev;
                return agg.groupBy.isEmpty() ? sql : sql + "\ngroup by " + String.join(", ", agg.groupBy);
            }
            case SORT: {
                IrSortComponent sort = (IrSortComponent) c;
                String select = sort.removeDuplicates ? "select distinct * from " : "select * from ";
                return sort.sortKeys.isEmpty() ? select + prev : select + prev + "\norder by " + String.join(", ", sort.sortKeys);
            }
            case UNION_ALL:
                return "-- " + c.name + ": other inputs are separate chains\nselect * from " + prev;
            default:
                return "-- unsupported component " + c.name + " (" + c.classId + ")\nselect * from " + prev;
        }
    }

    /** The predicate for the split output the chain follows; the default output negates every case. */
    private static String splitPredicate(IrConditionalSplitComponent split, IrPath out) {
        String port = out == null || out.startPort == null ? "" : out.startPort;
        boolean defaultOutput = split.defaultOutput != null && portNamed(port, split.defaultOutput);
        for (IrNamedExpression cond : split.conditions) {
            if (!defaultOutput && portNamed(port, cond.name)) {
                return SqlStatements.expression(cond.displayExpression());
            }
        }
        if (split.conditions.isEmpty()) return "true";
        List<String> negated = new ArrayList<>();
        for (IrNamedExpression cond : split.conditions) {
            negated.add("not (" + SqlStatements.expression(cond.displayExpression()) + ")");
        }
        return String.join("\n  and ", negated);
    }

    private static boolean portNamed(String port, String name) {
        return port.equals(name) || port.endsWith("[" + name + "]") || port.endsWith("." + name);
    }

    private static IrPath path(IrDataFlow df, String pathId) {
        for (IrPath p : df.paths) {
            if (p.id.equals(pathId)) return p;
        }
        return null;
    }

    private static String ref(String model) {
        return "{{ ref('" + model + "') }}";
    }

    private final class Build {
        final Set<SqlSource> sources = new LinkedHashSet<>();
        final List<SqlModel> models = new ArrayList<>();
        final Set<SqlTest> tests = new LinkedHashSet<>();
        final Set<String> names = new HashSet<>();

        /** {@code path} is already slugged. */
        String name(ModelLayer layer, String packageName, String path) {
            return MappingNames.unique(layer.prefix() + "_" + MappingNames.slug(packageName) + "__" + path, names);
        }

        void model(IrPackage pkg, String name, ModelLayer layer, Materialization materialization, String originId,
                   String targetTable, List<String> dependsOn, String sql, boolean rewrite) {
            List<String> applied = List.of();
            if (rewrite && rewriter != null) {
                SqlDialectRewriter.Result result = rewriter.rewrite(sql);
                sql = result.sql;
                applied = result.appliedRules;
            }
            models.add(new SqlModel(name, pkg.name, layer, materialization, originId, targetTable, dependsOn, applied, sql));
        }
    }
}
