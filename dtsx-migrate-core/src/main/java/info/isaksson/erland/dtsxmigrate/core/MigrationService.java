package info.isaksson.erland.dtsxmigrate.core;

import info.isaksson.erland.dtsxmigrate.extract.DtsxExtractor;
import info.isaksson.erland.dtsxmigrate.extract.ExtractedPackage;
import info.isaksson.erland.dtsxmigrate.extract.ProjectParametersReader;
import info.isaksson.erland.dtsxmigrate.io.PackageScanner;
import info.isaksson.erland.dtsxmigrate.io.PackageSource;
import info.isaksson.erland.dtsxmigrate.ir.IrPackage;
import info.isaksson.erland.dtsxmigrate.ir.IrParameter;
import info.isaksson.erland.dtsxmigrate.ir.IrStrategyDecision;
import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticCode;
import info.isaksson.erland.dtsxmigrate.ir.diag.Diagnostics;
import info.isaksson.erland.dtsxmigrate.ir.diag.IrDiagnostic;
import info.isaksson.erland.dtsxmigrate.mapping.SqlProjectMappingInput;
import info.isaksson.erland.dtsxmigrate.mapping.WorkflowMappingInput;
import info.isaksson.erland.dtsxmigrate.mapping.sql.SqlProject;
import info.isaksson.erland.dtsxmigrate.mapping.sql.SqlProjectMapper;
import info.isaksson.erland.dtsxmigrate.mapping.workflow.WorkflowGraph;
import info.isaksson.erland.dtsxmigrate.mapping.workflow.WorkflowGraphMapper;
import info.isaksson.erland.dtsxmigrate.project.CrossPackageResolver;
import info.isaksson.erland.dtsxmigrate.project.ProjectScopeChecker;
import info.isaksson.erland.dtsxmigrate.strategy.StrategyClassifier;
import info.isaksson.erland.dtsxmigrate.xml.MalformedDocumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Core (server-friendly) API for migrating SSIS packages.
 *
 * <p>CLI and server wrappers should use this class instead of re-implementing the pipeline. No
 * method throws for problems in the input documents; those end up as diagnostics on the results.</p>
 */
public final class MigrationService {

    private static final Logger logger = LoggerFactory.getLogger(MigrationService.class);

    private final DtsxExtractor extractor = new DtsxExtractor();
    private final PackageAssembler assembler = new PackageAssembler();

    /** Parse, assemble and validate one package. */
    public PackageResult migratePackage(PackageSource source, MigrationOptions options) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        if (options == null) options = new MigrationOptions();
        try {
            ExtractedPackage extracted = extractor.extract(source.name, source.content(), options.toExtractOptions());
            return assembler.assemble(extracted);
        } catch (MalformedDocumentException e) {
            logger.warn("{}: not a readable package: {}", source.name, e.getMessage());
            return failed(source.name, DiagnosticCode.MALFORMED_DOCUMENT_ERROR, e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("{}: migration failed unexpectedly", source.name, e);
            return failed(source.name, DiagnosticCode.INTERNAL_ERROR, "Unexpected " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * Migrate every package of a project, then resolve cross-package calls, classify and map.
     *
     * <p>Packages are parsed in parallel on {@link MigrationOptions#parallelism} threads; results keep
     * the request order. A cycle between packages fails the project but leaves each package's IR
     * intact; mapping is then skipped.</p>
     */
    public ProjectResult migrateProject(ProjectRequest request, MigrationOptions options) {
        if (request == null) throw new IllegalArgumentException("request must not be null");
        if (options == null) options = new MigrationOptions();
        logger.info("Migrating {} package(s)", request.packages.size());

        Diagnostics projectDiagnostics = new Diagnostics(null);
        List<IrParameter> projectParameters = readProjectParameters(request, options, projectDiagnostics);
        List<PackageResult> results = parseAll(request.packages, options);

        List<IrPackage> valid = new ArrayList<>();
        for (PackageResult r : results) {
            if (r.ok()) {
                valid.add(r.ir);
            } else {
                projectDiagnostics.add(new IrDiagnostic(DiagnosticCode.CLASSIFICATION_SKIPPED, null, r.packageName, null, null,
                        "Package " + r.packageName + " failed and is left out of the project graph and strategy",
                        Map.of("source", r.sourceName)));
            }
        }

        CrossPackageResolver.Resolution resolution = new CrossPackageResolver().resolve(valid);
        projectDiagnostics.addAll(resolution.diagnostics);
        valid = resolution.packages;
        results = withProjectNames(results, valid);
        projectDiagnostics.addAll(new ProjectScopeChecker().check(valid, projectParameters, request.projectParams != null));
        IrStrategyDecision decision = new StrategyClassifier().decide(valid, resolution.graph.edges);

        WorkflowGraph workflow = null;
        SqlProject sqlProject = null;
        if (resolution.cycle == null) {
            if (decision.strategy.needsWorkflow()) {
                workflow = new WorkflowGraphMapper().generate(new WorkflowMappingInput(valid, resolution.graph.edges, decision));
            }
            if (decision.strategy.needsSqlProject()) {
                sqlProject = new SqlProjectMapper(options.rewriteSqlDialect, options.targetDialect)
                        .generate(SqlProjectMappingInput.of(valid, decision));
            }
        }

        ProjectStatus status;
        if (resolution.cycle != null || (valid.isEmpty() && !results.isEmpty())) {
            status = ProjectStatus.FAILED;
        } else if (valid.size() < results.size()) {
            status = ProjectStatus.PARTIAL;
        } else {
            status = ProjectStatus.OK;
        }
        logger.info("Project {}: {} of {} package(s) valid, strategy {}",
                status, valid.size(), results.size(), decision.strategy.wireName());
        return new ProjectResult(status, results, projectParameters, resolution.graph, resolution.cycle, decision,
                workflow, sqlProject, projectDiagnostics.toDeterministicList());
    }

    private List<IrParameter> readProjectParameters(ProjectRequest request, MigrationOptions options, Diagnostics d) {
        if (request.projectParams == null) return List.of();
        try {
            return new ProjectParametersReader().read(PackageScanner.PROJECT_PARAMS, request.projectParams, options.toExtractOptions(), d);
        } catch (MalformedDocumentException e) {
            logger.warn("{}: not readable: {}", PackageScanner.PROJECT_PARAMS, e.getMessage());
            d.report(DiagnosticCode.MALFORMED_DOCUMENT_ERROR, e.getMessage(), "source", PackageScanner.PROJECT_PARAMS);
            return List.of();
        }
    }

    private List<PackageResult> parseAll(List<PackageSource> sources, MigrationOptions options) {
        List<PackageResult> results = new ArrayList<>(sources.size());
        if (sources.isEmpty()) return results;

        final MigrationOptions opts = options;
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, Math.min(options.parallelism, sources.size())));
        try {
            List<Future<PackageResult>> futures = new ArrayList<>(sources.size());
            for (PackageSource source : sources) {
                futures.add(pool.submit(() -> migratePackage(source, opts)));
            }

            boolean interrupted = false;
            for (int i = 0; i < futures.size(); i++) {
                Future<PackageResult> f = futures.get(i);
                String name = sources.get(i).name;
                if (interrupted && !f.isDone()) {
                    f.cancel(true);
                    results.add(failed(name, DiagnosticCode.INTERRUPTED, "Interrupted before the package was migrated"));
                    continue;
                }
                try {
                    results.add(f.get());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    interrupted = true;
                    f.cancel(true);
                    results.add(failed(name, DiagnosticCode.INTERRUPTED, "Interrupted before the package was migrated"));
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    logger.warn("{}: migration failed unexpectedly", name, cause);
                    results.add(failed(name, DiagnosticCode.INTERNAL_ERROR, "Unexpected " + cause.getClass().getSimpleName() + ": " + cause.getMessage()));
                }
            }
            if (interrupted) logger.warn("Interrupted; remaining packages were marked failed");
        } finally {
            pool.shutdownNow();
        }
        return results;
    }

    /** Replaces the IR of packages the resolver renamed, attributing their diagnostics to the new name. */
    private static List<PackageResult> withProjectNames(List<PackageResult> results, List<IrPackage> named) {
        List<PackageResult> out = new ArrayList<>(results.size());
        int i = 0;
        for (PackageResult r : results) {
            if (!r.ok()) {
                out.add(r);
                continue;
            }
            IrPackage ir = named.get(i++);
            if (ir == r.ir) {
                out.add(r);
                continue;
            }
            List<IrDiagnostic> diagnostics = new ArrayList<>(r.diagnostics.size());
            for (IrDiagnostic d : r.diagnostics) diagnostics.add(d.inPackage(ir.name));
            out.add(PackageResult.ok(ir, diagnostics));
        }
        return out;
    }

    private static PackageResult failed(String sourceName, DiagnosticCode code, String message) {
        String packageName = CrossPackageResolver.stem(sourceName);
        IrDiagnostic d = new IrDiagnostic(code, null, packageName, null, null, message, Map.of("source", sourceName));
        return PackageResult.failed(sourceName, packageName, List.of(d));
    }
}
