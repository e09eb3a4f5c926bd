package info.isaksson.erland.dtsxmigrate.extract;

import info.isaksson.erland.dtsxmigrate.ir.IrConnectionManager;
import info.isaksson.erland.dtsxmigrate.ir.IrExecutable;
import info.isaksson.erland.dtsxmigrate.ir.IrExpression;
import info.isaksson.erland.dtsxmigrate.ir.IrPackage;
import info.isaksson.erland.dtsxmigrate.ir.IrParameter;
import info.isaksson.erland.dtsxmigrate.ir.IrPrecedenceEdge;
import info.isaksson.erland.dtsxmigrate.ir.IrProtectionLevel;
import info.isaksson.erland.dtsxmigrate.ir.IrVariable;
import info.isaksson.erland.dtsxmigrate.ir.diag.Diagnostics;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Everything extracted from one package document, before assembly and validation.
 *
 * <p>Mutable while the extractors run; {@link #toPackage()} snapshots it into an (unvalidated)
 * {@link IrPackage}.</p>
 */
public final class ExtractedPackage {
    public final String sourceName;
    public final Diagnostics diagnostics;

    public String name;
    public IrProtectionLevel protectionLevel = IrProtectionLevel.DONT_SAVE_SENSITIVE;
    public String creatorName;
    public String creationDate;
    public String versionBuild;
    public String versionComments;

    public final List<IrVariable> variables = new ArrayList<>();
    public final List<IrParameter> parameters = new ArrayList<>();
    public final List<IrConnectionManager> connectionManagers = new ArrayList<>();
    public final List<IrExecutable> executables = new ArrayList<>();
    public final List<IrPrecedenceEdge> precedenceEdges = new ArrayList<>();
    public final List<IrExpression> expressions = new ArrayList<>();

    public ExtractedPackage(String sourceName, Diagnostics diagnostics) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.name = sourceName;
    }

    public IrPackage toPackage() {
        return new IrPackage(
                IrPackage.SCHEMA_VERSION,
                name,
                sourceName,
                protectionLevel,
                creatorName,
                creationDate,
                versionBuild,
                versionComments,
                variables,
                parameters,
                connectionManagers,
                executables,
                precedenceEdges,
                expressions
        );
    }
}
