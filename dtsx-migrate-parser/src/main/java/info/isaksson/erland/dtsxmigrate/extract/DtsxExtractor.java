package info.isaksson.erland.dtsxmigrate.extract;

import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticCode;
import info.isaksson.erland.dtsxmigrate.ir.diag.Diagnostics;
import info.isaksson.erland.dtsxmigrate.xml.DtsxDocument;
import info.isaksson.erland.dtsxmigrate.xml.DtsxElement;
import info.isaksson.erland.dtsxmigrate.xml.MalformedDocumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts one {@code .dtsx} document into an {@link ExtractedPackage}.
 *
 * <p>Steps: package header, variables and parameters, connection managers, control flow (with data
 * flows), precedence constraints. Unsupported constructs are recorded as diagnostics; only a document
 * that is not well-formed, or whose root is not a {@code DTS:Executable}, raises.</p>
 *
 * <p>Instances hold no state between calls and may be shared between threads.</p>
 */
public final class DtsxExtractor {

    private static final Logger logger = LoggerFactory.getLogger(DtsxExtractor.class);

    private final PackageHeaderExtractor header = new PackageHeaderExtractor();
    private final VariableExtractor variables = new VariableExtractor();
    private final ConnectionManagerExtractor connections = new ConnectionManagerExtractor();
    private final ControlFlowExtractor controlFlow = new ControlFlowExtractor();
    private final PrecedenceResolver precedence = new PrecedenceResolver();

    public ExtractedPackage extract(String sourceName, byte[] content, ExtractOptions options) throws MalformedDocumentException {
        DtsxDocument doc = DtsxDocument.parse(sourceName, content);
        DtsxElement root = doc.root();
        if (!root.is("DTS:Executable")) {
            throw new MalformedDocumentException(sourceName, "Root element " + root + " is not a DTS:Executable");
        }

        Diagnostics diagnostics = new Diagnostics(packageName(root, sourceName));
        ExtractedPackage out = new ExtractedPackage(sourceName, diagnostics);
        out.name = diagnostics.packageName();

        header.extract(root, out);
        logger.debug("{}: package {} protection level {}", sourceName, out.name, out.protectionLevel);

        ExtractContext ctx = new ExtractContext(options, diagnostics,
                new RedactionPolicy(out.protectionLevel, options.decryptionCredential, options.decryptor, diagnostics));
        if (out.protectionLevel.encryptsAll() && options.decryptionCredential == null) {
            diagnostics.report(DiagnosticCode.ENCRYPTED_PACKAGE,
                    "Package is saved with " + out.protectionLevel.dtsName + " and no credential was supplied; only unencrypted content is extracted",
                    "protectionLevel", out.protectionLevel.dtsName);
        }

        variables.extract(root, ctx, out);
        logger.debug("{}: {} variables, {} parameters", sourceName, out.variables.size(), out.parameters.size());

        out.connectionManagers.addAll(connections.extract(root, ctx));
        ctx.connections = out.connectionManagers;
        logger.debug("{}: {} connection managers", sourceName, out.connectionManagers.size());

        controlFlow.extract(root, ctx, out);
        logger.debug("{}: {} executables", sourceName, out.executables.size());

        out.precedenceEdges.addAll(precedence.resolve(root, ctx));
        logger.debug("{}: {} precedence edges", sourceName, out.precedenceEdges.size());

        out.expressions.addAll(ctx.expressions.expressions());
        return out;
    }

    /** Package name as {@link PackageHeaderExtractor} will read it, falling back to the source name. */
    static String packageName(DtsxElement root, String sourceName) {
        String name = PackageHeaderExtractor.blankToNull(root.attrOrProperty("ObjectName"));
        if (name == null) name = PackageHeaderExtractor.blankToNull(root.property("PackageName"));
        if (name != null) return name;
        String fromSource = ControlFlowExtractor.packageReference(sourceName);
        return fromSource == null ? sourceName : fromSource;
    }
}
