package info.isaksson.erland.dtsxmigrate.extract;

import info.isaksson.erland.dtsxmigrate.ir.IrComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrComponentKind;
import info.isaksson.erland.dtsxmigrate.ir.IrConnectionKind;
import info.isaksson.erland.dtsxmigrate.ir.IrConnectionManager;
import info.isaksson.erland.dtsxmigrate.ir.IrDataFlow;
import info.isaksson.erland.dtsxmigrate.ir.IrDerivedColumnComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrDestinationComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrEndpointBinding;
import info.isaksson.erland.dtsxmigrate.ir.IrExecutable;
import info.isaksson.erland.dtsxmigrate.ir.IrExecutePackage;
import info.isaksson.erland.dtsxmigrate.ir.IrExecuteSql;
import info.isaksson.erland.dtsxmigrate.ir.IrForEachLoop;
import info.isaksson.erland.dtsxmigrate.ir.IrLookupComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrPackage;
import info.isaksson.erland.dtsxmigrate.ir.IrParameter;
import info.isaksson.erland.dtsxmigrate.ir.IrPrecedenceCondition;
import info.isaksson.erland.dtsxmigrate.ir.IrPrecedenceEdge;
import info.isaksson.erland.dtsxmigrate.ir.IrPrecedenceEvalOp;
import info.isaksson.erland.dtsxmigrate.ir.IrProtectionLevel;
import info.isaksson.erland.dtsxmigrate.ir.IrScript;
import info.isaksson.erland.dtsxmigrate.ir.IrScriptIoIntent;
import info.isaksson.erland.dtsxmigrate.ir.IrSourceComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrSqlDialect;
import info.isaksson.erland.dtsxmigrate.ir.IrUnknownExecutable;
import info.isaksson.erland.dtsxmigrate.ir.IrUnknownReason;
import info.isaksson.erland.dtsxmigrate.ir.IrVariable;
import info.isaksson.erland.dtsxmigrate.ir.IrWriteMode;
import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticCode;
import info.isaksson.erland.dtsxmigrate.ir.diag.IrDiagnostic;
import info.isaksson.erland.dtsxmigrate.xml.MalformedDocumentException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class DtsxExtractorTest {

    @Test
    void readsPackageHeader() throws Exception {
        IrPackage pkg = DtsxFixtures.extract("load_sales.dtsx").toPackage();

        assertEquals("LoadSales", pkg.name);
        assertEquals("load_sales.dtsx", pkg.sourceName);
        assertEquals(IrProtectionLevel.ENCRYPT_SENSITIVE_WITH_PASSWORD, pkg.protectionLevel);
        assertEquals("CORP\\etl", pkg.creatorName);
        assertEquals("14", pkg.versionBuild);
        assertEquals("nightly load", pkg.versionComments);
    }

    @Test
    void flattensExecutablesWithParentLinks() throws Exception {
        IrPackage pkg = DtsxFixtures.extract("load_sales.dtsx").toPackage();

        assertEquals(6, pkg.executables.size());
        IrForEachLoop loop = assertInstanceOf(IrForEachLoop.class, pkg.executable("Package\\Process Files").orElseThrow());
        assertEquals(List.of("Package\\Process Files\\Upload Raw File", "Package\\Process Files\\Archive File"), loop.children());
        assertEquals("Package\\Process Files", pkg.executable("Package\\Process Files\\Archive File").orElseThrow().parentId);
        assertNull(loop.parentId);
    }

    @Test
    void readsExecuteSqlPayload() throws Exception {
        IrPackage pkg = DtsxFixtures.extract("load_sales.dtsx").toPackage();

        IrExecuteSql sql = assertInstanceOf(IrExecuteSql.class, pkg.executable("Package\\Prepare Staging").orElseThrow());
        assertTrue(sql.statement().startsWith("TRUNCATE TABLE [stg].[Sales]"));
        assertEquals("Package.ConnectionManagers[Warehouse]", sql.connectionRef);
        assertEquals(IrSqlDialect.TSQL, sql.dialect);
        assertEquals(1, sql.parameterBindings.size());
        assertEquals("User::BatchID", sql.parameterBindings.get(0).variable);
        assertTrue(sql.parameterBindings.get(0).resolved);
    }

    @Test
    void detectsExternalIoInScriptSource() throws Exception {
        IrPackage pkg = DtsxFixtures.extract("load_sales.dtsx").toPackage();

        IrScript script = assertInstanceOf(IrScript.class, pkg.executable("Package\\Process Files\\Upload Raw File").orElseThrow());
        assertEquals(IrScriptIoIntent.EXTERNAL_IO, script.ioIntent);
        assertTrue(script.ioEvidence.contains("WebClient"), "evidence: " + script.ioEvidence);
        assertEquals("CSharp", script.language);
        assertEquals(List.of("User::CurrentFile"), script.readOnlyVariables);
    }

    @Test
    void readsForEachEnumeratorAndMappings() throws Exception {
        IrPackage pkg = DtsxFixtures.extract("load_sales.dtsx").toPackage();

        IrForEachLoop loop = assertInstanceOf(IrForEachLoop.class, pkg.executable("Package\\Process Files").orElseThrow());
        assertEquals("Microsoft.ForEachFileEnumerator", loop.enumeratorType);
        assertEquals("*.csv", loop.enumeratorProperties.get("FileSpec").literal);
        assertEquals("@[User::InputFolder]", loop.enumeratorProperties.get("Directory").expression);
        assertEquals(List.of("User::CurrentFile"), loop.variableMappings);
    }

    @Test
    void resolvesExecutePackageReferenceThroughFileConnection() throws Exception {
        IrPackage pkg = DtsxFixtures.extract("load_sales.dtsx").toPackage();

        IrExecutePackage call = assertInstanceOf(IrExecutePackage.class, pkg.executable("Package\\Publish").orElseThrow());
        assertEquals("PublishSales", call.packageReference);
        assertEquals("C:\\packages\\PublishSales.dtsx", call.rawReference);
        assertFalse(call.useProjectReference);
    }

    @Test
    void unsupportedTaskBecomesPlaceholderWithSingleWarning() throws Exception {
        ExtractedPackage extracted = DtsxFixtures.extract("load_sales.dtsx");
        IrPackage pkg = extracted.toPackage();

        IrUnknownExecutable unknown = assertInstanceOf(IrUnknownExecutable.class,
                pkg.executable("Package\\Process Files\\Archive File").orElseThrow());
        assertEquals(IrUnknownReason.UNRECOGNIZED_TYPE, unknown.reason);
        assertEquals("Microsoft.FileSystemTask", unknown.typeTag);

        List<IrDiagnostic> warnings = extracted.diagnostics.toDeterministicList().stream()
                .filter(d -> d.code == DiagnosticCode.UNKNOWN_EXECUTABLE)
                .collect(Collectors.toList());
        assertEquals(1, warnings.size());
        assertEquals("Package\\Process Files\\Archive File", warnings.get(0).executableId);
    }

    @Test
    void buildsDataFlowInTopologicalOrder() throws Exception {
        IrPackage pkg = DtsxFixtures.extract("load_sales.dtsx").toPackage();

        IrDataFlow df = assertInstanceOf(IrDataFlow.class, pkg.executable("Package\\Load Sales").orElseThrow());
        List<String> order = df.components.stream().map(c -> c.name).collect(Collectors.toList());
        assertEquals(List.of("Sales File", "Add Audit Columns", "Customer Lookup", "Fuzzy Grouping", "Sales Destination"), order);
        assertEquals(4, df.paths.size());

        IrSourceComponent src = assertInstanceOf(IrSourceComponent.class, df.components.get(0));
        assertEquals(IrEndpointBinding.FILE, src.binding);
        assertEquals("Package\\Load Sales\\Sales File.Outputs[Flat File Source Output]", src.outputPort);

        IrDerivedColumnComponent derived = assertInstanceOf(IrDerivedColumnComponent.class, df.components.get(1));
        assertEquals("LoadDate", derived.columns.get(0).name);
        assertEquals("GETDATE()", derived.columns.get(0).expression);

        IrLookupComponent lookup = assertInstanceOf(IrLookupComponent.class, df.components.get(2));
        assertEquals(List.of("CustomerCode"), lookup.joinKeys);
        assertEquals("NO_MATCH_OUTPUT", lookup.noMatchBehavior);

        assertEquals(IrComponentKind.UNKNOWN, df.components.get(3).kind);

        IrDestinationComponent dst = assertInstanceOf(IrDestinationComponent.class, df.components.get(4));
        assertEquals("[dbo].[FactSales]", dst.tableName);
        assertEquals(IrWriteMode.APPEND, dst.writeMode);
        assertEquals(IrEndpointBinding.WAREHOUSE, dst.binding);
    }

    @Test
    void unknownComponentKeepsItsPortsAndGetsOneWarning() throws Exception {
        ExtractedPackage extracted = DtsxFixtures.extract("load_sales.dtsx");
        IrDataFlow df = (IrDataFlow) extracted.toPackage().executable("Package\\Load Sales").orElseThrow();
        IrComponent fuzzy = df.component("Package\\Load Sales\\Fuzzy Grouping");

        assertEquals(1, fuzzy.inputPorts.size());
        assertEquals(1, fuzzy.outputPorts.size());
        long warnings = extracted.diagnostics.toDeterministicList().stream()
                .filter(d -> d.code == DiagnosticCode.UNKNOWN_COMPONENT)
                .count();
        assertEquals(1, warnings);
    }

    @Test
    void mapsConnectionManagersAndRedactsSecrets() throws Exception {
        ExtractedPackage extracted = DtsxFixtures.extract("load_sales.dtsx");
        IrPackage pkg = extracted.toPackage();

        IrConnectionManager dw = pkg.connection("Warehouse").orElseThrow();
        assertEquals(IrConnectionKind.RELATIONAL, dw.kind);
        assertTrue(dw.sensitive);
        assertTrue(dw.properties.get("Password").redactedValue());
        assertEquals("@[$Package::TargetDatabase]", dw.properties.get("InitialCatalog").expression);

        IrConnectionManager file = pkg.connection("SalesFile").orElseThrow();
        assertEquals(IrConnectionKind.FILE, file.kind);
        assertFalse(file.sensitive);

        assertTrue(extracted.diagnostics.toDeterministicList().stream().anyMatch(d -> d.code == DiagnosticCode.REDACTED_VALUE));
    }

    @Test
    void readsVariablesAndParameters() throws Exception {
        IrPackage pkg = DtsxFixtures.extract("load_sales.dtsx").toPackage();

        assertEquals(4, pkg.variables.size());
        IrVariable archive = pkg.variables.stream().filter(v -> v.name.equals("ArchiveFolder")).findFirst().orElseThrow();
        assertEquals("User::ArchiveFolder", archive.scopedName);
        assertTrue(archive.value.hasExpression());
        assertTrue(archive.value.references.get(0).resolved);

        IrParameter target = pkg.parameters.stream().filter(p -> p.name.equals("TargetDatabase")).findFirst().orElseThrow();
        assertEquals("Sales", target.value.literal);
        assertTrue(target.required);

        IrParameter apiKey = pkg.parameters.stream().filter(p -> p.name.equals("ApiKey")).findFirst().orElseThrow();
        assertTrue(apiKey.sensitive);
        assertTrue(apiKey.value.redactedValue());
    }

    @Test
    void resolvesPrecedenceConstraintsAcrossContainers() throws Exception {
        IrPackage pkg = DtsxFixtures.extract("load_sales.dtsx").toPackage();

        assertEquals(4, pkg.precedenceEdges.size());
        IrPrecedenceEdge expr = edge(pkg, "Package\\Process Files", "Package\\Load Sales");
        assertEquals(IrPrecedenceCondition.EXPRESSION, expr.condition);
        assertEquals(IrPrecedenceEvalOp.EXPRESSION_AND_CONSTRAINT, expr.evalOp);
        assertEquals("@[User::BatchID] > 0", expr.expression);

        // From given as DTSID resolves to the executable's refId
        IrPrecedenceEdge completion = edge(pkg, "Package\\Load Sales", "Package\\Publish");
        assertEquals(IrPrecedenceCondition.COMPLETION, completion.condition);

        IrPrecedenceEdge nested = edge(pkg, "Package\\Process Files\\Upload Raw File", "Package\\Process Files\\Archive File");
        assertEquals(IrPrecedenceCondition.SUCCESS, nested.condition);
    }

    @Test
    void readsLegacyPropertyFormAndComponentIdPaths() throws Exception {
        ExtractedPackage extracted = DtsxFixtures.extract("orders_legacy.dtsx");
        IrPackage pkg = extracted.toPackage();

        assertEquals("OrdersLegacy", pkg.name);
        assertEquals(IrProtectionLevel.DONT_SAVE_SENSITIVE, pkg.protectionLevel);
        assertEquals("User", pkg.variables.get(0).namespace);
        assertEquals("RunDate", pkg.variables.get(0).name);

        IrExecutable prep = pkg.executable("{11111111-1111-1111-1111-111111111111}").orElseThrow();
        IrExecuteSql sql = assertInstanceOf(IrExecuteSql.class, prep);
        assertEquals("TRUNCATE TABLE staging_orders", sql.statement());
        assertEquals(IrSqlDialect.ANSI, sql.dialect);

        IrDataFlow df = assertInstanceOf(IrDataFlow.class, pkg.executable("{22222222-2222-2222-2222-222222222222}").orElseThrow());
        assertEquals(6, df.components.size());
        assertEquals(5, df.paths.size());
        assertEquals("4.Outputs[HighValue]", df.paths.stream().filter(p -> p.id.equals("path4")).findFirst().orElseThrow().startPort);

        IrLookupComponent lookup = assertInstanceOf(IrLookupComponent.class, df.component("3"));
        assertEquals(List.of("customer_id", "region_id"), lookup.joinKeys);

        IrDestinationComponent high = assertInstanceOf(IrDestinationComponent.class, df.component("5"));
        assertEquals(IrWriteMode.APPEND, high.writeMode);
        IrDestinationComponent regular = assertInstanceOf(IrDestinationComponent.class, df.component("6"));
        assertEquals(IrWriteMode.INSERT, regular.writeMode);

        IrPrecedenceEdge edge = pkg.precedenceEdges.get(0);
        assertEquals(prep.id, edge.from);
        assertEquals(df.id, edge.to);

        String cs = pkg.connectionManagers.get(0).properties.get("ConnectionString").literal;
        assertTrue(cs.contains("Password=[REDACTED]"), cs);
        assertTrue(cs.contains("Data Source=ordersrv"), cs);
    }

    @Test
    void rejectsRootThatIsNotAnExecutable() {
        byte[] xml = "<Project xmlns=\"urn:x\"/>".getBytes(StandardCharsets.UTF_8);
        assertThrows(MalformedDocumentException.class,
                () -> new DtsxExtractor().extract("project.xml", xml, ExtractOptions.defaults()));
    }

    @Test
    void encryptAllWithoutCredentialRaisesAdvisory() throws Exception {
        String xml = """
                <DTS:Executable xmlns:DTS="www.microsoft.com/SqlServer/Dts" DTS:ObjectName="Locked" DTS:ProtectionLevel="3">
                  <DTS:EncryptedData>AQAAANCMnd8BFdERjHoAwE</DTS:EncryptedData>
                </DTS:Executable>
                """;
        ExtractedPackage extracted = new DtsxExtractor().extract("locked.dtsx", xml.getBytes(StandardCharsets.UTF_8), ExtractOptions.defaults());

        assertEquals(IrProtectionLevel.ENCRYPT_ALL_WITH_PASSWORD, extracted.protectionLevel);
        assertTrue(extracted.executables.isEmpty());
        assertTrue(extracted.diagnostics.toDeterministicList().stream().anyMatch(d -> d.code == DiagnosticCode.ENCRYPTED_PACKAGE));
    }

    @Test
    void unknownProtectionLevelFallsBackWithWarning() throws Exception {
        String xml = """
                <DTS:Executable xmlns:DTS="www.microsoft.com/SqlServer/Dts" DTS:ObjectName="Odd" DTS:ProtectionLevel="42"/>
                """;
        ExtractedPackage extracted = new DtsxExtractor().extract("odd.dtsx", xml.getBytes(StandardCharsets.UTF_8), ExtractOptions.defaults());

        assertEquals(IrProtectionLevel.DONT_SAVE_SENSITIVE, extracted.protectionLevel);
        assertTrue(extracted.diagnostics.toDeterministicList().stream().anyMatch(d -> d.code == DiagnosticCode.UNKNOWN_PROTECTION_LEVEL));
    }

    private static IrPrecedenceEdge edge(IrPackage pkg, String from, String to) {
        return pkg.precedenceEdges.stream()
                .filter(e -> e.from.equals(from) && e.to.equals(to))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no edge " + from + " -> " + to + " in " + pkg.precedenceEdges));
    }
}
