package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticCode;
import info.isaksson.erland.dtsxmigrate.ir.diag.IrDiagnostic;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IrJsonDeterminismTest {

    @Test
    void writeMatchesGoldenPackage() throws Exception {
        assertGoldenRoundTrip("ir/golden/load-customers.json");
    }

    @Test
    void polymorphicVariantsSurviveRoundTrip() throws Exception {
        IrPackage pkg = IrJson.read(golden("ir/golden/load-customers.json"));

        assertEquals(2, pkg.executables.size());
        IrDataFlow df = assertInstanceOf(IrDataFlow.class, pkg.executable("Package\\Load").orElseThrow());
        assertEquals(IrComponentKind.SOURCE, df.components.get(0).kind);
        IrDestinationComponent dst = assertInstanceOf(IrDestinationComponent.class, df.components.get(1));
        assertEquals(IrWriteMode.APPEND, dst.writeMode);

        IrExecuteSql sql = assertInstanceOf(IrExecuteSql.class, pkg.executable("Package\\Prep").orElseThrow());
        assertEquals("TRUNCATE TABLE dbo.DimCustomer", sql.statement());
        assertTrue(pkg.connection("Src").orElseThrow().properties.get("Password").redactedValue());
    }

    @Test
    void normalizationIsIndependentOfInputOrder() throws Exception {
        IrExecutable a = new IrScript("Package\\A", "A", "Microsoft.ScriptTask", null, null, false, null, null, null, null, IrScriptIoIntent.NONE, null);
        IrExecutable b = new IrSequenceContainer("Package\\B", "B", "STOCK:SEQUENCE", null, null, false, null);
        IrPrecedenceEdge e1 = IrPrecedenceEdge.of("Package\\A", "Package\\B", IrPrecedenceCondition.SUCCESS);
        IrPrecedenceEdge e2 = IrPrecedenceEdge.of("Package\\B", "Package\\A", IrPrecedenceCondition.FAILURE);

        IrPackage p1 = new IrPackage(null, "P", null, null, null, null, null, null, null, null, null, List.of(a, b), List.of(e1, e2), null);
        IrPackage p2 = new IrPackage(null, "P", null, null, null, null, null, null, null, null, null, List.of(b, a), List.of(e2, e1), null);

        assertEquals(IrJson.toJsonString(p1), IrJson.toJsonString(p2));
    }

    @Test
    void newerMajorSchemaIsRejectedOnRead() {
        String json = """
                {"schemaVersion":"2.0","name":"Future"}
                """;
        IOException e = assertThrows(IOException.class, () -> IrJson.readFromString(json));
        assertTrue(e.getMessage().contains("2.0"), e.getMessage());
    }

    @Test
    void minorSchemaRevisionsAreAccepted() throws Exception {
        IrPackage pkg = IrJson.readFromString("""
                {"schemaVersion":"1.3","name":"Later"}
                """);
        assertEquals("1.3", pkg.schemaVersion);
        assertEquals("Later", pkg.sourceName);
    }

    @Test
    void diagnosticListsAreWrittenInCanonicalOrder() throws Exception {
        IrDiagnostic late = new IrDiagnostic(DiagnosticCode.UNKNOWN_COMPONENT, null, "B", "Package\\DF", "7", "late", null);
        IrDiagnostic early = new IrDiagnostic(DiagnosticCode.UNKNOWN_COMPONENT, null, "A", "Package\\DF", "7", "early", null);

        String json = IrJson.valueToJsonString(List.of(late, early));
        assertEquals(IrJson.valueToJsonString(List.of(early, late)), json);
        assertTrue(json.indexOf("early") < json.indexOf("late"));
    }

    private static void assertGoldenRoundTrip(String resourcePath) throws IOException, URISyntaxException {
        Path goldenPath = golden(resourcePath);
        String golden = Files.readString(goldenPath, StandardCharsets.UTF_8);

        IrPackage pkg = IrJson.read(goldenPath);

        // Parse once so the test is resilient to whitespace/pretty-print differences.
        ObjectMapper om = new ObjectMapper();
        JsonNode goldenNode = om.readTree(golden);

        String rendered = IrJson.toJsonString(pkg);
        assertEquals(goldenNode, om.readTree(rendered), "Rendered JSON must be semantically equal to golden fixture.");

        Path tmp = Files.createTempFile("irjson-", ".json");
        IrJson.write(pkg, tmp);
        String written = Files.readString(tmp, StandardCharsets.UTF_8);
        assertEquals(goldenNode, om.readTree(written), "Written JSON must be semantically equal to golden fixture.");

        Path tmp2 = Files.createTempFile("irjson-", ".json");
        IrJson.write(IrJson.readFromString(written), tmp2);
        assertEquals(written, Files.readString(tmp2, StandardCharsets.UTF_8), "Writing twice must produce identical output.");
    }

    private static Path golden(String resourcePath) throws URISyntaxException {
        return Path.of(IrJsonDeterminismTest.class.getClassLoader().getResource(resourcePath).toURI());
    }
}
