package info.isaksson.erland.dtsxmigrate.extract;

import info.isaksson.erland.dtsxmigrate.ir.IrParameter;
import info.isaksson.erland.dtsxmigrate.ir.diag.DiagnosticCode;
import info.isaksson.erland.dtsxmigrate.ir.diag.Diagnostics;
import info.isaksson.erland.dtsxmigrate.xml.MalformedDocumentException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ProjectParametersReaderTest {

    private static final String PARAMS = """
            <?xml version="1.0"?>
            <SSIS:Parameters xmlns:SSIS="www.microsoft.com/SqlServer/SSIS">
              <SSIS:Parameter SSIS:Name="ServerName">
                <SSIS:Properties>
                  <SSIS:Property SSIS:Name="DataType">18</SSIS:Property>
                  <SSIS:Property SSIS:Name="Required">1</SSIS:Property>
                  <SSIS:Property SSIS:Name="Sensitive">0</SSIS:Property>
                  <SSIS:Property SSIS:Name="Value">dw01</SSIS:Property>
                </SSIS:Properties>
              </SSIS:Parameter>
              <SSIS:Parameter SSIS:Name="ApiSecret">
                <SSIS:Properties>
                  <SSIS:Property SSIS:Name="DataType">18</SSIS:Property>
                  <SSIS:Property SSIS:Name="Sensitive">1</SSIS:Property>
                  <SSIS:Property SSIS:Name="Value">AQAAANCMnd8</SSIS:Property>
                </SSIS:Properties>
              </SSIS:Parameter>
            </SSIS:Parameters>
            """;

    @Test
    void readsProjectScopedParameters() throws Exception {
        Diagnostics diag = new Diagnostics("Project.params");
        List<IrParameter> params = new ProjectParametersReader()
                .read("Project.params", PARAMS.getBytes(StandardCharsets.UTF_8), ExtractOptions.defaults(), diag);

        assertEquals(2, params.size());
        IrParameter server = params.get(0);
        assertEquals(IrParameter.PROJECT_NAMESPACE, server.namespace);
        assertEquals("$Project::ServerName", server.scopedName);
        assertEquals("dw01", server.value.literal);
        assertTrue(server.required);
        assertFalse(server.sensitive);

        IrParameter secret = params.get(1);
        assertTrue(secret.sensitive);
        assertTrue(secret.value.redactedValue());
        assertEquals(DiagnosticCode.REDACTED_VALUE, diag.toDeterministicList().get(0).code);
    }

    @Test
    void malformedDocumentRaises() {
        byte[] bad = "<SSIS:Parameters".getBytes(StandardCharsets.UTF_8);
        assertThrows(MalformedDocumentException.class,
                () -> new ProjectParametersReader().read("Project.params", bad, ExtractOptions.defaults(), new Diagnostics("x")));
    }
}
