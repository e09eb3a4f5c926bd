package info.isaksson.erland.dtsxmigrate.extract;

import info.isaksson.erland.dtsxmigrate.ir.IrComponentKind;
import info.isaksson.erland.dtsxmigrate.ir.IrConnectionKind;
import info.isaksson.erland.dtsxmigrate.ir.IrEndpointBinding;
import info.isaksson.erland.dtsxmigrate.ir.IrExecutableKind;
import info.isaksson.erland.dtsxmigrate.ir.IrSqlDialect;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TypeTablesTest {

    @Test
    void executableTagsInAllSpellings() {
        assertEquals(IrExecutableKind.EXECUTE_SQL, ExecutableTypes.kindOf("Microsoft.ExecuteSQLTask"));
        assertEquals(IrExecutableKind.EXECUTE_SQL, ExecutableTypes.kindOf("SSIS.ExecuteSQLTask.3"));
        assertEquals(IrExecutableKind.DATA_FLOW, ExecutableTypes.kindOf("SSIS.Pipeline.3"));
        assertEquals(IrExecutableKind.DATA_FLOW,
                ExecutableTypes.kindOf("Microsoft.SqlServer.Dts.Pipeline.Wrapper.TaskHost, Microsoft.SqlServer.DTSPipelineWrap"));
        assertEquals(IrExecutableKind.SEQUENCE_CONTAINER, ExecutableTypes.kindOf("STOCK:SEQUENCE"));
        assertEquals(IrExecutableKind.FOR_EACH_LOOP, ExecutableTypes.kindOf("STOCK:FOREACHLOOP"));
        assertEquals(IrExecutableKind.EXECUTE_PACKAGE, ExecutableTypes.kindOf("Microsoft.ExecutePackageTask"));
        assertEquals(IrExecutableKind.UNKNOWN, ExecutableTypes.kindOf("STOCK:FORLOOP"));
        assertEquals(IrExecutableKind.UNKNOWN, ExecutableTypes.kindOf(null));
        assertTrue(ExecutableTypes.ioTask("Microsoft.FtpTask"));
        assertFalse(ExecutableTypes.ioTask("Microsoft.ScriptTask"));
    }

    @Test
    void componentClassesAndBindings() {
        ComponentClasses.ComponentClass src = ComponentClasses.classify("Microsoft.OLEDBSource", Map.of());
        assertEquals(IrComponentKind.SOURCE, src.kind);
        assertEquals(IrEndpointBinding.WAREHOUSE, src.binding);

        assertEquals(IrEndpointBinding.FILE, ComponentClasses.classify("Microsoft.ExcelSource", Map.of()).binding);
        assertEquals(IrComponentKind.DESTINATION, ComponentClasses.classify("Microsoft.SnowflakeDestination", Map.of()).kind);
        assertEquals(IrComponentKind.LOOKUP, ComponentClasses.classify("DTSTransform.Lookup.3", Map.of()).kind);

        ComponentClasses.ComponentClass managed = ComponentClasses.classify("Microsoft.ManagedComponentHost",
                Map.of("UserComponentTypeName", "Microsoft.ADONETDestinationAdapter, Version=1"));
        assertEquals(IrComponentKind.DESTINATION, managed.kind);

        assertEquals(IrComponentKind.UNKNOWN, ComponentClasses.classify("Microsoft.FuzzyLookup", Map.of()).kind);
    }

    @Test
    void connectionKinds() {
        assertEquals(IrConnectionKind.RELATIONAL, ConnectionManagerExtractor.kindOf("OLEDB"));
        assertEquals(IrConnectionKind.RELATIONAL, ConnectionManagerExtractor.kindOf("ADO.NET:System.Data.SqlClient.SqlConnection"));
        assertEquals(IrConnectionKind.FILE, ConnectionManagerExtractor.kindOf("FLATFILE"));
        assertEquals(IrConnectionKind.HTTP, ConnectionManagerExtractor.kindOf("HTTP"));
        assertEquals(IrConnectionKind.UNKNOWN, ConnectionManagerExtractor.kindOf("SMTP"));
    }

    @Test
    void sqlHeuristics() {
        assertEquals(IrSqlDialect.TSQL, SqlHeuristics.dialect("SELECT TOP 10 * FROM t"));
        assertEquals(IrSqlDialect.TSQL, SqlHeuristics.dialect("SELECT [Name] FROM dbo.t"));
        assertEquals(IrSqlDialect.ANSI, SqlHeuristics.dialect("SELECT name FROM t WHERE id = @[User::Id]"));
        assertTrue(SqlHeuristics.hardcodedCredential("EXEC sp_connect 'Server=x;Password=y'"));
    }
}
