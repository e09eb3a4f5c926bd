package info.isaksson.erland.dtsxmigrate.mapping.sql;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SqlDialectRewriterTest {

    private final SqlDialectRewriter snowflake = new SqlDialectRewriter(TargetDialect.SNOWFLAKE);

    @Test
    void rewritesFunctionsTopAndBracketIdentifiers() {
        SqlDialectRewriter.Result r = snowflake.rewrite(
                "SELECT TOP 10 [Order Id], ISNULL(Amount, 0) AS Amount, LEN(Name) FROM [dbo].[Orders] WHERE Created < GETDATE();");

        assertEquals("SELECT \"Order Id\", COALESCE(Amount, 0) AS Amount, LENGTH(Name) FROM dbo.Orders WHERE Created < CURRENT_TIMESTAMP()\nLIMIT 10;",
                r.sql);
        assertEquals(List.of("TOP n->LIMIT n", "[x]->x", "GETDATE()->CURRENT_TIMESTAMP()", "ISNULL->COALESCE", "LEN->LENGTH"),
                r.appliedRules);
        assertTrue(r.changed());
    }

    @Test
    void renamesTempTablesAndSnowflakeFunctions() {
        SqlDialectRewriter.Result r = snowflake.rewrite(
                "SELECT * INTO #Staging FROM dbo.Orders; SELECT NEWID(), CEILING(x) FROM #Staging WHERE y = @Id");

        assertEquals("SELECT * INTO temp_Staging FROM dbo.Orders; SELECT UUID_STRING(), CEIL(x) FROM temp_Staging WHERE y = @Id", r.sql);
        assertEquals(List.of("#tmp->temp_tmp", "CEILING->CEIL", "NEWID()->UUID_STRING()"), r.appliedRules);
    }

    @Test
    void plainAnsiSqlIsLeftAlone() {
        SqlDialectRewriter.Result r = snowflake.rewrite("select id, amount from dbo.orders where id = @Id");

        assertEquals("select id, amount from dbo.orders where id = @Id", r.sql);
        assertFalse(r.changed());
        assertEquals("", snowflake.rewrite(null).sql);
    }

    @Test
    void nestedTopIsNotRewritten() {
        String sql = "SELECT TOP 5 a FROM (SELECT TOP 10 a FROM t ORDER BY a) x";

        SqlDialectRewriter.Result r = snowflake.rewrite(sql);

        assertEquals(sql, r.sql);
        assertTrue(r.appliedRules.isEmpty());
    }

    @Test
    void existingLimitIsKept() {
        SqlDialectRewriter.Result r = snowflake.rewrite("SELECT DISTINCT TOP 3 a FROM t LIMIT 3");

        assertEquals("SELECT DISTINCT a FROM t LIMIT 3", r.sql);
    }

    @Test
    void ddlRewrites() {
        SqlDialectRewriter.Result r = snowflake.rewrite(
                "IF EXISTS (SELECT 1 FROM sys.tables WHERE name = 'Audit') DROP TABLE dbo.Audit; CREATE TABLE dbo.Audit (Id INT IDENTITY(1,1))");

        assertEquals("DROP TABLE IF EXISTS dbo.Audit; CREATE TABLE dbo.Audit (Id INT AUTOINCREMENT)", r.sql);
        assertEquals(List.of("IF EXISTS DROP TABLE->DROP TABLE IF EXISTS", "IDENTITY->AUTOINCREMENT"), r.appliedRules);
    }

    @Test
    void ansiTargetSkipsSnowflakeOnlyRules() {
        SqlDialectRewriter ansi = new SqlDialectRewriter(TargetDialect.ANSI);

        SqlDialectRewriter.Result r = ansi.rewrite("SELECT TOP (3) NEWID(), GETDATE(), LEN(a) FROM t");

        assertEquals("SELECT NEWID(), CURRENT_TIMESTAMP, CHAR_LENGTH(a) FROM t\nFETCH FIRST 3 ROWS ONLY", r.sql);
        assertEquals(List.of("TOP n->FETCH FIRST n ROWS ONLY", "GETDATE()->CURRENT_TIMESTAMP", "LEN->LENGTH"), r.appliedRules);
    }
}
