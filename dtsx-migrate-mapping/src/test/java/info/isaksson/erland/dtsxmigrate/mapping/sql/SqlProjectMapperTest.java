package info.isaksson.erland.dtsxmigrate.mapping.sql;

import info.isaksson.erland.dtsxmigrate.ir.IrExecutable;
import info.isaksson.erland.dtsxmigrate.ir.IrExecuteSql;
import info.isaksson.erland.dtsxmigrate.ir.IrPackage;
import info.isaksson.erland.dtsxmigrate.ir.IrPropertyValue;
import info.isaksson.erland.dtsxmigrate.ir.IrSqlDialect;
import info.isaksson.erland.dtsxmigrate.ir.IrStrategy;
import info.isaksson.erland.dtsxmigrate.mapping.SqlProjectMappingInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static info.isaksson.erland.dtsxmigrate.ir.IrPackageClassKind.INGESTION;
import static info.isaksson.erland.dtsxmigrate.ir.IrPackageClassKind.TRANSFORM;
import static info.isaksson.erland.dtsxmigrate.mapping.IrFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class SqlProjectMapperTest {

    private SqlProjectMappingInput input;

    @BeforeEach
    void setUp() {
        IrExecuteSql dynamic = new IrExecuteSql("Package\\Dynamic", "Dynamic", "Microsoft.ExecuteSQLTask", null, null, false,
                IrPropertyValue.ofLiteral("").withExpression("\"SELECT * FROM \" + @[User::Table]", List.of()),
                "Variable", WAREHOUSE, IrSqlDialect.TSQL, null);
        IrPackage sales = pkg("Sales", List.<IrExecutable>of(
                sql("Package\\Build Summary", "Build Summary", null, "SELECT TOP 5 * FROM dbo.Orders"),
                dynamic,
                salesFlow("Package\\Load"),
                sql("Package\\Purge", "Purge", null, "DELETE FROM dbo.Orders WHERE Created < GETDATE()")
        ), List.of());
        input = SqlProjectMappingInput.of(List.of(sales), decision(IrStrategy.DBT_ONLY, "Sales", TRANSFORM));
    }

    @Test
    void modelsAreGeneratedPerLayerInExecutableOrder() {
        SqlProject project = new SqlProjectMapper().generate(input);

        assertEquals(List.of(
                "sql_sales__build_summary",
                "sql_sales__dynamic",
                "stg_sales__orders",
                "int_sales__load_orders__1",
                "int_sales__load_orders__2",
                "mart_sales__high_value",
                "mart_sales__other_orders",
                "sql_sales__purge"), project.models.stream().map(m -> m.name).toList());
        assertEquals(TargetDialect.SNOWFLAKE, project.dialect);
    }

    @Test
    void executeSqlMaterializationDependsOnStatementKind() {
        SqlProject project = new SqlProjectMapper().generate(input);

        SqlModel summary = project.model("sql_sales__build_summary").orElseThrow();
        assertEquals(Materialization.TABLE, summary.materialization);
        assertEquals("SELECT * FROM dbo.Orders\nLIMIT 5", summary.sql);
        assertEquals(List.of("TOP n->LIMIT n"), summary.appliedRewrites);

        SqlModel purge = project.model("sql_sales__purge").orElseThrow();
        assertEquals(Materialization.OPERATION, purge.materialization);
        assertEquals("DELETE FROM dbo.Orders WHERE Created < CURRENT_TIMESTAMP()", purge.sql);

        SqlModel dynamic = project.model("sql_sales__dynamic").orElseThrow();
        assertEquals(Materialization.OPERATION, dynamic.materialization);
        assertTrue(dynamic.sql.startsWith("-- statement is built at run time"));
        assertTrue(dynamic.sql.contains("@[User::Table]"));
    }

    @Test
    void stagingReadsDeclaredSource() {
        SqlProject project = new SqlProjectMapper().generate(input);

        assertEquals(List.of(new SqlSource("warehouse", "dbo.Orders", "Sales")), project.sources);
        SqlModel staging = project.model("stg_sales__orders").orElseThrow();
        assertEquals(ModelLayer.STAGING, staging.layer);
        assertEquals(Materialization.VIEW, staging.materialization);
        assertEquals("select * from {{ source('warehouse', 'dbo.Orders') }}", staging.sql);
    }

    @Test
    void intermediateModelFollowsTheChain() {
        SqlProject project = new SqlProjectMapper().generate(input);

        SqlModel high = project.model("int_sales__load_orders__1").orElseThrow();
        assertEquals(Materialization.TABLE, high.materialization);
        assertEquals(List.of("stg_sales__orders"), high.dependsOn);
        assertTrue(high.sql.startsWith("-- Load Orders: Orders -> Add Audit -> Customer Lookup -> Route -> High Value\n"));
        assertTrue(high.sql.contains("select *, CURRENT_TIMESTAMP() as LoadDate"));
        assertTrue(high.sql.contains("inner join dbo.Customers as lkp using (CustomerId)"));
        assertTrue(high.sql.contains("where Amount > 1000 AND IsActive = 1"));
        assertTrue(high.sql.endsWith("select * from step_3"));
        assertTrue(high.appliedRewrites.contains("GETDATE()->CURRENT_TIMESTAMP()"));

        SqlModel other = project.model("int_sales__load_orders__2").orElseThrow();
        assertTrue(other.sql.contains("where not (Amount > 1000 AND IsActive = 1)"));
    }

    @Test
    void martsFollowWriteMode() {
        SqlProject project = new SqlProjectMapper().generate(input);

        SqlModel high = project.model("mart_sales__high_value").orElseThrow();
        assertEquals(Materialization.INCREMENTAL, high.materialization);
        assertEquals("dbo.HighValueOrders", high.targetTable);
        assertEquals(List.of("int_sales__load_orders__1"), high.dependsOn);
        assertEquals("select * from {{ ref('int_sales__load_orders__1') }}", high.sql);

        SqlModel other = project.model("mart_sales__other_orders").orElseThrow();
        assertEquals(Materialization.TABLE, other.materialization);
        assertEquals(2, project.modelsIn(ModelLayer.MART).size());
    }

    @Test
    void lookupJoinKeysGetNotNullTests() {
        SqlProject project = new SqlProjectMapper().generate(input);

        assertEquals(List.of(
                new SqlTest("int_sales__load_orders__1", "CustomerId", SqlTest.NOT_NULL),
                new SqlTest("int_sales__load_orders__2", "CustomerId", SqlTest.NOT_NULL)), project.tests);
    }

    @Test
    void rewritingCanBeDisabled() {
        SqlProject project = new SqlProjectMapper(false, TargetDialect.SNOWFLAKE).generate(input);

        SqlModel summary = project.model("sql_sales__build_summary").orElseThrow();
        assertEquals("SELECT TOP 5 * FROM dbo.Orders", summary.sql);
        assertTrue(summary.appliedRewrites.isEmpty());
    }

    @Test
    void querySourceIsStagedFromItsQuery() {
        IrPackage p = pkg("Q", List.<IrExecutable>of(dataFlow("Package\\DF", "DF",
                List.of(querySource("1", "Recent", "SELECT * FROM [dbo].[Orders] WHERE Created > GETDATE() - 1")),
                List.of())), List.of());

        SqlProject project = new SqlProjectMapper().generate(
                SqlProjectMappingInput.of(List.of(p), decision(IrStrategy.DBT_ONLY, "Q", TRANSFORM)));

        assertTrue(project.sources.isEmpty());
        assertEquals("SELECT * FROM dbo.Orders WHERE Created > CURRENT_TIMESTAMP() - 1", project.model("stg_q__recent").orElseThrow().sql);
    }

    @Test
    void ingestionOnlyProjectYieldsEmptySqlProject() {
        SqlProjectMappingInput ingest = SqlProjectMappingInput.of(List.of(input.packages.get(0).pkg),
                decision(IrStrategy.AIRFLOW_ONLY, "Sales", INGESTION));

        SqlProject project = new SqlProjectMapper().generate(ingest);

        assertTrue(project.isEmpty());
        assertTrue(project.sources.isEmpty());
    }
}
