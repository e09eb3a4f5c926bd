package info.isaksson.erland.dtsxmigrate.mapping;

import info.isaksson.erland.dtsxmigrate.ir.IrComponent;
import info.isaksson.erland.dtsxmigrate.ir.IrDataFlow;
import info.isaksson.erland.dtsxmigrate.ir.IrEndpointBinding;
import info.isaksson.erland.dtsxmigrate.ir.IrExecutable;
import info.isaksson.erland.dtsxmigrate.ir.IrPackage;
import info.isaksson.erland.dtsxmigrate.ir.IrScriptIoIntent;
import info.isaksson.erland.dtsxmigrate.ir.IrStrategy;
import info.isaksson.erland.dtsxmigrate.ir.IrWriteMode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static info.isaksson.erland.dtsxmigrate.ir.IrPackageClassKind.*;
import static info.isaksson.erland.dtsxmigrate.mapping.IrFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class SqlProjectMappingInputTest {

    private static IrPackage mixedPackage(String name) {
        IrDataFlow fileFlow = dataFlow("Package\\Export", "Export", List.<IrComponent>of(
                source("1", "Orders", "dbo.Orders", IrEndpointBinding.WAREHOUSE),
                destination("2", "Csv", null, IrWriteMode.INSERT, IrEndpointBinding.FILE)
        ), List.of(path("p", "1", "2")));
        return pkg(name, List.<IrExecutable>of(
                sql("Package\\Truncate", "Truncate", null, "TRUNCATE TABLE stg.Orders"),
                salesFlow("Package\\Load"),
                fileFlow,
                script("Package\\Upload", "Upload", IrScriptIoIntent.EXTERNAL_IO)
        ), List.of());
    }

    @Test
    void transformPackageContributesEveryExecutable() {
        IrPackage p = mixedPackage("Sales");

        SqlProjectMappingInput input = SqlProjectMappingInput.of(List.of(p), decision(IrStrategy.DBT_ONLY, "Sales", TRANSFORM));

        SqlProjectMappingInput.PackageSlice slice = input.packages.get(0);
        assertEquals(4, slice.executables.size());
        assertEquals(2, slice.chainsOf("Package\\Load").size());
        assertEquals(1, slice.chainsOf("Package\\Export").size());
    }

    @Test
    void mixedPackageKeepsSqlTasksAndWarehouseBoundFlowsOnly() {
        IrPackage p = mixedPackage("Sales");

        SqlProjectMappingInput input = SqlProjectMappingInput.of(List.of(p), decision(IrStrategy.MIXED, "Sales", MIXED));

        SqlProjectMappingInput.PackageSlice slice = input.packages.get(0);
        assertEquals(MIXED, slice.classification);
        assertEquals(List.of("Package\\Truncate", "Package\\Load"), slice.executables.stream().map(e -> e.id).toList());
        assertEquals(List.of("Package\\Load"), List.copyOf(slice.chains.keySet()));
    }

    @Test
    void ingestionPackageContributesNothingAndUnclassifiedPackagesAreLeftOut() {
        SqlProjectMappingInput input = SqlProjectMappingInput.of(
                List.of(mixedPackage("Zeta"), mixedPackage("Alpha"), mixedPackage("Failed")),
                decision(IrStrategy.MIXED, "Zeta", INGESTION, "Alpha", TRANSFORM));

        assertEquals(List.of("Alpha", "Zeta"), input.packages.stream().map(s -> s.packageName).toList());
        assertTrue(input.packages.get(1).executables.isEmpty());
        assertTrue(input.packages.get(1).chains.isEmpty());
    }
}
