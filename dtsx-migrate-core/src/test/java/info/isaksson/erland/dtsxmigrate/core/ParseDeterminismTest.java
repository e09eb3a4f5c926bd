package info.isaksson.erland.dtsxmigrate.core;

import info.isaksson.erland.dtsxmigrate.io.PackageSource;
import info.isaksson.erland.dtsxmigrate.ir.IrJson;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParseDeterminismTest {

    @Test
    void samePackageGivesByteIdenticalIr() throws Exception {
        MigrationService service = new MigrationService();
        for (String name : List.of("TransformSales.dtsx", "UploadFiles.dtsx", "CycleA.dtsx")) {
            PackageSource source = new PackageSource(name, CoreFixtures.load(name));
            PackageResult first = service.migratePackage(source, new MigrationOptions());
            PackageResult second = service.migratePackage(source, new MigrationOptions());
            assertTrue(first.ok(), name);
            assertEquals(IrJson.toJsonString(first.ir), IrJson.toJsonString(second.ir), name);
            assertEquals(IrJson.valueToJsonString(first.diagnostics), IrJson.valueToJsonString(second.diagnostics), name);
        }
    }

    @Test
    void projectResultDoesNotDependOnParallelism() throws Exception {
        List<PackageSource> sources = List.of(
                new PackageSource("UploadFiles.dtsx", CoreFixtures.load("UploadFiles.dtsx")),
                new PackageSource("TransformSales.dtsx", CoreFixtures.load("TransformSales.dtsx")));
        MigrationOptions serial = new MigrationOptions();
        serial.parallelism = 1;
        MigrationOptions parallel = new MigrationOptions();
        parallel.parallelism = 4;

        MigrationService service = new MigrationService();
        ProjectResult a = service.migrateProject(ProjectRequest.of(sources), serial);
        ProjectResult b = service.migrateProject(ProjectRequest.of(sources), parallel);
        assertEquals(IrJson.valueToJsonString(a), IrJson.valueToJsonString(b));
    }
}
