package info.isaksson.erland.dtsxmigrate.strategy;

import info.isaksson.erland.dtsxmigrate.ir.IrEndpointBinding;
import info.isaksson.erland.dtsxmigrate.ir.IrPackageClassKind;
import info.isaksson.erland.dtsxmigrate.ir.IrPackageClassification;
import info.isaksson.erland.dtsxmigrate.ir.IrScriptIoIntent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static info.isaksson.erland.dtsxmigrate.core.CoreFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class PackageClassifierTest {

    private final PackageClassifier classifier = new PackageClassifier();

    @Test
    void executeSqlOnlyIsTransform() {
        IrPackageClassification c = classifier.classify(pkg("Sql", sql("a"), sql("b")));
        assertEquals(IrPackageClassKind.TRANSFORM, c.kind);
        assertEquals(List.of("execute_sql:a", "execute_sql:b"), c.transformSignals);
        assertTrue(c.ingestionSignals.isEmpty());
    }

    @Test
    void emptyAndStructuralPackagesAreTransform() {
        assertEquals(IrPackageClassKind.TRANSFORM, classifier.classify(pkg("Empty")).kind);
        assertEquals(IrPackageClassKind.TRANSFORM, classifier.classify(pkg("Caller", call("run", "Other"))).kind);
    }

    @Test
    void fileReadingDataFlowIsIngestionThroughEndpointAndConnection() {
        IrPackageClassification c = classifier.classify(pkg("Files", flow("df", IrEndpointBinding.FILE, true)));
        assertEquals(IrPackageClassKind.INGESTION, c.kind);
        assertEquals(List.of("endpoint:df/src:file", "connection:Files:file"), c.ingestionSignals);
    }

    @Test
    void unusedFileConnectionIsNoSignal() {
        IrPackageClassification c = classifier.classify(pkg("Dw", flow("df", IrEndpointBinding.WAREHOUSE, false)));
        assertEquals(IrPackageClassKind.TRANSFORM, c.kind);
        assertEquals(List.of("warehouse_data_flow:df"), c.transformSignals);
    }

    @Test
    void scriptWithIoPlusSqlIsMixed() {
        IrPackageClassification c = classifier.classify(pkg("Both", script("upload", IrScriptIoIntent.EXTERNAL_IO), sql("merge")));
        assertEquals(IrPackageClassKind.MIXED, c.kind);
        assertEquals(List.of("script_io:upload"), c.ingestionSignals);
    }

    @Test
    void orchestrationOnlyWorkCountsOnIngestionSide() {
        assertEquals(IrPackageClassKind.INGESTION,
                classifier.classify(pkg("Quiet", script("calc", IrScriptIoIntent.NONE))).kind);
        IrPackageClassification c = classifier.classify(pkg("Tasks",
                unknown("ftp", "Microsoft.FtpTask"), unknown("cdc", "Attunity.CdcControlTask")));
        assertEquals(IrPackageClassKind.INGESTION, c.kind);
        assertEquals(List.of("io_task:ftp:ftptask", "unknown:cdc:cdccontroltask"), c.ingestionSignals);
    }

    @Test
    void unknownBoundEndpointIsIngestionSide() {
        IrPackageClassification c = classifier.classify(pkg("Odd", flow("df", IrEndpointBinding.UNKNOWN, false), sql("a")));
        assertEquals(IrPackageClassKind.MIXED, c.kind);
        assertEquals(List.of("endpoint:df/src:unknown"), c.ingestionSignals);
    }
}
