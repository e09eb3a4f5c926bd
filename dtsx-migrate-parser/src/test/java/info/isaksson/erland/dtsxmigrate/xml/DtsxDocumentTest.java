package info.isaksson.erland.dtsxmigrate.xml;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DtsxDocumentTest {

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void rejectsDocumentThatIsNotWellFormed() {
        MalformedDocumentException e = assertThrows(MalformedDocumentException.class,
                () -> DtsxDocument.parse("broken.dtsx", bytes("<DTS:Executable xmlns:DTS=\"www.microsoft.com/SqlServer/Dts\"><DTS:Executables>")));
        assertEquals("broken.dtsx", e.sourceName());
    }

    @Test
    void rejectsEmptyInput() {
        assertThrows(MalformedDocumentException.class, () -> DtsxDocument.parse("empty.dtsx", new byte[0]));
    }

    @Test
    void rejectsDoctypeDeclarations() {
        String xxe = """
                <?xml version="1.0"?>
                <!DOCTYPE foo [ <!ENTITY xxe SYSTEM "file:///etc/passwd"> ]>
                <DTS:Executable xmlns:DTS="www.microsoft.com/SqlServer/Dts" DTS:ObjectName="&xxe;"/>
                """;
        assertThrows(MalformedDocumentException.class, () -> DtsxDocument.parse("xxe.dtsx", bytes(xxe)));
    }

    @Test
    void resolvesQualifiedNamesAndFallsBackToPropertyChildren() throws Exception {
        String xml = """
                <DTS:Executable xmlns:DTS="www.microsoft.com/SqlServer/Dts" DTS:ObjectName="Modern">
                  <DTS:Property DTS:Name="CreatorName">someone</DTS:Property>
                  <DTS:Executables>
                    <DTS:Executable DTS:refId="Package\\A"/>
                    <DTS:Executable DTS:refId="Package\\B"/>
                  </DTS:Executables>
                </DTS:Executable>
                """;
        DtsxElement root = DtsxDocument.parse("m.dtsx", bytes(xml)).root();

        assertTrue(root.is("DTS:Executable"));
        assertEquals("Modern", root.attrOrProperty("ObjectName"));
        assertEquals("someone", root.attrOrProperty("CreatorName"));
        assertNull(root.attrOrProperty("VersionBuild"));

        List<DtsxElement> children = root.child("DTS:Executables").orElseThrow().children("DTS:Executable");
        assertEquals(2, children.size());
        assertEquals("Package\\B", children.get(1).attr("DTS:refId"));
        assertEquals(2, root.descendants("DTS:Executable").size());
    }

    @Test
    void namespaceUrisCompareCaseInsensitively() throws Exception {
        String xml = """
                <DTS:Executable xmlns:DTS="www.microsoft.com/sqlserver/dts">
                  <DTS:Variables/>
                </DTS:Executable>
                """;
        DtsxElement root = DtsxDocument.parse("lower.dtsx", bytes(xml)).root();
        assertTrue(root.is("DTS:Executable"));
        assertTrue(root.child("DTS:Variables").isPresent());
    }

    @Test
    void unknownNamespacesAreWalkableByLocalName() throws Exception {
        String xml = """
                <DTS:Executable xmlns:DTS="www.microsoft.com/SqlServer/Dts" xmlns:x="urn:vendor:custom">
                  <DTS:ObjectData><x:CustomTaskData x:Setting="42"/></DTS:ObjectData>
                </DTS:Executable>
                """;
        DtsxElement root = DtsxDocument.parse("custom.dtsx", bytes(xml)).root();
        DtsxElement data = root.descendants("CustomTaskData").get(0);
        assertEquals("42", data.attr("Setting"));
        assertEquals("urn:vendor:custom", data.namespaceUri());
    }
}
