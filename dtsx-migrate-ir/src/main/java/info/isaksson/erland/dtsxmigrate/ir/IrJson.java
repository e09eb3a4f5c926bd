package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import info.isaksson.erland.dtsxmigrate.ir.diag.Diagnostics;
import info.isaksson.erland.dtsxmigrate.ir.diag.IrDiagnostic;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * JSON form of the package IR and of the reports built around it.
 *
 * <p>Output is canonical: packages pass through {@link IrNormalizer}, diagnostic lists are sorted
 * by location and code, map keys are ordered, and every document ends with a newline. Reading
 * refuses IR written under a newer major schema than {@link IrPackage#SCHEMA_VERSION}.</p>
 */
public final class IrJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    private static final ObjectWriter WRITER = MAPPER.writer(prettyPrinter());

    private IrJson() {}

    public static IrPackage read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        return supported(MAPPER.readValue(path.toFile(), IrPackage.class), path.toString());
    }

    public static IrPackage readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return supported(MAPPER.readValue(json, IrPackage.class), "<string>");
    }

    public static void write(IrPackage pkg, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(path, toJsonString(pkg), StandardCharsets.UTF_8);
    }

    public static String toJsonString(IrPackage pkg) throws IOException {
        if (pkg == null) throw new IllegalArgumentException("pkg is null");
        return WRITER.writeValueAsString(IrNormalizer.normalize(pkg)) + "\n";
    }

    /**
     * Serializes a project graph, strategy decision, result or diagnostic list. A bare package is
     * normalized and a collection of diagnostics is sorted, so reports diff cleanly across runs.
     */
    public static String valueToJsonString(Object value) throws IOException {
        return WRITER.writeValueAsString(canonical(value)) + "\n";
    }

    public static <T> T readValue(String json, Class<T> type) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, type);
    }

    static Object canonical(Object value) {
        if (value instanceof IrPackage) return IrNormalizer.normalize((IrPackage) value);
        if (value instanceof Collection && !((Collection<?>) value).isEmpty()) {
            List<IrDiagnostic> diagnostics = new ArrayList<>();
            for (Object o : (Collection<?>) value) {
                if (!(o instanceof IrDiagnostic)) return value;
                diagnostics.add((IrDiagnostic) o);
            }
            return Diagnostics.sorted(diagnostics);
        }
        return value;
    }

    private static IrPackage supported(IrPackage pkg, String origin) throws IOException {
        int major = major(pkg.schemaVersion);
        if (major > major(IrPackage.SCHEMA_VERSION)) {
            throw new IOException(origin + ": IR schema " + pkg.schemaVersion
                    + " is newer than the supported " + IrPackage.SCHEMA_VERSION);
        }
        return pkg;
    }

    // Unparseable versions sort after every known one.
    static int major(String version) {
        int dot = version.indexOf('.');
        try {
            return Integer.parseInt(dot < 0 ? version : version.substring(0, dot));
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }

    private static DefaultPrettyPrinter prettyPrinter() {
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
