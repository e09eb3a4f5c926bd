package info.isaksson.erland.dtsxmigrate.io;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Deterministic discovery of {@code .dtsx} files under a project folder, with exclude rules.
 *
 * <p>The scanner returns a stable list sorted by relative path.</p>
 */
public final class PackageScanner {

    /** Name of the project-parameter document of an SSIS project. */
    public static final String PROJECT_PARAMS = "Project.params";

    private PackageScanner() {}

    /**
     * Scan for package files under {@code projectRoot}.
     *
     * @param projectRoot  root folder to scan
     * @param excludeGlobs glob patterns matched against the path relative to projectRoot, using '/' separators
     */
    public static List<Path> scan(Path projectRoot, List<String> excludeGlobs) throws IOException {
        Objects.requireNonNull(projectRoot, "projectRoot");

        final List<Predicate<Path>> excludeMatchers = compileExcludeMatchers(excludeGlobs);

        try (Stream<Path> stream = Files.walk(projectRoot)) {
            List<Path> out = new ArrayList<>();
            stream
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".dtsx"))
                .filter(p -> !isInBuildDir(projectRoot, p))
                .filter(p -> !matchesAny(projectRoot, p, excludeMatchers))
                .forEach(out::add);

            out.sort(Comparator.comparing(p -> normalizeRel(projectRoot, p)));
            return out;
        }
    }

    /** Load every scanned package as a {@link PackageSource}, in scan order. */
    public static List<PackageSource> load(Path projectRoot, List<String> excludeGlobs) throws IOException {
        List<PackageSource> out = new ArrayList<>();
        for (Path p : scan(projectRoot, excludeGlobs)) {
            out.add(PackageSource.of(p));
        }
        return out;
    }

    /** The {@code Project.params} file directly under {@code projectRoot}, if present. */
    public static Path projectParams(Path projectRoot) {
        Path p = projectRoot.resolve(PROJECT_PARAMS);
        return Files.isRegularFile(p) ? p : null;
    }

    private static boolean matchesAny(Path root, Path absolutePath, List<Predicate<Path>> matchers) {
        if (matchers.isEmpty()) return false;
        final Path rel = root.relativize(absolutePath);
        for (Predicate<Path> m : matchers) {
            if (m.test(rel)) return true;
        }
        return false;
    }

    private static List<Predicate<Path>> compileExcludeMatchers(List<String> excludeGlobs) {
        if (excludeGlobs == null || excludeGlobs.isEmpty()) return Collections.emptyList();

        FileSystem fs = FileSystems.getDefault();
        List<Predicate<Path>> out = new ArrayList<>();
        for (String raw : excludeGlobs) {
            if (raw == null) continue;
            String pattern = raw.trim();
            if (pattern.isEmpty()) continue;

            pattern = pattern.replace("\\", "/");

            // A plain directory name excludes everything under it.
            if (!pattern.contains("*") && !pattern.contains("?") && !pattern.contains("[") && !pattern.endsWith("/")
                    && !pattern.toLowerCase(Locale.ROOT).endsWith(".dtsx")) {
                pattern = pattern + "/**";
            }

            final var matcher = fs.getPathMatcher("glob:" + pattern);
            out.add(p -> matcher.matches(Path.of(normalizePathString(p))));
        }
        return out;
    }

    private static boolean isInBuildDir(Path root, Path absolutePath) {
        String rel = "/" + normalizeRel(root, absolutePath);
        return rel.contains("/bin/")
                || rel.contains("/obj/")
                || rel.contains("/target/")
                || rel.contains("/.git/")
                || rel.contains("/.vs/");
    }

    private static String normalizeRel(Path root, Path p) {
        return normalizePathString(root.relativize(p));
    }

    private static String normalizePathString(Path p) {
        return p.toString().replace("\\", "/");
    }
}
