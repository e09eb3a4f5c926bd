package info.isaksson.erland.dtsxmigrate.core;

import info.isaksson.erland.dtsxmigrate.io.PackageScanner;
import info.isaksson.erland.dtsxmigrate.io.PackageSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** The packages of one project, plus its {@code Project.params} document when there is one. */
public final class ProjectRequest {
    public final List<PackageSource> packages;

    /** Raw {@code Project.params} bytes, or null. */
    public final byte[] projectParams;

    public ProjectRequest(List<PackageSource> packages, byte[] projectParams) {
        if (packages == null) throw new IllegalArgumentException("packages must not be null");
        this.packages = List.copyOf(packages);
        this.projectParams = projectParams == null ? null : projectParams.clone();
    }

    public static ProjectRequest of(List<PackageSource> packages) {
        return new ProjectRequest(packages, null);
    }

    /** Loads every {@code .dtsx} file under {@code root} and the root's {@code Project.params}, if present. */
    public static ProjectRequest fromDirectory(Path root, List<String> excludeGlobs) throws IOException {
        if (root == null) throw new IllegalArgumentException("root must not be null");
        List<PackageSource> packages = PackageScanner.load(root, excludeGlobs == null ? List.of() : excludeGlobs);
        Path params = PackageScanner.projectParams(root);
        return new ProjectRequest(packages, params == null ? null : Files.readAllBytes(params));
    }
}
