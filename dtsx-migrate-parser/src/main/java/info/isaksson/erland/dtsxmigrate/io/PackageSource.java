package info.isaksson.erland.dtsxmigrate.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** A package document as handed to the pipeline: its source name and raw bytes. */
public final class PackageSource {
    public final String name;
    private final byte[] content;

    public PackageSource(String name, byte[] content) {
        this.name = Objects.requireNonNull(name, "name");
        this.content = Objects.requireNonNull(content, "content").clone();
    }

    public static PackageSource of(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return new PackageSource(file.getFileName().toString(), Files.readAllBytes(file));
    }

    /** A copy of the document bytes. */
    public byte[] content() {
        return content.clone();
    }

    @Override
    public String toString() {
        return "PackageSource{" + name + ", " + content.length + " bytes}";
    }
}
