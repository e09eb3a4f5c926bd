package info.isaksson.erland.dtsxmigrate.extract;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/** Loads package documents from {@code src/test/resources/dtsx}. */
final class DtsxFixtures {
    private DtsxFixtures() {}

    static byte[] load(String name) {
        try (InputStream in = DtsxFixtures.class.getResourceAsStream("/dtsx/" + name)) {
            if (in == null) throw new IllegalArgumentException("No fixture " + name);
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static ExtractedPackage extract(String name) throws Exception {
        return new DtsxExtractor().extract(name, load(name), ExtractOptions.defaults());
    }
}
