package info.isaksson.erland.dtsxmigrate.project;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Packages that call each other in a loop, in call order, the first one not repeated. */
public final class ProjectCycle {
    public final List<String> packages;

    @JsonCreator
    public ProjectCycle(@JsonProperty("packages") List<String> packages) {
        if (packages == null || packages.isEmpty()) throw new IllegalArgumentException("a cycle needs at least one package");
        this.packages = List.copyOf(packages);
    }

    /** {@code A -> B -> C -> A}. */
    public String path() {
        return String.join(" -> ", packages) + " -> " + packages.get(0);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ProjectCycle && packages.equals(((ProjectCycle) o).packages);
    }

    @Override
    public int hashCode() {
        return packages.hashCode();
    }

    @Override
    public String toString() {
        return packages.toString();
    }
}
