package info.isaksson.erland.dtsxmigrate.mapping.sql;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/** Output of {@link SqlProjectMapper}. */
@JsonPropertyOrder({"dialect","sources","models","tests"})
public final class SqlProject {
    public final TargetDialect dialect;
    public final List<SqlSource> sources;
    public final List<SqlModel> models;
    public final List<SqlTest> tests;

    public SqlProject(TargetDialect dialect, List<SqlSource> sources, List<SqlModel> models, List<SqlTest> tests) {
        this.dialect = dialect;
        this.sources = List.copyOf(sources);
        this.models = List.copyOf(models);
        this.tests = List.copyOf(tests);
    }

    public Optional<SqlModel> model(String name) {
        return models.stream().filter(m -> m.name.equals(name)).findFirst();
    }

    public List<SqlModel> modelsIn(ModelLayer layer) {
        return models.stream().filter(m -> m.layer == layer).collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return models.isEmpty();
    }
}
