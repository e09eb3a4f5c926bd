package info.isaksson.erland.dtsxmigrate.mapping.sql;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A warehouse table read by a Source component, grouped under the slugged connection name. */
@JsonPropertyOrder({"sourceName","table","packageName"})
public final class SqlSource {
    public final String sourceName;
    public final String table;
    public final String packageName;

    public SqlSource(String sourceName, String table, String packageName) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.table = Objects.requireNonNull(table, "table");
        this.packageName = Objects.requireNonNull(packageName, "packageName");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SqlSource)) return false;
        SqlSource that = (SqlSource) o;
        return sourceName.equals(that.sourceName) && table.equals(that.table) && packageName.equals(that.packageName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceName, table, packageName);
    }

    @Override
    public String toString() {
        return sourceName + "." + table;
    }
}
