package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Objects;

/**
 * A control-flow node of a package.
 *
 * <p>The set of variants is closed: every executable is exactly one of the subclasses listed in
 * {@link IrExecutableKind}, and anything not recognized is an {@link IrUnknownExecutable}.
 * Consumers switch over {@link #kind}.</p>
 *
 * <p>Executables are stored flat on the package; nesting is expressed through {@link #parentId}
 * and the {@code childIds} of container variants.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = IrExecuteSql.class, name = "EXECUTE_SQL"),
        @JsonSubTypes.Type(value = IrDataFlow.class, name = "DATA_FLOW"),
        @JsonSubTypes.Type(value = IrScript.class, name = "SCRIPT"),
        @JsonSubTypes.Type(value = IrSequenceContainer.class, name = "SEQUENCE_CONTAINER"),
        @JsonSubTypes.Type(value = IrForEachLoop.class, name = "FOR_EACH_LOOP"),
        @JsonSubTypes.Type(value = IrExecutePackage.class, name = "EXECUTE_PACKAGE"),
        @JsonSubTypes.Type(value = IrUnknownExecutable.class, name = "UNKNOWN")
})
public abstract class IrExecutable {
    public final IrExecutableKind kind;
    public final String id;
    public final String name;

    /** The object-type tag as written in the package (e.g. {@code Microsoft.ExecuteSQLTask}). */
    public final String typeTag;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String parentId;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final String description;

    public final boolean disabled;

    IrExecutable(IrExecutableKind kind, String id, String name, String typeTag, String parentId, String description, boolean disabled) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.id = Objects.requireNonNull(id, "id");
        this.name = name == null ? id : name;
        this.typeTag = typeTag == null ? "" : typeTag;
        this.parentId = parentId;
        this.description = description;
        this.disabled = disabled;
    }

    /** Ids of directly nested executables; empty for non-containers. */
    public List<String> children() {
        return List.of();
    }
}
