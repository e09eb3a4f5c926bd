package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Root of the per-package IR.
 *
 * <p>Instances are immutable. {@link IrNormalizer} defines the canonical ordering; two parses of the
 * same document produce packages whose {@link IrJson#toJsonString(IrPackage)} output is identical.</p>
 */
@JsonPropertyOrder({"schemaVersion","name","sourceName","protectionLevel","creatorName","creationDate","versionBuild","versionComments",
        "variables","parameters","connectionManagers","executables","precedenceEdges","expressions"})
public final class IrPackage {
    public static final String SCHEMA_VERSION = "1.0";

    public final String schemaVersion;
    public final String name;
    public final String sourceName;
    public final IrProtectionLevel protectionLevel;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String creatorName;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String creationDate;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String versionBuild;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String versionComments;

    public final List<IrVariable> variables;
    public final List<IrParameter> parameters;
    public final List<IrConnectionManager> connectionManagers;
    public final List<IrExecutable> executables;
    public final List<IrPrecedenceEdge> precedenceEdges;
    public final List<IrExpression> expressions;

    @JsonCreator
    public IrPackage(
            @JsonProperty("schemaVersion") String schemaVersion,
            @JsonProperty("name") String name,
            @JsonProperty("sourceName") String sourceName,
            @JsonProperty("protectionLevel") IrProtectionLevel protectionLevel,
            @JsonProperty("creatorName") String creatorName,
            @JsonProperty("creationDate") String creationDate,
            @JsonProperty("versionBuild") String versionBuild,
            @JsonProperty("versionComments") String versionComments,
            @JsonProperty("variables") List<IrVariable> variables,
            @JsonProperty("parameters") List<IrParameter> parameters,
            @JsonProperty("connectionManagers") List<IrConnectionManager> connectionManagers,
            @JsonProperty("executables") List<IrExecutable> executables,
            @JsonProperty("precedenceEdges") List<IrPrecedenceEdge> precedenceEdges,
            @JsonProperty("expressions") List<IrExpression> expressions
    ) {
        this.schemaVersion = schemaVersion == null ? SCHEMA_VERSION : schemaVersion;
        this.name = Objects.requireNonNull(name, "name");
        this.sourceName = sourceName == null ? name : sourceName;
        this.protectionLevel = protectionLevel == null ? IrProtectionLevel.DONT_SAVE_SENSITIVE : protectionLevel;
        this.creatorName = creatorName;
        this.creationDate = creationDate;
        this.versionBuild = versionBuild;
        this.versionComments = versionComments;
        this.variables = variables == null ? List.of() : List.copyOf(variables);
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.connectionManagers = connectionManagers == null ? List.of() : List.copyOf(connectionManagers);
        this.executables = executables == null ? List.of() : List.copyOf(executables);
        this.precedenceEdges = precedenceEdges == null ? List.of() : List.copyOf(precedenceEdges);
        this.expressions = expressions == null ? List.of() : List.copyOf(expressions);
    }

    /** Same package under another name; everything else, {@link #sourceName} included, is kept. */
    public IrPackage withName(String newName) {
        return new IrPackage(schemaVersion, newName, sourceName, protectionLevel, creatorName, creationDate,
                versionBuild, versionComments, variables, parameters, connectionManagers, executables,
                precedenceEdges, expressions);
    }

    public Optional<IrExecutable> executable(String id) {
        for (IrExecutable e : executables) {
            if (e.id.equals(id)) return Optional.of(e);
        }
        return Optional.empty();
    }

    /** Resolve a connection reference by refId, DTSID or name. */
    public Optional<IrConnectionManager> connection(String ref) {
        for (IrConnectionManager cm : connectionManagers) {
            if (cm.matches(ref)) return Optional.of(cm);
        }
        return Optional.empty();
    }

    public <T extends IrExecutable> List<T> executablesOf(Class<T> type) {
        return executables.stream().filter(type::isInstance).map(type::cast).toList();
    }
}
