package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"kind","id","name","typeTag","parentId","description","disabled","language","projectName","readOnlyVariables","readWriteVariables","ioIntent","ioEvidence"})
public final class IrScript extends IrExecutable {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String language;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String projectName;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> readOnlyVariables;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> readWriteVariables;

    public final IrScriptIoIntent ioIntent;

    /** Markers that led to {@link #ioIntent}, e.g. {@code System.IO.File}. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> ioEvidence;

    @JsonCreator
    public IrScript(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("typeTag") String typeTag,
            @JsonProperty("parentId") String parentId,
            @JsonProperty("description") String description,
            @JsonProperty("disabled") boolean disabled,
            @JsonProperty("language") String language,
            @JsonProperty("projectName") String projectName,
            @JsonProperty("readOnlyVariables") List<String> readOnlyVariables,
            @JsonProperty("readWriteVariables") List<String> readWriteVariables,
            @JsonProperty("ioIntent") IrScriptIoIntent ioIntent,
            @JsonProperty("ioEvidence") List<String> ioEvidence
    ) {
        super(IrExecutableKind.SCRIPT, id, name, typeTag, parentId, description, disabled);
        this.language = language;
        this.projectName = projectName;
        this.readOnlyVariables = readOnlyVariables == null ? List.of() : List.copyOf(readOnlyVariables);
        this.readWriteVariables = readWriteVariables == null ? List.of() : List.copyOf(readWriteVariables);
        this.ioIntent = ioIntent == null ? IrScriptIoIntent.UNKNOWN : ioIntent;
        this.ioEvidence = ioEvidence == null ? List.of() : List.copyOf(ioEvidence);
    }
}
