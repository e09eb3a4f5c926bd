package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Invocation of another package.
 *
 * <p>{@link #packageReference} is the callee's bare name (directories and the {@code .dtsx}
 * extension stripped); {@link #rawReference} keeps the value as written.</p>
 */
@JsonPropertyOrder({"kind","id","name","typeTag","parentId","description","disabled","packageReference","rawReference","useProjectReference"})
public final class IrExecutePackage extends IrExecutable {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String packageReference;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String rawReference;

    public final boolean useProjectReference;

    @JsonCreator
    public IrExecutePackage(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("typeTag") String typeTag,
            @JsonProperty("parentId") String parentId,
            @JsonProperty("description") String description,
            @JsonProperty("disabled") boolean disabled,
            @JsonProperty("packageReference") String packageReference,
            @JsonProperty("rawReference") String rawReference,
            @JsonProperty("useProjectReference") boolean useProjectReference
    ) {
        super(IrExecutableKind.EXECUTE_PACKAGE, id, name, typeTag, parentId, description, disabled);
        this.packageReference = packageReference;
        this.rawReference = rawReference;
        this.useProjectReference = useProjectReference;
    }
}
