package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** Low-confidence placeholder that keeps the original type tag of an unsupported executable. */
@JsonPropertyOrder({"kind","id","name","typeTag","parentId","description","disabled","reason","childIds"})
public final class IrUnknownExecutable extends IrExecutable {
    public final IrUnknownReason reason;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> childIds;

    @JsonCreator
    public IrUnknownExecutable(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("typeTag") String typeTag,
            @JsonProperty("parentId") String parentId,
            @JsonProperty("description") String description,
            @JsonProperty("disabled") boolean disabled,
            @JsonProperty("reason") IrUnknownReason reason,
            @JsonProperty("childIds") List<String> childIds
    ) {
        super(IrExecutableKind.UNKNOWN, id, name, typeTag, parentId, description, disabled);
        this.reason = reason == null ? IrUnknownReason.UNRECOGNIZED_TYPE : reason;
        this.childIds = childIds == null ? List.of() : List.copyOf(childIds);
    }

    @Override
    public List<String> children() {
        return childIds;
    }
}
