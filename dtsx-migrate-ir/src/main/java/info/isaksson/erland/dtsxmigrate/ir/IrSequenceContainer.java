package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"kind","id","name","typeTag","parentId","description","disabled","childIds"})
public final class IrSequenceContainer extends IrExecutable {
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> childIds;

    @JsonCreator
    public IrSequenceContainer(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("typeTag") String typeTag,
            @JsonProperty("parentId") String parentId,
            @JsonProperty("description") String description,
            @JsonProperty("disabled") boolean disabled,
            @JsonProperty("childIds") List<String> childIds
    ) {
        super(IrExecutableKind.SEQUENCE_CONTAINER, id, name, typeTag, parentId, description, disabled);
        this.childIds = childIds == null ? List.of() : List.copyOf(childIds);
    }

    @Override
    public List<String> children() {
        return childIds;
    }
}
