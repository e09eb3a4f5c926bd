package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A Foreach loop container.
 *
 * <p>{@link #enumeratorType} is the enumerator's creation name (file, item, ADO, ...);
 * {@link #variableMappings} lists the variables assigned per iteration in value-index order.</p>
 */
@JsonPropertyOrder({"kind","id","name","typeTag","parentId","description","disabled","enumeratorType","enumeratorProperties","variableMappings","childIds"})
public final class IrForEachLoop extends IrExecutable {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String enumeratorType;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final Map<String, IrPropertyValue> enumeratorProperties;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> variableMappings;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> childIds;

    @JsonCreator
    public IrForEachLoop(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("typeTag") String typeTag,
            @JsonProperty("parentId") String parentId,
            @JsonProperty("description") String description,
            @JsonProperty("disabled") boolean disabled,
            @JsonProperty("enumeratorType") String enumeratorType,
            @JsonProperty("enumeratorProperties") Map<String, IrPropertyValue> enumeratorProperties,
            @JsonProperty("variableMappings") List<String> variableMappings,
            @JsonProperty("childIds") List<String> childIds
    ) {
        super(IrExecutableKind.FOR_EACH_LOOP, id, name, typeTag, parentId, description, disabled);
        this.enumeratorType = enumeratorType;
        this.enumeratorProperties = enumeratorProperties == null || enumeratorProperties.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(enumeratorProperties));
        this.variableMappings = variableMappings == null ? List.of() : List.copyOf(variableMappings);
        this.childIds = childIds == null ? List.of() : List.copyOf(childIds);
    }

    @Override
    public List<String> children() {
        return childIds;
    }
}
