package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"namespace","name","scopedName","dataType","readOnly","value"})
public final class IrVariable {
    public final String namespace;
    public final String name;
    public final String scopedName;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String dataType;

    public final boolean readOnly;
    public final IrPropertyValue value;

    @JsonCreator
    public IrVariable(
            @JsonProperty("namespace") String namespace,
            @JsonProperty("name") String name,
            @JsonProperty("scopedName") String scopedName,
            @JsonProperty("dataType") String dataType,
            @JsonProperty("readOnly") boolean readOnly,
            @JsonProperty("value") IrPropertyValue value
    ) {
        this.namespace = namespace == null || namespace.isBlank() ? "User" : namespace;
        this.name = Objects.requireNonNull(name, "name");
        this.scopedName = scopedName == null ? this.namespace + "::" + name : scopedName;
        this.dataType = dataType;
        this.readOnly = readOnly;
        this.value = value == null ? IrPropertyValue.ofLiteral(null) : value;
    }
}
