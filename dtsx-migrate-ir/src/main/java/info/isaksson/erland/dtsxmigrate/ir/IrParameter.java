package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A package parameter ({@code $Package::Name}) or project parameter ({@code $Project::Name}).
 *
 * <p>Sensitive parameter values follow the same redaction rule as connection manager properties.</p>
 */
@JsonPropertyOrder({"namespace","name","scopedName","dataType","sensitive","required","value"})
public final class IrParameter {
    public static final String PACKAGE_NAMESPACE = "$Package";
    public static final String PROJECT_NAMESPACE = "$Project";

    public final String namespace;
    public final String name;
    public final String scopedName;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String dataType;

    public final boolean sensitive;
    public final boolean required;
    public final IrPropertyValue value;

    @JsonCreator
    public IrParameter(
            @JsonProperty("namespace") String namespace,
            @JsonProperty("name") String name,
            @JsonProperty("scopedName") String scopedName,
            @JsonProperty("dataType") String dataType,
            @JsonProperty("sensitive") boolean sensitive,
            @JsonProperty("required") boolean required,
            @JsonProperty("value") IrPropertyValue value
    ) {
        this.namespace = namespace == null || namespace.isBlank() ? PACKAGE_NAMESPACE : namespace;
        this.name = Objects.requireNonNull(name, "name");
        this.scopedName = scopedName == null ? this.namespace + "::" + name : scopedName;
        this.dataType = dataType;
        this.sensitive = sensitive;
        this.required = required;
        this.value = value == null ? IrPropertyValue.ofLiteral(null) : value;
    }
}
