package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Binding of an Execute SQL statement parameter to a variable or parameter. */
@JsonPropertyOrder({"parameterName","variable","direction","dataType","resolved"})
public final class IrParameterBinding {
    public final String parameterName;
    public final String variable;
    public final String direction;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String dataType;

    public final boolean resolved;

    @JsonCreator
    public IrParameterBinding(
            @JsonProperty("parameterName") String parameterName,
            @JsonProperty("variable") String variable,
            @JsonProperty("direction") String direction,
            @JsonProperty("dataType") String dataType,
            @JsonProperty("resolved") boolean resolved
    ) {
        this.parameterName = parameterName == null ? "" : parameterName;
        this.variable = variable == null ? "" : variable;
        this.direction = direction == null || direction.isBlank() ? "Input" : direction;
        this.dataType = dataType;
        this.resolved = resolved;
    }
}
