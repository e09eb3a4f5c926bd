package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A property expression declared on the package, an executable, a connection manager or a variable.
 *
 * <p>{@link #ownerId} is the package name, executable id, connection manager id or variable scoped
 * name depending on {@link #scope}.</p>
 */
@JsonPropertyOrder({"scope","ownerId","property","text","references"})
public final class IrExpression {
    public final IrExpressionScope scope;
    public final String ownerId;
    public final String property;
    public final String text;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<IrReference> references;

    @JsonCreator
    public IrExpression(
            @JsonProperty("scope") IrExpressionScope scope,
            @JsonProperty("ownerId") String ownerId,
            @JsonProperty("property") String property,
            @JsonProperty("text") String text,
            @JsonProperty("references") List<IrReference> references
    ) {
        this.scope = scope == null ? IrExpressionScope.PACKAGE : scope;
        this.ownerId = ownerId == null ? "" : ownerId;
        this.property = Objects.requireNonNull(property, "property");
        this.text = text == null ? "" : text;
        this.references = references == null ? List.of() : List.copyOf(references);
    }
}
