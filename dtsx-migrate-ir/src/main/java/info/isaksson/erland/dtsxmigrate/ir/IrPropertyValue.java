package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A property value as declared in a package: an optional literal plus an optional expression override.
 *
 * <p>Both are retained. The literal is the design-time fallback; the expression is the dynamic
 * override which may only be resolvable at run time. {@link #references} lists the variables and
 * parameters the expression touches.</p>
 */
@JsonPropertyOrder({"literal","expression","references"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class IrPropertyValue {

    /** Placeholder used for sensitive values that were not decrypted. */
    public static final String REDACTION_MARKER = "[REDACTED]";

    public final String literal;
    public final String expression;
    public final List<IrReference> references;

    @JsonCreator
    public IrPropertyValue(
            @JsonProperty("literal") String literal,
            @JsonProperty("expression") String expression,
            @JsonProperty("references") List<IrReference> references
    ) {
        this.literal = literal;
        this.expression = expression == null || expression.isBlank() ? null : expression;
        this.references = references == null ? List.of() : List.copyOf(references);
    }

    public static IrPropertyValue ofLiteral(String literal) {
        return new IrPropertyValue(literal, null, null);
    }

    public static IrPropertyValue redacted() {
        return new IrPropertyValue(REDACTION_MARKER, null, null);
    }

    public IrPropertyValue withExpression(String expression, List<IrReference> references) {
        return new IrPropertyValue(literal, expression, references);
    }

    public boolean hasExpression() {
        return expression != null;
    }

    public boolean redactedValue() {
        return REDACTION_MARKER.equals(literal);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrPropertyValue)) return false;
        IrPropertyValue that = (IrPropertyValue) o;
        return Objects.equals(literal, that.literal)
                && Objects.equals(expression, that.expression)
                && Objects.equals(references, that.references);
    }

    @Override
    public int hashCode() {
        return Objects.hash(literal, expression, references);
    }

    @Override
    public String toString() {
        return hasExpression() ? literal + " <- " + expression : String.valueOf(literal);
    }
}
