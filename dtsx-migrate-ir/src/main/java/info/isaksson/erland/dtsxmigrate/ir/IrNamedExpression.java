package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A named expression: a derived column, a split condition or an aggregation. */
@JsonPropertyOrder({"name","expression","friendlyExpression"})
public final class IrNamedExpression {
    public final String name;
    public final String expression;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String friendlyExpression;

    @JsonCreator
    public IrNamedExpression(
            @JsonProperty("name") String name,
            @JsonProperty("expression") String expression,
            @JsonProperty("friendlyExpression") String friendlyExpression
    ) {
        this.name = name == null ? "" : name;
        this.expression = expression == null ? "" : expression;
        this.friendlyExpression = friendlyExpression;
    }

    /** The expression as shown in the designer, falling back to the stored form. */
    public String displayExpression() {
        return friendlyExpression == null || friendlyExpression.isBlank() ? expression : friendlyExpression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrNamedExpression)) return false;
        IrNamedExpression that = (IrNamedExpression) o;
        return name.equals(that.name) && expression.equals(that.expression)
                && Objects.equals(friendlyExpression, that.friendlyExpression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, expression, friendlyExpression);
    }
}
