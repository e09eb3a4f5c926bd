package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"kind","id","name","typeTag","parentId","description","disabled","sql","sqlSourceType","connectionRef","dialect","parameterBindings"})
public final class IrExecuteSql extends IrExecutable {

    /** SQL text; the literal is the statement, the expression a {@code SqlStatementSource} override. */
    public final IrPropertyValue sql;

    /** {@code DirectInput}, {@code FileConnection} or {@code Variable}. */
    public final String sqlSourceType;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String connectionRef;

    public final IrSqlDialect dialect;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<IrParameterBinding> parameterBindings;

    @JsonCreator
    public IrExecuteSql(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("typeTag") String typeTag,
            @JsonProperty("parentId") String parentId,
            @JsonProperty("description") String description,
            @JsonProperty("disabled") boolean disabled,
            @JsonProperty("sql") IrPropertyValue sql,
            @JsonProperty("sqlSourceType") String sqlSourceType,
            @JsonProperty("connectionRef") String connectionRef,
            @JsonProperty("dialect") IrSqlDialect dialect,
            @JsonProperty("parameterBindings") List<IrParameterBinding> parameterBindings
    ) {
        super(IrExecutableKind.EXECUTE_SQL, id, name, typeTag, parentId, description, disabled);
        this.sql = sql == null ? IrPropertyValue.ofLiteral("") : sql;
        this.sqlSourceType = sqlSourceType == null || sqlSourceType.isBlank() ? "DirectInput" : sqlSourceType;
        this.connectionRef = connectionRef;
        this.dialect = dialect == null ? IrSqlDialect.ANSI : dialect;
        this.parameterBindings = parameterBindings == null ? List.of() : List.copyOf(parameterBindings);
    }

    /** The literal statement text, never null. */
    public String statement() {
        return sql.literal == null ? "" : sql.literal;
    }
}
