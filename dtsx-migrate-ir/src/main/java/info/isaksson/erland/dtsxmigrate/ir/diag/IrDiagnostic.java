package info.isaksson.erland.dtsxmigrate.ir.diag;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A structured warning or error, tagged with the package/executable/component it concerns. */
@JsonIgnoreProperties(value = {"kind"}, allowGetters = true)
@JsonPropertyOrder({"code","kind","severity","packageName","executableId","componentId","message","context"})
public final class IrDiagnostic {

    /** Code stable across versions. */
    public final DiagnosticCode code;

    public final DiagnosticKind kind;
    public final DiagnosticSeverity severity;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String packageName;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String executableId;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String componentId;

    /** Human-readable message. */
    public final String message;

    /** Optional structured context (stable keys recommended). */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final Map<String, String> context;

    @JsonCreator
    public IrDiagnostic(
            @JsonProperty("code") DiagnosticCode code,
            @JsonProperty("severity") DiagnosticSeverity severity,
            @JsonProperty("packageName") String packageName,
            @JsonProperty("executableId") String executableId,
            @JsonProperty("componentId") String componentId,
            @JsonProperty("message") String message,
            @JsonProperty("context") Map<String, String> context
    ) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.kind = code.kind;
        this.severity = severity == null ? code.defaultSeverity : severity;
        this.packageName = packageName;
        this.executableId = executableId;
        this.componentId = componentId;
        this.message = Objects.requireNonNull(message, "message must not be null");
        if (context == null || context.isEmpty()) {
            this.context = Collections.emptyMap();
        } else {
            this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        }
    }

    public boolean error() {
        return severity == DiagnosticSeverity.ERROR;
    }

    /** Same diagnostic attributed to another package (used when merging per-package channels). */
    public IrDiagnostic inPackage(String pkg) {
        return new IrDiagnostic(code, severity, pkg, executableId, componentId, message, context);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity).append(' ').append(code);
        if (packageName != null) sb.append(" [").append(packageName);
        if (packageName != null && executableId != null) sb.append(" / ").append(executableId);
        if (packageName != null && componentId != null) sb.append(" / ").append(componentId);
        if (packageName != null) sb.append(']');
        return sb.append(": ").append(message).toString();
    }
}
