package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A connection manager declared by a package.
 *
 * <p>When {@link #sensitive} is set, at least one property carried a sensitive value. Such values hold
 * {@link IrPropertyValue#REDACTION_MARKER} unless they were decrypted with an explicit credential.</p>
 */
@JsonPropertyOrder({"id","dtsId","name","kind","rawType","sensitive","properties"})
public final class IrConnectionManager {
    public final String id;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String dtsId;

    public final String name;
    public final IrConnectionKind kind;
    public final String rawType;
    public final boolean sensitive;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final Map<String, IrPropertyValue> properties;

    @JsonCreator
    public IrConnectionManager(
            @JsonProperty("id") String id,
            @JsonProperty("dtsId") String dtsId,
            @JsonProperty("name") String name,
            @JsonProperty("kind") IrConnectionKind kind,
            @JsonProperty("rawType") String rawType,
            @JsonProperty("sensitive") boolean sensitive,
            @JsonProperty("properties") Map<String, IrPropertyValue> properties
    ) {
        this.id = Objects.requireNonNull(id, "id");
        this.dtsId = dtsId;
        this.name = name == null ? id : name;
        this.kind = kind == null ? IrConnectionKind.UNKNOWN : kind;
        this.rawType = rawType == null ? "" : rawType;
        this.sensitive = sensitive;
        this.properties = properties == null || properties.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(properties));
    }

    /** True when {@code ref} names this connection by refId, DTSID or object name. */
    public boolean matches(String ref) {
        if (ref == null || ref.isBlank()) return false;
        String r = ref.trim();
        return r.equals(id) || r.equalsIgnoreCase(dtsId) || r.equals(name)
                || r.equals("Package.ConnectionManagers[" + name + "]");
    }
}
