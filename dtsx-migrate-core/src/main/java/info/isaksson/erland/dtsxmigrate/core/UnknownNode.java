package info.isaksson.erland.dtsxmigrate.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** An Unknown executable or component, for reporting. {@link #componentId} is null for executables. */
@JsonPropertyOrder({"packageName","executableId","componentId","typeTag","reason"})
public final class UnknownNode {
    public final String packageName;
    public final String executableId;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String componentId;

    public final String typeTag;
    public final String reason;

    UnknownNode(String packageName, String executableId, String componentId, String typeTag, String reason) {
        this.packageName = packageName;
        this.executableId = executableId;
        this.componentId = componentId;
        this.typeTag = typeTag;
        this.reason = reason;
    }

    @Override
    public String toString() {
        return packageName + ":" + executableId + (componentId == null ? "" : "/" + componentId) + " (" + typeTag + ")";
    }
}
