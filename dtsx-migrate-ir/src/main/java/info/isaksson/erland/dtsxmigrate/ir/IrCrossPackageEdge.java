package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A caller package invoking a callee package through an Execute Package task. */
@JsonPropertyOrder({"callerPackage","callerExecutableId","calleePackage"})
public final class IrCrossPackageEdge {
    public final String callerPackage;
    public final String callerExecutableId;
    public final String calleePackage;

    @JsonCreator
    public IrCrossPackageEdge(
            @JsonProperty("callerPackage") String callerPackage,
            @JsonProperty("callerExecutableId") String callerExecutableId,
            @JsonProperty("calleePackage") String calleePackage
    ) {
        this.callerPackage = Objects.requireNonNull(callerPackage, "callerPackage");
        this.callerExecutableId = Objects.requireNonNull(callerExecutableId, "callerExecutableId");
        this.calleePackage = Objects.requireNonNull(calleePackage, "calleePackage");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrCrossPackageEdge)) return false;
        IrCrossPackageEdge that = (IrCrossPackageEdge) o;
        return callerPackage.equals(that.callerPackage)
                && callerExecutableId.equals(that.callerExecutableId)
                && calleePackage.equals(that.calleePackage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(callerPackage, callerExecutableId, calleePackage);
    }

    @Override
    public String toString() {
        return callerPackage + "[" + callerExecutableId + "] -> " + calleePackage;
    }
}
