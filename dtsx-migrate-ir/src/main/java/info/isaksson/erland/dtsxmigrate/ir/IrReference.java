package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A variable or parameter referenced from an expression, e.g. {@code @[User::BatchID]}. */
@JsonPropertyOrder({"kind","scopedName","resolved"})
public final class IrReference {
    public final IrReferenceKind kind;
    public final String scopedName;
    public final boolean resolved;

    @JsonCreator
    public IrReference(
            @JsonProperty("kind") IrReferenceKind kind,
            @JsonProperty("scopedName") String scopedName,
            @JsonProperty("resolved") boolean resolved
    ) {
        this.kind = kind == null ? IrReferenceKind.VARIABLE : kind;
        this.scopedName = Objects.requireNonNull(scopedName, "scopedName");
        this.resolved = resolved;
    }

    public IrReference asResolved() {
        return resolved ? this : new IrReference(kind, scopedName, true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrReference)) return false;
        IrReference that = (IrReference) o;
        return resolved == that.resolved && kind == that.kind && scopedName.equals(that.scopedName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, scopedName, resolved);
    }

    @Override
    public String toString() {
        return "@[" + scopedName + "]";
    }
}
