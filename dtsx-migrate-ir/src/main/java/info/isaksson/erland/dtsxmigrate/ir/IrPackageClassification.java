package info.isaksson.erland.dtsxmigrate.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** Classification of one package together with the signals that produced it. */
@JsonPropertyOrder({"packageName","kind","ingestionSignals","transformSignals"})
public final class IrPackageClassification {
    public final String packageName;
    public final IrPackageClassKind kind;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> ingestionSignals;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> transformSignals;

    @JsonCreator
    public IrPackageClassification(
            @JsonProperty("packageName") String packageName,
            @JsonProperty("kind") IrPackageClassKind kind,
            @JsonProperty("ingestionSignals") List<String> ingestionSignals,
            @JsonProperty("transformSignals") List<String> transformSignals
    ) {
        this.packageName = Objects.requireNonNull(packageName, "packageName");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.ingestionSignals = ingestionSignals == null ? List.of() : List.copyOf(ingestionSignals);
        this.transformSignals = transformSignals == null ? List.of() : List.copyOf(transformSignals);
    }
}
