package info.isaksson.erland.dtsxmigrate.extract;

import info.isaksson.erland.dtsxmigrate.ir.IrComponentKind;
import info.isaksson.erland.dtsxmigrate.ir.IrEndpointBinding;

import java.util.Locale;
import java.util.Map;

/**
 * Recognizes data-flow component class ids.
 *
 * <p>Class ids are matched on their short name, so {@code Microsoft.OLEDBSource},
 * {@code DTSAdapter.OLEDBSource.3} and {@code OLEDBSource} are the same. Managed components
 * ({@code Microsoft.ManagedComponentHost}) are recognized through their {@code UserComponentTypeName}
 * property.</p>
 */
public final class ComponentClasses {

    /** Kind and default endpoint binding of a component class. */
    public static final class ComponentClass {
        public final IrComponentKind kind;
        public final IrEndpointBinding binding;

        ComponentClass(IrComponentKind kind, IrEndpointBinding binding) {
            this.kind = kind;
            this.binding = binding;
        }
    }

    private static final Map<String, ComponentClass> CLASSES = Map.ofEntries(
            Map.entry("oledbsource", source(IrEndpointBinding.WAREHOUSE)),
            Map.entry("adonetsource", source(IrEndpointBinding.WAREHOUSE)),
            Map.entry("datareadersource", source(IrEndpointBinding.WAREHOUSE)),
            Map.entry("odbcsource", source(IrEndpointBinding.WAREHOUSE)),
            Map.entry("snowflakesource", source(IrEndpointBinding.WAREHOUSE)),
            Map.entry("flatfilesource", source(IrEndpointBinding.FILE)),
            Map.entry("excelsource", source(IrEndpointBinding.FILE)),
            Map.entry("rawsource", source(IrEndpointBinding.FILE)),
            Map.entry("xmlsource", source(IrEndpointBinding.FILE)),
            Map.entry("odatasource", source(IrEndpointBinding.API)),
            Map.entry("webservicesource", source(IrEndpointBinding.API)),
            Map.entry("scriptsource", source(IrEndpointBinding.UNKNOWN)),

            Map.entry("oledbdestination", destination(IrEndpointBinding.WAREHOUSE)),
            Map.entry("adonetdestination", destination(IrEndpointBinding.WAREHOUSE)),
            Map.entry("odbcdestination", destination(IrEndpointBinding.WAREHOUSE)),
            Map.entry("sqlserverdestination", destination(IrEndpointBinding.WAREHOUSE)),
            Map.entry("snowflakedestination", destination(IrEndpointBinding.WAREHOUSE)),
            Map.entry("flatfiledestination", destination(IrEndpointBinding.FILE)),
            Map.entry("exceldestination", destination(IrEndpointBinding.FILE)),
            Map.entry("rawdestination", destination(IrEndpointBinding.FILE)),
            Map.entry("recordsetdestination", destination(IrEndpointBinding.UNKNOWN)),

            Map.entry("derivedcolumn", transform(IrComponentKind.DERIVED_COLUMN)),
            Map.entry("lookup", transform(IrComponentKind.LOOKUP)),
            Map.entry("conditionalsplit", transform(IrComponentKind.CONDITIONAL_SPLIT)),
            Map.entry("unionall", transform(IrComponentKind.UNION_ALL)),
            Map.entry("aggregate", transform(IrComponentKind.AGGREGATE)),
            Map.entry("sort", transform(IrComponentKind.SORT))
    );

    private static final ComponentClass UNKNOWN = new ComponentClass(IrComponentKind.UNKNOWN, IrEndpointBinding.UNKNOWN);

    private ComponentClasses() {}

    public static ComponentClass classify(String classId, Map<String, String> properties) {
        String key = shortName(classId);
        if ("managedcomponenthost".equals(key) && properties != null) {
            key = shortName(properties.get("UserComponentTypeName"));
        }
        ComponentClass c = CLASSES.get(key);
        if (c == null && key.endsWith("adapter")) {
            c = CLASSES.get(key.substring(0, key.length() - "adapter".length()));
        }
        return c == null ? UNKNOWN : c;
    }

    /** Lower-case class name without vendor prefix, version suffix or assembly qualification. */
    static String shortName(String classId) {
        if (classId == null) return "";
        String t = classId.trim();
        int comma = t.indexOf(',');
        if (comma >= 0) t = t.substring(0, comma).trim();
        String[] parts = t.split("\\.");
        int last = parts.length - 1;
        while (last > 0 && parts[last].chars().allMatch(Character::isDigit)) last--;
        return parts.length == 0 ? "" : parts[last].toLowerCase(Locale.ROOT);
    }

    private static ComponentClass source(IrEndpointBinding binding) {
        return new ComponentClass(IrComponentKind.SOURCE, binding);
    }

    private static ComponentClass destination(IrEndpointBinding binding) {
        return new ComponentClass(IrComponentKind.DESTINATION, binding);
    }

    private static ComponentClass transform(IrComponentKind kind) {
        return new ComponentClass(kind, IrEndpointBinding.UNKNOWN);
    }
}
