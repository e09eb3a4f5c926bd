package info.isaksson.erland.dtsxmigrate.extract;

import info.isaksson.erland.dtsxmigrate.ir.IrExecutableKind;

import java.util.Locale;
import java.util.Set;

/**
 * Maps the object-type tags of executables to IR kinds.
 *
 * <p>Accepts short tags ({@code Microsoft.ExecuteSQLTask}), legacy stock monikers
 * ({@code STOCK:SEQUENCE}), versioned ProgIDs ({@code SSIS.Pipeline.3}) and assembly-qualified type
 * names.</p>
 */
public final class ExecutableTypes {

    /** Short names of tasks that move data in or out of the warehouse boundary. */
    public static final Set<String> IO_TASKS = Set.of(
            "filesystemtask", "ftptask", "bulkinserttask", "webservicetask", "sendmailtask");

    /** Short names of recognized task types that have no dedicated IR variant. */
    public static final Set<String> KNOWN_UNSUPPORTED = Set.of(
            "filesystemtask", "ftptask", "sendmailtask", "bulkinserttask", "webservicetask", "forloop");

    private ExecutableTypes() {}

    /**
     * Lower-case short name of a type tag: the assembly qualification, a trailing version number and
     * any namespace prefix are removed.
     */
    public static String shortName(String typeTag) {
        if (typeTag == null) return "";
        String t = typeTag.trim();
        int comma = t.indexOf(',');
        if (comma >= 0) t = t.substring(0, comma).trim();
        int colon = t.lastIndexOf(':');
        if (colon >= 0) t = t.substring(colon + 1);
        String[] parts = t.split("\\.");
        int last = parts.length - 1;
        while (last > 0 && parts[last].chars().allMatch(Character::isDigit)) last--;
        return parts.length == 0 ? "" : parts[last].toLowerCase(Locale.ROOT);
    }

    /** The IR kind for a tag; {@link IrExecutableKind#UNKNOWN} when not one of the supported kinds. */
    public static IrExecutableKind kindOf(String typeTag) {
        // the data flow task is hosted as Microsoft.SqlServer.Dts.Pipeline.Wrapper.TaskHost in older files
        if (typeTag != null && typeTag.toLowerCase(Locale.ROOT).contains("dts.pipeline")) return IrExecutableKind.DATA_FLOW;
        switch (shortName(typeTag)) {
            case "executesqltask":
            case "sqltask":
                return IrExecutableKind.EXECUTE_SQL;
            case "pipeline":
            case "dataflowtask":
            case "pipelinetask":
                return IrExecutableKind.DATA_FLOW;
            case "scripttask":
                return IrExecutableKind.SCRIPT;
            case "sequence":
                return IrExecutableKind.SEQUENCE_CONTAINER;
            case "foreachloop":
                return IrExecutableKind.FOR_EACH_LOOP;
            case "executepackagetask":
                return IrExecutableKind.EXECUTE_PACKAGE;
            default:
                return IrExecutableKind.UNKNOWN;
        }
    }

    public static boolean ioTask(String typeTag) {
        return IO_TASKS.contains(shortName(typeTag));
    }
}
