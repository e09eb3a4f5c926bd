package info.isaksson.erland.dtsxmigrate.mapping;

import info.isaksson.erland.dtsxmigrate.ir.IrExecutable;
import info.isaksson.erland.dtsxmigrate.ir.IrPackage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Identifier rules shared by the mappers: lower-case ASCII words joined by underscores, path
 * segments joined by a double underscore.
 */
public final class MappingNames {

    private MappingNames() {}

    public static String slug(String raw) {
        if (raw == null) return "x";
        StringBuilder sb = new StringBuilder();
        boolean underscore = false;
        for (char c : raw.toLowerCase(Locale.ROOT).toCharArray()) {
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                sb.append(c);
                underscore = false;
            } else if (!underscore && sb.length() > 0) {
                sb.append('_');
                underscore = true;
            }
        }
        int end = sb.length();
        while (end > 0 && sb.charAt(end - 1) == '_') end--;
        return end == 0 ? "x" : sb.substring(0, end);
    }

    public static String join(String... parts) {
        List<String> slugs = new ArrayList<>();
        for (String p : parts) slugs.add(slug(p));
        return String.join("__", slugs);
    }

    /** {@code base}, or {@code base_2}, {@code base_3}, ... when already taken; the result is added to {@code used}. */
    public static String unique(String base, Set<String> used) {
        String candidate = base;
        int n = 2;
        while (!used.add(candidate)) {
            candidate = base + "_" + n++;
        }
        return candidate;
    }

    /** Names of the executable and its containers, outermost first. */
    public static List<String> namePath(IrPackage pkg, IrExecutable exe) {
        List<String> names = new ArrayList<>();
        IrExecutable cur = exe;
        int guard = pkg.executables.size();
        while (cur != null && guard-- >= 0) {
            names.add(cur.name);
            cur = cur.parentId == null ? null : pkg.executable(cur.parentId).orElse(null);
        }
        Collections.reverse(names);
        return names;
    }

    /** Slug of {@link #namePath}, segments joined by a double underscore. */
    public static String executablePath(IrPackage pkg, IrExecutable exe) {
        return join(namePath(pkg, exe).toArray(new String[0]));
    }
}
