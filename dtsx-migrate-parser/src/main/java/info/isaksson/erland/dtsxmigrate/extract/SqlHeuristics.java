package info.isaksson.erland.dtsxmigrate.extract;

import info.isaksson.erland.dtsxmigrate.ir.IrSqlDialect;

import java.util.Locale;
import java.util.regex.Pattern;

/** Lightweight text checks over SQL statements. No parsing. */
public final class SqlHeuristics {

    private static final Pattern BRACKET_IDENTIFIER = Pattern.compile("(?<!@)\\[[A-Za-z_#][^\\]\\r\\n]*\\]");
    private static final Pattern TOP_CLAUSE = Pattern.compile("(?i)\\bSELECT\\s+(DISTINCT\\s+)?TOP\\s*\\(?\\s*\\d+");
    private static final Pattern CREDENTIAL = Pattern.compile("(?i)\\b(password|pwd|user\\s+id)\\s*=");

    private SqlHeuristics() {}

    public static IrSqlDialect dialect(String sql) {
        if (sql == null || sql.isEmpty()) return IrSqlDialect.ANSI;
        String upper = sql.toUpperCase(Locale.ROOT);
        if (upper.contains("GETDATE(") || upper.contains("ISNULL(") || upper.contains("NEWID(")) return IrSqlDialect.TSQL;
        if (TOP_CLAUSE.matcher(sql).find() || BRACKET_IDENTIFIER.matcher(sql).find()) return IrSqlDialect.TSQL;
        return IrSqlDialect.ANSI;
    }

    public static boolean hardcodedCredential(String sql) {
        return sql != null && CREDENTIAL.matcher(sql).find();
    }
}
