package info.isaksson.erland.dtsxmigrate.mapping.sql;

import java.util.regex.Pattern;

/** Text-level helpers for statements and expressions carried over from packages. */
final class SqlStatements {

    private static final Pattern QUERY = Pattern.compile("(?is)^\\s*(\\(\\s*)*(SELECT|WITH)\\b.*");
    private static final Pattern LINE_COMMENT = Pattern.compile("(?m)--[^\\r\\n]*");
    private static final Pattern BLOCK_COMMENT = Pattern.compile("(?s)/\\*.*?\\*/");

    private SqlStatements() {}

    /** True when the statement, leading comments ignored, is a SELECT or a WITH query. */
    static boolean isQuery(String sql) {
        if (sql == null) return false;
        String stripped = LINE_COMMENT.matcher(BLOCK_COMMENT.matcher(sql).replaceAll(" ")).replaceAll(" ");
        return QUERY.matcher(stripped).matches();
    }

    /** {@code [dbo].[Fact Sales]} becomes {@code dbo.Fact Sales}; quotes are dropped as well. */
    static String tableName(String raw) {
        if (raw == null) return null;
        String t = raw.replace("[", "").replace("]", "").replace("\"", "").replace("`", "").trim();
        return t.isEmpty() ? null : t;
    }

    /** Maps the comparison and boolean operators of a package expression to their SQL spelling. */
    static String expression(String ssis) {
        if (ssis == null) return "";
        return ssis.replace("==", "=").replace("&&", " AND ").replace("||", " OR ")
                .replaceAll("\\s{2,}", " ").trim();
    }

    static String indent(String sql) {
        return "    " + sql.replace("\n", "\n    ");
    }
}
