package info.isaksson.erland.dtsxmigrate.mapping.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based T-SQL to warehouse dialect rewriting.
 *
 * <p>Rules are applied in a fixed order and operate on raw text: string literals and comments are
 * not excluded. Every rule that changed the text is recorded in {@link Result#appliedRules}.</p>
 */
public final class SqlDialectRewriter {

    public static final class Result {
        public final String sql;
        public final List<String> appliedRules;

        Result(String sql, List<String> appliedRules) {
            this.sql = sql;
            this.appliedRules = List.copyOf(appliedRules);
        }

        public boolean changed() {
            return !appliedRules.isEmpty();
        }
    }

    private static final Pattern TOP = Pattern.compile(
            "(?i)\\bSELECT(\\s+DISTINCT)?\\s+TOP\\s*\\(?\\s*(\\d+)\\s*\\)?\\s+");
    private static final Pattern LIMIT = Pattern.compile("(?i)\\b(LIMIT\\s+\\d+|FETCH\\s+FIRST)\\b");
    private static final Pattern WORD = Pattern.compile("\\w+");

    private final TargetDialect dialect;
    private final List<Rule> rules = new ArrayList<>();

    public SqlDialectRewriter(TargetDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        boolean snowflake = dialect == TargetDialect.SNOWFLAKE;
        String now = snowflake ? "CURRENT_TIMESTAMP()" : "CURRENT_TIMESTAMP";

        rules.add(new Rule("#tmp->temp_tmp", "(?<![\\w@#])##?(\\w+)", m -> "temp_" + m.group(1)));
        rules.add(new Rule("IF EXISTS DROP TABLE->DROP TABLE IF EXISTS",
                "(?is)\\bIF\\s+EXISTS\\s*\\([^)]*\\)\\s*DROP\\s+TABLE\\s+([\\w.\\[\\]]+)",
                m -> "DROP TABLE IF EXISTS " + m.group(1)));
        if (snowflake) {
            rules.add(new Rule("IDENTITY->AUTOINCREMENT", "(?i)\\bIDENTITY\\s*\\(\\s*\\d+\\s*,\\s*\\d+\\s*\\)", m -> "AUTOINCREMENT"));
        }
        rules.add(new Rule("[x]->x", "\\[([^\\]\\r\\n]+)\\]", m -> identifier(m.group(1))));
        rules.add(new Rule("GETDATE()->" + now, "(?i)\\b(GETDATE|GETUTCDATE|SYSDATETIME|SYSUTCDATETIME)\\s*\\(\\s*\\)", m -> now));
        rules.add(new Rule("ISNULL->COALESCE", "(?i)\\bISNULL\\s*\\(", m -> "COALESCE("));
        rules.add(new Rule("LEN->LENGTH", "(?i)\\bLEN\\s*\\(", m -> snowflake ? "LENGTH(" : "CHAR_LENGTH("));
        rules.add(new Rule("CEILING->CEIL", "(?i)\\bCEILING\\s*\\(", m -> "CEIL("));
        rules.add(new Rule("DATALENGTH->OCTET_LENGTH", "(?i)\\bDATALENGTH\\s*\\(", m -> "OCTET_LENGTH("));
        if (snowflake) {
            rules.add(new Rule("NEWID()->UUID_STRING()", "(?i)\\bNEWID\\s*\\(\\s*\\)", m -> "UUID_STRING()"));
            rules.add(new Rule("RAND()->RANDOM()", "(?i)\\bRAND\\s*\\(\\s*\\)", m -> "RANDOM()"));
        }
    }

    public TargetDialect dialect() {
        return dialect;
    }

    public Result rewrite(String sql) {
        if (sql == null || sql.isBlank()) return new Result(sql == null ? "" : sql, List.of());
        List<String> applied = new ArrayList<>();
        String out = rewriteTop(sql, applied);
        for (Rule rule : rules) {
            String next = rule.pattern.matcher(out).replaceAll(m -> Matcher.quoteReplacement(rule.replacement.apply(m)));
            if (!next.equals(out)) {
                applied.add(rule.name);
                out = next;
            }
        }
        return new Result(out, applied);
    }

    /** {@code TOP n} is rewritten only when the statement has exactly one. */
    private String rewriteTop(String sql, List<String> applied) {
        Matcher m = TOP.matcher(sql);
        if (!m.find()) return sql;
        int start = m.start();
        int end = m.end();
        String distinct = m.group(1) == null ? "" : m.group(1);
        String n = m.group(2);
        if (m.find()) return sql;

        String body = sql.substring(0, start) + "SELECT" + distinct + " " + sql.substring(end);
        String trimmed = body.stripTrailing();
        boolean semicolon = trimmed.endsWith(";");
        if (semicolon) trimmed = trimmed.substring(0, trimmed.length() - 1).stripTrailing();
        if (!LIMIT.matcher(trimmed).find()) {
            trimmed += dialect == TargetDialect.SNOWFLAKE ? "\nLIMIT " + n : "\nFETCH FIRST " + n + " ROWS ONLY";
        }
        applied.add(dialect == TargetDialect.SNOWFLAKE ? "TOP n->LIMIT n" : "TOP n->FETCH FIRST n ROWS ONLY");
        return semicolon ? trimmed + ";" : trimmed;
    }

    private static String identifier(String raw) {
        return WORD.matcher(raw).matches() ? raw : "\"" + raw.replace("\"", "\"\"") + "\"";
    }

    private static final class Rule {
        final String name;
        final Pattern pattern;
        final Function<MatchResult, String> replacement;

        Rule(String name, String regex, Function<MatchResult, String> replacement) {
            this.name = name;
            this.pattern = Pattern.compile(regex);
            this.replacement = replacement;
        }
    }
}
