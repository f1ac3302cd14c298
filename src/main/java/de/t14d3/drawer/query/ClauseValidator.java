package de.t14d3.drawer.query;

import de.t14d3.drawer.exceptions.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Guards caller-supplied SQL fragments (column lists, WHERE, ORDER BY and GROUP BY clauses).
 *
 * Checks run in this order:
 * <ol>
 *   <li>length bound, before any pattern matching</li>
 *   <li>string literals and quoted identifiers are masked out</li>
 *   <li>statement separators and comment markers</li>
 *   <li>characters outside the {@link ClauseContext}</li>
 *   <li>statement keywords that cannot appear inside a single clause</li>
 *   <li>function calls against the allow-list and the deny-list</li>
 * </ol>
 * A double-quoted name followed by {@code (} is a function call to the engines, so it is
 * unquoted and checked like a bare one.
 * Only the last check honours non-strict mode, where a finding is logged instead of thrown.
 */
public final class ClauseValidator {
    private static final Logger logger = LoggerFactory.getLogger(ClauseValidator.class);

    public static final int DEFAULT_MAX_LENGTH = 1000;

    public static final Set<String> DEFAULT_ALLOWED_FUNCTIONS = Set.of(
            "COUNT", "SUM", "AVG", "MIN", "MAX", "TOTAL", "GROUP_CONCAT",
            "ABS", "ROUND", "UPPER", "LOWER", "LENGTH", "SUBSTR", "SUBSTRING",
            "TRIM", "LTRIM", "RTRIM", "REPLACE", "INSTR", "PRINTF",
            "COALESCE", "IFNULL", "NULLIF", "IIF", "CAST", "TYPEOF",
            "DATE", "TIME", "DATETIME", "JULIANDAY", "STRFTIME", "UNIXEPOCH",
            "JSON", "JSON_EXTRACT", "JSON_TYPE", "JSON_ARRAY", "JSON_OBJECT", "JSON_ARRAY_LENGTH"
    );

    private static final Set<String> STATEMENT_KEYWORDS = Set.of(
            "SELECT", "INSERT", "UPDATE", "DELETE", "DROP", "CREATE", "ALTER",
            "ATTACH", "DETACH", "PRAGMA", "VACUUM", "REINDEX", "TRUNCATE",
            "UNION", "INTERSECT", "EXCEPT", "GRANT", "REVOKE", "EXEC", "EXECUTE"
    );

    // words that may legally precede "(" without being a function call
    private static final Set<String> NON_FUNCTION_WORDS = Set.of(
            "IN", "NOT", "AND", "OR", "AS", "IS", "BETWEEN", "LIKE", "GLOB",
            "EXISTS", "CASE", "WHEN", "THEN", "ELSE", "END", "NULL", "ON"
    );

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern WORD = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern FUNCTION_CALL = Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)\\s*\\(");

    private final boolean strict;
    private final Set<String> allowedFunctions;
    private final Set<String> forbiddenFunctions;
    private final int maxLength;

    public ClauseValidator() {
        this(true, Set.of(), Set.of(), DEFAULT_MAX_LENGTH);
    }

    /**
     * @param strict             throw on disallowed functions instead of logging a warning
     * @param allowedFunctions   functions permitted in addition to {@link #DEFAULT_ALLOWED_FUNCTIONS}
     * @param forbiddenFunctions functions rejected even when allowed
     * @param maxLength          upper bound on fragment length
     */
    public ClauseValidator(boolean strict, Collection<String> allowedFunctions,
                           Collection<String> forbiddenFunctions, int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be > 0");
        }
        this.strict = strict;
        Set<String> allowed = new HashSet<>(DEFAULT_ALLOWED_FUNCTIONS);
        allowed.addAll(upper(allowedFunctions));
        this.allowedFunctions = Collections.unmodifiableSet(allowed);
        this.forbiddenFunctions = Collections.unmodifiableSet(upper(forbiddenFunctions));
        this.maxLength = maxLength;
    }

    public boolean isStrict() {
        return strict;
    }

    public int maxLength() {
        return maxLength;
    }

    public void validate(String fragment, ClauseContext context) {
        check(fragment, context, allowedFunctions, forbiddenFunctions, maxLength, strict);
    }

    /**
     * Validate with per-call function lists layered over this validator's configuration.
     *
     * @param extraAllowed     functions permitted for this call only
     * @param extraForbidden   functions rejected for this call only
     * @param overrideAllowed  when true, only {@code extraAllowed} is permitted
     */
    public void validate(String fragment, ClauseContext context, Collection<String> extraAllowed,
                         Collection<String> extraForbidden, boolean overrideAllowed) {
        Set<String> allowed = overrideAllowed ? new HashSet<>() : new HashSet<>(allowedFunctions);
        allowed.addAll(upper(extraAllowed));
        Set<String> forbidden = new HashSet<>(forbiddenFunctions);
        forbidden.addAll(upper(extraForbidden));
        check(fragment, context, allowed, forbidden, maxLength, strict);
    }

    /**
     * Stateless form: {@code allowedExtra} is added to {@link #DEFAULT_ALLOWED_FUNCTIONS}.
     *
     * @throws ValidationException when the fragment is rejected
     */
    public static void validate(String fragment, ClauseContext context, Collection<String> allowedExtra,
                                Collection<String> forbidden, int maxLength, boolean strict) {
        Set<String> allowed = new HashSet<>(DEFAULT_ALLOWED_FUNCTIONS);
        allowed.addAll(upper(allowedExtra));
        check(fragment, context, allowed, upper(forbidden), maxLength, strict);
    }

    /**
     * Accept only plain SQL identifiers such as table names.
     */
    public static String validateIdentifier(String name, String what) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new ValidationException("Invalid " + what + ": '" + name + "'");
        }
        return name;
    }

    public static boolean isIdentifier(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    private static void check(String fragment, ClauseContext context, Set<String> allowed,
                              Set<String> forbidden, int maxLength, boolean strict) {
        if (fragment == null || fragment.isBlank()) {
            return;
        }
        if (fragment.length() > maxLength) {
            throw new ValidationException(context.label() + " exceeds maximum length of " + maxLength
                    + " characters (got " + fragment.length() + ")");
        }

        List<String> quotedCalls = new ArrayList<>();
        String masked = maskQuoted(fragment, context, quotedCalls);

        if (masked.indexOf(';') >= 0) {
            throw new ValidationException(context.label() + " must not contain statement separators: " + fragment);
        }
        if (masked.contains("--") || masked.contains("/*") || masked.contains("*/")) {
            throw new ValidationException(context.label() + " must not contain comments: " + fragment);
        }
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (!context.permits(c)) {
                throw new ValidationException("Character '" + c + "' is not permitted in " + context.label() + ": " + fragment);
            }
        }

        Matcher words = WORD.matcher(masked);
        while (words.find()) {
            String word = words.group().toUpperCase(Locale.ROOT);
            if (STATEMENT_KEYWORDS.contains(word)) {
                throw new ValidationException("Keyword " + word + " is not permitted in " + context.label() + ": " + fragment);
            }
        }

        List<String> calls = new ArrayList<>(quotedCalls);
        Matcher bare = FUNCTION_CALL.matcher(masked);
        while (bare.find()) {
            String name = bare.group(1).toUpperCase(Locale.ROOT);
            if (!NON_FUNCTION_WORDS.contains(name)) {
                calls.add(name);
            }
        }
        for (String name : calls) {
            String problem = null;
            if (forbidden.contains(name)) {
                problem = "Function " + name + " is forbidden";
            } else if (!allowed.contains(name)) {
                problem = "Function " + name + " is not in the allowed function list";
            }
            if (problem != null) {
                if (strict) {
                    throw new ValidationException(problem + " (" + context.label() + ": " + fragment + ")");
                }
                logger.warn("{} ({}: {}); accepted because strict validation is disabled", problem, context.label(), fragment);
            }
        }
    }

    /**
     * Replace the content of '...' literals and "..." identifiers, keeping the delimiters.
     * Upper-cased names of quoted identifiers used as function calls go to {@code quotedCalls}.
     */
    private static String maskQuoted(String fragment, ClauseContext context, List<String> quotedCalls) {
        StringBuilder out = new StringBuilder(fragment.length());
        int i = 0;
        while (i < fragment.length()) {
            char c = fragment.charAt(i);
            if (c != '\'' && c != '"') {
                out.append(c);
                i++;
                continue;
            }
            int close = -1;
            int j = i + 1;
            while (j < fragment.length()) {
                if (fragment.charAt(j) == c) {
                    if (j + 1 < fragment.length() && fragment.charAt(j + 1) == c) {
                        j += 2;
                        continue;
                    }
                    close = j;
                    break;
                }
                j++;
            }
            if (close < 0) {
                throw new ValidationException("Unterminated quote in " + context.label() + ": " + fragment);
            }
            if (c == '"' && opensCall(fragment, close + 1)) {
                String name = fragment.substring(i + 1, close).replace("\"\"", "\"");
                quotedCalls.add(name.toUpperCase(Locale.ROOT));
            }
            out.append(c).append(c);
            i = close + 1;
        }
        return out.toString();
    }

    private static boolean opensCall(String fragment, int from) {
        int i = from;
        while (i < fragment.length() && Character.isWhitespace(fragment.charAt(i))) {
            i++;
        }
        return i < fragment.length() && fragment.charAt(i) == '(';
    }

    private static Set<String> upper(Collection<String> names) {
        Set<String> out = new HashSet<>();
        if (names != null) {
            for (String name : names) {
                out.add(name.trim().toUpperCase(Locale.ROOT));
            }
        }
        return out;
    }
}
