package com.sqlguard.guard;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a statement is read-only enough to reach the database.
 *
 * <p>Checks run in a fixed order and the first failing check decides the reported reason:
 * <ol>
 *     <li>the leading keyword must be SELECT, WITH or EXPLAIN;</li>
 *     <li>no forbidden keyword may appear anywhere as a whole word;</li>
 *     <li>no statement terminator may remain after the trailing one is stripped.</li>
 * </ol>
 *
 * <p>This is a textual classifier, not a SQL parser. Quoted literals and comments are scanned
 * like any other text, so a literal such as {@code 'DROP'} or {@code ';'} is refused. The
 * read-only session underneath is the second line of defense.
 *
 * <p>Stateless and thread-safe; {@link #classify(String)} never throws.
 */
@Component
public class StatementClassifier {

    static final List<String> READ_ONLY_PREFIXES = List.of("SELECT", "WITH", "EXPLAIN");

    static final List<String> FORBIDDEN_KEYWORDS = List.of(
            "INSERT", "UPDATE", "DELETE", "DROP", "ALTER", "CREATE", "TRUNCATE",
            "GRANT", "REVOKE", "EXEC", "EXECUTE", "CALL", "COPY", "LOAD"
    );

    static final char TERMINATOR = ';';

    private static final int PREFIX_EXCERPT_CHARS = 50;

    // Identifier characters are ASCII letters, digits and underscore.
    private static final String NOT_IDENT_BEFORE = "(?<![A-Za-z0-9_])";
    private static final String NOT_IDENT_AFTER = "(?![A-Za-z0-9_])";

    private static final Pattern LEADING_KEYWORD = Pattern.compile(
            "^(?:" + String.join("|", READ_ONLY_PREFIXES) + ")" + NOT_IDENT_AFTER,
            Pattern.CASE_INSENSITIVE);

    private static final Pattern FORBIDDEN = Pattern.compile(
            NOT_IDENT_BEFORE + "(" + String.join("|", FORBIDDEN_KEYWORDS) + ")" + NOT_IDENT_AFTER,
            Pattern.CASE_INSENSITIVE);

    /**
     * Classify a caller-supplied statement.
     *
     * @param text raw statement text, may be null
     * @return accepted (with the normalized text) or rejected (with reason and fragment)
     */
    public Classification classify(String text) {
        String cleaned = normalize(text);

        if (!LEADING_KEYWORD.matcher(cleaned).find()) {
            return Classification.rejected(RejectionReason.NOT_READ_ONLY_PREFIX, excerpt(cleaned));
        }

        Matcher forbidden = FORBIDDEN.matcher(cleaned);
        if (forbidden.find()) {
            return Classification.rejected(RejectionReason.FORBIDDEN_KEYWORD, forbidden.group(1));
        }

        int terminator = cleaned.indexOf(TERMINATOR);
        if (terminator >= 0) {
            return Classification.rejected(RejectionReason.MULTIPLE_STATEMENTS, cleaned.substring(terminator).strip());
        }

        return Classification.accepted(cleaned);
    }

    /**
     * Strip surrounding whitespace and at most one trailing terminator.
     *
     * @param text raw text, may be null
     * @return normalized text, never null
     */
    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String s = text.strip();
        if (!s.isEmpty() && s.charAt(s.length() - 1) == TERMINATOR) {
            s = s.substring(0, s.length() - 1);
        }
        return s.strip();
    }

    private static String excerpt(String cleaned) {
        return cleaned.length() <= PREFIX_EXCERPT_CHARS ? cleaned : cleaned.substring(0, PREFIX_EXCERPT_CHARS);
    }
}
