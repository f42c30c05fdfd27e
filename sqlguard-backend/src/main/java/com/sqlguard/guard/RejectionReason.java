package com.sqlguard.guard;

/**
 * Reason codes reported when a statement is refused.
 *
 * <p>The codes and their rendered messages are grepped by audit tooling and must stay stable.
 */
public enum RejectionReason {
    NOT_READ_ONLY_PREFIX,
    FORBIDDEN_KEYWORD,
    MULTIPLE_STATEMENTS;

    /** Leading token of every rendered rejection. */
    public static final String MARKER = "BLOCKED";

    /**
     * Render the caller-facing message for this reason.
     *
     * @param fragment offending fragment (prefix excerpt, keyword or trailing statement)
     * @return rendered message starting with {@link #MARKER}
     */
    public String render(String fragment) {
        String head = MARKER + " [" + name() + "]: ";
        switch (this) {
            case NOT_READ_ONLY_PREFIX:
                return head + "Only SELECT, WITH (CTE), and EXPLAIN queries are allowed. Got: '" + fragment + "...'";
            case FORBIDDEN_KEYWORD:
                return head + "Detected forbidden keyword '" + fragment + "' in query. Only read-only queries are allowed.";
            case MULTIPLE_STATEMENTS:
                return head + "Multiple statements detected (semicolon in query body). Only single SELECT statements are allowed.";
            default:
                throw new IllegalStateException("Unknown rejection reason: " + this);
        }
    }
}
