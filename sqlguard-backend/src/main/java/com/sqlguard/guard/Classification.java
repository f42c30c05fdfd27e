package com.sqlguard.guard;

import java.util.Objects;

/**
 * Outcome of classifying one statement: either {@link Accepted} or {@link Rejected}.
 *
 * <p>The hierarchy is closed. Instances of {@link Accepted} are only created by
 * {@link StatementClassifier}, so holding one proves the text went through the checks.
 */
public abstract class Classification {

    private Classification() {
    }

    public abstract boolean isAccepted();

    static Accepted accepted(String statement) {
        return new Accepted(statement);
    }

    static Rejected rejected(RejectionReason reason, String fragment) {
        return new Rejected(reason, fragment);
    }

    /**
     * A statement cleared for execution, in its normalized form.
     */
    public static final class Accepted extends Classification {
        private final String statement;

        private Accepted(String statement) {
            this.statement = Objects.requireNonNull(statement, "statement");
        }

        public String getStatement() {
            return statement;
        }

        @Override
        public boolean isAccepted() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Accepted other)) {
                return false;
            }
            return statement.equals(other.statement);
        }

        @Override
        public int hashCode() {
            return statement.hashCode();
        }

        @Override
        public String toString() {
            return "Accepted(" + statement + ")";
        }
    }

    /**
     * A refused statement with its reason code and the fragment that triggered it.
     */
    public static final class Rejected extends Classification {
        private final RejectionReason reason;
        private final String fragment;

        private Rejected(RejectionReason reason, String fragment) {
            this.reason = Objects.requireNonNull(reason, "reason");
            this.fragment = fragment != null ? fragment : "";
        }

        public RejectionReason getReason() {
            return reason;
        }

        public String getFragment() {
            return fragment;
        }

        /**
         * @return audit-facing message, starting with {@link RejectionReason#MARKER}
         */
        public String getMessage() {
            return reason.render(fragment);
        }

        @Override
        public boolean isAccepted() {
            return false;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Rejected other)) {
                return false;
            }
            return reason == other.reason && fragment.equals(other.fragment);
        }

        @Override
        public int hashCode() {
            return Objects.hash(reason, fragment);
        }

        @Override
        public String toString() {
            return "Rejected(" + reason + ", " + fragment + ")";
        }
    }
}
