package com.credential.dedupe.grouping;

/**
 * Options controlling how records are bucketed into duplicate-candidate clusters.
 */
public class GroupingOptions {

    private final boolean strictPasswords;
    private final boolean emailUsernameEquivalence;

    private GroupingOptions(Builder builder) {
        this.strictPasswords = builder.strictPasswords;
        this.emailUsernameEquivalence = builder.emailUsernameEquivalence;
    }

    /**
     * Whether the password is part of the grouping key.
     */
    public boolean isStrictPasswords() {
        return strictPasswords;
    }

    /**
     * Whether an email-bearing field stands in for an empty username.
     */
    public boolean isEmailUsernameEquivalence() {
        return emailUsernameEquivalence;
    }

    /**
     * Strict passwords, email/username equivalence on.
     */
    public static GroupingOptions defaults() {
        return builder().build();
    }

    /**
     * Groups records regardless of password, so entries whose password changed
     * between exports meet in one cluster.
     */
    public static GroupingOptions relaxed() {
        return builder().strictPasswords(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "GroupingOptions{strictPasswords=" + strictPasswords +
                ", emailUsernameEquivalence=" + emailUsernameEquivalence + '}';
    }

    public static class Builder {
        private boolean strictPasswords = true;
        private boolean emailUsernameEquivalence = true;

        public Builder strictPasswords(boolean strictPasswords) {
            this.strictPasswords = strictPasswords;
            return this;
        }

        public Builder emailUsernameEquivalence(boolean emailUsernameEquivalence) {
            this.emailUsernameEquivalence = emailUsernameEquivalence;
            return this;
        }

        public GroupingOptions build() {
            return new GroupingOptions(this);
        }
    }
}
