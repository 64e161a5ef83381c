package io.exoticst.automaton;

/**
 * Immutable configuration for {@link Automaton} construction.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * AutomatonConfiguration config = AutomatonConfiguration.builder()
 *     .ignoreCase(true)
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 *
 * @see Automaton#build(java.util.List, java.util.List, AutomatonConfiguration)
 */
public final class AutomatonConfiguration {

    private static final AutomatonConfiguration DEFAULT = builder().build();

    private final boolean ignoreCase;

    private AutomatonConfiguration(Builder builder) {
        this.ignoreCase = builder.ignoreCase;
    }

    /**
     * Create a new builder for AutomatonConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static AutomatonConfiguration defaultConfiguration() {
        return DEFAULT;
    }

    /**
     * Check if pattern and text characters are compared case-insensitively.
     * Result keys are always the patterns exactly as supplied.
     *
     * @return true if matching ignores case (default: false)
     */
    public boolean ignoreCase() {
        return ignoreCase;
    }

    @Override
    public String toString() {
        return "AutomatonConfiguration[ignoreCase=" + ignoreCase + "]";
    }

    /**
     * Builder for AutomatonConfiguration.
     */
    public static final class Builder {
        private boolean ignoreCase = false;

        private Builder() {
        }

        /**
         * Enable or disable case-insensitive matching. Characters are lower-cased
         * one at a time with {@link Character#toLowerCase(char)} before they drive
         * trie transitions.
         *
         * @param ignoreCase true to ignore case (default: false)
         * @return this builder for method chaining
         */
        public Builder ignoreCase(boolean ignoreCase) {
            this.ignoreCase = ignoreCase;
            return this;
        }

        /**
         * Build the immutable AutomatonConfiguration.
         *
         * @return a new AutomatonConfiguration instance
         */
        public AutomatonConfiguration build() {
            return new AutomatonConfiguration(this);
        }
    }
}
