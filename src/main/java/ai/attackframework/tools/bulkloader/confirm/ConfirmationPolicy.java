package ai.attackframework.tools.bulkloader.confirm;

/**
 * Decides whether a destructive operation may proceed.
 *
 * <p>{@link ConsoleConfirmation} asks an operator; {@link #always()} and {@link #never()} serve
 * non-interactive callers.</p>
 */
@FunctionalInterface
public interface ConfirmationPolicy {

    /**
     * @param prompt question shown to the operator
     * @return {@code true} to proceed
     */
    boolean confirm(String prompt);

    /** Proceeds without asking. */
    static ConfirmationPolicy always() {
        return prompt -> true;
    }

    /** Declines without asking. */
    static ConfirmationPolicy never() {
        return prompt -> false;
    }
}
