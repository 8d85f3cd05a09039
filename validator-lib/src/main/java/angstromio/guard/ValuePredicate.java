package angstromio.guard;

/**
 * A single validation rule expressed as a boolean test over an incoming value.
 *
 * <p>Implementations must not mutate the value they are given. They may read configuration
 * captured when they were created (a range's bounds, a compiled pattern) but the outcome for a
 * given value must not change between calls. Returning {@code false} rejects the value; throwing
 * is a defect in the rule itself and is reported as a {@link ValidatorDefinitionException}
 * rather than as a validation failure.
 *
 * @see TypeGuard
 */
@FunctionalInterface
public interface ValuePredicate {

    /**
     * Tests the incoming value.
     *
     * @param value the value being assigned or passed, possibly {@code null}.
     * @return {@code true} to accept the value, {@code false} to reject it.
     */
    boolean test(Object value);

    /**
     * @param other rule evaluated only when this one accepts.
     * @return a rule accepting values both rules accept.
     */
    default ValuePredicate and(ValuePredicate other) {
        return value -> test(value) && other.test(value);
    }
}
