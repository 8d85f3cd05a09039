package angstromio.guard;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * A {@link ValuePredicate} that also describes the type an accepted value can be treated as.
 *
 * <p>The narrowing view exists for callers that want a typed handle on an accepted value.
 * Registration and enforcement only ever call {@link #test(Object)}: a type guard and a plain
 * predicate with the same {@code test} behave identically when enforced. {@link #narrow(Object)}
 * is derived from {@code test} and must not be overridden to disagree with it.
 *
 * @param <T> the type accepted values are known to have.
 */
public interface TypeGuard<T> extends ValuePredicate {

    /**
     * @return the type every accepted value is an instance of.
     */
    Class<T> guardedType();

    /**
     * Returns the value viewed as {@code T} when this guard accepts it.
     *
     * @param value candidate value.
     * @return the value as {@code T}, or empty when rejected or {@code null}.
     */
    default Optional<T> narrow(Object value) {
        if (!test(value) || !guardedType().isInstance(value)) {
            return Optional.empty();
        }
        return Optional.of(guardedType().cast(value));
    }

    /**
     * Builds a type guard from a type and a rule over values of that type. Values of any other type
     * are rejected without calling {@code rule}.
     */
    static <T> TypeGuard<T> of(Class<T> type, Predicate<? super T> rule) {
        return new TypeGuard<>() {
            @Override
            public Class<T> guardedType() {
                return type;
            }

            @Override
            public boolean test(Object value) {
                return type.isInstance(value) && rule.test(type.cast(value));
            }

            @Override
            public String toString() {
                return "TypeGuard[" + type.getSimpleName() + "]";
            }
        };
    }
}
