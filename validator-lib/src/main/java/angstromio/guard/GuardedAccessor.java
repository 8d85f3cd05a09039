package angstromio.guard;

/**
 * A value whose writes are checked against the rules of an accessor identity. A rejected write
 * leaves the previous value in place.
 *
 * @param <T> value type.
 */
public final class GuardedAccessor<T> {

    private final TargetIdentity target;
    private final EnforcementWrapper wrapper;
    private volatile T value;

    GuardedAccessor(TargetIdentity target, EnforcementWrapper wrapper, T initial) {
        this.target = target;
        this.wrapper = wrapper;
        this.value = initial;
    }

    public T get() {
        return value;
    }

    /**
     * @throws ConstraintViolatedException when a rule rejects {@code newValue}.
     */
    public void set(T newValue) {
        wrapper.check(target, newValue);
        this.value = newValue;
    }

    public TargetIdentity target() {
        return target;
    }
}
