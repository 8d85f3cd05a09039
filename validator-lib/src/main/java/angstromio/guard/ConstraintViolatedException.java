package angstromio.guard;

import java.io.Serial;

import jakarta.validation.ValidationException;

/**
 * Raised by an enforced accessor or method when a registered rule rejects the incoming value.
 * The guarded body has not run when this is thrown.
 */
public class ConstraintViolatedException extends ValidationException {

    @Serial
    private static final long serialVersionUID = 1L;

    private final transient TargetIdentity target;
    private final String ruleName;
    private final transient Object invalidValue;

    public ConstraintViolatedException(String message, TargetIdentity target, String ruleName, Object invalidValue) {
        super(message);
        this.target = target;
        this.ruleName = ruleName;
        this.invalidValue = invalidValue;
    }

    /**
     * @return the accessor or parameter whose rule rejected the value.
     */
    public TargetIdentity getTarget() {
        return target;
    }

    /**
     * @return the name of the rejecting rule.
     */
    public String getRuleName() {
        return ruleName;
    }

    /**
     * @return the rejected value, as passed by the caller.
     */
    public Object getInvalidValue() {
        return invalidValue;
    }
}
