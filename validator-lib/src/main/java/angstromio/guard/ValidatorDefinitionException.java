package angstromio.guard;

import java.io.Serial;

import jakarta.validation.ConstraintDefinitionException;

/**
 * Signals a programming mistake in how a rule was written or attached, for example a rule that
 * throws or a rule annotation without a {@code message} element. Never caused by the value under
 * validation alone and never worth retrying.
 */
public class ValidatorDefinitionException extends ConstraintDefinitionException {

    @Serial
    private static final long serialVersionUID = 1L;

    public ValidatorDefinitionException(String message) {
        super(message);
    }

    public ValidatorDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
