package angstromio.guard.constraints;

import angstromio.guard.ValidatorDefinitionException;

/**
 * Inclusive numeric bounds for {@link Predicates#inRange(RangeConfig)}. Either bound may be
 * infinite to leave that side open.
 *
 * @param min lowest accepted value.
 * @param max highest accepted value.
 */
public record RangeConfig(double min, double max) {

    public RangeConfig {
        if (Double.isNaN(min) || Double.isNaN(max)) {
            throw new ValidatorDefinitionException("range bounds must be numbers (was " + min + ", " + max + ")");
        }
        if (min > max) {
            throw new ValidatorDefinitionException("range minimum " + min + " is greater than maximum " + max);
        }
    }

    public static RangeConfig atLeast(double min) {
        return new RangeConfig(min, Double.POSITIVE_INFINITY);
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }
}
