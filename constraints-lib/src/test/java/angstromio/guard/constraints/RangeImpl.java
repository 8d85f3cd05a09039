package angstromio.guard.constraints;

import java.io.Serial;
import java.io.Serializable;
import java.lang.annotation.Annotation;

record RangeImpl(String message, double min, double max) implements Range, Serializable {

    RangeImpl(double min, double max) {
        this("${validatedValue} is out of range", min, max);
    }

    public int hashCode() {
        // This is specified in java.lang.Annotation.
        return ((127 * "message".hashCode()) ^ message.hashCode())
                + ((127 * "min".hashCode()) ^ Double.valueOf(min).hashCode())
                + ((127 * "max".hashCode()) ^ Double.valueOf(max).hashCode());
    }

    /**
     * Range specific equals
     */
    public boolean equals(Object o) {
        if (!(o instanceof Range other)) {
            return false;
        }

        return message.equals(other.message())
                && Double.compare(min, other.min()) == 0
                && Double.compare(max, other.max()) == 0;
    }

    public String toString() {
        return "@" + Range.class.getName() + "(message=" + message + ", min=" + min + ", max=" + max + ")";
    }

    public Class<? extends Annotation> annotationType() {
        return Range.class;
    }

    @Serial
    private static final long serialVersionUID = 0;
}
