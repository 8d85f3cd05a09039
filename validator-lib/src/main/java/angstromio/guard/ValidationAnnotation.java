package angstromio.guard;

import java.lang.reflect.Method;

/**
 * A reusable rule ready to be attached to targets. Attaching only records the rule in the
 * {@link MetadataRegistry}; checking happens when an {@link Enforced} member is called.
 *
 * <p>Instances come from {@link AnnotationFactory}.
 */
public class ValidationAnnotation {

    private final MetadataRegistry registry;
    private final String name;
    private final ValuePredicate predicate;
    private final String messageTemplate;

    ValidationAnnotation(MetadataRegistry registry, String name, ValuePredicate predicate, String messageTemplate) {
        this.registry = registry;
        this.name = name;
        this.predicate = predicate;
        this.messageTemplate = messageTemplate;
    }

    /**
     * Attaches this rule to the target.
     *
     * @param target accessor or parameter to attach to.
     * @return {@code target}, unchanged.
     */
    public TargetIdentity applyTo(TargetIdentity target) {
        registry.register(target, ValidatorEntry.forTarget(target, predicate, messageTemplate, name));
        return target;
    }

    public TargetIdentity applyToAccessor(Method setter) {
        return applyTo(TargetIdentity.accessor(setter));
    }

    public TargetIdentity applyToParameter(Method method, int index) {
        return applyTo(TargetIdentity.parameter(method, index));
    }

    public String name() {
        return name;
    }

    public ValuePredicate predicate() {
        return predicate;
    }

    public String messageTemplate() {
        return messageTemplate;
    }

    @Override
    public String toString() {
        return "@" + name;
    }
}
