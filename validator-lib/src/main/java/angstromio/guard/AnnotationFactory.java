package angstromio.guard;

import java.util.function.Function;

/**
 * Turns predicates into {@link ValidationAnnotation}s bound to one {@link MetadataRegistry}.
 *
 * <pre>{@code
 * AnnotationFactory annotations = new AnnotationFactory(registry);
 * ValidationAnnotation notNull = annotations.makeAnnotation("NotNull", Objects::nonNull, "must not be null");
 * ParameterizedAnnotation<Bounds> range = annotations.parameterized(
 *     "Range", Bounds::predicate, b -> "${validatedValue} is outside " + b);
 *
 * notNull.applyToParameter(method, 0);
 * range.with(new Bounds(0, 100)).applyToParameter(method, 0);
 * }</pre>
 */
public final class AnnotationFactory {

    private final MetadataRegistry registry;

    public AnnotationFactory(MetadataRegistry registry) {
        if (registry == null) {
            throw new ValidatorDefinitionException("annotation factory requires a registry");
        }
        this.registry = registry;
    }

    public ValidationAnnotation makeAnnotation(ValuePredicate predicate, String messageTemplate) {
        return makeAnnotation(null, predicate, messageTemplate);
    }

    /**
     * @param name            rule name used in diagnostics, defaults to the predicate's {@code toString}.
     * @param predicate       the rule.
     * @param messageTemplate failure message, may contain {@link MessageTemplate#MARKER}.
     */
    public ValidationAnnotation makeAnnotation(String name, ValuePredicate predicate, String messageTemplate) {
        if (predicate == null) {
            throw new ValidatorDefinitionException("annotation '" + name + "' requires a predicate");
        }
        return new ValidationAnnotation(registry, nameOr(name, predicate), predicate, messageOrEmpty(messageTemplate));
    }

    public <C> ParameterizedAnnotation<C> parameterized(String name,
                                                        Function<? super C, ? extends ValuePredicate> rule,
                                                        String messageTemplate) {
        String template = messageOrEmpty(messageTemplate);
        return this.<C>parameterized(name, rule, config -> template);
    }

    /**
     * @param name            rule name used in diagnostics.
     * @param rule            builds the predicate for one configuration.
     * @param messageTemplate builds the message template for one configuration.
     */
    public <C> ParameterizedAnnotation<C> parameterized(String name,
                                                        Function<? super C, ? extends ValuePredicate> rule,
                                                        Function<? super C, String> messageTemplate) {
        if (name == null || name.isBlank()) {
            throw new ValidatorDefinitionException("parameterized annotations require a name");
        }
        if (rule == null || messageTemplate == null) {
            throw new ValidatorDefinitionException("annotation '" + name + "' requires a rule and a message template");
        }
        return new ParameterizedAnnotation<>(registry, name, rule, messageTemplate);
    }

    public MetadataRegistry registry() {
        return registry;
    }

    private static String nameOr(String name, ValuePredicate predicate) {
        return name == null || name.isBlank() ? predicate.toString() : name;
    }

    private static String messageOrEmpty(String messageTemplate) {
        return messageTemplate == null ? "" : messageTemplate;
    }
}
