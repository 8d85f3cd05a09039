package angstromio.guard;

import java.util.function.Function;

/**
 * Produces differently configured {@link ValidationAnnotation}s from one rule definition, for
 * example one range annotation per {@code (min, max)} pair.
 *
 * @param <C> the configuration record the rule is built from.
 */
public final class ParameterizedAnnotation<C> {

    private final MetadataRegistry registry;
    private final String name;
    private final Function<? super C, ? extends ValuePredicate> rule;
    private final Function<? super C, String> messageTemplate;

    ParameterizedAnnotation(MetadataRegistry registry,
                            String name,
                            Function<? super C, ? extends ValuePredicate> rule,
                            Function<? super C, String> messageTemplate) {
        this.registry = registry;
        this.name = name;
        this.rule = rule;
        this.messageTemplate = messageTemplate;
    }

    /**
     * Builds an annotation for one configuration. Each call builds a new predicate; annotations
     * built from different configurations share nothing.
     */
    public Configured<C> with(C config) {
        if (config == null) {
            throw new ValidatorDefinitionException("annotation '" + name + "' requires a configuration");
        }
        ValuePredicate predicate = rule.apply(config);
        if (predicate == null) {
            throw new ValidatorDefinitionException("annotation '" + name + "' produced no rule for " + config);
        }
        return new Configured<>(registry, name, predicate, messageTemplate.apply(config), config);
    }

    /**
     * An annotation together with the configuration it was built from.
     */
    public static final class Configured<C> extends ValidationAnnotation {

        private final C config;

        Configured(MetadataRegistry registry, String name, ValuePredicate predicate, String messageTemplate, C config) {
            super(registry, name, predicate, messageTemplate);
            this.config = config;
        }

        public C config() {
            return config;
        }

        @Override
        public String toString() {
            return super.toString() + "(" + config + ")";
        }
    }
}
