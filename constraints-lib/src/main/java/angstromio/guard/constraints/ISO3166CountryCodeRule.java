package angstromio.guard.constraints;

import angstromio.guard.AnnotationRule;
import angstromio.guard.ValuePredicate;

/**
 * Checks {@link CountryCode}-annotated values against the ISO-3166 alpha-2 codes known to
 * {@link java.util.Locale#getISOCountries()}.
 */
public class ISO3166CountryCodeRule implements AnnotationRule<CountryCode> {

    @Override
    public ValuePredicate predicate(CountryCode annotation) {
        return Predicates.isCountryCode();
    }
}
