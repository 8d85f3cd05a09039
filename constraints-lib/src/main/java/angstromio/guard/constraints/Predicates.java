package angstromio.guard.constraints;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import angstromio.guard.TypeGuard;
import angstromio.guard.ValidatorDefinitionException;
import angstromio.guard.ValuePredicate;

/**
 * Basic string and number rules. Every rule rejects values of the wrong type, {@code null}
 * included, without throwing.
 */
public final class Predicates {

    private static final Pattern UUID_PATTERN =
            Pattern.compile("\\A[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}\\z");

    private static final Set<String> ISO_COUNTRY_CODES = Set.of(Locale.getISOCountries());

    private Predicates() {
        // Utility
    }

    public static TypeGuard<Boolean> isBoolean() {
        return TypeGuard.of(Boolean.class, value -> true);
    }

    public static TypeGuard<Number> isNumber() {
        return TypeGuard.of(Number.class, value -> true);
    }

    public static TypeGuard<String> isString() {
        return TypeGuard.of(String.class, value -> true);
    }

    public static ValuePredicate notNull() {
        return value -> value != null;
    }

    /**
     * Accepts character sequences with at least one non-whitespace character.
     */
    public static TypeGuard<CharSequence> notBlank() {
        return TypeGuard.of(CharSequence.class, value -> !value.toString().isBlank());
    }

    /**
     * Accepts numbers greater than or equal to zero; {@code NaN} is rejected.
     */
    public static ValuePredicate nonNegative() {
        return inRange(RangeConfig.atLeast(0));
    }

    public static ValuePredicate inRange(RangeConfig range) {
        if (range == null) {
            throw new ValidatorDefinitionException("inRange requires bounds");
        }
        return value -> value instanceof Number number && range.contains(number.doubleValue());
    }

    /**
     * Accepts character sequences matching {@code pattern} in full.
     */
    public static ValuePredicate matches(Pattern pattern) {
        if (pattern == null) {
            throw new ValidatorDefinitionException("matches requires a pattern");
        }
        return value -> value instanceof CharSequence text && pattern.matcher(text).matches();
    }

    /**
     * Accepts strings in the canonical {@code 8-4-4-4-12} hexadecimal UUID form.
     */
    public static ValuePredicate isUUID() {
        return matches(UUID_PATTERN);
    }

    /**
     * Accepts an ISO-3166 alpha-2 country code, ignoring case, or a non-empty collection or array
     * made only of such codes.
     */
    public static ValuePredicate isCountryCode() {
        return value -> {
            List<?> codes = asList(value);
            if (codes == null) {
                return isSingleCountryCode(value);
            }
            return !codes.isEmpty() && codes.stream().allMatch(Predicates::isSingleCountryCode);
        };
    }

    /**
     * Applies {@code rule} to the {@code name} entry of a map. Values that are not maps, or maps
     * that do not accept string keys, are rejected and a missing entry is tested as {@code null}.
     */
    public static ValuePredicate field(String name, ValuePredicate rule) {
        if (name == null || rule == null) {
            throw new ValidatorDefinitionException("field rules require a field name and a rule");
        }
        return value -> value instanceof Map<?, ?> map && testEntry(map, name, rule);
    }

    /**
     * Accepts maps whose listed entries each satisfy their rule. Entries are checked in the
     * iteration order of {@code fields} and checking stops at the first failing entry.
     */
    public static ValuePredicate hasFields(Map<String, ValuePredicate> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new ValidatorDefinitionException("hasFields requires at least one field rule");
        }
        Map<String, ValuePredicate> copy = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        return value -> value instanceof Map<?, ?> map
                && copy.entrySet().stream().allMatch(entry -> testEntry(map, entry.getKey(), entry.getValue()));
    }

    public static ValuePredicate allOf(ValuePredicate... rules) {
        if (rules == null || rules.length == 0) {
            throw new ValidatorDefinitionException("allOf requires at least one rule");
        }
        if (Arrays.asList(rules).contains(null)) {
            throw new ValidatorDefinitionException("allOf rules must not be null");
        }
        List<ValuePredicate> copy = List.of(rules);
        return value -> copy.stream().allMatch(rule -> rule.test(value));
    }

    /**
     * Maps that cannot hold a {@code String} key, such as a {@code TreeMap} ordered on integers,
     * are rejected rather than failing the lookup.
     */
    private static boolean testEntry(Map<?, ?> map, String name, ValuePredicate rule) {
        Object entry;
        try {
            entry = map.get(name);
        } catch (ClassCastException | NullPointerException e) {
            return false;
        }
        return rule.test(entry);
    }

    private static boolean isSingleCountryCode(Object value) {
        return value instanceof String code && ISO_COUNTRY_CODES.contains(code.toUpperCase(Locale.ROOT));
    }

    private static List<?> asList(Object value) {
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (value instanceof Object[] elements) {
            return Arrays.asList(elements);
        }
        return null;
    }
}
