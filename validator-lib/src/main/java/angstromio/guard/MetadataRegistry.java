package angstromio.guard;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records which rules are attached to which {@link TargetIdentity}, in attachment order.
 *
 * <p>Rules are registered while guarded types are being set up and read on every guarded call
 * afterwards. Lookups are safe from any thread. Registering against an identity that is already
 * being enforced concurrently is not supported. An identity with no rules and an identity never
 * seen both look up as an empty list.
 *
 * <p>{@link #shared()} is the instance used when no registry is passed explicitly; tests build their
 * own with {@code new MetadataRegistry()}.
 */
public final class MetadataRegistry {

    private static final Logger log = LoggerFactory.getLogger(MetadataRegistry.class);

    private static final MetadataRegistry SHARED = new MetadataRegistry();

    private final Map<TargetIdentity, List<ValidatorEntry>> entries = new ConcurrentHashMap<>();
    private final Set<Class<?>> scannedTypes = ConcurrentHashMap.newKeySet();

    public static MetadataRegistry shared() {
        return SHARED;
    }

    /**
     * Appends a rule to the target's list. Registering an equal entry twice keeps both.
     */
    public void register(TargetIdentity target, ValidatorEntry entry) {
        if (target == null) {
            throw new ValidatorDefinitionException("cannot register rule " + (entry == null ? null : entry.ruleName()) + " without a target");
        }
        if (entry == null) {
            throw new ValidatorDefinitionException("cannot register a missing rule on " + target);
        }
        List<ValidatorEntry> list = entries.computeIfAbsent(target, key -> new CopyOnWriteArrayList<>());
        list.add(entry);
        log.debug("Registered rule '{}' on {} (position {})", entry.ruleName(), target, list.size());
    }

    /**
     * @return an immutable snapshot of the target's rules in registration order, empty when none.
     */
    public List<ValidatorEntry> lookup(TargetIdentity target) {
        if (target == null) {
            throw new ValidatorDefinitionException("cannot look up rules without a target");
        }
        List<ValidatorEntry> list = entries.get(target);
        return list == null ? List.of() : List.copyOf(list);
    }

    /**
     * Claims {@code type} for declaration scanning. Returns {@code false} when any scanner working
     * against this registry has already claimed it.
     */
    boolean claimScan(Class<?> type) {
        return scannedTypes.add(type);
    }

    boolean isScanned(Class<?> type) {
        return scannedTypes.contains(type);
    }

    /**
     * @return every target with at least one rule.
     */
    public Set<TargetIdentity> identities() {
        return Set.copyOf(entries.keySet());
    }
}
