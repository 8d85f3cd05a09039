package angstromio.guard;

/**
 * Bounds applied when a value is rendered into a failure message.
 *
 * @param maxDepth    containers nested deeper than this are shown by type name only.
 * @param maxElements elements shown per collection, map, array or record before eliding the rest.
 * @param maxLength   characters kept in the rendered text; longer output ends with {@code ...}.
 */
public record RenderLimits(int maxDepth, int maxElements, int maxLength) {

    public static final RenderLimits DEFAULT = new RenderLimits(4, 32, 1024);

    public RenderLimits {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be non-negative (was " + maxDepth + ")");
        }
        if (maxElements < 1) {
            throw new IllegalArgumentException("maxElements must be positive (was " + maxElements + ")");
        }
        if (maxLength < 8) {
            throw new IllegalArgumentException("maxLength must be at least 8 (was " + maxLength + ")");
        }
    }
}
