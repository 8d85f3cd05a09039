package angstromio.guard;

import java.lang.reflect.Array;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Renders arbitrary values as diagnostic text for failure messages. Strings are quoted, maps,
 * collections, arrays and records are expanded up to {@link RenderLimits}, and a container that
 * contains itself is shown as {@code [Circular]}.
 *
 * <p>Rendering never fails. A value whose {@code toString} or record accessor throws, or whose
 * {@code toString} overflows the stack, is shown by type name together with the error type.
 */
public final class ValueRenderer {

    private static final String CIRCULAR = "[Circular]";
    private static final String ELLIPSIS = "...";

    private final RenderLimits limits;

    public ValueRenderer(RenderLimits limits) {
        this.limits = limits == null ? RenderLimits.DEFAULT : limits;
    }

    public String render(Object value) {
        StringBuilder out = new StringBuilder();
        Set<Object> path = Collections.newSetFromMap(new IdentityHashMap<>());
        append(out, value, 0, path);
        return truncate(out);
    }

    private void append(StringBuilder out, Object value, int depth, Set<Object> path) {
        if (full(out)) {
            return;
        }
        if (value == null) {
            out.append("null");
        } else if (value instanceof CharSequence || value instanceof Character) {
            out.append('\'');
            appendText(out, value);
            out.append('\'');
        } else if (value instanceof Number || value instanceof Boolean) {
            appendText(out, value);
        } else if (value instanceof Enum<?> constant) {
            out.append(constant.getDeclaringClass().getSimpleName()).append('.').append(constant.name());
        } else if (value instanceof Class<?> type) {
            out.append(type.getName());
        } else if (value instanceof Optional<?> optional) {
            appendOptional(out, optional, depth, path);
        } else if (!path.add(value)) {
            out.append(CIRCULAR);
        } else {
            try {
                appendContainerOrText(out, value, depth, path);
            } finally {
                path.remove(value);
            }
        }
    }

    private void appendContainerOrText(StringBuilder out, Object value, int depth, Set<Object> path) {
        boolean container = value instanceof Map<?, ?>
                || value instanceof Iterable<?>
                || value.getClass().isArray()
                || value.getClass().isRecord();
        if (container && depth >= limits.maxDepth()) {
            out.append('[').append(value.getClass().getSimpleName()).append(']');
        } else if (value instanceof Map<?, ?> map) {
            appendMap(out, map, depth, path);
        } else if (value instanceof Iterable<?> iterable) {
            appendIterable(out, iterable, depth, path);
        } else if (value.getClass().isArray()) {
            appendArray(out, value, depth, path);
        } else if (value.getClass().isRecord()) {
            appendRecord(out, value, depth, path);
        } else {
            appendText(out, value);
        }
    }

    private void appendOptional(StringBuilder out, Optional<?> optional, int depth, Set<Object> path) {
        if (optional.isEmpty()) {
            out.append("Optional.empty");
            return;
        }
        out.append("Optional[");
        append(out, optional.get(), depth + 1, path);
        out.append(']');
    }

    private void appendMap(StringBuilder out, Map<?, ?> map, int depth, Set<Object> path) {
        out.append('{');
        int shown = 0;
        try {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (shown == limits.maxElements()) {
                    out.append(", ").append(ELLIPSIS).append(map.size() - shown).append(" more");
                    break;
                }
                if (shown > 0) {
                    out.append(", ");
                }
                append(out, entry.getKey(), depth + 1, path);
                out.append(": ");
                append(out, entry.getValue(), depth + 1, path);
                shown++;
                if (full(out)) {
                    break;
                }
            }
        } catch (RuntimeException e) {
            out.append("<iteration failed: ").append(e.getClass().getSimpleName()).append('>');
        }
        out.append('}');
    }

    private void appendIterable(StringBuilder out, Iterable<?> iterable, int depth, Set<Object> path) {
        out.append('[');
        int shown = 0;
        try {
            Iterator<?> elements = iterable.iterator();
            while (elements.hasNext()) {
                Object element = elements.next();
                if (shown == limits.maxElements()) {
                    out.append(", ").append(ELLIPSIS);
                    break;
                }
                if (shown > 0) {
                    out.append(", ");
                }
                append(out, element, depth + 1, path);
                shown++;
                if (full(out)) {
                    break;
                }
            }
        } catch (RuntimeException e) {
            out.append("<iteration failed: ").append(e.getClass().getSimpleName()).append('>');
        }
        out.append(']');
    }

    private void appendArray(StringBuilder out, Object array, int depth, Set<Object> path) {
        int length = Array.getLength(array);
        out.append('[');
        for (int i = 0; i < length; i++) {
            if (i == limits.maxElements()) {
                out.append(", ").append(ELLIPSIS).append(length - i).append(" more");
                break;
            }
            if (i > 0) {
                out.append(", ");
            }
            append(out, Array.get(array, i), depth + 1, path);
            if (full(out)) {
                break;
            }
        }
        out.append(']');
    }

    private void appendRecord(StringBuilder out, Object value, int depth, Set<Object> path) {
        out.append(value.getClass().getSimpleName()).append('{');
        RecordComponent[] components = value.getClass().getRecordComponents();
        for (int i = 0; i < components.length && i < limits.maxElements(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            out.append(components[i].getName()).append(": ");
            Method accessor = components[i].getAccessor();
            try {
                accessor.trySetAccessible();
                append(out, accessor.invoke(value), depth + 1, path);
            } catch (ReflectiveOperationException | RuntimeException e) {
                out.append('<').append(e.getClass().getSimpleName()).append('>');
            }
        }
        out.append('}');
    }

    private void appendText(StringBuilder out, Object value) {
        try {
            out.append(value);
        } catch (RuntimeException | StackOverflowError e) {
            out.append('<').append(value.getClass().getName())
                    .append(" toString threw ").append(e.getClass().getSimpleName()).append('>');
        }
    }

    private boolean full(StringBuilder out) {
        return out.length() > limits.maxLength();
    }

    private String truncate(StringBuilder out) {
        if (out.length() <= limits.maxLength()) {
            return out.toString();
        }
        return out.substring(0, limits.maxLength() - ELLIPSIS.length()) + ELLIPSIS;
    }
}
