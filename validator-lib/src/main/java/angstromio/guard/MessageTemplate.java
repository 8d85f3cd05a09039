package angstromio.guard;

/**
 * Failure message rendering. A template may contain {@value #MARKER} any number of times; each
 * occurrence is replaced with a diagnostic rendering of the rejected value. No other syntax is
 * recognised.
 */
public final class MessageTemplate {

    /**
     * The substitution token for the rejected value.
     */
    public static final String MARKER = "${validatedValue}";

    private static final ValueRenderer DEFAULT_RENDERER = new ValueRenderer(RenderLimits.DEFAULT);

    private MessageTemplate() {
        // Utility
    }

    /**
     * Renders a template with {@link RenderLimits#DEFAULT}.
     *
     * @param template message template, {@code null} is treated as empty.
     * @param value    the rejected value.
     * @return the rendered message; the template itself when it has no marker.
     */
    public static String render(String template, Object value) {
        return render(template, value, DEFAULT_RENDERER);
    }

    public static String render(String template, Object value, ValueRenderer renderer) {
        if (template == null) {
            return "";
        }
        if (!template.contains(MARKER)) {
            return template;
        }
        return template.replace(MARKER, renderer.render(value));
    }
}
