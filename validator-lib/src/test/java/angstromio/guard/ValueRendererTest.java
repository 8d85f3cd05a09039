package angstromio.guard;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ValueRendererTest {

    private final ValueRenderer renderer = new ValueRenderer(RenderLimits.DEFAULT);

    record Point(int x, int y) {
    }

    record Faulty(String name) {
        @Override
        public String name() {
            throw new UnsupportedOperationException();
        }
    }

    enum Gear { LOW, HIGH }

    @Test
    public void testScalars() {
        assertEquals("null", renderer.render(null));
        assertEquals("'text'", renderer.render("text"));
        assertEquals("'c'", renderer.render('c'));
        assertEquals("42", renderer.render(42));
        assertEquals("-2000.5", renderer.render(-2000.5));
        assertEquals("true", renderer.render(true));
        assertEquals("Gear.HIGH", renderer.render(Gear.HIGH));
        assertEquals("java.lang.String", renderer.render(String.class));
        assertEquals("Optional[1]", renderer.render(Optional.of(1)));
        assertEquals("Optional.empty", renderer.render(Optional.empty()));
    }

    @Test
    public void testContainers() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("flag1", true);
        settings.put("speed", 1000);

        assertEquals("{'flag1': true, 'speed': 1000}", renderer.render(settings));
        assertEquals("[1, 'two', null]", renderer.render(java.util.Arrays.asList(1, "two", null)));
        assertEquals("[1, 2, 3]", renderer.render(new int[]{1, 2, 3}));
        assertEquals("Point{x: 1, y: 2}", renderer.render(new Point(1, 2)));
    }

    @Test
    public void testRecordAccessorFailure() {
        assertEquals("Faulty{name: <InvocationTargetException>}", renderer.render(new Faulty("n")));
    }

    @Test
    public void testDepthLimit() {
        ValueRenderer shallow = new ValueRenderer(new RenderLimits(1, 32, 1024));
        assertEquals("[[ArrayList]]", shallow.render(List.of(new ArrayList<>(List.of(new ArrayList<>())))));
    }

    @Test
    public void testElementLimit() {
        ValueRenderer few = new ValueRenderer(new RenderLimits(4, 3, 1024));
        List<Integer> numbers = IntStream.range(0, 10).boxed().toList();

        assertEquals("[0, 1, 2, ...]", few.render(numbers));
        assertEquals("[0, 1, 2, ...7 more]", few.render(new int[]{0, 1, 2, 3, 4, 5, 6, 7, 8, 9}));
    }

    @Test
    public void testLengthLimit() {
        ValueRenderer tight = new ValueRenderer(new RenderLimits(4, 32, 16));
        String rendered = tight.render("a".repeat(100));

        assertEquals(16, rendered.length());
        assertTrue(rendered.endsWith("..."));
    }

    @Test
    public void testDeeplyNestedSelfReferenceTerminates() {
        List<Object> outer = new ArrayList<>();
        List<Object> current = outer;
        for (int i = 0; i < 10_000; i++) {
            List<Object> next = new ArrayList<>();
            current.add(next);
            current = next;
        }
        current.add(outer);

        String rendered = renderer.render(outer);
        assertTrue(rendered.startsWith("[[[["));
    }

    @Test
    public void testInvalidLimits() {
        assertThrows(IllegalArgumentException.class, () -> new RenderLimits(-1, 1, 64));
        assertThrows(IllegalArgumentException.class, () -> new RenderLimits(1, 0, 64));
        assertThrows(IllegalArgumentException.class, () -> new RenderLimits(1, 1, 2));
    }
}
