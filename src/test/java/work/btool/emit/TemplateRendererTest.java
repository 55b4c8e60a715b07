package work.btool.emit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class TemplateRendererTest {
    @Test
    void substitutesPlaceholders() {
        assertEquals(
            "runlim --time-limit=120 clasp",
            TemplateRenderer.render("runlim --time-limit={run.timeout} { run.solver }", Map.of("run.timeout", 120, "run.solver", "clasp"))
        );
    }

    @Test
    void doubledBracesAreLiteral() {
        assertEquals("\"${jobs[@]}\"", TemplateRenderer.render("\"${{jobs[@]}}\"", Map.of()));
    }

    @Test
    void unknownPlaceholdersAreReportedTogether() {
        var error = assertThrows(
            IllegalArgumentException.class,
            () -> TemplateRenderer.render("{a} {b} {c}", Map.of("b", "x"))
        );
        assertTrue(error.getMessage().endsWith("a, c"), error.getMessage());
    }

    @Test
    void keepsAnUnterminatedBrace() {
        assertEquals("x {y", TemplateRenderer.render("x {y", Map.of()));
    }
}
