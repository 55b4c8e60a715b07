package work.btool.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class DiagnosticCollectorTest {
    @Test
    void separatesErrorsFromWarnings() {
        var collector = new DiagnosticCollector();
        collector.warning(Diagnostic.Category.REFERENCE, "project 'p'", "runtag selects no setting");
        assertFalse(collector.hasErrors());

        collector.record("project 'p'", ConfigurationException.reference("undeclared machine 'm'"));
        assertTrue(collector.hasErrors());
        assertEquals(1, collector.errors().size());
        assertEquals(1, collector.warnings().size());
        assertEquals(2, collector.size());
    }

    @Test
    void formatsWithSeverityCategoryAndScope() {
        var diagnostic = new Diagnostic(
            Diagnostic.Severity.ERROR,
            Diagnostic.Category.FILESYSTEM,
            "benchmark 'b'",
            "folder 'x' does not exist"
        );
        assertEquals("error [filesystem] benchmark 'b': folder 'x' does not exist", diagnostic.format());
        assertEquals("filesystem", diagnostic.toSerializableMap().get("category"));
    }
}
