package work.btool.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.btool.model.Benchmark;
import work.btool.model.BenchmarkSource;
import work.btool.model.Instance;
import work.btool.model.InstanceAttributes;
import work.btool.shared.ConfigurationException;
import work.btool.shared.Diagnostic;
import work.btool.shared.DiagnosticCollector;
import work.btool.support.BtoolTestSupport;

class BenchmarkResolverTest {
    @Test
    void folderInstancesAreFiledUnderTheirDirectory() {
        Path root = BtoolTestSupport.tempDir();
        try {
            BtoolTestSupport.touch(root, "b.lp", "a.lp", "hard/c.lp");
            var benchmark = new Benchmark("bench", List.of(new BenchmarkSource.FolderSource(
                root, false, List.of(), new InstanceAttributes(null, null, Set.of("x"), null), List.of()
            )));

            var resolved = new BenchmarkResolver(new DiagnosticCollector()).resolve(benchmark).orElseThrow();

            assertEquals(List.of(".", "hard"), List.copyOf(resolved.classes().keySet()));
            assertEquals(List.of("a", "b", "c"), resolved.instances().stream().map(Instance::name).toList());
            assertEquals(Set.of("x"), resolved.instances().get(2).attributes().tags());
        } finally {
            BtoolTestSupport.deleteTree(root);
        }
    }

    @Test
    void filesEntriesSharingAGroupFormOneInstance() {
        Path root = BtoolTestSupport.tempDir();
        try {
            BtoolTestSupport.touch(root, "x/p.lp", "x/q.lp", "r.lp");
            var benchmark = new Benchmark("bench", List.of(new BenchmarkSource.FilesSource(
                root,
                List.of(
                    new BenchmarkSource.FileEntry(Path.of("x/q.lp"), "pair", new InstanceAttributes("--q", null, null, null)),
                    new BenchmarkSource.FileEntry(Path.of("x/p.lp"), "pair", null),
                    new BenchmarkSource.FileEntry(Path.of("r.lp"), null, null)
                ),
                null,
                List.of()
            )));

            var resolved = new BenchmarkResolver(new DiagnosticCollector()).resolve(benchmark).orElseThrow();

            Instance pair = resolved.classes().get("x").get(0);
            assertEquals("pair", pair.name());
            assertTrue(pair.isGrouped());
            assertEquals(root.resolve("x/q.lp"), pair.files().get(0).path());
            assertEquals("--q", pair.files().get(0).cmdline());
            assertEquals(root.resolve("x/p.lp"), pair.files().get(1).path());
            assertEquals("r", resolved.classes().get(".").get(0).name());
        } finally {
            BtoolTestSupport.deleteTree(root);
        }
    }

    @Test
    void groupMembersContributeCommandLinesInDeclarationOrder() {
        Path root = BtoolTestSupport.tempDir();
        try {
            BtoolTestSupport.touch(root, "x/p.lp", "x/q.lp");
            var benchmark = new Benchmark("bench", List.of(new BenchmarkSource.FilesSource(
                root,
                List.of(
                    new BenchmarkSource.FileEntry(Path.of("x/q.lp"), "pair", new InstanceAttributes("--declared-first", null, null, null)),
                    new BenchmarkSource.FileEntry(Path.of("x/p.lp"), "pair", new InstanceAttributes("--declared-second", null, null, null))
                ),
                null,
                List.of()
            )));

            Instance pair = new BenchmarkResolver(new DiagnosticCollector()).resolve(benchmark).orElseThrow().classes().get("x").get(0);
            var system = BtoolTestSupport.system("clasp", "1", null, List.of());
            var composed = CommandLineComposer.compose(system, BtoolTestSupport.setting("s", (String) null, Set.of()), pair);

            assertEquals(List.of("--declared-first", "--declared-second"), composed.pre());
        } finally {
            BtoolTestSupport.deleteTree(root);
        }
    }

    @Test
    void groupsSpanningDirectoriesAreRejected() {
        Path root = BtoolTestSupport.tempDir();
        try {
            BtoolTestSupport.touch(root, "x/p.lp", "y/q.lp");
            var benchmark = new Benchmark("bench", List.of(new BenchmarkSource.FilesSource(
                root,
                List.of(
                    new BenchmarkSource.FileEntry(Path.of("x/p.lp"), "pair", null),
                    new BenchmarkSource.FileEntry(Path.of("y/q.lp"), "pair", null)
                ),
                null,
                List.of()
            )));

            var error = assertThrows(ConfigurationException.class, () -> BenchmarkResolver.materialize(benchmark));
            assertEquals(Diagnostic.Category.STRUCTURAL, error.category());
        } finally {
            BtoolTestSupport.deleteTree(root);
        }
    }

    @Test
    void failuresAreReportedOnceInTheBenchmarkScope() {
        Path root = BtoolTestSupport.tempDir();
        try {
            var diagnostics = new DiagnosticCollector();
            var resolver = new BenchmarkResolver(diagnostics);
            var benchmark = new Benchmark("broken", List.of(new BenchmarkSource.FolderSource(
                root.resolve("missing"), false, null, null, null
            )));

            assertTrue(resolver.resolve(benchmark).isEmpty());
            assertTrue(resolver.resolve(benchmark).isEmpty());

            assertEquals(1, diagnostics.errors().size());
            assertEquals(Diagnostic.Category.FILESYSTEM, diagnostics.errors().get(0).category());
            assertEquals("benchmark 'broken'", diagnostics.errors().get(0).scope());
        } finally {
            BtoolTestSupport.deleteTree(root);
        }
    }

    @Test
    void resolvesEachBenchmarkOnceAndWarnsWhenEmpty() {
        Path root = BtoolTestSupport.tempDir();
        try {
            var diagnostics = new DiagnosticCollector();
            var resolver = new BenchmarkResolver(diagnostics);
            var benchmark = new Benchmark("empty", List.of(new BenchmarkSource.FolderSource(root, false, null, null, null)));

            var first = resolver.resolve(benchmark).orElseThrow();

            assertSame(first, resolver.resolve(benchmark).orElseThrow());
            assertTrue(first.isEmpty());
            assertEquals(1, diagnostics.warnings().size());
        } finally {
            BtoolTestSupport.deleteTree(root);
        }
    }
}
