package work.btool.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.btool.loader.RunscriptLoader;
import work.btool.model.Runscript;
import work.btool.shared.Diagnostic;
import work.btool.support.BtoolTestSupport;

class RunDescriptorGeneratorTest {
    @Test
    void resolvesRunTagsIntoOneRunPerInstance() {
        withExample("", (root, runscript) -> {
            var result = RunDescriptorGenerator.resolve(runscript);
            var basic = plan(result, "basic");

            assertEquals(ProjectPlan.Status.RESOLVED, basic.status());
            assertEquals(List.of("a", "b"), basic.runs().stream().map(RunDescriptor::instance).toList());
            var run = basic.runs().get(0);
            assertEquals(
                root.resolve("output/basic/zuse/results/graphs/clasp-3.3.5-default/a/1"),
                run.outputPath()
            );
            assertEquals(List.of("--stats", "-q 0", "-c n=4"), run.cmdline());
            assertEquals(
                List.of(root.resolve("encodings/base.lp"), root.resolve("encodings/heur.lp")),
                run.encodings()
            );
            assertEquals(List.of(root.resolve("benchmarks/graphs/a.lp")), run.files());
            assertEquals(root.resolve("templates/seq-generic.sh"), run.template());
            assertTrue(basic.batches().isEmpty());
            assertFalse(result.hasErrors(), () -> result.errors().toString());
        });
    }

    @Test
    void runSpecNamingAFamilySelectsEveryMember() {
        withExample("", (root, runscript) -> {
            var sweep = plan(RunDescriptorGenerator.resolve(runscript), "sweep");

            assertEquals(8, sweep.runs().size());
            assertEquals(
                List.of("sweep_geom_1", "sweep_geom_2", "sweep_luby_1", "sweep_luby_2"),
                sweep.runs().stream().map(RunDescriptor::setting).distinct().sorted().toList()
            );
            var run = sweep.runs().stream().filter(r -> r.setting().equals("sweep_geom_2")).findFirst().orElseThrow();
            assertEquals(List.of("--stats", "--restarts=geom --seed=2", "-c n=4"), run.cmdline());
            assertEquals(List.of(root.resolve("encodings/base.lp")), run.encodings());
        });
    }

    @Test
    void distributedProjectsAreBatchedPerSetting() {
        withExample("", (root, runscript) -> {
            var sweep = plan(RunDescriptorGenerator.resolve(runscript), "sweep");

            assertTrue(sweep.isDistributed());
            assertEquals(4, sweep.batches().size());
            for (DispatchBatch batch : sweep.batches()) {
                assertEquals(2, batch.runs().size());
                assertEquals(1, batch.runs().stream().map(RunDescriptor::setting).distinct().count());
                assertEquals("short", batch.partition());
                assertEquals(4, batch.cpt());
            }
        });
    }

    @Test
    void specBenchmarksUseTheFirstSpecFileOnEachPath() {
        withExample("", (root, runscript) -> {
            var puzzles = plan(RunDescriptorGenerator.resolve(runscript), "puzzles");

            assertEquals(5, puzzles.runs().size());
            assertTrue(puzzles.runs().stream().allMatch(r -> r.benchmarkClass().equals("sudoku/easy")));
            assertEquals(
                root.resolve("output/puzzles/zuse/results/puzzles/clasp-3.3.5-default/sudoku/easy/s1/1"),
                puzzles.runs().get(0).outputPath()
            );
        });
    }

    @Test
    void brokenProjectsDoNotAffectTheOthers() {
        String broken = """
              - name: broken
                job: seq
                runspecs:
                  - machine: nowhere
                    benchmark: graphs
                    system: clasp
                    version: "9.9"
                    setting: default
                  - machine: zuse
                    benchmark: graphs
                    system: gringo
                    version: "1"
                    setting: default
            """;
        withExample(broken, (root, runscript) -> {
            var result = RunDescriptorGenerator.resolve(runscript);

            var failed = plan(result, "broken");
            assertTrue(failed.isFailed());
            assertTrue(failed.runs().isEmpty());
            assertEquals(List.of(failed), result.failedPlans());
            assertEquals(2, plan(result, "basic").runs().size());
            assertEquals(8, plan(result, "sweep").runs().size());

            var messages = result.errors().stream().map(Diagnostic::message).toList();
            assertEquals(3, messages.size());
            assertTrue(messages.get(0).contains("undeclared machine 'nowhere'"), messages.get(0));
            assertTrue(messages.get(1).contains("undeclared version '9.9' of system 'clasp'"), messages.get(1));
            assertTrue(messages.get(2).contains("undeclared system 'gringo'"), messages.get(2));
            assertTrue(result.errors().stream().allMatch(d -> d.scope().equals("project 'broken'")));
        });
    }

    @Test
    void missingBenchmarkFoldersOnlySkipTheSelectorsUsingThem() {
        String extra = """
              - name: mixed
                job: seq
                runtags:
                  - machine: zuse
                    benchmark: graphs
                    tag: basic
                  - machine: zuse
                    benchmark: lost
                    tag: basic
            """;
        withExample(extra, (root, runscript) -> {
            var result = RunDescriptorGenerator.resolve(runscript);

            var mixed = plan(result, "mixed");
            assertEquals(ProjectPlan.Status.RESOLVED, mixed.status());
            assertEquals(List.of("a", "b"), mixed.runs().stream().map(RunDescriptor::instance).toList());
            assertEquals(2, plan(result, "basic").runs().size());

            assertEquals(1, result.errors().size());
            assertEquals("benchmark 'lost'", result.errors().get(0).scope());
            assertEquals(Diagnostic.Category.FILESYSTEM, result.errors().get(0).category());
            assertEquals(1, result.warnings().size());
            assertEquals("project 'mixed'", result.warnings().get(0).scope());
            assertTrue(result.warnings().get(0).message().contains("benchmark 'lost'"));
        }, """
              - name: lost
                folders:
                  - path: benchmarks/lost
            """);
    }

    @Test
    void distinctRunsSharingAnOutputPathRejectTheProject() {
        String extra = """
              - name: clash
                job: seq
                runtags:
                  - machine: zuse
                    benchmark: clash
                    tag: basic
            """;
        withExample(extra, (root, runscript) -> {
            BtoolTestSupport.write(root, "benchmarks/clash/spec.toml", """
                [[class]]
                name = "c"

                [[class.folder]]
                path = "."

                [[class]]
                name = "c/sub"

                [[class.folder]]
                path = "sub"
                """);
            BtoolTestSupport.touch(root, "benchmarks/clash/sub/i.lp");

            var result = RunDescriptorGenerator.resolve(runscript);

            assertTrue(plan(result, "clash").isFailed());
            assertEquals(2, plan(result, "basic").runs().size());
            assertEquals(1, result.errors().size());
            var error = result.errors().get(0);
            assertEquals(Diagnostic.Category.STRUCTURAL, error.category());
            assertEquals("project 'clash'", error.scope());
            assertTrue(error.message().contains("share the output path"), error.message());
        }, """
              - name: clash
                specs:
                  - path: benchmarks/clash
            """);
    }

    @Test
    void emptySelectionsAreWarnings() {
        String extra = """
              - name: nothing
                job: seq
                runtags:
                  - machine: zuse
                    benchmark: graphs
                    tag: missing-tag
            """;
        withExample(extra, (root, runscript) -> {
            var result = RunDescriptorGenerator.resolve(runscript);

            var nothing = plan(result, "nothing");
            assertEquals(ProjectPlan.Status.RESOLVED, nothing.status());
            assertTrue(nothing.runs().isEmpty());
            assertFalse(result.hasErrors());
            assertEquals(1, result.warnings().size());
            assertTrue(result.warnings().get(0).message().contains("selects no setting"));
        });
    }

    @Test
    void generatedMembersAndDuplicateSelectionsResolveOnce() {
        String extra = """
              - name: picked
                job: seq
                runtags:
                  - machine: zuse
                    benchmark: graphs
                    tag: basic
                runspecs:
                  - machine: zuse
                    benchmark: graphs
                    system: clasp
                    version: "3.3.5"
                    setting: default
                  - machine: zuse
                    benchmark: graphs
                    system: clasp
                    version: "3.3.5"
                    setting: sweep_luby_2
            """;
        withExample(extra, (root, runscript) -> {
            var picked = plan(RunDescriptorGenerator.resolve(runscript), "picked");

            assertEquals(
                List.of("default", "default", "sweep_luby_2", "sweep_luby_2"),
                picked.runs().stream().map(RunDescriptor::setting).toList()
            );
        });
    }

    @Test
    void undeclaredSettingsAreReferenceErrors() {
        String extra = """
              - name: typo
                job: seq
                runspecs:
                  - machine: zuse
                    benchmark: graphs
                    system: clasp
                    version: "3.3.5"
                    setting: sweep_luby_3
            """;
        withExample(extra, (root, runscript) -> {
            var result = RunDescriptorGenerator.resolve(runscript);

            assertTrue(plan(result, "typo").isFailed());
            var error = result.errors().get(0);
            assertEquals(Diagnostic.Category.REFERENCE, error.category());
            assertTrue(error.message().contains("undeclared setting 'sweep_luby_3' of system 'clasp-3.3.5'"), error.message());
        });
    }

    @Test
    void resolvingTwiceYieldsIdenticalRuns() {
        withExample("", (root, runscript) -> {
            var first = RunDescriptorGenerator.resolve(runscript);
            var second = RunDescriptorGenerator.resolve(RunscriptLoader.load(root.resolve("runscript.yml")));

            assertEquals(first.runs(), second.runs());
            assertEquals(
                first.plans().stream().map(ProjectPlan::batches).toList(),
                second.plans().stream().map(ProjectPlan::batches).toList()
            );
        });
    }

    private static ProjectPlan plan(ResolutionResult result, String project) {
        return result.plans().stream().filter(p -> p.project().equals(project)).findFirst().orElseThrow();
    }

    private static void withExample(String extraProjects, ExampleTest test) {
        withExample(extraProjects, test, "");
    }

    /**
     * Runs {@code test} against a copy of the example runscript with extra projects appended and
     * extra benchmarks spliced in.
     */
    private static void withExample(String extraProjects, ExampleTest test, String extraBenchmarks) {
        Path root = BtoolTestSupport.copyFixture("example");
        try {
            Path file = root.resolve("runscript.yml");
            if (!extraBenchmarks.isEmpty()) {
                String text = Files.readString(file);
                Files.writeString(file, text.replace("\nprojects:\n", "\n" + extraBenchmarks + "\nprojects:\n"));
            }
            if (!extraProjects.isEmpty()) {
                Files.writeString(file, extraProjects, StandardOpenOption.APPEND);
            }
            test.accept(root, RunscriptLoader.load(file));
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        } finally {
            BtoolTestSupport.deleteTree(root);
        }
    }

    @FunctionalInterface
    private interface ExampleTest {
        void accept(Path root, Runscript runscript);
    }
}
