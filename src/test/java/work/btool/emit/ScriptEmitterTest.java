package work.btool.emit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.btool.loader.RunscriptLoader;
import work.btool.resolve.DispatchBatch;
import work.btool.resolve.ResolutionResult;
import work.btool.resolve.RunDescriptor;
import work.btool.resolve.RunDescriptorGenerator;
import work.btool.shared.Diagnostic;
import work.btool.shared.DiagnosticCollector;
import work.btool.support.BtoolTestSupport;

class ScriptEmitterTest {
    private static final String RUN_A = "output/basic/zuse/results/graphs/clasp-3.3.5-default/a/1";

    @Test
    void writesRunScriptsAndQueueRunners() throws IOException {
        Path root = BtoolTestSupport.copyFixture("example");
        try {
            var diagnostics = new DiagnosticCollector();
            var report = new ScriptEmitter(root, false).emit(resolve(root), diagnostics);

            assertFalse(diagnostics.hasErrors(), () -> diagnostics.all().toString());
            assertEquals(15, report.written());
            assertEquals(0, report.skipped());
            assertEquals(3, report.machineScripts().size());

            Path runScript = root.resolve(RUN_A).resolve(ScriptEmitter.RUN_SCRIPT);
            String script = Files.readString(runScript);
            assertTrue(script.contains("# basic/zuse default a run 1"), script);
            assertTrue(script.contains("--time-limit=120 --space-limit=2000"), script);
            assertTrue(script.contains("/programs/clasp-3.3.5\" --stats -q 0 -c n=4 \""), script);
            assertTrue(script.contains("benchmarks/graphs/a.lp\" \""), script);
            assertTrue(script.contains("encodings/base.lp\" \""), script);
            assertTrue(Files.isExecutable(runScript));

            String queue = Files.readString(root.resolve("output/basic/zuse/start.sh"));
            assertTrue(queue.contains("-P 2"), queue);
            assertTrue(queue.contains("results/graphs/clasp-3.3.5-default/a/1/start.sh\nresults/graphs/clasp-3.3.5-default/b/1/start.sh"), queue);
        } finally {
            BtoolTestSupport.deleteTree(root);
        }
    }

    @Test
    void writesOneDistScriptPerBatch() throws IOException {
        Path root = BtoolTestSupport.copyFixture("example");
        try {
            new ScriptEmitter(root, false).emit(resolve(root), new DiagnosticCollector());

            Path machine = root.resolve("output/sweep/zuse");
            String submit = Files.readString(machine.resolve(ScriptEmitter.RUN_SCRIPT));
            assertTrue(submit.contains("sbatch \"start0000.dist\"\nsbatch \"start0001.dist\""), submit);
            assertTrue(submit.contains("sbatch \"start0003.dist\""), submit);
            assertFalse(Files.exists(machine.resolve("start0004.dist")));

            String dist = Files.readString(machine.resolve("start0000.dist"));
            assertTrue(dist.contains("#SBATCH --time=02:00:00"), dist);
            assertTrue(dist.contains("#SBATCH --cpus-per-task=4"), dist);
            assertTrue(dist.contains("#SBATCH --partition=short"), dist);
            assertTrue(dist.contains("\"results/graphs/clasp-3.3.5-sweep_luby_1/a/1/start.sh\""), dist);
            assertTrue(dist.contains("\"${jobs[@]}\""), dist);
        } finally {
            BtoolTestSupport.deleteTree(root);
        }
    }

    @Test
    void excludeSkipsFinishedRuns() throws IOException {
        Path root = BtoolTestSupport.copyFixture("example");
        try {
            BtoolTestSupport.touch(root, RUN_A + "/" + ScriptEmitter.FINISHED_MARKER);

            var report = new ScriptEmitter(root, true).emit(resolve(root), new DiagnosticCollector());

            assertEquals(14, report.written());
            assertEquals(1, report.skipped());
            assertFalse(Files.exists(root.resolve(RUN_A).resolve(ScriptEmitter.RUN_SCRIPT)));
            String queue = Files.readString(root.resolve("output/basic/zuse/start.sh"));
            assertFalse(queue.contains("/a/1/start.sh"), queue);
        } finally {
            BtoolTestSupport.deleteTree(root);
        }
    }

    @Test
    void missingTemplatesFailTheirProjects() throws IOException {
        Path root = BtoolTestSupport.copyFixture("example");
        try {
            var resolution = resolve(root);
            Files.delete(root.resolve("templates/seq-generic.sh"));
            var diagnostics = new DiagnosticCollector();

            var report = new ScriptEmitter(root, false).emit(resolution, diagnostics);

            assertEquals(0, report.written());
            assertEquals(3, diagnostics.errors().size());
            assertTrue(diagnostics.errors().stream().allMatch(d -> d.category() == Diagnostic.Category.FILESYSTEM));
            assertFalse(Files.exists(root.resolve("output")));
        } finally {
            BtoolTestSupport.deleteTree(root);
        }
    }

    @Test
    void unknownPlaceholdersAreStructuralErrors() throws IOException {
        Path root = BtoolTestSupport.copyFixture("example");
        try {
            Files.writeString(root.resolve("templates/seq-generic.sh"), "#!/bin/bash\n{run.nope}\n");
            var diagnostics = new DiagnosticCollector();

            new ScriptEmitter(root, false).emit(resolve(root), diagnostics);

            var error = diagnostics.errors().get(0);
            assertEquals(Diagnostic.Category.STRUCTURAL, error.category());
            assertEquals("project 'basic'", error.scope());
            assertTrue(error.message().contains("run.nope"), error.message());
        } finally {
            BtoolTestSupport.deleteTree(root);
        }
    }

    @Test
    void distOptionsBecomeSbatchLines() {
        assertEquals("", ScriptEmitter.sbatchOptions("  "));
        assertEquals("#SBATCH --mem=4G\n#SBATCH --exclusive\n", ScriptEmitter.sbatchOptions("--mem=4G --exclusive"));
    }

    @Test
    void distValuesQuoteRunScriptsRelativeToTheMachine() {
        Path machine = Path.of("/out/p/m");
        var run = new RunDescriptor(
            "p", "m", "b", "clasp", "1", "s", ".", "i", 1,
            List.of(Path.of("/bench/i.lp")), List.of(), List.of(), List.of(),
            Duration.ofMinutes(5), 100, machine.resolve("results/b/clasp-1-s/i/1"),
            Path.of("/t.sh"), "templates/single.dist", ""
        );
        var batch = new DispatchBatch("m", List.of(run), Duration.ofMinutes(90), "kr", 2, "templates/single.dist", "--mem=1G");

        var values = ScriptEmitter.distValues(batch, machine);

        assertEquals("01:30:00", values.get("walltime"));
        assertEquals("\"results/b/clasp-1-s/i/1/start.sh\"", values.get("jobs"));
        assertEquals("#SBATCH --mem=1G\n", values.get("dist_options"));
    }

    private static ResolutionResult resolve(Path root) {
        return RunDescriptorGenerator.resolve(RunscriptLoader.load(root.resolve("runscript.yml")));
    }
}
