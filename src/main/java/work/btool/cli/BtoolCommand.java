package work.btool.cli;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.btool.api.BenchmarkToolRunner;
import work.btool.api.GenerationConfiguration;
import work.btool.api.GenerationResult;
import work.btool.emit.ScriptEmitter;
import work.btool.export.PlanExporter;
import work.btool.loader.SpecFile;
import work.btool.shared.LoggingSupport;
import work.btool.verify.RunlimVerifier;

@CommandLine.Command(
    name = "btool",
    description = "Resolve benchmark runscripts into run scripts and dispatch batches.",
    mixinStandardHelpOptions = true,
    versionProvider = BtoolCommand.Version.class,
    subcommands = {
        BtoolCommand.GenCommand.class,
        BtoolCommand.PlanCommand.class,
        BtoolCommand.VerifyCommand.class
    }
)
final class BtoolCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand (gen, plan or verify).");
    }

    /** Tool version from the jar manifest, plus the input formats and the running JVM. */
    static final class Version implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            String implementationVersion = BtoolCommand.class.getPackage().getImplementationVersion();
            return new String[] {
                "btool " + (implementationVersion != null ? implementationVersion : "development"),
                "runscripts: YAML, JSON; spec files: " + SpecFile.FILE_NAME + " (TOML)",
                "JVM: " + System.getProperty("java.version") + " (" + System.getProperty("java.vendor") + ")"
            };
        }
    }

    static Path existingRunscript(CommandLine commandLine, Path runscript) {
        Path path = runscript.toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new CommandLine.ParameterException(commandLine, "Runscript not found: " + path);
        }
        return path;
    }

    @CommandLine.Command(
        name = "gen",
        description = "Write start scripts for every run of the runscript.",
        mixinStandardHelpOptions = true,
        versionProvider = BtoolCommand.Version.class
    )
    static final class GenCommand implements Callable<Integer> {
        @CommandLine.Spec
        private CommandLine.Model.CommandSpec spec;

        @CommandLine.Mixin
        private LogLevelOption logLevel = new LogLevelOption();

        @CommandLine.Parameters(index = "0", paramLabel = "RUNSCRIPT", description = "Runscript (YAML or JSON).")
        private Path runscript;

        @CommandLine.Option(names = {"-e", "--exclude"}, description = "Skip runs that already finished.")
        private boolean exclude;

        @Override
        public Integer call() {
            var configuration = GenerationConfiguration.builder()
                .runscript(existingRunscript(spec.commandLine(), runscript))
                .mode(GenerationConfiguration.Mode.GENERATE)
                .exclude(exclude)
                .logLevel(logLevel.resolve())
                .build();
            GenerationResult result = new BenchmarkToolRunner().run(configuration);
            spec.commandLine().getOut().println(result.toPrettyJson());
            return result.status().exitCode();
        }
    }

    @CommandLine.Command(
        name = "plan",
        description = "Resolve the runscript and print the runs (and dispatch batches) without writing scripts.",
        mixinStandardHelpOptions = true,
        versionProvider = BtoolCommand.Version.class,
        showDefaultValues = true
    )
    static final class PlanCommand implements Callable<Integer> {
        @CommandLine.Spec
        private CommandLine.Model.CommandSpec spec;

        @CommandLine.Mixin
        private LogLevelOption logLevel = new LogLevelOption();

        @CommandLine.Parameters(index = "0", paramLabel = "RUNSCRIPT", description = "Runscript (YAML or JSON).")
        private Path runscript;

        @CommandLine.Option(names = {"-f", "--format"}, description = "Output format (json|csv).", defaultValue = "json")
        private String format;

        @Override
        public Integer call() {
            PlanExporter.Format planFormat;
            try {
                planFormat = PlanExporter.Format.from(format);
            } catch (IllegalArgumentException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
            }
            var configuration = GenerationConfiguration.builder()
                .runscript(existingRunscript(spec.commandLine(), runscript))
                .mode(GenerationConfiguration.Mode.PLAN)
                .planFormat(planFormat)
                .logLevel(logLevel.resolve())
                .build();
            GenerationResult result = new BenchmarkToolRunner().run(configuration);
            PrintWriter out = spec.commandLine().getOut();
            if (result.resolution().isPresent()) {
                out.print(PlanExporter.export(result.resolution().get(), planFormat));
                out.flush();
            } else {
                spec.commandLine().getErr().println(result.toPrettyJson());
            }
            return result.status().exitCode();
        }
    }

    @CommandLine.Command(
        name = "verify",
        description = "Find runs with runlim errors and clear their completion markers so they run again.",
        mixinStandardHelpOptions = true,
        versionProvider = BtoolCommand.Version.class
    )
    static final class VerifyCommand implements Callable<Integer> {
        @CommandLine.Spec
        private CommandLine.Model.CommandSpec spec;

        @CommandLine.Mixin
        private LogLevelOption logLevel = new LogLevelOption();

        @CommandLine.Parameters(index = "0", paramLabel = "FOLDER", description = "Folder holding the benchmark results.")
        private Path folder;

        @Override
        public Integer call() {
            LoggingSupport.apply(logLevel.resolve());
            if (!Files.isDirectory(folder)) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Folder does not exist: " + folder);
            }
            var report = RunlimVerifier.verify(folder);
            PrintWriter out = spec.commandLine().getOut();
            if (!report.foundErrors()) {
                out.println("No runlim errors found");
            }
            report.removed().forEach(dir -> out.println("Removed: " + dir.resolve(ScriptEmitter.FINISHED_MARKER)));
            report.pending().forEach(dir -> out.println("Pending: " + dir));
            out.flush();
            return 0;
        }
    }
}
