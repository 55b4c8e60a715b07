package work.btool.resolve;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.btool.model.Benchmark;
import work.btool.model.DistJob;
import work.btool.model.Instance;
import work.btool.model.InstanceFile;
import work.btool.model.Job;
import work.btool.model.Project;
import work.btool.model.ResolvedBenchmark;
import work.btool.model.RunSelector;
import work.btool.model.RunSpec;
import work.btool.model.RunTag;
import work.btool.model.Runscript;
import work.btool.model.Setting;
import work.btool.model.SystemSpec;
import work.btool.shared.ConfigurationException;
import work.btool.shared.Diagnostic;
import work.btool.shared.DiagnosticCollector;

/**
 * Resolves every project of a runscript into run descriptors. A project first links all of its
 * references; if any of them fails the project is reported with every failing reference and
 * produces no runs, while the other projects are resolved as usual. Selectors on a benchmark whose
 * sources could not be read are skipped with a warning.
 */
public final class RunDescriptorGenerator {
    private static final Logger log = LoggerFactory.getLogger(RunDescriptorGenerator.class);

    private final Runscript runscript;
    private final DiagnosticCollector diagnostics = new DiagnosticCollector();
    private final BenchmarkResolver benchmarks = new BenchmarkResolver(diagnostics);

    private RunDescriptorGenerator(Runscript runscript) {
        this.runscript = runscript;
        diagnostics.addAll(runscript.diagnostics());
    }

    public static ResolutionResult resolve(Runscript runscript) {
        return new RunDescriptorGenerator(runscript).resolveAll();
    }

    private ResolutionResult resolveAll() {
        var plans = new ArrayList<ProjectPlan>();
        for (Project project : runscript.projects().values()) {
            plans.add(resolveProject(project));
        }
        return new ResolutionResult(runscript, plans, diagnostics.all());
    }

    private ProjectPlan resolveProject(Project project) {
        String scope = "project '" + project.name() + "'";
        var errors = new ArrayList<ConfigurationException>();
        Job job = attempt(errors, () -> runscript.jobs().require(project.job(), scope));
        var selections = new ArrayList<Selection>();
        var unavailable = new ArrayList<RunSelector>();
        for (RunSelector selector : project.selectors()) {
            String context = scope + " " + selector.describe();
            attempt(errors, () -> runscript.machines().require(selector.machine(), context));
            Benchmark benchmark = attempt(errors, () -> runscript.benchmarks().require(selector.benchmark(), context));
            List<Pair> pairs = attempt(errors, () -> pairs(selector, context));
            if (benchmark == null) {
                continue;
            }
            var instances = benchmarks.resolve(benchmark);
            if (instances.isEmpty()) {
                unavailable.add(selector);
            } else if (pairs != null) {
                selections.add(new Selection(selector, pairs, instances.get()));
            }
        }
        if (!errors.isEmpty()) {
            return reject(project, job, errors);
        }
        for (RunSelector selector : unavailable) {
            diagnostics.warning(
                Diagnostic.Category.FILESYSTEM,
                scope,
                selector.describe() + " skipped: benchmark '" + selector.benchmark() + "' could not be resolved"
            );
        }

        var runs = new ArrayList<RunDescriptor>();
        var owners = new HashMap<Path, RunKey>();
        for (Selection selection : selections) {
            if (selection.pairs().isEmpty()) {
                diagnostics.warning(Diagnostic.Category.REFERENCE, scope, selection.selector().describe() + " selects no setting");
            }
            for (Pair pair : selection.pairs()) {
                for (Instance instance : selection.instances().instances()) {
                    for (int run = 1; run <= job.runs(); run++) {
                        var descriptor = descriptor(project, job, selection.selector(), selection.instances(), pair, instance, run);
                        var key = RunKey.of(descriptor);
                        var owner = owners.putIfAbsent(descriptor.outputPath(), key);
                        if (owner == null) {
                            runs.add(descriptor);
                        } else if (!owner.equals(key)) {
                            errors.add(ConfigurationException.structural(
                                "runs " + owner + " and " + key + " share the output path '" + descriptor.outputPath() + "'"
                            ));
                        }
                    }
                }
            }
        }
        if (!errors.isEmpty()) {
            return reject(project, job, errors);
        }
        var batches = job instanceof DistJob distJob ? DispatchBatcher.batch(distJob, runs) : List.<DispatchBatch>of();
        log.debug("Project {} resolved to {} runs in {} batches", project.name(), runs.size(), batches.size());
        return new ProjectPlan(project.name(), job, ProjectPlan.Status.RESOLVED, runs, batches);
    }

    private ProjectPlan reject(Project project, Job job, List<ConfigurationException> errors) {
        String scope = "project '" + project.name() + "'";
        errors.forEach(ex -> diagnostics.record(scope, ex));
        log.debug("Project {} rejected with {} errors", project.name(), errors.size());
        return ProjectPlan.failed(project.name(), job);
    }

    private RunDescriptor descriptor(
        Project project,
        Job job,
        RunSelector selector,
        ResolvedBenchmark benchmark,
        Pair pair,
        Instance instance,
        int run
    ) {
        var command = CommandLineComposer.compose(pair.system(), pair.setting(), instance);
        Path output = runscript.output()
            .resolve(project.name())
            .resolve(selector.machine())
            .resolve("results")
            .resolve(benchmark.name())
            .resolve(pair.system().id() + "-" + pair.setting().name())
            .resolve(instance.benchmarkClass())
            .resolve(instance.name())
            .resolve(Integer.toString(run))
            .normalize();
        return new RunDescriptor(
            project.name(),
            selector.machine(),
            benchmark.name(),
            pair.system().name(),
            pair.system().version(),
            pair.setting().name(),
            instance.benchmarkClass(),
            instance.name(),
            run,
            instance.files().stream().map(InstanceFile::path).toList(),
            command.pre(),
            command.post(),
            EncodingResolver.resolve(instance, pair.setting()),
            job.timeout(),
            job.memout(),
            output,
            pair.system().config().template(),
            pair.setting().distTemplate(),
            pair.setting().distOptions()
        );
    }

    private List<Pair> pairs(RunSelector selector, String context) {
        if (selector instanceof RunTag tag) {
            var expression = TagExpression.parse(tag.tagExpression());
            var pairs = new ArrayList<Pair>();
            for (SystemSpec system : runscript.systems().values()) {
                for (Setting declared : system.settings()) {
                    for (Setting setting : VariableExpander.expand(declared)) {
                        if (expression.matches(setting.tags())) {
                            pairs.add(new Pair(system, setting));
                        }
                    }
                }
            }
            return pairs;
        }
        if (selector instanceof RunSpec spec) {
            SystemSpec system = system(spec, context);
            return settings(system, spec.setting(), context).stream().map(s -> new Pair(system, s)).toList();
        }
        throw new IllegalArgumentException("Unsupported selector: " + selector.describe());
    }

    private SystemSpec system(RunSpec spec, String context) {
        String key = SystemSpec.key(spec.system(), spec.version());
        var system = runscript.systems().lookup(key);
        if (system.isPresent()) {
            return system.get();
        }
        if (runscript.systems().isRejected(key)) {
            return runscript.systems().require(key, context);
        }
        boolean known = runscript.systems().values().stream().anyMatch(s -> s.name().equals(spec.system()));
        if (known) {
            throw ConfigurationException.reference(
                context + " references undeclared version '" + spec.version() + "' of system '" + spec.system() + "'"
            );
        }
        throw ConfigurationException.reference(context + " references undeclared system '" + spec.system() + "'");
    }

    /**
     * The setting named {@code name}: a declared setting (its whole family when it has variables)
     * or one generated member of a family.
     */
    private static List<Setting> settings(SystemSpec system, String name, String context) {
        var declared = system.declaredSetting(name);
        if (declared.isPresent()) {
            var family = new ArrayList<Setting>();
            VariableExpander.expand(declared.get()).forEach(family::add);
            return family;
        }
        for (Setting base : system.settings()) {
            if (!base.hasVariables()) {
                continue;
            }
            for (Setting generated : VariableExpander.expand(base)) {
                if (generated.name().equals(name)) {
                    return List.of(generated);
                }
            }
        }
        var rejection = system.settingRejection(name);
        if (rejection.isPresent()) {
            throw ConfigurationException.reference(
                context + " references setting '" + name + "' of system '" + system.id() + "' which was rejected: " + rejection.get()
            );
        }
        throw ConfigurationException.reference(
            context + " references undeclared setting '" + name + "' of system '" + system.id() + "'"
        );
    }

    private static <T> T attempt(List<ConfigurationException> errors, Supplier<T> step) {
        try {
            return step.get();
        } catch (ConfigurationException ex) {
            errors.add(ex);
            return null;
        }
    }

    private record Pair(SystemSpec system, Setting setting) {}

    /** Identity of a run; the same key selected twice is one run. */
    private record RunKey(
        String machine,
        String benchmark,
        String system,
        String version,
        String setting,
        String benchmarkClass,
        String instance,
        int run
    ) {
        static RunKey of(RunDescriptor descriptor) {
            return new RunKey(
                descriptor.machine(),
                descriptor.benchmark(),
                descriptor.system(),
                descriptor.version(),
                descriptor.setting(),
                descriptor.benchmarkClass(),
                descriptor.instance(),
                descriptor.run()
            );
        }

        @Override
        public String toString() {
            return machine + "/" + benchmark + "/" + system + "-" + version + "-" + setting + "/" + benchmarkClass + "/" + instance + "/" + run;
        }
    }

    private record Selection(RunSelector selector, List<Pair> pairs, ResolvedBenchmark instances) {}
}
