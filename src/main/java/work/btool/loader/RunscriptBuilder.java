package work.btool.loader;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.btool.model.Benchmark;
import work.btool.model.BenchmarkSource;
import work.btool.model.Config;
import work.btool.model.DistJob;
import work.btool.model.Encoding;
import work.btool.model.InstanceAttributes;
import work.btool.model.Job;
import work.btool.model.Machine;
import work.btool.model.NamedIndex;
import work.btool.model.Project;
import work.btool.model.RunSelector;
import work.btool.model.RunSpec;
import work.btool.model.RunTag;
import work.btool.model.Runscript;
import work.btool.model.SeqJob;
import work.btool.model.Setting;
import work.btool.model.SystemSpec;
import work.btool.model.VariableDef;
import work.btool.resolve.EncodingResolver;
import work.btool.resolve.VariableExpander;
import work.btool.shared.ConfigurationException;
import work.btool.shared.Diagnostic;
import work.btool.shared.DiagnosticCollector;
import work.btool.shared.DurationParser;

/**
 * Builds the {@link Runscript} model from a raw runscript tree. Entities are indexed by name first;
 * system configs and setting families are linked and validated afterwards. Problems reject the
 * smallest enclosing entity and are collected rather than thrown.
 */
final class RunscriptBuilder {
    private static final Set<String> SEQ_JOB_KEYS = Set.of(
        "name", "timeout", "runs", "memout", "parallel", "template_options"
    );
    private static final Set<String> DIST_JOB_KEYS = Set.of(
        "name", "timeout", "runs", "memout", "script_mode", "walltime", "cpt", "partition", "template_options"
    );

    private final Path baseDir;
    private final DiagnosticCollector diagnostics = new DiagnosticCollector();
    private final NamedIndex<Machine> machines = new NamedIndex<>("machine");
    private final NamedIndex<Config> configs = new NamedIndex<>("config");
    private final NamedIndex<SystemSpec> systems = new NamedIndex<>("system");
    private final NamedIndex<Job> jobs = new NamedIndex<>("job");
    private final NamedIndex<Benchmark> benchmarks = new NamedIndex<>("benchmark");
    private final NamedIndex<Project> projects = new NamedIndex<>("project");

    private RunscriptBuilder(Path baseDir) {
        this.baseDir = baseDir;
    }

    static Runscript build(Map<String, Object> tree, Path baseDir) {
        String output = TreeFields.string(tree, "output");
        if (output == null || output.isBlank()) {
            throw new IllegalArgumentException("Runscript does not declare 'output'");
        }
        var builder = new RunscriptBuilder(baseDir);
        builder.index(tree);
        builder.linkSystems(tree);
        return new Runscript(
            baseDir.resolve(output.trim()).normalize(),
            baseDir,
            builder.machines,
            builder.configs,
            builder.systems,
            builder.jobs,
            builder.benchmarks,
            builder.projects,
            builder.diagnostics.all()
        );
    }

    private void index(Map<String, Object> tree) {
        for (var node : entries(tree, "machines")) {
            declare(machines, node, "machine", name -> new Machine(
                name, TreeFields.string(node, "cpu"), TreeFields.string(node, "memory")
            ));
        }
        for (var node : entries(tree, "configs")) {
            declare(configs, node, "config", name -> new Config(
                name, baseDir.resolve(TreeFields.requireString(node, "template", "config '" + name + "'")).normalize()
            ));
        }
        for (var node : entries(tree, "seqjobs")) {
            declare(jobs, node, "job", name -> seqJob(name, node));
        }
        for (var node : entries(tree, "distjobs")) {
            declare(jobs, node, "job", name -> distJob(name, node));
        }
        for (var node : entries(tree, "benchmarks")) {
            declare(benchmarks, node, "benchmark", name -> benchmark(name, node));
        }
        for (var node : entries(tree, "projects")) {
            declare(projects, node, "project", name -> project(name, node));
        }
    }

    /**
     * Systems are keyed by {@code name-version} and need the configs indexed before them.
     */
    private void linkSystems(Map<String, Object> tree) {
        var list = entries(tree, "systems");
        for (int i = 0; i < list.size(); i++) {
            var node = list.get(i);
            String scope = "systems[" + i + "]";
            String key;
            try {
                String name = TreeFields.requireString(node, "name", scope);
                String version = TreeFields.requireString(node, "version", "system '" + name + "'");
                key = SystemSpec.key(name, version);
            } catch (ConfigurationException ex) {
                diagnostics.record(scope, ex);
                continue;
            }
            String systemScope = "system '" + key + "'";
            SystemSpec system;
            try {
                system = system(key, node);
            } catch (ConfigurationException ex) {
                diagnostics.record(systemScope, ex);
                if (!systems.reject(key, ex.getMessage())) {
                    duplicate(systems, key, systemScope);
                }
                continue;
            }
            if (!systems.register(key, system)) {
                duplicate(systems, key, systemScope);
            }
        }
    }

    private void duplicate(NamedIndex<?> index, String key, String scope) {
        diagnostics.error(Diagnostic.Category.STRUCTURAL, scope, index.rejectionReason(key).orElse("declared more than once"));
    }

    private SystemSpec system(String key, Map<String, Object> node) {
        String scope = "system '" + key + "'";
        String configName = TreeFields.requireString(node, "config", scope);
        Config config = configs.require(configName, scope);
        var rejected = new LinkedHashMap<String, String>();
        var settings = settings(key, node, rejected);
        return new SystemSpec(
            TreeFields.string(node, "name").trim(),
            TreeFields.string(node, "version").trim(),
            TreeFields.string(node, "measures"),
            config,
            TreeFields.string(node, "cmdline"),
            TreeFields.string(node, "cmdline_post"),
            settings,
            rejected
        );
    }

    private List<Setting> settings(String systemKey, Map<String, Object> node, Map<String, String> rejected) {
        var parsed = new ArrayList<Setting>();
        var nodes = TreeFields.mapList(node, "settings", "system '" + systemKey + "'");
        for (int i = 0; i < nodes.size(); i++) {
            var settingNode = nodes.get(i);
            String scope = "system '" + systemKey + "' settings[" + i + "]";
            String name;
            try {
                name = TreeFields.requireString(settingNode, "name", scope);
            } catch (ConfigurationException ex) {
                diagnostics.record(scope, ex);
                continue;
            }
            try {
                parsed.add(setting(name, settingNode, settingScope(systemKey, name)));
            } catch (ConfigurationException ex) {
                reject(rejected, systemKey, name, ex.getMessage(), ex.category());
            }
        }

        var declaredCounts = new HashMap<String, Integer>();
        parsed.forEach(s -> declaredCounts.merge(s.name(), 1, Integer::sum));
        declaredCounts.forEach((name, count) -> {
            if (count > 1) {
                reject(rejected, systemKey, name, "setting '" + name + "' is declared more than once", Diagnostic.Category.STRUCTURAL);
            }
        });

        var owners = new LinkedHashMap<String, List<String>>();
        for (Setting setting : parsed) {
            if (rejected.containsKey(setting.name())) {
                continue;
            }
            try {
                for (Setting concrete : VariableExpander.expand(setting)) {
                    owners.computeIfAbsent(concrete.name(), k -> new ArrayList<>()).add(setting.name());
                }
            } catch (ConfigurationException ex) {
                reject(rejected, systemKey, setting.name(), ex.getMessage(), ex.category());
            }
        }
        owners.forEach((generated, bases) -> {
            if (bases.size() > 1) {
                for (String base : new LinkedHashSet<>(bases)) {
                    if (!rejected.containsKey(base)) {
                        reject(rejected, systemKey, base,
                            "setting name '" + generated + "' is produced more than once", Diagnostic.Category.STRUCTURAL);
                    }
                }
            }
        });
        return parsed.stream().filter(s -> !rejected.containsKey(s.name())).toList();
    }

    private void reject(Map<String, String> rejected, String systemKey, String setting, String reason, Diagnostic.Category category) {
        if (rejected.putIfAbsent(setting, reason) == null) {
            diagnostics.error(category, settingScope(systemKey, setting), reason);
        }
    }

    private Setting setting(String name, Map<String, Object> node, String scope) {
        var variables = new ArrayList<VariableDef>();
        for (var variable : TreeFields.mapList(node, "variables", scope)) {
            variables.add(variable(variable, scope));
        }
        var encodings = encodings(node, baseDir, scope);
        warnDuplicateEncodings(encodings, scope);
        var encodingTags = TreeFields.tags(node, "encoding_tag");
        return new Setting(
            name,
            name,
            TreeFields.string(node, "cmdline"),
            TreeFields.string(node, "cmdline_post"),
            TreeFields.tags(node, "tag"),
            encodingTags != null ? encodingTags : TreeFields.tags(node, "enctag"),
            TreeFields.firstString(node, "dist_template", "disttemplate"),
            TreeFields.firstString(node, "dist_options", "distopts"),
            encodings,
            variables
        );
    }

    private static VariableDef variable(Map<String, Object> node, String scope) {
        String cmd = TreeFields.requireString(node, "cmd", scope + " variable");
        Object range = node.get("range");
        Object values = node.get("values");
        if ((range == null) == (values == null)) {
            throw ConfigurationException.structural(
                "variable '" + cmd + "' must declare exactly one of 'range' or 'values'"
            );
        }
        boolean post = TreeFields.bool(node, "post", false, scope + " variable '" + cmd + "'");
        if (range != null) {
            var parts = rangeParts(range);
            if (parts.size() != 3) {
                throw ConfigurationException.structural(
                    "variable '" + cmd + "' declares malformed range '" + String.join(",", parts) + "'"
                );
            }
            return new VariableDef(cmd, new VariableDef.Range(parts.get(0), parts.get(1), parts.get(2)), post);
        }
        var items = new ArrayList<String>();
        if (values instanceof List<?>) {
            items.addAll(TreeFields.stringItems(values));
        } else {
            for (String item : TreeFields.scalar(values).split(";", -1)) {
                items.add(item);
            }
        }
        return new VariableDef(cmd, new VariableDef.Pool(items), post);
    }

    private static List<String> rangeParts(Object range) {
        if (range instanceof List<?>) {
            return TreeFields.stringItems(range).stream().map(String::trim).toList();
        }
        return List.of(TreeFields.scalar(range).split(",", -1)).stream().map(String::trim).toList();
    }

    private Job seqJob(String name, Map<String, Object> node) {
        String scope = "job '" + name + "'";
        return new SeqJob(
            name,
            time(node, "timeout", scope),
            runs(node, scope),
            TreeFields.integer(node, "memout", Job.DEFAULT_MEMOUT, scope),
            positive(TreeFields.integer(node, "parallel", 1, scope), "parallel", scope),
            TreeFields.string(node, "template_options"),
            extraAttributes(node, SEQ_JOB_KEYS)
        );
    }

    private Job distJob(String name, Map<String, Object> node) {
        String scope = "job '" + name + "'";
        DistJob.ScriptMode mode;
        try {
            mode = DistJob.ScriptMode.from(TreeFields.string(node, "script_mode"));
        } catch (IllegalArgumentException ex) {
            throw ConfigurationException.structural(scope + ": " + ex.getMessage());
        }
        return new DistJob(
            name,
            time(node, "timeout", scope),
            runs(node, scope),
            TreeFields.integer(node, "memout", Job.DEFAULT_MEMOUT, scope),
            mode,
            time(node, "walltime", scope),
            positive(TreeFields.integer(node, "cpt", 1, scope), "cpt", scope),
            TreeFields.string(node, "partition"),
            TreeFields.string(node, "template_options"),
            extraAttributes(node, DIST_JOB_KEYS)
        );
    }

    private static Duration time(Map<String, Object> node, String key, String scope) {
        try {
            return DurationParser.require(TreeFields.string(node, key), scope + " " + key);
        } catch (IllegalArgumentException ex) {
            throw ConfigurationException.structural(ex.getMessage());
        }
    }

    private static int runs(Map<String, Object> node, String scope) {
        return positive(TreeFields.integer(node, "runs", 1, scope), "runs", scope);
    }

    private static int positive(int value, String key, String scope) {
        if (value < 1) {
            throw ConfigurationException.structural(scope + " " + key + " must be at least 1");
        }
        return value;
    }

    private static Map<String, String> extraAttributes(Map<String, Object> node, Set<String> known) {
        var extra = new LinkedHashMap<String, String>();
        node.forEach((key, value) -> {
            if (!known.contains(key) && value != null && !(value instanceof Map<?, ?>) && !(value instanceof List<?>)) {
                extra.put(key, TreeFields.scalar(value));
            }
        });
        return extra;
    }

    private Benchmark benchmark(String name, Map<String, Object> node) {
        String scope = "benchmark '" + name + "'";
        var sources = new ArrayList<BenchmarkSource>();
        for (var folder : TreeFields.mapList(node, "folders", scope)) {
            var encodings = encodings(folder, baseDir, scope + " folder");
            warnDuplicateEncodings(encodings, scope);
            sources.add(new BenchmarkSource.FolderSource(
                baseDir.resolve(TreeFields.requireString(folder, "path", scope + " folder")).normalize(),
                TreeFields.bool(folder, "group", false, scope + " folder"),
                TreeFields.stringItems(folder.get("ignore")).stream().map(Path::of).toList(),
                attributes(folder),
                encodings
            ));
        }
        for (var files : TreeFields.mapList(node, "files", scope)) {
            Path root = baseDir.resolve(TreeFields.string(files, "path", ".")).normalize();
            var entries = new ArrayList<BenchmarkSource.FileEntry>();
            for (var add : TreeFields.mapList(files, "add", scope + " files")) {
                entries.add(new BenchmarkSource.FileEntry(
                    Path.of(TreeFields.requireString(add, "file", scope + " files.add")),
                    TreeFields.string(add, "group"),
                    attributes(add)
                ));
            }
            var encodings = encodings(files, baseDir, scope + " files");
            warnDuplicateEncodings(encodings, scope);
            sources.add(new BenchmarkSource.FilesSource(root, entries, attributes(files), encodings));
        }
        for (var spec : TreeFields.mapList(node, "specs", scope)) {
            sources.add(new BenchmarkSource.SpecSource(
                baseDir.resolve(TreeFields.requireString(spec, "path", scope + " spec")).normalize(),
                TreeFields.string(spec, "instance_tag")
            ));
        }
        return new Benchmark(name, sources);
    }

    private Project project(String name, Map<String, Object> node) {
        String scope = "project '" + name + "'";
        String job = TreeFields.requireString(node, "job", scope);
        var selectors = new ArrayList<RunSelector>();
        for (var tag : TreeFields.mapList(node, "runtags", scope)) {
            selectors.add(new RunTag(
                TreeFields.requireString(tag, "machine", scope + " runtag"),
                TreeFields.requireString(tag, "benchmark", scope + " runtag"),
                TreeFields.string(tag, "tag", "")
            ));
        }
        for (var spec : TreeFields.mapList(node, "runspecs", scope)) {
            String context = scope + " runspec";
            selectors.add(new RunSpec(
                TreeFields.requireString(spec, "machine", context),
                TreeFields.requireString(spec, "benchmark", context),
                TreeFields.requireString(spec, "system", context),
                TreeFields.requireString(spec, "version", context),
                TreeFields.requireString(spec, "setting", context)
            ));
        }
        return new Project(name, job, selectors);
    }

    /**
     * Container attributes shared by folders, files, spec classes and their instances.
     */
    static InstanceAttributes attributes(Map<String, Object> node) {
        var tags = TreeFields.tags(node, "tag");
        return new InstanceAttributes(
            TreeFields.string(node, "cmdline"),
            TreeFields.string(node, "cmdline_post"),
            tags,
            TreeFields.firstString(node, "encoding_tag", "enctag")
        );
    }

    /**
     * Encodings given as paths or as {@code {file, tag}} mappings, resolved against {@code dir}.
     */
    static List<Encoding> encodings(Map<String, Object> node, Path dir, String context) {
        Object raw = node.get("encodings");
        if (raw == null) {
            return List.of();
        }
        var items = raw instanceof List<?> list ? list : List.of(raw);
        var encodings = new ArrayList<Encoding>();
        for (Object item : items) {
            if (item instanceof Map<?, ?>) {
                var entry = TreeFields.asMap(item, context + " encoding");
                encodings.add(new Encoding(
                    dir.resolve(TreeFields.requireString(entry, "file", context + " encoding")).normalize(),
                    TreeFields.string(entry, "tag")
                ));
            } else if (item != null) {
                encodings.add(Encoding.untagged(dir.resolve(TreeFields.scalar(item).trim()).normalize()));
            }
        }
        return encodings;
    }

    private void warnDuplicateEncodings(List<Encoding> encodings, String scope) {
        for (Path duplicate : EncodingResolver.duplicates(encodings)) {
            diagnostics.warning(Diagnostic.Category.STRUCTURAL, scope,
                "encoding '" + duplicate + "' is declared more than once; the first declaration is used");
        }
    }

    private <T> void declare(NamedIndex<T> index, Map<String, Object> node, String kind, EntityFactory<T> factory) {
        String name;
        try {
            name = TreeFields.requireString(node, "name", kind);
        } catch (ConfigurationException ex) {
            diagnostics.record(kind, ex);
            return;
        }
        String scope = kind + " '" + name + "'";
        T value;
        try {
            value = factory.create(name);
        } catch (ConfigurationException ex) {
            diagnostics.record(scope, ex);
            if (!index.reject(name, ex.getMessage())) {
                duplicate(index, name, scope);
            }
            return;
        }
        if (!index.register(name, value)) {
            duplicate(index, name, scope);
        }
    }

    private static List<Map<String, Object>> entries(Map<String, Object> tree, String key) {
        return TreeFields.mapList(tree, key, "runscript");
    }

    private static String settingScope(String systemKey, String setting) {
        return "setting '" + systemKey + "/" + setting + "'";
    }

    @FunctionalInterface
    private interface EntityFactory<T> {
        T create(String name);
    }
}
