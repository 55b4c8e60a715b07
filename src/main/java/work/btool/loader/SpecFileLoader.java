package work.btool.loader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.btool.model.Encoding;
import work.btool.model.InstanceAttributes;
import work.btool.shared.ConfigurationException;

/**
 * Parses {@code spec.toml} files:
 *
 * <pre>
 * [[class]]
 * name = "easy"
 * tag = "small"
 * encodings = [{ file = "enc.lp" }, { file = "opt.lp", tag = "opt" }]
 *
 * [[class.folder]]
 * path = "instances"
 *
 * [[class.instance]]
 * file = "extra/one.lp"
 * </pre>
 */
public final class SpecFileLoader {
    private SpecFileLoader() {}

    public static SpecFile load(Path file) {
        String text;
        try {
            text = Files.readString(file);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + file, ex);
        }
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            var messages = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw ConfigurationException.structural("cannot parse " + file + ": " + messages);
        }
        var tree = convertTomlMap(result.toMap());
        Path dir = file.getParent();
        var classes = new ArrayList<SpecFile.SpecClass>();
        var entries = TreeFields.mapList(tree, "class", file.toString());
        for (int i = 0; i < entries.size(); i++) {
            classes.add(readClass(entries.get(i), dir, file + " class[" + i + "]"));
        }
        return new SpecFile(file, classes);
    }

    private static SpecFile.SpecClass readClass(Map<String, Object> node, Path dir, String context) {
        String name = TreeFields.requireString(node, "name", context);
        var folders = new ArrayList<SpecFile.SpecFolder>();
        for (var folder : TreeFields.mapList(node, "folder", context)) {
            folders.add(new SpecFile.SpecFolder(
                dir.resolve(TreeFields.requireString(folder, "path", context + ".folder")).normalize(),
                TreeFields.bool(folder, "group", false, context + ".folder"),
                TreeFields.stringItems(folder.get("ignore")).stream().map(Path::of).toList(),
                RunscriptBuilder.attributes(folder)
            ));
        }
        var instances = new ArrayList<SpecFile.SpecInstance>();
        for (var instance : TreeFields.mapList(node, "instance", context)) {
            instances.add(new SpecFile.SpecInstance(
                dir.resolve(TreeFields.requireString(instance, "file", context + ".instance")).normalize(),
                TreeFields.string(instance, "group"),
                RunscriptBuilder.attributes(instance)
            ));
        }
        List<Encoding> encodings = RunscriptBuilder.encodings(node, dir, context);
        InstanceAttributes attributes = RunscriptBuilder.attributes(node);
        return new SpecFile.SpecClass(name, attributes, encodings, folders, instances);
    }

    private static Map<String, Object> convertTomlMap(Map<String, Object> source) {
        Map<String, Object> converted = new LinkedHashMap<>();
        for (var entry : source.entrySet()) {
            converted.put(String.valueOf(entry.getKey()), convertTomlValue(entry.getValue()));
        }
        return converted;
    }

    private static Object convertTomlValue(Object value) {
        if (value instanceof TomlTable table) {
            return convertTomlMap(table.toMap());
        }
        if (value instanceof TomlArray array) {
            List<Object> items = new ArrayList<>();
            for (int i = 0; i < array.size(); i++) {
                items.add(convertTomlValue(array.get(i)));
            }
            return items;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), convertTomlValue(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(convertTomlValue(item));
            }
            return copy;
        }
        return value;
    }
}
