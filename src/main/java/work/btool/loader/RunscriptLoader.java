package work.btool.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import work.btool.model.Runscript;

/**
 * Reads runscripts (YAML, or JSON by extension) into plain map trees and builds the model from
 * them. Relative paths inside the runscript resolve against the runscript's directory.
 */
public final class RunscriptLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private RunscriptLoader() {}

    public static Runscript load(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        var tree = readTree(absolute);
        Path baseDir = absolute.getParent() == null ? absolute : absolute.getParent();
        return RunscriptBuilder.build(tree, baseDir);
    }

    public static Runscript fromString(String yaml, Path baseDir) {
        try {
            return RunscriptBuilder.build(toMap(YAML_MAPPER.readTree(yaml), "runscript"), baseDir.toAbsolutePath().normalize());
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to parse runscript: " + ex.getMessage(), ex);
        }
    }

    public static Map<String, Object> readTree(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Runscript not found: " + path);
        }
        var mapper = path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json") ? JSON_MAPPER : YAML_MAPPER;
        try (var in = Files.newInputStream(path)) {
            return toMap(mapper.readTree(in), path.toString());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read runscript: " + path + " (" + ex.getMessage() + ")", ex);
        }
    }

    private static Map<String, Object> toMap(JsonNode node, String source) throws IOException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new IOException("empty document " + source);
        }
        if (!node.isObject()) {
            throw new IOException("runscript root must be a mapping: " + source);
        }
        @SuppressWarnings("unchecked")
        var map = (Map<String, Object>) convertNode(node);
        return map;
    }

    private static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }
}
