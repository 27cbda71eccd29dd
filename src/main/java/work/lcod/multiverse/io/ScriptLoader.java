package work.lcod.multiverse.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlTable;

/**
 * Loads an analysis script as an ordered list of code steps.
 *
 * <ul>
 *   <li>{@code .yaml}, {@code .yml}, {@code .json}: a {@code steps} list of code strings</li>
 *   <li>{@code .toml}: {@code [[steps]]} tables with a {@code code} string</li>
 *   <li>anything else: plain text, steps separated by lines containing only {@code ---}</li>
 * </ul>
 */
public final class ScriptLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String STEP_SEPARATOR = "---";

    private ScriptLoader() {}

    public static List<String> load(Path path) {
        String text;
        try {
            text = Files.readString(path);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read script: " + path, ex);
        }
        var name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".yaml") || name.endsWith(".yml") || name.endsWith(".json")) {
            return fromTree(text, path);
        }
        if (name.endsWith(".toml")) {
            return fromToml(text, path);
        }
        return fromText(text);
    }

    static List<String> fromText(String text) {
        var steps = new ArrayList<String>();
        var current = new StringBuilder();
        for (var line : text.split("\\R", -1)) {
            if (line.trim().equals(STEP_SEPARATOR)) {
                addStep(steps, current.toString());
                current.setLength(0);
                continue;
            }
            current.append(line).append('\n');
        }
        addStep(steps, current.toString());
        return List.copyOf(steps);
    }

    static List<String> fromTree(String text, Path origin) {
        JsonNode root;
        try {
            // JSON is a subset of YAML; one mapper reads both
            root = YAML_MAPPER.readTree(text);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to parse script " + origin + ": " + ex.getMessage(), ex);
        }
        var stepsNode = root != null && root.isObject() ? root.get("steps") : root;
        if (stepsNode == null || !stepsNode.isArray()) {
            throw new IllegalStateException("Script " + origin + " has no 'steps' list");
        }
        var steps = new ArrayList<String>();
        for (var step : stepsNode) {
            var code = step.isObject() ? step.get("code") : step;
            if (code == null || !code.isTextual()) {
                throw new IllegalStateException("Script " + origin + ": every step must be a code string");
            }
            addStep(steps, code.asText());
        }
        return List.copyOf(steps);
    }

    static List<String> fromToml(String text, Path origin) {
        var result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new IllegalStateException("Failed to parse script " + origin + ": " + result.errors().get(0));
        }
        TomlArray array = result.getArray("steps");
        if (array == null) {
            throw new IllegalStateException("Script " + origin + " has no [[steps]] tables");
        }
        var steps = new ArrayList<String>();
        for (int i = 0; i < array.size(); i++) {
            var item = array.get(i);
            String code = null;
            if (item instanceof TomlTable table) {
                code = table.getString("code");
            } else if (item instanceof String string) {
                code = string;
            }
            if (code == null) {
                throw new IllegalStateException("Script " + origin + ": step " + i + " has no 'code' string");
            }
            addStep(steps, code);
        }
        return List.copyOf(steps);
    }

    private static void addStep(List<String> steps, String code) {
        var trimmed = code.strip();
        if (!trimmed.isEmpty()) {
            steps.add(trimmed);
        }
    }
}
