package work.lcod.multiverse.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.multiverse.api.MultiverseConfiguration;

/**
 * Applies a TOML engine file to a configuration builder.
 *
 * <pre>
 * [engine]
 * parallelism = 4
 * max_universes = 5000
 * execute_default_on_add = true
 *
 * [data]
 * survey = "survey.csv"   # resolved against the file's directory
 * </pre>
 */
public final class ConfigurationLoader {
    private ConfigurationLoader() {}

    public static MultiverseConfiguration.Builder load(Path path, MultiverseConfiguration.Builder builder) {
        TomlParseResult result;
        try {
            result = Toml.parse(Files.readString(path));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read configuration: " + path, ex);
        }
        if (result.hasErrors()) {
            throw new IllegalStateException("Invalid configuration " + path + ": " + result.errors().get(0));
        }
        TomlTable engine = result.getTable("engine");
        if (engine != null) {
            Long parallelism = engine.getLong("parallelism");
            if (parallelism != null) {
                builder.parallelism(Math.toIntExact(parallelism));
            }
            Long maxUniverses = engine.getLong("max_universes");
            if (maxUniverses != null) {
                builder.maxUniverses(Math.toIntExact(maxUniverses));
            }
            Boolean executeDefault = engine.getBoolean("execute_default_on_add");
            if (executeDefault != null) {
                builder.executeDefaultOnAdd(executeDefault);
            }
        }
        TomlTable data = result.getTable("data");
        if (data != null) {
            var base = path.toAbsolutePath().getParent();
            for (var name : data.keySet()) {
                var key = List.of(name);
                if (!data.isString(key)) {
                    throw new IllegalStateException("Invalid configuration " + path + ": data." + name + " must be a file path");
                }
                builder.input(name, DataLoader.load(base.resolve(data.getString(key))));
            }
        }
        return builder;
    }
}
