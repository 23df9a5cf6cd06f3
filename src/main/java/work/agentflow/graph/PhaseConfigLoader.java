package work.agentflow.graph;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads phase tables and precedence edges from TOML.
 *
 * <pre>
 * [phases]
 * architecture = 1
 * components = 2
 *
 * [[precedence]]
 * before = "architecture"
 * after = ["components"]
 * </pre>
 */
public final class PhaseConfigLoader {
    static final String DEFAULT_RESOURCE = "/default-phases.toml";

    private PhaseConfigLoader() {}

    public static PhaseGraph loadDefault() {
        try (InputStream in = PhaseConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new PhaseConfigException("Missing bundled phase table " + DEFAULT_RESOURCE);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), DEFAULT_RESOURCE);
        } catch (IOException ex) {
            throw new PhaseConfigException("Unable to read bundled phase table: " + ex.getMessage(), ex);
        }
    }

    public static PhaseGraph load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new PhaseConfigException("Phase table not found: " + path);
        }
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8), path.toString());
        } catch (IOException ex) {
            throw new PhaseConfigException("Unable to read phase table " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static PhaseGraph parse(String source, String origin) {
        TomlParseResult result = Toml.parse(source);
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new PhaseConfigException("Invalid phase table " + origin + ": " + errors);
        }
        PhaseTable table = readTable(result.getTable("phases"), origin);
        PhaseGraph graph = new PhaseGraph(table);
        TomlArray precedence = result.getArray("precedence");
        if (precedence == null) {
            return graph;
        }
        for (int i = 0; i < precedence.size(); i++) {
            TomlTable edge;
            String before;
            try {
                edge = precedence.getTable(i);
                before = edge.getString("before");
            } catch (TomlInvalidTypeException ex) {
                throw new PhaseConfigException(origin + ": precedence[" + i + "] " + ex.getMessage(), ex);
            }
            if (before == null) {
                throw new PhaseConfigException(origin + ": precedence[" + i + "] is missing 'before'");
            }
            for (String after : readTargets(edge.get("after"), origin, i)) {
                try {
                    graph.addPrecedence(before, after);
                } catch (IllegalArgumentException ex) {
                    throw new PhaseConfigException(origin + ": " + ex.getMessage(), ex);
                }
            }
        }
        return graph;
    }

    private static PhaseTable readTable(TomlTable phases, String origin) {
        if (phases == null || phases.isEmpty()) {
            throw new PhaseConfigException(origin + ": [phases] table is missing or empty");
        }
        Map<String, Integer> ordinals = new LinkedHashMap<>();
        for (String key : phases.keySet()) {
            Object value = phases.get(List.of(key));
            if (!(value instanceof Long ordinal)) {
                throw new PhaseConfigException(origin + ": phase of '" + key + "' must be an integer");
            }
            if (ordinal < Integer.MIN_VALUE || ordinal > Integer.MAX_VALUE) {
                throw new PhaseConfigException(origin + ": phase of '" + key + "' is out of range: " + ordinal);
            }
            ordinals.put(key, ordinal.intValue());
        }
        try {
            return new PhaseTable(ordinals);
        } catch (IllegalArgumentException ex) {
            throw new PhaseConfigException(origin + ": " + ex.getMessage(), ex);
        }
    }

    private static List<String> readTargets(Object raw, String origin, int index) {
        if (raw instanceof String single) {
            return List.of(single);
        }
        if (raw instanceof TomlArray array) {
            var targets = new ArrayList<String>();
            for (int i = 0; i < array.size(); i++) {
                if (!(array.get(i) instanceof String target)) {
                    throw new PhaseConfigException(origin + ": precedence[" + index + "].after must list strings");
                }
                targets.add(target);
            }
            return targets;
        }
        throw new PhaseConfigException(origin + ": precedence[" + index + "] is missing 'after'");
    }
}
