package work.agentflow.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.agentflow.graph.PhaseTable;
import work.agentflow.shared.Names;

/**
 * Extracts an {@link AgentRecord} from the metadata block at the top of a document.
 * YAML blocks are fenced by {@code ---}, TOML blocks by {@code +++}.
 */
public final class FrontMatterParser {
    public static final String DEFAULT_CATEGORY = "other";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final String YAML_FENCE = "---";
    private static final String TOML_FENCE = "+++";

    private final PhaseTable phaseTable;

    public FrontMatterParser(PhaseTable phaseTable) {
        this.phaseTable = Objects.requireNonNull(phaseTable, "phaseTable");
    }

    public AgentRecord parse(String content, String sourcePath) {
        Map<String, Object> fields = readFields(content == null ? "" : content, sourcePath);
        return toRecord(fields, sourcePath);
    }

    private Map<String, Object> readFields(String content, String sourcePath) {
        List<String> lines = content.replace("\uFEFF", "").lines().collect(Collectors.toList());
        int start = 0;
        while (start < lines.size() && lines.get(start).isBlank()) {
            start++;
        }
        if (start == lines.size()) {
            throw new ParseException(sourcePath, "document is empty");
        }
        String fence = lines.get(start).trim();
        if (!YAML_FENCE.equals(fence) && !TOML_FENCE.equals(fence)) {
            throw new ParseException(sourcePath, "no metadata block");
        }
        int end = start + 1;
        while (end < lines.size() && !fence.equals(lines.get(end).trim())) {
            end++;
        }
        if (end == lines.size()) {
            throw new ParseException(sourcePath, "metadata block is not terminated");
        }
        String block = String.join("\n", lines.subList(start + 1, end));
        return YAML_FENCE.equals(fence) ? readYaml(block, sourcePath) : readToml(block, sourcePath);
    }

    private Map<String, Object> readYaml(String block, String sourcePath) {
        if (block.isBlank()) {
            return Map.of();
        }
        try {
            JsonNode root = YAML_MAPPER.readTree(block);
            if (root == null || root.isNull() || root.isMissingNode()) {
                return Map.of();
            }
            if (!root.isObject()) {
                throw new ParseException(sourcePath, "metadata block must be a mapping");
            }
            return YAML_MAPPER.convertValue(root, MAP_TYPE);
        } catch (IOException ex) {
            throw new ParseException(sourcePath, "invalid YAML metadata: " + firstLine(ex.getMessage()), ex);
        }
    }

    private Map<String, Object> readToml(String block, String sourcePath) {
        TomlParseResult result = Toml.parse(block);
        if (result.hasErrors()) {
            throw new ParseException(sourcePath, "invalid TOML metadata: " + result.errors().get(0));
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (String key : result.keySet()) {
            Object value = result.get(List.of(key));
            fields.put(key, value instanceof TomlArray array ? array.toList() : value);
        }
        return fields;
    }

    private AgentRecord toRecord(Map<String, Object> fields, String sourcePath) {
        String name = requiredText(fields, "name", sourcePath);
        String description = requiredText(fields, "description", sourcePath);
        String category = Names.category(optionalText(fields, "category", sourcePath));
        if (category == null) {
            category = DEFAULT_CATEGORY;
        }
        String explicitId = optionalText(fields, "id", sourcePath);
        String id = Names.slug(explicitId != null ? explicitId : name);
        if (id == null) {
            throw new ParseException(sourcePath, "cannot derive an id from '" + (explicitId != null ? explicitId : name) + "'");
        }
        Object rawTags = fields.containsKey("stackTags") ? fields.get("stackTags") : fields.get("tags");
        return new AgentRecord(
            id,
            name,
            description,
            category,
            Names.tags(readTags(rawTags, sourcePath)),
            phaseTable.phaseOf(category),
            sourcePath,
            optionalText(fields, "model", sourcePath)
        );
    }

    private static String requiredText(Map<String, Object> fields, String key, String sourcePath) {
        String value = optionalText(fields, key, sourcePath);
        if (value == null) {
            throw new ParseException(sourcePath, "missing required field '" + key + "'");
        }
        return value;
    }

    private static String optionalText(Map<String, Object> fields, String key, String sourcePath) {
        Object value = fields.get(key);
        if (value == null) {
            return null;
        }
        if (isStructured(value)) {
            throw new ParseException(sourcePath, "field '" + key + "' must be a scalar");
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private static List<String> readTags(Object raw, String sourcePath) {
        var tags = new ArrayList<String>();
        if (raw == null) {
            return tags;
        }
        if (raw instanceof Collection<?> values) {
            for (Object value : values) {
                if (isStructured(value)) {
                    throw new ParseException(sourcePath, "stackTags must list plain strings");
                }
                if (value != null) {
                    tags.add(value.toString());
                }
            }
            return tags;
        }
        if (isStructured(raw)) {
            throw new ParseException(sourcePath, "stackTags must be a list or a comma-separated string");
        }
        for (String part : raw.toString().split(",")) {
            tags.add(part);
        }
        return tags;
    }

    private static boolean isStructured(Object value) {
        return value instanceof Map<?, ?>
            || value instanceof Collection<?>
            || value instanceof TomlTable
            || value instanceof TomlArray;
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unknown error";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
