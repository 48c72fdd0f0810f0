package dumb.sequent;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dumb.sequent.util.Json;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static dumb.sequent.util.Log.message;
import static java.util.Objects.requireNonNull;

/** Rule templates as a JSON array in a single file. */
public class JsonRuleTemplateStore implements RuleTemplateStore {

    private static final TypeReference<List<RuleTemplate>> LIST = new TypeReference<>() {
    };

    private final Path path;
    private final ObjectMapper mapper;

    public JsonRuleTemplateStore(Path path) {
        this.path = requireNonNull(path);
        this.mapper = Json.the;
    }

    @Override
    public List<RuleTemplate> load() throws IOException {
        if (!Files.exists(path)) {
            message("Rule template file " + path + " not found, starting with none");
            return List.of();
        }
        var templates = mapper.readValue(Files.readString(path), LIST);
        message("Loaded " + templates.size() + " rule template(s) from " + path);
        return templates;
    }

    @Override
    public void save(List<RuleTemplate> templates) throws IOException {
        var parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(path, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(templates));
        message("Saved " + templates.size() + " rule template(s) to " + path);
    }

    public Path path() {
        return path;
    }
}
