package dumb.sequent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.sequent.util.Json;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static dumb.sequent.util.Log.warning;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Configuration(
        @JsonProperty("templateFile") String templateFile,
        @JsonProperty("freshSeparator") String freshSeparator,
        @JsonProperty("loadTemplates") boolean loadTemplates
) {
    public static final String RESOURCE = "sequent.json";
    static final String DEFAULT_TEMPLATE_FILE = "rules.json";
    static final String DEFAULT_FRESH_SEPARATOR = "_";
    static final boolean DEFAULT_LOAD_TEMPLATES = true;

    @JsonCreator
    public Configuration(
            @JsonProperty("templateFile") String templateFile,
            @JsonProperty("freshSeparator") String freshSeparator,
            @JsonProperty("loadTemplates") Boolean loadTemplates
    ) {
        this(
                templateFile != null ? templateFile : DEFAULT_TEMPLATE_FILE,
                freshSeparator != null ? freshSeparator : DEFAULT_FRESH_SEPARATOR,
                loadTemplates != null ? loadTemplates : DEFAULT_LOAD_TEMPLATES
        );
    }

    public Configuration() {
        this(DEFAULT_TEMPLATE_FILE, DEFAULT_FRESH_SEPARATOR, DEFAULT_LOAD_TEMPLATES);
    }

    /** The bundled {@value #RESOURCE}, or the defaults if it is missing or unreadable. */
    public static Configuration load() {
        try (var in = Configuration.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                warning(RESOURCE + " not found on classpath, using defaults");
                return new Configuration();
            }
            return Json.the.readValue(in, Configuration.class);
        } catch (IOException e) {
            warning("Could not read " + RESOURCE + ": " + e.getMessage() + ". Using defaults.");
            return new Configuration();
        }
    }

    public static Configuration load(Path file) throws IOException {
        return Json.obj(Files.readString(file), Configuration.class);
    }

    public Configuration withTemplateFile(String file) {
        return new Configuration(file, freshSeparator, loadTemplates);
    }
}
