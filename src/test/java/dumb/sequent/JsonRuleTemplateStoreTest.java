package dumb.sequent;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static dumb.sequent.Side.LHS;
import static dumb.sequent.Side.RHS;
import static org.junit.jupiter.api.Assertions.*;

class JsonRuleTemplateStoreTest {

    @TempDir
    Path dir;

    @Test
    void missingFileLoadsAsEmpty() throws IOException {
        assertEquals(List.of(), new JsonRuleTemplateStore(dir.resolve("absent.json")).load());
    }

    @Test
    void saveThenLoad() throws IOException {
        var store = new JsonRuleTemplateStore(dir.resolve("nested/rules.json"));
        var templates = List.of(
                RuleTemplate.unary("orSwap", RHS, "RIGHT, LEFT"),
                RuleTemplate.binary("orCases", LHS, "LEFT", "RIGHT"),
                RuleTemplate.close("trustMe", RHS));
        store.save(templates);
        assertTrue(Files.exists(store.path()));
        assertEquals(templates, store.load());
    }

    @Test
    void readsHandWrittenFile() throws IOException {
        var file = dir.resolve("rules.json");
        Files.writeString(file, """
                [
                  {"name": "orCases", "side": "LHS", "arity": "BINARY", "templates": ["LEFT", "RIGHT"], "note": "ignored"},
                  {"name": "trustMe", "side": "RHS", "arity": "CLOSE"}
                ]
                """);
        var loaded = new JsonRuleTemplateStore(file).load();
        assertEquals(List.of(RuleTemplate.binary("orCases", LHS, "LEFT", "RIGHT"), RuleTemplate.close("trustMe", RHS)), loaded);
    }

    @Test
    void invalidTemplateIsRejected() throws IOException {
        var file = dir.resolve("rules.json");
        Files.writeString(file, """
                [{"name": "andL", "side": "LHS", "arity": "UNARY", "templates": ["LEFT"]}]
                """);
        assertThrows(IOException.class, () -> new JsonRuleTemplateStore(file).load());
    }
}
