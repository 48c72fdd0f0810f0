package dumb.sequent;

import java.io.IOException;
import java.util.List;

/**
 * Keeps user rule templates between sessions. The engine only reads templates; the storage format
 * belongs to the implementation.
 */
public interface RuleTemplateStore {

    List<RuleTemplate> load() throws IOException;

    void save(List<RuleTemplate> templates) throws IOException;
}
