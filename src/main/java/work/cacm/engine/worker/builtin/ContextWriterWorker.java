package work.cacm.engine.worker.builtin;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.cacm.engine.binding.MissingValue;
import work.cacm.engine.context.SharedContext;
import work.cacm.engine.worker.AbstractWorker;
import work.cacm.engine.worker.WorkerResult;

/**
 * Stores every step input in the shared data store, optionally under a key prefix.
 *
 * <p>A {@code documentURI}/{@code documentType} pair is also registered as a document reference; a
 * {@code knowledgeBaseURI} is added to the knowledge base references.
 */
public final class ContextWriterWorker extends AbstractWorker {
    public static final String KEY_PREFIX_HINT = "keyPrefix";
    static final String DOCUMENT_URI = "documentURI";
    static final String DOCUMENT_TYPE = "documentType";
    static final String KNOWLEDGE_BASE_URI = "knowledgeBaseURI";

    private final String keyPrefix;

    public ContextWriterWorker(String name, String keyPrefix) {
        super(name);
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    @Override
    public WorkerResult run(String task, Map<String, Object> inputs, SharedContext context) {
        var stored = new ArrayList<String>();
        var warnings = new ArrayList<String>();
        for (var entry : inputs.entrySet()) {
            if (MissingValue.isMissing(entry.getValue())) {
                warnings.add("Input '" + entry.getKey() + "' unresolved, not stored");
                continue;
            }
            if (entry.getValue() == null) {
                continue;
            }
            var key = keyPrefix + entry.getKey();
            context.setData(key, entry.getValue());
            stored.add(key);
        }
        if (inputs.get(DOCUMENT_URI) instanceof String uri && inputs.get(DOCUMENT_TYPE) instanceof String type) {
            context.addDocumentReference(type, uri);
        }
        if (inputs.get(KNOWLEDGE_BASE_URI) instanceof String kb) {
            context.addKnowledgeBaseReference(kb);
        }
        log.info("Stored {} key(s) in shared context: {}", stored.size(), stored);
        var fields = Map.<String, Object>of("storedKeys", List.copyOf(stored));
        if (!warnings.isEmpty()) {
            return WorkerResult.partial("Stored " + stored.size() + " input(s)", fields, warnings);
        }
        return WorkerResult.success("Stored " + stored.size() + " input(s)", fields);
    }
}
