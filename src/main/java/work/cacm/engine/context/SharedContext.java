package work.cacm.engine.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.cacm.engine.shared.Values;

/**
 * Per-run state shared by every worker invoked during one workflow execution.
 *
 * <p>One instance is created when a run starts and passed by reference to each worker call, so writes are visible to
 * later steps and to delegated peers immediately. Each map is concurrent; {@link #setData} is atomic per key and the
 * last writer wins. A {@code null} value removes the key. Global parameters are meant to be written once: overwriting
 * one is allowed but logged.
 */
public final class SharedContext {
    private static final Logger log = LoggerFactory.getLogger(SharedContext.class);

    private final String sessionId;
    private final String cacmId;
    private final Map<String, String> documentReferences = new ConcurrentHashMap<>();
    private final List<String> knowledgeBaseReferences = new CopyOnWriteArrayList<>();
    private final Map<String, Object> globalParameters = new ConcurrentHashMap<>();
    private final Map<String, Object> dataStore = new ConcurrentHashMap<>();

    public SharedContext(String cacmId) {
        this(cacmId, null);
    }

    public SharedContext(String cacmId, String sessionId) {
        this.cacmId = Objects.requireNonNull(cacmId, "cacmId");
        this.sessionId = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId;
        log.info("SharedContext initialized for CACM '{}' (session {})", this.cacmId, this.sessionId);
    }

    public String sessionId() {
        return sessionId;
    }

    public String cacmId() {
        return cacmId;
    }

    public void setData(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (value == null) {
            dataStore.remove(key);
            log.debug("Removed data store key '{}'", key);
            return;
        }
        dataStore.put(key, value);
        log.debug("Set data store key '{}' ({})", key, Values.typeName(value));
    }

    public Optional<Object> getData(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(dataStore.get(key));
    }

    public Object getData(String key, Object defaultValue) {
        if (key == null) {
            return defaultValue;
        }
        return dataStore.getOrDefault(key, defaultValue);
    }

    public boolean hasData(String key) {
        return key != null && dataStore.containsKey(key);
    }

    public Object removeData(String key) {
        return key == null ? null : dataStore.remove(key);
    }

    public Map<String, Object> dataStore() {
        return Collections.unmodifiableMap(dataStore);
    }

    public void addDocumentReference(String docType, String uri) {
        Objects.requireNonNull(docType, "docType");
        Objects.requireNonNull(uri, "uri");
        var previous = documentReferences.put(docType, uri);
        if (previous != null && !previous.equals(uri)) {
            log.warn("Document reference '{}' replaced: {} -> {}", docType, previous, uri);
        } else {
            log.info("Added document reference '{}' -> {}", docType, uri);
        }
    }

    public Optional<String> getDocumentReference(String docType) {
        return docType == null ? Optional.empty() : Optional.ofNullable(documentReferences.get(docType));
    }

    public Map<String, String> documentReferences() {
        return Map.copyOf(documentReferences);
    }

    /**
     * Adds a knowledge base URI unless it is already present. Returns whether the reference was added.
     */
    public boolean addKnowledgeBaseReference(String uri) {
        Objects.requireNonNull(uri, "uri");
        synchronized (knowledgeBaseReferences) {
            if (knowledgeBaseReferences.contains(uri)) {
                log.debug("Knowledge base reference {} already present", uri);
                return false;
            }
            knowledgeBaseReferences.add(uri);
        }
        log.info("Added knowledge base reference {}", uri);
        return true;
    }

    public List<String> knowledgeBaseReferences() {
        return List.copyOf(knowledgeBaseReferences);
    }

    public void setGlobalParameter(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (value == null) {
            globalParameters.remove(key);
            return;
        }
        var previous = globalParameters.put(key, value);
        if (previous != null) {
            log.warn("Global parameter '{}' overwritten ({} -> {})", key, Values.typeName(previous), Values.typeName(value));
        } else {
            log.info("Set global parameter '{}' ({})", key, Values.typeName(value));
        }
    }

    public Optional<Object> getGlobalParameter(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(globalParameters.get(key));
    }

    public Map<String, Object> globalParameters() {
        return Collections.unmodifiableMap(globalParameters);
    }

    /**
     * Diagnostic summary of the context. Data store values are omitted, only their keys are listed.
     */
    public String summarize() {
        var lines = new ArrayList<String>();
        lines.add("--- SharedContext (session " + sessionId + ", CACM " + cacmId + ") ---");
        lines.add("Document references: " + (documentReferences.isEmpty() ? "none" : new LinkedHashMap<>(documentReferences)));
        lines.add("Knowledge base references: " + (knowledgeBaseReferences.isEmpty() ? "none" : knowledgeBaseReferences));
        lines.add("Global parameters: " + (globalParameters.isEmpty() ? "none" : globalParameters.keySet()));
        lines.add("Data store keys: " + (dataStore.isEmpty() ? "none" : dataStore.keySet().stream().sorted().toList()));
        var summary = String.join(System.lineSeparator(), lines);
        log.info(summary);
        return summary;
    }

    /**
     * Serializable copy of the whole context, for callers that persist it after a run.
     */
    public Map<String, Object> snapshot() {
        var snapshot = new LinkedHashMap<String, Object>();
        snapshot.put("sessionId", sessionId);
        snapshot.put("cacmId", cacmId);
        snapshot.put("documentReferences", new LinkedHashMap<>(documentReferences));
        snapshot.put("knowledgeBaseReferences", new ArrayList<>(knowledgeBaseReferences));
        snapshot.put("globalParameters", Values.copyMap(globalParameters));
        snapshot.put("dataStore", Values.copyMap(dataStore));
        return snapshot;
    }
}
