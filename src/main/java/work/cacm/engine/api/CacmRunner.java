package work.cacm.engine.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.cacm.engine.catalog.CapabilityCatalog;
import work.cacm.engine.catalog.CatalogLoader;
import work.cacm.engine.model.WorkflowLoader;
import work.cacm.engine.runtime.Orchestrator;
import work.cacm.engine.shared.EngineException;
import work.cacm.engine.skill.SkillService;
import work.cacm.engine.validation.StructuralWorkflowValidator;
import work.cacm.engine.worker.builtin.BuiltinWorkers;

/**
 * Public entry point for embedding the engine: loads the catalog and the workflow, runs it once and reports.
 */
public final class CacmRunner {
    private static final Logger log = LoggerFactory.getLogger(CacmRunner.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    static final String DEBUG_PROPERTY = "cacm.debug";

    public RunResult run(RunConfiguration configuration) {
        var started = Instant.now();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("workflow", configuration.workflowPath().toString());
        configuration.catalogPath().ifPresent(path -> metadata.put("catalog", path.toString()));
        try {
            var catalog = configuration.catalogPath().map(CatalogLoader::load).orElseGet(CapabilityCatalog::empty);
            var instance = WorkflowLoader.load(configuration.workflowPath());
            var registry = configuration.registry().orElseGet(BuiltinWorkers::createRegistry);
            var skills = configuration.skills().orElseGet(SkillService::none);
            try (var orchestrator = new Orchestrator(catalog, registry, skills, new StructuralWorkflowValidator(),
                configuration.settings())) {
                var result = orchestrator.run(instance);
                metadata.put("cacmId", instance.cacmId());
                metadata.putAll(result.toMap());
                if (result.success()) {
                    return RunResult.success(metadata, started);
                }
                if (result.stepReports().isEmpty()) {
                    return RunResult.failure("Workflow did not run", metadata, started);
                }
                return RunResult.partialFailure(metadata, started);
            }
        } catch (EngineException ex) {
            log.error("Run setup failed [{}]: {}", ex.kind(), ex.getMessage());
            if (Boolean.getBoolean(DEBUG_PROPERTY)) {
                log.error("Stack trace", ex);
            }
            metadata.put("errorKind", ex.kind().name());
            return RunResult.failure(ex.getMessage(), metadata, started);
        } catch (RuntimeException ex) {
            log.error("Run failed: {}", ex.getMessage());
            if (Boolean.getBoolean(DEBUG_PROPERTY)) {
                log.error("Stack trace", ex);
            }
            return RunResult.failure(ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage(), metadata, started);
        }
    }

    public RunResult runToJson(RunConfiguration configuration) {
        var result = run(configuration);
        try {
            var json = JSON.writerWithDefaultPrettyPrinter().writeValueAsString(result.toSerializableMap());
            return result.withSerializedPayload(json);
        } catch (JsonProcessingException ex) {
            return RunResult.failure("Unable to serialize result payload: " + ex.getMessage(), Map.of(), result.startedAt());
        }
    }
}
