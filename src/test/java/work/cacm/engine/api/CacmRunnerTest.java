package work.cacm.engine.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.cacm.engine.skill.InMemorySkillService;

class CacmRunnerTest {
    private static Path resource(String... parts) {
        return Path.of("src/test/resources", parts).toAbsolutePath();
    }

    private static InMemorySkillService skills() {
        return new InMemorySkillService()
            .register("FinancialAnalysis", "calculate_basic_ratios", args -> {
                @SuppressWarnings("unchecked")
                var data = (Map<String, Object>) args.get("financial_data");
                var ratios = new LinkedHashMap<String, Object>();
                ratios.put("current_ratio",
                    ((Number) data.get("current_assets")).doubleValue() / ((Number) data.get("current_liabilities")).doubleValue());
                return ratios;
            })
            .register("Reports", "summarize", args -> args.get("company") + " current ratio " + args.get("current_ratio"));
    }

    @Test
    void runsEchoChainWithoutCatalog() {
        var config = RunConfiguration.builder()
            .workflowPath(resource("workflows", "echo-chain.json"))
            .build();
        var result = new CacmRunner().run(config);
        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertEquals(Map.of("x", "hello", "y", "hello"), result.metadata().get("outputs"));
        assertEquals("echo-chain-001", result.metadata().get("cacmId"));
    }

    @Test
    void runsCreditAnalysisWithCatalogAndSkills() {
        var config = RunConfiguration.builder()
            .workflowPath(resource("workflows", "credit-analysis.yaml"))
            .catalogPath(resource("catalogs", "credit-analysis.json"))
            .skills(skills())
            .build();
        var result = new CacmRunner().run(config);
        assertEquals(RunResult.Status.SUCCESS, result.status(), result.toPrettyJson());
        @SuppressWarnings("unchecked")
        var outputs = (Map<String, Object>) result.metadata().get("outputs");
        assertEquals("ACME current ratio 2.0", outputs.get("summary"));
        assertEquals(List.of("documentURI", "documentType", "financials"), outputs.get("stored"));
    }

    @Test
    void missingCatalogDegradesToStepFailures() {
        var config = RunConfiguration.builder()
            .workflowPath(resource("workflows", "credit-analysis.yaml"))
            .catalogPath(resource("catalogs", "does-not-exist.json"))
            .build();
        var result = new CacmRunner().run(config);
        assertEquals(RunResult.Status.PARTIAL_FAILURE, result.status());
        assertEquals(2, result.status().exitCode());
    }

    @Test
    void invalidWorkflowIsFailure() {
        var config = RunConfiguration.builder()
            .workflowPath(resource("workflows", "invalid.json"))
            .build();
        var result = new CacmRunner().run(config);
        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("DONE_FAILED", result.metadata().get("finalState"));
        assertEquals(Map.of(), result.metadata().get("outputs"));
    }

    @Test
    void unreadableWorkflowIsFailureWithKind() {
        var config = RunConfiguration.builder()
            .workflowPath(resource("workflows", "broken.yaml"))
            .build();
        var result = new CacmRunner().run(config);
        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("WORKFLOW_LOAD", result.metadata().get("errorKind"));
        assertTrue(result.metadata().containsKey("error"));
    }

    @Test
    void runToJsonAddsPayload() {
        var config = RunConfiguration.builder()
            .workflowPath(resource("workflows", "echo-chain.json"))
            .build();
        var result = new CacmRunner().runToJson(config);
        var payload = (String) result.metadata().get("payload");
        assertTrue(payload.contains("\"status\" : \"success\""), payload);
        assertTrue(payload.contains("\"finalState\" : \"DONE_SUCCESS\""), payload);
    }
}
