package work.cacm.engine.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import work.cacm.engine.runtime.OrchestratorSettings;
import work.cacm.engine.skill.SkillService;
import work.cacm.engine.worker.WorkerRegistry;

/**
 * Immutable configuration passed to {@link CacmRunner}.
 *
 * @param registry worker factories; the built-in workers are used when absent
 * @param skills skill service handed to every worker; an empty in-memory service is used when absent
 */
public record RunConfiguration(
    Path workflowPath,
    Optional<Path> catalogPath,
    OrchestratorSettings settings,
    Optional<WorkerRegistry> registry,
    Optional<SkillService> skills
) {
    public RunConfiguration {
        Objects.requireNonNull(workflowPath, "workflowPath");
        Objects.requireNonNull(catalogPath, "catalogPath");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(skills, "skills");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path workflowPath;
        private Optional<Path> catalogPath = Optional.empty();
        private OrchestratorSettings settings = OrchestratorSettings.defaults();
        private Optional<WorkerRegistry> registry = Optional.empty();
        private Optional<SkillService> skills = Optional.empty();

        public Builder workflowPath(Path workflowPath) {
            this.workflowPath = workflowPath;
            return this;
        }

        public Builder catalogPath(Path catalogPath) {
            this.catalogPath = Optional.ofNullable(catalogPath);
            return this;
        }

        public Builder settings(OrchestratorSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder registry(WorkerRegistry registry) {
            this.registry = Optional.ofNullable(registry);
            return this;
        }

        public Builder skills(SkillService skills) {
            this.skills = Optional.ofNullable(skills);
            return this;
        }

        public RunConfiguration build() {
            return new RunConfiguration(workflowPath, catalogPath, settings, registry, skills);
        }
    }
}
