package work.cacm.engine.worker.builtin;

import java.util.LinkedHashMap;
import java.util.Map;
import work.cacm.engine.context.SharedContext;
import work.cacm.engine.worker.AbstractWorker;
import work.cacm.engine.worker.WorkerResult;

/**
 * Forwards the step to the peer named by the {@code delegateTo} input (or construction hint) and returns the peer's
 * result with a {@code delegatedTo} field added.
 */
public final class DelegatingWorker extends AbstractWorker {
    public static final String DELEGATE_TO = "delegateTo";

    private final String defaultPeer;

    public DelegatingWorker(String name, String defaultPeer) {
        super(name);
        this.defaultPeer = defaultPeer;
    }

    @Override
    public WorkerResult run(String task, Map<String, Object> inputs, SharedContext context) {
        var peer = inputs.get(DELEGATE_TO) instanceof String requested && !requested.isBlank() ? requested : defaultPeer;
        if (peer == null) {
            return WorkerResult.error("Input '" + DELEGATE_TO + "' is required");
        }
        var forwarded = new LinkedHashMap<>(inputs);
        forwarded.remove(DELEGATE_TO);
        var result = delegate(peer, task, forwarded, context);
        var fields = new LinkedHashMap<>(result.fields());
        fields.put("delegatedTo", peer);
        if (result instanceof WorkerResult.Partial partial) {
            return WorkerResult.partial(partial.message(), fields, partial.warnings());
        }
        if (result instanceof WorkerResult.Error error) {
            return WorkerResult.error(error.message(), fields);
        }
        return WorkerResult.success(result.message(), fields);
    }
}
