package work.cacm.engine.worker.builtin;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import work.cacm.engine.binding.MissingValue;
import work.cacm.engine.context.SharedContext;
import work.cacm.engine.worker.AbstractWorker;
import work.cacm.engine.worker.WorkerResult;

/**
 * Returns its inputs unchanged plus an {@code invocation} counter that persists across steps.
 */
public final class EchoWorker extends AbstractWorker {
    public static final String INVOCATION_FIELD = "invocation";

    private final AtomicInteger invocations = new AtomicInteger();

    public EchoWorker(String name) {
        super(name);
    }

    @Override
    public WorkerResult run(String task, Map<String, Object> inputs, SharedContext context) {
        int count = invocations.incrementAndGet();
        var fields = new LinkedHashMap<String, Object>();
        inputs.forEach((key, value) -> {
            if (!MissingValue.isMissing(value)) {
                fields.put(key, value);
            }
        });
        fields.put(INVOCATION_FIELD, count);
        log.info("Echo '{}' (call {}): {}", task, count, fields.keySet());
        return WorkerResult.success("Echoed " + (fields.size() - 1) + " input(s)", fields);
    }

    public int invocations() {
        return invocations.get();
    }
}
