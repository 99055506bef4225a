package work.cacm.engine.worker;

import work.cacm.engine.shared.EngineException;
import work.cacm.engine.shared.ErrorKind;

/**
 * Neither a registered worker type nor a catalog entry matches the requested name.
 */
public final class CapabilityNotFoundException extends EngineException {
    private final String name;

    public CapabilityNotFoundException(String name) {
        super(ErrorKind.CAPABILITY_NOT_FOUND, "Capability or worker type not found: " + name);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
