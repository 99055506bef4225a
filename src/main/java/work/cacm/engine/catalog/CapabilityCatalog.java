package work.cacm.engine.catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable lookup table of compute capabilities, keyed by capability id.
 */
public final class CapabilityCatalog {
    private static final CapabilityCatalog EMPTY = new CapabilityCatalog(Map.of());

    private final Map<String, CapabilityDescriptor> capabilities;

    private CapabilityCatalog(Map<String, CapabilityDescriptor> capabilities) {
        this.capabilities = capabilities;
    }

    public static CapabilityCatalog empty() {
        return EMPTY;
    }

    /**
     * Builds a catalog preserving declaration order. A repeated id replaces the earlier entry.
     */
    public static CapabilityCatalog of(Collection<CapabilityDescriptor> descriptors) {
        if (descriptors == null || descriptors.isEmpty()) {
            return EMPTY;
        }
        var ordered = new LinkedHashMap<String, CapabilityDescriptor>();
        for (var descriptor : descriptors) {
            ordered.put(descriptor.id(), descriptor);
        }
        return new CapabilityCatalog(Collections.unmodifiableMap(ordered));
    }

    public Optional<CapabilityDescriptor> lookup(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(capabilities.get(id));
    }

    public boolean contains(String id) {
        return id != null && capabilities.containsKey(id);
    }

    public Set<String> ids() {
        return capabilities.keySet();
    }

    public Collection<CapabilityDescriptor> descriptors() {
        return capabilities.values();
    }

    public int size() {
        return capabilities.size();
    }

    public boolean isEmpty() {
        return capabilities.isEmpty();
    }
}
