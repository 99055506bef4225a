package work.cacm.engine.binding;

import java.util.Optional;

/**
 * Root scopes a binding reference may point into.
 */
public enum Namespace {
    INPUTS("cacm.inputs"),
    OUTPUTS("cacm.outputs"),
    INTERMEDIATE("intermediate");

    private final String root;

    Namespace(String root) {
        this.root = root;
    }

    public String root() {
        return root;
    }

    public String prefix() {
        return root + ".";
    }

    public boolean writable() {
        return this != INPUTS;
    }

    /**
     * Namespace whose prefix starts {@code text}, if any. A bare root without a trailing segment does not match.
     */
    public static Optional<Namespace> match(String text) {
        if (text == null) {
            return Optional.empty();
        }
        for (var namespace : values()) {
            if (text.startsWith(namespace.prefix())) {
                return Optional.of(namespace);
            }
        }
        return Optional.empty();
    }
}
