package work.cacm.engine.binding;

import work.cacm.engine.shared.EngineException;
import work.cacm.engine.shared.ErrorKind;

/**
 * Raised when a reference walks into a segment that does not exist in its namespace.
 */
public final class UnresolvedBindingException extends EngineException {
    private final String reference;
    private final String missingSegment;

    public UnresolvedBindingException(String reference, String missingSegment) {
        this(reference, missingSegment, "Unresolved reference '" + reference + "': segment '" + missingSegment + "' not found");
    }

    public UnresolvedBindingException(String reference, String missingSegment, String message) {
        super(ErrorKind.UNRESOLVED_BINDING, message);
        this.reference = reference;
        this.missingSegment = missingSegment;
    }

    public String reference() {
        return reference;
    }

    public String missingSegment() {
        return missingSegment;
    }
}
