package work.cacm.engine.binding;

/**
 * Marker bound in place of an input whose reference could not be resolved.
 */
public enum MissingValue {
    INSTANCE;

    public static boolean isMissing(Object value) {
        return value == INSTANCE;
    }

    @Override
    public String toString() {
        return "<missing>";
    }
}
