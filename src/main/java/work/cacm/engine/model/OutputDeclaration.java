package work.cacm.engine.model;

/**
 * A declared workflow output. Optional outputs may legitimately stay unbound after a successful run.
 */
public record OutputDeclaration(String type, String description, boolean optional) {
    public OutputDeclaration {
        description = description == null ? "" : description;
    }

    public static OutputDeclaration of(String type) {
        return new OutputDeclaration(type, "", false);
    }
}
