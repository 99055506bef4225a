package work.cacm.engine.catalog;

import work.cacm.engine.shared.EngineException;
import work.cacm.engine.shared.ErrorKind;

/**
 * Raised while reading a catalog document. {@link CatalogLoader#load} catches it and degrades to an empty catalog.
 */
public final class CatalogLoadException extends EngineException {
    public CatalogLoadException(String message) {
        super(ErrorKind.CATALOG_LOAD, message);
    }

    public CatalogLoadException(String message, Throwable cause) {
        super(ErrorKind.CATALOG_LOAD, message, cause);
    }
}
