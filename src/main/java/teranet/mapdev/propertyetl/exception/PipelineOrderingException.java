package teranet.mapdev.propertyetl.exception;

/**
 * Raised when a pipeline stage is invoked before the stage it depends on,
 * e.g. transforming before extracting. Signals caller misuse.
 */
public class PipelineOrderingException extends IllegalStateException {

    public PipelineOrderingException(String message) {
        super(message);
    }
}
