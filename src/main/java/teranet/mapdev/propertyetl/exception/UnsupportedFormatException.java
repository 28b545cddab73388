package teranet.mapdev.propertyetl.exception;

import lombok.Getter;

/**
 * Raised when an input file carries an extension no reader understands.
 * Fatal for the run.
 */
@Getter
public class UnsupportedFormatException extends RuntimeException {

    private final String extension;

    public UnsupportedFormatException(String extension) {
        super("Unsupported file format: " + (extension == null || extension.isEmpty() ? "<none>" : extension));
        this.extension = extension;
    }
}
