package teranet.mapdev.propertyetl.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * Raised when a source file cannot be turned into a dataset: I/O failure,
 * empty file or missing header.
 */
@Getter
public class DatasetReadException extends RuntimeException {

    private final Path path;

    public DatasetReadException(Path path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public DatasetReadException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }
}
