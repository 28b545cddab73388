package teranet.mapdev.propertyetl.util;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Helpers for deciding a file's tabular format from its name.
 */
public class FileFormatUtil {

    private FileFormatUtil() {
        // Private constructor to prevent instantiation
    }

    /**
     * Lower-case extension including the leading dot, e.g. ".csv".
     * Returns an empty string for names without an extension or ending in a dot.
     *
     * @param path the file path
     * @return the extension, never null
     */
    public static String getExtension(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int lastDotIndex = name.lastIndexOf('.');
        if (lastDotIndex <= 0 || lastDotIndex == name.length() - 1) {
            return "";
        }
        return name.substring(lastDotIndex).toLowerCase(Locale.ROOT);
    }

    public static boolean isCsv(Path path) {
        return ".csv".equals(getExtension(path));
    }

    public static boolean isExcel(Path path) {
        String extension = getExtension(path);
        return ".xlsx".equals(extension) || ".xls".equals(extension);
    }
}
