package teranet.mapdev.propertyetl.util;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Header name handling shared by the file readers.
 */
public class ColumnNameUtil {

    private ColumnNameUtil() {
        // Private constructor to prevent instantiation
    }

    /**
     * Make header names unique by suffixing repeats with ".1", ".2", ...
     * Examples:
     *   [id, precio, precio]         → [id, precio, precio.1]
     *   [a, a, a.1]                  → [a, a.2, a.1]
     *
     * The first occurrence keeps its name, so files without repeated
     * headers come back unchanged.
     *
     * @param headers raw header names in file order
     * @return unique names in the same order
     */
    public static List<String> uniqueNames(List<String> headers) {
        Set<String> taken = new HashSet<>(headers);
        Set<String> assigned = new HashSet<>();
        List<String> result = new ArrayList<>(headers.size());
        for (String header : headers) {
            String name = header;
            if (!assigned.add(name)) {
                int suffix = 1;
                while (taken.contains(header + "." + suffix) || assigned.contains(header + "." + suffix)) {
                    suffix++;
                }
                name = header + "." + suffix;
                assigned.add(name);
            }
            result.add(name);
        }
        return result;
    }

    public static boolean hasDuplicates(List<String> headers) {
        return new HashSet<>(headers).size() != headers.size();
    }
}
