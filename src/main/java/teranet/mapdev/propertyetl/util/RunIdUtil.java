package teranet.mapdev.propertyetl.util;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Manages the pipeline run id in the SLF4J MDC so every log line of a run can
 * be correlated. The console pattern prints it through {@code %X{runId}}.
 */
public class RunIdUtil {

    private static final String RUN_ID_KEY = "runId";
    private static final String NO_RUN_ID = "NO-RUN-ID";

    private RunIdUtil() {
    }

    /**
     * Starts a new run id and stores it in the MDC.
     * @return the generated id
     */
    public static String startRun() {
        String runId = UUID.randomUUID().toString();
        MDC.put(RUN_ID_KEY, runId);
        return runId;
    }

    /**
     * @return the active run id or "NO-RUN-ID" when none is set
     */
    public static String getCurrentRunId() {
        String runId = MDC.get(RUN_ID_KEY);
        return runId != null ? runId : NO_RUN_ID;
    }

    /**
     * Removes the run id from the MDC. Call from a finally block.
     */
    public static void clearRunId() {
        MDC.remove(RUN_ID_KEY);
    }

    public static boolean hasRunId() {
        return MDC.get(RUN_ID_KEY) != null;
    }
}
