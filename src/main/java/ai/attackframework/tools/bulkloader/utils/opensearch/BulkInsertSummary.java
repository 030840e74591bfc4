package ai.attackframework.tools.bulkloader.utils.opensearch;

/**
 * Outcome of one bulk insert call. Failures are reported here and in the log, never thrown.
 *
 * @param submitted     documents taken from the source
 * @param created       items the engine answered with {@code 201 created}
 * @param notCreated    items answered with any other status, including overwrites ({@code 200 updated})
 * @param failedBatches bulk requests that failed as a whole (transport or engine error)
 * @param batches       bulk requests sent
 */
public record BulkInsertSummary(int submitted, int created, int notCreated, int failedBatches, int batches) {

    /** True when every submitted document was created. */
    public boolean allCreated() {
        return failedBatches == 0 && notCreated == 0 && created == submitted;
    }
}
