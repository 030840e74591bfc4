/**
 * Root package for the Attack Framework tabular bulk loader.
 *
 * <p>Hosts {@link ai.attackframework.tools.bulkloader.BulkLoader}, the single entry point that
 * connects to an OpenSearch cluster, manages target indices, and bulk-inserts
 * {@link ai.attackframework.tools.bulkloader.dataset.Dataset} rows. Classes here are light
 * adapters; request fan-out and client construction live in
 * {@link ai.attackframework.tools.bulkloader.utils.opensearch}.</p>
 */
package ai.attackframework.tools.bulkloader;
