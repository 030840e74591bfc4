/**
 * OpenSearch client construction and bulk submission.
 *
 * <p>Builds TLS/basic-auth clients from {@link ai.attackframework.tools.bulkloader.utils.config.LoaderConfig},
 * fans bulk requests out over a worker pool, and formats request summaries for logging. Calls block;
 * nothing here retries.</p>
 */
package ai.attackframework.tools.bulkloader.utils.opensearch;
