/**
 * Loader configuration: environment and JSON sources, keys, and defaults.
 *
 * <p>{@link ai.attackframework.tools.bulkloader.utils.config.LoaderConfig} is immutable and validated
 * on construction.</p>
 */
package ai.attackframework.tools.bulkloader.utils.config;
