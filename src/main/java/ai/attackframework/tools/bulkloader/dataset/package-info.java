/**
 * In-memory tabular data and its conversion to indexable documents.
 */
package ai.attackframework.tools.bulkloader.dataset;
