/**
 * Output documents: mapping of domain values to ordered maps, JSON and YAML rendering, and file or stdout sinks.
 */
package nl.pdok.spider.infrastructure.output;
