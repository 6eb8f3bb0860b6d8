/**
 * Harvest pipeline: catalogue search and pagination, capability dispatch, aggregation, and output shaping.
 *
 * <p>Components receive their {@link org.slf4j.Logger} through their constructors.</p>
 */
package nl.pdok.spider.application.pipeline;
