/**
 * Normalized service model shared by the dispatcher, aggregation, and output stages.
 * <p><strong>Role:</strong> Domain layer; immutable records and sealed hierarchies with no I/O.</p>
 * <p><strong>Thread-safety:</strong> All types are immutable and safe to share between fetch workers.</p>
 *
 * @since 0.1.0
 */
package nl.pdok.spider.domain.service;
