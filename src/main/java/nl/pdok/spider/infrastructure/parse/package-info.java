/**
 * Tolerant XML, JSON, and URL parsing shared by the catalogue client and capability readers.
 *
 * @since 0.1.0
 */
package nl.pdok.spider.infrastructure.parse;
