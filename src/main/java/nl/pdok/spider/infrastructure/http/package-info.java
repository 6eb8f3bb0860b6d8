/**
 * HTTP transport for catalogue and capability requests.
 *
 * @since 0.1.0
 */
package nl.pdok.spider.infrastructure.http;
