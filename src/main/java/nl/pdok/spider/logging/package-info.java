/**
 * Logging setup and hygiene helpers.
 * <p><strong>Observability:</strong> Logback is the runtime backend; core components receive their SLF4J loggers
 * through constructors.</p>
 *
 * @since 0.1.0
 */
package nl.pdok.spider.logging;
