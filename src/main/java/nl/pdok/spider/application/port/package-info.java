/**
 * <strong>Purpose:</strong> Ports between the harvest pipeline and the outside world.
 * <p><strong>Pipeline role:</strong> Application layer; adapters in {@code infrastructure} implement these
 * interfaces for HTTP and CSW.</p>
 * <p><strong>Concurrency:</strong> Implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package nl.pdok.spider.application.port;
