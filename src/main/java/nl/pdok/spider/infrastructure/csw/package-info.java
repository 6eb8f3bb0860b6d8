/**
 * CSW 2.0.2 catalogue adapter: request encoding, response parsing, and ISO 19139 field extraction.
 * <p><strong>Role:</strong> Driven adapter implementing {@link nl.pdok.spider.application.port.CatalogueClient}.</p>
 *
 * @since 0.1.0
 */
package nl.pdok.spider.infrastructure.csw;
