/**
 * Capability readers, one per supported service protocol.
 *
 * <p>Each reader fetches its documents through a {@link nl.pdok.spider.application.port.DocumentFetcher} and
 * normalizes them into a {@link nl.pdok.spider.domain.service.Service}; absent fields become empty strings.</p>
 */
package nl.pdok.spider.infrastructure.capabilities;
