/**
 * Catalogue records as harvested from the CSW endpoint, before capabilities are resolved.
 *
 * @since 0.1.0
 */
package nl.pdok.spider.domain.catalogue;
