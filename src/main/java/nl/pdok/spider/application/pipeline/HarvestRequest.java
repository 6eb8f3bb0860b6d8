package nl.pdok.spider.application.pipeline;

import java.util.List;
import java.util.Objects;
import nl.pdok.spider.domain.catalogue.FilterMode;
import nl.pdok.spider.domain.service.ServiceProtocol;

/**
 * Parameters of one {@code layers} harvest.
 *
 * @param protocols protocols to query; ignored when {@code identifier} is set
 * @param owner organisation name
 * @param maxResults maximum records per protocol, {@code 0} for unlimited
 * @param identifier metadata id of a single service record, or empty
 * @param filterMode post-processing of catalogue records
 * @param mode output shape
 * @param sortRules flat-mode sort rules; empty keeps harvest order
 */
public record HarvestRequest(
    List<ServiceProtocol> protocols,
    String owner,
    int maxResults,
    String identifier,
    FilterMode filterMode,
    OutputMode mode,
    List<SortRule> sortRules) {

  public HarvestRequest {
    protocols = List.copyOf(protocols);
    Objects.requireNonNull(owner, "owner");
    identifier = Objects.requireNonNullElse(identifier, "").trim();
    Objects.requireNonNull(filterMode, "filterMode");
    Objects.requireNonNull(mode, "mode");
    sortRules = sortRules == null ? List.of() : List.copyOf(sortRules);
    if (maxResults < 0) {
      throw new IllegalArgumentException("maxResults must not be negative");
    }
  }
}
