package nl.pdok.spider.domain.service;

/**
 * Signals an output mode that is not implemented for a protocol, such as grouping Atom feeds by dataset.
 *
 * <p>Distinct from transient failures: the request is rejected before any network call is made.</p>
 */
public class UnsupportedModeException extends UnsupportedOperationException {
  private static final long serialVersionUID = 1L;

  private final ServiceProtocol protocol;
  private final String mode;

  /**
   * Creates the exception.
   *
   * @param protocol protocol that cannot be rendered in {@code mode}
   * @param mode output mode name
   */
  public UnsupportedModeException(ServiceProtocol protocol, String mode) {
    super(mode + " output for " + protocol.catalogueValue() + " services has not been implemented");
    this.protocol = protocol;
    this.mode = mode;
  }

  /** @return rejected protocol */
  public ServiceProtocol protocol() {
    return protocol;
  }

  /** @return rejected output mode */
  public String mode() {
    return mode;
  }
}
