package com.codeheadsystems.revoker.client.config;

import com.codeheadsystems.revoker.client.exceptions.InvalidAddressException;
import com.codeheadsystems.revoker.client.exceptions.NoAddressConfiguredException;
import java.net.URI;
import java.net.URISyntaxException;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Picks the Salesforce base URL for an invocation.
 * <p>
 * An address supplied with the request wins over the {@code ADDRESS} environment default.
 * Surrounding whitespace is trimmed and exactly one trailing slash is stripped so paths can be
 * appended with a leading slash.  The result must be an absolute {@code http} or {@code https}
 * URL with a host.
 */
@Singleton
public class TargetResolver {

  /**
   * Instantiates a new Target resolver.
   */
  @Inject
  public TargetResolver() {
  }

  /**
   * Resolves the base URL.
   *
   * @param requestAddress per-request override, may be null
   * @param context        the invocation context
   * @return the normalized base URL
   * @throws NoAddressConfiguredException if neither source has a value
   * @throws InvalidAddressException      if the value is not a usable base URL
   */
  public String resolve(final String requestAddress, final RevokerContext context) {
    String address = requestAddress != null && !requestAddress.isBlank()
        ? requestAddress.trim()
        : context.env(RevokerContext.ADDRESS).orElseThrow(NoAddressConfiguredException::new).trim();
    if (address.endsWith("/")) {
      address = address.substring(0, address.length() - 1);
    }
    if (address.isBlank()) {
      throw new NoAddressConfiguredException();
    }
    validate(address);
    return address;
  }

  private static void validate(final String address) {
    URI uri;
    try {
      uri = new URI(address);
    } catch (URISyntaxException e) {
      throw new InvalidAddressException(address, e.getReason(), e);
    }
    String scheme = uri.getScheme();
    if (!"https".equalsIgnoreCase(scheme) && !"http".equalsIgnoreCase(scheme)) {
      throw new InvalidAddressException(address, "scheme must be http or https", null);
    }
    if (uri.getHost() == null) {
      throw new InvalidAddressException(address, "no host", null);
    }
    if (uri.getRawQuery() != null || uri.getRawFragment() != null) {
      throw new InvalidAddressException(address, "query and fragment are not allowed", null);
    }
  }
}
