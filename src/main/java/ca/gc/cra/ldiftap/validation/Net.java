package ca.gc.cra.ldiftap.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Network endpoint validation for Kafka bootstrap server lists.
 * <p><strong>Why:</strong> Catches typos in {@code kafkaBootstrap} at startup rather than when the producer first
 * tries to connect.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @implNote IPv6 literals must be bracketed; hostnames are checked against RFC 1123 label rules without DNS
 * resolution.
 * @since 0.1.0
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a comma-separated list of {@code host:port} endpoints.
   *
   * @param name parameter name used in diagnostics
   * @param value raw list
   * @return normalized list joined with commas
   * @throws IllegalArgumentException if the list is empty or any endpoint is malformed
   */
  public static String validateHostPortList(String name, String value) {
    List<String> endpoints = Strings.parseList(name, value);
    if (endpoints.isEmpty()) {
      throw new IllegalArgumentException(name + " must list at least one host:port");
    }
    List<String> normalized = new ArrayList<>(endpoints.size());
    for (String endpoint : endpoints) {
      normalized.add(validateHostPort(endpoint));
    }
    return String.join(",", normalized);
  }

  /**
   * Validates one {@code host:port} endpoint.
   *
   * @param value endpoint text
   * @return normalized endpoint
   * @throws IllegalArgumentException if malformed
   */
  public static String validateHostPort(String value) {
    String sanitized = Strings.requireNonBlank("host:port", value);
    String host;
    String portPart;
    if (sanitized.startsWith("[")) {
      int idx = sanitized.indexOf(']');
      if (idx < 0) {
        throw new IllegalArgumentException("host:port must close IPv6 literal with ']'");
      }
      if (idx + 2 > sanitized.length() || sanitized.charAt(idx + 1) != ':') {
        throw new IllegalArgumentException("host:port must include :<port> after IPv6 literal");
      }
      String literal = sanitized.substring(1, idx);
      validateIpv6(literal);
      host = '[' + literal + ']';
      portPart = sanitized.substring(idx + 2);
    } else {
      int lastColon = sanitized.lastIndexOf(':');
      if (lastColon <= 0 || lastColon == sanitized.length() - 1) {
        throw new IllegalArgumentException("host:port must use HOST:PORT format (was " + sanitized + ")");
      }
      host = sanitized.substring(0, lastColon);
      portPart = sanitized.substring(lastColon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
      }
      if (IPV4_PATTERN.matcher(host).matches()) {
        validateIpv4Octets(host);
      } else {
        validateHostname(host);
      }
    }
    int port;
    try {
      port = Integer.parseInt(portPart);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("port must be numeric (was " + portPart + ")", ex);
    }
    Numbers.requireRange("port", port, 1, 65535);
    return host + ':' + port;
  }

  private static void validateHostname(String host) {
    if (host.length() > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + host.length());
    }
    for (String label : host.split("\\.", -1)) {
      if (label.isEmpty() || label.length() > MAX_LABEL_LENGTH) {
        throw new IllegalArgumentException("invalid hostname label in " + host);
      }
      if (!isAsciiAlnum(label.charAt(0)) || !isAsciiAlnum(label.charAt(label.length() - 1))) {
        throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
      }
      for (int i = 1; i < label.length() - 1; i++) {
        char c = label.charAt(i);
        if (!isAsciiAlnum(c) && c != '-') {
          throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
        }
      }
    }
  }

  private static void validateIpv4Octets(String host) {
    for (String part : host.split("\\.")) {
      Numbers.requireRange("IPv4 octet", Integer.parseInt(part), 0, 255);
    }
  }

  private static void validateIpv6(String host) {
    try {
      if (!(InetAddress.getByName(host) instanceof Inet6Address)) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv6 literal: " + host, ex);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
  }
}
