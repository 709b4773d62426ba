package ca.gc.cra.frametap.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Endpoint validation for ZeroMQ transport addresses and Kafka bootstrap servers.
 *
 * <p>ZeroMQ endpoints take the form {@code tcp://host:port}, {@code ipc://path} or {@code inproc://name}.
 * A bind endpoint may use {@code *} as the host.</p>
 *
 * @since 0.1.0
 */
public final class Endpoints {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Endpoints() {
    // Utility
  }

  /**
   * Validates a ZeroMQ endpoint.
   *
   * @param value candidate endpoint
   * @param bind {@code true} when the endpoint will be bound, which permits the {@code *} wildcard host
   * @return trimmed endpoint
   * @throws IllegalArgumentException if the scheme or address is malformed
   */
  public static String validateZmqEndpoint(String value, boolean bind) {
    String sanitized = Strings.requireNonBlank("endpoint", value);
    int schemeEnd = sanitized.indexOf("://");
    if (schemeEnd <= 0) {
      throw new IllegalArgumentException("endpoint must use scheme://address (was " + sanitized + ")");
    }
    String scheme = sanitized.substring(0, schemeEnd).toLowerCase(Locale.ROOT);
    String address = sanitized.substring(schemeEnd + 3);
    if (address.isEmpty()) {
      throw new IllegalArgumentException("endpoint address must not be empty (was " + sanitized + ")");
    }
    switch (scheme) {
      case "tcp" -> {
        if (bind && address.startsWith("*:")) {
          requirePort(address.substring(2));
        } else {
          validateHostPort(address);
        }
      }
      case "ipc", "inproc" -> {
        // opaque path or name
      }
      default -> throw new IllegalArgumentException(
          "endpoint scheme must be tcp, ipc or inproc (was " + scheme + ")");
    }
    return scheme + "://" + address;
  }

  /**
   * Validates a {@code host:port} pair supporting hostnames, IPv4, and bracketed IPv6 literals.
   *
   * @param value candidate pair
   * @return normalized {@code host:port}
   * @throws IllegalArgumentException if the value is malformed or the port is out of range
   */
  public static String validateHostPort(String value) {
    String sanitized = Strings.requireNonBlank("host:port", value);
    String host;
    String portPart;
    if (sanitized.startsWith("[")) {
      int idx = sanitized.indexOf(']');
      if (idx < 0 || idx + 2 > sanitized.length() || sanitized.charAt(idx + 1) != ':') {
        throw new IllegalArgumentException("host:port must use [IPv6]:PORT format");
      }
      host = sanitized.substring(1, idx);
      portPart = sanitized.substring(idx + 2);
      validateIpv6(host);
      host = '[' + host + ']';
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
        for (String octet : host.split("\\.")) {
          Numbers.requireRange("IPv4 octet", Integer.parseInt(octet), 0, 255);
        }
      } else {
        validateHostname(host);
      }
    }
    return host + ':' + requirePort(portPart);
  }

  private static int requirePort(String raw) {
    int port;
    try {
      port = Integer.parseInt(raw);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("port must be numeric (was " + raw + ")", ex);
    }
    Numbers.requireRange("port", port, 1, 65535);
    return port;
  }

  private static void validateHostname(String host) {
    if (host.isEmpty() || host.length() > MAX_HOSTNAME_LENGTH) {
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
