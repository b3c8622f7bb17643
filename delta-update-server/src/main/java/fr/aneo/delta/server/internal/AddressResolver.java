/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package fr.aneo.delta.server.internal;

import com.google.common.base.CharMatcher;
import com.google.common.net.HostAndPort;
import com.google.common.net.InetAddresses;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Optional;

import static com.google.common.base.Strings.isNullOrEmpty;

/**
 * Parses the listening address of the server.
 * <p>
 * Accepted forms are {@code host:port}, {@code [ipv6]:port} and {@code scheme://host:port}. The
 * scheme, when present, is ignored.
 */
public final class AddressResolver {

  private AddressResolver() {
  }

  /**
   * @param rawAddress the address; may be {@code null} or blank
   * @return the socket address, or empty if {@code rawAddress} is {@code null} or blank
   * @throws IllegalArgumentException if the address is malformed or its host cannot be resolved
   */
  public static Optional<InetSocketAddress> resolve(String rawAddress) {
    if (rawAddress == null || rawAddress.isBlank()) return Optional.empty();

    var address = rawAddress.trim();
    if (CharMatcher.whitespace().matchesAnyOf(address)) {
      throw new IllegalArgumentException("Address must not contain whitespace: " + rawAddress);
    }

    var hostAndPort = address.contains("://") ? fromUri(address) : fromHostAndPort(address);
    return Optional.of(new InetSocketAddress(toInetAddress(hostAndPort.getHost()), hostAndPort.getPort()));
  }

  private static HostAndPort fromUri(String address) {
    URI uri;
    try {
      uri = new URI(address);
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid address URI: " + address, e);
    }
    if (uri.getHost() == null || uri.getPort() == -1) {
      throw new IllegalArgumentException("Address URI must include a host and a port: " + address);
    }
    if (!isNullOrEmpty(uri.getPath()) || uri.getQuery() != null || uri.getFragment() != null) {
      throw new IllegalArgumentException("Address URI must not include a path, query or fragment: " + address);
    }
    return HostAndPort.fromParts(stripBrackets(uri.getHost()), uri.getPort());
  }

  private static HostAndPort fromHostAndPort(String address) {
    HostAndPort hostAndPort;
    try {
      hostAndPort = HostAndPort.fromString(address);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid host:port address: " + address, e);
    }
    if (!hostAndPort.hasPort()) {
      throw new IllegalArgumentException("Address must include a port: " + address);
    }
    return hostAndPort;
  }

  private static InetAddress toInetAddress(String host) {
    if (InetAddresses.isInetAddress(host)) {
      return InetAddresses.forString(host);
    }
    try {
      return InetAddress.getByName(host);
    } catch (UnknownHostException e) {
      throw new IllegalArgumentException("Unknown host: " + host, e);
    }
  }

  private static String stripBrackets(String host) {
    return host.startsWith("[") && host.endsWith("]") ? host.substring(1, host.length() - 1) : host;
  }
}
