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
package fr.aneo.delta.server;

import fr.aneo.delta.domain.DeltaUpdateManager;
import fr.aneo.delta.domain.xctest.TestRunUpdate;
import fr.aneo.delta.domain.xctest.XCTestRunRequest;
import fr.aneo.delta.server.internal.AddressResolver;
import fr.aneo.delta.server.internal.DeltaUpdateGrpcService;
import fr.aneo.delta.server.internal.GsonMessageCodec;
import fr.aneo.delta.server.internal.RequestDecoder;
import fr.aneo.delta.server.internal.ResultEncoder;
import io.grpc.BindableService;
import io.grpc.Server;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * gRPC server exposing a {@link DeltaUpdateManager} through the {@code DeltaUpdate} service.
 *
 * <h2>Configuration</h2>
 * <dl>
 *   <dt><code>DeltaUpdate__Server__Address</code></dt>
 *   <dd>Address where the server listens (format: "host:port"). Defaults to "0.0.0.0:8080".</dd>
 * </dl>
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>Create the server with {@link #create} or {@link #forXCTest}</li>
 *   <li>{@link #start()} binds the address and registers a JVM shutdown hook</li>
 *   <li>{@link #shutdown()} stops accepting calls, waits up to 30 seconds for in-flight ones, then
 *       closes the manager</li>
 * </ol>
 */
public class DeltaUpdateServer {
  private static final Logger logger = LoggerFactory.getLogger(DeltaUpdateServer.class);

  static final String ADDRESS_ENV = "DeltaUpdate__Server__Address";

  private final BindableService service;
  private final AutoCloseable manager;
  private volatile Server server;
  private InetSocketAddress address;

  private DeltaUpdateServer(BindableService service, AutoCloseable manager) {
    this.service = service;
    this.manager = manager;
  }

  /**
   * Creates a server for any kind of operation.
   *
   * @param manager        the manager serving the sessions
   * @param requestDecoder decodes {@code StartSession} requests
   * @param resultEncoder  encodes result fragments in {@code Poll} replies
   * @param <R>            the request type
   * @param <F>            the result fragment type
   * @return a server, not started
   */
  public static <R, F> DeltaUpdateServer create(DeltaUpdateManager<R, F> manager,
                                                RequestDecoder<R> requestDecoder,
                                                ResultEncoder<F> resultEncoder) {
    requireNonNull(manager, "manager cannot be null");
    return new DeltaUpdateServer(new DeltaUpdateGrpcService<>(manager, requestDecoder, resultEncoder), manager);
  }

  /**
   * Creates a server for XCTest runs, exchanging requests and results as JSON.
   *
   * @param manager the XCTest manager
   * @return a server, not started
   */
  public static DeltaUpdateServer forXCTest(DeltaUpdateManager<XCTestRunRequest, TestRunUpdate> manager) {
    var codec = GsonMessageCodec.forXCTest();
    return create(manager, codec, codec);
  }

  /**
   * Binds the server and starts serving.
   * <p>
   * This method should be called only once per instance.
   *
   * @throws IOException              if the server cannot bind its address
   * @throws IllegalArgumentException if {@code DeltaUpdate__Server__Address} is malformed
   */
  public void start() throws IOException {
    address = AddressResolver.resolve(System.getenv(ADDRESS_ENV))
                             .orElseGet(() -> {
                               logger.warn("Environment variable {} is not set. Falling back to default 0.0.0.0:8080", ADDRESS_ENV);
                               return new InetSocketAddress("0.0.0.0", 8080);
                             });

    server = NettyServerBuilder.forAddress(address)
                               .permitKeepAliveWithoutCalls(true)
                               .permitKeepAliveTime(30, SECONDS)
                               .keepAliveTime(30, SECONDS)
                               .keepAliveTimeout(10, SECONDS)
                               .maxInboundMessageSize(8 * 1024 * 1024)
                               .addService(service)
                               .build();

    server.start();
    logger.info("Delta update server started on {}:{}", address.getHostString(), address.getPort());

    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      try {
        shutdown();
      } catch (InterruptedException e) {
        logger.warn("Server shutdown interrupted");
        Thread.currentThread().interrupt();
      }
    }, "delta-update-server-shutdown"));
  }

  /**
   * Stops the server, then closes the manager. Safe to call several times.
   *
   * @throws InterruptedException if interrupted while waiting for in-flight calls
   */
  public synchronized void shutdown() throws InterruptedException {
    if (server == null) return;

    logger.info("Initiating graceful shutdown of the delta update server...");
    server.shutdown();
    if (!server.awaitTermination(30, SECONDS)) {
      logger.warn("Graceful shutdown timed out. Forcing shutdown...");
      server.shutdownNow();
      server.awaitTermination(5, SECONDS);
    }
    server = null;
    closeManager();
    logger.info("Delta update server stopped.");
  }

  public void blockUntilShutdown() throws InterruptedException {
    var current = server;
    if (current != null) current.awaitTermination();
  }

  /**
   * @return the address the server listens on, or {@code null} before {@link #start()}
   */
  public InetSocketAddress address() {
    return address;
  }

  private void closeManager() {
    try {
      manager.close();
    } catch (Exception e) {
      logger.error("Failed to close the delta update manager", e);
    }
  }
}
