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

import fr.aneo.delta.api.grpc.v1.DeltaUpdateCommon;
import fr.aneo.delta.api.grpc.v1.DeltaUpdateGrpc.DeltaUpdateImplBase;
import fr.aneo.delta.domain.Cursor;
import fr.aneo.delta.domain.DeltaSnapshot;
import fr.aneo.delta.domain.DeltaUpdateManager;
import fr.aneo.delta.domain.InvalidRequestException;
import fr.aneo.delta.domain.SessionAlreadyExistsException;
import fr.aneo.delta.domain.SessionCapacityExceededException;
import fr.aneo.delta.domain.SessionId;
import fr.aneo.delta.domain.SessionNotFoundException;
import fr.aneo.delta.domain.SessionState;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import static fr.aneo.delta.api.grpc.v1.DeltaUpdateCommon.PollReply;
import static fr.aneo.delta.api.grpc.v1.DeltaUpdateCommon.PollRequest;
import static fr.aneo.delta.api.grpc.v1.DeltaUpdateCommon.StartSessionReply;
import static fr.aneo.delta.api.grpc.v1.DeltaUpdateCommon.StartSessionRequest;
import static fr.aneo.delta.api.grpc.v1.DeltaUpdateCommon.TerminateReply;
import static fr.aneo.delta.api.grpc.v1.DeltaUpdateCommon.TerminateRequest;
import static java.util.Objects.requireNonNull;

/**
 * gRPC front end of a {@link DeltaUpdateManager}.
 * <p>
 * Requests are decoded with a {@link RequestDecoder} and result fragments encoded with a
 * {@link ResultEncoder}, so that the wire format stays independent of the operation.
 *
 * <h4>Error Mapping</h4>
 * <ul>
 *   <li>{@link InvalidRequestException} and malformed input: {@code INVALID_ARGUMENT}</li>
 *   <li>{@link SessionAlreadyExistsException}: {@code ALREADY_EXISTS}</li>
 *   <li>{@link SessionNotFoundException}: {@code NOT_FOUND}</li>
 *   <li>{@link SessionCapacityExceededException}: {@code RESOURCE_EXHAUSTED}</li>
 *   <li>anything else: {@code INTERNAL}</li>
 * </ul>
 * A failed operation is not an RPC error: it is reported in the {@code Poll} reply.
 *
 * @param <R> the request type
 * @param <F> the result fragment type
 */
public class DeltaUpdateGrpcService<R, F> extends DeltaUpdateImplBase {
  private static final Logger logger = LoggerFactory.getLogger(DeltaUpdateGrpcService.class);

  private final DeltaUpdateManager<R, F> manager;
  private final RequestDecoder<R> requestDecoder;
  private final ResultEncoder<F> resultEncoder;

  public DeltaUpdateGrpcService(DeltaUpdateManager<R, F> manager, RequestDecoder<R> requestDecoder, ResultEncoder<F> resultEncoder) {
    this.manager = requireNonNull(manager, "manager cannot be null");
    this.requestDecoder = requireNonNull(requestDecoder, "requestDecoder cannot be null");
    this.resultEncoder = requireNonNull(resultEncoder, "resultEncoder cannot be null");
  }

  /**
   * Starts a session. An empty {@code session_id} lets the manager generate one.
   */
  @Override
  public void startSession(StartSessionRequest request, StreamObserver<StartSessionReply> responseObserver) {
    MDC.put("sessionId", request.getSessionId());
    try {
      var operationRequest = requestDecoder.decode(request.getRequestJson());
      var sessionId = request.getSessionId().isEmpty()
        ? manager.startSession(operationRequest)
        : manager.startSession(SessionId.from(request.getSessionId()), operationRequest);

      responseObserver.onNext(StartSessionReply.newBuilder()
                                               .setSessionId(sessionId.asString())
                                               .build());
      responseObserver.onCompleted();
    } catch (RuntimeException e) {
      responseObserver.onError(toStatusException("StartSession", e));
    } finally {
      MDC.remove("sessionId");
    }
  }

  @Override
  public void poll(PollRequest request, StreamObserver<PollReply> responseObserver) {
    try {
      var cursor = request.hasCursor()
        ? new Cursor(request.getCursor().getResultPosition(), request.getCursor().getLogPosition())
        : Cursor.START;
      var snapshot = manager.poll(SessionId.from(request.getSessionId()), cursor);

      responseObserver.onNext(toPollReply(snapshot));
      responseObserver.onCompleted();
    } catch (RuntimeException e) {
      responseObserver.onError(toStatusException("Poll", e));
    }
  }

  /**
   * Signals the operation of a session to stop.
   * <p>
   * Replies with the state right after signalling, or with the terminal state when {@code wait}
   * is set.
   */
  @Override
  public void terminate(TerminateRequest request, StreamObserver<TerminateReply> responseObserver) {
    try {
      var sessionId = SessionId.from(request.getSessionId());
      var termination = manager.terminate(sessionId);

      if (!request.getWait()) {
        responseObserver.onNext(toTerminateReply(sessionId, manager.state(sessionId)));
        responseObserver.onCompleted();
        return;
      }

      termination.whenComplete((state, error) -> {
        if (error != null) {
          responseObserver.onError(toStatusException("Terminate", error));
        } else {
          responseObserver.onNext(toTerminateReply(sessionId, state));
          responseObserver.onCompleted();
        }
      });
    } catch (RuntimeException e) {
      responseObserver.onError(toStatusException("Terminate", e));
    }
  }

  private PollReply toPollReply(DeltaSnapshot<F> snapshot) {
    var reply = PollReply.newBuilder()
                         .setSessionId(snapshot.sessionId().asString())
                         .setLogOutput(snapshot.logOutput())
                         .setState(toGrpc(snapshot.state()))
                         .setNextCursor(DeltaUpdateCommon.Cursor.newBuilder()
                                                                .setResultPosition(snapshot.nextCursor().resultPosition())
                                                                .setLogPosition(snapshot.nextCursor().logPosition()));
    snapshot.results().forEach(result -> reply.addResultsJson(resultEncoder.encode(result)));
    if (snapshot.outputLocation() != null) reply.setOutputLocation(snapshot.outputLocation());
    if (snapshot.hasError()) reply.setError(snapshot.errorMessage());
    return reply.build();
  }

  private static TerminateReply toTerminateReply(SessionId sessionId, SessionState state) {
    return TerminateReply.newBuilder()
                         .setSessionId(sessionId.asString())
                         .setState(toGrpc(state))
                         .build();
  }

  static DeltaUpdateCommon.SessionState toGrpc(SessionState state) {
    return switch (state) {
      case PENDING -> DeltaUpdateCommon.SessionState.SESSION_STATE_PENDING;
      case RUNNING -> DeltaUpdateCommon.SessionState.SESSION_STATE_RUNNING;
      case COMPLETED -> DeltaUpdateCommon.SessionState.SESSION_STATE_COMPLETED;
      case FAILED -> DeltaUpdateCommon.SessionState.SESSION_STATE_FAILED;
      case CANCELLED -> DeltaUpdateCommon.SessionState.SESSION_STATE_CANCELLED;
    };
  }

  private static StatusRuntimeException toStatusException(String method, Throwable error) {
    Status status;
    if (error instanceof InvalidRequestException || error instanceof IllegalArgumentException) {
      status = Status.INVALID_ARGUMENT;
    } else if (error instanceof SessionAlreadyExistsException) {
      status = Status.ALREADY_EXISTS;
    } else if (error instanceof SessionNotFoundException) {
      status = Status.NOT_FOUND;
    } else if (error instanceof SessionCapacityExceededException) {
      status = Status.RESOURCE_EXHAUSTED;
    } else {
      logger.error("{} failed unexpectedly", method, error);
      status = Status.INTERNAL;
    }

    var description = error.getMessage() != null ? error.getMessage() : error.toString();
    logger.debug("{} rejected with {}: {}", method, status.getCode(), description);
    return status.withDescription(description).withCause(error).asRuntimeException();
  }
}
