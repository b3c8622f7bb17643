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
package fr.aneo.delta.domain.xctest;

import fr.aneo.delta.domain.DeltaUpdateException;
import fr.aneo.delta.domain.InvalidRequestException;
import fr.aneo.delta.domain.OperationFactory;
import fr.aneo.delta.domain.OperationHandle;
import fr.aneo.delta.domain.OperationOutcome;
import fr.aneo.delta.domain.OperationReporter;
import fr.aneo.delta.domain.SessionId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Starts XCTest runs on a {@link TestTarget}, one per session.
 * <p>
 * Starting a run resolves the test bundle and prepares a working directory synchronously. A bundle
 * removed since the request was validated is rejected there. The run itself executes on the configured
 * executor and reports:
 * <ul>
 *   <li>the result bundle path as output location, when the request asks for it;</li>
 *   <li>one {@link TestRunUpdate} per test, as soon as the target reports it;</li>
 *   <li>the target's log output;</li>
 *   <li>a final outcome derived from how the target returned.</li>
 * </ul>
 *
 * <h2>Outcome Mapping</h2>
 * <table>
 *   <tr><th>Run ended with</th><th>Outcome</th></tr>
 *   <tr><td>{@link TestTarget.Completion#FINISHED}</td><td>success, even if a cancellation arrived late</td></tr>
 *   <tr><td>{@link TestTarget.Completion#STOPPED}</td><td>cancelled</td></tr>
 *   <tr><td>an exception after a cancellation request</td><td>cancelled</td></tr>
 *   <tr><td>an exception</td><td>failure carrying the exception</td></tr>
 *   <tr><td>an {@link Error}</td><td>failure carrying the error, which is then rethrown</td></tr>
 *   <tr><td>the request timeout elapsing</td><td>failure</td></tr>
 * </table>
 * Individual test failures are results, not operation failures: a run with failing tests completes.
 */
public final class XCTestOperationFactory implements OperationFactory<XCTestRunRequest, TestRunUpdate> {
  private static final Logger logger = LoggerFactory.getLogger(XCTestOperationFactory.class);

  static final String RESULT_BUNDLE_NAME = "results.xcresult";

  private final TestTarget target;
  private final XCTestBundleStorage bundleStorage;
  private final TemporaryDirectory temporaryDirectory;
  private final Executor executor;
  private final ScheduledExecutorService scheduler;

  /**
   * @param target             the target running the tests
   * @param bundleStorage      resolves installed test bundles
   * @param temporaryDirectory provides per-run working directories
   * @param executor           runs the test runs, one task per session
   * @param scheduler          enforces request timeouts
   */
  public XCTestOperationFactory(TestTarget target,
                                XCTestBundleStorage bundleStorage,
                                TemporaryDirectory temporaryDirectory,
                                Executor executor,
                                ScheduledExecutorService scheduler) {
    this.target = requireNonNull(target, "target must not be null");
    this.bundleStorage = requireNonNull(bundleStorage, "bundleStorage must not be null");
    this.temporaryDirectory = requireNonNull(temporaryDirectory, "temporaryDirectory must not be null");
    this.executor = requireNonNull(executor, "executor must not be null");
    this.scheduler = requireNonNull(scheduler, "scheduler must not be null");
  }

  @Override
  public OperationHandle start(SessionId sessionId, XCTestRunRequest request, OperationReporter<TestRunUpdate> reporter) {
    var bundlePath = bundleStorage.bundlePath(request.testBundleId())
                                  .orElseThrow(() -> new InvalidRequestException(
                                    "Test bundle " + request.testBundleId() + " is not installed on target " + target.udid()));

    Path workingDirectory;
    try {
      workingDirectory = temporaryDirectory.create("xctest-" + sessionId.asString());
    } catch (IOException e) {
      throw new DeltaUpdateException("Failed to create working directory for session " + sessionId.asString(), e);
    }

    var resultBundlePath = request.collectResultBundle() ? workingDirectory.resolve(RESULT_BUNDLE_NAME) : null;
    var launch = new TestLaunch(sessionId, request, bundlePath, workingDirectory, resultBundlePath);
    var control = new RunControl();

    executor.execute(() -> run(launch, reporter, control));
    return control;
  }

  private void run(TestLaunch launch, OperationReporter<TestRunUpdate> reporter, RunControl control) {
    MDC.put("sessionId", launch.sessionId().asString());
    var timeoutTimer = scheduleTimeout(launch.request().timeout(), control);
    long start = System.nanoTime();
    try {
      logger.info("Running test bundle {} on target {}", launch.request().testBundleId(), target.udid());
      if (launch.resultBundlePath() != null) {
        reporter.reportOutputLocation(launch.resultBundlePath().toString());
      }

      var completion = target.runTests(launch, new ReportingListener(reporter), control);
      reporter.reportOutcome(outcomeOf(completion, control, launch.request().timeout()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      reporter.reportOutcome(outcomeOf(e, control, launch.request().timeout()));
    } catch (Exception e) {
      if (!control.isCancelled()) {
        logger.error("Test run of {} failed", launch.request().testBundleId(), e);
      }
      reporter.reportOutcome(outcomeOf(e, control, launch.request().timeout()));
    } catch (Error e) {
      logger.error("Test run of {} aborted", launch.request().testBundleId(), e);
      reporter.reportOutcome(OperationOutcome.failure(e));
      throw e;
    } finally {
      if (timeoutTimer != null) timeoutTimer.cancel(false);
      logger.info("Test run ended after {} ms", NANOSECONDS.toMillis(System.nanoTime() - start));
      MDC.remove("sessionId");
    }
  }

  private ScheduledFuture<?> scheduleTimeout(Duration timeout, RunControl control) {
    if (timeout == null) return null;
    return scheduler.schedule(control::timeOut, timeout.toNanos(), NANOSECONDS);
  }

  private static OperationOutcome outcomeOf(TestTarget.Completion completion, RunControl control, Duration timeout) {
    if (completion != TestTarget.Completion.STOPPED) return OperationOutcome.SUCCESS;
    if (control.timedOut) return timedOut(timeout);
    return OperationOutcome.CANCELLED;
  }

  private static OperationOutcome outcomeOf(Exception error, RunControl control, Duration timeout) {
    if (control.timedOut) return timedOut(timeout);
    if (control.cancelled) return OperationOutcome.CANCELLED;
    return OperationOutcome.failure(error);
  }

  private static OperationOutcome timedOut(Duration timeout) {
    return OperationOutcome.failure("Test run timed out after " + timeout);
  }

  private static final class RunControl implements OperationHandle, CancellationSignal {
    private volatile boolean cancelled;
    private volatile boolean timedOut;

    @Override
    public void cancel() {
      cancelled = true;
    }

    @Override
    public boolean isCancelled() {
      return cancelled;
    }

    void timeOut() {
      logger.warn("Test run timed out, stopping it");
      timedOut = true;
      cancelled = true;
    }
  }

  private static final class ReportingListener implements TestRunListener {
    private final OperationReporter<TestRunUpdate> reporter;

    private ReportingListener(OperationReporter<TestRunUpdate> reporter) {
      this.reporter = reporter;
    }

    @Override
    public void onTestResult(TestRunUpdate update) {
      logger.debug("Test {} {}", update.testName(), update.status());
      reporter.reportResult(update);
    }

    @Override
    public void onLog(String text) {
      reporter.reportLog(text);
    }
  }
}
