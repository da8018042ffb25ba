/*
 * Copyright 2025 Andrew Aylett
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package eu.aylett.admission;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;
import java.util.function.DoubleSupplier;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import static eu.aylett.admission.SneakyThrows.sneakyThrow;

/**
 * Runs operations against a rate-limited provider, keeping within its budget.
 * <p>
 * Each logical call waits as long as the {@link DelayPolicy} says, is
 * dispatched with the active credential, and has its outcome read by the
 * {@link LimitFeedbackHook}. Transient failures are retried after a backoff,
 * up to a maximum number of attempts. Rate limiting moves every caller on to
 * the next credential. The caller sees either the result or one terminal
 * exception.
 * </p>
 * <p>
 * All callers share the window, limits and credentials, behind one lock.
 * Deciding a delay and reserving the slot it leads to happen together under
 * that lock, so two callers can't both see room for one more call. Nobody
 * sleeps holding it.
 * </p>
 *
 * @param <C>
 *          the credential type
 * @param <R>
 *          the type of result the feedback hook understands
 */
public final class ThrottleExecutor<C, R> {
  private static final Logger log = LoggerFactory.getLogger(ThrottleExecutor.class);

  public static final Duration DEFAULT_BASE_BACKOFF_DELAY = Duration.ofSeconds(2);
  public static final int DEFAULT_MAX_ATTEMPTS = 5;

  private final Object lock = new Object();
  private final String name;
  private final InstantSource clock;
  private final Sleeper sleeper;
  private final DelayPolicy delayPolicy;
  private final BackoffController backoff;
  private final Duration baseBackoffDelay;
  private final int maxAttempts;
  private final Predicate<Throwable> transientFailure;
  private final LimitFeedbackHook<R> feedbackHook;
  private final CredentialRotator<C> credentials;
  private final List<CredentialLane> lanes;
  private final @Nullable ScheduledExecutorService scheduler;

  private ThrottleExecutor(Builder<C, R> builder) {
    DoubleSupplier randomSource = builder.randomSource != null ? builder.randomSource : new SecureRandom()::nextDouble;
    this.name = builder.name;
    this.clock = builder.clock;
    this.sleeper = builder.sleeper;
    this.delayPolicy = builder.delayPolicy != null ? builder.delayPolicy : new PercentageDelayPolicy(randomSource);
    this.backoff = new BackoffController(builder.backoffFactor, builder.backoffMaxDelay, randomSource);
    this.baseBackoffDelay = builder.baseBackoffDelay;
    this.maxAttempts = builder.maxAttempts;
    this.transientFailure = builder.transientFailure;
    this.feedbackHook = builder.feedbackHook;
    this.credentials = new CredentialRotator<>(builder.credentials, builder.refresher);
    this.scheduler = builder.scheduler;

    var count = credentials.size();
    var laneList = new ArrayList<CredentialLane>(count);
    var shared = builder.windowScope == WindowScope.SHARED ? new CredentialLane(clock, builder.limits) : null;
    for (var i = 0; i < count; i++) {
      laneList.add(shared != null ? shared : new CredentialLane(clock, builder.limits));
    }
    this.lanes = List.copyOf(laneList);
  }

  /**
   * An executor with no credentials, the default limits and no feedback hook.
   */
  public static Builder<NoCredential, Object> builder() {
    return new Builder<>(List.of(NoCredential.INSTANCE), LimitFeedbackHook.none());
  }

  /**
   * Run the operation, waiting and retrying as needed.
   *
   * @throws CredentialsExhaustedException
   *           if every credential has been rate limited
   * @throws RetriesExhaustedException
   *           if the provider kept responding with transient failures
   * @throws ThrottleCancelledException
   *           if the thread was interrupted while waiting
   * @throws Exception
   *           anything else the operation threw, unchanged; a transient
   *           failure is rethrown from the last attempt
   */
  public <T extends R> T run(Operation<? super C, T> operation) throws Exception {
    var call = new ThrottledCall<T>(operation);
    while (true) {
      var admission = call.admit();
      if (!admission.delay.isZero()) {
        pause(admission.delay, admission);
      }
      var outcome = call.dispatch(admission);
      var step = call.complete(admission, outcome);
      if (step instanceof Done<T> done) {
        return done.value;
      }
      if (step instanceof Failed<T> failed) {
        throw sneakyThrow(failed.failure);
      }
      var retry = (Retry<T>) step;
      if (!retry.delay.isZero()) {
        pause(retry.delay, null);
      }
    }
  }

  /**
   * Run a callable that doesn't need the credential.
   */
  public <T extends R> T checkedAttempt(Callable<T> callable) throws Exception {
    return run(credential -> callable.call());
  }

  /**
   * Call the supplier, rethrowing whatever it or the throttle throws without
   * declaring it.
   */
  public <T extends R> T attempt(Supplier<T> supplier) {
    try {
      return run(credential -> supplier.get());
    } catch (Exception e) {
      throw sneakyThrow(e);
    }
  }

  /**
   * Call the runnable, rethrowing whatever it or the throttle throws without
   * declaring it. The feedback hook sees a {@code null} result.
   */
  public void attempt(Runnable runnable) {
    try {
      this.<R>run(credential -> {
        runnable.run();
        return null;
      });
    } catch (Exception e) {
      throw sneakyThrow(e);
    }
  }

  /**
   * Wrap a Supplier so that when it's called, it's throttled.
   */
  public <T extends R> Supplier<T> wrap(Supplier<T> supplier) {
    return () -> attempt(supplier);
  }

  /**
   * Wrap a Runnable so that when it's called, it's throttled.
   */
  public Runnable wrap(Runnable runnable) {
    return () -> attempt(runnable);
  }

  /**
   * Wrap a Function so that when it's called, it's throttled.
   */
  public <A, T extends R> Function<A, T> wrap(Function<A, T> function) {
    return (A a) -> attempt(() -> function.apply(a));
  }

  /**
   * Wrap a BiFunction so that when it's called, it's throttled.
   */
  public <A, B, T extends R> BiFunction<A, B, T> wrap(BiFunction<A, B, T> function) {
    return (A a, B b) -> attempt(() -> function.apply(a, b));
  }

  /**
   * Run the operation without blocking the caller: waits are scheduled on the
   * executor's scheduler, which also runs the operation itself.
   * <p>
   * Cancelling the returned future while the call is waiting abandons it
   * before it's dispatched. A dispatch already in progress is left to finish,
   * but its outcome is discarded.
   * </p>
   *
   * @throws IllegalStateException
   *           if the executor was built without a scheduler
   */
  public <T extends R> CompletableFuture<T> submit(Operation<? super C, T> operation) {
    if (scheduler == null) {
      throw new IllegalStateException(name + ": submit needs a scheduler; see Builder.scheduler");
    }
    var future = new CompletableFuture<T>();
    new AsyncCall<>(new ThrottledCall<T>(operation), future, scheduler).admitNext();
    return future;
  }

  public String name() {
    return name;
  }

  /**
   * The limits in force for the active credential.
   */
  public LimitState limits() {
    synchronized (lock) {
      return activeLane().limits();
    }
  }

  /**
   * The active credential's current load, including reservations.
   */
  public int load() {
    synchronized (lock) {
      var lane = activeLane();
      return lane.window.load(lane.limits().rateLimitWindow());
    }
  }

  public C activeCredential() {
    synchronized (lock) {
      return credentials.current();
    }
  }

  private CredentialLane activeLane() {
    return lanes.get(credentials.activeIndex());
  }

  private void pause(Duration delay, @Nullable Admission reservation) {
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      if (reservation != null) {
        abandon(reservation);
      }
      throw new ThrottleCancelledException(name + ": interrupted while waiting to dispatch", e);
    }
  }

  private void abandon(Admission admission) {
    synchronized (lock) {
      admission.lane.window.release(admission.slot);
    }
    log.debug("{}: abandoned reservation at {}", name, admission.slot);
  }

  private void applyUpdate(CredentialLane lane, LimitUpdate update) {
    if (update.isEmpty()) {
      return;
    }
    try {
      if (lane.apply(update)) {
        log.info("{}: provider reported new limits {}", name, lane.limits());
      }
    } catch (IllegalArgumentException e) {
      log.warn("{}: ignoring invalid limit update {}: {}", name, update, e.getMessage());
    }
  }

  /**
   * A slot reserved in a credential's window, to be dispatched after
   * {@code delay}.
   */
  private final class Admission {
    final int index;
    final CredentialLane lane;
    final C credential;
    final Instant slot;
    final Duration delay;
    private final AtomicBoolean claimed = new AtomicBoolean();

    Admission(int index, CredentialLane lane, C credential, Instant slot, Duration delay) {
      this.index = index;
      this.lane = lane;
      this.credential = credential;
      this.slot = slot;
      this.delay = delay;
    }

    /**
     * Either the dispatcher or a canceller gets to act on the reservation,
     * never both.
     */
    boolean claim() {
      return claimed.compareAndSet(false, true);
    }
  }

  private sealed interface Step<T> permits Done, Failed, Retry {
  }

  private record Done<T>(@Nullable T value) implements Step<T> {
  }

  private record Failed<T>(Throwable failure) implements Step<T> {
  }

  private record Retry<T>(Duration delay) implements Step<T> {
  }

  /**
   * One logical call: its operation and how far through its retries it is.
   * Both the blocking and the asynchronous paths drive it through
   * admit, dispatch and complete.
   */
  private final class ThrottledCall<T extends R> {
    private final Operation<? super C, T> operation;
    private BackoffState backoffState = BackoffState.initial(baseBackoffDelay);
    private int attempts;

    ThrottledCall(Operation<? super C, T> operation) {
      this.operation = operation;
    }

    Admission admit() {
      synchronized (lock) {
        if (credentials.isExhausted()) {
          throw new CredentialsExhaustedException(credentials.size());
        }
        var index = credentials.activeIndex();
        var lane = lanes.get(index);
        var now = clock.instant();
        var snapshot = lane.window.snapshot(lane.limits());
        var delay = lane.admissionDelay(delayPolicy, snapshot, now);
        var slot = lane.window.record(Durations.plus(now, delay));
        if (!delay.isZero()) {
          log.debug("{}: window holds {} of {}, waiting {} before dispatch", name, snapshot.load(),
              lane.limits().maxOperationsInWindow(), Durations.seconds(delay));
        }
        return new Admission(index, lane, credentials.current(), slot, delay);
      }
    }

    CallOutcome<T> dispatch(Admission admission) {
      attempts++;
      log.debug("{}: dispatching attempt {} with credential #{}", name, attempts, admission.index);
      try {
        return CallOutcome.success(operation.call(admission.credential));
      } catch (Exception e) {
        return CallOutcome.failure(e);
      }
    }

    Step<T> complete(Admission admission, CallOutcome<T> outcome) {
      var feedback = inspect(outcome);
      var failure = outcome.failure();

      synchronized (lock) {
        applyUpdate(admission.lane, feedback.update());
        if (feedback instanceof LimitFeedback.RateLimited rateLimited) {
          // Rate limiting is bounded by the credentials, not by maxAttempts.
          attempts--;
          var requiredWait = rateLimited.requiredWait();
          if (requiredWait != null) {
            admission.lane.pauseUntil(Durations.plus(clock.instant(), backoff.cap(requiredWait)));
          }
          try {
            if (credentials.rotateFrom(admission.index)) {
              log.info("{}: credential #{} is rate limited, rotated to #{} of {}", name, admission.index,
                  credentials.activeIndex(), credentials.size());
            }
          } catch (CredentialsExhaustedException e) {
            log.warn("{}: rate limited on all {} credential(s)", name, credentials.size());
            return new Failed<>(new CredentialsExhaustedException(credentials.size(), failure));
          }
          var next = backOff(requiredWait);
          log.debug("{}: retrying rate limited call in {}", name, Durations.seconds(next));
          return new Retry<>(next);
        }
      }

      if (feedback instanceof LimitFeedback.Transient transientFeedback) {
        return retry(transientFeedback.requiredWait(), outcome);
      }
      if (failure != null) {
        if (transientFailure.test(failure)) {
          var requiredWait = failure instanceof TransientFailureException tfe ? tfe.requiredWait() : null;
          return retry(requiredWait, outcome);
        }
        return new Failed<>(failure);
      }
      return new Done<>(outcome.value());
    }

    private LimitFeedback inspect(CallOutcome<T> outcome) {
      var feedback = feedbackHook.inspect(outcome);
      if (feedback instanceof LimitFeedback.Ok ok && outcome.failure() instanceof RateLimitedException rle) {
        return new LimitFeedback.RateLimited(rle.requiredWait(), ok.update());
      }
      return feedback;
    }

    private Step<T> retry(@Nullable Duration requiredWait, CallOutcome<T> outcome) {
      var failure = outcome.failure();
      if (attempts >= maxAttempts) {
        log.warn("{}: giving up after {} attempt(s)", name, attempts);
        return new Failed<>(failure != null ? failure : new RetriesExhaustedException(attempts, outcome.value()));
      }
      var next = backOff(requiredWait);
      log.debug("{}: transient failure on attempt {} ({}), retrying in {}", name, attempts,
          failure != null ? failure.toString() : "from response", Durations.seconds(next));
      return new Retry<>(next);
    }

    private Duration backOff(@Nullable Duration requiredWait) {
      var next = requiredWait != null
          ? backoff.explicitWait(backoffState, requiredWait)
          : backoff.nextDelay(backoffState);
      backoffState = next.next();
      return next.delay();
    }
  }

  private final class AsyncCall<T extends R> {
    private final ThrottledCall<T> call;
    private final CompletableFuture<T> future;
    private final ScheduledExecutorService scheduler;

    AsyncCall(ThrottledCall<T> call, CompletableFuture<T> future, ScheduledExecutorService scheduler) {
      this.call = call;
      this.future = future;
      this.scheduler = scheduler;
    }

    void admitNext() {
      if (future.isDone()) {
        return;
      }
      final Admission admission;
      try {
        admission = call.admit();
      } catch (Throwable t) {
        future.completeExceptionally(t);
        return;
      }
      future.whenComplete((value, failure) -> {
        if (future.isCancelled() && admission.claim()) {
          abandon(admission);
        }
      });
      schedule(() -> dispatch(admission), admission.delay);
    }

    private void dispatch(Admission admission) {
      if (!admission.claim()) {
        return;
      }
      Step<T> step;
      try {
        var outcome = call.dispatch(admission);
        if (future.isDone()) {
          log.debug("{}: call was cancelled during dispatch, discarding its outcome", name);
          return;
        }
        step = call.complete(admission, outcome);
      } catch (Throwable t) {
        // Errors too: nobody else would complete the future.
        future.completeExceptionally(t);
        return;
      }
      if (step instanceof Done<T> done) {
        future.complete(done.value);
      } else if (step instanceof Failed<T> failed) {
        future.completeExceptionally(failed.failure);
      } else {
        schedule(this::admitNext, ((Retry<T>) step).delay);
      }
    }

    private void schedule(Runnable task, Duration delay) {
      try {
        scheduler.schedule(task, Durations.nanos(delay), TimeUnit.NANOSECONDS);
      } catch (RejectedExecutionException e) {
        future.completeExceptionally(e);
      }
    }
  }

  /**
   * Configuration for a {@link ThrottleExecutor}. Everything is fixed at
   * construction; only the limits change afterwards, and only through
   * provider feedback.
   *
   * @param <C>
   *          the credential type
   * @param <R>
   *          the type of result the feedback hook understands
   */
  public static final class Builder<C, R> {
    private String name = "throttle";
    private LimitState limits = LimitState.DEFAULT;
    private InstantSource clock = Clock.systemUTC();
    private @Nullable DoubleSupplier randomSource;
    private Sleeper sleeper = Sleeper.SYSTEM;
    private @Nullable DelayPolicy delayPolicy;
    private Duration baseBackoffDelay = DEFAULT_BASE_BACKOFF_DELAY;
    private double backoffFactor = BackoffController.DEFAULT_FACTOR;
    private Duration backoffMaxDelay = BackoffController.DEFAULT_MAX_DELAY;
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private Predicate<Throwable> transientFailure = TransientFailures.defaults();
    private WindowScope windowScope = WindowScope.PER_CREDENTIAL;
    private @Nullable ScheduledExecutorService scheduler;
    private final List<C> credentials;
    private @Nullable UnaryOperator<C> refresher;
    private final LimitFeedbackHook<R> feedbackHook;

    private Builder(List<C> credentials, LimitFeedbackHook<R> feedbackHook) {
      this.credentials = credentials;
      this.feedbackHook = feedbackHook;
    }

    private <C2, R2> Builder<C2, R2> retype(List<C2> newCredentials, LimitFeedbackHook<R2> newHook) {
      var copy = new Builder<>(newCredentials, newHook);
      copy.name = name;
      copy.limits = limits;
      copy.clock = clock;
      copy.randomSource = randomSource;
      copy.sleeper = sleeper;
      copy.delayPolicy = delayPolicy;
      copy.baseBackoffDelay = baseBackoffDelay;
      copy.backoffFactor = backoffFactor;
      copy.backoffMaxDelay = backoffMaxDelay;
      copy.maxAttempts = maxAttempts;
      copy.transientFailure = transientFailure;
      copy.windowScope = windowScope;
      copy.scheduler = scheduler;
      return copy;
    }

    /**
     * A name for log messages, normally the provider's.
     */
    public Builder<C, R> name(String name) {
      this.name = name;
      return this;
    }

    public Builder<C, R> limits(LimitState limits) {
      this.limits = limits;
      return this;
    }

    /**
     * The primary credential and its backups, in the order they'll be used.
     * Replaces any refresher set earlier.
     */
    public <C2> Builder<C2, R> credentials(C2 primary, List<? extends C2> backups) {
      var all = new ArrayList<C2>(backups.size() + 1);
      all.add(primary);
      all.addAll(backups);
      return retype(List.copyOf(all), feedbackHook);
    }

    public <C2> Builder<C2, R> credentials(List<? extends C2> credentials) {
      if (credentials.isEmpty()) {
        throw new IllegalArgumentException("At least one credential is required");
      }
      return retype(List.copyOf(credentials), feedbackHook);
    }

    /**
     * Applied to each backup credential when it becomes active, for example
     * to exchange it for a session token.
     */
    public Builder<C, R> credentialRefresher(UnaryOperator<C> refresher) {
      this.refresher = refresher;
      return this;
    }

    public <R2> Builder<C, R2> feedback(LimitFeedbackHook<R2> hook) {
      var copy = retype(credentials, hook);
      copy.refresher = refresher;
      return copy;
    }

    public Builder<C, R> windowScope(WindowScope windowScope) {
      this.windowScope = windowScope;
      return this;
    }

    public Builder<C, R> baseBackoffDelay(Duration baseBackoffDelay) {
      if (baseBackoffDelay.isZero() || baseBackoffDelay.isNegative()) {
        throw new IllegalArgumentException("baseBackoffDelay must be greater than 0, was " + baseBackoffDelay);
      }
      this.baseBackoffDelay = baseBackoffDelay;
      return this;
    }

    public Builder<C, R> backoffFactor(double backoffFactor) {
      if (!(backoffFactor > 1.0)) {
        throw new IllegalArgumentException("backoffFactor must be greater than 1, was " + backoffFactor);
      }
      this.backoffFactor = backoffFactor;
      return this;
    }

    public Builder<C, R> backoffMaxDelay(Duration backoffMaxDelay) {
      if (backoffMaxDelay.isZero() || backoffMaxDelay.isNegative()) {
        throw new IllegalArgumentException("backoffMaxDelay must be greater than 0, was " + backoffMaxDelay);
      }
      this.backoffMaxDelay = backoffMaxDelay;
      return this;
    }

    /**
     * The most times one logical call will be dispatched, counting the first.
     * Rate limiting doesn't use these up.
     */
    public Builder<C, R> maxAttempts(int maxAttempts) {
      if (maxAttempts < 1) {
        throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
      }
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Which exceptions thrown by the operation are worth retrying. Defaults to
     * {@link TransientFailures#defaults()}.
     */
    public Builder<C, R> transientFailure(Predicate<Throwable> transientFailure) {
      this.transientFailure = transientFailure;
      return this;
    }

    public Builder<C, R> delayPolicy(DelayPolicy delayPolicy) {
      this.delayPolicy = delayPolicy;
      return this;
    }

    /**
     * The time source used for the window (mainly for testing).
     */
    public Builder<C, R> clock(InstantSource clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Uniform samples in [0, 1) used for jitter (mainly for testing).
     */
    public Builder<C, R> randomSource(DoubleSupplier randomSource) {
      this.randomSource = randomSource;
      return this;
    }

    /**
     * How blocking calls wait (mainly for testing).
     */
    public Builder<C, R> sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * Needed for {@link ThrottleExecutor#submit}. It runs the operations too,
     * so size it for the number of calls you expect in flight.
     */
    public Builder<C, R> scheduler(ScheduledExecutorService scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    public ThrottleExecutor<C, R> build() {
      return new ThrottleExecutor<>(this);
    }
  }
}
