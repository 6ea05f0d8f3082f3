package com.agentloop.core.execution;

import com.agentloop.core.capability.CapabilityInvocationPort;
import com.agentloop.core.capability.CapabilityResult;
import com.agentloop.core.logging.MdcContext;
import com.agentloop.core.model.FailureKind;
import com.agentloop.core.model.TaskNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Dispatches one wave of ready nodes to the capability port.
 * <p>
 * At most {@code parallelism} calls run at once; with a parallelism of one the nodes run
 * strictly one after another in the order given. Every call gets its own timeout and is
 * interrupted when it elapses. When the session deadline passes, calls still in flight are
 * cancelled and nodes not yet started are reported as undispatched. {@link #execute} returns
 * only once every dispatched call has completed, failed or been cancelled.
 */
public class WaveExecutor {

    private static final Logger log = LoggerFactory.getLogger(WaveExecutor.class);

    private final CapabilityInvocationPort capabilities;
    private final int parallelism;
    private final ExecutorService workers;
    private final ScheduledExecutorService watchdog;

    public WaveExecutor(CapabilityInvocationPort capabilities, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
        this.capabilities = capabilities;
        this.parallelism = parallelism;
        this.workers = Executors.newCachedThreadPool(daemonThreads("agentloop-worker-"));
        this.watchdog = Executors.newSingleThreadScheduledExecutor(daemonThreads("agentloop-watchdog-"));
    }

    public int parallelism() {
        return parallelism;
    }

    /**
     * @param sessionId      owning session, for logging
     * @param wave           ready nodes in dispatch order
     * @param nodeTimeout    per-node timeout
     * @param deadlineNanos  session deadline on the {@link System#nanoTime()} clock
     * @param beforeDispatch called on the calling thread right before each node starts
     */
    public WaveReport execute(String sessionId, List<TaskNode> wave, Duration nodeTimeout,
                              long deadlineNanos, Consumer<TaskNode> beforeDispatch) {
        var permits = new Semaphore(parallelism);
        var calls = new ArrayList<NodeCall>();
        var undispatched = new ArrayList<String>();
        boolean expired = false;

        for (TaskNode node : wave) {
            if (!expired) {
                expired = !acquire(permits, deadlineNanos);
            }
            if (expired) {
                undispatched.add(node.id());
                continue;
            }
            beforeDispatch.accept(node);
            var call = new NodeCall(node, permits, () -> invoke(sessionId, node, nodeTimeout));
            workers.execute(call);
            call.timer = watchdog.schedule(call::expire, nodeTimeout.toNanos(), TimeUnit.NANOSECONDS);
            calls.add(call);
        }

        var outcomes = new ArrayList<NodeOutcome>();
        for (NodeCall call : calls) {
            if (expired) {
                call.cancelForSession();
            }
            NodeOutcome outcome = collect(call, deadlineNanos, nodeTimeout);
            if (outcome.failureKind() == FailureKind.SESSION_TIMEOUT && !expired) {
                expired = true;
                calls.forEach(NodeCall::cancelForSession);
            }
            outcomes.add(outcome);
        }

        if (expired) {
            log.warn("Session deadline passed during wave: {} in flight cancelled, {} not started",
                    outcomes.stream().filter(o -> o.failureKind() == FailureKind.SESSION_TIMEOUT).count(),
                    undispatched.size());
        }
        return new WaveReport(outcomes, undispatched, expired);
    }

    private boolean acquire(Semaphore permits, long deadlineNanos) {
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            return false;
        }
        try {
            return permits.tryAcquire(remaining, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private CapabilityResult invoke(String sessionId, TaskNode node, Duration nodeTimeout) {
        MdcContext.setTask(sessionId, node.id(), node.capabilityRef());
        try {
            log.info("Dispatching node {} [{}]: {}", node.id(), node.capabilityRef(), node.description());
            return capabilities.invoke(node.capabilityRef(), node.arguments(), nodeTimeout);
        } finally {
            MdcContext.clear();
        }
    }

    private NodeOutcome collect(NodeCall call, long deadlineNanos, Duration nodeTimeout) {
        TaskNode node = call.node;
        try {
            long remaining = Math.max(0, deadlineNanos - System.nanoTime());
            CapabilityResult result = call.get(remaining, TimeUnit.NANOSECONDS);
            if (result != null && result.success()) {
                return NodeOutcome.success(node.id(), node.capabilityRef(), result.output(), call.elapsedMs());
            }
            String error = result == null ? "capability returned no result" : result.error();
            return NodeOutcome.failure(node.id(), node.capabilityRef(), FailureKind.CAPABILITY, error, call.elapsedMs());
        } catch (CancellationException e) {
            if (call.timedOut) {
                return NodeOutcome.failure(node.id(), node.capabilityRef(), FailureKind.TIMEOUT,
                        "timed out after " + nodeTimeout.toMillis() + "ms", call.elapsedMs());
            }
            return NodeOutcome.failure(node.id(), node.capabilityRef(), FailureKind.SESSION_TIMEOUT,
                    "cancelled by session timeout", call.elapsedMs());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Node {} [{}] failed: {}", node.id(), node.capabilityRef(), cause.getMessage());
            return NodeOutcome.failure(node.id(), node.capabilityRef(), FailureKind.CAPABILITY,
                    cause.getMessage(), call.elapsedMs());
        } catch (TimeoutException e) {
            call.cancelForSession();
            return NodeOutcome.failure(node.id(), node.capabilityRef(), FailureKind.SESSION_TIMEOUT,
                    "cancelled by session timeout", call.elapsedMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancelForSession();
            return NodeOutcome.failure(node.id(), node.capabilityRef(), FailureKind.SESSION_TIMEOUT,
                    "interrupted", call.elapsedMs());
        }
    }

    /** Stops the worker and watchdog threads. Calls still running are interrupted. */
    public void shutdown() {
        workers.shutdownNow();
        watchdog.shutdownNow();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * A node call that gives back its permit as soon as it completes or is cancelled,
     * so a call that ignores interruption cannot stall the rest of the wave.
     */
    private static final class NodeCall extends FutureTask<CapabilityResult> {

        private final TaskNode node;
        private final Semaphore permits;
        private final long dispatchedAt = System.nanoTime();
        private volatile boolean timedOut;
        private volatile ScheduledFuture<?> timer;

        NodeCall(TaskNode node, Semaphore permits, Callable<CapabilityResult> body) {
            super(body);
            this.node = node;
            this.permits = permits;
        }

        void expire() {
            if (!isDone()) {
                timedOut = true;
                cancel(true);
            }
        }

        void cancelForSession() {
            if (!isDone()) {
                cancel(true);
            }
        }

        long elapsedMs() {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - dispatchedAt);
        }

        @Override
        protected void done() {
            permits.release();
            ScheduledFuture<?> t = timer;
            if (t != null) {
                t.cancel(false);
            }
        }
    }
}
