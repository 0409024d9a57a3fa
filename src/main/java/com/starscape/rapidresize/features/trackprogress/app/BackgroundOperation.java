package com.starscape.rapidresize.features.trackprogress.app;

import com.starscape.rapidresize.common.concurrent.CancellationToken;
import com.starscape.rapidresize.features.trackprogress.api.dto.ProgressMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Handle to one unit of background work (a load session or a save run).
 *
 * The handle owns its cancellation token and its channel. The consumer talks to the worker
 * only through {@link #poll(int)} and {@link #cancel()}; the worker talks back only through
 * {@link #publish(ProgressMessage)}. Whatever happens inside the worker, exactly one terminal
 * message is published.
 */
public abstract class BackgroundOperation {

    private static final Logger log = LoggerFactory.getLogger(BackgroundOperation.class);

    private final String operationId = UUID.randomUUID().toString();
    private final CancellationToken cancellationToken = new CancellationToken();
    private final ProgressChannel channel;
    private final CountDownLatch workerFinished = new CountDownLatch(1);
    private volatile boolean started;
    private volatile boolean terminalDelivered;

    protected BackgroundOperation(int channelCapacity) {
        this.channel = new ProgressChannel(channelCapacity);
    }

    /**
     * Submit the worker. Called once by the service that created the handle.
     */
    public void start(TaskExecutor executor) {
        if (started) {
            throw new IllegalStateException("Operation already started: " + operationId);
        }
        started = true;
        executor.execute(this::runWorker);
    }

    private void runWorker() {
        try {
            execute();
        } catch (InterruptedException e) {
            log.warn("Worker interrupted: operationId={}", operationId);
            publishFallbackTerminal(e);
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Worker failed: operationId={}", operationId, e);
            publishFallbackTerminal(e);
        } finally {
            workerFinished.countDown();
        }
    }

    private void publishFallbackTerminal(Exception failure) {
        if (channel.isTerminalPublished()) {
            return;
        }
        channel.publishTerminal(fatalMessage(failure));
    }

    /**
     * Worker body. Must publish exactly one terminal message on every normal exit path.
     */
    protected abstract void execute() throws InterruptedException;

    /**
     * Terminal message published when {@link #execute()} escapes with an unexpected exception
     * or is interrupted before it could publish one.
     */
    protected abstract ProgressMessage fatalMessage(Exception failure);

    protected void publish(ProgressMessage message) throws InterruptedException {
        channel.publish(message);
    }

    protected boolean isCancellationRequested() {
        return cancellationToken.isCancellationRequested();
    }

    /**
     * Drain up to {@code maxMessages} messages without blocking.
     */
    public List<ProgressMessage> poll(int maxMessages) {
        List<ProgressMessage> messages = channel.drain(maxMessages);
        for (ProgressMessage message : messages) {
            if (message.isTerminal()) {
                terminalDelivered = true;
            }
        }
        return messages;
    }

    /**
     * Request cooperative cancellation. The item in progress is allowed to finish.
     */
    public void cancel() {
        if (cancellationToken.cancel()) {
            log.info("Cancellation requested: operationId={}", operationId);
        }
    }

    /**
     * @return true once the consumer has received the terminal message
     */
    public boolean isFinished() {
        return terminalDelivered;
    }

    public boolean isWorkerFinished() {
        return workerFinished.getCount() == 0;
    }

    /**
     * Wait for the worker thread to return. The consumer must keep draining while waiting,
     * otherwise a worker blocked on a full channel never finishes.
     */
    public boolean awaitWorker(Duration timeout) throws InterruptedException {
        return workerFinished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public String getOperationId() {
        return operationId;
    }
}
