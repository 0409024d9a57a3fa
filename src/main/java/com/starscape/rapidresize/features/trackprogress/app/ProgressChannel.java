package com.starscape.rapidresize.features.trackprogress.app;

import com.starscape.rapidresize.features.trackprogress.api.dto.ProgressMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Semaphore;

/**
 * Bounded single-producer channel between a worker and the consumer loop.
 *
 * The worker blocks only when {@code capacity} non-terminal messages are waiting. The terminal
 * message has a slot of its own, so publishing it never blocks and cannot be interrupted.
 * The consumer never blocks: it drains a bounded number of messages per tick.
 * Once the terminal message is queued the channel accepts nothing else.
 */
public class ProgressChannel {

    private final BlockingQueue<ProgressMessage> queue;
    private final Semaphore progressSlots;
    private volatile boolean terminalPublished;

    public ProgressChannel(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Channel capacity must be positive");
        }
        this.queue = new ArrayBlockingQueue<>(capacity + 1);
        this.progressSlots = new Semaphore(capacity);
    }

    public void publish(ProgressMessage message) throws InterruptedException {
        if (message.isTerminal()) {
            publishTerminal(message);
            return;
        }
        requireOpen(message);
        progressSlots.acquire();
        queue.add(message);
    }

    /**
     * Queue the terminal message without waiting, whatever the number of unread messages.
     */
    public void publishTerminal(ProgressMessage message) {
        if (!message.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal message: " + message.getMessageType());
        }
        requireOpen(message);
        queue.add(message);
        terminalPublished = true;
    }

    private void requireOpen(ProgressMessage message) {
        if (terminalPublished) {
            throw new IllegalStateException(
                "Channel already closed by a terminal message, rejected " + message.getMessageType());
        }
    }

    /**
     * Remove up to {@code maxMessages} queued messages without waiting.
     */
    public List<ProgressMessage> drain(int maxMessages) {
        List<ProgressMessage> drained = new ArrayList<>(Math.min(maxMessages, queue.size() + 1));
        queue.drainTo(drained, maxMessages);
        for (ProgressMessage message : drained) {
            releaseSlot(message);
        }
        return drained;
    }

    private void releaseSlot(ProgressMessage message) {
        if (!message.isTerminal()) {
            progressSlots.release();
        }
    }

    public boolean isTerminalPublished() {
        return terminalPublished;
    }

    public int size() {
        return queue.size();
    }
}
