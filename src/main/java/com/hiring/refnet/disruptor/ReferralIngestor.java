package com.hiring.refnet.disruptor;

import com.hiring.refnet.engine.ReferralGraph;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import java.util.concurrent.locks.LockSupport;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import lombok.extern.log4j.Log4j2;

/**
 * Serialises referral insertions from any number of producer threads onto a
 * single consumer thread that owns a {@link ReferralGraph}.
 *
 * <p>
 * {@link #publish(String, String)} is safe to call concurrently. The graph must
 * not be read or written directly while the ingestor is running; call
 * {@link #shutdown()} first, which drains every published referral.
 *
 * <p>
 * Publishing and shutting down are mutually exclusive: a call to
 * {@link #publish(String, String)} that returns normally is always applied
 * before {@link #shutdown()} returns.
 */
@Log4j2
public final class ReferralIngestor implements AutoCloseable {
    public static final int DEFAULT_BUFFER_SIZE = 1024;

    private static final long DRAIN_PARK_NANOS = 100_000L;

    private final ReferralPublisher publisher;
    private final Disruptor<ReferralEvent> disruptor;
    private final RingBuffer<ReferralEvent> ringBuffer;
    private final ReadWriteLock lifecycle = new ReentrantReadWriteLock();
    private boolean running;

    public ReferralIngestor(ReferralGraph graph) {
        this(graph, DEFAULT_BUFFER_SIZE);
    }

    public ReferralIngestor(ReferralGraph graph, int bufferSize) {
        if (bufferSize <= 0 || Integer.bitCount(bufferSize) != 1)
            throw new IllegalArgumentException("bufferSize must be a power of 2: " + bufferSize);
        this.publisher = new ReferralPublisher(graph);
        this.disruptor = new Disruptor<>(
                ReferralEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(publisher);
        disruptor.setDefaultExceptionHandler(new LoggingExceptionHandler());
        this.ringBuffer = disruptor.start();
        this.running = true;
        log.info("Referral ingestor started (buffer={})", bufferSize);
    }

    /**
     * Queues a referral. Blocks only while the ring buffer is full.
     *
     * @throws IllegalStateException after {@link #shutdown()}
     */
    public void publish(String referrer, String candidate) {
        lifecycle.readLock().lock();
        try {
            if (!running)
                throw new IllegalStateException("Ingestor is shut down");
            ringBuffer.publishEvent((event, seq, r, c) -> event.set(r, c, seq), referrer, candidate);
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    public void setPostBatchCallback(ReferralPublisher.PostBatchCallback cb) {
        publisher.setPostBatchCallback(cb);
    }

    /** Waits until every published referral is applied, then stops the consumer. */
    public void shutdown() {
        lifecycle.writeLock().lock();
        try {
            if (!running)
                return;
            running = false;
            // Every claimed slot is published once the write lock is held.
            long last = ringBuffer.getCursor();
            while (publisher.processedSequence() < last)
                LockSupport.parkNanos(DRAIN_PARK_NANOS);
            disruptor.shutdown();
        } finally {
            lifecycle.writeLock().unlock();
        }
        log.info("Referral ingestor stopped: {} accepted, {} rejected", publisher.acceptedCount(),
                publisher.rejectedCount());
    }

    @Override
    public void close() {
        shutdown();
    }

    public long acceptedCount() {
        return publisher.acceptedCount();
    }

    public long rejectedCount() {
        return publisher.rejectedCount();
    }

    /** Keeps the consumer alive after an unexpected failure. */
    private static final class LoggingExceptionHandler implements ExceptionHandler<ReferralEvent> {
        @Override
        public void handleEventException(Throwable ex, long sequence, ReferralEvent event) {
            log.error("Failed to apply referral #{} ({} -> {})", event.sequenceId(), event.referrer(),
                    event.candidate(), ex);
            event.clear();
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Ingestor failed to start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Ingestor failed to shut down cleanly", ex);
        }
    }
}
