package com.lmrunner.stream;

import com.lmrunner.exception.SinkClosedException;
import com.lmrunner.model.StreamChunk;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded single-producer/single-consumer channel carrying the chunks of one streaming call.
 *
 * <p>The producer blocks in {@link #send(StreamChunk)} while the buffer is full, so a slow
 * consumer throttles the upstream provider read. Once the consumer calls {@link #close()} any
 * blocked or later send fails with {@link SinkClosedException}. The producer ends the stream with
 * {@link #complete()} or {@link #fail(Throwable)}; chunks already buffered are still delivered.
 *
 * <p>Consumers either block in {@link #receive()} or subscribe to {@link #asFlux()}, which is
 * driven by downstream demand and never holds a thread while waiting.
 */
@Slf4j
public class ChunkChannel {

    public static final int DEFAULT_CAPACITY = 32;

    private final int capacity;
    private final ArrayDeque<StreamChunk> buffer;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notFull = lock.newCondition();
    private final Condition notEmpty = lock.newCondition();
    private final Sinks.Empty<Void> closedSignal = Sinks.empty();
    private final AtomicReference<FluxSink<StreamChunk>> subscriber = new AtomicReference<>();
    private final AtomicInteger drainRequests = new AtomicInteger();

    private boolean receiverClosed;
    private boolean senderClosed;
    private Throwable failure;

    public ChunkChannel() {
        this(DEFAULT_CAPACITY);
    }

    public ChunkChannel(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Channel capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(capacity);
    }

    /**
     * Enqueue a chunk, waiting while the buffer is full.
     *
     * @throws SinkClosedException  if the receiver has closed the channel
     * @throws InterruptedException if the producing thread is interrupted while waiting
     */
    public void send(StreamChunk chunk) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (buffer.size() >= capacity && !receiverClosed) {
                notFull.await();
            }
            if (receiverClosed) {
                throw new SinkClosedException();
            }
            if (senderClosed) {
                throw new IllegalStateException("Channel already completed by its producer");
            }
            buffer.addLast(chunk);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
        drain();
    }

    /**
     * Wait for the next chunk.
     *
     * @return the chunk, or empty once the producer has finished and the buffer is drained
     */
    public Optional<StreamChunk> receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty() && !senderClosed && !receiverClosed) {
                notEmpty.await();
            }
            return Optional.ofNullable(take());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait at most {@code timeout} for the next chunk.
     * An empty result means either a timeout or the end of the stream; see {@link #isFinished()}.
     */
    public Optional<StreamChunk> receive(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty() && !senderClosed && !receiverClosed) {
                if (nanos <= 0L) {
                    return Optional.empty();
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return Optional.ofNullable(take());
        } finally {
            lock.unlock();
        }
    }

    private StreamChunk take() {
        StreamChunk chunk = buffer.pollFirst();
        if (chunk != null) {
            notFull.signal();
        }
        return chunk;
    }

    /**
     * Receiver side: stop accepting chunks and release a blocked producer.
     */
    public void close() {
        lock.lock();
        try {
            if (receiverClosed) {
                return;
            }
            receiverClosed = true;
            buffer.clear();
            notFull.signalAll();
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
        log.debug("Chunk channel closed by receiver");
        closedSignal.tryEmitEmpty();
    }

    /**
     * Producer side: no more chunks will be sent.
     */
    public void complete() {
        finish(null);
    }

    /**
     * Producer side: the stream ended with an error. Chunks already sent stay deliverable.
     */
    public void fail(Throwable error) {
        finish(error);
    }

    private void finish(Throwable error) {
        lock.lock();
        try {
            if (senderClosed) {
                return;
            }
            senderClosed = true;
            failure = error;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
        drain();
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return receiverClosed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * True once the producer has finished and every buffered chunk has been taken.
     */
    public boolean isFinished() {
        lock.lock();
        try {
            return (senderClosed && buffer.isEmpty()) || receiverClosed;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Throwable> terminalError() {
        lock.lock();
        try {
            return Optional.ofNullable(failure);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Completes when the receiver closes the channel.
     */
    public Mono<Void> whenClosed() {
        return closedSignal.asMono();
    }

    /**
     * Consumer view of the channel. Chunks are emitted only against downstream demand, from
     * whichever thread sends or requests. Cancelling the subscription closes the channel.
     * Terminates with the producer's error, if any, after the buffered chunks.
     *
     * <p>Only one subscription is allowed, and it must not be mixed with {@link #receive()}.
     */
    public Flux<StreamChunk> asFlux() {
        return Flux.create(sink -> {
            if (!subscriber.compareAndSet(null, sink)) {
                sink.error(new IllegalStateException("Chunk channel already has a subscriber"));
                return;
            }
            sink.onRequest(n -> drain());
            sink.onCancel(this::close);
            drain();
        });
    }

    /**
     * Emit buffered chunks to the subscriber while it has demand. Calls from the sending and
     * requesting threads are serialized: a call made during a drain makes the running drain loop again.
     */
    private void drain() {
        FluxSink<StreamChunk> sink = subscriber.get();
        if (sink == null || drainRequests.getAndIncrement() != 0) {
            return;
        }
        int missed = 1;
        do {
            while (emitNext(sink)) {
                // keep emitting
            }
            missed = drainRequests.addAndGet(-missed);
        } while (missed != 0);
    }

    /**
     * @return true when a chunk was emitted and another may be ready
     */
    private boolean emitNext(FluxSink<StreamChunk> sink) {
        if (sink.isCancelled()) {
            return false;
        }
        StreamChunk chunk = null;
        boolean done;
        Throwable error;
        lock.lock();
        try {
            if (receiverClosed) {
                return false;
            }
            if (sink.requestedFromDownstream() > 0) {
                chunk = take();
            }
            done = senderClosed && buffer.isEmpty();
            error = failure;
        } finally {
            lock.unlock();
        }
        if (chunk != null) {
            sink.next(chunk);
            return true;
        }
        if (done) {
            if (error != null) {
                sink.error(error);
            } else {
                sink.complete();
            }
        }
        return false;
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Current number of buffered chunks.
     */
    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }
}
