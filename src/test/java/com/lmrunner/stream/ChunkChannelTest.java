package com.lmrunner.stream;

import com.lmrunner.exception.SinkClosedException;
import com.lmrunner.model.NodeInfo;
import com.lmrunner.model.StreamChunk;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Subscription;
import reactor.core.publisher.BaseSubscriber;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ChunkChannel.
 */
class ChunkChannelTest {

    private final NodeInfo nodeInfo = NodeInfo.detached();

    private StreamChunk chunk(String content) {
        return StreamChunk.of(nodeInfo, content);
    }

    @Test
    void testChunksArriveInSendOrder() throws InterruptedException {
        ChunkChannel channel = new ChunkChannel(4);
        channel.send(chunk("a"));
        channel.send(chunk("b"));
        channel.send(chunk("c"));
        channel.complete();

        assertEquals("a", channel.receive().orElseThrow().getContent());
        assertEquals("b", channel.receive().orElseThrow().getContent());
        assertEquals("c", channel.receive().orElseThrow().getContent());
        assertTrue(channel.receive().isEmpty());
        assertTrue(channel.isFinished());
    }

    @Test
    void testSendBlocksWhileFull() throws Exception {
        ChunkChannel channel = new ChunkChannel(1);
        channel.send(chunk("first"));

        CountDownLatch started = new CountDownLatch(1);
        CompletableFuture<Void> second = CompletableFuture.runAsync(() -> {
            started.countDown();
            try {
                channel.send(chunk("second"));
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertThrows(TimeoutException.class, () -> second.get(200, TimeUnit.MILLISECONDS));
        assertEquals(1, channel.size());

        assertEquals("first", channel.receive().orElseThrow().getContent());
        second.get(5, TimeUnit.SECONDS);
        assertEquals("second", channel.receive().orElseThrow().getContent());
    }

    @Test
    void testCloseReleasesBlockedSender() throws Exception {
        ChunkChannel channel = new ChunkChannel(1);
        channel.send(chunk("buffered"));

        CompletableFuture<Void> blocked = CompletableFuture.runAsync(() -> {
            try {
                channel.send(chunk("blocked"));
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(100);
        channel.close();

        ExecutionException e = assertThrows(ExecutionException.class, () -> blocked.get(5, TimeUnit.SECONDS));
        assertTrue(e.getCause() instanceof SinkClosedException);
        assertTrue(channel.isClosed());
        assertEquals(0, channel.size());
    }

    @Test
    void testSendAfterCloseFails() {
        ChunkChannel channel = new ChunkChannel();
        channel.close();

        assertThrows(SinkClosedException.class, () -> channel.send(chunk("late")));
    }

    @Test
    void testSendAfterCompleteIsRejected() {
        ChunkChannel channel = new ChunkChannel();
        channel.complete();

        assertThrows(IllegalStateException.class, () -> channel.send(chunk("late")));
    }

    @Test
    void testFailureSurfacesAfterBufferedChunks() throws InterruptedException {
        ChunkChannel channel = new ChunkChannel();
        channel.send(chunk("partial"));
        RuntimeException failure = new RuntimeException("boom");
        channel.fail(failure);
        channel.complete();

        assertEquals("partial", channel.receive().orElseThrow().getContent());
        assertTrue(channel.receive().isEmpty());
        assertSame(failure, channel.terminalError().orElseThrow());
    }

    @Test
    void testReceiveTimesOut() throws InterruptedException {
        ChunkChannel channel = new ChunkChannel();

        assertTrue(channel.receive(Duration.ofMillis(50)).isEmpty());
        assertFalse(channel.isFinished());
    }

    @Test
    void testAsFluxDrainsThenCompletes() throws InterruptedException {
        ChunkChannel channel = new ChunkChannel();
        channel.send(chunk("x"));
        channel.send(chunk("y"));
        channel.complete();

        List<String> contents = channel.asFlux()
                .map(StreamChunk::getContent)
                .collectList()
                .block(Duration.ofSeconds(5));

        assertEquals(List.of("x", "y"), contents);
    }

    @Test
    void testAsFluxErrorsWithProducerFailure() throws InterruptedException {
        ChunkChannel channel = new ChunkChannel();
        channel.send(chunk("x"));
        channel.fail(new IllegalArgumentException("bad"));

        List<String> seen = new ArrayList<>();
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> channel.asFlux()
                .doOnNext(c -> seen.add(c.getContent()))
                .blockLast(Duration.ofSeconds(5)));

        assertEquals("bad", e.getMessage());
        assertEquals(List.of("x"), seen);
    }

    @Test
    void testCancellingFluxClosesChannel() throws InterruptedException {
        ChunkChannel channel = new ChunkChannel();
        channel.send(chunk("1"));
        channel.send(chunk("2"));

        String first = channel.asFlux().map(StreamChunk::getContent).blockFirst(Duration.ofSeconds(5));

        assertEquals("1", first);
        assertTrue(channel.isClosed());
        assertNull(channel.whenClosed().block(Duration.ofSeconds(1)));
    }

    @Test
    void testAsFluxEmitsOnlyAgainstDemand() throws InterruptedException {
        ChunkChannel channel = new ChunkChannel(4);
        List<String> seen = new CopyOnWriteArrayList<>();
        BaseSubscriber<StreamChunk> subscriber = new BaseSubscriber<>() {
            @Override
            protected void hookOnSubscribe(Subscription subscription) {
                request(1);
            }

            @Override
            protected void hookOnNext(StreamChunk chunk) {
                seen.add(chunk.getContent());
            }
        };
        channel.asFlux().subscribe(subscriber);

        channel.send(chunk("a"));
        channel.send(chunk("b"));
        channel.send(chunk("c"));

        assertEquals(List.of("a"), seen);
        assertEquals(2, channel.size());

        subscriber.request(1);
        assertEquals(List.of("a", "b"), seen);
        assertEquals(1, channel.size());
        subscriber.dispose();
        assertTrue(channel.isClosed());
    }

    @Test
    void testAsFluxDeliversOnTheSendingThreadWithoutAWorker() throws InterruptedException {
        ChunkChannel channel = new ChunkChannel(1);
        List<String> seen = new CopyOnWriteArrayList<>();
        List<Thread> threads = new CopyOnWriteArrayList<>();
        AtomicBoolean completed = new AtomicBoolean();
        channel.asFlux().subscribe(c -> {
            seen.add(c.getContent());
            threads.add(Thread.currentThread());
        }, e -> fail(e), () -> completed.set(true));

        // with unbounded demand a capacity-1 channel never blocks the sender
        for (int i = 0; i < 50; i++) {
            channel.send(chunk("c" + i));
        }
        channel.complete();

        assertEquals(50, seen.size());
        assertEquals("c49", seen.get(49));
        assertTrue(threads.stream().allMatch(t -> t == Thread.currentThread()));
        assertTrue(completed.get());
    }

    @Test
    void testAsFluxAllowsOneSubscriber() {
        ChunkChannel channel = new ChunkChannel();
        channel.asFlux().subscribe();

        assertThrows(IllegalStateException.class, () -> channel.asFlux().blockFirst(Duration.ofSeconds(1)));
    }

    @Test
    void testCapacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new ChunkChannel(0));
        assertEquals(ChunkChannel.DEFAULT_CAPACITY, new ChunkChannel().getCapacity());
    }
}
