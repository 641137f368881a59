package com.parley.eventbus;

import com.parley.eventbus.testing.RecordingSink;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BufferedChannel")
class BufferedChannelTest {

    private static final ChannelSettings DIRECT = new ChannelSettings(8, Runnable::run);

    private static BufferedChannel<String> channel(RecordingSink<String> sink, ChannelSettings settings,
                                                   boolean suspended) {
        return new BufferedChannel<>("c-1", "TOPIC", sink, settings, suspended, null, null, null);
    }

    @Nested
    @DisplayName("Delivery")
    class Delivery {

        @Test
        @DisplayName("delivers events in offer order")
        void inOrder() {
            var sink = new RecordingSink<String>();
            var channel = channel(sink, DIRECT, false);

            channel.offer("e1");
            channel.offer("e2");
            channel.offer("e3");

            assertThat(sink.events()).containsExactly("e1", "e2", "e3");
        }

        @Test
        @DisplayName("never runs the sink on the offering thread")
        void offDispatcherThread() {
            var executor = new ManualExecutor();
            var sink = new RecordingSink<String>();
            var channel = channel(sink, new ChannelSettings(8, executor), false);

            channel.offer("e1");
            channel.offer("e2");

            assertThat(sink.events()).isEmpty();
            assertThat(executor.pending()).isEqualTo(1);

            executor.runAll();
            assertThat(sink.events()).containsExactly("e1", "e2");
        }

        @Test
        @DisplayName("a suspended channel buffers until resumed")
        void suspended() {
            var sink = new RecordingSink<String>();
            var channel = channel(sink, DIRECT, true);

            channel.offer("e1");
            channel.offer("e2");
            assertThat(sink.events()).isEmpty();
            assertThat(channel.buffered()).isEqualTo(2);

            channel.resume();
            channel.offer("e3");

            assertThat(sink.events()).containsExactly("e1", "e2", "e3");
            assertThat(channel.isSuspended()).isFalse();
        }

        @Test
        @DisplayName("a failing sink does not stop later events")
        void sinkFailureIsolated() {
            var sink = new RecordingSink<String>().failOnEvent(new IllegalStateException("boom"));
            var channel = channel(sink, DIRECT, false);

            channel.offer("e1");
            assertThat(channel.isOpen()).isTrue();

            sink.failOnEvent(null);
            channel.offer("e2");

            assertThat(sink.events()).containsExactly("e2");
        }

        @Test
        @DisplayName("preserves order under a real executor")
        void realExecutor() throws InterruptedException {
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                var sink = new RecordingSink<String>();
                var channel = channel(sink, new ChannelSettings(1000, pool), false);

                for (int i = 0; i < 500; i++) {
                    channel.offer("e" + i);
                }

                assertThat(sink.awaitEvents(500, 5, TimeUnit.SECONDS)).isTrue();
                assertThat(sink.events()).startsWith("e0", "e1", "e2").endsWith("e498", "e499");
                for (int i = 0; i < 500; i++) {
                    assertThat(sink.events().get(i)).isEqualTo("e" + i);
                }
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Overflow")
    class Overflow {

        @Test
        @DisplayName("drops the oldest events beyond capacity and counts them")
        void dropOldest() {
            var sink = new RecordingSink<String>();
            var channel = channel(sink, new ChannelSettings(3, Runnable::run), true);

            for (int i = 1; i <= 5; i++) {
                assertThat(channel.offer("e" + i)).isTrue();
            }
            channel.resume();

            assertThat(sink.events()).containsExactly("e3", "e4", "e5");
            assertThat(channel.droppedCount()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Termination")
    class Termination {

        @Test
        @DisplayName("close signals completion exactly once and refuses further events")
        void closeOnce() {
            var sink = new RecordingSink<String>();
            var channel = channel(sink, DIRECT, false);

            channel.close();
            channel.close();
            channel.fail(new IllegalStateException("late"));

            assertThat(sink.completions()).isEqualTo(1);
            assertThat(sink.terminalSignals()).isEqualTo(1);
            assertThat(channel.offer("e1")).isFalse();
            assertThat(sink.events()).isEmpty();
        }

        @Test
        @DisplayName("fail signals the error exactly once")
        void failOnce() {
            var sink = new RecordingSink<String>();
            var channel = channel(sink, DIRECT, true);
            var cause = new IllegalStateException("denied");

            channel.fail(cause);
            channel.fail(new IllegalStateException("again"));

            assertThat(sink.errors()).containsExactly(cause);
            assertThat(sink.terminalSignals()).isEqualTo(1);
        }

        @Test
        @DisplayName("close discards undelivered events")
        void discardsBuffered() {
            var sink = new RecordingSink<String>();
            var channel = channel(sink, DIRECT, true);
            channel.offer("e1");

            channel.close();
            channel.resume();

            assertThat(sink.events()).isEmpty();
            assertThat(sink.completions()).isEqualTo(1);
        }

        @Test
        @DisplayName("a close during a scheduled drain is signalled by the drainer")
        void closeWhileDraining() {
            var executor = new ManualExecutor();
            var sink = new RecordingSink<String>();
            var channel = channel(sink, new ChannelSettings(8, executor), false);

            channel.offer("e1");
            channel.close();
            assertThat(sink.terminalSignals()).isZero();

            executor.runAll();

            assertThat(sink.events()).isEmpty();
            assertThat(sink.completions()).isEqualTo(1);
        }

        @Test
        @DisplayName("a sink that closes its own channel gets the terminal signal after the event")
        void closeFromSink() {
            var holder = new BufferedChannel<?>[1];
            var completions = new AtomicInteger();
            EventSink<String> sink = new EventSink<>() {
                @Override
                public void onEvent(String event) {
                    holder[0].close();
                    assertThat(completions.get()).isZero();
                }

                @Override
                public void onError(Throwable cause) {
                }

                @Override
                public void onComplete() {
                    completions.incrementAndGet();
                }
            };
            var channel = new BufferedChannel<>("c-2", "TOPIC", sink, DIRECT);
            holder[0] = channel;

            channel.offer("e1");

            assertThat(completions.get()).isEqualTo(1);
            assertThat(channel.isOpen()).isFalse();
        }

        @Test
        @DisplayName("close hooks run once, immediately when registered after close")
        void closeHooks() {
            var channel = channel(new RecordingSink<>(), DIRECT, false);
            var runs = new AtomicInteger();
            channel.whenClosed(runs::incrementAndGet);

            channel.close();
            channel.close();
            assertThat(runs.get()).isEqualTo(1);

            channel.whenClosed(runs::incrementAndGet);
            assertThat(runs.get()).isEqualTo(2);
        }

        @Test
        @DisplayName("a rejecting executor fails the channel")
        void rejectedExecution() {
            var sink = new RecordingSink<String>();
            var channel = channel(sink, new ChannelSettings(8, task -> {
                throw new RejectedExecutionException("shut down");
            }), false);

            channel.offer("e1");

            assertThat(channel.isOpen()).isFalse();
            assertThat(sink.errors()).singleElement().isInstanceOf(RejectedExecutionException.class);
        }
    }

    @Test
    @DisplayName("rejects null events and invalid settings")
    void validation() {
        var channel = channel(new RecordingSink<>(), DIRECT, false);

        assertThatThrownBy(() -> channel.offer(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ChannelSettings(0, Runnable::run))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BufferedChannel<>(" ", "TOPIC", new RecordingSink<>(), DIRECT))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
