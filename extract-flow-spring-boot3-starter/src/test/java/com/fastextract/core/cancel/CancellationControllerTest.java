package com.fastextract.core.cancel;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CancellationControllerTest {

    @Test
    void cancel_firesEachListenerOnce() {
        CancellationController controller = new CancellationController();
        AtomicInteger fired = new AtomicInteger();
        controller.signal().onCancel(fired::incrementAndGet);
        controller.signal().onCancel(fired::incrementAndGet);

        controller.cancel();
        controller.cancel();

        assertThat(fired).hasValue(2);
        assertThat(controller.listenerCount()).isZero();
    }

    @Test
    void onCancel_afterCancel_firesImmediately() {
        CancellationController controller = new CancellationController();
        controller.cancel();
        AtomicInteger fired = new AtomicInteger();

        CancellationSignal.Registration registration = controller.signal().onCancel(fired::incrementAndGet);

        assertThat(fired).hasValue(1);
        assertThat(registration.unregister()).isFalse();
    }

    @Test
    void unregister_dropsListener() {
        CancellationController controller = new CancellationController();
        AtomicInteger fired = new AtomicInteger();
        CancellationSignal.Registration registration = controller.signal().onCancel(fired::incrementAndGet);

        assertThat(registration.unregister()).isTrue();
        assertThat(registration.unregister()).isFalse();
        controller.cancel();

        assertThat(fired).hasValue(0);
    }

    @Test
    void throwingListener_doesNotStopOthers() {
        CancellationController controller = new CancellationController();
        AtomicInteger fired = new AtomicInteger();
        controller.signal().onCancel(() -> {
            throw new IllegalStateException("listener bug");
        });
        controller.signal().onCancel(fired::incrementAndGet);

        controller.cancel();

        assertThat(fired).hasValue(1);
    }

    @Test
    void anyOf_close_detachesFromInputs() {
        CancellationController session = new CancellationController();
        CancellationController deadline = new CancellationController();

        CancellationSignal.LinkedSignal combined = CancellationSignal.anyOf(session.signal(), null, deadline.signal());
        assertThat(session.listenerCount()).isEqualTo(1);

        combined.close();
        session.cancel();

        assertThat(session.listenerCount()).isZero();
        assertThat(deadline.listenerCount()).isZero();
        assertThat(combined.isCancelled()).isFalse();
    }

    @Test
    void anyOf_cancelsWhenAnyInputCancels() {
        CancellationController session = new CancellationController();
        CancellationController deadline = new CancellationController();
        CancellationSignal combined = CancellationSignal.anyOf(session.signal(), deadline.signal());

        deadline.cancel();

        assertThat(combined.isCancelled()).isTrue();
        assertThat(session.isCancelled()).isFalse();
    }

    @Test
    void concurrentRegisterAndCancel_everyListenerFiresExactlyOnce() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            for (int round = 0; round < 200; round++) {
                CancellationController controller = new CancellationController();
                AtomicInteger fired = new AtomicInteger();
                int listeners = 8;
                CountDownLatch go = new CountDownLatch(1);
                CountDownLatch done = new CountDownLatch(listeners);
                for (int i = 0; i < listeners; i++) {
                    pool.execute(() -> {
                        try {
                            go.await();
                            controller.signal().onCancel(fired::incrementAndGet);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        } finally {
                            done.countDown();
                        }
                    });
                }
                go.countDown();
                controller.cancel();
                assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();

                assertThat(fired).hasValue(listeners);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
