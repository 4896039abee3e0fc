package io.voxeldaemon.daemon.lifecycle;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import sun.misc.Signal;

class OsSignalsTest {

    @Test
    void hangup_runsReloadAction_andNotStop() throws Exception {
        AtomicInteger stops = new AtomicInteger();
        CountDownLatch reloaded = new CountDownLatch(1);

        try (OsSignals signals = OsSignals.install(stops::incrementAndGet, reloaded::countDown)) {
            assertThat(signals.installed()).contains("HUP", "TERM");

            Signal.raise(new Signal("HUP"));

            assertThat(reloaded.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(stops.get()).isZero();
        }
    }

    @Test
    void close_forgetsInstalledHandlers() {
        OsSignals signals = OsSignals.install(() -> {}, () -> {});

        signals.close();

        assertThat(signals.installed()).isEmpty();
    }
}
