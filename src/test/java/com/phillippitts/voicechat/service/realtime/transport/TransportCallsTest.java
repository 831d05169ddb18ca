package com.phillippitts.voicechat.service.realtime.transport;

import com.phillippitts.voicechat.exception.TransportException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransportCallsTest {

    @Test
    void shouldReturnWhenAcknowledged() {
        assertThatCode(() -> TransportCalls.await(() -> CompletableFuture.completedFuture(null), 100, "activate", "ch"))
                .doesNotThrowAnyException();
    }

    @Test
    void shouldTranslateTimeout() {
        assertThatThrownBy(() -> TransportCalls.await(CompletableFuture::new, 50, "activate", "ch"))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("not acknowledged within 50ms")
                .extracting("channelName").isEqualTo("ch");
    }

    @Test
    void shouldTranslateFailedFuture() {
        assertThatThrownBy(() -> TransportCalls.await(
                () -> CompletableFuture.failedFuture(new IllegalStateException("boom")), 100, "deactivate", "ch"))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("deactivate failed")
                .hasRootCauseMessage("boom");
    }

    @Test
    void shouldTranslateThrowingCall() {
        assertThatThrownBy(() -> TransportCalls.await(() -> {
            throw new IllegalStateException("socket closed");
        }, 100, "activate", "ch"))
                .isInstanceOf(TransportException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
