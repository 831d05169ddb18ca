package com.phillippitts.voicechat.testutil;

import com.phillippitts.voicechat.domain.ChangeEventKind;
import com.phillippitts.voicechat.domain.FilterExpression;
import com.phillippitts.voicechat.domain.WatchedTable;
import com.phillippitts.voicechat.service.realtime.transport.ChangeHandler;
import com.phillippitts.voicechat.service.realtime.transport.ChangePayload;
import com.phillippitts.voicechat.service.realtime.transport.InMemoryRealtimeTransport;
import com.phillippitts.voicechat.service.realtime.transport.RealtimeChannel;
import com.phillippitts.voicechat.service.realtime.transport.RealtimeTransport;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test transport that delegates delivery to {@link InMemoryRealtimeTransport} while counting
 * channel operations. Activation and deactivation can be made to fail, and activation can be held.
 */
public class RecordingTransport implements RealtimeTransport {

    private final InMemoryRealtimeTransport delegate = new InMemoryRealtimeTransport();
    private final List<String> openedChannels = new CopyOnWriteArrayList<>();
    private final AtomicInteger activations = new AtomicInteger();
    private final AtomicInteger deactivations = new AtomicInteger();
    private final AtomicInteger handlerRegistrations = new AtomicInteger();
    private volatile boolean failActivation;
    private volatile boolean failDeactivation;
    private volatile CompletableFuture<Void> activationGate;

    @Override
    public RealtimeChannel openChannel(String name) {
        openedChannels.add(name);
        return new RecordingChannel(delegate.openChannel(name));
    }

    public int publish(ChangePayload payload) {
        return delegate.publish(payload);
    }

    public void failActivation(boolean fail) {
        this.failActivation = fail;
    }

    /** Makes later activations wait for the gate; completing it exceptionally fails them. */
    public void holdActivation(CompletableFuture<Void> gate) {
        this.activationGate = gate;
    }

    public void failDeactivation(boolean fail) {
        this.failDeactivation = fail;
    }

    /** Every openChannel call, in order; repeated names mean the channel was opened again. */
    public List<String> openedChannels() {
        return List.copyOf(openedChannels);
    }

    public List<String> liveChannelNames() {
        return delegate.openChannelNames();
    }

    public int activations() {
        return activations.get();
    }

    public int deactivations() {
        return deactivations.get();
    }

    public int handlerRegistrations() {
        return handlerRegistrations.get();
    }

    private final class RecordingChannel implements RealtimeChannel {

        private final RealtimeChannel target;

        RecordingChannel(RealtimeChannel target) {
            this.target = target;
        }

        @Override
        public String name() {
            return target.name();
        }

        @Override
        public void on(ChangeEventKind kind, WatchedTable table, FilterExpression filter, ChangeHandler handler) {
            handlerRegistrations.incrementAndGet();
            target.on(kind, table, filter, handler);
        }

        @Override
        public CompletableFuture<Void> activate() {
            activations.incrementAndGet();
            if (failActivation) {
                return CompletableFuture.failedFuture(new IllegalStateException("activation refused"));
            }
            CompletableFuture<Void> gate = activationGate;
            if (gate != null) {
                return gate.thenCompose(ignored -> target.activate());
            }
            return target.activate();
        }

        @Override
        public boolean isActive() {
            return target.isActive();
        }

        @Override
        public CompletableFuture<Void> deactivate() {
            deactivations.incrementAndGet();
            if (failDeactivation) {
                return CompletableFuture.failedFuture(new IllegalStateException("deactivation refused"));
            }
            return target.deactivate();
        }
    }
}
