package com.phillippitts.voicechat.service.realtime.transport;

import com.phillippitts.voicechat.exception.TransportException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Waits on transport acknowledgements with a bounded timeout and translates every failure
 * mode into a {@link TransportException}.
 */
public final class TransportCalls {

    private TransportCalls() {}

    /**
     * Invokes a suspending transport call and waits for its acknowledgement.
     *
     * @param call        transport call, e.g. {@code channel::activate}
     * @param timeoutMs   maximum wait in milliseconds
     * @param operation   operation name for the error message (activate, deactivate)
     * @param channelName channel the call targets
     * @throws TransportException if the call throws, fails, times out or the wait is interrupted
     */
    public static void await(Supplier<CompletableFuture<Void>> call,
                             long timeoutMs,
                             String operation,
                             String channelName) {
        CompletableFuture<Void> future;
        try {
            future = call.get();
        } catch (TransportException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransportException("Channel " + operation + " failed", channelName, e);
        }
        if (future == null) {
            return;
        }
        try {
            future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransportException(
                    "Channel " + operation + " not acknowledged within " + timeoutMs + "ms", channelName, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for channel " + operation, channelName, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof TransportException te) {
                throw te;
            }
            throw new TransportException("Channel " + operation + " failed", channelName, cause);
        }
    }
}
