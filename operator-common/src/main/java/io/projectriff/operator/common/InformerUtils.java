/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common;

import io.fabric8.kubernetes.client.informers.SharedIndexInformer;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Utility methods for working with informers
 */
public class InformerUtils {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(InformerUtils.class);

    private InformerUtils() { }

    /**
     * Synchronously stops one or more informers. It will stop them and then wait for up to the specified timeout for
     * each of them to actually stop.
     *
     * @param timeoutMs     Timeout in milliseconds for how long we will wait for each informer to stop
     * @param informers     Informers which should be stopped.
     */
    public static void stopAll(long timeoutMs, SharedIndexInformer<?>... informers) {
        LOGGER.infoOp("Stopping informers");
        for (SharedIndexInformer<?> informer : informers)    {
            informer.stop();
        }

        try {
            for (SharedIndexInformer<?> informer : informers)    {
                informer.stopped().toCompletableFuture().get(timeoutMs, TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warnOp("Interrupted while waiting for the informers to stop", e);
        } catch (TimeoutException | ExecutionException e) {
            // We just log the error as we are anyway shutting down
            LOGGER.warnOp("Failed to wait for the informers to stop", e);
        }
    }

    /**
     * Exception handler for informers which logs the error and lets the informer retry its watch
     *
     * @param type          Kind of the resources watched by the informer
     * @param isStarted     Whether the informer was already started
     * @param throwable     Error raised by the informer
     *
     * @return  Always true to keep the informer retrying
     */
    public static boolean loggingExceptionHandler(String type, boolean isStarted, Throwable throwable) {
        LOGGER.errorOp("Caught exception in the {} informer which is {}", type, isStarted ? "started" : "not started", throwable);
        return true;
    }
}
