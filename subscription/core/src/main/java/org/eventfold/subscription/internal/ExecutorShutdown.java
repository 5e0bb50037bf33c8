/*
 * Copyright 2026 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventfold.subscription.internal;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Utility functions for shutting down executor services.
 */
public class ExecutorShutdown {

    /**
     * Blocks until all tasks have completed execution after a shutdown request, or the timeout occurs, or the current thread is interrupted, whichever happens first.
     * Tasks still running when the timeout expires are interrupted.
     *
     * @param executorService The executor service
     * @param timeout         the maximum time to wait
     * @param unit            the time unit of the timeout argument
     * @return {@code true} if the executor terminated before the timeout, {@code false} otherwise.
     */
    public static boolean shutdownSafely(ExecutorService executorService, long timeout, TimeUnit unit) {
        if (executorService.isTerminated()) {
            return true;
        }
        executorService.shutdown();
        try {
            if (executorService.awaitTermination(timeout, unit)) {
                return true;
            }
            executorService.shutdownNow();
            return false;
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
