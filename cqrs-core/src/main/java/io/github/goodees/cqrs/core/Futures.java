package io.github.goodees.cqrs.core;

/*-
 * #%L
 * cqrs-core
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for composing asynchronous collaborator calls.
 */
public final class Futures {
    private Futures() {
    }

    /**
     * Wrap a result of callable. The callable is invoked immediately.
     * @param action the action to perform
     * @param <V> type of result
     * @return future completed with the return value or exception thrown from the callable
     */
    public static <V> CompletableFuture<V> invoke(Callable<V> action) {
        CompletableFuture<V> result = new CompletableFuture<>();
        try {
            result.complete(action.call());
        } catch (Exception e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    public static <V> CompletableFuture<V> failed(Throwable t) {
        CompletableFuture<V> result = new CompletableFuture<>();
        result.completeExceptionally(t);
        return result;
    }

    /**
     * Combine stages into a list of results, in the order of the stages.
     * @param stages stages to combine
     * @param <V> type of results
     * @return future completing when all stages complete, failing when any of them fails
     */
    public static <V> CompletableFuture<List<V>> allAsList(Collection<? extends CompletionStage<? extends V>> stages) {
        List<CompletableFuture<? extends V>> futures = new ArrayList<>(stages.size());
        for (CompletionStage<? extends V> stage : stages) {
            futures.add(stage.toCompletableFuture());
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).thenApply(ignored -> {
            List<V> results = new ArrayList<>(futures.size());
            for (CompletableFuture<? extends V> f : futures) {
                results.add(f.join());
            }
            return results;
        });
    }

    /**
     * Exception that caused completion or execution exception.
     * @param t exception thrown by a stage
     * @return the cause, if t is wrapper exception
     */
    public static Throwable unwrapCompletionException(Throwable t) {
        Throwable result = t;
        while ((result instanceof CompletionException || result instanceof ExecutionException)
                && result.getCause() != null) {
            result = result.getCause();
        }
        return result;
    }
}
