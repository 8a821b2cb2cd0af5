package com.gt.linker.knowledgePoint;

import com.gt.linker.conf.BeanConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Runs mutations asynchronously with at most one in flight per key. A mutation submitted for several
 * keys waits for every one of them and blocks each until it finishes. A failed mutation does not stop
 * the ones queued behind it.
 */
@Component
public class KeyedMutationQueue {

    private static final CompletableFuture<Object> IDLE = CompletableFuture.completedFuture(null);

    private final Executor executor;
    private final Map<String, CompletableFuture<?>> tails = new ConcurrentHashMap<>();

    @Autowired
    public KeyedMutationQueue(@Qualifier(BeanConfig.MUTATION_EXECUTOR) Executor executor) {
        this.executor = executor;
    }

    public <T> CompletableFuture<T> submit(String key, Supplier<T> mutation) {
        return submit(List.of(key), mutation);
    }

    public <T> CompletableFuture<T> submit(Collection<String> keys, Supplier<T> mutation) {
        List<String> distinctKeys = keys.stream().distinct().toList();
        CompletableFuture<T> next;

        synchronized (tails) {
            CompletableFuture<?>[] predecessors = distinctKeys.stream()
                    .map(key -> tails.getOrDefault(key, IDLE).handle((result, ex) -> null))
                    .toArray(CompletableFuture[]::new);

            next = CompletableFuture.allOf(predecessors).thenApplyAsync(ignored -> mutation.get(), executor);
            for (String key : distinctKeys) {
                tails.put(key, next);
            }
        }

        CompletableFuture<T> submitted = next;
        submitted.whenComplete((result, ex) -> distinctKeys.forEach(key -> tails.remove(key, submitted)));

        return submitted;
    }

    int pendingKeyCount() {
        return tails.size();
    }
}
