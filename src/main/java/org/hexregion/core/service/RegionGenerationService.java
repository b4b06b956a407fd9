package org.hexregion.core.service;

import org.hexregion.core.generation.GenerationContext;
import org.hexregion.core.generation.GenerationPipeline;
import org.hexregion.core.io.LoadResult;
import org.hexregion.core.io.ProgressListener;
import org.hexregion.core.io.RegionSerializer;
import org.hexregion.core.io.SaveResult;
import org.hexregion.core.model.RegionData;
import org.hexregion.core.model.config.GeneratorSettings;
import org.hexregion.core.util.CancellationToken;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Генерация, сохранение и загрузка регионов. Тяжёлая работа идёт в фоновом пуле,
 * по одному региону одновременно выполняется не больше одной операции.
 */
public class RegionGenerationService implements AutoCloseable {

    private final GenerationPipeline pipeline;
    private final RegionSerializer serializer;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    // ключ: id региона либо нормализованный путь файла
    private final Map<Object, CompletableFuture<?>> inFlight = new ConcurrentHashMap<>();

    public RegionGenerationService(GenerationPipeline pipeline, RegionSerializer serializer, ExecutorService executor) {
        this.pipeline = pipeline;
        this.serializer = serializer;
        this.executor = executor;
        this.ownsExecutor = false;
    }

    public RegionGenerationService(GenerationPipeline pipeline, RegionSerializer serializer) {
        this.pipeline = pipeline;
        this.serializer = serializer;
        this.executor = Executors.newFixedThreadPool(2, daemonFactory());
        this.ownsExecutor = true;
    }

    public RegionGenerationService() {
        this(new GenerationPipeline(), new RegionSerializer());
    }

    /**
     * Id региона выводится из сида и имени: одинаковые параметры дают одинаковый id.
     */
    public static UUID regionIdFor(GeneratorSettings settings) {
        String key = "region:" + settings.name + ":" + settings.seed + ":" + settings.width + "x" + settings.height;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8));
    }

    public RegionData generate(GeneratorSettings settings, CancellationToken token) {
        settings.validate();
        RegionData region = RegionData.createEmpty(regionIdFor(settings), settings.name,
                settings.width, settings.height, settings.seed);
        GenerationContext ctx = new GenerationContext(region, settings, token);
        pipeline.run(ctx);
        region.setGeneratedAt(Instant.now());
        return region;
    }

    public CompletableFuture<RegionData> generateAsync(GeneratorSettings settings, CancellationToken token) {
        settings.validate();
        return submit(regionIdFor(settings), () -> generate(settings, token));
    }

    public CompletableFuture<SaveResult> saveAsync(RegionData region, Path path, ProgressListener progress,
                                                   CancellationToken token) {
        return submit(region.getId(), () -> serializer.save(region, path, progress, token));
    }

    public CompletableFuture<LoadResult<RegionData>> loadAsync(Path path, ProgressListener progress,
                                                               CancellationToken token) {
        return submit(path.toAbsolutePath().normalize(), () -> serializer.load(path, progress, token));
    }

    public boolean isBusy(UUID regionId) {
        return inFlight.containsKey(regionId);
    }

    private <T> CompletableFuture<T> submit(Object key, Supplier<T> work) {
        CompletableFuture<T> future = new CompletableFuture<>();
        if (inFlight.putIfAbsent(key, future) != null) {
            throw new IllegalStateException("Operation already in progress for " + key);
        }
        // вызывающий получает зависимую future: к её завершению ключ уже снят
        CompletableFuture<T> result = future.whenComplete((r, e) -> inFlight.remove(key, future));
        try {
            executor.execute(() -> {
                try {
                    future.complete(work.get());
                } catch (Throwable t) {
                    future.completeExceptionally(t);
                }
            });
        } catch (RuntimeException e) {
            inFlight.remove(key, future);
            throw e;
        }
        return result;
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    private static ThreadFactory daemonFactory() {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "region-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
