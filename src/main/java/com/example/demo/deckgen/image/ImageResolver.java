package com.example.demo.deckgen.image;

import com.example.demo.deckgen.aspect.LogExecutionTime;
import com.example.demo.deckgen.catalog.TemplateLoader;
import com.example.demo.deckgen.config.DeckgenProperties;
import com.example.demo.deckgen.config.ImageFetchConfiguration;
import com.example.demo.deckgen.exception.DocumentAssemblyException;
import com.example.demo.deckgen.exception.RenderCancelledException;
import com.example.demo.deckgen.exception.ResourceLoadingException;
import com.example.demo.deckgen.model.ImageDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves the images of one deck concurrently on the shared fetch pool.
 *
 * Each fetch gets the configured timeout from the moment it starts running;
 * the batch as a whole gets {@code timeout * ceil(n / poolSize)} plus one
 * timeout for queueing. Anything that is not a decodable image by then is
 * replaced by the slide's fallback resource. Results are keyed by slide index.
 */
@Slf4j
@Component
public class ImageResolver {
    private static final long POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final ImageProvider provider;
    private final ExecutorService executor;
    private final TemplateLoader resourceLoader;
    private final DeckgenProperties properties;

    public ImageResolver(ImageProvider provider,
                         @Qualifier(ImageFetchConfiguration.IMAGE_FETCH_EXECUTOR) ExecutorService executor,
                         TemplateLoader resourceLoader,
                         DeckgenProperties properties) {
        this.provider = provider;
        this.executor = executor;
        this.resourceLoader = resourceLoader;
        this.properties = properties;
    }

    @LogExecutionTime("Resolving Images")
    public Map<Integer, ResolvedImage> resolveAll(Map<Integer, ImageDescriptor> descriptors) {
        Map<Integer, ResolvedImage> resolved = new TreeMap<>();
        if (descriptors.isEmpty()) {
            return resolved;
        }
        Duration timeout = properties.getImages().getTimeout();
        long timeoutNanos = timeout.toNanos();
        int poolSize = Math.max(1, properties.getImages().getPoolSize());
        long waves = (descriptors.size() + poolSize - 1) / poolSize;
        long deadline = System.nanoTime() + timeoutNanos * waves + timeoutNanos;

        Map<Integer, FetchTask> tasks = new LinkedHashMap<>();
        for (Map.Entry<Integer, ImageDescriptor> entry : descriptors.entrySet()) {
            FetchTask task = new FetchTask(entry.getValue().getQuery(), timeout);
            task.future = executor.submit(task);
            tasks.put(entry.getKey(), task);
        }

        try {
            for (Map.Entry<Integer, FetchTask> entry : tasks.entrySet()) {
                int index = entry.getKey();
                ImageDescriptor descriptor = descriptors.get(index);
                Optional<FetchedImage> fetched = await(index, entry.getValue(), deadline, timeoutNanos);
                resolved.put(index, accept(index, descriptor, fetched));
            }
        } catch (InterruptedException e) {
            tasks.values().forEach(t -> t.future.cancel(true));
            Thread.currentThread().interrupt();
            throw new RenderCancelledException("Render cancelled while resolving images", e);
        }
        return resolved;
    }

    private Optional<FetchedImage> await(int index, FetchTask task, long deadline, long timeoutNanos)
            throws InterruptedException {
        while (true) {
            Long started = task.startedAt;
            long limit = started == null ? deadline : Math.min(deadline, started + timeoutNanos);
            long wait = limit - System.nanoTime();
            if (wait <= 0) {
                task.future.cancel(true);
                log.warn("Image fetch for slide {} ('{}') timed out, using fallback", index, task.query);
                return Optional.empty();
            }
            try {
                Optional<FetchedImage> result = task.future.get(Math.min(wait, POLL_NANOS), TimeUnit.NANOSECONDS);
                return result == null ? Optional.empty() : result;
            } catch (TimeoutException e) {
                // the task may have started since the last poll, which moves its limit
                log.trace("Still waiting for image of slide {}", index);
            } catch (ExecutionException e) {
                log.warn("Image fetch for slide {} ('{}') failed: {}", index, task.query, e.getCause().toString());
                return Optional.empty();
            } catch (CancellationException e) {
                return Optional.empty();
            }
        }
    }

    private ResolvedImage accept(int index, ImageDescriptor descriptor, Optional<FetchedImage> fetched) {
        if (fetched.isPresent()) {
            FetchedImage image = fetched.get();
            String contentType = image.getContentType();
            if (contentType == null || !contentType.toLowerCase(Locale.ROOT).startsWith("image/")) {
                log.warn("Provider returned non-image content '{}' for slide {}, using fallback", contentType, index);
            } else if (!decodable(image.getBytes())) {
                log.warn("Provider returned undecodable image for slide {}, using fallback", index);
            } else {
                return new ResolvedImage(image.getBytes(), contentType, false, descriptor.getQuery());
            }
        }
        return fallback(descriptor);
    }

    ResolvedImage fallback(ImageDescriptor descriptor) {
        String location = descriptor.getFallbackResource();
        byte[] bytes;
        try {
            bytes = resourceLoader.getResourceBytes(location);
        } catch (ResourceLoadingException e) {
            throw new DocumentAssemblyException("FALLBACK_IMAGE_UNAVAILABLE", "Fallback image '" + location + "' cannot be read", e);
        }
        if (!decodable(bytes)) {
            throw new DocumentAssemblyException("FALLBACK_IMAGE_UNAVAILABLE", "Fallback image '" + location + "' is not a readable image", null);
        }
        return new ResolvedImage(bytes, "image/png", true, location);
    }

    static boolean decodable(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return false;
        }
        try {
            return ImageIO.read(new ByteArrayInputStream(bytes)) != null;
        } catch (IOException | RuntimeException e) {
            return false;
        }
    }

    private final class FetchTask implements Callable<Optional<FetchedImage>> {
        private final String query;
        private final Duration timeout;
        private volatile Long startedAt;
        private Future<Optional<FetchedImage>> future;

        FetchTask(String query, Duration timeout) {
            this.query = query;
            this.timeout = timeout;
        }

        @Override
        public Optional<FetchedImage> call() {
            startedAt = System.nanoTime();
            return provider.fetch(query, timeout);
        }
    }
}
