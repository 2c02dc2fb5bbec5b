package com.example.demo.deckgen.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Bounded worker pool for image provider calls, shared by all renders.
 */
@Configuration
public class ImageFetchConfiguration {
    public static final String IMAGE_FETCH_EXECUTOR = "imageFetchExecutor";

    @Bean(name = IMAGE_FETCH_EXECUTOR, destroyMethod = "shutdownNow")
    @Qualifier(IMAGE_FETCH_EXECUTOR)
    public ExecutorService imageFetchExecutor(DeckgenProperties properties) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("image-fetch-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(Math.max(1, properties.getImages().getPoolSize()), threadFactory);
    }
}
