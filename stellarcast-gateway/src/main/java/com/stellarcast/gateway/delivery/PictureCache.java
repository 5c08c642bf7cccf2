package com.stellarcast.gateway.delivery;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stellarcast.common.config.ConfigPaths;
import com.stellarcast.common.infra.JsonFile;
import com.stellarcast.media.apod.PictureOfDay;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Today's picture ({@code apod.json}) and its composed image
 * ({@code apod_infopuzzle.png}) in the cache directory. Cache I/O failures are
 * logged and treated as a miss.
 * <p>
 * {@link #evictAll()} starts a new generation. Writers pass the generation
 * they read at the start of their work; a write from an older generation is
 * dropped, so data derived from before an eviction never outlives it.
 */
@Slf4j
public class PictureCache {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path pictureFile;
    private final Path composedFile;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private long generation;

    public PictureCache(Path cacheDir) {
        this.pictureFile = cacheDir.resolve(ConfigPaths.PICTURE_CACHE_FILENAME);
        this.composedFile = cacheDir.resolve(ConfigPaths.COMPOSED_CACHE_FILENAME);
    }

    public long generation() {
        lock.readLock().lock();
        try {
            return generation;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<PictureOfDay> loadPicture() {
        lock.readLock().lock();
        try {
            JsonNode node = JsonFile.readTree(pictureFile);
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            return Optional.of(MAPPER.treeToValue(node, PictureOfDay.class));
        } catch (IOException e) {
            log.warn("apod: ignoring unreadable picture cache {}: {}", pictureFile, e.getMessage());
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return false if the cache was evicted since {@code readGeneration} or
     *         the write failed
     */
    public boolean storePicture(PictureOfDay picture, long readGeneration) {
        lock.writeLock().lock();
        try {
            if (isStale(readGeneration, "picture")) {
                return false;
            }
            JsonFile.writeAtomically(pictureFile, MAPPER.writeValueAsBytes(picture));
            return true;
        } catch (IOException e) {
            log.warn("apod: failed to cache picture: {}", e.getMessage());
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<byte[]> loadComposed() {
        lock.readLock().lock();
        try {
            if (!Files.exists(composedFile)) {
                return Optional.empty();
            }
            byte[] bytes = Files.readAllBytes(composedFile);
            return bytes.length == 0 ? Optional.empty() : Optional.of(bytes);
        } catch (IOException e) {
            log.warn("apod: ignoring unreadable composed image {}: {}", composedFile, e.getMessage());
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return false if the cache was evicted since {@code readGeneration} or
     *         the write failed
     */
    public boolean storeComposed(byte[] png, long readGeneration) {
        lock.writeLock().lock();
        try {
            if (isStale(readGeneration, "composed image")) {
                return false;
            }
            JsonFile.writeAtomically(composedFile, png);
            return true;
        } catch (IOException e) {
            log.warn("apod: failed to cache composed image: {}", e.getMessage());
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void evictComposed() {
        lock.writeLock().lock();
        try {
            delete(composedFile);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drop both cached files and start a new generation.
     */
    public void evictAll() {
        lock.writeLock().lock();
        try {
            generation++;
            delete(pictureFile);
            delete(composedFile);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private boolean isStale(long readGeneration, String what) {
        if (readGeneration == generation) {
            return false;
        }
        log.info("apod: not caching {} from before the last eviction", what);
        return true;
    }

    private static void delete(Path file) {
        try {
            if (Files.deleteIfExists(file)) {
                log.debug("apod: evicted {}", file.getFileName());
            }
        } catch (IOException e) {
            log.warn("apod: failed to evict {}: {}", file, e.getMessage());
        }
    }
}
