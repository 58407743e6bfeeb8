package com.codeops.workbench.storage;

import com.codeops.workbench.exception.StorageException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Drives every {@link StorageProvider}: loads them at startup, saves them opportunistically
 * from a scheduled tick subject to each provider's throttle, and saves everything on shutdown.
 */
@Component
@Slf4j
public class StorageManager {

    private final List<Tracked<?>> providers;
    private final Clock clock;

    @Autowired
    public StorageManager(List<StorageProvider<?>> providers) {
        this(providers, Clock.systemUTC());
    }

    StorageManager(List<StorageProvider<?>> providers, Clock clock) {
        this.providers = providers.stream().<Tracked<?>>map(provider -> track(provider)).toList();
        this.clock = clock;
    }

    @PostConstruct
    public void loadAll() {
        providers.forEach(Tracked::load);
    }

    /**
     * Saves every provider whose state changed and whose throttle window has elapsed.
     * Failures are logged and retried on a later tick.
     */
    @Scheduled(fixedDelayString = "${codeops.workbench.flush-interval:500}")
    public void flush() {
        Instant now = clock.instant();
        for (Tracked<?> tracked : providers) {
            try {
                tracked.saveIfDue(now);
            } catch (StorageException e) {
                log.error("Saving '{}' failed, will retry", tracked.provider.key(), e);
            }
        }
    }

    @PreDestroy
    public void saveAll() {
        Instant now = clock.instant();
        for (Tracked<?> tracked : providers) {
            try {
                tracked.forceSave(now);
            } catch (StorageException e) {
                log.error("Final save of '{}' failed", tracked.provider.key(), e);
            }
        }
    }

    private static <T> Tracked<T> track(StorageProvider<T> provider) {
        return new Tracked<>(provider);
    }

    private static final class Tracked<T> {

        private final StorageProvider<T> provider;
        private T lastSaved;
        private Instant lastSaveAt = Instant.EPOCH;

        Tracked(StorageProvider<T> provider) {
            this.provider = provider;
        }

        void load() {
            lastSaved = provider.load().orElse(null);
            log.info("Loaded storage provider '{}'", provider.key());
        }

        void saveIfDue(Instant now) {
            T next = provider.state();
            if (!provider.shouldSave(lastSaved, next)) {
                return;
            }
            if (lastSaveAt.plus(provider.throttleWait()).isAfter(now)) {
                return;
            }
            provider.save(false);
            lastSaved = next;
            lastSaveAt = now;
        }

        void forceSave(Instant now) {
            provider.save(true);
            lastSaved = provider.state();
            lastSaveAt = now;
        }
    }
}
