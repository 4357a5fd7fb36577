package tech.noetzold.zta.validation_api.reference;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Publishes the current reference snapshot. Readers take one snapshot per request;
 * {@link #reload()} swaps in a complete new one.
 */
@Slf4j
@Component
public class ReferenceDataHolder {

    private final ReferenceDataLoader loader;
    private final AtomicReference<ReferenceDataSnapshot> current =
            new AtomicReference<>(ReferenceDataSnapshot.empty());

    public ReferenceDataHolder(ReferenceDataLoader loader) {
        this.loader = loader;
    }

    @PostConstruct
    public void init() {
        current.set(loader.load());
    }

    public ReferenceDataSnapshot current() {
        return current.get();
    }

    public synchronized ReferenceDataSnapshot reload() {
        ReferenceDataSnapshot fresh = loader.load();
        ReferenceDataSnapshot retired = current.getAndSet(fresh);
        log.info("Reference data swapped, loaded_at={}", fresh.loadedAt());
        release(retired);
        return fresh;
    }

    @PreDestroy
    public void shutdown() {
        release(current.get());
    }

    private static void release(ReferenceDataSnapshot snapshot) {
        try {
            snapshot.close();
        } catch (IOException e) {
            log.warn("Retired reference snapshot from {} did not close cleanly: {}", snapshot.loadedAt(), e.getMessage());
        }
    }
}
