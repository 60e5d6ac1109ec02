package guraa.stampdetect.service;

import guraa.stampdetect.model.StampReference;
import lombok.Getter;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of the loaded reference stamps. A reload builds a new store and
 * swaps it in whole, so detections in flight keep the snapshot they started with.
 */
@Getter
public final class StampStore {

    private final List<StampReference> stamps;
    private final Path directory;
    private final Instant loadedAt;

    public StampStore(List<StampReference> stamps, Path directory, Instant loadedAt) {
        this.stamps = List.copyOf(stamps);
        this.directory = directory;
        this.loadedAt = loadedAt;
    }

    public static StampStore empty(Path directory) {
        return new StampStore(List.of(), directory, Instant.now());
    }

    public boolean isEmpty() {
        return stamps.isEmpty();
    }

    public int size() {
        return stamps.size();
    }

    public Optional<StampReference> find(String name) {
        return stamps.stream().filter(s -> s.getName().equals(name)).findFirst();
    }
}
