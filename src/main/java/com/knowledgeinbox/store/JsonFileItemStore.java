package com.knowledgeinbox.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * {@link ItemStore} backed by a single pretty-printed JSON file. The whole file is rewritten on every mutation,
 * which is fine for a personal inbox of a few thousand notes.
 */
public class JsonFileItemStore implements ItemStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileItemStore.class);

    private final Path path;
    private final Clock clock;
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public JsonFileItemStore(Path path) {
        this(path, Clock.systemUTC());
    }

    public JsonFileItemStore(Path path, Clock clock) {
        this.path = path;
        this.clock = clock;
    }

    @Override
    public synchronized Item create(ItemDraft draft) throws IOException {
        StoreFile file = load();
        Item item = new Item(file.nextId, draft.sourceKind(), draft.originUrl(), draft.rawText(), clock.instant());
        file.items.add(item);
        file.nextId = item.id() + 1;
        save(file);
        log.debug("Stored item {} kind={} chars={}", item.id(), item.sourceKind().wireName(), item.rawText().length());
        return item;
    }

    @Override
    public synchronized Optional<Item> get(long id) throws IOException {
        return load().items.stream()
                .filter(item -> item.id() == id)
                .findFirst();
    }

    @Override
    public synchronized List<Item> list(SourceKind filter) throws IOException {
        return load().items.stream()
                .filter(item -> filter == null || item.sourceKind() == filter)
                .sorted(Comparator.comparing(Item::createdAt).thenComparingLong(Item::id).reversed())
                .toList();
    }

    @Override
    public synchronized boolean delete(long id) throws IOException {
        StoreFile file = load();
        boolean removed = file.items.removeIf(item -> item.id() == id);
        if (removed) {
            save(file);
            log.debug("Deleted item {} from {}", id, path);
        }
        return removed;
    }

    public Path path() {
        return path;
    }

    private StoreFile load() throws IOException {
        if (!Files.exists(path) || Files.size(path) == 0L) {
            return new StoreFile();
        }
        return objectMapper.readValue(path.toFile(), StoreFile.class);
    }

    private void save(StoreFile file) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), file);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class StoreFile {
        public long nextId = 1L;
        public List<Item> items = new ArrayList<>();
    }
}
