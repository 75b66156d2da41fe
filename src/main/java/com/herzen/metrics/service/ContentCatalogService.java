package com.herzen.metrics.service;

import com.herzen.metrics.domain.ContentModels.ContentItem;
import com.herzen.metrics.domain.ContentModels.ContentItemIn;
import com.herzen.metrics.domain.ContentModels.RegisterItemsAck;
import com.herzen.metrics.domain.MetricModels.Level;
import com.herzen.metrics.error.InvalidMetricDefinitionException;
import com.herzen.metrics.repository.ContentCatalogJdbcRepository;
import com.herzen.metrics.repository.StoreRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Read model of the content tree (program → namespace → lesson → component).
 * Every write bumps {@link #version()}, which also invalidates the in-memory snapshot.
 */
@Service
public class ContentCatalogService {
    private static final Logger log = LoggerFactory.getLogger(ContentCatalogService.class);

    private final ContentCatalogJdbcRepository repository;
    private final StoreRetry storeRetry;
    private final AtomicLong version = new AtomicLong(1);
    private volatile CatalogSnapshot snapshot;

    public ContentCatalogService(ContentCatalogJdbcRepository repository, StoreRetry storeRetry) {
        this.repository = repository;
        this.storeRetry = storeRetry;
    }

    public RegisterItemsAck register(List<ContentItemIn> items) {
        if (items == null || items.isEmpty()) return new RegisterItemsAck(0, version());
        List<ContentItem> parsed = items.stream().map(this::toItem).toList();
        storeRetry.run("catalog.upsert", () -> repository.upsertItems(parsed));
        long newVersion = version.incrementAndGet();
        log.info("Registered {} content item(s), catalog version {}", parsed.size(), newVersion);
        return new RegisterItemsAck(parsed.size(), newVersion);
    }

    public long version() {
        return version.get();
    }

    public Set<String> itemIdsAtLevel(Level level) {
        return snapshot().byLevel().getOrDefault(level, Set.of());
    }

    public List<ContentItem> itemsAtLevel(Level level) {
        CatalogSnapshot s = snapshot();
        return s.byLevel().getOrDefault(level, Set.of()).stream().map(s.byId()::get).toList();
    }

    public Optional<ContentItem> find(String itemId) {
        return Optional.ofNullable(snapshot().byId().get(itemId));
    }

    public String tagOf(String itemId) {
        return find(itemId).map(ContentItem::tag).orElse(null);
    }

    /**
     * The item itself followed by every item below it.
     */
    public Set<String> descendantsAndSelf(String itemId) {
        CatalogSnapshot s = snapshot();
        Set<String> out = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(itemId);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!out.add(current)) continue;
            s.children().getOrDefault(current, List.of()).forEach(stack::push);
        }
        return out;
    }

    public Set<String> ancestorsAndSelf(String itemId) {
        CatalogSnapshot s = snapshot();
        Set<String> out = new LinkedHashSet<>();
        String current = itemId;
        while (current != null && out.add(current)) {
            ContentItem item = s.byId().get(current);
            current = item == null ? null : item.parentId();
        }
        return out;
    }

    public Optional<String> ancestorAtLevel(String itemId, Level level) {
        CatalogSnapshot s = snapshot();
        return ancestorsAndSelf(itemId).stream()
                .filter(id -> s.byId().containsKey(id) && s.byId().get(id).level() == level)
                .findFirst();
    }

    private CatalogSnapshot snapshot() {
        CatalogSnapshot current = snapshot;
        long expected = version.get();
        if (current != null && current.version() == expected) return current;

        List<ContentItem> items = storeRetry.call("catalog.load", repository::loadAll);
        Map<String, ContentItem> byId = new HashMap<>();
        Map<Level, Set<String>> byLevel = new EnumMap<>(Level.class);
        Map<String, List<String>> children = new HashMap<>();
        for (ContentItem item : items) {
            byId.put(item.id(), item);
            byLevel.computeIfAbsent(item.level(), l -> new TreeSet<>()).add(item.id());
            if (item.parentId() != null) {
                children.computeIfAbsent(item.parentId(), p -> new ArrayList<>()).add(item.id());
            }
        }
        CatalogSnapshot loaded = new CatalogSnapshot(expected, byId, byLevel, children);
        snapshot = loaded;
        return loaded;
    }

    private ContentItem toItem(ContentItemIn in) {
        if (in == null || in.id() == null || in.id().isBlank()) {
            throw new InvalidMetricDefinitionException("Content item id is required");
        }
        Level level;
        try {
            level = Level.fromValue(in.level());
        } catch (IllegalArgumentException e) {
            throw new InvalidMetricDefinitionException("Content item " + in.id() + ": " + e.getMessage());
        }
        String tag = in.tag() == null || in.tag().isBlank() ? null : in.tag().trim();
        return new ContentItem(in.id().trim(), level, in.parentId(), tag);
    }

    private record CatalogSnapshot(long version,
                                   Map<String, ContentItem> byId,
                                   Map<Level, Set<String>> byLevel,
                                   Map<String, List<String>> children) {}
}
