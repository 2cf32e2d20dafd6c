package io.trading.executor.lookup;

import com.fasterxml.jackson.databind.JsonNode;
import io.trading.executor.error.ExecutorException;
import io.trading.executor.error.NotFoundException;
import io.trading.executor.model.CommissionRate;
import io.trading.executor.model.TradingRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves trading rules and commission rates from descriptor files.
 *
 * Lookups walk the search path and the first location whose venue file has an entry for
 * the symbol wins; locations are never merged. Successful results are cached per
 * (kind, venue, symbol) and revalidated lazily against the source file's modification
 * marker on each hit. Concurrent cold lookups of the same key share a single parse;
 * lookups of different keys never wait on each other.
 */
public class ConfigLookupService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigLookupService.class);

    private final DescriptorLocator locator;
    private final DescriptorParser parser;
    private final ConcurrentHashMap<CacheKey, CompletableFuture<CacheEntry>> cache = new ConcurrentHashMap<>();

    public ConfigLookupService(DescriptorLocator locator, DescriptorParser parser) {
        this.locator = locator;
        this.parser = parser;
    }

    /**
     * @throws NotFoundException                                     if no location has the symbol
     * @throws io.trading.executor.error.MalformedDescriptorException if the matching entry is invalid
     */
    public TradingRule tradingRule(String venue, String symbol) {
        return (TradingRule) lookup(new CacheKey(DescriptorKind.TRADING_RULE, normalize(venue), symbol));
    }

    /**
     * @throws NotFoundException                                     if no location has the symbol
     * @throws io.trading.executor.error.MalformedDescriptorException if the matching entry is invalid
     */
    public CommissionRate commissionRate(String venue, String symbol) {
        return (CommissionRate) lookup(new CacheKey(DescriptorKind.COMMISSION_RATE, normalize(venue), symbol));
    }

    /**
     * Drops every cached entry. In-flight loads complete but are not reused.
     */
    public void clearCache() {
        cache.clear();
        LOGGER.info("Descriptor cache cleared");
    }

    public int getCacheSize() {
        return cache.size();
    }

    public DescriptorParser getParser() {
        return parser;
    }

    private Object lookup(CacheKey key) {
        if (key.symbol() == null || key.symbol().isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be null or empty");
        }
        while (true) {
            CompletableFuture<CacheEntry> future = cache.get(key);
            if (future == null) {
                CompletableFuture<CacheEntry> created = new CompletableFuture<>();
                future = cache.putIfAbsent(key, created);
                if (future == null) {
                    return loadInto(key, created).value();
                }
            }

            CacheEntry entry = await(future);
            if (entry.isCurrent()) {
                return entry.value();
            }
            LOGGER.debug("Descriptor {} changed, reloading {}", entry.source(), key);
            cache.remove(key, future);
        }
    }

    private CacheEntry loadInto(CacheKey key, CompletableFuture<CacheEntry> slot) {
        try {
            CacheEntry entry = load(key);
            slot.complete(entry);
            return entry;
        } catch (RuntimeException e) {
            // failures are not cached; the next lookup retries
            cache.remove(key, slot);
            slot.completeExceptionally(e);
            throw e;
        }
    }

    private CacheEntry load(CacheKey key) {
        for (Path file : locator.candidates(key.kind(), key.venue())) {
            FileMarker marker = FileMarker.of(file);
            if (marker == null) {
                continue;
            }
            Map<String, JsonNode> entries = parser.parse(file);
            JsonNode entry = entries.get(key.symbol());
            if (entry == null) {
                continue;
            }
            Object value = switch (key.kind()) {
                case TRADING_RULE -> parser.toTradingRule(file, key.symbol(), entry);
                case COMMISSION_RATE -> parser.toCommissionRate(file, key.symbol(), entry);
            };
            LOGGER.debug("Loaded {} for {}/{} from {}", key.kind(), key.venue(), key.symbol(), file);
            return new CacheEntry(value, file, marker);
        }
        throw new NotFoundException(key.venue(), key.symbol(), key.kind().getDisplayName());
    }

    private static CacheEntry await(CompletableFuture<CacheEntry> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExecutorException executorException) {
                throw executorException;
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new ExecutorException("Descriptor load failed", cause);
        }
    }

    private static String normalize(String venue) {
        if (venue == null || venue.isBlank()) {
            throw new IllegalArgumentException("venue cannot be null or empty");
        }
        return venue.trim().toLowerCase(Locale.ROOT);
    }

    private record CacheKey(DescriptorKind kind, String venue, String symbol) {}

    private record CacheEntry(Object value, Path source, FileMarker marker) {
        boolean isCurrent() {
            return marker.equals(FileMarker.of(source));
        }
    }

    /**
     * On-disk modification marker: last-modified time plus size.
     */
    private record FileMarker(long lastModifiedMillis, long size) {
        static FileMarker of(Path file) {
            try {
                BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
                if (!attributes.isRegularFile()) {
                    return null;
                }
                return new FileMarker(attributes.lastModifiedTime().toMillis(), attributes.size());
            } catch (IOException e) {
                return null;
            }
        }
    }
}
