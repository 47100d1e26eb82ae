package org.carball.bom.quote;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.carball.bom.model.part.ActualPartKey;
import org.carball.bom.model.quote.PriceBreak;
import org.carball.bom.model.quote.VendorQuote;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Persistent map from manufacturer part to the vendor quotes last fetched for it.
 * <p>
 * Quotes older than the time-to-live are dropped on {@link #load()}, and a part left without quotes
 * is dropped entirely. The map is safe for concurrent puts of distinct keys.
 */
@Slf4j
public class QuoteCache {

    public static final int SCHEMA_VERSION = 1;
    public static final Duration DEFAULT_TTL = Duration.ofDays(2);

    @Getter
    private final Path file;
    @Getter
    private final Duration timeToLive;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final Map<ActualPartKey, List<VendorQuote>> entries = new ConcurrentHashMap<>();

    public QuoteCache(Path file) {
        this(file, DEFAULT_TTL, Clock.systemUTC());
    }

    public QuoteCache(Path file, Duration timeToLive, Clock clock) {
        this.file = file;
        this.timeToLive = timeToLive;
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Reads the cache file, if there is one, discarding stale quotes.
     *
     * @return number of quotes discarded as stale
     */
    public int load() throws IOException {
        entries.clear();
        if (file == null || !Files.exists(file)) {
            log.info("No quote cache at {}; starting empty", file);
            return 0;
        }

        CacheFile cacheFile;
        try {
            cacheFile = objectMapper.readValue(file.toFile(), CacheFile.class);
        } catch (IOException e) {
            throw new IOException("Quote cache " + file + " is not readable: " + e.getMessage(), e);
        }
        if (cacheFile.getSchemaVersion() != SCHEMA_VERSION) {
            throw new IOException("Quote cache " + file + " has schema version " + cacheFile.getSchemaVersion()
                    + "; expected " + SCHEMA_VERSION);
        }

        Instant cutoff = clock.instant().minus(timeToLive);
        int stale = 0;
        for (CacheEntry entry : cacheFile.getEntries()) {
            ActualPartKey key = new ActualPartKey(entry.getManufacturer(), entry.getManufacturerPartName());
            List<VendorQuote> fresh = new ArrayList<>();
            for (CachedQuote cached : entry.getQuotes()) {
                VendorQuote quote = cached.toQuote(key);
                if (quote.isOlderThan(cutoff)) {
                    stale++;
                } else {
                    fresh.add(quote);
                }
            }
            if (!fresh.isEmpty()) {
                entries.put(key, List.copyOf(fresh));
            }
        }

        log.info("Loaded {} cached parts from {} ({} stale quotes dropped)", entries.size(), file, stale);
        return stale;
    }

    public Optional<List<VendorQuote>> get(ActualPartKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Stores {@code quotes} for {@code key}. An empty list is kept for the rest of the run so the part
     * is not fetched again, but it does not survive the next {@link #load()}.
     */
    public void put(ActualPartKey key, List<VendorQuote> quotes) {
        entries.put(key, List.copyOf(quotes));
    }

    public boolean contains(ActualPartKey key) {
        return entries.containsKey(key);
    }

    Set<ActualPartKey> keys() {
        return Set.copyOf(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    /**
     * Writes every entry to the cache file, replacing it atomically where the file system allows.
     */
    public synchronized void save() throws IOException {
        if (file == null) {
            return;
        }

        CacheFile cacheFile = new CacheFile(SCHEMA_VERSION, new ArrayList<>());
        for (Map.Entry<ActualPartKey, List<VendorQuote>> entry : new TreeMap<>(entries).entrySet()) {
            List<CachedQuote> quotes = new ArrayList<>();
            for (VendorQuote quote : entry.getValue()) {
                quotes.add(CachedQuote.from(quote));
            }
            cacheFile.getEntries().add(new CacheEntry(entry.getKey().manufacturerName(),
                    entry.getKey().manufacturerPartName(), quotes));
        }

        Path directory = file.toAbsolutePath().getParent();
        if (directory != null) {
            Files.createDirectories(directory);
        }
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        objectMapper.writeValue(temp.toFile(), cacheFile);
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
        log.debug("Saved {} cached parts to {}", entries.size(), file);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class CacheFile {
        @JsonProperty("schema_version")
        private int schemaVersion;

        @JsonProperty("entries")
        private List<CacheEntry> entries = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class CacheEntry {
        @JsonProperty("manufacturer")
        private String manufacturer;

        @JsonProperty("manufacturer_part_name")
        private String manufacturerPartName;

        @JsonProperty("quotes")
        private List<CachedQuote> quotes = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class CachedQuote {
        @JsonProperty("vendor_name")
        private String vendorName;

        @JsonProperty("vendor_part_name")
        private String vendorPartName;

        @JsonProperty("available_quantity")
        private int availableQuantity;

        @JsonProperty("price_breaks")
        private List<PriceBreak> priceBreaks = new ArrayList<>();

        @JsonProperty("fetched_at")
        private long fetchedAt;

        static CachedQuote from(VendorQuote quote) {
            return new CachedQuote(quote.vendorName(), quote.vendorPartName(), quote.availableQuantity(),
                    quote.priceBreaks(), quote.fetchedAt().getEpochSecond());
        }

        VendorQuote toQuote(ActualPartKey key) {
            return new VendorQuote(key, vendorName, vendorPartName, availableQuantity, priceBreaks,
                    Instant.ofEpochSecond(fetchedAt));
        }
    }
}
