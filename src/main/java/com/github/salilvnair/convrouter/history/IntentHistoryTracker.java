package com.github.salilvnair.convrouter.history;

import com.github.salilvnair.convrouter.config.ConvRouterHistoryConfig;
import com.github.salilvnair.convrouter.intent.ConfidenceLevel;
import com.github.salilvnair.convrouter.intent.Intent;
import com.github.salilvnair.convrouter.intent.IntentType;
import com.github.salilvnair.convrouter.intent.Sentiment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Bounded log of classified intents with per-user and per-type indexes.
 * <p>
 * When the log is full the oldest entry is dropped from the log and from the user and type
 * indexes it was filed under. Queries take the read lock and never mutate.
 */
@Slf4j
@Component
public class IntentHistoryTracker {

    private final int maxSize;
    private final Clock clock;

    private final Deque<TrackedIntent> history = new ArrayDeque<>();
    private final Map<String, Deque<TrackedIntent>> byUser = new HashMap<>();
    private final Map<IntentType, Deque<TrackedIntent>> byType = new EnumMap<>(IntentType.class);
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private long sequence;

    public IntentHistoryTracker(ConvRouterHistoryConfig config, Clock clock) {
        this.maxSize = Math.max(1, config.getMaxSize());
        this.clock = clock;
    }

    public void track(Intent intent, String userId) {
        lock.writeLock().lock();
        try {
            TrackedIntent entry = new TrackedIntent(intent, blankToNull(userId), ++sequence);
            history.addLast(entry);
            byType.computeIfAbsent(intent.getType(), t -> new ArrayDeque<>()).addLast(entry);
            if (entry.userId() != null) {
                byUser.computeIfAbsent(entry.userId(), u -> new ArrayDeque<>()).addLast(entry);
            }
            while (history.size() > maxSize) {
                evict(history.removeFirst());
            }
            log.debug("Tracked intent {} (total: {})", intent.getType(), history.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void track(Intent intent) {
        track(intent, null);
    }

    /**
     * Matching intents, oldest first.
     */
    public List<Intent> getHistory(HistoryQuery query) {
        HistoryQuery q = query == null ? HistoryQuery.all() : query;
        lock.readLock().lock();
        try {
            Collection<TrackedIntent> base;
            if (q.userId() != null) {
                base = byUser.getOrDefault(q.userId(), new ArrayDeque<>());
            } else if (q.type() != null) {
                base = byType.getOrDefault(q.type(), new ArrayDeque<>());
            } else {
                base = history;
            }
            List<Intent> matches = new ArrayList<>();
            for (TrackedIntent entry : base) {
                Intent intent = entry.intent();
                if (q.type() != null && intent.getType() != q.type()) {
                    continue;
                }
                if (q.since() != null && intent.getTimestamp().isBefore(q.since())) {
                    continue;
                }
                matches.add(intent);
            }
            if (q.limit() != null && q.limit() > 0 && matches.size() > q.limit()) {
                return List.copyOf(matches.subList(matches.size() - q.limit(), matches.size()));
            }
            return List.copyOf(matches);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<IntentType, Long> getFrequency(String userId, Instant since) {
        return countBy(query(userId, null, since), Intent::getType);
    }

    /**
     * Most frequent types first; equal counts keep first-seen order.
     */
    public List<IntentCount> getTopIntents(int n, String userId, Instant since) {
        return topIntents(query(userId, null, since), n);
    }

    public ConfidenceStats getConfidenceStats(IntentType type, String userId, Instant since) {
        return ConfidenceStats.of(query(userId, type, since).stream().map(Intent::getConfidence).toList());
    }

    public Map<ConfidenceLevel, Long> getConfidenceDistribution(IntentType type, String userId, Instant since) {
        return countBy(query(userId, type, since), Intent::getConfidenceLevel);
    }

    public Map<Sentiment, Long> getSentimentDistribution(IntentType type, String userId, Instant since) {
        List<Intent> withSentiment = query(userId, type, since).stream()
                .filter(i -> i.getSentiment() != null)
                .toList();
        return countBy(withSentiment, Intent::getSentiment);
    }

    /**
     * Volume per UTC hour over the last {@code hours} hours, oldest hour first. Hours without intents are omitted.
     */
    public List<HourlyVolume> getHourlyVolume(int hours, String userId) {
        Instant since = clock.instant().minus(Duration.ofHours(Math.max(0, hours)));
        Map<Instant, Long> byHour = new TreeMap<>();
        for (Intent intent : query(userId, null, since)) {
            byHour.merge(intent.getTimestamp().truncatedTo(ChronoUnit.HOURS), 1L, Long::sum);
        }
        return byHour.entrySet().stream()
                .map(e -> new HourlyVolume(e.getKey(), e.getValue()))
                .toList();
    }

    public Optional<UserPatterns> getUserPatterns(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        List<Intent> intents = query(userId, null, null);
        if (intents.isEmpty()) {
            return Optional.empty();
        }
        double avgConfidence = intents.stream().mapToDouble(Intent::getConfidence).average().orElse(0.0);

        Map<String, Long> languages = countBy(intents, Intent::getLanguage);
        String preferredLanguage = languages.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(Intent.DEFAULT_LANGUAGE);

        Map<Integer, Long> hourCounts = new TreeMap<>(
                countBy(intents, i -> i.getTimestamp().atZone(ZoneOffset.UTC).getHour()));
        int mostActiveHour = hourCounts.entrySet().stream()
                .max(Map.Entry.<Integer, Long>comparingByValue().thenComparing(Map.Entry.comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey)
                .orElse(0);

        Instant dayAgo = clock.instant().minus(Duration.ofHours(24));
        long last24h = intents.stream().filter(i -> !i.getTimestamp().isBefore(dayAgo)).count();

        return Optional.of(new UserPatterns(
                userId,
                intents.size(),
                topIntents(intents, 5),
                avgConfidence,
                preferredLanguage,
                mostActiveHour,
                last24h
        ));
    }

    public HistorySummary getSummary() {
        List<Intent> all;
        int uniqueUsers;
        lock.readLock().lock();
        try {
            all = history.stream().map(TrackedIntent::intent).toList();
            uniqueUsers = byUser.size();
        } finally {
            lock.readLock().unlock();
        }
        Instant now = clock.instant();
        Instant hourAgo = now.minus(Duration.ofHours(1));
        Instant dayAgo = now.minus(Duration.ofHours(24));
        return new HistorySummary(
                all.size(),
                uniqueUsers,
                all.stream().filter(i -> !i.getTimestamp().isBefore(hourAgo)).count(),
                all.stream().filter(i -> !i.getTimestamp().isBefore(dayAgo)).count(),
                topIntents(all, 10),
                ConfidenceStats.of(all.stream().map(Intent::getConfidence).toList()),
                countBy(all, Intent::getConfidenceLevel),
                countBy(all.stream().filter(i -> i.getSentiment() != null).toList(), Intent::getSentiment)
        );
    }

    public int clearUserHistory(String userId) {
        lock.writeLock().lock();
        try {
            Deque<TrackedIntent> removed = userId == null ? null : byUser.remove(userId);
            if (removed == null) {
                return 0;
            }
            history.removeIf(e -> userId.equals(e.userId()));
            byType.values().forEach(d -> d.removeIf(e -> userId.equals(e.userId())));
            byType.values().removeIf(Deque::isEmpty);
            log.info("Cleared {} tracked intent(s) for user {}", removed.size(), userId);
            return removed.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clearAll() {
        lock.writeLock().lock();
        try {
            history.clear();
            byUser.clear();
            byType.clear();
            log.info("Cleared intent history");
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return history.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    int userIndexSize(String userId) {
        lock.readLock().lock();
        try {
            Deque<TrackedIntent> entries = byUser.get(userId);
            return entries == null ? 0 : entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    int typeIndexSize(IntentType type) {
        lock.readLock().lock();
        try {
            Deque<TrackedIntent> entries = byType.get(type);
            return entries == null ? 0 : entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // caller holds the write lock
    private void evict(TrackedIntent oldest) {
        removeFromIndex(byType, oldest.intent().getType(), oldest);
        if (oldest.userId() != null) {
            removeFromIndex(byUser, oldest.userId(), oldest);
        }
    }

    private static <K> void removeFromIndex(Map<K, Deque<TrackedIntent>> index, K key, TrackedIntent entry) {
        Deque<TrackedIntent> entries = index.get(key);
        if (entries == null) {
            return;
        }
        if (entries.peekFirst() == entry) {
            entries.removeFirst();
        } else {
            entries.removeFirstOccurrence(entry);
        }
        if (entries.isEmpty()) {
            index.remove(key);
        }
    }

    private List<Intent> query(String userId, IntentType type, Instant since) {
        return getHistory(HistoryQuery.builder().userId(userId).type(type).since(since).build());
    }

    private static List<IntentCount> topIntents(List<Intent> intents, int n) {
        return countBy(intents, Intent::getType).entrySet().stream()
                .sorted(Map.Entry.<IntentType, Long>comparingByValue().reversed())
                .limit(Math.max(0, n))
                .map(e -> new IntentCount(e.getKey(), e.getValue()))
                .toList();
    }

    private static <K> Map<K, Long> countBy(List<Intent> intents, Function<Intent, K> key) {
        Map<K, Long> counts = new LinkedHashMap<>();
        for (Intent intent : intents) {
            counts.merge(key.apply(intent), 1L, Long::sum);
        }
        return counts;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
