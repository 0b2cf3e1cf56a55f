package com.example.admission.domain.abuse.detector;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.Value;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 키별 최근 이벤트 슬라이딩 윈도우
 *
 * 키는 마지막 접근 후 ttl이 지나면 사라지고, 키당 이벤트 수는 maxEvents로 제한된다.
 */
final class RecentEvents<V> {

    private final Cache<String, Deque<Event<V>>> events;
    private final long windowMillis;
    private final int maxEvents;

    RecentEvents(Duration ttl, long maxKeys, long windowMillis, int maxEvents) {
        this.events = Caffeine.newBuilder()
                .expireAfterAccess(ttl)
                .maximumSize(maxKeys)
                .build();
        this.windowMillis = windowMillis;
        this.maxEvents = maxEvents;
    }

    /**
     * 이벤트를 기록하고 윈도우 안의 이벤트를 오래된 순으로 돌려준다.
     */
    List<Event<V>> append(String key, long nowMillis, V value) {
        Deque<Event<V>> deque = events.get(key, k -> new ArrayDeque<>());
        synchronized (deque) {
            deque.addLast(new Event<>(nowMillis, value));
            while (deque.size() > maxEvents) {
                deque.removeFirst();
            }
            prune(deque, nowMillis);
            return new ArrayList<>(deque);
        }
    }

    List<Event<V>> recent(String key, long nowMillis) {
        Deque<Event<V>> deque = events.getIfPresent(key);
        if (deque == null) {
            return List.of();
        }
        synchronized (deque) {
            prune(deque, nowMillis);
            return new ArrayList<>(deque);
        }
    }

    private void prune(Deque<Event<V>> deque, long nowMillis) {
        long cutoff = nowMillis - windowMillis;
        while (!deque.isEmpty() && deque.peekFirst().getAt() <= cutoff) {
            deque.removeFirst();
        }
    }

    static <V> Set<V> distinctValues(List<Event<V>> events) {
        Set<V> values = new HashSet<>();
        for (Event<V> event : events) {
            if (event.getValue() != null) {
                values.add(event.getValue());
            }
        }
        return values;
    }

    /**
     * 이벤트 간격의 변동계수. 간격이 2개 미만이면 NaN.
     */
    static double intervalVariation(List<? extends Event<?>> events) {
        if (events.size() < 3) {
            return Double.NaN;
        }
        double[] intervals = new double[events.size() - 1];
        double sum = 0;
        for (int i = 1; i < events.size(); i++) {
            intervals[i - 1] = events.get(i).getAt() - events.get(i - 1).getAt();
            sum += intervals[i - 1];
        }
        double mean = sum / intervals.length;
        if (mean <= 0) {
            return 0;
        }
        double variance = 0;
        for (double interval : intervals) {
            variance += (interval - mean) * (interval - mean);
        }
        return Math.sqrt(variance / intervals.length) / mean;
    }

    @Value
    static class Event<V> {
        long at;
        V value;
    }
}
