package com.zzf.pdfsandbox.bus;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process publish/subscribe for artifact notifications. Subscribers registered under {@code "*"}
 * receive every event. A failing subscriber is logged and does not stop delivery to the others.
 */
@Slf4j
public class ArtifactEventBus {
    public static final String ARTIFACT_UPDATED = "artifact-updated";
    public static final String ARTIFACT_FAILED = "artifact-failed";
    public static final String ALL = "*";

    private final Map<String, List<Subscription>> subscriptions = new ConcurrentHashMap<>();

    @Data
    @AllArgsConstructor
    public static class EventInstance {
        private String type;
        private Object properties;
    }

    public interface Subscription extends Consumer<EventInstance> {}

    public int publish(String type, Object properties) {
        EventInstance event = new EventInstance(type, properties);
        int delivered = 0;
        for (String key : Arrays.asList(type, ALL)) {
            List<Subscription> subs = subscriptions.getOrDefault(key, Collections.emptyList());
            for (Subscription sub : new ArrayList<>(subs)) {
                try {
                    sub.accept(event);
                    delivered++;
                } catch (RuntimeException e) {
                    log.warn("bus.deliver.fail type={} err={}", type, e.toString());
                }
            }
        }
        return delivered;
    }

    /**
     * @return a handle that removes the subscription
     */
    public Runnable subscribe(String type, Subscription callback) {
        subscriptions.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>()).add(callback);
        return () -> unsubscribe(type, callback);
    }

    public Runnable subscribeAll(Subscription callback) {
        return subscribe(ALL, callback);
    }

    private void unsubscribe(String type, Subscription callback) {
        List<Subscription> subs = subscriptions.get(type);
        if (subs != null) {
            subs.remove(callback);
        }
    }
}
