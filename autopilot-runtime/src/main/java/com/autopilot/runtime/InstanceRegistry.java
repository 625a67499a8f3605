package com.autopilot.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Running trading instances by id. Shared between the control service and the watchdog.
 */
public class InstanceRegistry {

    private static final Logger log = LoggerFactory.getLogger(InstanceRegistry.class);

    private final ConcurrentHashMap<String, TradingInstance> instances = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException when an instance with the same id is already registered
     */
    public TradingInstance register(TradingInstance instance) {
        TradingInstance existing = instances.putIfAbsent(instance.getId(), instance);
        if (existing != null) {
            throw new IllegalArgumentException("Instance already exists: " + instance.getId());
        }
        log.info("Registered instance {}", instance.getId());
        return instance;
    }

    public Optional<TradingInstance> get(String id) {
        return Optional.ofNullable(id != null ? instances.get(id) : null);
    }

    public TradingInstance require(String id) {
        return get(id).orElseThrow(() -> new IllegalArgumentException("Unknown instance: " + id));
    }

    public boolean contains(String id) {
        return instances.containsKey(id);
    }

    public Optional<TradingInstance> remove(String id) {
        TradingInstance removed = instances.remove(id);
        if (removed != null) {
            log.info("Removed instance {}", id);
        }
        return Optional.ofNullable(removed);
    }

    /**
     * All instances ordered by id.
     */
    public List<TradingInstance> all() {
        List<TradingInstance> list = new ArrayList<>(instances.values());
        list.sort(Comparator.comparing(TradingInstance::getId));
        return list;
    }

    public Set<String> ids() {
        return new TreeSet<>(instances.keySet());
    }

    public int size() {
        return instances.size();
    }

}
