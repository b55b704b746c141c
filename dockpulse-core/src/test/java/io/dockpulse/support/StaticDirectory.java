package io.dockpulse.support;

import io.dockpulse.core.BatchConfig;
import io.dockpulse.spi.BatchConfigSource;
import io.dockpulse.spi.UserDirectory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Users and their batch configs held in memory.
 */
public class StaticDirectory implements UserDirectory, BatchConfigSource {

    private final List<String> users = new CopyOnWriteArrayList<>();
    private final Map<String, Map<String, BatchConfig>> configs = new ConcurrentHashMap<>();

    public StaticDirectory addUser(String userId) {
        users.add(userId);
        return this;
    }

    public StaticDirectory config(String userId, String jobType, BatchConfig config) {
        configs.computeIfAbsent(userId, u -> new ConcurrentHashMap<>()).put(jobType, config);
        return this;
    }

    @Override
    public List<String> findAllUserIds() {
        return new ArrayList<>(users);
    }

    @Override
    public Map<String, BatchConfig> findConfigs(String userId) {
        return new HashMap<>(configs.getOrDefault(userId, Map.of()));
    }
}
