/*
 * Copyright 2018-2020 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.volumerestrictions.framework;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-attempt key/value store shared by the extension points of all plugins. Plugins write
 * during PreFilter and read during Filter, which runs concurrently across nodes.
 */
public final class CycleState {
    private final Map<String, StateData> storage = new ConcurrentHashMap<>();
    private final Set<String> skipFilterPlugins = ConcurrentHashMap.newKeySet();

    public void write(final String key, final StateData data) {
        storage.put(key, data);
    }

    public StateData read(final String key) {
        final StateData data = storage.get(key);
        if (data == null) {
            throw new StateMissingException(String.format("cannot read \"%s\" from cycleState", key));
        }
        return data;
    }

    public <T extends StateData> T read(final String key, final Class<T> type) {
        final StateData data = read(key);
        if (!type.isInstance(data)) {
            throw new IllegalStateException(String.format("%s cannot be converted to %s", data,
                                                          type.getSimpleName()));
        }
        return type.cast(data);
    }

    public boolean contains(final String key) {
        return storage.containsKey(key);
    }

    public void delete(final String key) {
        storage.remove(key);
    }

    /**
     * Records that the named plugin returned {@link Status.Code#SKIP} from PreFilter.
     */
    public void skipFilter(final String pluginName) {
        skipFilterPlugins.add(pluginName);
    }

    public boolean isFilterSkipped(final String pluginName) {
        return skipFilterPlugins.contains(pluginName);
    }

    /**
     * Copies every entry through {@link StateData#copy()}, so that mutations on the copy are
     * not visible here.
     */
    public CycleState copy() {
        final CycleState copy = new CycleState();
        storage.forEach((key, data) -> copy.storage.put(key, data.copy()));
        copy.skipFilterPlugins.addAll(skipFilterPlugins);
        return copy;
    }
}
