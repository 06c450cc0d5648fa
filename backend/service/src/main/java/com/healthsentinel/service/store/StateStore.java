package com.healthsentinel.service.store;

import com.healthsentinel.service.runtime.StateTracker;

import java.util.Optional;

public interface StateStore {
    Optional<StateTracker.Snapshot> load();

    void save(StateTracker.Snapshot snapshot);
}
