package io.plinth.core.storage;

import io.plinth.core.exception.NotFoundException;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/// Fixed table of one reentrant lock per node instance id.
///
/// Built once when a store is constructed and never resized, because the instance set is
/// fixed for the store's lifetime. Lookups therefore need no synchronization of their own.
///
/// The locks are reentrant so a store's load path can take the lock again while its update
/// path already holds it on the same thread.
public final class InstanceLocks {

    private final Map<String, ReentrantLock> locks;

    /// Creates one lock per id.
    ///
    /// @param nodeInstanceIds the fixed instance set, not null
    public InstanceLocks(Collection<String> nodeInstanceIds) {
        Map<String, ReentrantLock> table = new TreeMap<>();
        for (String id : nodeInstanceIds) {
            table.put(id, new ReentrantLock());
        }
        this.locks = Collections.unmodifiableMap(table);
    }

    /// Returns the lock guarding an instance.
    ///
    /// @param nodeInstanceId the instance id, not null
    /// @return the lock, never null
    /// @throws NotFoundException if the id is not part of the instance set
    public ReentrantLock lockFor(String nodeInstanceId) {
        ReentrantLock lock = locks.get(nodeInstanceId);
        if (lock == null) {
            throw new NotFoundException("Node instance " + nodeInstanceId + " does not exist");
        }
        return lock;
    }

    /// Returns the guarded instance ids in ascending order.
    ///
    /// @return unmodifiable sorted set, never null
    public Set<String> ids() {
        return locks.keySet();
    }

    public boolean contains(String nodeInstanceId) {
        return locks.containsKey(nodeInstanceId);
    }
}
