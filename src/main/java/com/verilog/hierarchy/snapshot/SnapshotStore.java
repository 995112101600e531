package com.verilog.hierarchy.snapshot;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.verilog.hierarchy.model.VerilogModule;

/**
 * Persists the whole module set so later runs can skip re-parsing sources.
 * All or nothing: there is no per-module access.
 */
public interface SnapshotStore {

    void save(Collection<VerilogModule> modules);

    /**
     * @return the saved modules, or empty when no snapshot exists
     */
    Optional<List<VerilogModule>> load();

    /**
     * @return true when a snapshot existed and was removed
     */
    boolean delete();

    boolean exists();
}
