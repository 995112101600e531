package com.verilog.hierarchy.registry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verilog.hierarchy.model.ModuleConflict;
import com.verilog.hierarchy.model.ModuleSummary;
import com.verilog.hierarchy.model.VerilogModule;

/**
 * Owns every module discovered during a run, keyed by name.
 *
 * The first definition of a name wins; later definitions only leave a
 * {@link ModuleConflict} behind. The registry also carries the run-wide set of
 * `define names, since files ingested later see the defines of earlier files.
 *
 * Written by the ingesting thread only; read-only once ingestion is done.
 */
public class ModuleRegistry {
    private static final Logger log = LoggerFactory.getLogger(ModuleRegistry.class);

    private final Map<String, VerilogModule> modulesByName = new LinkedHashMap<>();
    private final List<ModuleConflict> conflicts = new ArrayList<>();
    private final Set<String> definedNames = new LinkedHashSet<>();

    public InsertOutcome insert(VerilogModule module) {
        Objects.requireNonNull(module, "module");

        if (modulesByName.containsKey(module.getName())) {
            log.warn("module named {} already defined", module.getName());
            conflicts.add(ModuleConflict.builder()
                    .moduleName(module.getName())
                    .location(module.getLocation())
                    .build());
            return InsertOutcome.CONFLICT_RECORDED;
        }

        modulesByName.put(module.getName(), module);
        return InsertOutcome.INSERTED;
    }

    public Optional<VerilogModule> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(modulesByName.get(name));
    }

    public Optional<ModuleSummary> describe(String name) {
        return lookup(name).map(ModuleSummary::from);
    }

    public boolean contains(String name) {
        return name != null && modulesByName.containsKey(name);
    }

    /**
     * All kept modules in registration order, as a read-only live view.
     */
    public Collection<VerilogModule> getModules() {
        return Collections.unmodifiableCollection(modulesByName.values());
    }

    public List<ModuleConflict> getConflicts() {
        return Collections.unmodifiableList(conflicts);
    }

    public int size() {
        return modulesByName.size();
    }

    public boolean isEmpty() {
        return modulesByName.isEmpty();
    }

    /**
     * Bulk load from a snapshot. Current modules and conflicts are discarded, not merged.
     */
    public void replaceAll(Collection<VerilogModule> modules) {
        Objects.requireNonNull(modules, "modules");
        modulesByName.clear();
        conflicts.clear();
        for (VerilogModule module : modules) {
            modulesByName.putIfAbsent(module.getName(), module);
        }
        log.debug("Registry replaced with {} modules", modulesByName.size());
    }

    /**
     * Drops modules, conflicts and defines.
     */
    public void clear() {
        modulesByName.clear();
        conflicts.clear();
        definedNames.clear();
    }

    public void define(String name) {
        definedNames.add(name);
    }

    public boolean isDefined(String name) {
        return definedNames.contains(name);
    }

    public Set<String> getDefinedNames() {
        return Collections.unmodifiableSet(definedNames);
    }
}
