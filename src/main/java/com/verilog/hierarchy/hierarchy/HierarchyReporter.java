package com.verilog.hierarchy.hierarchy;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verilog.hierarchy.model.Instance;
import com.verilog.hierarchy.model.VerilogModule;
import com.verilog.hierarchy.registry.ModuleRegistry;

/**
 * Top-down, pre-order walk of the instance tree below a root module.
 *
 * Types that were never defined are reported as leaves. Without the cycle
 * guard a module that (indirectly) instantiates itself recurses until the depth
 * limit, or forever when no limit is set.
 */
public class HierarchyReporter {
    private static final Logger log = LoggerFactory.getLogger(HierarchyReporter.class);

    private final ModuleRegistry registry;

    public HierarchyReporter(ModuleRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public HierarchyReport report(HierarchyRequest request) {
        return report(request, HierarchySink.NONE);
    }

    public HierarchyReport report(HierarchyRequest request, HierarchySink sink) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(sink, "sink");

        String root = request.getRootModule();
        Walk walk = new Walk(request, sink);
        if (request.isReportUnused()) {
            walk.usedModules.add(root);
        }

        log.info("reporting hierarchy below module {}...", root);
        sink.onRoot(root, request.getMaxDepth());

        TraversalContext context = new TraversalContext(request.isCycleGuard());
        context.enter(root);
        walk.visit(root, 0, context);
        context.leave();

        List<VerilogModule> unusedModules = new ArrayList<>();
        List<String> unusedFiles = new ArrayList<>();
        if (request.isReportUnused()) {
            collectUnused(walk, unusedModules, unusedFiles);
        }

        log.info("end of hierarchy report");
        return HierarchyReport.builder()
                .rootModule(root)
                .maxDepth(request.getMaxDepth())
                .entries(List.copyOf(walk.entries))
                .usedModules(walk.usedModules)
                .usedFiles(walk.usedFiles)
                .unusedModules(unusedModules)
                .unusedFiles(unusedFiles)
                .unusedRequested(request.isReportUnused())
                .build();
    }

    private void collectUnused(Walk walk, List<VerilogModule> unusedModules, List<String> unusedFiles) {
        for (VerilogModule module : registry.getModules()) {
            if (!walk.usedModules.contains(module.getName())) {
                unusedModules.add(module);
                log.info("module type {} was unused ({})", module.getName(), module.getLocation());
            }
        }
        for (VerilogModule module : unusedModules) {
            String file = module.getLocation().getFilePath();
            if (!walk.usedFiles.contains(file) && !unusedFiles.contains(file)) {
                unusedFiles.add(file);
            }
        }
    }

    /**
     * Accumulators of a single traversal.
     */
    private final class Walk {
        private final HierarchyRequest request;
        private final HierarchySink sink;
        private final List<HierarchyEntry> entries = new ArrayList<>();
        private final Set<String> usedModules = new LinkedHashSet<>();
        private final Set<String> usedFiles = new LinkedHashSet<>();

        private Walk(HierarchyRequest request, HierarchySink sink) {
            this.request = request;
            this.sink = sink;
        }

        private void visit(String moduleName, int level, TraversalContext context) {
            Optional<VerilogModule> found = registry.lookup(moduleName);
            if (found.isEmpty()) {
                return;
            }
            VerilogModule module = found.get();
            usedFiles.add(module.getLocation().getFilePath());

            for (Instance instance : module.getInstances()) {
                HierarchyEntry entry = new HierarchyEntry(level + 1, instance.getInstanceName(), instance.getTypeName());
                entries.add(entry);
                sink.onInstance(entry);
                usedModules.add(instance.getTypeName());

                if (!withinDepth(level)) {
                    continue;
                }
                if (context.enter(instance.getTypeName())) {
                    visit(instance.getTypeName(), level + 1, context);
                    context.leave();
                } else {
                    log.warn("instance {} of {} closes a cycle through {}, not expanding it",
                            instance.getInstanceName(), instance.getTypeName(), context.path());
                }
            }
        }

        private boolean withinDepth(int level) {
            int maxDepth = request.getMaxDepth();
            return maxDepth == 0 || level < maxDepth - 1;
        }
    }
}
