package com.verilog.hierarchy.hierarchy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verilog.hierarchy.model.Instance;
import com.verilog.hierarchy.model.VerilogModule;
import com.verilog.hierarchy.registry.ModuleRegistry;

/**
 * Bottom-up search for every hierarchical path from a scope module down to the
 * instances accepted by a matcher.
 *
 * Starting at each matching instance, the search repeatedly looks for whoever
 * instantiates the enclosing module, prepending instance names as it climbs.
 * Nothing is memoized: a module instantiated from many places is revisited once
 * per occurrence. Cyclic instantiation recurses without bound unless the cycle
 * guard is on.
 */
public class ReversePathFinder {
    private static final Logger log = LoggerFactory.getLogger(ReversePathFinder.class);

    public static final String DEFAULT_SEPARATOR = ".";

    private final ModuleRegistry registry;
    private final String separator;
    private final boolean cycleGuard;

    public ReversePathFinder(ModuleRegistry registry) {
        this(registry, DEFAULT_SEPARATOR, false);
    }

    public ReversePathFinder(ModuleRegistry registry, String separator, boolean cycleGuard) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.separator = Objects.requireNonNull(separator, "separator");
        this.cycleGuard = cycleGuard;
    }

    /**
     * Streams each found path to {@code sink} as soon as it is found.
     *
     * @return number of paths emitted
     */
    public int find(SearchMethod method, String target, String scopeModule, Consumer<String> sink) {
        log.info("searching for all instances under {} where {} '{}'", scopeModule, method.getDescription(), target);
        return find(method.matcher(target), scopeModule, sink);
    }

    public int find(InstanceMatcher matcher, String scopeModule, Consumer<String> sink) {
        Objects.requireNonNull(matcher, "matcher");
        Objects.requireNonNull(scopeModule, "scopeModule");
        Objects.requireNonNull(sink, "sink");
        return search(matcher, scopeModule, "", new TraversalContext(cycleGuard), sink);
    }

    public List<String> findAll(SearchMethod method, String target, String scopeModule) {
        List<String> paths = new ArrayList<>();
        find(method, target, scopeModule, paths::add);
        return paths;
    }

    private int search(InstanceMatcher matcher, String scopeModule, String currentPath,
                       TraversalContext context, Consumer<String> sink) {
        int found = 0;
        for (VerilogModule module : registry.getModules()) {
            for (Instance instance : module.getInstances()) {
                if (!matcher.matches(instance)) {
                    continue;
                }
                String path = currentPath.isEmpty()
                        ? instance.getInstanceName()
                        : instance.getInstanceName() + separator + currentPath;

                if (module.getName().equals(scopeModule)) {
                    String result = module.getName() + separator + path;
                    log.info("Found path = {}", result);
                    sink.accept(result);
                    found++;
                }

                if (context.enter(module.getName())) {
                    found += search(SearchMethod.EXACT_TYPE.matcher(module.getName()), scopeModule, path, context, sink);
                    context.leave();
                } else {
                    log.debug("Not climbing into {} again, already on {}", module.getName(), context.path());
                }
            }
        }
        return found;
    }
}
