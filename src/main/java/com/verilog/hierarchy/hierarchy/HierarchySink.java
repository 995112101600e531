package com.verilog.hierarchy.hierarchy;

/**
 * Receives the hierarchy tree while it is being walked.
 */
public interface HierarchySink {

    HierarchySink NONE = new HierarchySink() {
        @Override
        public void onRoot(String rootModule, int maxDepth) {
        }

        @Override
        public void onInstance(HierarchyEntry entry) {
        }
    };

    void onRoot(String rootModule, int maxDepth);

    void onInstance(HierarchyEntry entry);
}
