package com.verilog.hierarchy.parser;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ModuleBoundaryTracker.
 */
class ModuleBoundaryTrackerTest {

    @Test
    void testCollectsModuleLines() {
        ModuleBoundaryTracker tracker = new ModuleBoundaryTracker("rtl/leaf.v");

        assertThat(tracker.accept("// header text", 1)).isEmpty();
        assertThat(tracker.accept("module leaf(input a, output b);", 2)).isEmpty();
        assertThat(tracker.isInModule()).isTrue();
        assertThat(tracker.accept("  assign b = a;", 3)).isEmpty();
        Optional<ModuleSource> done = tracker.accept("endmodule", 4);

        assertThat(done).isPresent();
        ModuleSource source = done.get();
        assertThat(source.getName()).isEqualTo("leaf");
        assertThat(source.getLines()).containsExactly(
                "module leaf(input a, output b);", "  assign b = a;", "endmodule");
        assertThat(source.getLocation().getFilePath()).isEqualTo("rtl/leaf.v");
        assertThat(source.getLocation().getLine()).isEqualTo(2);
        assertThat(source.getLocation().getColumn()).isEqualTo(12);
        assertThat(tracker.isInModule()).isFalse();

        tracker.finish(4);
    }

    @Test
    void testModuleNameTerminators() {
        assertThat(ModuleBoundaryTracker.extractModuleName("module top(a, b);")).isEqualTo("top");
        assertThat(ModuleBoundaryTracker.extractModuleName("module top;")).isEqualTo("top");
        assertThat(ModuleBoundaryTracker.extractModuleName("module\tcore #(parameter W = 4)")).isEqualTo("core");
        assertThat(ModuleBoundaryTracker.extractModuleName("  module   spaced (")).isEqualTo("spaced");
    }

    @Test
    void testHeaderRecognition() {
        assertThat(ModuleBoundaryTracker.isModuleHeader("module a;")).isTrue();
        assertThat(ModuleBoundaryTracker.isModuleHeader("\tmodule\tb(")).isTrue();
        assertThat(ModuleBoundaryTracker.isModuleHeader("extern module c;")).isTrue();
        assertThat(ModuleBoundaryTracker.isModuleHeader("modules are great")).isFalse();
        assertThat(ModuleBoundaryTracker.isModuleHeader("submodule x;")).isFalse();
    }

    @Test
    void testModuleInMiddleOfLine() {
        ModuleBoundaryTracker tracker = new ModuleBoundaryTracker("x.v");

        tracker.accept("extern module ext_core(input clk);", 1);
        ModuleSource source = tracker.accept("endmodule", 2).orElseThrow();

        assertThat(source.getName()).isEqualTo("ext_core");
        assertThat(source.getLocation().getColumn()).isEqualTo(23);
    }

    @Test
    void testSecondHeaderRenamesOpenModule() {
        ModuleBoundaryTracker tracker = new ModuleBoundaryTracker("x.v");

        tracker.accept("module first;", 1);
        tracker.accept("module second;", 2);
        ModuleSource source = tracker.accept("endmodule", 3).orElseThrow();

        assertThat(source.getName()).isEqualTo("second");
        assertThat(source.getLocation().getLine()).isEqualTo(2);
        assertThat(source.getLines()).hasSize(3);
    }

    @Test
    void testEndmoduleOutsideModuleIsFatal() {
        ModuleBoundaryTracker tracker = new ModuleBoundaryTracker("bad.v");

        assertThatThrownBy(() -> tracker.accept("endmodule", 7))
                .isInstanceOf(VerilogParseException.class)
                .hasMessageContaining("bad.v:7");
    }

    @Test
    void testSingleLineModuleIsFatal() {
        ModuleBoundaryTracker tracker = new ModuleBoundaryTracker("one.v");

        assertThatThrownBy(() -> tracker.accept("module a; endmodule", 1))
                .isInstanceOf(VerilogParseException.class);
    }

    @Test
    void testUnterminatedModuleIsFatal() {
        ModuleBoundaryTracker tracker = new ModuleBoundaryTracker("open.v");
        tracker.accept("module dangling(input a);", 1);

        assertThatThrownBy(() -> tracker.finish(1))
                .hasMessageContaining("dangling")
                .isInstanceOfSatisfying(VerilogParseException.class,
                        e -> assertThat(e.getFilePath()).isEqualTo("open.v"));
    }
}
