package com.verilog.hierarchy.parser;

import com.verilog.hierarchy.registry.ModuleRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LinePreprocessor.
 */
class LinePreprocessorTest {

    @Test
    void testCommentsRemovedBeforeDirectivesAreRead() {
        ModuleRegistry registry = new ModuleRegistry();
        LinePreprocessor preprocessor = new LinePreprocessor(registry);

        assertThat(preprocessor.process("// `define COMMENTED")).isEmpty();
        assertThat(preprocessor.process("`define REAL // trailing note")).isEmpty();

        assertThat(registry.isDefined("COMMENTED")).isFalse();
        assertThat(registry.isDefined("REAL")).isTrue();
    }

    @Test
    void testBlockCommentHidesDirectives() {
        LinePreprocessor preprocessor = new LinePreprocessor(new ModuleRegistry());

        preprocessor.process("/*");
        assertThat(preprocessor.isInsideBlockComment()).isTrue();
        assertThat(preprocessor.process("`ifdef NEVER")).isEmpty();
        assertThat(preprocessor.process("*/ wire a;")).isEqualTo(" wire a;");

        assertThat(preprocessor.isInsideBlockComment()).isFalse();
        assertThat(preprocessor.getConditionalState().hasPending()).isFalse();
    }

    @Test
    void testStatePersistsAcrossLines() {
        LinePreprocessor preprocessor = new LinePreprocessor(new ModuleRegistry());

        preprocessor.process("`ifdef MISSING");
        assertThat(preprocessor.process("hidden")).isEmpty();
        preprocessor.process("`endif");

        assertThat(preprocessor.process("shown")).isEqualTo("shown");
        assertThat(preprocessor.getConditionalState().depth()).isZero();
    }
}
