package com.verilog.hierarchy.parser;

import com.verilog.hierarchy.model.Instance;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for InstanceExtractor.
 */
class InstanceExtractorTest {

    private final InstanceExtractor extractor = new InstanceExtractor();

    @Test
    void testSimpleInstantiation() {
        List<Instance> instances = extractor.extract("top",
                "module top(input a); my_adder u_add (.a(a),.b(b)); endmodule ");

        assertThat(instances).containsExactly(Instance.of("my_adder", "u_add"));
    }

    @Test
    void testIfStatementIsNotAnInstance() {
        List<Instance> instances = extractor.extract("top",
                "module top; always begin if (cond) begin x = 1; end end endmodule ");

        assertThat(instances).isEmpty();
    }

    @Test
    void testInstancesKeepSourceOrderAndDuplicates() {
        List<Instance> instances = extractor.extract("top",
                "module top; fifo u0 (.a(a)); adder u1 (.b(b)); fifo u0 (.c(c)); endmodule ");

        assertThat(instances).containsExactly(
                Instance.of("fifo", "u0"),
                Instance.of("adder", "u1"),
                Instance.of("fifo", "u0"));
    }

    @Test
    void testReservedPrefixesStripped() {
        List<Instance> instances = extractor.extract("top",
                "module top; generate begin sub u_sub (.a(a)); end endgenerate endmodule ");

        assertThat(instances).containsExactly(Instance.of("sub", "u_sub"));
    }

    @Test
    void testAssignAndWireStatementsSkipped() {
        List<Instance> instances = extractor.extract("top",
                "module top;wire w = f(x);assign y = g(w); leaf u0 (.a(y)); endmodule ");

        assertThat(instances).containsExactly(Instance.of("leaf", "u0"));
    }

    @Test
    void testTwoTokenTaskCallAccepted() {
        List<Instance> instances = extractor.extract("top", "module top; my_task arg (x); endmodule ");

        assertThat(instances).containsExactly(Instance.of("my_task", "arg"));
    }

    @Test
    void testMissingTrailingSemicolonStillTerminates() {
        List<Instance> instances = extractor.extract("m", "module m; leaf u1 (a)");

        assertThat(instances).containsExactly(Instance.of("leaf", "u1"));
    }

    @Test
    void testOwnHeaderIsNotAnInstance() {
        List<Instance> instances = extractor.extract("top", "module top (input a); endmodule ");

        assertThat(instances).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"if", "else", "begin", "end", "case", "endcase", "generate", "endgenerate",
            "initial", "wire", "logic", "parameter", "localparam", "assign", "always", "always_ff", "for"})
    void testReservedWordNeverInstanceName(String word) {
        assertThat(extractor.recognize("my_type " + word)).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"a.b u0", "bus[0] u0", "x = y", "q <= d", "$display u0", "lbl: u0", "only_one"})
    void testForbiddenCandidatesRejected(String candidate) {
        assertThat(extractor.recognize(candidate)).isEmpty();
    }

    @Test
    void testRecognizeTrimsSurroundingSpaces() {
        assertThat(extractor.recognize("  leaf u0 ")).contains(Instance.of("leaf", "u0"));
    }

    @Test
    void testStripReservedPrefixesRepeats() {
        assertThat(InstanceExtractor.stripReservedPrefixes("end else begin sub u0 ")).isEqualTo("sub u0 ");
    }
}
