package com.cellml.text.report;

import com.cellml.text.generator.ComponentEquations;
import com.cellml.text.model.ModelNode;
import com.cellml.text.parser.CellmlParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LatexDocumentRenderer.
 */
class LatexDocumentRendererTest {

    private final LatexDocumentRenderer renderer = new LatexDocumentRenderer();

    @Test
    void testRenderDocument() {
        String document = renderer.render("hh_model", List.of(
                new ComponentEquations("membrane", List.of("x = 1", "y = \\alpha")),
                new ComponentEquations("gate", List.of())));

        assertThat(document)
                .startsWith("\\documentclass{article}")
                .contains("\\title{hh\\_model}")
                .contains("\\section*{membrane}")
                .contains("\\begin{equation*}\nx = 1\n\\end{equation*}")
                .contains("\\begin{equation*}\ny = \\alpha\n\\end{equation*}")
                .contains("\\section*{gate}\nNo equations.")
                .endsWith("\\end{document}\n");
    }

    @Test
    void testRenderModel() {
        ModelNode model = new CellmlParser().parse("""
            def model cell as
              def comp membrane_1 as
                ode(V, t) = I_stim;
              enddef;
            enddef;
            """).getModel();

        String document = renderer.render(model);

        assertThat(document)
                .contains("\\title{cell}")
                .contains("\\section*{membrane\\_1}")
                .contains("\\frac{dV}{dt} = I_{stim}");
    }

    @Test
    void testEscapeText() {
        assertThat(LatexDocumentRenderer.escapeText("a_b & 50% #1 {x}"))
                .isEqualTo("a\\_b \\& 50\\% \\#1 \\{x\\}");
    }
}
