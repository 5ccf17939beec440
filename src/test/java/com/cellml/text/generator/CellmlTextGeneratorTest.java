package com.cellml.text.generator;

import com.cellml.text.model.ApplyNode;
import com.cellml.text.model.CiNode;
import com.cellml.text.model.ComponentNode;
import com.cellml.text.model.ModelNode;
import com.cellml.text.model.VariableNode;
import com.cellml.text.parser.CellmlParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CellmlTextGenerator.
 */
class CellmlTextGeneratorTest {

    private static final String MATHML = "xmlns=\"http://www.w3.org/1998/Math/MathML\" "
            + "xmlns:cellml=\"http://www.cellml.org/cellml/2.0#\"";

    private final CellmlTextGenerator generator = new CellmlTextGenerator();

    @Test
    void testGenerateFromXml() {
        String xml = """
            <model name="hh" xmlns="http://www.cellml.org/cellml/2.0#">
              <units name="millivolt"><unit units="volt" prefix="milli"/></units>
              <component name="membrane">
                <variable name="V" units="millivolt" initial_value="-65" interface="public"/>
                <variable name="t" units="ms"/>
                <math %s>
                  <apply><eq/>
                    <apply><diff/><bvar><ci>t</ci></bvar><ci>V</ci></apply>
                    <apply><plus/><ci>a</ci><apply><times/><ci>b</ci><ci>c</ci></apply></apply>
                  </apply>
                </math>
              </component>
            </model>
            """.formatted(MATHML);

        assertThat(generator.generate(xml)).isEqualTo("""
            def model hh as
              def unit millivolt as
                unit volt {prefix: milli};
              enddef;

              def comp membrane as
                var V: millivolt {init: -65, interface: public};
                var t: ms;
                ode(V, t) = (a + (b * c));
              enddef;
            enddef;
            """);
    }

    @Test
    void testOperatorSpellings() {
        String text = equationsOf("""
            <apply><eq/><ci>a</ci><apply><minus/><ci>b</ci></apply></apply>
            <apply><eq/><ci>a</ci><apply><minus/><ci>b</ci><ci>c</ci></apply></apply>
            <apply><eq/><ci>a</ci><apply><divide/><ci>b</ci><cn>2</cn></apply></apply>
            <apply><eq/><ci>a</ci><apply><root/><ci>b</ci></apply></apply>
            <apply><eq/><ci>a</ci><apply><ln/><ci>b</ci></apply></apply>
            <apply><eq/><ci>a</ci><apply><max/><ci>b</ci><ci>c</ci></apply></apply>
            <apply><eq/><ci>a</ci><pi/></apply>
            """);

        assertThat(text).contains(
                "a = -b;",
                "a = (b - c);",
                "a = (b / 2);",
                "a = sqrt(b);",
                "a = ln(b);",
                "a = max(b, c);",
                "a = pi;");
    }

    @Test
    void testNumbersWithUnitsAndENotation() {
        String text = equationsOf("""
            <apply><eq/><ci>a</ci><cn cellml:units="mV">5</cn></apply>
            <apply><eq/><ci>a</ci><cn type="e-notation" cellml:units="per_ms">1.5<sep/>-3</cn></apply>
            """);

        assertThat(text).contains("a = 5 {units: mV};", "a = 1.5e-3 {units: per_ms};");
    }

    @Test
    void testPiecewiseIndentation() {
        String text = equationsOf("""
            <apply><eq/><ci>x</ci>
              <piecewise>
                <piece><cn>1</cn><apply><and/>
                  <apply><gt/><ci>a</ci><cn>0</cn></apply>
                  <apply><neq/><ci>b</ci><cn>1</cn></apply>
                </apply></piece>
                <otherwise><cn>2</cn></otherwise>
              </piecewise>
            </apply>
            """);

        assertThat(text).contains("""
                x = sel
                  case a > 0 and b != 1: 1;
                  otherwise: 2;
                endsel;
            """);
    }

    @Test
    void testNakedExpressionAndUnsupportedNode() {
        String text = equationsOf("""
            <apply><lt/><ci>a</ci><ci>b</ci></apply>
            <csymbol>x</csymbol>
            """);

        assertThat(text).contains("    a < b;\n", "    /* Unsupported MathML node: csymbol */;\n");
    }

    @Test
    void testEmptyModel() {
        assertThat(generator.generate(new ModelNode("m"))).isEqualTo("def model m as\nenddef;\n");
    }

    @Test
    void testUnnamedModelFallback() {
        assertThat(generator.generate(new ModelNode())).startsWith("def model unnamed_model as\n");
    }

    @Test
    void testTabSize() {
        ModelNode model = new ModelNode("m");
        ComponentNode component = new ComponentNode("c");
        component.addVariable(VariableNode.builder().name("x").units("u").build());
        component.getOrCreateMath().addChild(ApplyNode.of("eq", new CiNode("x"), new CiNode("y")));
        model.addComponent(component);

        CellmlTextGenerator wide = new CellmlTextGenerator(TextGeneratorOptions.builder().tabSize(4).build());

        assertThat(wide.generate(model)).isEqualTo("""
            def model m as
                def comp c as
                    var x: u;
                    x = y;
                enddef;
            enddef;
            """);
    }

    @Test
    void testMalformedXmlYieldsErrorComment() {
        assertThat(generator.generate("<model"))
                .startsWith("// Error generating text: XML Parsing Error");
    }

    @Test
    void testMissingModelYieldsErrorComment() {
        assertThat(generator.generate("<model xmlns=\"http://www.cellml.org/cellml/1.1#\"/>"))
                .isEqualTo("// Error generating text: No CellML 2.0 Model found");
    }

    @Test
    void testReproducesParsedText() {
        String text = """
            def model m as
              def comp c as
                var x: dimensionless {init: 0};
                x = sel
                  case (a + 1) >= 2: -a;
                  otherwise: (a * (b / c));
                endsel;
              enddef;
            enddef;
            """;

        ModelNode model = new CellmlParser().parse(text).getModel();

        assertThat(generator.generate(model)).isEqualTo(text);
    }

    private String equationsOf(String mathContent) {
        String xml = "<model name=\"m\" xmlns=\"http://www.cellml.org/cellml/2.0#\">"
                + "<component name=\"c\"><math " + MATHML + ">" + mathContent + "</math></component></model>";
        return generator.generate(xml);
    }
}
