package com.cellml.text.integration;

import com.cellml.text.generator.CellmlTextGenerator;
import com.cellml.text.generator.LatexGenerator;
import com.cellml.text.model.ApplyNode;
import com.cellml.text.model.ModelNode;
import com.cellml.text.model.PiecewiseNode;
import com.cellml.text.parser.CellmlParser;
import com.cellml.text.parser.ParseResult;
import com.cellml.text.xml.CellmlXmlReader;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end conversions: text to XML, XML back to text, and XML to LaTeX.
 */
class RoundTripIntegrationTest {

    private static final String HODGKIN_HUXLEY = """
        def model hodgkin_huxley as
          def unit millivolt as
            unit volt {prefix: milli};
          enddef;

          def unit per_millisecond as
            unit second {prefix: milli} {exponent: -1};
          enddef;

          def comp membrane as
            var V: millivolt {init: -75, interface: public};
            var t: millisecond {interface: public};
            var Cm: microF_per_cm2 {init: 1};
            ode(V, t) = (-(i_Na + (i_K + i_L)) / Cm);
          enddef;

          def comp sodium_channel_m_gate as
            var alpha_m: per_millisecond;
            alpha_m = ((0.1 {units: per_mV_ms} * (V + 50 {units: millivolt})) / (1 - exp((-(V + 50 {units: millivolt}) / 10 {units: millivolt}))));
            i_stim = sel
              case t >= 10 {units: millisecond} and t <= 10.5 {units: millisecond}: -20 {units: microA_per_cm2};
              otherwise: 0 {units: microA_per_cm2};
            endsel;
          enddef;
        enddef;
        """;

    private final CellmlParser parser = new CellmlParser();
    private final CellmlXmlReader reader = new CellmlXmlReader();
    private final CellmlTextGenerator textGenerator = new CellmlTextGenerator();

    @Test
    void testTextSurvivesXmlRoundTrip() {
        ParseResult result = parser.parse(HODGKIN_HUXLEY);
        assertThat(result.getErrors()).isEmpty();

        String regenerated = textGenerator.generate(result.getXml());

        assertThat(regenerated).isEqualTo(HODGKIN_HUXLEY);
    }

    @Test
    void testXmlReaderRebuildsParsedTree() {
        ParseResult result = parser.parse(HODGKIN_HUXLEY);

        ModelNode reread = reader.read(result.getXml());

        assertThat(reread).isEqualTo(result.getModel());
    }

    @Test
    void testPiecewiseSurvivesRegeneration() {
        ModelNode first = parser.parse(HODGKIN_HUXLEY).getModel();
        ModelNode second = parser.parse(textGenerator.generate(first)).getModel();

        PiecewiseNode before = piecewiseOf(first);
        PiecewiseNode after = piecewiseOf(second);
        assertThat(after.getPieces()).hasSameSizeAs(before.getPieces());
        assertThat(after).isEqualTo(before);
    }

    @Test
    void testDerivativeToLatex() {
        String xml = parser.parse(HODGKIN_HUXLEY).getXml();
        ModelNode model = reader.read(xml);

        ApplyNode ode = (ApplyNode) model.getAllEquations().get(0);
        LatexGenerator latex = new LatexGenerator();

        assertThat(textGenerator.generate(xml)).contains("ode(V, t) = ");
        assertThat(latex.convert(ode.getArguments().get(0))).isEqualTo("\\frac{dV}{dt}");
        assertThat(latex.convert(ode))
                .isEqualTo("\\frac{dV}{dt} = \\frac{-\\left(i_{Na} + i_{K} + i_{L}\\right)}{Cm}");
    }

    private static PiecewiseNode piecewiseOf(ModelNode model) {
        ApplyNode stimulus = (ApplyNode) model.getAllEquations().get(2);
        return (PiecewiseNode) stimulus.getArguments().get(1);
    }
}
