package com.cellml.text.generator;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LatexIdentifierFormatter.
 */
class LatexIdentifierFormatterTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "V           | V",
            "alpha       | \\alpha",
            "Omega       | \\Omega",
            "alphabet    | alphabet",
            "V_m         | V_{m}",
            "i_Na_K      | i_{Na,K}",
            "tau_m_inf   | \\tau_{m}^{inf}",
            "a_b_c_d     | a_{b}^{c_{d}}",
            "a_b_c_d_e_f | a_{b,e,f}^{c_{d}}",
            "alpha_beta  | \\alpha_{\\beta}",
            "x__y        | x_{y}"
    })
    void testFormat(String name, String expected) {
        assertThat(LatexIdentifierFormatter.format(name)).isEqualTo(expected);
    }
}
