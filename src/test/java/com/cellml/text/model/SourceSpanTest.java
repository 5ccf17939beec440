package com.cellml.text.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SourceSpan and the equation lookup built on it.
 */
class SourceSpanTest {

    @ParameterizedTest
    @CsvSource({
            "3, 3, 3",
            "3, 5, 3-5",
            "7, 2, 7"
    })
    void testToString(int start, int end, String expected) {
        assertThat(SourceSpan.of(start, end).toString()).isEqualTo(expected);
    }

    @Test
    void testParse() {
        assertThat(SourceSpan.parse("4-6")).isEqualTo(SourceSpan.of(4, 6));
        assertThat(SourceSpan.parse("9")).isEqualTo(SourceSpan.of(9, 9));
        assertThat(SourceSpan.parse("x-1")).isNull();
        assertThat(SourceSpan.parse(null)).isNull();
    }

    @Test
    void testContains() {
        SourceSpan span = SourceSpan.of(4, 6);

        assertThat(span.contains(4)).isTrue();
        assertThat(span.contains(6)).isTrue();
        assertThat(span.contains(7)).isFalse();
    }

    @Test
    void testFindEquationAtLine() {
        ApplyNode first = ApplyNode.of(ApplyNode.EQ, new CiNode("x"), CnNode.of("1"));
        first.setAnnotation("loc", "2-3");
        ApplyNode second = ApplyNode.of(ApplyNode.EQ, new CiNode("y"), CnNode.of("2"));
        second.setAnnotation("loc", "5");

        ComponentNode component = new ComponentNode("c");
        component.getOrCreateMath().addChild(first);
        component.getOrCreateMath().addChild(second);
        ModelNode model = new ModelNode("m");
        model.addComponent(component);

        assertThat(model.findEquationAtLine("loc", 3)).containsSame(first);
        assertThat(model.findEquationAtLine("loc", 5)).containsSame(second);
        assertThat(model.findEquationAtLine("loc", 4)).isEmpty();
        assertThat(model.findEquationAtLine("other", 2)).isEmpty();
    }
}
