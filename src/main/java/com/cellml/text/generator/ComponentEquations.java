package com.cellml.text.generator;

import java.util.List;

import lombok.Value;

/**
 * LaTeX renderings of one component's equations, in document order.
 */
@Value
public class ComponentEquations {
    String name;
    List<String> equations;

    public boolean isEmpty() {
        return equations.isEmpty();
    }
}
