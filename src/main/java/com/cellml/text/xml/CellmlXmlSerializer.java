package com.cellml.text.xml;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.cellml.text.model.ApplyNode;
import com.cellml.text.model.BvarNode;
import com.cellml.text.model.CellmlNode;
import com.cellml.text.model.CellmlNodeVisitor;
import com.cellml.text.model.CiNode;
import com.cellml.text.model.CnNode;
import com.cellml.text.model.ComponentNode;
import com.cellml.text.model.ConstantNode;
import com.cellml.text.model.MathElement;
import com.cellml.text.model.MathNode;
import com.cellml.text.model.ModelNode;
import com.cellml.text.model.OtherwiseNode;
import com.cellml.text.model.PieceNode;
import com.cellml.text.model.PiecewiseNode;
import com.cellml.text.model.UnitNode;
import com.cellml.text.model.UnitsNode;
import com.cellml.text.model.UnsupportedNode;
import com.cellml.text.model.VariableNode;

/**
 * Renders a model tree as indented XML text.
 *
 * Two spaces per nesting level. Empty elements are self-closing and text-only
 * elements stay on one line. {@code xmlns} is injected on {@code model} and
 * {@code math}. Apply annotations, the source-line span included, are never written.
 */
public class CellmlXmlSerializer implements CellmlNodeVisitor<Void> {
    public static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

    private static final String INDENT = "  ";

    private final StringBuilder out = new StringBuilder();
    private int depth = 0;

    /**
     * Serialize a tree as a complete document, XML declaration first.
     */
    public String serialize(CellmlNode root) {
        return XML_DECLARATION + "\n" + serializeFragment(root);
    }

    /**
     * Serialize a tree without the XML declaration.
     */
    public String serializeFragment(CellmlNode root) {
        out.setLength(0);
        depth = 0;
        root.accept(this);
        if (out.length() > 0 && out.charAt(out.length() - 1) == '\n') {
            out.setLength(out.length() - 1);
        }
        return out.toString();
    }

    @Override
    public Void visit(ModelNode model) {
        Map<String, String> attributes = attributes("name", model.getName());
        attributes.put("xmlns", CellmlNamespaces.CELLML_2_0);

        if (model.getUnits().isEmpty() && model.getComponents().isEmpty()) {
            emptyElement(model.getTagName(), attributes);
            return null;
        }
        startElement(model.getTagName(), attributes);
        model.getUnits().forEach(units -> units.accept(this));
        model.getComponents().forEach(component -> component.accept(this));
        endElement(model.getTagName());
        return null;
    }

    @Override
    public Void visit(UnitsNode units) {
        container(units.getTagName(), attributes("name", units.getName()), units.getUnits());
        return null;
    }

    @Override
    public Void visit(UnitNode unit) {
        Map<String, String> attributes = attributes("units", unit.getUnits());
        putIfPresent(attributes, "prefix", unit.getPrefix());
        putIfPresent(attributes, "exponent", unit.getExponent());
        putIfPresent(attributes, "multiplier", unit.getMultiplier());
        emptyElement(unit.getTagName(), attributes);
        return null;
    }

    @Override
    public Void visit(ComponentNode component) {
        Map<String, String> attributes = attributes("name", component.getName());
        if (component.getVariables().isEmpty() && component.getMaths().isEmpty()) {
            emptyElement(component.getTagName(), attributes);
            return null;
        }
        startElement(component.getTagName(), attributes);
        component.getVariables().forEach(variable -> variable.accept(this));
        component.getMaths().forEach(math -> math.accept(this));
        endElement(component.getTagName());
        return null;
    }

    @Override
    public Void visit(VariableNode variable) {
        Map<String, String> attributes = attributes("name", variable.getName());
        putIfPresent(attributes, "units", variable.getUnits());
        putIfPresent(attributes, "initial_value", variable.getInitialValue());
        putIfPresent(attributes, "interface", variable.getInterfaceType());
        emptyElement(variable.getTagName(), attributes);
        return null;
    }

    @Override
    public Void visit(MathNode math) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("xmlns", CellmlNamespaces.MATHML);
        attributes.put("xmlns:" + CellmlNamespaces.CELLML_PREFIX, CellmlNamespaces.CELLML_2_0);
        container(math.getTagName(), attributes, math.getChildren());
        return null;
    }

    @Override
    public Void visit(ApplyNode apply) {
        startElement(apply.getTagName(), Map.of());
        emptyElement(apply.getOperator(), Map.of());
        apply.getArguments().forEach(this::childOf);
        endElement(apply.getTagName());
        return null;
    }

    @Override
    public Void visit(CiNode ci) {
        textElement(ci.getTagName(), Map.of(), ci.getName());
        return null;
    }

    @Override
    public Void visit(CnNode cn) {
        Map<String, String> attributes = new LinkedHashMap<>();
        if (cn.isENotation()) {
            attributes.put("type", CnNode.E_NOTATION);
        }
        putIfPresent(attributes, CellmlNamespaces.CELLML_PREFIX + ":units", cn.getUnits());

        if (cn.isENotation()) {
            line("<" + cn.getTagName() + renderAttributes(attributes) + ">"
                    + escape(cn.getValue()) + "<sep/>" + escape(cn.getExponent())
                    + "</" + cn.getTagName() + ">");
        } else {
            textElement(cn.getTagName(), attributes, cn.getValue());
        }
        return null;
    }

    @Override
    public Void visit(PiecewiseNode piecewise) {
        if (piecewise.getPieces().isEmpty() && piecewise.getOtherwise() == null) {
            emptyElement(piecewise.getTagName(), Map.of());
            return null;
        }
        startElement(piecewise.getTagName(), Map.of());
        piecewise.getPieces().forEach(this::childOf);
        if (piecewise.getOtherwise() != null) {
            childOf(piecewise.getOtherwise());
        }
        endElement(piecewise.getTagName());
        return null;
    }

    @Override
    public Void visit(PieceNode piece) {
        startElement(piece.getTagName(), Map.of());
        childOf(piece.getValue());
        childOf(piece.getCondition());
        endElement(piece.getTagName());
        return null;
    }

    @Override
    public Void visit(OtherwiseNode otherwise) {
        startElement(otherwise.getTagName(), Map.of());
        childOf(otherwise.getValue());
        endElement(otherwise.getTagName());
        return null;
    }

    @Override
    public Void visit(BvarNode bvar) {
        startElement(bvar.getTagName(), Map.of());
        childOf(bvar.getVariable());
        endElement(bvar.getTagName());
        return null;
    }

    @Override
    public Void visit(ConstantNode constant) {
        emptyElement(constant.getTagName(), Map.of());
        return null;
    }

    @Override
    public Void visit(UnsupportedNode unsupported) {
        emptyElement(unsupported.getTagName(), Map.of());
        return null;
    }

    private void container(String tag, Map<String, String> attributes, List<? extends CellmlNode> children) {
        if (children.isEmpty()) {
            emptyElement(tag, attributes);
            return;
        }
        startElement(tag, attributes);
        children.forEach(child -> child.accept(this));
        endElement(tag);
    }

    private void childOf(MathElement child) {
        if (child != null) {
            child.accept(this);
        }
    }

    private void startElement(String tag, Map<String, String> attributes) {
        line("<" + tag + renderAttributes(attributes) + ">");
        depth++;
    }

    private void endElement(String tag) {
        depth--;
        line("</" + tag + ">");
    }

    private void emptyElement(String tag, Map<String, String> attributes) {
        line("<" + tag + renderAttributes(attributes) + "/>");
    }

    private void textElement(String tag, Map<String, String> attributes, String text) {
        String content = text == null ? "" : text.trim();
        if (content.isEmpty()) {
            emptyElement(tag, attributes);
            return;
        }
        line("<" + tag + renderAttributes(attributes) + ">" + escape(content) + "</" + tag + ">");
    }

    private void line(String content) {
        out.append(INDENT.repeat(depth)).append(content).append('\n');
    }

    private static Map<String, String> attributes(String name, String value) {
        Map<String, String> attributes = new LinkedHashMap<>();
        putIfPresent(attributes, name, value);
        return attributes;
    }

    private static void putIfPresent(Map<String, String> attributes, String name, String value) {
        if (value != null) {
            attributes.put(name, value);
        }
    }

    private static String renderAttributes(Map<String, String> attributes) {
        StringBuilder sb = new StringBuilder();
        attributes.forEach((name, value) ->
                sb.append(' ').append(name).append("=\"").append(escape(value)).append('"'));
        return sb.toString();
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
