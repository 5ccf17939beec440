package com.cellml.text.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cellml.text.model.ApplyNode;
import com.cellml.text.model.BvarNode;
import com.cellml.text.model.CiNode;
import com.cellml.text.model.CnNode;
import com.cellml.text.model.ComponentNode;
import com.cellml.text.model.ConstantNode;
import com.cellml.text.model.MathElement;
import com.cellml.text.model.MathElementVisitor;
import com.cellml.text.model.MathNode;
import com.cellml.text.model.ModelNode;
import com.cellml.text.model.OtherwiseNode;
import com.cellml.text.model.PieceNode;
import com.cellml.text.model.PiecewiseNode;
import com.cellml.text.model.UnitNode;
import com.cellml.text.model.UnitsNode;
import com.cellml.text.model.UnsupportedNode;
import com.cellml.text.model.VariableNode;
import com.cellml.text.xml.CellmlXmlReader;
import com.cellml.text.xml.XmlReadException;

/**
 * Writes a CellML model back out as CellML Text.
 *
 * <p>Blocks are separated by one blank line. Binary arithmetic is fully
 * parenthesized so the output reparses to the same tree. Failures while reading
 * XML come back as a single {@code // Error generating text: ...} line.</p>
 */
public class CellmlTextGenerator {
    private static final Logger log = LoggerFactory.getLogger(CellmlTextGenerator.class);

    static final String ERROR_PREFIX = "// Error generating text: ";

    private final String standardIndent;
    private final CellmlXmlReader reader = new CellmlXmlReader();

    private StringBuilder output;
    private int indentLevel;

    public CellmlTextGenerator() {
        this(TextGeneratorOptions.defaults());
    }

    public CellmlTextGenerator(TextGeneratorOptions options) {
        this.standardIndent = (options != null ? options : TextGeneratorOptions.defaults()).getIndentUnit();
    }

    /**
     * Generate CellML Text from a CellML 2.0 XML document.
     */
    public String generate(String xml) {
        try {
            return generate(reader.read(xml));
        } catch (XmlReadException e) {
            log.warn("Cannot generate text: {}", e.getMessage());
            return ERROR_PREFIX + e.getMessage();
        }
    }

    public String generate(ModelNode model) {
        output = new StringBuilder();
        indentLevel = 0;

        append("def model " + nameOr(model.getName(), "unnamed_model") + " as");
        indentLevel++;

        model.getUnits().forEach(this::writeUnits);
        model.getComponents().forEach(this::writeComponent);

        // Exactly one newline after the last block
        trimTrailingWhitespace();
        output.append('\n');

        indentLevel--;
        append("enddef;");

        log.debug("Generated text for model '{}' ({} chars)", model.getName(), output.length());
        return output.toString();
    }

    private void writeUnits(UnitsNode units) {
        append("def unit " + nameOr(units.getName(), "unnamed_units") + " as");
        indentLevel++;

        for (UnitNode unit : units.getUnits()) {
            StringBuilder line = new StringBuilder("unit ").append(unit.getUnits());
            if (hasText(unit.getPrefix())) {
                line.append(" {prefix: ").append(unit.getPrefix()).append('}');
            }
            if (hasText(unit.getExponent())) {
                line.append(" {exponent: ").append(unit.getExponent()).append('}');
            }
            if (hasText(unit.getMultiplier())) {
                line.append(" {multiplier: ").append(unit.getMultiplier()).append('}');
            }
            append(line.append(';').toString());
        }

        indentLevel--;
        append("enddef;");
        append("");
    }

    private void writeComponent(ComponentNode component) {
        append("def comp " + nameOr(component.getName(), "unnamed_component") + " as");
        indentLevel++;

        component.getVariables().forEach(this::writeVariable);
        component.getMaths().forEach(this::writeMath);

        indentLevel--;
        append("enddef;");
        append("");
    }

    private void writeVariable(VariableNode variable) {
        List<String> properties = new ArrayList<>();
        if (hasText(variable.getInitialValue())) {
            properties.add("init: " + variable.getInitialValue());
        }
        if (hasText(variable.getInterfaceType())) {
            properties.add("interface: " + variable.getInterfaceType());
        }

        StringBuilder line = new StringBuilder("var ")
                .append(variable.getName())
                .append(": ")
                .append(variable.getUnits());
        if (!properties.isEmpty()) {
            line.append(" {").append(String.join(", ", properties)).append('}');
        }
        append(line.append(';').toString());
    }

    private void writeMath(MathNode math) {
        ExpressionWriter writer = new ExpressionWriter();

        for (MathElement child : math.getChildren()) {
            // A top-level eq is an assignment, whatever the shape of its sides
            if (child instanceof ApplyNode apply && apply.isOperator(ApplyNode.EQ)) {
                List<MathElement> sides = apply.getArguments();
                String lhs = writer.write(sides.size() > 0 ? sides.get(0) : null);
                String rhs = writer.write(sides.size() > 1 ? sides.get(1) : null);
                append(lhs + " = " + rhs + ";");
            } else {
                String expression = writer.write(child);
                if (!expression.isEmpty()) {
                    append(expression + ";");
                }
            }
        }
    }

    private String indent() {
        return standardIndent.repeat(indentLevel);
    }

    private void append(String line) {
        if (!line.isEmpty()) {
            output.append(indent()).append(line);
        }
        output.append('\n');
    }

    private void trimTrailingWhitespace() {
        int end = output.length();
        while (end > 0 && Character.isWhitespace(output.charAt(end - 1))) {
            end--;
        }
        output.setLength(end);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }

    private static String nameOr(String name, String fallback) {
        return hasText(name) ? name : fallback;
    }

    /**
     * Renders one MathML expression as CellML Text.
     */
    private class ExpressionWriter implements MathElementVisitor<String> {

        String write(MathElement element) {
            return element == null ? "" : element.accept(this);
        }

        @Override
        public String visit(ApplyNode apply) {
            String op = apply.getOperator();
            if (op == null) {
                return "";
            }
            if (apply.isOperator(ApplyNode.DIFF)) {
                return writeDerivative(apply);
            }

            List<String> args = apply.getArguments().stream().map(this::write).toList();
            String first = args.isEmpty() ? "" : args.get(0);
            String second = args.size() > 1 ? args.get(1) : "";

            return switch (op) {
                case "plus" -> "(" + String.join(" + ", args) + ")";
                case "minus" -> args.size() == 1 ? "-" + first : "(" + first + " - " + second + ")";
                case "times" -> "(" + String.join(" * ", args) + ")";
                case "divide" -> "(" + first + " / " + second + ")";
                case "eq" -> first + " == " + second;
                case "neq" -> first + " != " + second;
                case "lt" -> first + " < " + second;
                case "leq" -> first + " <= " + second;
                case "gt" -> first + " > " + second;
                case "geq" -> first + " >= " + second;
                case "and" -> String.join(" and ", args);
                case "or" -> String.join(" or ", args);
                case "sin", "cos", "tan", "exp", "ln", "log" -> op + "(" + first + ")";
                case "root" -> "sqrt(" + first + ")";
                default -> {
                    log.warn("No CellML Text form for operator '{}', writing it as a function call", op);
                    yield op + "(" + String.join(", ", args) + ")";
                }
            };
        }

        // diff(bvar(t), V) -> ode(V, t)
        private String writeDerivative(ApplyNode apply) {
            Optional<BvarNode> bvar = apply.findBvar();
            String independent = bvar.map(b -> write(b.getVariable())).filter(s -> !s.isEmpty()).orElse("t");
            List<MathElement> operands = apply.getOperands();
            String dependent = operands.isEmpty() ? "unknown" : write(operands.get(0));
            return "ode(" + dependent + ", " + independent + ")";
        }

        @Override
        public String visit(CiNode ci) {
            return ci.getName() == null ? "" : ci.getName().trim();
        }

        @Override
        public String visit(CnNode cn) {
            String value = hasText(cn.getValue()) ? cn.getLiteral() : "0";
            return hasText(cn.getUnits()) ? value + " {units: " + cn.getUnits() + "}" : value;
        }

        @Override
        public String visit(PiecewiseNode piecewise) {
            List<String> lines = new ArrayList<>();
            for (PieceNode piece : piecewise.getPieces()) {
                lines.add(standardIndent + "case " + write(piece.getCondition()) + ": " + write(piece.getValue()) + ";");
            }
            if (piecewise.getOtherwise() != null) {
                lines.add(standardIndent + "otherwise: " + write(piecewise.getOtherwise().getValue()) + ";");
            }

            String indent = indent();
            return "sel\n"
                    + lines.stream().map(line -> indent + line + "\n").collect(Collectors.joining())
                    + indent + "endsel";
        }

        @Override
        public String visit(PieceNode piece) {
            return unsupported(piece.getTagName());
        }

        @Override
        public String visit(OtherwiseNode otherwise) {
            return unsupported(otherwise.getTagName());
        }

        @Override
        public String visit(BvarNode bvar) {
            // Only meaningful inside diff
            return "";
        }

        @Override
        public String visit(ConstantNode constant) {
            return constant.getName();
        }

        @Override
        public String visit(UnsupportedNode unsupported) {
            return unsupported(unsupported.getTag());
        }

        private String unsupported(String tag) {
            log.warn("Unsupported MathML node: {}", tag);
            return "/* Unsupported MathML node: " + tag + " */";
        }
    }
}
