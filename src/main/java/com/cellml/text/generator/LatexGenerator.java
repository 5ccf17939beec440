package com.cellml.text.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
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
import com.cellml.text.model.MathNode;
import com.cellml.text.model.ModelNode;
import com.cellml.text.model.PieceNode;
import com.cellml.text.model.PiecewiseNode;

/**
 * Renders MathML content as LaTeX.
 *
 * <p>Each subtree is rendered against the precedence its parent requires and is
 * wrapped in {@code \left( \right)} when it binds more loosely. Constructs that
 * delimit their arguments themselves ({@code \frac}, {@code \sqrt}, function
 * parentheses) reset the required precedence to zero.</p>
 *
 * <p>A top-level {@code eq} is an assignment and renders as {@code lhs = rhs}; nested
 * equality tests render as {@code ==}. Malformed input yields {@code \text{Error: ...}}
 * instead of an exception.</p>
 */
public class LatexGenerator {
    private static final Logger log = LoggerFactory.getLogger(LatexGenerator.class);

    private static final Set<String> NAMED_FUNCTIONS = Set.of(
            "sin", "cos", "tan", "sec", "csc", "cot",
            "sinh", "cosh", "tanh", "arcsin", "arccos", "arctan",
            "ln", "log");

    static boolean isNamedFunction(String operator) {
        return NAMED_FUNCTIONS.contains(operator);
    }

    /**
     * Render every top-level child of a {@code math} block, one per line.
     */
    public String convert(MathNode math) {
        if (math == null) {
            return error("no math element");
        }
        return math.getChildren().stream()
                .map(this::convert)
                .collect(Collectors.joining("\n"));
    }

    /**
     * Render one expression or equation.
     */
    public String convert(MathElement element) {
        try {
            if (element == null) {
                throw new LatexConversionException("no MathML element");
            }
            if (element instanceof ApplyNode apply && apply.isEquation()) {
                return render(apply.getArguments().get(0), 0) + " = " + render(apply.getArguments().get(1), 0);
            }
            return render(element, 0);
        } catch (LatexConversionException e) {
            log.warn("LaTeX conversion failed: {}", e.getMessage());
            return error(e.getMessage());
        }
    }

    /**
     * Render the equations of every component of a model.
     */
    public List<ComponentEquations> convertAll(ModelNode model) {
        List<ComponentEquations> result = new ArrayList<>();
        for (ComponentNode component : model.getComponents()) {
            List<String> equations = new ArrayList<>();
            for (MathNode math : component.getMaths()) {
                math.getChildren().forEach(child -> equations.add(convert(child)));
            }
            result.add(new ComponentEquations(component.getName(), equations));
        }
        log.debug("Converted {} components of model '{}' to LaTeX", result.size(), model.getName());
        return result;
    }

    private String render(MathElement node, int contextPrecedence) {
        if (node == null) {
            throw new LatexConversionException("missing operand");
        }

        int precedence = MathPrecedence.ATOMIC;
        String latex;

        if (node instanceof ApplyNode apply) {
            precedence = MathPrecedence.of(apply.getOperator());
            latex = renderApply(apply);
        } else if (node instanceof CiNode ci) {
            latex = LatexIdentifierFormatter.format(ci.getName() == null ? "" : ci.getName().trim());
        } else if (node instanceof CnNode cn) {
            latex = renderNumber(cn);
        } else if (node instanceof PiecewiseNode piecewise) {
            latex = renderPiecewise(piecewise);
        } else if (node instanceof ConstantNode constant) {
            latex = renderConstant(constant.getName());
        } else if (node instanceof BvarNode bvar) {
            latex = render(bvar.getVariable(), contextPrecedence);
        } else {
            log.warn("Unsupported MathML node <{}> in LaTeX output", node.getTagName());
            latex = "\\text{" + node.getTagName() + "}";
        }

        if (precedence < contextPrecedence) {
            return "\\left(" + latex + "\\right)";
        }
        return latex;
    }

    private String renderApply(ApplyNode apply) {
        String op = apply.getOperator();
        if (op == null || op.isEmpty()) {
            throw new LatexConversionException("apply without operator");
        }

        int precedence = MathPrecedence.of(op);
        List<MathElement> args = apply.getOperands();

        switch (op) {
            case "plus":
                requireOperands(op, args, 1);
                return join(args, precedence, " + ");
            case "minus":
                requireOperands(op, args, 1);
                if (args.size() == 1) {
                    return "-" + render(args.get(0), precedence + 1);
                }
                // Right side binds tighter so a - (b - c) keeps its parentheses
                return render(args.get(0), precedence) + " - " + render(args.get(1), precedence + 1);
            case "times":
                requireOperands(op, args, 1);
                return join(args, precedence, " \\cdot ");
            case "divide":
                requireOperands(op, args, 2);
                return "\\frac{" + render(args.get(0), 0) + "}{" + render(args.get(1), 0) + "}";
            case "eq":
                return relation(op, args, "==");
            case "neq":
                return relation(op, args, "\\neq");
            case "lt":
                return relation(op, args, "<");
            case "leq":
                return relation(op, args, "\\leq");
            case "gt":
                return relation(op, args, ">");
            case "geq":
                return relation(op, args, "\\geq");
            case "and":
                requireOperands(op, args, 1);
                return join(args, precedence, " \\land ");
            case "or":
                requireOperands(op, args, 1);
                return join(args, precedence, " \\lor ");
            case "power":
                requireOperands(op, args, 2);
                return renderPower(args.get(0), args.get(1));
            case "root":
            case "sqrt":
                requireOperands(op, args, 1);
                return "\\sqrt{" + render(args.get(args.size() - 1), 0) + "}";
            case "diff":
                return renderDerivative(apply);
            case "exp":
                requireOperands(op, args, 1);
                return "e^{" + render(args.get(0), 0) + "}";
            case "abs":
                requireOperands(op, args, 1);
                return "\\left|" + render(args.get(0), 0) + "\\right|";
            case "floor":
                requireOperands(op, args, 1);
                return "\\lfloor " + render(args.get(0), 0) + " \\rfloor";
            case "ceiling":
            case "ceil":
                requireOperands(op, args, 1);
                return "\\lceil " + render(args.get(0), 0) + " \\rceil";
            default:
                break;
        }

        if (isNamedFunction(op)) {
            requireOperands(op, args, 1);
            return "\\" + op + "\\left(" + render(args.get(0), 0) + "\\right)";
        }

        log.warn("No LaTeX form for operator '{}', rendering it as text", op);
        return "\\text{" + op + "}(" + args.stream().map(arg -> render(arg, 0)).collect(Collectors.joining(", ")) + ")";
    }

    private String relation(String op, List<MathElement> args, String symbol) {
        requireOperands(op, args, 2);
        int precedence = MathPrecedence.RELATIONAL;
        return render(args.get(0), precedence) + " " + symbol + " " + render(args.get(1), precedence);
    }

    private String join(List<MathElement> args, int precedence, String separator) {
        return args.stream()
                .map(arg -> render(arg, precedence))
                .collect(Collectors.joining(separator));
    }

    private String renderPower(MathElement base, MathElement exponent) {
        String renderedBase = render(base, 0);
        boolean atomic = base instanceof CiNode || (base instanceof CnNode cn && !cn.isNegative() && !cn.isENotation());
        if (!atomic) {
            renderedBase = "\\left(" + renderedBase + "\\right)";
        }
        return "{" + renderedBase + "}^{" + render(exponent, 0) + "}";
    }

    // diff(bvar(t), V) -> \frac{dV}{dt}
    private String renderDerivative(ApplyNode apply) {
        Optional<BvarNode> bvar = apply.findBvar();
        String independent = bvar.isPresent() ? render(bvar.get().getVariable(), 0) : "x";
        List<MathElement> operands = apply.getOperands();
        String dependent = operands.isEmpty() ? "y" : render(operands.get(0), 0);
        return "\\frac{d" + dependent + "}{d" + independent + "}";
    }

    private String renderNumber(CnNode cn) {
        String value = cn.getValue() == null || cn.getValue().isBlank() ? "0" : cn.getValue().trim();
        if (cn.isENotation()) {
            return value + " \\times 10^{" + cn.getExponent().trim() + "}";
        }
        return value;
    }

    private String renderPiecewise(PiecewiseNode piecewise) {
        List<String> rows = new ArrayList<>();
        for (PieceNode piece : piecewise.getPieces()) {
            rows.add(render(piece.getValue(), 0) + " & \\text{if } " + render(piece.getCondition(), 0));
        }
        if (piecewise.getOtherwise() != null) {
            rows.add(render(piecewise.getOtherwise().getValue(), 0) + " & \\text{otherwise}");
        }
        return "\\begin{cases} " + String.join(" \\\\ ", rows) + " \\end{cases}";
    }

    private static String renderConstant(String name) {
        return switch (name) {
            case "pi" -> "\\pi";
            case "exponentiale" -> "e";
            case "infinity" -> "\\infty";
            case "notanumber" -> "\\text{NaN}";
            default -> "\\text{" + name + "}";
        };
    }

    private static void requireOperands(String op, List<MathElement> args, int minimum) {
        if (args.size() < minimum) {
            throw new LatexConversionException(
                    "operator '" + op + "' needs " + minimum + " operand(s), found " + args.size());
        }
    }

    private static String error(String message) {
        return "\\text{Error: " + message + "}";
    }

    /**
     * Raised for a malformed tree; never escapes {@link LatexGenerator}.
     */
    private static class LatexConversionException extends RuntimeException {
        LatexConversionException(String message) {
            super(message);
        }
    }
}
