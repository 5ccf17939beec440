package com.cellml.text.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cellml.text.model.ApplyNode;
import com.cellml.text.model.BvarNode;
import com.cellml.text.model.CiNode;
import com.cellml.text.model.CnNode;
import com.cellml.text.model.ComponentNode;
import com.cellml.text.model.MathElement;
import com.cellml.text.model.ModelNode;
import com.cellml.text.model.OtherwiseNode;
import com.cellml.text.model.PieceNode;
import com.cellml.text.model.PiecewiseNode;
import com.cellml.text.model.SourceSpan;
import com.cellml.text.model.UnitNode;
import com.cellml.text.model.UnitsNode;
import com.cellml.text.model.VariableNode;
import com.cellml.text.parser.CellmlToken.TokenType;
import com.cellml.text.xml.CellmlXmlSerializer;

/**
 * Recursive-descent parser for CellML Text.
 * Builds a CellML model tree with embedded MathML and serializes it to XML.
 *
 * Parsing is fail-fast: the first grammar violation ends the parse and is reported
 * as the single {@link ParserError} of the result. Scanner and parser state is
 * rebuilt on every {@link #parse(String)} call.
 */
public class CellmlParser {
    private static final Logger log = LoggerFactory.getLogger(CellmlParser.class);

    private static final String ODE = "ode";

    private final ParserOptions options;
    private CellmlScanner scanner;

    public CellmlParser() {
        this(ParserOptions.defaults());
    }

    public CellmlParser(ParserOptions options) {
        this.options = options != null ? options : ParserOptions.defaults();
    }

    public ParseResult parse(String text) {
        scanner = new CellmlScanner(text);

        try {
            ModelNode model = parseModel();
            String xml = new CellmlXmlSerializer().serialize(model);
            return ParseResult.success(xml, model, scanner.getDiagnostics());
        } catch (CellmlSyntaxException e) {
            log.debug("Parse failed at line {}: {}", e.getLine(), e.getMessage());
            return ParseResult.failure(new ParserError(e.getLine(), e.getMessage()), scanner.getDiagnostics());
        }
    }

    // Model := 'def' 'model' Identifier? 'as' Block* 'enddef' ';'
    private ModelNode parseModel() {
        expect(TokenType.KW_DEF);
        expect(TokenType.KW_MODEL);

        ModelNode model = new ModelNode();
        if (check(TokenType.IDENTIFIER)) {
            model.setName(advance().getValue());
        }

        expect(TokenType.KW_AS);

        while (check(TokenType.KW_DEF)) {
            parseBlock(model);
        }

        expect(TokenType.KW_ENDDEF);
        expect(TokenType.SEMICOLON);
        expect(TokenType.EOF);

        log.debug("Parsed model '{}' with {} components", model.getName(), model.getComponents().size());
        return model;
    }

    private void parseBlock(ModelNode model) {
        expect(TokenType.KW_DEF);

        if (check(TokenType.KW_COMP)) {
            model.addComponent(parseComponent());
        } else if (check(TokenType.KW_UNIT)) {
            model.addUnits(parseUnits());
        } else {
            throw error("Expected 'comp' or 'unit' after 'def' but found " + describe(scanner.getToken()));
        }
    }

    private ComponentNode parseComponent() {
        expect(TokenType.KW_COMP);
        ComponentNode component = new ComponentNode(expectValue(TokenType.IDENTIFIER));
        expect(TokenType.KW_AS);

        while (!check(TokenType.KW_ENDDEF)) {
            if (check(TokenType.KW_VAR)) {
                component.addVariable(parseVariable());
            } else if (scanner.getToken().startsFactor()) {
                parseMathStatement(component);
            } else {
                throw error("Expected variable or math statement but found " + describe(scanner.getToken()));
            }
        }

        expect(TokenType.KW_ENDDEF);
        expect(TokenType.SEMICOLON);

        log.debug("Parsed component '{}': {} variables", component.getName(), component.getVariables().size());
        return component;
    }

    // var V: millivolt {init: -65, interface: public};
    private VariableNode parseVariable() {
        int line = scanner.getToken().getLine();
        expect(TokenType.KW_VAR);
        VariableNode variable = new VariableNode();
        variable.setName(expectValue(TokenType.IDENTIFIER));
        expect(TokenType.COLON);
        variable.setUnits(expectValue(TokenType.IDENTIFIER));

        if (check(TokenType.LBRACE)) {
            advance();
            while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
                String property = expectValue(TokenType.IDENTIFIER);
                expect(TokenType.COLON);
                String value = parsePropertyValue();

                switch (property) {
                    case "init" -> variable.setInitialValue(value);
                    case "interface" -> variable.setInterfaceType(value);
                    default -> log.debug("Dropping unrecognized variable property '{}' at line {}", property, line);
                }

                if (check(TokenType.COMMA)) {
                    advance();
                }
            }
            expect(TokenType.RBRACE);
        }

        expect(TokenType.SEMICOLON);
        log.debug("Parsed variable: {} at line {}", variable.getName(), line);
        return variable;
    }

    // def unit millivolt as unit volt {prefix: milli}; enddef;
    private UnitsNode parseUnits() {
        expect(TokenType.KW_UNIT);
        UnitsNode units = new UnitsNode(expectValue(TokenType.IDENTIFIER));
        expect(TokenType.KW_AS);

        while (check(TokenType.KW_UNIT)) {
            units.addUnit(parseUnitFactor());
        }

        expect(TokenType.KW_ENDDEF);
        expect(TokenType.SEMICOLON);

        log.debug("Parsed unit definition '{}' with {} factors", units.getName(), units.getUnits().size());
        return units;
    }

    private UnitNode parseUnitFactor() {
        expect(TokenType.KW_UNIT);
        UnitNode unit = new UnitNode();
        unit.setUnits(expectValue(TokenType.IDENTIFIER));

        // Either {prefix: milli} {exponent: 2} or {prefix: milli, exponent: 2}
        while (check(TokenType.LBRACE)) {
            advance();
            while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
                int line = scanner.getToken().getLine();
                String modifier = expectValue(TokenType.IDENTIFIER);
                expect(TokenType.COLON);
                String value = parsePropertyValue();

                switch (modifier) {
                    case "prefix" -> unit.setPrefix(value);
                    case "exponent", "expo" -> unit.setExponent(value);
                    case "multiplier", "mult" -> unit.setMultiplier(value);
                    default -> log.debug("Dropping unrecognized unit modifier '{}' at line {}", modifier, line);
                }

                if (check(TokenType.COMMA)) {
                    advance();
                }
            }
            expect(TokenType.RBRACE);
        }

        expect(TokenType.SEMICOLON);
        return unit;
    }

    // Value := '-'? Number | Identifier
    private String parsePropertyValue() {
        if (check(TokenType.OP_MINUS)) {
            advance();
            return "-" + expectValue(TokenType.NUMBER);
        }
        if (check(TokenType.NUMBER)) {
            return advance().getValue();
        }
        return expectValue(TokenType.IDENTIFIER);
    }

    // MathStatement := Expression '=' Expression ';'
    private void parseMathStatement(ComponentNode component) {
        int startLine = scanner.getToken().getLine();

        MathElement lhs = parseExpression();
        expect(TokenType.OP_ASSIGN);
        MathElement rhs = parseExpression();

        int endLine = scanner.getToken().getLine();

        ApplyNode equation = ApplyNode.of(ApplyNode.EQ, lhs, rhs);
        if (options.isSourceTrackingEnabled()) {
            equation.setAnnotation(options.getSourceLineAttribute(), SourceSpan.of(startLine, endLine).toString());
        }

        expect(TokenType.SEMICOLON);
        component.getOrCreateMath().addChild(equation);
        log.debug("Parsed equation in '{}' at lines {}-{}", component.getName(), startLine, endLine);
    }

    // Condition := Comparison (('and'|'or') Comparison)*
    private MathElement parseCondition() {
        MathElement left = parseComparison();

        while (check(TokenType.OP_AND) || check(TokenType.OP_OR)) {
            String operator = advance().is(TokenType.OP_AND) ? "and" : "or";
            MathElement right = parseComparison();
            left = ApplyNode.of(operator, left, right);
        }
        return left;
    }

    // Comparison := Expression (CompOp Expression)?
    private MathElement parseComparison() {
        MathElement left = parseExpression();

        if (!scanner.getToken().isComparison()) {
            return left;
        }

        String operator = switch (advance().getType()) {
            case OP_EQ -> "eq";
            case OP_NE -> "neq";
            case OP_LT -> "lt";
            case OP_LE -> "leq";
            case OP_GT -> "gt";
            case OP_GE -> "geq";
            default -> throw new IllegalStateException("Not a comparison operator");
        };

        MathElement right = parseExpression();
        return ApplyNode.of(operator, left, right);
    }

    // Expression := Term (('+'|'-') Term)*
    private MathElement parseExpression() {
        MathElement left = parseTerm();

        while (check(TokenType.OP_PLUS) || check(TokenType.OP_MINUS)) {
            String operator = advance().is(TokenType.OP_PLUS) ? "plus" : "minus";
            MathElement right = parseTerm();
            left = ApplyNode.of(operator, left, right);
        }
        return left;
    }

    // Term := Factor (('*'|'/') Factor)*
    private MathElement parseTerm() {
        MathElement left = parseFactor();

        while (check(TokenType.OP_TIMES) || check(TokenType.OP_DIVIDE)) {
            String operator = advance().is(TokenType.OP_TIMES) ? "times" : "divide";
            MathElement right = parseFactor();
            left = ApplyNode.of(operator, left, right);
        }
        return left;
    }

    private MathElement parseFactor() {
        if (check(TokenType.OP_MINUS)) {
            advance();
            // Right-recursive, so "- -5" nests two unary minus applies
            return ApplyNode.of("minus", parseFactor());
        }

        if (check(TokenType.NUMBER)) {
            return parseNumber();
        }

        if (check(TokenType.IDENTIFIER)) {
            String name = advance().getValue();
            if (check(TokenType.LPAREN)) {
                return parseFunctionCall(name);
            }
            return new CiNode(name);
        }

        if (check(TokenType.LPAREN)) {
            advance();
            MathElement inner = parseExpression();
            expect(TokenType.RPAREN);
            return inner;
        }

        if (check(TokenType.KW_SEL)) {
            return parsePiecewise();
        }

        throw error("Unexpected token in math: " + describe(scanner.getToken()));
    }

    // Number ('{' 'units' ':' Identifier ... '}')?
    private CnNode parseNumber() {
        CnNode cn = CnNode.of(advance().getValue());

        if (check(TokenType.LBRACE)) {
            advance();
            if (check(TokenType.IDENTIFIER) && "units".equals(scanner.getValue())) {
                advance();
                expect(TokenType.COLON);
                cn.setUnits(expectValue(TokenType.IDENTIFIER));
            }
            // Anything else inside the braces is not interpreted
            while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
                advance();
            }
            expect(TokenType.RBRACE);
        }
        return cn;
    }

    // sel (case Condition ':' Expression ';')* (otherwise ':' Expression ';')? endsel
    private PiecewiseNode parsePiecewise() {
        expect(TokenType.KW_SEL);
        PiecewiseNode piecewise = new PiecewiseNode();

        while (check(TokenType.KW_CASE)) {
            advance();
            MathElement condition = parseCondition();
            expect(TokenType.COLON);
            MathElement value = parseExpression();
            expect(TokenType.SEMICOLON);
            piecewise.addPiece(new PieceNode(value, condition));
        }

        if (check(TokenType.KW_OTHERWISE)) {
            advance();
            expect(TokenType.COLON);
            MathElement value = parseExpression();
            expect(TokenType.SEMICOLON);
            piecewise.setOtherwise(new OtherwiseNode(value));
        }

        expect(TokenType.KW_ENDSEL);
        return piecewise;
    }

    private ApplyNode parseFunctionCall(String name) {
        expect(TokenType.LPAREN);

        // ode(dependent, independent) is the MathML derivative form
        if (ODE.equals(name)) {
            MathElement dependent = parseExpression();
            expect(TokenType.COMMA);
            MathElement independent = parseExpression();
            expect(TokenType.RPAREN);
            return ApplyNode.of(ApplyNode.DIFF, new BvarNode(independent), dependent);
        }

        ApplyNode call = new ApplyNode(name);
        if (!check(TokenType.RPAREN)) {
            call.addArgument(parseExpression());
            while (check(TokenType.COMMA)) {
                advance();
                call.addArgument(parseExpression());
            }
        }
        expect(TokenType.RPAREN);
        return call;
    }

    private boolean check(TokenType type) {
        return scanner.getType() == type;
    }

    private CellmlToken advance() {
        CellmlToken token = scanner.getToken();
        scanner.nextToken();
        return token;
    }

    private void expect(TokenType type) {
        if (!check(type)) {
            throw error("Expected " + type + " but found " + describe(scanner.getToken()));
        }
        advance();
    }

    private String expectValue(TokenType type) {
        if (!check(type)) {
            throw error("Expected " + type + " but found " + describe(scanner.getToken()));
        }
        return advance().getValue();
    }

    private CellmlSyntaxException error(String message) {
        return new CellmlSyntaxException(message, scanner.getToken().getLine());
    }

    private static String describe(CellmlToken token) {
        return token.is(TokenType.EOF) ? "end of input" : "'" + token.getValue() + "'";
    }
}
