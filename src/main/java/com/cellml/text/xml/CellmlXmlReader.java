package com.cellml.text.xml;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import com.cellml.text.model.ApplyNode;
import com.cellml.text.model.BvarNode;
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
 * Reads CellML 2.0 XML into a model tree.
 *
 * Elements outside the handled subset (imports, connections, resets, ...) are
 * skipped. Unknown MathML content becomes an {@link UnsupportedNode}.
 */
public class CellmlXmlReader {
    private static final Logger log = LoggerFactory.getLogger(CellmlXmlReader.class);

    private static final String DISALLOW_DOCTYPE = "http://apache.org/xml/features/disallow-doctype-decl";

    public ModelNode read(String xml) {
        Document doc = parseDocument(xml);

        NodeList models = doc.getElementsByTagNameNS(CellmlNamespaces.CELLML_2_0, "model");
        if (models.getLength() == 0) {
            throw new XmlReadException("No CellML 2.0 Model found");
        }
        return readModel((Element) models.item(0));
    }

    private Document parseDocument(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new XmlReadException("XML Parsing Error: empty document");
        }
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setCoalescing(true);
            factory.setIgnoringComments(true);
            factory.setFeature(DISALLOW_DOCTYPE, true);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new RethrowingErrorHandler());
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXException e) {
            throw new XmlReadException("XML Parsing Error: " + e.getMessage(), e);
        } catch (ParserConfigurationException | IOException e) {
            throw new XmlReadException("XML reader unavailable: " + e.getMessage(), e);
        }
    }

    private ModelNode readModel(Element element) {
        ModelNode model = new ModelNode(attribute(element, "name"));

        // Unit definitions count only as direct children of the model
        for (Element child : childElements(element)) {
            if (isCellml(child, "units")) {
                model.addUnits(readUnits(child));
            }
        }

        NodeList components = element.getElementsByTagNameNS(CellmlNamespaces.CELLML_2_0, "component");
        for (int i = 0; i < components.getLength(); i++) {
            model.addComponent(readComponent((Element) components.item(i)));
        }

        log.debug("Read model '{}' with {} units and {} components",
                model.getName(), model.getUnits().size(), model.getComponents().size());
        return model;
    }

    private UnitsNode readUnits(Element element) {
        UnitsNode units = new UnitsNode(attribute(element, "name"));
        NodeList children = element.getElementsByTagNameNS(CellmlNamespaces.CELLML_2_0, "unit");
        for (int i = 0; i < children.getLength(); i++) {
            Element unit = (Element) children.item(i);
            units.addUnit(UnitNode.builder()
                    .units(attribute(unit, "units"))
                    .prefix(attribute(unit, "prefix"))
                    .exponent(attribute(unit, "exponent"))
                    .multiplier(attribute(unit, "multiplier"))
                    .build());
        }
        return units;
    }

    private ComponentNode readComponent(Element element) {
        ComponentNode component = new ComponentNode(attribute(element, "name"));

        NodeList variables = element.getElementsByTagNameNS(CellmlNamespaces.CELLML_2_0, "variable");
        for (int i = 0; i < variables.getLength(); i++) {
            Element variable = (Element) variables.item(i);
            component.addVariable(VariableNode.builder()
                    .name(attribute(variable, "name"))
                    .units(attribute(variable, "units"))
                    .initialValue(attribute(variable, "initial_value"))
                    .interfaceType(attribute(variable, "interface"))
                    .build());
        }

        NodeList maths = element.getElementsByTagNameNS(CellmlNamespaces.MATHML, "math");
        for (int i = 0; i < maths.getLength(); i++) {
            component.addMath(readMathBlock((Element) maths.item(i)));
        }
        return component;
    }

    private MathNode readMathBlock(Element element) {
        MathNode math = new MathNode();
        for (Element child : childElements(element)) {
            math.addChild(readMath(child));
        }
        return math;
    }

    /**
     * Read one MathML content element.
     */
    MathElement readMath(Element element) {
        String tag = element.getLocalName();

        switch (tag) {
            case "apply":
                return readApply(element);
            case "ci":
                return new CiNode(getText(element));
            case "cn":
                return readNumber(element);
            case "piecewise":
                return readPiecewise(element);
            case "bvar":
                return new BvarNode(readMath(firstChild(element, "bvar")));
            default:
                break;
        }

        if (ConstantNode.isConstant(tag)) {
            return new ConstantNode(tag);
        }

        log.debug("Unsupported MathML element <{}> kept as a placeholder", tag);
        return new UnsupportedNode(tag);
    }

    private ApplyNode readApply(Element element) {
        List<Element> children = childElements(element);
        if (children.isEmpty()) {
            throw new XmlReadException("Empty <apply> element has no operator");
        }

        ApplyNode apply = new ApplyNode(children.get(0).getLocalName());
        for (Element argument : children.subList(1, children.size())) {
            apply.addArgument(readMath(argument));
        }
        return apply;
    }

    private CnNode readNumber(Element element) {
        CnNode cn = CnNode.builder()
                .value(getText(element))
                .units(namespacedAttribute(element, CellmlNamespaces.CELLML_2_0, "units"))
                .build();

        if (CnNode.E_NOTATION.equals(attribute(element, "type"))) {
            StringBuilder mantissa = new StringBuilder();
            StringBuilder exponent = new StringBuilder();
            boolean afterSep = false;

            for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
                if (child.getNodeType() == Node.ELEMENT_NODE && "sep".equals(child.getLocalName())) {
                    afterSep = true;
                } else if (child.getNodeType() == Node.TEXT_NODE) {
                    (afterSep ? exponent : mantissa).append(child.getNodeValue());
                }
            }

            if (afterSep) {
                cn.setValue(mantissa.toString().trim());
                cn.setExponent(exponent.toString().trim());
            }
        }
        return cn;
    }

    private PiecewiseNode readPiecewise(Element element) {
        PiecewiseNode piecewise = new PiecewiseNode();

        for (Element child : childElements(element)) {
            List<Element> parts = childElements(child);
            if ("piece".equals(child.getLocalName())) {
                if (parts.size() < 2) {
                    throw new XmlReadException("<piece> requires a value and a condition");
                }
                piecewise.addPiece(new PieceNode(readMath(parts.get(0)), readMath(parts.get(1))));
            } else if ("otherwise".equals(child.getLocalName())) {
                piecewise.setOtherwise(new OtherwiseNode(readMath(firstChild(child, "otherwise"))));
            } else {
                log.debug("Ignoring <{}> inside <piecewise>", child.getLocalName());
            }
        }
        return piecewise;
    }

    private static Element firstChild(Element element, String description) {
        List<Element> children = childElements(element);
        if (children.isEmpty()) {
            throw new XmlReadException("<" + description + "> has no content");
        }
        return children.get(0);
    }

    private static List<Element> childElements(Element element) {
        List<Element> result = new ArrayList<>();
        for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) child);
            }
        }
        return result;
    }

    private static boolean isCellml(Element element, String localName) {
        return CellmlNamespaces.CELLML_2_0.equals(element.getNamespaceURI())
                && localName.equals(element.getLocalName());
    }

    private static String getText(Node node) {
        StringBuilder result = new StringBuilder();
        for (Node child = node.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.TEXT_NODE || child.getNodeType() == Node.CDATA_SECTION_NODE) {
                result.append(child.getNodeValue());
            }
        }
        return result.toString().trim();
    }

    private static String attribute(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name) : null;
    }

    private static String namespacedAttribute(Element element, String namespace, String name) {
        return element.hasAttributeNS(namespace, name) ? element.getAttributeNS(namespace, name) : null;
    }

    /**
     * Turns parser warnings into log lines and errors into exceptions, instead of the
     * JAXP default of printing to stderr.
     */
    private static class RethrowingErrorHandler implements ErrorHandler {
        @Override
        public void warning(SAXParseException e) {
            log.debug("XML warning at line {}: {}", e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }
}
