package com.cellml.text.xml;

import lombok.experimental.UtilityClass;

/**
 * XML namespaces used by CellML 2.0 documents.
 */
@UtilityClass
public class CellmlNamespaces {
    public static final String CELLML_2_0 = "http://www.cellml.org/cellml/2.0#";
    public static final String MATHML = "http://www.w3.org/1998/Math/MathML";
    public static final String CELLML_PREFIX = "cellml";
}
