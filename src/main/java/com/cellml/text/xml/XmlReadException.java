package com.cellml.text.xml;

/**
 * Raised when an XML document cannot be read into a CellML model tree.
 */
public class XmlReadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public XmlReadException(String message) {
        super(message);
    }

    public XmlReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
