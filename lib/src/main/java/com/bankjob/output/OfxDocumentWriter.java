package com.bankjob.output;

import com.bankjob.Version;
import com.bankjob.ledger.OfxElement;
import com.bankjob.ledger.Statement;
import com.bankjob.loader.validation.StatementValidator;
import com.bankjob.loader.validation.ValidationException;
import com.bankjob.loader.validation.ValidationRunner;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

/**
 * Serializes statements as an OFX 2 bank statement download: the XML declaration, the OFX
 * processing instruction, then {@code OFX/BANKMSGSRSV1} holding one {@code STMTTRNRS} per
 * statement. Every statement is validated before anything is written.
 */
public final class OfxDocumentWriter {

    public static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";
    public static final String OFX_HEADER =
            "<?OFX OFXHEADER=\""
                    + Version.OFX_VERSION
                    + "\" VERSION=\""
                    + Version.OFX_VERSION
                    + "\" SECURITY=\"NONE\" OLDFILEUID=\"NONE\" NEWFILEUID=\"NONE\"?>";

    private static final Logger LOGGER = Logger.getLogger(OfxDocumentWriter.class.getName());
    private static final String INDENT = "  ";
    private static final String NEWLINE = "\n";

    private final ValidationRunner validation;

    public OfxDocumentWriter() {
        this(ValidationRunner.defaultRules());
    }

    public OfxDocumentWriter(ValidationRunner validation) {
        this.validation = Objects.requireNonNull(validation, "validation");
    }

    public void write(List<Statement> statements, Writer out) throws IOException, ValidationException {
        Objects.requireNonNull(statements, "statements");
        Objects.requireNonNull(out, "out");
        for (Statement statement : statements) {
            StatementValidator.validate(statement, validation);
        }

        out.write(XML_DECLARATION);
        out.write(NEWLINE);
        out.write(OFX_HEADER);
        out.write(NEWLINE);

        OfxElement.Builder messages = OfxElement.aggregate("BANKMSGSRSV1");
        for (Statement statement : statements) {
            messages.child(statement.toOfxElement());
        }
        OfxElement document = OfxElement.aggregate("OFX").child(messages.build()).build();

        try {
            XMLStreamWriter xml = XMLOutputFactory.newFactory().createXMLStreamWriter(out);
            writeElement(xml, document, 0);
            xml.flush();
            xml.close();
        } catch (XMLStreamException ex) {
            throw new IOException("Failed to write OFX document", ex);
        }
        out.write(NEWLINE);
        out.flush();
        LOGGER.log(Level.FINE, "Wrote OFX document with {0} statement(s)", statements.size());
    }

    public String toString(List<Statement> statements) throws ValidationException {
        StringWriter buffer = new StringWriter();
        try {
            write(statements, buffer);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return buffer.toString();
    }

    private static void writeElement(XMLStreamWriter xml, OfxElement element, int depth)
            throws XMLStreamException {
        xml.writeStartElement(element.getName());
        if (element.isLeaf()) {
            xml.writeCharacters(element.getText());
        } else {
            for (OfxElement child : element.getChildren()) {
                newline(xml, depth + 1);
                writeElement(xml, child, depth + 1);
            }
            newline(xml, depth);
        }
        xml.writeEndElement();
    }

    private static void newline(XMLStreamWriter xml, int depth) throws XMLStreamException {
        xml.writeCharacters(NEWLINE + INDENT.repeat(depth));
    }
}
