package com.raditha.condcov.coverage.data;

import com.raditha.condcov.coverage.ExecutedLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads executed lines from a JaCoCo XML report ({@code jacoco.xml}).
 * <p>
 * Each {@code <sourcefile>} inside a {@code <package>} becomes one entry keyed
 * {@code <package name>/<sourcefile name>}. A line counts as executed when its
 * covered instruction count {@code ci} is positive.
 */
public class JacocoXmlCoverageData {

    private static final Logger logger = LoggerFactory.getLogger(JacocoXmlCoverageData.class);

    private JacocoXmlCoverageData() {
        /* this is only a utility class */
    }

    public static CoverageDataSource read(Path report) throws IOException {
        try (InputStream in = Files.newInputStream(report)) {
            return read(in);
        }
    }

    public static CoverageDataSource read(InputStream in) throws IOException {
        Document document;
        try {
            document = newDocumentBuilder().parse(in);
        } catch (SAXException | ParserConfigurationException e) {
            throw new IOException("Malformed JaCoCo report: " + e.getMessage(), e);
        }

        Map<String, Set<Integer>> lines = new HashMap<>();
        NodeList packages = document.getElementsByTagName("package");
        for (int i = 0; i < packages.getLength(); i++) {
            Element pkg = (Element) packages.item(i);
            String packageName = pkg.getAttribute("name");
            NodeList sourceFiles = pkg.getElementsByTagName("sourcefile");
            for (int j = 0; j < sourceFiles.getLength(); j++) {
                Element sourceFile = (Element) sourceFiles.item(j);
                String key = packageName.isEmpty()
                        ? sourceFile.getAttribute("name")
                        : packageName + "/" + sourceFile.getAttribute("name");
                collectExecutedLines(sourceFile, lines.computeIfAbsent(key, k -> new TreeSet<>()));
            }
        }

        logger.debug("Loaded JaCoCo line data for {} source files", lines.size());
        Map<String, ExecutedLines> executed = new HashMap<>();
        lines.forEach((path, set) -> executed.put(path, ExecutedLines.of(set)));
        return new InMemoryCoverageData(executed);
    }

    private static void collectExecutedLines(Element sourceFile, Set<Integer> target) {
        NodeList lineNodes = sourceFile.getElementsByTagName("line");
        for (int k = 0; k < lineNodes.getLength(); k++) {
            Element line = (Element) lineNodes.item(k);
            int coveredInstructions = parseInt(line.getAttribute("ci"));
            if (coveredInstructions > 0) {
                target.add(parseInt(line.getAttribute("nr")));
            }
        }
    }

    private static int parseInt(String value) {
        if (value == null || value.isEmpty()) {
            return 0;
        }
        return Integer.parseInt(value.trim());
    }

    private static DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        // JaCoCo reports declare report.dtd, which is never shipped next to the file
        factory.setValidating(false);
        factory.setNamespaceAware(false);
        factory.setExpandEntityReferences(false);
        factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
        return factory.newDocumentBuilder();
    }
}
