package dev.quantumreview.analysis;

import dev.quantumreview.domain.enums.TestStatus;
import dev.quantumreview.domain.valueobject.ParsedTestCase;
import dev.quantumreview.exception.ReportParseException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads JUnit XML ({@code <testsuites>} or a single {@code <testsuite>}).
 *
 * <p>Test ids are taken from names of the form {@code T3::test_login}, then from a classname of
 * the form {@code autoqa:T3} or {@code pkg::T3}, and fall back to the test name. Errors count as
 * failures. DOCTYPE declarations are refused.
 */
public final class JUnitReportParser {

    private JUnitReportParser() {
    }

    public static List<ParsedTestCase> parse(String xml) {
        Document document = read(xml);
        Element root = document.getDocumentElement();
        if (!"testsuites".equals(root.getTagName()) && !"testsuite".equals(root.getTagName())) {
            return List.of();
        }
        NodeList cases = root.getElementsByTagName("testcase");
        List<ParsedTestCase> results = new ArrayList<>(cases.getLength());
        for (int i = 0; i < cases.getLength(); i++) {
            results.add(toTestCase((Element) cases.item(i)));
        }
        return results;
    }

    private static ParsedTestCase toTestCase(Element testcase) {
        String name = testcase.getAttribute("name");
        String classname = testcase.getAttribute("classname");

        String testId = null;
        String testName = name;
        int sep = name.indexOf("::");
        if (sep > 0 && name.startsWith("T")) {
            testId = name.substring(0, sep);
            testName = name.substring(sep + 2);
        }
        if (testId == null && !classname.isEmpty()) {
            if (classname.startsWith("autoqa:")) {
                String[] parts = classname.split(":");
                if (parts.length > 1 && !parts[1].isEmpty()) testId = parts[1];
            } else if (classname.contains("::")) {
                String last = classname.substring(classname.lastIndexOf("::") + 2);
                if (last.startsWith("T")) testId = last;
            }
        }
        if (testId == null) testId = name;

        TestStatus status = TestStatus.PASSED;
        String errorMessage = null;
        Element failure = firstChild(testcase, "failure");
        if (failure == null) failure = firstChild(testcase, "error");
        if (failure != null) {
            status = TestStatus.FAILED;
            errorMessage = failure.getAttribute("message");
            if (errorMessage.isEmpty()) errorMessage = failure.getTextContent().strip();
        } else if (firstChild(testcase, "skipped") != null) {
            status = TestStatus.SKIPPED;
        }

        return new ParsedTestCase(testId, testName, classname, status, durationMs(testcase.getAttribute("time")), errorMessage);
    }

    private static Long durationMs(String time) {
        if (time == null || time.isBlank()) return null;
        try {
            return (long) (Double.parseDouble(time.replace(",", "")) * 1000);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Element firstChild(Element parent, String tag) {
        NodeList children = parent.getElementsByTagName(tag);
        return children.getLength() == 0 ? null : (Element) children.item(0);
    }

    private static Document read(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new ReportParseException("Empty JUnit report", null);
        }
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new ReportParseException("Invalid JUnit XML: " + e.getMessage(), e);
        }
    }
}
