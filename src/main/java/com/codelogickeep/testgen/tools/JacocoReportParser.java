package com.codelogickeep.testgen.tools;

import com.codelogickeep.testgen.exception.TestGenException;
import com.codelogickeep.testgen.model.CounterType;
import com.codelogickeep.testgen.model.CoverageGap;
import com.codelogickeep.testgen.model.CoverageReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static com.codelogickeep.testgen.exception.TestGenException.ErrorCode.REPORT_NOT_FOUND;
import static com.codelogickeep.testgen.exception.TestGenException.ErrorCode.REPORT_UNREADABLE;

/**
 * Parses a JaCoCo XML report into a flat list of coverage gaps sorted by line coverage.
 * <p>
 * The parser is stateless; one instance can be shared between threads.
 */
public class JacocoReportParser {
    private static final Logger log = LoggerFactory.getLogger(JacocoReportParser.class);

    public CoverageReport parse(String reportPath) {
        if (reportPath == null || reportPath.isBlank()) {
            throw new TestGenException(REPORT_NOT_FOUND, "Report path is empty");
        }
        return parse(Paths.get(reportPath));
    }

    public CoverageReport parse(Path reportPath) {
        log.info("Tool Input - parse: reportPath={}", reportPath);
        if (Files.isDirectory(reportPath)) {
            throw TestGenException.builder(REPORT_NOT_FOUND, "Coverage report path is a directory: " + reportPath.toAbsolutePath())
                    .context(reportPath.toString())
                    .suggestion("Point --report at the jacoco.xml file inside " + reportPath + ".")
                    .build();
        }
        if (!Files.isRegularFile(reportPath)) {
            throw new TestGenException(REPORT_NOT_FOUND,
                    "Coverage report not found at " + reportPath.toAbsolutePath(), reportPath.toString());
        }
        try (InputStream in = Files.newInputStream(reportPath)) {
            return parse(in, reportPath.toString());
        } catch (NoSuchFileException e) {
            throw new TestGenException(REPORT_NOT_FOUND,
                    "Coverage report not found at " + reportPath.toAbsolutePath(), reportPath.toString(), e);
        } catch (IOException e) {
            throw new TestGenException(REPORT_UNREADABLE,
                    "Failed to read coverage report: " + e.getMessage(), reportPath.toString(), e);
        }
    }

    public CoverageReport parse(InputStream in) {
        return parse(in, "<stream>");
    }

    private CoverageReport parse(InputStream in, String source) {
        if (in == null) {
            throw new TestGenException(REPORT_UNREADABLE, "Coverage report stream is null", source);
        }

        Document doc;
        try {
            doc = parseXml(in);
        } catch (SAXException | IOException | ParserConfigurationException e) {
            log.error("Failed to parse coverage report {}", source, e);
            throw new TestGenException(REPORT_UNREADABLE,
                    "Failed to parse coverage report: " + e.getMessage(), source, e);
        }

        CoverageReport report = extract(doc.getDocumentElement());
        log.info("Tool Output - parse: gaps={}, line={}, branch={}",
                report.getGaps().size(), report.getTotalLineCoveragePct(), report.getTotalBranchCoveragePct());
        return report;
    }

    private Document parseXml(InputStream in) throws ParserConfigurationException, SAXException, IOException {
        DocumentBuilderFactory dbFactory = DocumentBuilderFactory.newInstance();
        // Allow DOCTYPE for JaCoCo XML reports
        dbFactory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", false);
        dbFactory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        dbFactory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        dbFactory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        DocumentBuilder dBuilder = dbFactory.newDocumentBuilder();
        dBuilder.setErrorHandler(new ErrorHandler() {
            @Override
            public void warning(SAXParseException e) {
                log.debug("Coverage report warning at line {}: {}", e.getLineNumber(), e.getMessage());
            }

            @Override
            public void error(SAXParseException e) throws SAXException {
                throw e;
            }

            @Override
            public void fatalError(SAXParseException e) throws SAXException {
                throw e;
            }
        });
        Document doc = dBuilder.parse(in);
        doc.getDocumentElement().normalize();
        return doc;
    }

    private CoverageReport extract(Element root) {
        List<CoverageGap> gaps = new ArrayList<>();
        double totalLineCoverage = 0.0;
        double totalBranchCoverage = 0.0;

        // Packages may sit directly under <report> or inside <group> elements
        NodeList packages = root.getElementsByTagName("package");
        for (int i = 0; i < packages.getLength(); i++) {
            Element pkg = (Element) packages.item(i);
            String packageName = toDotted(pkg.getAttribute("name"));

            for (Element cls : childElements(pkg, "class")) {
                String fullClassName = qualify(packageName, cls.getAttribute("name"));

                for (Element method : childElements(cls, "method")) {
                    double lineCoverage = calculateCoverage(method, CounterType.LINE);
                    double branchCoverage = calculateCoverage(method, CounterType.BRANCH);

                    if (lineCoverage < 100) {
                        gaps.add(CoverageGap.builder()
                                .classFullName(fullClassName)
                                .methodSignature(method.getAttribute("name") + method.getAttribute("desc"))
                                .packageName(packageName)
                                .lineCoveragePct(lineCoverage)
                                .branchCoveragePct(branchCoverage)
                                .uncoveredLines(findUncoveredLines(method))
                                .build());
                    }
                }

                // Report total is the best class-level figure, unless report counters say otherwise
                totalLineCoverage = Math.max(totalLineCoverage, calculateCoverage(cls, CounterType.LINE));
                totalBranchCoverage = Math.max(totalBranchCoverage, calculateCoverage(cls, CounterType.BRANCH));
            }
        }

        if (findCounter(root, CounterType.LINE) != null) {
            totalLineCoverage = calculateCoverage(root, CounterType.LINE);
        }
        if (findCounter(root, CounterType.BRANCH) != null) {
            totalBranchCoverage = calculateCoverage(root, CounterType.BRANCH);
        }

        // List.sort is stable: equal coverage keeps package/class/method order
        gaps.sort(Comparator.comparingDouble(CoverageGap::getLineCoveragePct));

        log.debug("Extracted {} coverage gaps from {} packages", gaps.size(), packages.getLength());
        return CoverageReport.builder()
                .totalLineCoveragePct(totalLineCoverage)
                .totalBranchCoveragePct(totalBranchCoverage)
                .gaps(gaps)
                .build();
    }

    double calculateCoverage(Element element, CounterType counterType) {
        Element counter = findCounter(element, counterType);
        if (counter == null) {
            return 0.0;
        }
        long missed = readCount(counter, "missed");
        long covered = readCount(counter, "covered");
        long total = missed + covered;
        return total == 0 ? 0.0 : (double) covered / total * 100;
    }

    private Element findCounter(Element element, CounterType counterType) {
        for (Element counter : childElements(element, "counter")) {
            if (counterType.xmlName().equals(counter.getAttribute("type"))) {
                return counter;
            }
        }
        return null;
    }

    private List<Integer> findUncoveredLines(Element method) {
        List<Integer> uncovered = new ArrayList<>();
        for (Element line : childElements(method, "line")) {
            if (readCount(line, "ci") == 0) {
                uncovered.add(readLineNumber(line));
            }
        }
        return uncovered;
    }

    private long readCount(Element element, String attribute) {
        String value = element.getAttribute(attribute);
        if (value.isEmpty()) {
            return 0;
        }
        try {
            long count = Long.parseLong(value.trim());
            if (count < 0) {
                log.debug("Negative {}='{}' on <{}>, treating as 0", attribute, value, element.getTagName());
                return 0;
            }
            return count;
        } catch (NumberFormatException e) {
            log.debug("Non-numeric {}='{}' on <{}>, treating as 0", attribute, value, element.getTagName());
            return 0;
        }
    }

    private int readLineNumber(Element line) {
        String value = line.getAttribute("nr").trim();
        if (value.isEmpty()) {
            return 0;
        }
        try {
            return Math.max(0, Integer.parseInt(value));
        } catch (NumberFormatException e) {
            log.debug("Invalid nr='{}' on <line>, treating as 0", value);
            return 0;
        }
    }

    private static List<Element> childElements(Element parent, String tagName) {
        List<Element> result = new ArrayList<>();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && tagName.equals(node.getNodeName())) {
                result.add((Element) node);
            }
        }
        return result;
    }

    static String toDotted(String name) {
        return name == null ? "" : name.replace('/', '.');
    }

    /**
     * JaCoCo writes class names with their package path ("com/acme/Widget"); older or hand-written
     * reports may use the bare name. Both resolve to "com.acme.Widget".
     */
    static String qualify(String packageName, String rawClassName) {
        String className = toDotted(rawClassName);
        if (packageName.isEmpty()) {
            return className;
        }
        if (className.startsWith(packageName + ".")) {
            return className;
        }
        return packageName + "." + className;
    }
}
