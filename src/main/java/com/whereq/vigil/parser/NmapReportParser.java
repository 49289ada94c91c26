package com.whereq.vigil.parser;

import com.whereq.vigil.model.report.Host;
import com.whereq.vigil.model.report.HostAddress;
import com.whereq.vigil.model.report.HostName;
import com.whereq.vigil.model.report.OsClass;
import com.whereq.vigil.model.report.OsMatch;
import com.whereq.vigil.model.report.Port;
import com.whereq.vigil.model.report.RunStats;
import com.whereq.vigil.model.report.ScanInfo;
import com.whereq.vigil.model.report.ScanResult;
import com.whereq.vigil.model.report.ScriptOutput;
import com.whereq.vigil.model.report.Trace;
import com.whereq.vigil.model.report.TraceHop;
import com.whereq.vigil.model.report.Uptime;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts an nmap XML report ({@code -oX}) into a {@link ScanResult} tree.
 * <p>
 * Never throws: input that cannot be parsed yields {@link ScanResult#failed(String)},
 * an error-tagged result with no hosts.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
public class NmapReportParser {

    /**
     * Parse a raw XML report
     *
     * @param xml report text
     * @return extracted result, or an error-tagged empty result
     */
    public ScanResult parse(String xml) {
        if (xml == null || xml.isBlank()) {
            return ScanResult.failed("Empty scan report");
        }

        try {
            Document document = newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
            Element root = document.getDocumentElement();

            ScanInfo.ScanInfoBuilder scanInfo = ScanInfo.builder();
            NamedNodeMap rootAttributes = root.getAttributes();
            for (int i = 0; i < rootAttributes.getLength(); i++) {
                Attr attribute = (Attr) rootAttributes.item(i);
                scanInfo.attribute(attribute.getName(), attribute.getValue());
            }

            ScanResult.ScanResultBuilder result = ScanResult.builder();

            NodeList hostNodes = root.getElementsByTagName("host");
            for (int i = 0; i < hostNodes.getLength(); i++) {
                result.host(parseHost((Element) hostNodes.item(i)));
            }

            Element runStats = child(root, "runstats");
            if (runStats != null) {
                scanInfo.runStats(parseRunStats(runStats));
            }

            return result.scanInfo(scanInfo.build()).build();

        } catch (Exception e) {
            log.warn("Failed to parse scan report: {}", e.getMessage());
            log.debug("Scan report parse failure", e);
            return ScanResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private Host parseHost(Element hostNode) {
        Host.HostBuilder host = Host.builder();

        Element status = child(hostNode, "status");
        if (status != null) {
            host.status(attr(status, "state"));
        }

        for (Element address : children(hostNode, "address")) {
            String type = attr(address, "addrtype");
            String addr = attr(address, "addr");

            if ("ipv4".equals(type)) {
                host.ip(addr);
            } else if ("mac".equals(type)) {
                host.mac(addr);
            }

            host.address(HostAddress.builder()
                .type(type)
                .addr(addr)
                .vendor(attr(address, "vendor"))
                .build());
        }

        Element hostnames = child(hostNode, "hostnames");
        if (hostnames != null) {
            for (Element hostname : children(hostnames, "hostname")) {
                String name = attr(hostname, "name");
                String type = attr(hostname, "type");

                if ("user".equals(type)) {
                    host.hostname(name);
                }

                host.hostnameEntry(HostName.builder().name(name).type(type).build());
            }
        }

        Element ports = child(hostNode, "ports");
        if (ports != null) {
            for (Element port : children(ports, "port")) {
                host.port(parsePort(port));
            }
        }

        Element os = child(hostNode, "os");
        if (os != null) {
            List<OsMatch> matches = new ArrayList<>();
            for (Element matchNode : children(os, "osmatch")) {
                matches.add(parseOsMatch(matchNode));
            }
            host.osMatches(matches);
            // The report lists matches best first; no re-ranking
            if (!matches.isEmpty()) {
                host.os(matches.get(0));
            }
        }

        Element uptime = child(hostNode, "uptime");
        if (uptime != null) {
            host.uptime(Uptime.builder()
                .seconds(longAttr(uptime, "seconds"))
                .lastBoot(attr(uptime, "lastboot"))
                .build());
        }

        Element distance = child(hostNode, "distance");
        if (distance != null) {
            host.distance(intAttr(distance, "value"));
        }

        Element trace = child(hostNode, "trace");
        if (trace != null) {
            Trace.TraceBuilder traceBuilder = Trace.builder()
                .proto(attr(trace, "proto"))
                .port(attr(trace, "port"));
            for (Element hop : children(trace, "hop")) {
                traceBuilder.hop(TraceHop.builder()
                    .ttl(intAttr(hop, "ttl"))
                    .ipAddr(attr(hop, "ipaddr"))
                    .host(attr(hop, "host"))
                    .rtt(doubleAttr(hop, "rtt"))
                    .build());
            }
            host.trace(traceBuilder.build());
        }

        return host.build();
    }

    private Port parsePort(Element portNode) {
        Port.PortBuilder port = Port.builder()
            .protocol(attr(portNode, "protocol"))
            .portId(intAttr(portNode, "portid"));

        Element state = child(portNode, "state");
        if (state != null) {
            port.state(attr(state, "state"));
            port.reason(attr(state, "reason"));
        }

        Element service = child(portNode, "service");
        if (service != null) {
            String product = attr(service, "product");
            String version = attr(service, "version");

            port.service(attr(service, "name"))
                .product(product)
                .version(version)
                .versionInfo(joinVersion(product, version))
                .extraInfo(attr(service, "extrainfo"))
                .osType(attr(service, "ostype"))
                .deviceType(attr(service, "devicetype"))
                .serviceFingerprint(attr(service, "servicefp"));
        }

        for (Element script : children(portNode, "script")) {
            port.script(ScriptOutput.builder()
                .id(attr(script, "id"))
                .output(attr(script, "output"))
                .build());
        }

        return port.build();
    }

    private OsMatch parseOsMatch(Element matchNode) {
        OsMatch.OsMatchBuilder match = OsMatch.builder()
            .name(attr(matchNode, "name"))
            .accuracy(intAttr(matchNode, "accuracy"))
            .line(attr(matchNode, "line"));

        for (Element osClass : children(matchNode, "osclass")) {
            match.osClass(OsClass.builder()
                .type(attr(osClass, "type"))
                .vendor(attr(osClass, "vendor"))
                .osFamily(attr(osClass, "osfamily"))
                .osGen(attr(osClass, "osgen"))
                .accuracy(intAttr(osClass, "accuracy"))
                .build());
        }
        return match.build();
    }

    private RunStats parseRunStats(Element runStats) {
        RunStats.RunStatsBuilder stats = RunStats.builder();

        Element finished = child(runStats, "finished");
        if (finished != null) {
            stats.finishedTime(longAttr(finished, "time"))
                .finishedTimeStr(attr(finished, "timestr"))
                .elapsedSeconds(doubleAttr(finished, "elapsed"))
                .summary(attr(finished, "summary"));
        }

        Element hosts = child(runStats, "hosts");
        if (hosts != null) {
            stats.hostsUp(intAttr(hosts, "up"))
                .hostsDown(intAttr(hosts, "down"))
                .hostsTotal(intAttr(hosts, "total"));
        }

        return stats.build();
    }

    static String joinVersion(String product, String version) {
        List<String> parts = new ArrayList<>(2);
        if (product != null) {
            parts.add(product);
        }
        if (version != null) {
            parts.add(version);
        }
        return parts.isEmpty() ? null : String.join(" ", parts);
    }

    private static DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        // nmap writes <!DOCTYPE nmaprun>, so DOCTYPE stays allowed; nothing external is ever loaded
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
        factory.setValidating(false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        factory.setNamespaceAware(false);
        return factory.newDocumentBuilder();
    }

    private static Element child(Element parent, String name) {
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(node.getNodeName())) {
                return (Element) node;
            }
        }
        return null;
    }

    private static List<Element> children(Element parent, String name) {
        List<Element> elements = new ArrayList<>();
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(node.getNodeName())) {
                elements.add((Element) node);
            }
        }
        return elements;
    }

    /**
     * Attribute value, null when absent or empty
     */
    private static String attr(Element element, String name) {
        String value = element.getAttribute(name);
        return value.isEmpty() ? null : value;
    }

    private static Integer intAttr(Element element, String name) {
        String value = attr(element, name);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Long longAttr(Element element, String name) {
        String value = attr(element, name);
        if (value == null) {
            return null;
        }
        try {
            return Long.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double doubleAttr(Element element, String name) {
        String value = attr(element, name);
        if (value == null) {
            return null;
        }
        try {
            return Double.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
