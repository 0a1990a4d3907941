package com.integration.migrator.binding;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import com.integration.migrator.util.XmlDocuments;

/**
 * Reads a binding file into a {@link BindingSnapshot}.
 *
 * <p>Adapter settings and subscription filters are stored as escaped XML inside element text;
 * those nested documents are parsed separately and skipped with a warning when unreadable.
 */
public class BindingParser {

    private static final Logger log = LoggerFactory.getLogger(BindingParser.class);

    public BindingSnapshot parseFile(Path path) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    public BindingSnapshot parse(String xml) {
        Document document;
        try {
            document = XmlDocuments.parse(xml);
        } catch (SAXException | IOException e) {
            throw new BindingParseException("Binding file is not well-formed XML: " + e.getMessage(), e);
        }
        Element root = document.getDocumentElement();

        List<ReceiveLocationBinding> locations = new ArrayList<>();
        for (Element receivePort : XmlDocuments.descendants(root, "ReceivePort")) {
            String portName = nameOr(receivePort, "ReceivePort");
            for (Element location : XmlDocuments.descendants(receivePort, "ReceiveLocation")) {
                locations.add(parseReceiveLocation(location, portName));
            }
        }

        List<SendPortBinding> sendPorts = new ArrayList<>();
        for (Element sendPort : XmlDocuments.descendants(root, "SendPort")) {
            sendPorts.add(parseSendPort(sendPort));
        }

        log.debug("Parsed bindings: {} receive location(s), {} send port(s)", locations.size(), sendPorts.size());
        return new BindingSnapshot(locations, sendPorts);
    }

    private ReceiveLocationBinding parseReceiveLocation(Element location, String portName) {
        String name = nameOr(location, "ReceiveLocation");
        String address = textOrAttribute(location, "Address");

        ReceiveLocationBinding.ReceiveLocationBindingBuilder builder = ReceiveLocationBinding.builder()
                .name(name)
                .receivePortName(portName)
                .transportType(transportType(location, "ReceiveLocationTransportType"))
                .address(address)
                .enabled("true".equalsIgnoreCase(descendantText(location, "Enable")))
                .receivePipelineName(pipelineName(location, "ReceivePipeline"));

        CustomProps props = customProps(location, "ReceiveLocationTransportTypeData", name);
        String folder = props.folder != null ? props.folder : extractFolder(address);
        String mask = props.fileMask != null ? props.fileMask : extractMask(address);
        return builder
                .folderPath(folder)
                .fileMask(mask)
                .pollingIntervalSeconds(props.pollingSeconds)
                .userName(props.userName)
                .connectionString(props.connectionString)
                .hostAppsSubtype(props.hostAppsSubtype)
                .build();
    }

    private SendPortBinding parseSendPort(Element sendPort) {
        String name = nameOr(sendPort, "SendPort");
        CustomProps props = customProps(sendPort, "SendPortTransportTypeData", name);

        SendPortBinding.SendPortBindingBuilder builder = SendPortBinding.builder()
                .name(name)
                .transportType(transportType(sendPort, "SendPortTransportType"))
                .address(textOrAttribute(sendPort, "Address"))
                .sendPipelineName(pipelineName(sendPort, "SendPipeline"))
                .userName(props.userName)
                .connectionString(props.connectionString)
                .hostAppsSubtype(props.hostAppsSubtype);

        for (Element transform : XmlDocuments.descendants(sendPort, "Transform")) {
            String fullName = XmlDocuments.attribute(transform, "FullName");
            if (fullName != null) {
                builder.transform(TransformReference.of(fullName));
            }
        }

        Element filter = first(XmlDocuments.descendants(sendPort, "Filter"));
        if (filter != null && !filter.getTextContent().isBlank()) {
            parseFilter(filter.getTextContent(), name).forEach(builder::filter);
        }
        return builder.build();
    }

    private List<FilterCondition> parseFilter(String escaped, String sendPortName) {
        List<FilterCondition> conditions = new ArrayList<>();
        Document filterDoc = parseNested(escaped, "filter of send port " + sendPortName);
        if (filterDoc == null) {
            return conditions;
        }
        for (Element statement : XmlDocuments.descendants(filterDoc.getDocumentElement(), "Statement")) {
            String property = XmlDocuments.attribute(statement, "Property");
            String value = XmlDocuments.attribute(statement, "Value");
            if (property == null || value == null) {
                continue;
            }
            String operator = XmlDocuments.attribute(statement, "Operator");
            conditions.add(FilterCondition.builder()
                    .property(property)
                    .operator(operator != null ? operator : FilterCondition.EQUALS)
                    .value(value)
                    .build());
        }
        return conditions;
    }

    private CustomProps customProps(Element owner, String dataElementName, String ownerName) {
        CustomProps props = new CustomProps();
        Element data = first(XmlDocuments.descendants(owner, dataElementName));
        if (data == null) {
            // Send ports keep adapter settings under their primary transport.
            data = first(XmlDocuments.descendants(owner, "TransportTypeData"));
        }
        if (data == null || data.getTextContent().isBlank()) {
            return props;
        }
        Document doc = parseNested(data.getTextContent(), "transport data of " + ownerName);
        if (doc == null) {
            return props;
        }
        Element root = doc.getDocumentElement();

        props.fileMask = firstText(root, "FileMask", "FileMaskWildcard");
        props.folder = firstText(root, "DestinationFolder", "Folder");
        props.userName = firstText(root, "UserName", "Username");
        props.connectionString = firstText(root, "ConnectionString");
        props.pollingSeconds = pollingSeconds(root);

        String mappings = firstText(root, "AssemblyMappings");
        if (mappings != null) {
            props.hostAppsSubtype = hostAppsSubtype(mappings, ownerName);
            if (props.connectionString == null) {
                props.connectionString = mappingsConnectionString(mappings, ownerName);
            }
        }
        return props;
    }

    private Integer pollingSeconds(Element root) {
        String minutes = firstText(root, "PollingIntervalInMinutes");
        if (minutes != null) {
            Integer value = parseInt(minutes);
            return value != null ? value * 60 : null;
        }
        String raw = firstText(root, "PollingInterval", "PollingSeconds", "Interval", "SleepTime");
        Integer value = raw != null ? parseInt(raw) : null;
        if (value == null) {
            return null;
        }
        String unit = firstText(root, "PollingIntervalUnit", "PollingUnitOfMeasure");
        if (unit != null && unit.toLowerCase(Locale.ROOT).startsWith("minute")) {
            return value * 60;
        }
        if (unit != null && unit.toLowerCase(Locale.ROOT).startsWith("hour")) {
            return value * 3600;
        }
        return value;
    }

    String hostAppsSubtype(String mappings, String ownerName) {
        Document doc = parseNested(mappings, "host application mappings of " + ownerName);
        String source = mappings;
        if (doc != null) {
            Element assembly = first(XmlDocuments.descendants(doc.getDocumentElement(), "assembly"));
            if (assembly != null && !assembly.getTextContent().isBlank()) {
                source = assembly.getTextContent();
            } else {
                String connection = mappingsConnectionString(mappings, ownerName);
                source = connection != null ? connection : "";
            }
        }
        String lower = source.toLowerCase(Locale.ROOT);
        if (lower.contains("cics")) {
            return "Cics";
        }
        if (lower.contains("ims")) {
            return "Ims";
        }
        if (lower.contains("vsam")) {
            return "Vsam";
        }
        return "HostFile";
    }

    private String mappingsConnectionString(String mappings, String ownerName) {
        Document doc = parseNested(mappings, "host application mappings of " + ownerName);
        if (doc == null) {
            return null;
        }
        Element connection = first(XmlDocuments.descendants(doc.getDocumentElement(), "connectionString"));
        return connection != null && !connection.getTextContent().isBlank() ? connection.getTextContent().trim() : null;
    }

    /**
     * Parses XML held as element text, undoing one more level of escaping when present.
     */
    private Document parseNested(String text, String what) {
        String xml = text.trim();
        if (xml.startsWith("&lt;")) {
            xml = unescape(xml);
        }
        try {
            return XmlDocuments.parse(xml);
        } catch (SAXException | IOException e) {
            log.warn("Skipping unreadable {}: {}", what, e.getMessage());
            return null;
        }
    }

    static String unescape(String text) {
        return text.replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&apos;", "'")
                .replace("&amp;", "&");
    }

    static String extractFolder(String address) {
        if (address == null || address.isBlank()) {
            return null;
        }
        int star = address.indexOf('*');
        String head = star >= 0 ? address.substring(0, star) : address;
        int separator = Math.max(head.lastIndexOf('\\'), head.lastIndexOf('/'));
        if (separator <= 0) {
            return null;
        }
        return address.substring(0, separator);
    }

    static String extractMask(String address) {
        if (address == null || !address.contains("*")) {
            return null;
        }
        int separator = Math.max(address.lastIndexOf('\\'), address.lastIndexOf('/'));
        return address.substring(separator + 1);
    }

    private static String transportType(Element owner, String transportElementName) {
        Element transport = first(XmlDocuments.descendants(owner, transportElementName));
        if (transport == null) {
            transport = first(XmlDocuments.descendants(owner, "TransportType"));
        }
        String name = XmlDocuments.attribute(transport, "Name");
        if (name != null) {
            return name;
        }
        String adapter = XmlDocuments.attribute(owner, "AdapterName");
        return adapter != null ? adapter : XmlDocuments.attribute(owner, "Adapter");
    }

    private static String pipelineName(Element owner, String pipelineElementName) {
        String name = XmlDocuments.attribute(first(XmlDocuments.descendants(owner, pipelineElementName)), "Name");
        return name != null ? name : descendantText(owner, pipelineElementName + "Name");
    }

    private static String textOrAttribute(Element owner, String name) {
        String text = descendantText(owner, name);
        return text != null ? text : XmlDocuments.attribute(owner, name);
    }

    private static String descendantText(Element owner, String localName) {
        Element element = first(XmlDocuments.descendants(owner, localName));
        if (element == null || element.getTextContent().isBlank()) {
            return null;
        }
        return element.getTextContent().trim();
    }

    private static String firstText(Element root, String... localNames) {
        for (String localName : localNames) {
            String text = descendantText(root, localName);
            if (text != null) {
                return text;
            }
        }
        return null;
    }

    private static String nameOr(Element element, String fallback) {
        String name = XmlDocuments.attribute(element, "Name");
        return name != null ? name : fallback;
    }

    private static Integer parseInt(String text) {
        try {
            return Integer.valueOf(text.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric polling interval '{}'", text);
            return null;
        }
    }

    private static Element first(List<Element> elements) {
        return elements.isEmpty() ? null : elements.get(0);
    }

    private static final class CustomProps {
        String fileMask;
        String folder;
        String userName;
        String connectionString;
        String hostAppsSubtype;
        Integer pollingSeconds;
    }
}
