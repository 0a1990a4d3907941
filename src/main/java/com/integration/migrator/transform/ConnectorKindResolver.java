package com.integration.migrator.transform;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import com.integration.migrator.workflow.ConnectorKind;
import com.integration.migrator.workflow.WorkflowAction;

/**
 * Maps an adapter transport name and address onto a target connector family.
 * Tests run in a fixed order; the first match wins and Http is the default.
 */
public class ConnectorKindResolver {

    private static final String SERVICE_BUS_HOST_SUFFIX = ".servicebus.windows.net";

    public ConnectorKind resolve(String transport, String address) {
        return resolve(transport, address, null);
    }

    public ConnectorKind resolve(String transport, String address, String hostAppsSubtype) {
        String t = lower(transport);
        String a = lower(address);

        ConnectorKind hinted = fromHostAppsSubtype(hostAppsSubtype);
        if (hinted != null) {
            return hinted;
        }
        if (t.contains("hostapp")) {
            if (a.contains("cics://")) {
                return ConnectorKind.CICS;
            }
            if (a.contains("ims://")) {
                return ConnectorKind.IMS;
            }
            if (a.contains("vsam://")) {
                return ConnectorKind.VSAM;
            }
            return ConnectorKind.HOST_FILE;
        }
        if (t.contains("hostfile") || t.contains("host-files")) {
            return ConnectorKind.HOST_FILE;
        }
        if (t.contains("file")) {
            return ConnectorKind.FILE_SYSTEM;
        }
        if (t.contains("sftp")) {
            return ConnectorKind.SFTP;
        }
        if (t.contains("ftp")) {
            return ConnectorKind.FTP;
        }
        if (t.contains("sql")) {
            return ConnectorKind.SQL;
        }
        if (t.contains("as2")) {
            return ConnectorKind.AS2;
        }
        if (a.contains("x12")) {
            return ConnectorKind.X12;
        }
        if (a.contains("edifact")) {
            return ConnectorKind.EDIFACT;
        }
        if (t.contains("mllp") || a.startsWith("mllp://")) {
            return ConnectorKind.MLLP;
        }
        if (t.contains("sb") || t.contains("servicebus") || t.contains("msmq")) {
            return ConnectorKind.SERVICE_BUS;
        }
        if (t.contains("eventhub")) {
            return ConnectorKind.EVENT_HUBS;
        }
        if (t.contains("mqseries") || t.contains("ibmmq") || t.contains("mq")) {
            return ConnectorKind.IBM_MQ;
        }
        if (t.contains("db2") || a.contains("db2://")) {
            return ConnectorKind.DB2;
        }
        if (t.contains("cics") || a.contains("cics://")) {
            return ConnectorKind.CICS;
        }
        if (t.contains("ims") || a.contains("ims://")) {
            return ConnectorKind.IMS;
        }
        if (t.contains("vsam") || a.contains("vsam://")) {
            return ConnectorKind.VSAM;
        }
        if (t.contains("informix")) {
            return ConnectorKind.INFORMIX;
        }
        if (t.contains("sap") || a.contains("sap://")) {
            return ConnectorKind.SAP;
        }
        if (t.contains("smtp") || t.contains("pop3") || a.contains("gmail.com") || a.contains("outlook")
                || a.contains("office365") || a.contains("exchange")) {
            return ConnectorKind.SMTP;
        }
        return ConnectorKind.HTTP;
    }

    /**
     * Fills queue or topic and subscription from a namespace address such as
     * {@code sb://ns.servicebus.windows.net/orders/subscriptions/audit}.
     */
    public void populateServiceBusParts(WorkflowAction action, String address) {
        if (address == null || address.isBlank()) {
            return;
        }
        List<String> segments = Arrays.stream(address.split("[/\\\\]"))
                .filter(s -> !s.isEmpty())
                .toList();
        int hostIndex = -1;
        for (int i = 0; i < segments.size(); i++) {
            if (lower(segments.get(i)).endsWith(SERVICE_BUS_HOST_SUFFIX)) {
                hostIndex = i;
                break;
            }
        }
        if (hostIndex < 0 || hostIndex + 1 >= segments.size()) {
            return;
        }
        String entity = segments.get(hostIndex + 1);
        action.setQueueOrTopicName(entity);
        for (int i = hostIndex + 2; i < segments.size(); i++) {
            if (segments.get(i).equalsIgnoreCase("subscriptions")) {
                action.setTopic(entity);
                if (i + 1 < segments.size()) {
                    action.setSubscriptionName(segments.get(i + 1));
                }
                return;
            }
        }
        String path = lower(address);
        if (path.contains("/topic") || path.contains("topic=")) {
            action.setTopic(entity);
        }
    }

    private static ConnectorKind fromHostAppsSubtype(String subtype) {
        if (subtype == null) {
            return null;
        }
        return switch (subtype) {
            case "Cics" -> ConnectorKind.CICS;
            case "Ims" -> ConnectorKind.IMS;
            case "Vsam" -> ConnectorKind.VSAM;
            case "HostFile" -> ConnectorKind.HOST_FILE;
            default -> null;
        };
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
