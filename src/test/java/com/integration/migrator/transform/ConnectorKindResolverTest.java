package com.integration.migrator.transform;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.integration.migrator.workflow.ActionKind;
import com.integration.migrator.workflow.ConnectorKind;
import com.integration.migrator.workflow.WorkflowAction;

/**
 * Unit tests for ConnectorKindResolver.
 */
class ConnectorKindResolverTest {

    private final ConnectorKindResolver resolver = new ConnectorKindResolver();

    @ParameterizedTest
    @CsvSource({
        "FILE, C:\\in\\*.xml, FILE_SYSTEM",
        "SFTP, sftp://host/in, SFTP",
        "FTP, ftp://host/in, FTP",
        "WCF-SQL, mssql://db//Orders, SQL",
        "MLLP, mllp://lab:2575, MLLP",
        "SB-Messaging, sb://ns.servicebus.windows.net/q, SERVICE_BUS",
        "MSMQ, FormatName:DIRECT=OS:orders, SERVICE_BUS",
        "EventHubs, sb://ns.servicebus.windows.net/hub, EVENT_HUBS",
        "MQSeries, MQS://qm/ORDERS, IBM_MQ",
        "DB2, db2://host/orders, DB2",
        "WCF-SAP, sap://client=800, SAP",
        "Informix, informix://db, INFORMIX",
        "SMTP, mailto:ops@contoso.com, SMTP",
        "WCF-WebHttp, https://api.contoso.com/orders, HTTP"
    })
    void testTransportMapping(String transport, String address, ConnectorKind expected) {
        assertThat(resolver.resolve(transport, address)).isEqualTo(expected);
    }

    @Test
    void testEdiDetectedFromAddress() {
        assertThat(resolver.resolve("HTTP", "https://partner.com/x12/inbound")).isEqualTo(ConnectorKind.X12);
        assertThat(resolver.resolve("WCF-BasicHttp", "https://partner.com/edifact")).isEqualTo(ConnectorKind.EDIFACT);
        assertThat(resolver.resolve("FILE", "C:\\x12\\*.edi")).isEqualTo(ConnectorKind.FILE_SYSTEM);
    }

    @Test
    void testHostIntegrationAdapters() {
        assertThat(resolver.resolve("HostApps", "cics://zos1/ACCT")).isEqualTo(ConnectorKind.CICS);
        assertThat(resolver.resolve("HostApps", "HostApps://zos1")).isEqualTo(ConnectorKind.HOST_FILE);
        assertThat(resolver.resolve("FILE", "C:\\in", "Cics")).isEqualTo(ConnectorKind.CICS);
    }

    @Test
    void testDefaultsToHttp() {
        assertThat(resolver.resolve(null, null)).isEqualTo(ConnectorKind.HTTP);
        assertThat(resolver.resolve("WCF-BasicHttp", "/orders/submit")).isEqualTo(ConnectorKind.HTTP);
    }

    @Test
    void testServiceBusTopicSubscription() {
        WorkflowAction action = sendAction();

        resolver.populateServiceBusParts(action, "sb://contoso.servicebus.windows.net/orders/subscriptions/audit");

        assertThat(action.getQueueOrTopicName()).isEqualTo("orders");
        assertThat(action.getTopic()).isEqualTo("orders");
        assertThat(action.getSubscriptionName()).isEqualTo("audit");
    }

    @Test
    void testServiceBusQueue() {
        WorkflowAction action = sendAction();

        resolver.populateServiceBusParts(action, "sb://contoso.servicebus.windows.net/invoices-us");

        assertThat(action.getQueueOrTopicName()).isEqualTo("invoices-us");
        assertThat(action.getTopic()).isNull();
        assertThat(action.getSubscriptionName()).isNull();
    }

    @Test
    void testServiceBusAddressWithoutEntityLeavesActionUntouched() {
        WorkflowAction action = sendAction();

        resolver.populateServiceBusParts(action, "sb://contoso.servicebus.windows.net/");

        assertThat(action.getQueueOrTopicName()).isNull();
    }

    private static WorkflowAction sendAction() {
        return WorkflowAction.builder().name("Send").kind(ActionKind.SEND_CONNECTOR).build();
    }
}
