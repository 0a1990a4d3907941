package com.integration.migrator.binding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.integration.migrator.support.TestResources;

/**
 * Unit tests for BindingParser.
 */
class BindingParserTest {

    private final BindingParser parser = new BindingParser();

    @Test
    void testParseReceiveLocations() {
        BindingSnapshot snapshot = parser.parse(TestResources.read(TestResources.ORDER_ROUTING_BINDINGS));

        assertThat(snapshot.getReceiveLocations()).extracting(ReceiveLocationBinding::getName)
                .containsExactly("RL_Orders_File", "RL_Orders_Http");

        ReceiveLocationBinding file = snapshot.getReceiveLocations().get(0);
        assertThat(file.getReceivePortName()).isEqualTo("RP_Orders");
        assertThat(file.getTransportType()).isEqualTo("FILE");
        assertThat(file.getAddress()).isEqualTo("C:\\in\\orders\\*.xml");
        assertThat(file.isEnabled()).isTrue();
        assertThat(file.getReceivePipelineName()).isEqualTo("Microsoft.BizTalk.DefaultPipelines.XMLReceive");
        assertThat(file.getFolderPath()).isEqualTo("C:\\in\\orders");
        assertThat(file.getFileMask()).isEqualTo("*.xml");
        assertThat(file.getPollingIntervalSeconds()).isEqualTo(120);

        ReceiveLocationBinding http = snapshot.getReceiveLocations().get(1);
        assertThat(http.isEnabled()).isFalse();
        assertThat(http.getTransportType()).isEqualTo("WCF-BasicHttp");
        assertThat(http.getPollingIntervalSeconds()).isNull();
    }

    @Test
    void testParseSendPortsWithTransformsAndFilters() {
        BindingSnapshot snapshot = parser.parse(TestResources.read(TestResources.ORDER_ROUTING_BINDINGS));

        assertThat(snapshot.getSendPorts()).extracting(SendPortBinding::getName)
                .containsExactly("SP_Invoices_EU", "SP_Invoices_US", "SP_Audit", "SP_Legacy_Ftp");

        SendPortBinding eu = snapshot.findSendPort("sp_invoices_eu").orElseThrow();
        assertThat(eu.getTransportType()).isEqualTo("FILE");
        assertThat(eu.getAddress()).isEqualTo("C:\\out\\eu\\%MessageID%.xml");
        assertThat(eu.getUserName()).isEqualTo("svc_eu");
        assertThat(eu.getSendPipelineName()).isEqualTo("Microsoft.BizTalk.DefaultPipelines.XMLTransmit");
        assertThat(eu.getTransforms()).extracting(TransformReference::getShortName).containsExactly("Invoice_To_EU");
        assertThat(eu.routingFilter()).hasValueSatisfying(f -> {
            assertThat(f.getProperty()).isEqualTo("Contoso.Schemas.Region");
            assertThat(f.getValue()).isEqualTo("EU");
        });

        SendPortBinding audit = snapshot.findSendPort("SP_Audit").orElseThrow();
        assertThat(audit.routingFilter()).isEmpty();
        assertThat(audit.subscribedReceivePort()).hasValue("RP_Orders");

        assertThat(snapshot.findSendPort("SP_Legacy_Ftp").orElseThrow().getFilters()).isEmpty();
    }

    @Test
    void testDetectContentBasedRouting() {
        BindingSnapshot snapshot = parser.parse(TestResources.read(TestResources.ORDER_ROUTING_BINDINGS));

        assertThat(snapshot.detectContentBasedRouting()).singleElement().satisfies(group -> {
            assertThat(group.getRoutingProperty()).isEqualTo("Contoso.Schemas.Region");
            assertThat(group.getPropertyShortName()).isEqualTo("Region");
            assertThat(group.getRoutesByValue()).containsOnlyKeys("EU", "US");
        });
        assertThat(snapshot.sendPortsForReceivePort("RP_Orders")).extracting(SendPortBinding::getName)
                .containsExactly("SP_Audit");
    }

    @Test
    void testPreferredReceiveLocation() {
        BindingSnapshot snapshot = parser.parse(TestResources.read(TestResources.ORDER_ROUTING_BINDINGS));

        assertThat(snapshot.preferredReceiveLocation("RP_Orders")).map(ReceiveLocationBinding::getName)
                .hasValue("RL_Orders_File");
        assertThat(snapshot.preferredReceiveLocation("Unknown")).map(ReceiveLocationBinding::getName)
                .hasValue("RL_Orders_File");
        assertThat(BindingSnapshot.empty().preferredReceiveLocation("RP_Orders")).isEmpty();
    }

    @Test
    void testHostAppsSubtypeFromAssemblyMappings() {
        String xml = """
                <BindingInfo>
                  <SendPortCollection>
                    <SendPort Name="SP_Mainframe">
                      <PrimaryTransport>
                        <Address>HostApps://mainframe</Address>
                        <TransportType Name="HostApps" />
                        <TransportTypeData>&lt;CustomProps&gt;&lt;AssemblyMappings vt="8"&gt;&amp;lt;mappings&amp;gt;&amp;lt;mapping&amp;gt;&amp;lt;assembly&amp;gt;C:\\\\ti\\\\CicsAccounts.dll&amp;lt;/assembly&amp;gt;&amp;lt;connectionString&amp;gt;Host=zos1&amp;lt;/connectionString&amp;gt;&amp;lt;/mapping&amp;gt;&amp;lt;/mappings&amp;gt;&lt;/AssemblyMappings&gt;&lt;/CustomProps&gt;</TransportTypeData>
                      </PrimaryTransport>
                    </SendPort>
                  </SendPortCollection>
                </BindingInfo>
                """;

        SendPortBinding port = parser.parse(xml).getSendPorts().get(0);

        assertThat(port.getHostAppsSubtype()).isEqualTo("Cics");
        assertThat(port.getConnectionString()).isEqualTo("Host=zos1");
    }

    @Test
    void testUnreadableNestedSettingsAreSkipped() {
        String xml = """
                <BindingInfo>
                  <ReceivePortCollection>
                    <ReceivePort Name="RP">
                      <ReceiveLocations>
                        <ReceiveLocation Name="RL">
                          <Address>/tmp/in/*.csv</Address>
                          <ReceiveLocationTransportType Name="FILE" />
                          <ReceiveLocationTransportTypeData>&lt;CustomProps&gt;&lt;broken</ReceiveLocationTransportTypeData>
                          <Enable>true</Enable>
                        </ReceiveLocation>
                      </ReceiveLocations>
                    </ReceivePort>
                  </ReceivePortCollection>
                </BindingInfo>
                """;

        ReceiveLocationBinding location = parser.parse(xml).getReceiveLocations().get(0);

        assertThat(location.getFolderPath()).isEqualTo("/tmp/in");
        assertThat(location.getFileMask()).isEqualTo("*.csv");
        assertThat(location.getPollingIntervalSeconds()).isNull();
    }

    @Test
    void testMalformedBindingFileThrows() {
        assertThatThrownBy(() -> parser.parse("<BindingInfo><SendPort>"))
                .isInstanceOf(BindingParseException.class)
                .hasMessageContaining("not well-formed");
    }

    @Test
    void testParseFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("bindings.xml");
        Files.writeString(file, TestResources.read(TestResources.ORDER_ROUTING_BINDINGS));

        assertThat(parser.parseFile(file).getSendPorts()).hasSize(4);
    }

    @Test
    void testAddressHelpers() {
        assertThat(BindingParser.extractFolder("C:\\drop\\*.xml")).isEqualTo("C:\\drop");
        assertThat(BindingParser.extractMask("C:\\drop\\*.xml")).isEqualTo("*.xml");
        assertThat(BindingParser.extractMask("C:\\drop\\file.xml")).isNull();
        assertThat(BindingParser.extractFolder(null)).isNull();
        assertThat(BindingParser.unescape("&lt;a b=&quot;1&quot;/&gt;")).isEqualTo("<a b=\"1\"/>");
    }
}
