package com.whereq.vigil.parser;

import com.whereq.vigil.model.report.Host;
import com.whereq.vigil.model.report.Port;
import com.whereq.vigil.model.report.RunStats;
import com.whereq.vigil.model.report.ScanResult;
import com.whereq.vigil.support.Reports;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NmapReportParserTest {

    private final NmapReportParser parser = new NmapReportParser();

    @Test
    void extractsHostAndOpenPort() {
        String xml = """
            <nmaprun scanner="nmap" args="nmap -sV 10.0.0.5">
              <host>
                <status state="up"/>
                <address addr="10.0.0.5" addrtype="ipv4"/>
                <ports>
                  <port protocol="tcp" portid="22">
                    <state state="open" reason="syn-ack"/>
                    <service name="ssh" product="OpenSSH" version="9.6"/>
                  </port>
                </ports>
              </host>
            </nmaprun>
            """;

        ScanResult result = parser.parse(xml);

        assertThat(result.hasError()).isFalse();
        assertThat(result.getHosts()).hasSize(1);
        Host host = result.getHosts().get(0);
        assertThat(host.getIp()).isEqualTo("10.0.0.5");
        assertThat(host.getStatus()).isEqualTo("up");

        Port port = host.getPorts().get(0);
        assertThat(port.getState()).isEqualTo("open");
        assertThat(port.getPortId()).isEqualTo(22);
        assertThat(port.getProtocol()).isEqualTo("tcp");
        assertThat(port.getService()).isEqualTo("ssh");
        assertThat(port.getVersionInfo()).isEqualTo("OpenSSH 9.6");
        assertThat(result.getScanInfo().attribute("args")).contains("nmap -sV 10.0.0.5");
    }

    @Test
    void versionStringOmitsSeparatorWhenOnePartIsMissing() {
        ScanResult result = parser.parse(Reports.singleHost());
        Host host = result.getHosts().get(0);

        assertThat(host.getPorts()).extracting(Port::getVersionInfo)
            .containsExactly("OpenSSH 8.9p1", "nginx", "1.2");
        assertThat(NmapReportParser.joinVersion(null, null)).isNull();
    }

    @Test
    void separatesAddressesAndHostnames() {
        Host host = parser.parse(Reports.singleHost()).getHosts().get(0);

        assertThat(host.getIp()).isEqualTo("192.168.1.10");
        assertThat(host.getMac()).isEqualTo("AA:BB:CC:DD:EE:FF");
        assertThat(host.getAddresses()).hasSize(2);
        assertThat(host.getAddresses().get(1).getVendor()).isEqualTo("Acme Networks");
        assertThat(host.getHostname()).isEqualTo("router.local");
        assertThat(host.getHostnames()).hasSize(2);
    }

    @Test
    void firstOsMatchIsTheRepresentativeOs() {
        Host host = parser.parse(Reports.singleHost()).getHosts().get(0);

        assertThat(host.getOsMatches()).hasSize(2);
        assertThat(host.getOs().getName()).isEqualTo("Linux 5.0 - 5.14");
        assertThat(host.getOs().getAccuracy()).isEqualTo(98);
        assertThat(host.getOsMatches().get(1).getClasses()).hasSize(2);
        assertThat(host.getOsMatches().get(1).getClasses().get(0).getVendor()).isEqualTo("MikroTik");
    }

    @Test
    void capturesPortDetailsAndScripts() {
        Port ssh = parser.parse(Reports.singleHost()).getHosts().get(0).getPorts().get(0);

        assertThat(ssh.getExtraInfo()).isEqualTo("Ubuntu Linux; protocol 2.0");
        assertThat(ssh.getOsType()).isEqualTo("Linux");
        assertThat(ssh.getScripts()).hasSize(1);
        assertThat(ssh.getScripts().get(0).getId()).isEqualTo("ssh-hostkey");
    }

    @Test
    void capturesUptimeDistanceAndTrace() {
        Host host = parser.parse(Reports.singleHost()).getHosts().get(0);

        assertThat(host.getUptime().getSeconds()).isEqualTo(86400L);
        assertThat(host.getDistance()).isEqualTo(1);
        assertThat(host.getTrace().getHops()).hasSize(1);
        assertThat(host.getTrace().getHops().get(0).getRtt()).isEqualTo(0.52);
    }

    @Test
    void hostWithoutOptionalSectionsHasEmptyOptionals() {
        Host down = parser.parse(Reports.singleHost()).getHosts().get(1);

        assertThat(down.getStatus()).isEqualTo("down");
        assertThat(down.getPorts()).isEmpty();
        assertThat(down.findOs()).isEmpty();
        assertThat(down.findMac()).isEmpty();
        assertThat(down.findHostname()).isEmpty();
        assertThat(down.findTrace()).isEmpty();
    }

    @Test
    void aggregatesRunStatsSeparately() {
        ScanResult result = parser.parse(Reports.singleHost());

        RunStats stats = result.getScanInfo().findRunStats().orElseThrow();
        assertThat(stats.getElapsedSeconds()).isEqualTo(42.10);
        assertThat(stats.getHostsUp()).isEqualTo(1);
        assertThat(stats.getHostsDown()).isEqualTo(1);
        assertThat(stats.getHostsTotal()).isEqualTo(2);
        assertThat(result.getScanInfo().attribute("version")).contains("7.94");
    }

    @Test
    void malformedInputYieldsErrorTaggedEmptyResult() {
        ScanResult result = parser.parse("<nmaprun><host><status state=\"up\"></host>");

        assertThat(result.hasError()).isTrue();
        assertThat(result.getError()).isNotBlank();
        assertThat(result.getHosts()).isEmpty();
    }

    @Test
    void emptyAndNonXmlInputNeverThrow() {
        assertThat(parser.parse("").getError()).isEqualTo("Empty scan report");
        assertThat(parser.parse(null).hasError()).isTrue();
        assertThat(parser.parse("Starting Nmap 7.94 ( https://nmap.org )").hasError()).isTrue();
    }

    @Test
    void acceptsNmapDoctypeButNeverResolvesExternalEntities() {
        String xml = """
            <?xml version="1.0"?>
            <!DOCTYPE nmaprun [<!ENTITY xxe SYSTEM "file:///etc/passwd">]>
            <nmaprun><host><address addr="&xxe;" addrtype="ipv4"/></host></nmaprun>
            """;

        ScanResult result = parser.parse(xml);

        assertThat(result.getHosts())
            .extracting(Host::getIp)
            .noneMatch(ip -> ip != null && ip.contains("root:"));
    }
}
