package com.example.telemetry.shared.geo;

import org.junit.jupiter.api.Test;

import java.net.InetAddress;

import static org.assertj.core.api.Assertions.assertThat;

class IpAddressesTest {

    @Test
    void parsesIpv4AndIpv6Literals() {
        assertThat(IpAddresses.parseLiteral("8.8.8.8")).get().extracting(InetAddress::getHostAddress).isEqualTo("8.8.8.8");
        assertThat(IpAddresses.parseLiteral(" 2001:4860:4860::8888 ")).isPresent();
        assertThat(IpAddresses.parseLiteral("[2001:db8::1]")).isPresent();
    }

    @Test
    void rejectsHostnamesAndMalformedInput() {
        assertThat(IpAddresses.parseLiteral("example.com")).isEmpty();
        assertThat(IpAddresses.parseLiteral("localhost")).isEmpty();
        assertThat(IpAddresses.parseLiteral("256.1.1.1")).isEmpty();
        assertThat(IpAddresses.parseLiteral("1.2.3")).isEmpty();
        assertThat(IpAddresses.parseLiteral("")).isEmpty();
        assertThat(IpAddresses.parseLiteral(null)).isEmpty();
    }

    @Test
    void classifiesNonPublicRanges() {
        for (String ip : new String[] {"10.1.2.3", "172.16.0.1", "192.168.1.1", "127.0.0.1", "169.254.1.1",
                "100.64.0.1", "0.0.0.0", "240.0.0.1", "::1", "fd00::1", "fe80::1", "224.0.0.1"}) {
            assertThat(IpAddresses.isNonPublic(IpAddresses.parseLiteral(ip).orElseThrow())).as(ip).isTrue();
        }
        assertThat(IpAddresses.isNonPublic(IpAddresses.parseLiteral("8.8.8.8").orElseThrow())).isFalse();
        assertThat(IpAddresses.isNonPublic(IpAddresses.parseLiteral("100.128.0.1").orElseThrow())).isFalse();
    }

    @Test
    void truncatesHostBits() {
        assertThat(IpAddresses.truncate(IpAddresses.parseLiteral("203.0.113.77").orElseThrow()).getHostAddress())
                .isEqualTo("203.0.113.0");
        assertThat(IpAddresses.truncate(IpAddresses.parseLiteral("2001:db8:abcd:1234::1").orElseThrow()).getHostAddress())
                .isEqualTo("2001:db8:abcd:0:0:0:0:0");
    }

    @Test
    void hashIsSaltedAndStable() {
        String first = IpAddresses.hash("8.8.8.8", "salt-a");

        assertThat(first).hasSize(64).isEqualTo(IpAddresses.hash("8.8.8.8", "salt-a"));
        assertThat(first).isNotEqualTo(IpAddresses.hash("8.8.8.8", "salt-b"));
    }

    @Test
    void masksForLogs() {
        assertThat(IpAddresses.mask("203.0.113.77")).isEqualTo("203.0.113.xxx");
        assertThat(IpAddresses.mask("not-an-ip")).isEqualTo("invalid");
    }
}
