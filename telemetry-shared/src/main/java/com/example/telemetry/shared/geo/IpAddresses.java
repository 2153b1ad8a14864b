package com.example.telemetry.shared.geo;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * IP literal handling for the geo pipeline. Never performs DNS resolution.
 */
public final class IpAddresses {

    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})$");
    private static final Pattern IPV6 = Pattern.compile("^[0-9a-fA-F:.]+$");

    private IpAddresses() {}

    /**
     * Parses an IPv4 or IPv6 literal. Hostnames, zone ids and malformed input yield empty.
     */
    public static Optional<InetAddress> parseLiteral(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String candidate = raw.trim();
        if (candidate.startsWith("[") && candidate.endsWith("]")) {
            candidate = candidate.substring(1, candidate.length() - 1);
        }
        if (candidate.isEmpty()) {
            return Optional.empty();
        }

        Matcher ipv4 = IPV4.matcher(candidate);
        try {
            if (ipv4.matches()) {
                byte[] octets = new byte[4];
                for (int i = 0; i < 4; i++) {
                    int octet = Integer.parseInt(ipv4.group(i + 1));
                    if (octet > 255) {
                        return Optional.empty();
                    }
                    octets[i] = (byte) octet;
                }
                return Optional.of(InetAddress.getByAddress(octets));
            }
            // A literal containing ':' is parsed as IPv6 and never looked up
            if (candidate.indexOf(':') >= 0 && IPV6.matcher(candidate).matches()) {
                return Optional.of(InetAddress.getByName(candidate));
            }
        } catch (UnknownHostException | IllegalArgumentException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }

    /**
     * True for addresses a geo database cannot place: private, loopback, link-local, CGNAT,
     * unique-local, multicast, unspecified and reserved ranges.
     */
    public static boolean isNonPublic(InetAddress address) {
        if (address.isAnyLocalAddress() || address.isLoopbackAddress() || address.isLinkLocalAddress()
                || address.isSiteLocalAddress() || address.isMulticastAddress()) {
            return true;
        }
        byte[] bytes = address.getAddress();
        if (address instanceof Inet4Address) {
            int first = bytes[0] & 0xff;
            int second = bytes[1] & 0xff;
            return first == 0                                   // "this" network
                    || (first == 100 && (second & 0xc0) == 64)  // 100.64.0.0/10 CGNAT
                    || first >= 240;                            // reserved and broadcast
        }
        return (bytes[0] & 0xfe) == 0xfc;                       // fc00::/7 unique local
    }

    /**
     * Zeroes the host part: /24 for IPv4, /48 for IPv6.
     */
    public static InetAddress truncate(InetAddress address) {
        byte[] bytes = address.getAddress();
        int keep = address instanceof Inet4Address ? 3 : 6;
        for (int i = keep; i < bytes.length; i++) {
            bytes[i] = 0;
        }
        try {
            return InetAddress.getByAddress(bytes);
        } catch (UnknownHostException e) {
            // only thrown for an illegal array length, which cannot happen here
            throw new IllegalStateException(e);
        }
    }

    public static String hash(String value, String salt) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest((value + salt).getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Log-safe form of an address: last IPv4 octet or trailing IPv6 groups replaced.
     */
    public static String mask(String raw) {
        Optional<InetAddress> parsed = parseLiteral(raw);
        if (parsed.isEmpty()) {
            return "invalid";
        }
        String text = parsed.get().getHostAddress();
        if (parsed.get() instanceof Inet4Address) {
            return text.substring(0, text.lastIndexOf('.')) + ".xxx";
        }
        String[] groups = text.split(":");
        StringBuilder masked = new StringBuilder();
        for (int i = 0; i < Math.min(4, groups.length); i++) {
            masked.append(groups[i]).append(':');
        }
        return masked.append("xxxx").toString();
    }
}
