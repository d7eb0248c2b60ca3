/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.allocator;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * An IPv4 address range: a network address plus a prefix length.
 *
 * @param network the network address as an unsigned 32-bit value held in a long, host bits cleared
 * @param prefixLength prefix length, 0 to 32
 */
public record Cidr(long network, int prefixLength) {

    private static final Pattern IPV4_APPROXIMATE_PATTERN = Pattern.compile("(\\d{1,3}\\.){3}\\d{1,3}");
    private static final long ADDRESS_SPACE = 1L << 32;

    public Cidr {
        if (prefixLength < 0 || prefixLength > 32) {
            throw new IllegalArgumentException("prefix length out of range: " + prefixLength);
        }
        if (network < 0 || network >= ADDRESS_SPACE) {
            throw new IllegalArgumentException("network address out of range: " + network);
        }
        if ((network & ~mask(prefixLength)) != 0) {
            throw new IllegalArgumentException("network address has host bits set: " + network);
        }
    }

    /**
     * Parses {@code a.b.c.d/n}. Host bits in the address are cleared, so {@code 10.0.0.1/16} parses
     * as {@code 10.0.0.0/16}.
     *
     * @param text the range in CIDR notation
     * @return the range
     * @throws MalformedCidrException if the text is not an IPv4 range in CIDR notation
     */
    public static Cidr parse(String text) {
        if (text == null) {
            throw new MalformedCidrException("null is not a CIDR");
        }
        String[] parts = text.trim().split("/", -1);
        if (parts.length != 2) {
            throw new MalformedCidrException("'" + text + "' is not in CIDR notation");
        }
        if (!IPV4_APPROXIMATE_PATTERN.matcher(parts[0]).matches()) {
            throw new MalformedCidrException("'" + text + "' does not have an IPv4 address");
        }
        // out-of-range octets would otherwise be looked up as a host name
        for (String octet : parts[0].split("\\.")) {
            if (Integer.parseInt(octet) > 255) {
                throw new MalformedCidrException("'" + text + "' has an octet above 255");
            }
        }
        int prefix;
        try {
            prefix = Integer.parseInt(parts[1]);
        }
        catch (NumberFormatException e) {
            throw new MalformedCidrException("'" + text + "' does not have a numeric prefix length", e);
        }
        if (prefix < 0 || prefix > 32) {
            throw new MalformedCidrException("'" + text + "' has a prefix length outside 0-32");
        }
        long address;
        try {
            InetAddress inetAddress = InetAddress.getByName(parts[0]);
            if (!(inetAddress instanceof Inet4Address)) {
                throw new MalformedCidrException("'" + text + "' does not have an IPv4 address");
            }
            address = toLong(inetAddress.getAddress());
        }
        catch (UnknownHostException e) {
            throw new MalformedCidrException("'" + text + "' does not have a valid IPv4 address", e);
        }
        return new Cidr(address & mask(prefix), prefix);
    }

    /**
     * @return the number of addresses in the range
     */
    public long size() {
        return 1L << (32 - prefixLength);
    }

    public long firstAddress() {
        return network;
    }

    public long lastAddress() {
        return network + size() - 1;
    }

    public boolean overlaps(Cidr other) {
        return firstAddress() <= other.lastAddress() && other.firstAddress() <= lastAddress();
    }

    @Override
    public String toString() {
        return ((network >> 24) & 0xff) + "." + ((network >> 16) & 0xff) + "." + ((network >> 8) & 0xff) + "." + (network & 0xff) + "/" + prefixLength;
    }

    private static long mask(int prefixLength) {
        return prefixLength == 0 ? 0L : (ADDRESS_SPACE - 1) & ~((1L << (32 - prefixLength)) - 1);
    }

    private static long toLong(byte[] octets) {
        long value = 0;
        for (byte octet : octets) {
            value = (value << 8) | (octet & 0xff);
        }
        return value;
    }
}
