package com.netconfig.parser.address;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;

import com.google.common.net.InetAddresses;

import lombok.NonNull;
import lombok.Value;

/**
 * A single IPv4 or IPv6 address.
 */
@Value
public class IpAddress {
    @NonNull
    InetAddress inetAddress;

    /**
     * Parse a literal address. Never performs a name lookup. IPv4-mapped IPv6 text such as
     * {@code ::ffff:192.0.2.1} stays an IPv6 address.
     *
     * @throws IllegalArgumentException if the text is not an IP literal
     */
    public static IpAddress parse(String text) {
        InetAddress parsed = InetAddresses.forString(text);
        if (parsed instanceof Inet4Address && text.indexOf(':') >= 0) {
            return fromBytes(toMappedBytes(parsed.getAddress()));
        }
        return new IpAddress(parsed);
    }

    static IpAddress fromBytes(byte[] bytes) {
        try {
            if (bytes.length == 16) {
                // getByAddress(byte[]) would turn ::ffff:a.b.c.d into an Inet4Address
                return new IpAddress(Inet6Address.getByAddress(null, bytes, -1));
            }
            return new IpAddress(InetAddress.getByAddress(bytes));
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Address must be 4 or 16 bytes, got " + bytes.length, e);
        }
    }

    private static byte[] toMappedBytes(byte[] v4) {
        byte[] mapped = new byte[16];
        mapped[10] = (byte) 0xff;
        mapped[11] = (byte) 0xff;
        System.arraycopy(v4, 0, mapped, 12, 4);
        return mapped;
    }

    public IpVersion getVersion() {
        return inetAddress instanceof Inet4Address ? IpVersion.V4 : IpVersion.V6;
    }

    public byte[] toBytes() {
        return inetAddress.getAddress();
    }

    @Override
    public String toString() {
        return InetAddresses.toAddrString(inetAddress);
    }
}
