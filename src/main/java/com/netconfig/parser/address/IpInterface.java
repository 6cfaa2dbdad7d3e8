package com.netconfig.parser.address;

import lombok.NonNull;
import lombok.Value;

/**
 * An address together with the network it was configured on, e.g. {@code 192.0.2.1/30}.
 */
@Value
public class IpInterface {
    @NonNull
    IpAddress address;
    @NonNull
    IpNetwork network;

    public static IpInterface of(IpAddress address, int prefixLength) {
        return new IpInterface(address, IpNetwork.of(address, prefixLength));
    }

    /**
     * Parse {@code address/prefix} or {@code address/dotted-mask}.
     *
     * @throws IllegalArgumentException on a malformed address, prefix or mask
     */
    public static IpInterface parse(String text) {
        int slash = text.indexOf('/');
        if (slash < 0) {
            throw new IllegalArgumentException("Missing prefix length in '" + text + "'");
        }
        IpAddress address = IpAddress.parse(text.substring(0, slash));
        String suffix = text.substring(slash + 1);
        int prefixLength;
        if (!suffix.isEmpty() && suffix.chars().allMatch(Character::isDigit)) {
            if (suffix.length() > 3) {
                throw new IllegalArgumentException("Prefix length too long in '" + text + "'");
            }
            prefixLength = Integer.parseInt(suffix);
        } else {
            IpAddress mask = IpAddress.parse(suffix);
            if (mask.getVersion() != address.getVersion() || address.getVersion() != IpVersion.V4) {
                throw new IllegalArgumentException("Dotted masks are only valid for IPv4: '" + text + "'");
            }
            prefixLength = IpNetwork.prefixFromMask(mask);
        }
        return of(address, prefixLength);
    }

    public IpVersion getVersion() {
        return address.getVersion();
    }

    @Override
    public String toString() {
        return address + "/" + network.getPrefixLength();
    }
}
