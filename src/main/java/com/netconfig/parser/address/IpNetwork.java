package com.netconfig.parser.address;

import java.util.Arrays;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * An IP network: a network address with its host bits cleared plus a prefix length.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class IpNetwork {
    @NonNull
    IpAddress networkAddress;
    int prefixLength;

    /**
     * Build the network containing {@code address}. Host bits are cleared.
     *
     * @throws IllegalArgumentException if the prefix length is out of range for the address version
     */
    public static IpNetwork of(IpAddress address, int prefixLength) {
        int bits = address.getVersion().getBitLength();
        if (prefixLength < 0 || prefixLength > bits) {
            throw new IllegalArgumentException("Prefix length " + prefixLength + " out of range for " + address);
        }
        return new IpNetwork(IpAddress.fromBytes(mask(address.toBytes(), prefixLength)), prefixLength);
    }

    /**
     * Parse {@code address/prefix} or {@code address/dotted-mask}, ignoring host bits.
     */
    public static IpNetwork parse(String text) {
        return IpInterface.parse(text).getNetwork();
    }

    public IpVersion getVersion() {
        return networkAddress.getVersion();
    }

    /**
     * True if the address has the same version and shares this network's prefix.
     */
    public boolean contains(IpAddress address) {
        if (address.getVersion() != getVersion()) {
            return false;
        }
        byte[] masked = mask(address.toBytes(), prefixLength);
        return Arrays.equals(masked, networkAddress.toBytes());
    }

    /**
     * Convert a dotted mask to a prefix length. Netmasks ({@code 255.255.255.0}) are tried first,
     * then host masks ({@code 0.0.0.255}).
     *
     * @throws IllegalArgumentException if the mask is neither
     */
    public static int prefixFromMask(IpAddress mask) {
        byte[] bytes = mask.toBytes();
        int netmaskPrefix = leadingOnes(bytes);
        if (netmaskPrefix >= 0) {
            return netmaskPrefix;
        }
        byte[] inverted = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            inverted[i] = (byte) ~bytes[i];
        }
        int hostmaskPrefix = leadingOnes(inverted);
        if (hostmaskPrefix >= 0) {
            return hostmaskPrefix;
        }
        throw new IllegalArgumentException(mask + " is not a valid netmask");
    }

    // Number of leading one bits, or -1 when a one follows a zero.
    private static int leadingOnes(byte[] bytes) {
        int ones = 0;
        boolean seenZero = false;
        for (byte b : bytes) {
            for (int bit = 7; bit >= 0; bit--) {
                boolean set = ((b >> bit) & 1) == 1;
                if (set && seenZero) {
                    return -1;
                }
                if (set) {
                    ones++;
                } else {
                    seenZero = true;
                }
            }
        }
        return ones;
    }

    private static byte[] mask(byte[] bytes, int prefixLength) {
        byte[] masked = bytes.clone();
        for (int i = 0; i < masked.length; i++) {
            int bitsInByte = Math.max(0, Math.min(8, prefixLength - i * 8));
            int byteMask = bitsInByte == 0 ? 0 : (0xFF << (8 - bitsInByte)) & 0xFF;
            masked[i] = (byte) (masked[i] & byteMask);
        }
        return masked;
    }

    @Override
    public String toString() {
        return networkAddress + "/" + prefixLength;
    }
}
