package com.netconfig.parser.address;

/**
 * IP protocol version of an address value.
 */
public enum IpVersion {
    V4(32),
    V6(128);

    private final int bitLength;

    IpVersion(int bitLength) {
        this.bitLength = bitLength;
    }

    public int getBitLength() {
        return bitLength;
    }
}
