package com.netconfig.parser.address;

import com.netconfig.parser.exception.InvalidQueryException;

import lombok.experimental.UtilityClass;

/**
 * Turns user-supplied text into an address query.
 */
@UtilityClass
public class IpQueries {

    /**
     * {@code 192.0.2.1} becomes an {@link IpAddress}; {@code 192.0.2.1/30} or
     * {@code 192.0.2.1/255.255.255.252} becomes an {@link IpInterface}.
     *
     * @throws InvalidQueryException if the text is not an address literal
     */
    public static Object parse(String text) {
        String trimmed = text == null ? "" : text.strip();
        try {
            if (trimmed.contains("/")) {
                return IpInterface.parse(trimmed);
            }
            return IpAddress.parse(trimmed);
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException("Not an IP address or prefix: '" + text + "'", e);
        }
    }
}
