package com.netconfig.parser.address;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.experimental.UtilityClass;

/**
 * Scans a line of text for embedded IPv4/IPv6 addresses and networks.
 *
 * The scan walks the text left to right. From the scan position each form looks for its next
 * candidate; the earliest candidate position is tried form by form in {@link AddressForm}
 * order and the first one that converts is accepted. Scanning resumes after it. If no form
 * converts at that position the rest of the line is not scanned. Text that looks like an
 * address but fails validation is simply not an address.
 */
@UtilityClass
public class AddressExtractor {
    private static final Logger log = LoggerFactory.getLogger(AddressExtractor.class);

    private static final String V4 = "(?:\\d{1,3}\\.){3}\\d{1,3}";
    private static final String V4_START = "(?<![\\d.])";
    private static final String V4_END = "(?!\\.?\\d)";
    private static final String V6 = "((?:[0-9A-Fa-f]{0,4}:){2,7}(?:" + V4 + "|[0-9A-Fa-f]{1,4})?)";
    private static final String V6_START = "(?<![0-9A-Fa-f:.])";
    private static final String V6_END = "(?![0-9A-Fa-f:]|\\.\\d)";

    /** A line that is nothing but an OID-like dotted number run carries no addresses. */
    private static final Pattern OID_PATTERN = Pattern.compile("(?:\\d+\\.){4,}");

    /**
     * Address shapes in priority order.
     */
    enum AddressForm {
        IPV6_NETWORK(V6_START + V6 + "/(\\d{1,3})(?!\\d)"),
        IPV6_ADDRESS(V6_START + V6 + V6_END),
        IPV4_CIDR(V4_START + "(" + V4 + ")/(\\d{1,3})(?!\\d)"),
        IPV4_MASKED(V4_START + "(" + V4 + ")\\s+(" + V4 + ")" + V4_END),
        IPV4_ADDRESS(V4_START + "(" + V4 + ")" + V4_END);

        private final Pattern pattern;

        AddressForm(String regex) {
            this.pattern = Pattern.compile(regex);
        }

        Pattern pattern() {
            return pattern;
        }
    }

    private record Found(int end, IpAddress address, IpNetwork network) {
    }

    /**
     * Extract every address and network from {@code text}.
     */
    public static AddressRecord extract(String text) {
        if (text == null || text.isBlank() || OID_PATTERN.matcher(text.strip()).matches()) {
            return AddressRecord.EMPTY;
        }

        Set<IpAddress> addresses = new HashSet<>();
        Set<IpNetwork> networks = new HashSet<>();
        AddressForm[] forms = AddressForm.values();
        Matcher[] matchers = new Matcher[forms.length];
        int pos = 0;
        while (pos < text.length()) {
            int position = -1;
            for (int i = 0; i < forms.length; i++) {
                Matcher matcher = forms[i].pattern().matcher(text);
                matchers[i] = matcher.find(pos) ? matcher : null;
                if (matchers[i] != null && (position < 0 || matcher.start() < position)) {
                    position = matcher.start();
                }
            }
            if (position < 0) {
                break;
            }

            Found best = null;
            for (int i = 0; i < forms.length && best == null; i++) {
                if (matchers[i] != null && matchers[i].start() == position) {
                    best = convert(forms[i], matchers[i]).orElse(null);
                }
            }
            if (best == null) {
                log.debug("No address form converts at offset {} of '{}'", position, text);
                break;
            }
            addresses.add(best.address());
            if (best.network() != null) {
                networks.add(best.network());
            }
            pos = best.end();
        }

        if (addresses.isEmpty() && networks.isEmpty()) {
            return AddressRecord.EMPTY;
        }
        return new AddressRecord(addresses, networks);
    }

    private static Optional<Found> convert(AddressForm form, Matcher matcher) {
        try {
            return Optional.of(switch (form) {
                case IPV6_NETWORK, IPV4_CIDR -> {
                    IpInterface iface = IpInterface.of(
                            IpAddress.parse(matcher.group(1)), Integer.parseInt(matcher.group(2)));
                    yield new Found(matcher.end(), iface.getAddress(), iface.getNetwork());
                }
                case IPV4_MASKED -> {
                    IpInterface iface = IpInterface.parse(matcher.group(1) + "/" + matcher.group(2));
                    yield new Found(matcher.end(), iface.getAddress(), iface.getNetwork());
                }
                case IPV6_ADDRESS, IPV4_ADDRESS -> new Found(
                        matcher.end(), IpAddress.parse(matcher.group(1)), null);
            });
        } catch (IllegalArgumentException e) {
            log.debug("'{}' looks like {} but is not: {}", matcher.group(), form, e.getMessage());
            return Optional.empty();
        }
    }
}
