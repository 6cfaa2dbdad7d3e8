package com.netconfig.parser.address;

import java.util.Set;

import com.netconfig.parser.exception.InvalidQueryException;

import lombok.NonNull;
import lombok.Value;

/**
 * Addresses and networks found in one line of text. Immutable.
 */
@Value
public class AddressRecord {

    public static final AddressRecord EMPTY = new AddressRecord(Set.of(), Set.of());

    @NonNull
    Set<IpAddress> addresses;
    @NonNull
    Set<IpNetwork> networks;

    public AddressRecord(Set<IpAddress> addresses, Set<IpNetwork> networks) {
        this.addresses = Set.copyOf(addresses);
        this.networks = Set.copyOf(networks);
    }

    public boolean isEmpty() {
        return addresses.isEmpty() && networks.isEmpty();
    }

    /**
     * Test whether this record covers the query.
     *
     * <ul>
     *   <li>{@link IpAddress}: equal to a stored address or inside a stored network</li>
     *   <li>{@link IpNetwork}: equal to a stored network or containing a stored address</li>
     *   <li>{@link IpInterface}: its address or its network matches by the rules above</li>
     * </ul>
     *
     * Only values of the same IP version ever match.
     *
     * @throws InvalidQueryException for any other kind of query
     */
    public boolean hasAddress(Object query) {
        if (query instanceof IpAddress address) {
            return matchesAddress(address);
        }
        if (query instanceof IpNetwork network) {
            return matchesNetwork(network);
        }
        if (query instanceof IpInterface iface) {
            return matchesAddress(iface.getAddress()) || matchesNetwork(iface.getNetwork());
        }
        throw new InvalidQueryException("Unsupported address query type: "
                + (query == null ? "null" : query.getClass().getName())
                + "; expected IpAddress, IpNetwork or IpInterface");
    }

    private boolean matchesAddress(IpAddress address) {
        if (addresses.contains(address)) {
            return true;
        }
        return networks.stream().anyMatch(n -> n.contains(address));
    }

    private boolean matchesNetwork(IpNetwork network) {
        if (networks.contains(network)) {
            return true;
        }
        return addresses.stream().anyMatch(network::contains);
    }
}
