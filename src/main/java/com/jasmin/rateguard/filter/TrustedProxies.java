package com.jasmin.rateguard.filter;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;

/**
 * Addresses and CIDR blocks of the reverse proxies whose forwarding headers are believed.
 * Entries without a prefix length match a single address.
 */
class TrustedProxies {

    private final List<Network> networks = new ArrayList<>();

    TrustedProxies(List<String> entries) {
        for (String entry : entries) {
            networks.add(Network.parse(entry.trim()));
        }
    }

    boolean isEmpty() {
        return networks.isEmpty();
    }

    boolean contains(String address) {
        if (address == null || !isIpLiteral(address)) {
            return false;
        }
        byte[] bytes;
        try {
            bytes = InetAddress.getByName(address).getAddress();
        } catch (UnknownHostException e) {
            return false;
        }
        for (Network network : networks) {
            if (network.matches(bytes)) {
                return true;
            }
        }
        return false;
    }

    /** Rejects host names so that matching never triggers a DNS lookup. */
    private static boolean isIpLiteral(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (char c : s.toCharArray()) {
            if (Character.digit(c, 16) < 0 && c != '.' && c != ':') {
                return false;
            }
        }
        return true;
    }

    private static final class Network {
        private final byte[] address;
        private final int prefixLength;

        private Network(byte[] address, int prefixLength) {
            this.address = address;
            this.prefixLength = prefixLength;
        }

        static Network parse(String cidr) {
            String[] parts = cidr.split("/", 2);
            if (!isIpLiteral(parts[0])) {
                throw new IllegalArgumentException("Invalid trusted proxy address: " + cidr);
            }
            byte[] address;
            try {
                address = InetAddress.getByName(parts[0]).getAddress();
            } catch (UnknownHostException e) {
                throw new IllegalArgumentException("Invalid trusted proxy address: " + cidr, e);
            }

            int maxPrefix = address.length * 8;
            int prefixLength = maxPrefix;
            if (parts.length == 2) {
                try {
                    prefixLength = Integer.parseInt(parts[1]);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid prefix length in " + cidr, e);
                }
                if (prefixLength < 0 || prefixLength > maxPrefix) {
                    throw new IllegalArgumentException("Prefix length out of range in " + cidr);
                }
            }
            return new Network(address, prefixLength);
        }

        boolean matches(byte[] candidate) {
            if (candidate.length != address.length) {
                return false;
            }
            int fullBytes = prefixLength / 8;
            for (int i = 0; i < fullBytes; i++) {
                if (candidate[i] != address[i]) {
                    return false;
                }
            }
            int remainingBits = prefixLength % 8;
            if (remainingBits == 0) {
                return true;
            }
            int mask = (0xFF << (8 - remainingBits)) & 0xFF;
            return (candidate[fullBytes] & mask) == (address[fullBytes] & mask);
        }
    }
}
