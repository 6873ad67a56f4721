package com.clapgrow.tracking.common.privacy;

/**
 * Reduces a client address to a network prefix before it is stored or published.
 *
 * <ul>
 *   <li>IPv4: last octet zeroed ({@code 203.0.113.77 -> 203.0.113.0})</li>
 *   <li>IPv6: first three hextets kept, i.e. a /48 ({@code 2001:db8:85a3:8d3::1 -> 2001:db8:85a3::})</li>
 * </ul>
 *
 * Anything that does not parse as an address is dropped (returns {@code null}).
 * Truncating an already truncated address returns it unchanged.
 */
public final class IpAddressTruncator {

    private IpAddressTruncator() {
    }

    public static String truncate(String address) {
        if (address == null) {
            return null;
        }
        String value = address.trim();
        if (value.isEmpty()) {
            return null;
        }
        // X-Forwarded-For style lists: first hop is the client
        int comma = value.indexOf(',');
        if (comma >= 0) {
            value = value.substring(0, comma).trim();
        }
        if (value.regionMatches(true, 0, "::ffff:", 0, 7) && value.indexOf('.') > 0) {
            return truncateIpv4(value.substring(7));
        }
        if (value.indexOf(':') >= 0) {
            return truncateIpv6(value);
        }
        return truncateIpv4(value);
    }

    private static String truncateIpv4(String value) {
        String[] octets = value.split("\\.", -1);
        if (octets.length != 4) {
            return null;
        }
        for (int i = 0; i < 3; i++) {
            if (!isOctet(octets[i])) {
                return null;
            }
        }
        if (!isOctet(octets[3])) {
            return null;
        }
        return Integer.parseInt(octets[0]) + "." + Integer.parseInt(octets[1]) + "."
            + Integer.parseInt(octets[2]) + ".0";
    }

    private static boolean isOctet(String part) {
        if (part.isEmpty() || part.length() > 3) {
            return false;
        }
        for (int i = 0; i < part.length(); i++) {
            if (!Character.isDigit(part.charAt(i))) {
                return false;
            }
        }
        return Integer.parseInt(part) <= 255;
    }

    private static String truncateIpv6(String value) {
        int zone = value.indexOf('%');
        if (zone >= 0) {
            value = value.substring(0, zone);
        }
        String[] hextets = expandIpv6(value);
        if (hextets == null) {
            return null;
        }
        return hextets[0] + ":" + hextets[1] + ":" + hextets[2] + "::";
    }

    private static String[] expandIpv6(String value) {
        int doubleColon = value.indexOf("::");
        if (doubleColon != value.lastIndexOf("::")) {
            return null;
        }
        String[] result = new String[8];
        if (doubleColon >= 0) {
            String head = value.substring(0, doubleColon);
            String tail = value.substring(doubleColon + 2);
            String[] headParts = head.isEmpty() ? new String[0] : head.split(":", -1);
            String[] tailParts = tail.isEmpty() ? new String[0] : tail.split(":", -1);
            if (headParts.length + tailParts.length > 7) {
                return null;
            }
            for (int i = 0; i < 8; i++) {
                result[i] = "0";
            }
            for (int i = 0; i < headParts.length; i++) {
                result[i] = normalizeHextet(headParts[i]);
            }
            for (int i = 0; i < tailParts.length; i++) {
                result[8 - tailParts.length + i] = normalizeHextet(tailParts[i]);
            }
        } else {
            String[] parts = value.split(":", -1);
            if (parts.length != 8) {
                return null;
            }
            for (int i = 0; i < 8; i++) {
                result[i] = normalizeHextet(parts[i]);
            }
        }
        for (String hextet : result) {
            if (hextet == null) {
                return null;
            }
        }
        return result;
    }

    private static String normalizeHextet(String part) {
        if (part.isEmpty() || part.length() > 4) {
            return null;
        }
        try {
            return Integer.toHexString(Integer.parseInt(part, 16));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
