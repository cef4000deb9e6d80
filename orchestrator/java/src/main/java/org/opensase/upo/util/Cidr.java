package org.opensase.upo.util;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Optional;

/**
 * An IPv4 or IPv6 network range. A bare address is read as a host route (/32 or /128).
 *
 * <p>Parsed ranges are canonical: host bits are cleared and IPv6 addresses are written in
 * the compressed lower-case form, so two spellings of the same range compare equal.
 */
public record Cidr(String address, int prefixLength, boolean ipv6) {

    public static boolean isValid(String raw) {
        return parse(raw).isPresent();
    }

    public static Optional<Cidr> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String s = raw.trim();
        String addr = s;
        String prefix = null;
        int slash = s.indexOf('/');
        if (slash >= 0) {
            addr = s.substring(0, slash);
            prefix = s.substring(slash + 1);
        }
        boolean v6 = addr.indexOf(':') >= 0;
        byte[] bytes = v6 ? ipv6Bytes(addr) : ipv4Bytes(addr);
        if (bytes == null) {
            return Optional.empty();
        }
        int max = v6 ? 128 : 32;
        int length = max;
        if (prefix != null) {
            if (prefix.isEmpty() || prefix.length() > 3 || !prefix.chars().allMatch(Character::isDigit)) {
                return Optional.empty();
            }
            length = Integer.parseInt(prefix);
            if (length > max) return Optional.empty();
        }
        mask(bytes, length);
        return Optional.of(new Cidr(v6 ? formatIpv6(bytes) : formatIpv4(bytes), length, v6));
    }

    private static byte[] ipv4Bytes(String addr) {
        String[] octets = addr.split("\\.", -1);
        if (octets.length != 4) return null;
        byte[] bytes = new byte[4];
        for (int i = 0; i < 4; i++) {
            String octet = octets[i];
            if (octet.isEmpty() || octet.length() > 3 || !octet.chars().allMatch(Character::isDigit)) {
                return null;
            }
            int value = Integer.parseInt(octet);
            if (value > 255) return null;
            bytes[i] = (byte) value;
        }
        return bytes;
    }

    private static byte[] ipv6Bytes(String addr) {
        if (!addr.chars().allMatch(c -> Character.digit(c, 16) >= 0 || c == ':' || c == '.')) {
            return null;
        }
        // literal parsing only: an address containing ':' is never resolved through DNS
        try {
            byte[] bytes = InetAddress.getByName(addr).getAddress();
            return bytes.length == 16 ? bytes : null;
        } catch (UnknownHostException e) {
            return null;
        }
    }

    private static void mask(byte[] bytes, int prefixLength) {
        for (int i = 0; i < bytes.length; i++) {
            int keep = Math.max(0, Math.min(8, prefixLength - i * 8));
            bytes[i] = (byte) (bytes[i] & (0xff00 >> keep));
        }
    }

    private static String formatIpv4(byte[] bytes) {
        return (bytes[0] & 0xff) + "." + (bytes[1] & 0xff) + "." + (bytes[2] & 0xff) + "." + (bytes[3] & 0xff);
    }

    // RFC 5952: longest run of two or more zero groups becomes "::", the first run on a tie
    private static String formatIpv6(byte[] bytes) {
        int[] groups = new int[8];
        for (int i = 0; i < 8; i++) {
            groups[i] = ((bytes[2 * i] & 0xff) << 8) | (bytes[2 * i + 1] & 0xff);
        }
        int bestStart = -1;
        int bestLength = 1;
        for (int i = 0; i < 8; ) {
            if (groups[i] != 0) {
                i++;
                continue;
            }
            int j = i;
            while (j < 8 && groups[j] == 0) j++;
            if (j - i > bestLength) {
                bestStart = i;
                bestLength = j - i;
            }
            i = j;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 8; i++) {
            if (i == bestStart) {
                sb.append("::");
                i += bestLength - 1;
                continue;
            }
            if (sb.length() > 0 && sb.charAt(sb.length() - 1) != ':') {
                sb.append(':');
            }
            sb.append(Integer.toHexString(groups[i]));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return address + "/" + prefixLength;
    }
}
