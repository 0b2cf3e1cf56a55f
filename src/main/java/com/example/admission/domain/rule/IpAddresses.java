package com.example.admission.domain.rule;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * IP 리터럴 / CIDR 유틸리티
 *
 * InetAddress.getByName은 리터럴이 아닌 값에 대해 DNS 조회를 하므로 반드시 isLiteral 확인 후 호출한다.
 */
public final class IpAddresses {

    private static final Pattern IPV4 = Pattern.compile(
            "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");
    private static final Pattern IPV6 = Pattern.compile("^[0-9a-fA-F:.]{2,45}$");

    private static final int FINGERPRINT_LENGTH = 16;

    private IpAddresses() {
    }

    /**
     * 저장소 키와 감사 로그에 쓰는 IP 지문 (SHA-256 앞 16자리). 값이 없으면 null.
     */
    public static String fingerprint(String ip) {
        if (ip == null || ip.isBlank()) {
            return null;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(ip.trim().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, FINGERPRINT_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static boolean isLiteral(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        String trimmed = value.trim();
        if (IPV4.matcher(trimmed).matches()) {
            return true;
        }
        return trimmed.indexOf(':') >= 0 && IPV6.matcher(trimmed).matches() && toBytes(trimmed) != null;
    }

    public static boolean isCidrOrLiteral(String value) {
        if (value == null) {
            return false;
        }
        int slash = value.indexOf('/');
        if (slash < 0) {
            return isLiteral(value);
        }
        String address = value.substring(0, slash);
        if (!isLiteral(address)) {
            return false;
        }
        try {
            int prefix = Integer.parseInt(value.substring(slash + 1));
            return prefix >= 0 && prefix <= toBytes(address).length * 8;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * ip가 cidr(또는 단일 IP)에 포함되는지 확인. 주소 체계가 다르면 false.
     */
    public static boolean matches(String cidr, String ip) {
        if (!isLiteral(ip) || !isCidrOrLiteral(cidr)) {
            return false;
        }
        int slash = cidr.indexOf('/');
        byte[] network = toBytes(slash < 0 ? cidr : cidr.substring(0, slash));
        byte[] candidate = toBytes(ip);
        if (network == null || candidate == null || network.length != candidate.length) {
            return false;
        }
        int prefix = slash < 0 ? network.length * 8 : Integer.parseInt(cidr.substring(slash + 1));

        int fullBytes = prefix / 8;
        for (int i = 0; i < fullBytes; i++) {
            if (network[i] != candidate[i]) {
                return false;
            }
        }
        int remainingBits = prefix % 8;
        if (remainingBits == 0) {
            return true;
        }
        int mask = (0xFF << (8 - remainingBits)) & 0xFF;
        return (network[fullBytes] & mask) == (candidate[fullBytes] & mask);
    }

    /**
     * IPv4 /24 (IPv6는 앞 4그룹) 서브넷 식별자
     */
    public static String subnetOf(String ip) {
        if (ip == null) {
            return "default";
        }
        if (IPV4.matcher(ip).matches()) {
            return ip.substring(0, ip.lastIndexOf('.')) + ".0/24";
        }
        String[] groups = ip.split(":");
        StringBuilder prefix = new StringBuilder();
        for (int i = 0; i < Math.min(4, groups.length); i++) {
            prefix.append(groups[i]).append(':');
        }
        return prefix.append(":/64").toString();
    }

    private static byte[] toBytes(String literal) {
        try {
            return InetAddress.getByName(literal.trim()).getAddress();
        } catch (UnknownHostException e) {
            return null;
        }
    }
}
