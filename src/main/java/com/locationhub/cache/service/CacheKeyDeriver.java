package com.locationhub.cache.service;

import com.locationhub.cache.dto.Coordinates;
import com.locationhub.cache.model.OperationKind;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static com.locationhub.cache.constant.CacheConstants.COORDINATE_SCALE;
import static com.locationhub.cache.constant.CacheConstants.KEY_HASH_LENGTH;
import static com.locationhub.cache.constant.CacheConstants.KEY_SEPARATOR;

/**
 * 缓存 Key 生成器
 * <p>
 * 同一逻辑查询始终得到同一个 Key：地址去首尾空白、合并连续空白、转小写，
 * 坐标固定 6 位小数。参数以 ":" 拼接后做 SHA-256，取前 16 位十六进制，
 * 最终格式为 {@code <prefix>:<hash16>}。
 */
public class CacheKeyDeriver {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String DEGREES_FORMAT = "%." + COORDINATE_SCALE + "f";
    private static final String ZERO = String.format(Locale.ROOT, DEGREES_FORMAT, 0.0);
    private static final String NEGATIVE_ZERO = "-" + ZERO;

    public String deriveKey(OperationKind kind, String... parameters) {
        String combined = Arrays.stream(parameters)
            .map(String::valueOf)
            .collect(Collectors.joining(KEY_SEPARATOR));
        return kind.prefix() + KEY_SEPARATOR + hash(combined);
    }

    public String forGeocode(String address) {
        return deriveKey(OperationKind.GEOCODE, canonicalAddress(address));
    }

    public String forReverseGeocode(Coordinates coordinates) {
        return deriveKey(OperationKind.REVERSE_GEOCODE,
            canonicalDegrees(coordinates.latitude()),
            canonicalDegrees(coordinates.longitude()));
    }

    public String forRoute(Coordinates from, Coordinates to) {
        return deriveKey(OperationKind.ROUTE,
            canonicalDegrees(from.latitude()),
            canonicalDegrees(from.longitude()),
            canonicalDegrees(to.latitude()),
            canonicalDegrees(to.longitude()));
    }

    static String canonicalAddress(String address) {
        return WHITESPACE.matcher(address.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    static String canonicalDegrees(double value) {
        String formatted = String.format(Locale.ROOT, DEGREES_FORMAT, value);
        // -0.0000001 之类的值会格式化成 -0.000000
        return NEGATIVE_ZERO.equals(formatted) ? ZERO : formatted;
    }

    private static String hash(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, KEY_HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
