package com.bit.reputation.chain;

import com.bit.reputation.structure.seal.SealParams;
import com.bit.reputation.util.ByteUtils;
import com.bit.reputation.util.Keccak;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * SEAL 内容指纹
 * <p>
 * 序列化顺序固定（小端）：
 * <pre>
 * "8004_SEAL_V1____"(16) | value i64(8) | decimals u8 | scoreFlag u8 | score u8
 * | fileHashFlag u8 | [fileHash(32)] | u16 len + tag1 | u16 len + tag2
 * | u16 len + endpoint | u16 len + uri
 * </pre>
 * 然后做一次Keccak-256。字节布局必须与链上程序一致，任何偏差都会让所有已提交的摘要失配。
 */
public final class SealHasher {

    public static final int MAX_TAG_LEN = 32;
    public static final int MAX_ENDPOINT_LEN = 250;
    public static final int MAX_URI_LEN = 250;
    public static final int MAX_DECIMALS = 6;
    public static final int MAX_SCORE = 100;

    private static final BigInteger I64_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger I64_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private SealHasher() {
    }

    /**
     * 计算SEAL哈希
     * @throws ChainException 任一字段越界（不做任何截断或修正）
     */
    public static byte[] computeSealHash(SealParams params) {
        return Keccak.keccak256(serialize(params));
    }

    /**
     * 校验内容与给定的SEAL哈希是否一致；内容非法时抛出 {@link ChainException}
     */
    public static boolean verifySealHash(SealParams params, byte[] expected) {
        if (expected == null || expected.length != Keccak.DIGEST_LENGTH) {
            throw new ChainException(ErrorType.INVALID_LENGTH, "expected sealHash必须为32字节");
        }
        return Arrays.equals(computeSealHash(params), expected);
    }

    /**
     * 仅校验不计算，供上游在入库前拦截非法内容
     */
    public static void validateSealInputs(SealParams params) {
        if (params == null) {
            throw new ChainException(ErrorType.MISSING_FIELD, "SealParams不能为空");
        }
        BigInteger value = params.getValue();
        if (value == null) {
            throw new ChainException(ErrorType.MISSING_FIELD, "value不能为空");
        }
        if (value.compareTo(I64_MIN) < 0 || value.compareTo(I64_MAX) > 0) {
            throw new ChainException(ErrorType.VALUE_OUT_OF_RANGE, "value=" + value);
        }
        if (params.getValueDecimals() < 0 || params.getValueDecimals() > MAX_DECIMALS) {
            throw new ChainException(ErrorType.DECIMALS_OUT_OF_RANGE, "valueDecimals=" + params.getValueDecimals());
        }
        Integer score = params.getScore();
        if (score != null && (score < 0 || score > MAX_SCORE)) {
            throw new ChainException(ErrorType.SCORE_OUT_OF_RANGE, "score=" + score);
        }
        byte[] fileHash = params.getFeedbackFileHash();
        if (fileHash != null && fileHash.length != Keccak.DIGEST_LENGTH) {
            throw new ChainException(ErrorType.INVALID_LENGTH, "feedbackFileHash长度=" + fileHash.length);
        }
        checkLength("tag1", utf8(params.getTag1()), MAX_TAG_LEN);
        checkLength("tag2", utf8(params.getTag2()), MAX_TAG_LEN);
        checkLength("endpoint", utf8(params.getEndpoint()), MAX_ENDPOINT_LEN);
        checkLength("feedbackUri", utf8(params.getFeedbackUri()), MAX_URI_LEN);
    }

    static byte[] serialize(SealParams params) {
        validateSealInputs(params);

        ByteArrayOutputStream out = new ByteArrayOutputStream(128);
        out.writeBytes(DomainTags.seal());
        out.writeBytes(ByteUtils.longToBytesLE(params.getValue().longValueExact()));
        out.write(params.getValueDecimals());

        Integer score = params.getScore();
        out.write(score != null ? 1 : 0);
        out.write(score != null ? score : 0);

        byte[] fileHash = params.getFeedbackFileHash();
        if (fileHash != null) {
            out.write(1);
            out.writeBytes(fileHash);
        } else {
            out.write(0);
        }

        writeString(out, utf8(params.getTag1()));
        writeString(out, utf8(params.getTag2()));
        writeString(out, utf8(params.getEndpoint()));
        writeString(out, utf8(params.getFeedbackUri()));
        return out.toByteArray();
    }

    private static void writeString(ByteArrayOutputStream out, byte[] bytes) {
        out.writeBytes(ByteUtils.u16ToBytesLE(bytes.length));
        out.writeBytes(bytes);
    }

    // 长度按UTF-8字节计，而不是字符数
    private static byte[] utf8(String s) {
        return s == null ? new byte[0] : s.getBytes(StandardCharsets.UTF_8);
    }

    private static void checkLength(String field, byte[] bytes, int max) {
        if (bytes.length > max) {
            throw new ChainException(ErrorType.STRING_TOO_LONG,
                    field + "长度" + bytes.length + "字节，最大" + max + "字节");
        }
    }
}
