package com.bit.reputation.structure.seal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * 反馈内容指纹（SEAL）的输入参数
 * 数值用BigInteger承载，索引器返回超出i64的值时能在哈希前被拒绝，而不是被截断
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SealParams {
    private BigInteger value;        // 有符号64位数值
    private int valueDecimals;       // 小数位数 0-6
    private Integer score;           // 0-100，null表示未评分（与0不同）
    private String tag1;             // <= 32字节，null等同于空串
    private String tag2;             // <= 32字节，null等同于空串
    private String endpoint;         // <= 250字节，null等同于空串
    private String feedbackUri;      // <= 250字节
    private byte[] feedbackFileHash; // 可选，存在时必须为32字节
}
