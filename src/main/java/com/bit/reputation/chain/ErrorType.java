package com.bit.reputation.chain;

public enum ErrorType {
    INVALID_LENGTH("字节长度非法（摘要/公钥/哈希必须为32字节）"),
    VALUE_OUT_OF_RANGE("数值超出i64范围"),
    DECIMALS_OUT_OF_RANGE("小数位数超出范围（0-6）"),
    SCORE_OUT_OF_RANGE("评分超出范围（0-100或为空）"),
    STRING_TOO_LONG("字符串超出最大字节长度"),
    MISSING_FIELD("必填字段为空");

    private final String desc;

    ErrorType(String desc) {
        this.desc = desc;
    }

    public String getDesc() {
        return desc;
    }
}
