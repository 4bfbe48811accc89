package com.bit.reputation.chain;

/**
 * 编码层异常：SEAL/叶子/链哈希的输入在哈希之前被拒绝时抛出，绝不做静默修正
 */
public class ChainException extends RuntimeException {

    // 异常类型（用于分类处理）
    private final ErrorType errorType;

    public ChainException(ErrorType errorType, String message) {
        super("[" + errorType.getDesc() + "]：" + message);
        this.errorType = errorType;
    }

    public ChainException(ErrorType errorType, String message, Throwable cause) {
        super("[" + errorType.getDesc() + "]：" + message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
