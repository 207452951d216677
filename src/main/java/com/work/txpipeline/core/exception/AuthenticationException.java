package com.work.txpipeline.core.exception;

/**
 * 密文认证失败（被篡改、purpose 不匹配、主密钥不对）。一律失败关闭，不重试。
 */
public class AuthenticationException extends TxPipelineException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
