package com.work.txpipeline.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigInteger;

/**
 * 待发送的调用：目标地址、转账金额与 calldata。以 JSON 存在 tx_intents.built_call 中，
 * 替换交易和崩溃恢复时据此重建完全相同的交易。
 */
public class BuiltCall {

    private String to;

    /**
     * wei，十进制字符串。
     */
    private String value = "0";

    /**
     * 0x 开头的十六进制 calldata，可为空。
     */
    private String data = "0x";

    /**
     * 调用方给出的 gas limit；非空时跳过估算。
     */
    private Long gasLimitHint;

    public BuiltCall() {
    }

    public BuiltCall(String to, BigInteger value, String data, Long gasLimitHint) {
        this.to = to;
        this.value = value == null ? "0" : value.toString();
        this.data = data == null || data.isEmpty() ? "0x" : data;
        this.gasLimitHint = gasLimitHint;
    }

    @JsonIgnore
    public BigInteger valueWei() {
        return value == null || value.isEmpty() ? BigInteger.ZERO : new BigInteger(value);
    }

    public String getTo() {
        return to;
    }

    public void setTo(String to) {
        this.to = to;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public String getData() {
        return data;
    }

    public void setData(String data) {
        this.data = data;
    }

    public Long getGasLimitHint() {
        return gasLimitHint;
    }

    public void setGasLimitHint(Long gasLimitHint) {
        this.gasLimitHint = gasLimitHint;
    }
}
