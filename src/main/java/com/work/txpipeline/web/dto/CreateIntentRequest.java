package com.work.txpipeline.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Pattern;
import javax.validation.constraints.Positive;
import javax.validation.constraints.Size;
import java.util.Map;

/**
 * 注册 Intent 请求。金额与 calldata 已由调用方换算为最终单位，这里不做任何缩放。
 */
public class CreateIntentRequest {

    @NotBlank(message = "intentKey 不能为空")
    @Size(max = 128, message = "intentKey 最长 128 个字符")
    private String intentKey;

    @NotBlank(message = "signingAddress 不能为空")
    @Pattern(regexp = "^0x[0-9a-fA-F]{40}$", message = "signingAddress 格式错误")
    private String signingAddress;

    @NotBlank(message = "to 不能为空")
    @Pattern(regexp = "^0x[0-9a-fA-F]{40}$", message = "to 格式错误")
    private String to;

    /**
     * wei，十进制字符串，缺省为 0。
     */
    @Pattern(regexp = "^[0-9]{1,78}$", message = "value 必须是十进制 wei")
    private String value;

    @Pattern(regexp = "^0x([0-9a-fA-F]{2})*$", message = "data 必须是 0x 开头的十六进制")
    private String data;

    @Positive
    private Long gasLimit;

    private Map<String, Object> metadata;

    public String getIntentKey() {
        return intentKey;
    }

    public void setIntentKey(String intentKey) {
        this.intentKey = intentKey;
    }

    public String getSigningAddress() {
        return signingAddress;
    }

    public void setSigningAddress(String signingAddress) {
        this.signingAddress = signingAddress;
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

    public Long getGasLimit() {
        return gasLimit;
    }

    public void setGasLimit(Long gasLimit) {
        this.gasLimit = gasLimit;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }
}
