package com.work.shortkey.app.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Pattern;

public class ReservedKeyRequest {

    @NotBlank(message = "value 不能为空")
    @Pattern(regexp = "^[0-9a-zA-Z]{1,32}$", message = "value 只能包含字母和数字")
    private String value;

    private String reason;

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }
}
