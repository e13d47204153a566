package com.work.shortkey.app.web.dto;

import javax.validation.Valid;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.Size;

import java.util.List;

public class BatchAllocateRequest {

    @NotEmpty(message = "items 不能为空")
    @Size(max = 500, message = "单批最多 500 条")
    @Valid
    private List<AllocateRequest> items;

    public List<AllocateRequest> getItems() {
        return items;
    }

    public void setItems(List<AllocateRequest> items) {
        this.items = items;
    }
}
