package com.notibag.common.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SuccessResponse {

    private boolean success;

    public static SuccessResponse ok() {
        return new SuccessResponse(true);
    }
}
