package com.whothub.gameservice.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

/**
 * 客户端自报战绩（单机/人机对局用）。
 */
@Data
public class ReportMatchRequest {

    @NotBlank
    private String address;

    /** WIN 或 LOSS */
    @NotBlank
    @Pattern(regexp = "WIN|LOSS", message = "result must be WIN or LOSS")
    private String result;

    public boolean isWin() {
        return "WIN".equals(result);
    }
}
