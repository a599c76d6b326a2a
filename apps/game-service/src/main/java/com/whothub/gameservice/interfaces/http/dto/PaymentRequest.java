package com.whothub.gameservice.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * 已由外部服务完成链上校验的付费记录。
 */
@Data
public class PaymentRequest {

    @NotBlank
    private String txHash;

    @NotBlank
    private String userAddress;

    private String amount;

    /** 付费类型，computer_retry 会解锁重试 */
    private String type;
}
