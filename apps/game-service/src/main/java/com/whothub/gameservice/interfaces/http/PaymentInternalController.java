package com.whothub.gameservice.interfaces.http;

import com.whothub.gameservice.application.stats.PlayerStatsService;
import com.whothub.gameservice.infrastructure.persistence.entity.MatchStatus;
import com.whothub.gameservice.interfaces.http.dto.PaymentRequest;
import com.whothub.web.common.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 内部接口：外部支付校验服务确认交易成功后回调这里落库。
 * 仅供内网调用，不对浏览器开放。
 */
@Slf4j
@RestController
@RequestMapping("/internal/payments")
@RequiredArgsConstructor
public class PaymentInternalController {

    static final String COMPUTER_RETRY = "computer_retry";

    private final PlayerStatsService statsService;

    @PostMapping
    public ApiResponse<Boolean> record(@Valid @RequestBody PaymentRequest req) {
        boolean recorded = statsService.recordPayment(req.getTxHash(), req.getUserAddress(), req.getAmount(), req.getType());
        // 付费重试：解锁再来一局
        if (COMPUTER_RETRY.equals(req.getType())) {
            statsService.updateUserMatchStatus(req.getUserAddress(), MatchStatus.PAID_RETRY);
        }
        return ApiResponse.success(recorded ? "recorded" : "duplicate", recorded);
    }
}
