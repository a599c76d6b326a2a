package com.whothub.gameservice.interfaces.http;

import com.whothub.gameservice.application.stats.LeaderboardCacheService;
import com.whothub.gameservice.application.stats.PlayerStatsService;
import com.whothub.gameservice.application.stats.PlayerStatsView;
import com.whothub.gameservice.interfaces.http.dto.ReportMatchRequest;
import com.whothub.gameservice.platform.config.WhotProperties;
import com.whothub.web.common.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 玩家战绩与排行榜（暂不做鉴权，前端直接调用）。
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class PlayerStatsController {

    private final PlayerStatsService statsService;
    private final LeaderboardCacheService leaderboardCache;
    private final WhotProperties properties;

    /**
     * 经验值排行榜
     * @param limit 返回条数，不超过配置的排行榜大小
     */
    @GetMapping("/leaderboard")
    public ApiResponse<LeaderboardCacheService.Leaderboard> leaderboard(
            @RequestParam(value = "limit", required = false) Integer limit) {
        LeaderboardCacheService.Leaderboard board = leaderboardCache.get();
        int max = properties.getStats().getLeaderboardSize();
        int n = (limit == null || limit <= 0) ? max : Math.min(limit, max);
        if (board.entries().size() <= n) {
            return ApiResponse.success(board);
        }
        List<PlayerStatsView> head = board.entries().subList(0, n);
        return ApiResponse.success(new LeaderboardCacheService.Leaderboard(List.copyOf(head), board.cached()));
    }

    /** 获取玩家战绩，不存在则建档 */
    @GetMapping("/user/{address}")
    public ApiResponse<PlayerStatsView> user(@PathVariable("address") String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address must not be blank");
        }
        return ApiResponse.success(statsService.createUserIfNotExists(address));
    }

    @PostMapping("/report-match")
    public ApiResponse<Void> reportMatch(@Valid @RequestBody ReportMatchRequest req) {
        boolean win = req.isWin();
        statsService.updateUserXP(req.getAddress(), win ? properties.getStats().getWinXp() : 0, win);
        leaderboardCache.evict();
        return ApiResponse.success(null);
    }
}
