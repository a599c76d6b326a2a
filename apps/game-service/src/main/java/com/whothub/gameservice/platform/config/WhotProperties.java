package com.whothub.gameservice.platform.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * game-service 业务配置（前缀 whot）。
 * 支持通过 application.yml 或环境变量覆盖，默认值即生产默认值。
 */
@Data
@Component
@ConfigurationProperties(prefix = "whot")
public class WhotProperties {

    private Session session = new Session();
    private Tournament tournament = new Tournament();
    private Stats stats = new Stats();
    private Ws ws = new Ws();

    @Data
    public static class Session {
        /** 结束事件处理后延迟销毁对局的时间，留给最后几条广播送达 */
        private Duration teardownDelay = Duration.ofSeconds(1);
        /** 非赛事对局无任何活动超过该时长即被清扫 */
        private Duration idleTtl = Duration.ofHours(2);
        /** 空闲清扫的执行间隔 */
        private Duration sweepInterval = Duration.ofMinutes(5);
        /** 每个对局保留的聊天记录条数 */
        private int chatHistoryLimit = 50;
        /** 单条聊天消息最大长度 */
        private int maxMessageLength = 500;
    }

    @Data
    public static class Tournament {
        /** 赛事完成后保留多久再销毁 */
        private Duration cleanupDelay = Duration.ofMinutes(10);
        /** 允许创建的最大赛事人数（必须是 2 的幂） */
        private int maxSize = 64;
    }

    @Data
    public static class Stats {
        /** 胜者获得的经验值，败者固定为 0 */
        private int winXp = 10;
        /** 排行榜缓存有效期 */
        private Duration leaderboardCacheTtl = Duration.ofSeconds(30);
        /** 排行榜返回条数 */
        private int leaderboardSize = 50;
    }

    @Data
    public static class Ws {
        /** 允许的跨域来源（开发时用 *，生产建议限制域名） */
        private String[] allowedOrigins = {"*"};
    }
}
