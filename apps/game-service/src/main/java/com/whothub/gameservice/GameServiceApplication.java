package com.whothub.gameservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * game-service 启动入口。
 * 承载 Whot 对局会话注册表、淘汰赛引擎以及胜负仲裁。
 */
@SpringBootApplication
public class GameServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GameServiceApplication.class, args);
    }
}
