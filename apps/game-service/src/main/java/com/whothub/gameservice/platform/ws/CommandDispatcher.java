package com.whothub.gameservice.platform.ws;

import com.whothub.gameservice.common.CoordinationException;
import com.whothub.gameservice.platform.loop.GameLoop;
import com.whothub.gameservice.platform.transport.ClientNotifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 入站命令投递：把已校验的命令放到主循环上执行。
 * 业务拒绝（CoordinationException）只回给发起方连接，其余异常由主循环记录。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandDispatcher {

    private final GameLoop gameLoop;
    private final ClientNotifier notifier;

    public void dispatch(String connectionId, String label, Runnable command) {
        gameLoop.submit(label, () -> {
            try {
                command.run();
            } catch (CoordinationException e) {
                log.info("命令被拒绝: cmd={}, connectionId={}, kind={}, msg={}",
                        label, connectionId, e.getKind(), e.getMessage());
                notifier.sendError(connectionId, e.getMessage());
            }
        });
    }

    /** 校验失败等无需进入主循环的拒绝 */
    public void reject(String connectionId, String label, CoordinationException e) {
        log.info("命令校验失败: cmd={}, connectionId={}, msg={}", label, connectionId, e.getMessage());
        notifier.sendError(connectionId, e.getMessage());
    }
}
