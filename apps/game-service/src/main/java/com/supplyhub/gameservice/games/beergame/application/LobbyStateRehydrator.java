package com.supplyhub.gameservice.games.beergame.application;

import com.supplyhub.gameservice.games.beergame.domain.error.GameException;
import com.supplyhub.gameservice.games.beergame.domain.model.LobbyConfig;
import com.supplyhub.gameservice.games.beergame.domain.repository.LobbyRepository;
import com.supplyhub.gameservice.games.beergame.service.BeerGameService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

/**
 * 启动恢复：为所有大厅注册运行时状态，已开局的大厅从最新快照重建 RoundState。
 * <p>
 * 在全部单例初始化完成后、Web 服务器启动前执行，因此首个请求到达时状态已就绪。
 * 单个大厅恢复失败只记录错误，不影响其他大厅。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LobbyStateRehydrator implements SmartInitializingSingleton {

    private final LobbyRepository lobbyRepository;
    private final BeerGameService beerGameService;

    @Override
    public void afterSingletonsInstantiated() {
        rehydrateAll();
    }

    /**
     * @return 成功注册的大厅数
     */
    public int rehydrateAll() {
        int ok = 0;
        int failed = 0;
        for (LobbyConfig lobby : lobbyRepository.findAll()) {
            try {
                beerGameService.openLobby(lobby.id());
                ok++;
            } catch (GameException e) {
                failed++;
                log.error("大厅恢复失败: lobbyId={}, code={}, msg={}", lobby.id(), e.getCode(), e.getMessage(), e);
            }
        }
        log.info("启动恢复完成: 成功 {} 个大厅，失败 {} 个", ok, failed);
        return ok;
    }
}
