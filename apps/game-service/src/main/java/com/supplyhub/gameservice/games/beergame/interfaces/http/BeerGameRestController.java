package com.supplyhub.gameservice.games.beergame.interfaces.http;

import com.supplyhub.gameservice.games.beergame.config.BeerGameProperties;
import com.supplyhub.gameservice.games.beergame.domain.constants.GameMessages;
import com.supplyhub.gameservice.games.beergame.interfaces.http.dto.LobbyStateView;
import com.supplyhub.gameservice.games.beergame.interfaces.http.dto.StartGameRequest;
import com.supplyhub.gameservice.games.beergame.interfaces.http.dto.StatsRequest;
import com.supplyhub.gameservice.games.beergame.service.BeerGameService;
import com.supplyhub.web.common.ApiResponse;
import com.supplyhub.web.common.CurrentUserHelper;
import com.supplyhub.web.common.CurrentUserInfo;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 啤酒游戏 http 接口：大厅生命周期、开局、统计与重新同步。
 * 错误由 WebExceptionAdvice 统一转换成 ApiResponse。
 */
@Slf4j
@RestController
@RequestMapping("/api/beergame/lobbies/{lobbyId}")
public class BeerGameRestController {

    private final BeerGameService svc;
    private final BeerGameProperties properties;

    public BeerGameRestController(BeerGameService svc, BeerGameProperties properties) {
        this.svc = svc;
        this.properties = properties;
    }

    /**
     * 注册大厅运行时状态（已开局则从快照恢复），管理员
     */
    @PostMapping("/open")
    public ResponseEntity<ApiResponse<Void>> open(@PathVariable UUID lobbyId, @AuthenticationPrincipal Jwt jwt) {
        if (!isAdmin(jwt)) {
            return forbidden();
        }
        svc.openLobby(lobbyId);
        return ResponseEntity.ok(ApiResponse.success());
    }

    /**
     * 关闭大厅，管理员
     */
    @DeleteMapping
    public ResponseEntity<ApiResponse<Void>> close(@PathVariable UUID lobbyId, @AuthenticationPrincipal Jwt jwt) {
        if (!isAdmin(jwt)) {
            return forbidden();
        }
        svc.closeLobby(lobbyId);
        log.info("大厅已关闭: lobbyId={}, by={}", lobbyId, jwt.getSubject());
        return ResponseEntity.ok(ApiResponse.success());
    }

    /**
     * 开局，管理员
     */
    @PostMapping("/start")
    public ResponseEntity<ApiResponse<Void>> start(@PathVariable UUID lobbyId,
                                                   @Valid @RequestBody StartGameRequest req,
                                                   @AuthenticationPrincipal Jwt jwt) {
        if (!isAdmin(jwt)) {
            return forbidden();
        }
        svc.startGame(lobbyId, req.getRoster(), req.getClasses());
        return ResponseEntity.ok(ApiResponse.success());
    }

    @PutMapping("/classes")
    public ResponseEntity<ApiResponse<Void>> classes(@PathVariable UUID lobbyId,
                                                     @RequestBody Map<UUID, Integer> assignments) {
        svc.updatePlayerClasses(lobbyId, assignments);
        return ResponseEntity.ok(ApiResponse.success());
    }

    /**
     * 回放快照得到的统计序列
     */
    @PostMapping("/stats")
    public ResponseEntity<ApiResponse<Map<String, Map<UUID, List<Long>>>>> stats(@PathVariable UUID lobbyId,
                                                                               @RequestBody(required = false) StatsRequest req) {
        return ResponseEntity.ok(ApiResponse.success(svc.getPlayerStats(lobbyId, req == null ? null : req.getKinds())));
    }

    @GetMapping("/state")
    public ResponseEntity<ApiResponse<LobbyStateView>> state(@PathVariable UUID lobbyId) {
        return ResponseEntity.ok(ApiResponse.success(new LobbyStateView(svc.getPhase(lobbyId), svc.currentState(lobbyId))));
    }

    private boolean isAdmin(Jwt jwt) {
        CurrentUserInfo user = CurrentUserHelper.from(jwt);
        return user != null && user.hasRealmRole(properties.getAdminRole());
    }

    private static <T> ResponseEntity<ApiResponse<T>> forbidden() {
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ApiResponse.forbidden(GameMessages.ONLY_ADMIN));
    }
}
