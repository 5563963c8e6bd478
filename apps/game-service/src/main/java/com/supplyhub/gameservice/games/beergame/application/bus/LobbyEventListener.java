package com.supplyhub.gameservice.games.beergame.application.bus;

import java.util.UUID;

/**
 * 大厅事件的同步监听器（如 STOMP 转发）。
 * 在发布线程内调用，实现方不应阻塞；抛出的异常只记录日志，不影响发布方。
 */
public interface LobbyEventListener {

    void onEvent(UUID lobbyId, LobbyEvent event);
}
