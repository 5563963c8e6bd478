package com.supplyhub.gameservice.games.beergame.application.bus;

import com.supplyhub.gameservice.games.beergame.domain.enums.Resource;
import com.supplyhub.gameservice.games.beergame.domain.error.GameErrorCode;
import com.supplyhub.gameservice.games.beergame.domain.model.GameEnd;
import com.supplyhub.gameservice.games.beergame.domain.model.GameUpdate;
import com.supplyhub.gameservice.games.beergame.domain.model.Settings;

import java.util.Map;
import java.util.UUID;

/**
 * 大厅广播事件。
 * <p>
 * type() 为对外的消息类型；targetPlayer() 非空表示只发给该玩家。
 */
public sealed interface LobbyEvent {

    String type();

    default UUID targetPlayer() {
        return null;
    }

    default boolean isError() {
        return false;
    }

    record GameStarted(GameUpdate update) implements LobbyEvent {
        @Override
        public String type() {
            return "GAME_START";
        }
    }

    record RoundStarted(GameUpdate update) implements LobbyEvent {
        @Override
        public String type() {
            return "ROUND_START";
        }
    }

    record RoundEnded(long round) implements LobbyEvent {
        @Override
        public String type() {
            return "ROUND_END";
        }
    }

    record SettingsChanged(Settings settings) implements LobbyEvent {
        @Override
        public String type() {
            return "SETTINGS_CHANGE";
        }
    }

    record PopUpUser(UUID playerId, String message) implements LobbyEvent {
        @Override
        public String type() {
            return "POP_UP";
        }

        @Override
        public UUID targetPlayer() {
            return playerId;
        }
    }

    record PopUpAll(String message) implements LobbyEvent {
        @Override
        public String type() {
            return "POP_UP";
        }
    }

    record ResourceAddedUser(UUID playerId, Resource resource, long value) implements LobbyEvent {
        @Override
        public String type() {
            return "RESOURCE_ADDED";
        }

        @Override
        public UUID targetPlayer() {
            return playerId;
        }
    }

    record ResourceAddedAll(Resource resource, long value) implements LobbyEvent {
        @Override
        public String type() {
            return "RESOURCE_ADDED";
        }
    }

    /** 回合提交已受理 */
    record Ack(UUID playerId) implements LobbyEvent {
        @Override
        public String type() {
            return "ACK";
        }

        @Override
        public UUID targetPlayer() {
            return playerId;
        }
    }

    record PlayerError(UUID playerId, GameErrorCode code, String message) implements LobbyEvent {
        @Override
        public String type() {
            return "ERROR";
        }

        @Override
        public UUID targetPlayer() {
            return playerId;
        }

        @Override
        public boolean isError() {
            return true;
        }
    }

    record LobbyError(GameErrorCode code, String message) implements LobbyEvent {
        @Override
        public String type() {
            return "ERROR";
        }

        @Override
        public boolean isError() {
            return true;
        }
    }

    record GameEnded(GameEnd result) implements LobbyEvent {
        @Override
        public String type() {
            return "GAME_END";
        }
    }

    record ClassesUpdated(Map<UUID, Integer> classes) implements LobbyEvent {
        @Override
        public String type() {
            return "CLASSES_UPDATE";
        }
    }

    record PlayerDisconnected(UUID playerId) implements LobbyEvent {
        @Override
        public String type() {
            return "USER_DISCONNECTED";
        }
    }

    /** 大厅关闭，客户端应断开连接 */
    record KickAll(String reason) implements LobbyEvent {
        @Override
        public String type() {
            return "KICK_ALL";
        }
    }
}
