package com.supplyhub.gameservice.games.beergame.application.registry;

import com.supplyhub.gameservice.games.beergame.application.bus.LobbyEventBus;
import com.supplyhub.gameservice.games.beergame.domain.enums.LobbyPhase;
import com.supplyhub.gameservice.games.beergame.domain.model.RoundState;

import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 单个大厅的运行时句柄：权威 RoundState + 广播总线 + 独立的互斥锁。
 * <p>
 * roundState / phase / pendingClasses 只能在 {@link #withLock} / {@link #runWithLock} 内读写；
 * 一次提交到回合结算、事件处理、广播的整条链路都在同一把锁内完成。
 */
public class LobbySession {

    private final UUID lobbyId;
    private final LobbyEventBus bus;
    private final ReentrantLock lock = new ReentrantLock();

    private RoundState roundState = RoundState.empty();
    private LobbyPhase phase = LobbyPhase.NOT_STARTED;
    /** 开局前的职业分配 */
    private Map<UUID, Integer> pendingClasses = new TreeMap<>();

    public LobbySession(UUID lobbyId, LobbyEventBus bus) {
        this.lobbyId = lobbyId;
        this.bus = bus;
    }

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runWithLock(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    public UUID getLobbyId() {
        return lobbyId;
    }

    public LobbyEventBus getBus() {
        return bus;
    }

    public RoundState getRoundState() {
        return roundState;
    }

    /** 整体替换运行时状态（提交成功后调用） */
    public void commit(RoundState next) {
        this.roundState = next;
    }

    public LobbyPhase getPhase() {
        return phase;
    }

    public void setPhase(LobbyPhase phase) {
        this.phase = phase;
    }

    public Map<UUID, Integer> getPendingClasses() {
        return pendingClasses;
    }

    public void setPendingClasses(Map<UUID, Integer> pendingClasses) {
        this.pendingClasses = new TreeMap<>(pendingClasses);
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }
}
