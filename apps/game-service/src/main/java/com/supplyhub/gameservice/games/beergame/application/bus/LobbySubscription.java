package com.supplyhub.gameservice.games.beergame.application.bus;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 一个订阅者的有界缓冲。
 * <p>
 * 缓冲满时丢弃最旧的一条再放入新消息（至多一次、尽力而为）；
 * 丢失的消息由客户端通过状态快照重新同步。
 */
public class LobbySubscription implements AutoCloseable {

    private final LobbyEventBus bus;
    private final BlockingQueue<LobbyEvent> queue;
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean closed;

    LobbySubscription(LobbyEventBus bus, int capacity) {
        this.bus = bus;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * @return false 表示缓冲已满、丢弃了最旧的消息
     */
    synchronized boolean deliver(LobbyEvent event) {
        if (closed) {
            return true;
        }
        boolean clean = true;
        while (!queue.offer(event)) {
            queue.poll();
            dropped.incrementAndGet();
            clean = false;
        }
        return clean;
    }

    public LobbyEvent poll() {
        return queue.poll();
    }

    public LobbyEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /** 取出当前缓冲中的全部消息 */
    public List<LobbyEvent> drain() {
        List<LobbyEvent> out = new ArrayList<>();
        queue.drainTo(out);
        return out;
    }

    /** 因落后而丢失的消息数 */
    public long droppedCount() {
        return dropped.get();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        bus.unsubscribe(this);
    }
}
