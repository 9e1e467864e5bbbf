package com.bftchain.concurrent;

import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;

import lombok.extern.slf4j.Slf4j;

/**
 * Single consumer thread draining a task queue. Everything that touches
 * consensus state runs here, one task at a time.
 */
@Slf4j
public class EventLoop implements Executor {
    private final LinkedBlockingQueue<Runnable> taskQueue = new LinkedBlockingQueue<>();
    private final Thread eventLoopThread;
    private volatile boolean running = true;

    public EventLoop(String name) {
        eventLoopThread = new Thread(this::processTasks, "event-loop-" + name);
        eventLoopThread.setDaemon(true);
        eventLoopThread.start();
    }

    private void processTasks() {
        while (running) {
            try {
                Runnable task = taskQueue.take();
                task.run();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                // one failing task must not kill the loop
                log.error("Task failed on {}", eventLoopThread.getName(), e);
            }
        }
    }

    @Override
    public void execute(Runnable task) {
        if (!running) {
            log.debug("Event loop {} stopped, dropping task", eventLoopThread.getName());
            return;
        }
        taskQueue.offer(task);
    }

    public <T> Future<T> submit(Callable<T> task) {
        FutureTask<T> future = new FutureTask<>(task);
        execute(future);
        return future;
    }

    public boolean inEventLoop() {
        return Thread.currentThread() == eventLoopThread;
    }

    public int pendingTasks() {
        return taskQueue.size();
    }

    public void shutdown() {
        running = false;
        eventLoopThread.interrupt();
    }
}
