package com.parley.eventbus;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;

/** Executor that queues tasks until the test runs them. */
final class ManualExecutor implements Executor {

    private final Deque<Runnable> tasks = new ArrayDeque<>();

    @Override
    public synchronized void execute(Runnable command) {
        tasks.addLast(command);
    }

    synchronized int pending() {
        return tasks.size();
    }

    void runAll() {
        while (true) {
            Runnable next;
            synchronized (this) {
                next = tasks.pollFirst();
            }
            if (next == null) {
                return;
            }
            next.run();
        }
    }
}
