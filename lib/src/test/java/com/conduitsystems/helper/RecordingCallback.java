package com.conduitsystems.helper;

import com.conduitsystems.Callback;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Callback that records delivered payloads and the threads that delivered them.
 */
public class RecordingCallback<T> implements Callback<T> {

    private final List<T> delivered = new CopyOnWriteArrayList<>();
    private final List<Thread> threads = new CopyOnWriteArrayList<>();

    @Override
    public void call(T payload) throws Exception {
        delivered.add(payload);
        threads.add(Thread.currentThread());
    }

    public List<T> delivered() {
        return new ArrayList<>(delivered);
    }

    public long distinctThreads() {
        return threads.stream().distinct().count();
    }

    /**
     * Polls until {@code count} payloads were delivered.
     *
     * @return true if reached before the timeout
     */
    public boolean awaitSize(int count, long timeout, TimeUnit unit) throws InterruptedException {
        return Await.until(() -> delivered.size() >= count, timeout, unit);
    }
}
