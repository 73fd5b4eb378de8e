package com.hhplus.ordering.test.mocks;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;

/**
 * 테스트용 수동 작업 큐
 *
 * execute()는 작업을 큐에 넣기만 하고, 테스트가 runNext()/runAll()로 직접 실행합니다.
 * 메시지 버스의 "발행 호출 안에서는 핸들러가 실행되지 않는다"는 동작을 결정적으로 검증할 때 사용합니다.
 */
public class ManualTaskExecutor implements Executor {

    private static final int MAX_TASKS = 10_000;

    private final Deque<Runnable> tasks = new ArrayDeque<>();

    @Override
    public synchronized void execute(Runnable task) {
        tasks.addLast(task);
    }

    /**
     * 가장 먼저 들어온 작업 하나를 실행합니다.
     *
     * @return 실행한 작업이 있으면 true
     */
    public boolean runNext() {
        Runnable task;
        synchronized (this) {
            task = tasks.pollFirst();
        }
        if (task == null) {
            return false;
        }
        task.run();
        return true;
    }

    /**
     * 큐가 빌 때까지 실행합니다. 실행 중에 새로 들어온 작업도 포함됩니다.
     *
     * @return 실행한 작업 수
     */
    public int runAll() {
        int executed = 0;
        while (runNext()) {
            executed++;
            if (executed > MAX_TASKS) {
                throw new IllegalStateException("작업이 끝나지 않습니다 (순환 발행 의심): executed=" + executed);
            }
        }
        return executed;
    }

    public synchronized int pendingCount() {
        return tasks.size();
    }
}
