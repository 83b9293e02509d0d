package com.prediction.worthhub.worth_hub.execution;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Single writer for one topic. Instructions run one at a time in submission
 * order, which is what makes commitment counters and submit orders race-free.
 */
public class TopicExecutor {

    private final ExecutorService executor;
    private final InstructionProcessor processor;

    // Guarded by the registry's map entry for this topic.
    private int pending;
    private boolean retiring;

    public TopicExecutor(long topicId, InstructionProcessor processor) {
        this.processor = processor;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "topic-" + topicId);
            thread.setDaemon(true);
            return thread;
        });
    }

    public Future<InstructionReceipt> submit(Instruction instruction) {
        return executor.submit(() -> processor.process(instruction));
    }

    void acquire() {
        pending++;
    }

    /**
     * @return instructions still in flight on this executor
     */
    int release() {
        return --pending;
    }

    void markRetiring() {
        retiring = true;
    }

    boolean isRetiring() {
        return retiring;
    }

    public void shutdown() {
        executor.shutdown();
    }
}
