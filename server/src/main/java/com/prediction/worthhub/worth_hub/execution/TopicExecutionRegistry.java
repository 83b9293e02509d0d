package com.prediction.worthhub.worth_hub.execution;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

import com.prediction.worthhub.worth_hub.entity.TopicStatus;
import com.prediction.worthhub.worth_hub.error.ErrorCode;
import com.prediction.worthhub.worth_hub.error.WorthHubException;

import lombok.extern.slf4j.Slf4j;

/**
 * Routes every instruction to its topic's {@link TopicExecutor}.
 *
 * An executor is retired once its topic is settled, or when an instruction
 * names a topic that does not exist or is already settled. Retirement waits until no caller holds
 * the executor, so a topic never has two executors running at once.
 */
@Slf4j
public class TopicExecutionRegistry {

    private final ConcurrentHashMap<Long, TopicExecutor> executors = new ConcurrentHashMap<>();
    private final InstructionProcessor processor;

    public TopicExecutionRegistry(InstructionProcessor processor) {
        this.processor = processor;
    }

    /**
     * Run the instruction on its topic's executor and wait for the outcome.
     * Failures are rethrown as raised by the state machine.
     */
    public InstructionReceipt execute(Instruction instruction) {
        long topicId = instruction.getTopicId();
        TopicExecutor executor = acquire(topicId);
        InstructionReceipt receipt;
        try {
            receipt = executor.submit(instruction).get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            release(topicId, isRetiredTopic(cause));
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Instruction failed: " + instruction.getType(), cause);
        } catch (InterruptedException e) {
            // The instruction may still be running, so the executor stays held.
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while executing " + instruction.getType(), e);
        }
        release(topicId, isSettled(receipt));
        return receipt;
    }

    private TopicExecutor acquire(long topicId) {
        return executors.compute(topicId, (id, existing) -> {
            TopicExecutor executor = existing != null ? existing : new TopicExecutor(id, processor);
            executor.acquire();
            return executor;
        });
    }

    private void release(long topicId, boolean retire) {
        executors.computeIfPresent(topicId, (id, executor) -> {
            if (retire) {
                executor.markRetiring();
            }
            if (executor.release() == 0 && executor.isRetiring()) {
                executor.shutdown();
                log.debug("Retired executor for topicId={}", id);
                return null;
            }
            return executor;
        });
    }

    private static boolean isSettled(InstructionReceipt receipt) {
        return receipt.getSettlement() != null && receipt.getSettlement().getStatus() == TopicStatus.SETTLED;
    }

    private static boolean isRetiredTopic(Throwable cause) {
        return cause instanceof WorthHubException e
                && (e.getCode() == ErrorCode.TopicNotFound || e.getCode() == ErrorCode.AlreadySettled);
    }

    public int activeTopics() {
        return executors.size();
    }

    public void shutdown() {
        log.info("Shutting down {} topic executors", executors.size());
        executors.values().forEach(TopicExecutor::shutdown);
        executors.clear();
    }
}
