package com.prediction.worthhub.worth_hub.execution;

/**
 * The closed instruction set of the program.
 */
public enum InstructionType {
    CREATE_TOPIC,
    COMMIT,
    REVEAL,
    FINALIZE,
    SETTLE
}
