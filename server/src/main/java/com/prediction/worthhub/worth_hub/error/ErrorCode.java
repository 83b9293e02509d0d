package com.prediction.worthhub.worth_hub.error;

/**
 * Typed failures of the topic lifecycle. The enum name is the stable error
 * identifier returned to clients.
 */
public enum ErrorCode {

    // Validation
    DescriptionTooLong(ErrorCategory.VALIDATION, "Description too long (max 256 bytes)"),
    SymbolTooLong(ErrorCategory.VALIDATION, "Symbol too long (max 32 bytes)"),
    InvalidDeadlines(ErrorCategory.VALIDATION, "Invalid deadline configuration"),
    InvalidMinStake(ErrorCategory.VALIDATION, "Minimum stake must be greater than zero"),
    ZeroStake(ErrorCategory.VALIDATION, "Stake amount must be greater than zero"),
    StakeBelowMinimum(ErrorCategory.VALIDATION, "Stake amount is below the minimum required"),
    DuplicateCommitment(ErrorCategory.VALIDATION, "Participant already committed to this topic"),
    InvalidCommitmentHash(ErrorCategory.VALIDATION, "Commitment hash must be exactly 32 bytes"),
    InvalidSalt(ErrorCategory.VALIDATION, "Salt must be exactly 32 bytes"),
    TopicAlreadyExists(ErrorCategory.VALIDATION, "A topic with this id already exists"),

    // Phase
    CommitPhaseEnded(ErrorCategory.PHASE, "Commit phase has ended"),
    CommitPhaseNotEnded(ErrorCategory.PHASE, "Commit phase has not ended yet"),
    RevealPhaseEnded(ErrorCategory.PHASE, "Reveal phase has ended"),
    RevealPhaseNotEnded(ErrorCategory.PHASE, "Reveal phase has not ended yet"),
    AlreadyRevealed(ErrorCategory.PHASE, "Commitment has already been revealed"),
    AlreadyFinalized(ErrorCategory.PHASE, "Topic has already been finalized"),
    AlreadySettled(ErrorCategory.PHASE, "Topic has already been settled"),
    InvalidTopicState(ErrorCategory.PHASE, "Topic is not in the correct state for this operation"),

    // Integrity
    HashMismatch(ErrorCategory.INTEGRITY, "Commitment hash does not match the revealed values"),
    UnknownParticipant(ErrorCategory.INTEGRITY, "Participant has no commitment for this topic"),
    PartialSettlementNotAllowed(ErrorCategory.INTEGRITY, "Settlement must include every commitment of the topic"),
    ArithmeticOverflow(ErrorCategory.INTEGRITY, "Arithmetic overflow"),

    // Authorization
    UnauthorizedOracle(ErrorCategory.AUTHORIZATION, "Unauthorized: only the truth authority can finalize"),

    // Not found
    TopicNotFound(ErrorCategory.NOT_FOUND, "Topic not found");

    private final ErrorCategory category;
    private final String message;

    ErrorCode(ErrorCategory category, String message) {
        this.category = category;
        this.message = message;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public String getMessage() {
        return message;
    }
}
