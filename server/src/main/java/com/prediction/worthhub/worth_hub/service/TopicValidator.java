package com.prediction.worthhub.worth_hub.service;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import com.prediction.worthhub.worth_hub.entity.Commitment;
import com.prediction.worthhub.worth_hub.entity.Identity;
import com.prediction.worthhub.worth_hub.entity.Topic;
import com.prediction.worthhub.worth_hub.entity.TopicStatus;
import com.prediction.worthhub.worth_hub.error.ErrorCode;
import com.prediction.worthhub.worth_hub.error.WorthHubException;

import lombok.extern.slf4j.Slf4j;

/**
 * Precondition checks shared by every instruction.
 *
 * Checks are read-only and fail fast with the first violated rule, in the
 * order the instruction documents them. A passing check guarantees the
 * instruction can build its ledger write without further rejection.
 */
@Slf4j
public class TopicValidator {

    private final int maxDescriptionBytes;
    private final int maxSymbolBytes;

    public TopicValidator(int maxDescriptionBytes, int maxSymbolBytes) {
        this.maxDescriptionBytes = maxDescriptionBytes;
        this.maxSymbolBytes = maxSymbolBytes;
    }

    public void validateNewTopic(String description, String symbol, long commitDeadline, long revealDeadline,
            long minStake, long now) {
        if (utf8Length(description) > maxDescriptionBytes) {
            throw new WorthHubException(ErrorCode.DescriptionTooLong);
        }
        if (utf8Length(symbol) > maxSymbolBytes) {
            throw new WorthHubException(ErrorCode.SymbolTooLong);
        }
        if (commitDeadline <= now) {
            throw new WorthHubException(ErrorCode.InvalidDeadlines,
                    String.format("commit deadline %d is not in the future (now=%d)", commitDeadline, now));
        }
        if (revealDeadline <= commitDeadline) {
            throw new WorthHubException(ErrorCode.InvalidDeadlines,
                    String.format("reveal deadline %d must follow commit deadline %d", revealDeadline, commitDeadline));
        }
        if (minStake <= 0) {
            throw new WorthHubException(ErrorCode.InvalidMinStake);
        }
    }

    public void validateCommit(Topic topic, long stake, boolean alreadyCommitted, long now) {
        if (topic.getStatus() != TopicStatus.OPEN || now >= topic.getCommitDeadline()) {
            throw new WorthHubException(ErrorCode.CommitPhaseEnded);
        }
        if (stake <= 0) {
            throw new WorthHubException(ErrorCode.ZeroStake);
        }
        if (stake < topic.getMinStake()) {
            throw new WorthHubException(ErrorCode.StakeBelowMinimum,
                    String.format("stake %d < minimum %d", stake, topic.getMinStake()));
        }
        if (alreadyCommitted) {
            throw new WorthHubException(ErrorCode.DuplicateCommitment);
        }
    }

    public void validateReveal(Topic topic, Commitment commitment, long now) {
        if (commitment.isRevealed()) {
            throw new WorthHubException(ErrorCode.AlreadyRevealed);
        }
        if (now < topic.getCommitDeadline()) {
            throw new WorthHubException(ErrorCode.CommitPhaseNotEnded);
        }
        if (now >= topic.getRevealDeadline() || !topic.getStatus().acceptsReveals()) {
            throw new WorthHubException(ErrorCode.RevealPhaseEnded);
        }
    }

    public void validateFinalize(Topic topic, Identity caller, long now) {
        if (!topic.truthAuthorityIdentity().equals(caller)) {
            log.warn("Finalize rejected: caller {} is not the truth authority of topic {}", caller, topic.getTopicId());
            throw new WorthHubException(ErrorCode.UnauthorizedOracle);
        }
        switch (topic.getStatus()) {
            case FINALIZED -> throw new WorthHubException(ErrorCode.AlreadyFinalized);
            case SETTLED -> throw new WorthHubException(ErrorCode.AlreadySettled);
            default -> {
            }
        }
        if (now < topic.getRevealDeadline()) {
            throw new WorthHubException(ErrorCode.RevealPhaseNotEnded);
        }
    }

    public void validateSettleable(Topic topic) {
        if (topic.getStatus() == TopicStatus.SETTLED) {
            throw new WorthHubException(ErrorCode.AlreadySettled);
        }
        if (topic.getStatus() != TopicStatus.FINALIZED) {
            throw new WorthHubException(ErrorCode.InvalidTopicState,
                    "settle requires a finalized topic, status is " + topic.getStatus());
        }
    }

    /**
     * The supplied participants must be exactly the topic's committers: every
     * one must be known and none may be left out.
     */
    public void validateExhaustive(List<Commitment> commitments, Collection<Identity> participants) {
        Set<String> known = commitments.stream()
                .map(Commitment::getParticipant)
                .collect(Collectors.toSet());
        Set<String> supplied = participants.stream()
                .map(Identity::toHex)
                .collect(Collectors.toSet());

        for (String participant : supplied) {
            if (!known.contains(participant)) {
                throw new WorthHubException(ErrorCode.UnknownParticipant, participant);
            }
        }
        if (!supplied.containsAll(known)) {
            throw new WorthHubException(ErrorCode.PartialSettlementNotAllowed,
                    String.format("%d of %d commitments supplied", supplied.size(), known.size()));
        }
    }

    private static int utf8Length(String value) {
        return value == null ? 0 : value.getBytes(StandardCharsets.UTF_8).length;
    }
}
