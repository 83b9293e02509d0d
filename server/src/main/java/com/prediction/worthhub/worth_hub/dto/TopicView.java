package com.prediction.worthhub.worth_hub.dto;

import com.prediction.worthhub.worth_hub.entity.Topic;
import com.prediction.worthhub.worth_hub.entity.TopicStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@AllArgsConstructor
public class TopicView {

    private final String address;
    private final long topicId;
    private final String creator;
    private final String truthAuthority;
    private final String description;
    private final String symbol;
    private final long commitDeadline;
    private final long revealDeadline;
    private final long minStake;
    private final TopicStatus status;
    private final int statusCode;

    /** Null until the topic is finalized. */
    private final Long truthValue;

    private final long totalStake;
    private final int commitmentCount;
    private final int revealCount;

    public static TopicView from(Topic topic) {
        boolean hasTruth = topic.getStatus() == TopicStatus.FINALIZED || topic.getStatus() == TopicStatus.SETTLED;
        return TopicView.builder()
                .address(topic.getId())
                .topicId(topic.getTopicId())
                .creator(topic.getCreator())
                .truthAuthority(topic.getTruthAuthority())
                .description(topic.getDescription())
                .symbol(topic.getSymbol())
                .commitDeadline(topic.getCommitDeadline())
                .revealDeadline(topic.getRevealDeadline())
                .minStake(topic.getMinStake())
                .status(topic.getStatus())
                .statusCode(topic.getStatus().getCode())
                .truthValue(hasTruth ? topic.getTruthValue() : null)
                .totalStake(topic.getTotalStake())
                .commitmentCount(topic.getCommitmentCount())
                .revealCount(topic.getRevealCount())
                .build();
    }
}
