package com.prediction.worthhub.worth_hub.controller;

import java.security.Principal;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.prediction.worthhub.worth_hub.dto.CommitRequest;
import com.prediction.worthhub.worth_hub.dto.CommitmentView;
import com.prediction.worthhub.worth_hub.dto.CreateTopicRequest;
import com.prediction.worthhub.worth_hub.dto.EscrowView;
import com.prediction.worthhub.worth_hub.dto.FinalizeRequest;
import com.prediction.worthhub.worth_hub.dto.RevealRequest;
import com.prediction.worthhub.worth_hub.dto.SettleRequest;
import com.prediction.worthhub.worth_hub.dto.SettlementView;
import com.prediction.worthhub.worth_hub.dto.TopicView;
import com.prediction.worthhub.worth_hub.engine.TopicStateMachine;
import com.prediction.worthhub.worth_hub.entity.Identity;
import com.prediction.worthhub.worth_hub.execution.Instruction;
import com.prediction.worthhub.worth_hub.execution.InstructionReceipt;
import com.prediction.worthhub.worth_hub.execution.InstructionType;
import com.prediction.worthhub.worth_hub.execution.TopicExecutionRegistry;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Instructions are queued on the topic's executor; reads go straight to the ledger.
 */
@RestController
@RequestMapping("/api/topics")
@RequiredArgsConstructor
@Slf4j
public class TopicController {

    private static final HexFormat HEX = HexFormat.of();

    private final TopicExecutionRegistry registry;
    private final TopicStateMachine stateMachine;

    @PostMapping
    public ResponseEntity<TopicView> createTopic(@Valid @RequestBody CreateTopicRequest request, Principal principal) {
        InstructionReceipt receipt = registry.execute(Instruction.builder()
                .type(InstructionType.CREATE_TOPIC)
                .signer(signer(principal))
                .topicId(request.getTopicId())
                .description(request.getDescription())
                .symbol(request.getSymbol())
                .commitDeadline(request.getCommitDeadline())
                .revealDeadline(request.getRevealDeadline())
                .minStake(request.getMinStake())
                .truthAuthority(Identity.fromHex(request.getTruthAuthority()))
                .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(TopicView.from(receipt.getTopic()));
    }

    @PostMapping("/{topicId}/commit")
    public ResponseEntity<CommitmentView> commit(@PathVariable long topicId,
            @Valid @RequestBody CommitRequest request, Principal principal) {
        InstructionReceipt receipt = registry.execute(Instruction.builder()
                .type(InstructionType.COMMIT)
                .signer(signer(principal))
                .topicId(topicId)
                .commitmentHash(HEX.parseHex(request.getCommitmentHash()))
                .stake(request.getStake())
                .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(CommitmentView.from(receipt.getCommitment()));
    }

    @PostMapping("/{topicId}/reveal")
    public ResponseEntity<CommitmentView> reveal(@PathVariable long topicId,
            @Valid @RequestBody RevealRequest request, Principal principal) {
        InstructionReceipt receipt = registry.execute(Instruction.builder()
                .type(InstructionType.REVEAL)
                .signer(signer(principal))
                .topicId(topicId)
                .predictionValue(request.getPredictionValue())
                .salt(HEX.parseHex(request.getSalt()))
                .build());
        return ResponseEntity.ok(CommitmentView.from(receipt.getCommitment()));
    }

    @PostMapping("/{topicId}/finalize")
    public ResponseEntity<TopicView> finalizeTopic(@PathVariable long topicId,
            @Valid @RequestBody FinalizeRequest request, Principal principal) {
        InstructionReceipt receipt = registry.execute(Instruction.builder()
                .type(InstructionType.FINALIZE)
                .signer(signer(principal))
                .topicId(topicId)
                .truthValue(request.getTruthValue())
                .build());
        return ResponseEntity.ok(TopicView.from(receipt.getTopic()));
    }

    @PostMapping("/{topicId}/settle")
    public ResponseEntity<SettlementView> settle(@PathVariable long topicId,
            @Valid @RequestBody SettleRequest request, Principal principal) {
        List<Identity> participants = request.getParticipants().stream()
                .map(Identity::fromHex)
                .collect(Collectors.toList());
        InstructionReceipt receipt = registry.execute(Instruction.builder()
                .type(InstructionType.SETTLE)
                .signer(signer(principal))
                .topicId(topicId)
                .participants(participants)
                .build());
        return ResponseEntity.ok(SettlementView.from(receipt.getSettlement()));
    }

    @GetMapping("/{topicId}")
    public ResponseEntity<TopicView> getTopic(@PathVariable long topicId) {
        return ResponseEntity.ok(TopicView.from(stateMachine.getTopic(topicId)));
    }

    @GetMapping("/{topicId}/commitments")
    public ResponseEntity<List<CommitmentView>> getCommitments(@PathVariable long topicId) {
        List<CommitmentView> commitments = stateMachine.getCommitments(topicId).stream()
                .map(CommitmentView::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(commitments);
    }

    @GetMapping("/{topicId}/commitments/{participant}")
    public ResponseEntity<CommitmentView> getCommitment(@PathVariable long topicId, @PathVariable String participant) {
        return ResponseEntity.ok(CommitmentView.from(
                stateMachine.getCommitment(topicId, Identity.fromHex(participant))));
    }

    @GetMapping("/{topicId}/escrow")
    public ResponseEntity<EscrowView> getEscrow(@PathVariable long topicId) {
        return ResponseEntity.ok(EscrowView.from(stateMachine.getEscrow(topicId)));
    }

    private static Identity signer(Principal principal) {
        if (principal == null) {
            throw new IllegalArgumentException("Instruction has no signer");
        }
        return Identity.fromHex(principal.getName());
    }
}
