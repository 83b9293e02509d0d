package com.prediction.worthhub.worth_hub.controller;

import static com.prediction.worthhub.worth_hub.support.Identities.identity;
import static com.prediction.worthhub.worth_hub.support.Identities.salt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.security.Principal;
import java.util.HexFormat;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prediction.worthhub.worth_hub.crypto.CommitmentScheme;
import com.prediction.worthhub.worth_hub.dto.CommitRequest;
import com.prediction.worthhub.worth_hub.dto.CreateTopicRequest;
import com.prediction.worthhub.worth_hub.dto.FinalizeRequest;
import com.prediction.worthhub.worth_hub.dto.RevealRequest;
import com.prediction.worthhub.worth_hub.dto.SettleRequest;
import com.prediction.worthhub.worth_hub.engine.SettlementEngine;
import com.prediction.worthhub.worth_hub.engine.TopicStateMachine;
import com.prediction.worthhub.worth_hub.entity.FixedPoint;
import com.prediction.worthhub.worth_hub.entity.Identity;
import com.prediction.worthhub.worth_hub.error.RestExceptionHandler;
import com.prediction.worthhub.worth_hub.execution.InstructionProcessor;
import com.prediction.worthhub.worth_hub.execution.TopicExecutionRegistry;
import com.prediction.worthhub.worth_hub.ledger.InMemoryLedgerStore;
import com.prediction.worthhub.worth_hub.service.EscrowService;
import com.prediction.worthhub.worth_hub.service.TopicValidator;
import com.prediction.worthhub.worth_hub.support.MutableClock;

@DisplayName("Topic REST API")
class TopicControllerTest {

    private static final long NOW = 1_700_000_000L;
    private static final long TOPIC_ID = 11L;
    private static final long STAKE = 100_000_000L;
    private static final long RESERVE = 890_880L;
    private static final HexFormat HEX = HexFormat.of();

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CommitmentScheme scheme = new CommitmentScheme();

    private final Identity creator = identity(0x01);
    private final Identity oracle = identity(0x0F);
    private final Identity alice = identity(0xA1);
    private final Identity bob = identity(0xB2);
    private final Identity carol = identity(0xC3);

    private MutableClock clock;
    private TopicExecutionRegistry registry;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        InMemoryLedgerStore store = new InMemoryLedgerStore();
        TopicStateMachine machine = new TopicStateMachine(store, scheme, new SettlementEngine(),
                new TopicValidator(256, 32), new EscrowService(store), clock, RESERVE, 0);
        registry = new TopicExecutionRegistry(new InstructionProcessor(machine));

        mockMvc = MockMvcBuilders.standaloneSetup(new TopicController(registry, machine))
                .setControllerAdvice(new RestExceptionHandler())
                .build();
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
    }

    private static Principal as(Identity signer) {
        return new UsernamePasswordAuthenticationToken(signer.toHex(), null, List.of());
    }

    private ResultActions postJson(String path, Object body, Identity signer) throws Exception {
        return mockMvc.perform(post(path)
                .principal(as(signer))
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)));
    }

    private ResultActions createTopic() throws Exception {
        return postJson("/api/topics", CreateTopicRequest.builder()
                .topicId(TOPIC_ID)
                .description("SOL/USD at close")
                .symbol("SOL")
                .commitDeadline(NOW + 100)
                .revealDeadline(NOW + 200)
                .minStake(1_000_000L)
                .truthAuthority(oracle.toHex())
                .build(), creator);
    }

    private ResultActions commit(Identity participant, String prediction, int saltFill) throws Exception {
        byte[] hash = scheme.compute(FixedPoint.of(prediction), salt(saltFill), participant);
        return postJson("/api/topics/" + TOPIC_ID + "/commit", CommitRequest.builder()
                .commitmentHash(HEX.formatHex(hash))
                .stake(STAKE)
                .build(), participant);
    }

    private ResultActions reveal(Identity participant, String prediction, int saltFill) throws Exception {
        return postJson("/api/topics/" + TOPIC_ID + "/reveal", RevealRequest.builder()
                .predictionValue(FixedPoint.of(prediction))
                .salt(HEX.formatHex(salt(saltFill)))
                .build(), participant);
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("Should run a topic from creation to settlement")
        void fullLifecycle() throws Exception {
            createTopic()
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.topicId").value(TOPIC_ID))
                    .andExpect(jsonPath("$.status").value("OPEN"))
                    .andExpect(jsonPath("$.statusCode").value(0));

            commit(alice, "150.00", 1).andExpect(status().isCreated())
                    .andExpect(jsonPath("$.submitOrder").value(0));
            commit(bob, "155.50", 2).andExpect(status().isCreated())
                    .andExpect(jsonPath("$.submitOrder").value(1));
            commit(carol, "148.00", 3).andExpect(status().isCreated());

            clock.setEpochSecond(NOW + 100);
            reveal(alice, "150.00", 1).andExpect(status().isOk())
                    .andExpect(jsonPath("$.revealed").value(true));
            reveal(bob, "155.50", 2).andExpect(status().isOk());

            clock.setEpochSecond(NOW + 200);
            postJson("/api/topics/" + TOPIC_ID + "/finalize",
                    FinalizeRequest.builder().truthValue(FixedPoint.of("151.00")).build(), oracle)
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("FINALIZED"));

            postJson("/api/topics/" + TOPIC_ID + "/settle",
                    SettleRequest.builder().participants(List.of(alice.toHex(), bob.toHex(), carol.toHex())).build(),
                    carol)
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("SETTLED"))
                    .andExpect(jsonPath("$.consensus").value(152_750_000))
                    .andExpect(jsonPath("$.payouts[0].payout").value((int) (2 * STAKE - RESERVE)))
                    .andExpect(jsonPath("$.payouts[1].payout").value((int) STAKE))
                    .andExpect(jsonPath("$.payouts[2].payout").value(0));

            mockMvc.perform(get("/api/topics/" + TOPIC_ID + "/escrow"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.balance").value((int) RESERVE));

            mockMvc.perform(get("/api/topics/" + TOPIC_ID + "/commitments"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.length()").value(3))
                    .andExpect(jsonPath("$[2].revealed").value(false));

            mockMvc.perform(get("/api/topics/" + TOPIC_ID + "/commitments/" + alice.toHex()))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.predictionValue").value(150_000_000))
                    .andExpect(jsonPath("$.settled").value(true));
        }
    }

    @Nested
    @DisplayName("Errors")
    class ErrorTests {

        @Test
        @DisplayName("Should answer 404 for an unknown topic")
        void notFound() throws Exception {
            mockMvc.perform(get("/api/topics/404"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error").value("TopicNotFound"))
                    .andExpect(jsonPath("$.category").value("NOT_FOUND"));
        }

        @Test
        @DisplayName("Should answer 409 for an instruction in the wrong phase")
        void wrongPhase() throws Exception {
            createTopic();
            clock.setEpochSecond(NOW + 100);

            commit(alice, "1.00", 1)
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error").value("CommitPhaseEnded"))
                    .andExpect(jsonPath("$.category").value("PHASE"));
        }

        @Test
        @DisplayName("Should answer 403 when someone other than the truth authority finalizes")
        void unauthorizedOracle() throws Exception {
            createTopic();
            clock.setEpochSecond(NOW + 200);

            postJson("/api/topics/" + TOPIC_ID + "/finalize", FinalizeRequest.builder().truthValue(1L).build(), alice)
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.error").value("UnauthorizedOracle"));
        }

        @Test
        @DisplayName("Should answer 400 for validation failures and malformed input")
        void badRequests() throws Exception {
            createTopic();
            createTopic()
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("TopicAlreadyExists"));

            postJson("/api/topics/" + TOPIC_ID + "/commit",
                    CommitRequest.builder().commitmentHash("zz").stake(STAKE).build(), alice)
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("InvalidArgument"));

            postJson("/api/topics/" + TOPIC_ID + "/commit",
                    CommitRequest.builder().commitmentHash("00".repeat(32)).build(), alice)
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.category").value("VALIDATION"));
        }
    }
}
