package io.github.drompincen.aigov.gateway.controller;

import io.github.drompincen.aigov.persistence.document.DecisionDocument;
import io.github.drompincen.aigov.protocol.api.DecisionDto;
import io.github.drompincen.aigov.runtime.decision.DecisionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DecisionControllerTest {

    @Mock private DecisionService decisionService;

    private DecisionController controller;

    @BeforeEach
    void setUp() {
        controller = new DecisionController(decisionService);
    }

    private static DecisionDocument decision(String id, int number) {
        DecisionDocument d = new DecisionDocument();
        d.setId(id);
        d.setProjectId("widgets");
        d.setDecisionNumber(number);
        d.setTitle("Decision " + number);
        return d;
    }

    @Test
    void listMapsRecentDecisions() {
        when(decisionService.recent("widgets", 20)).thenReturn(List.of(decision("d2", 2), decision("d1", 1)));

        List<DecisionDto> result = controller.list("widgets", 20);

        assertThat(result).extracting(DecisionDto::decisionNumber).containsExactly(2, 1);
    }

    @Test
    void getReturns404WhenMissing() {
        when(decisionService.get("x")).thenReturn(Optional.empty());
        ResponseEntity<DecisionDto> response = controller.get("x");
        assertThat(response.getStatusCode().value()).isEqualTo(404);
    }

    @Test
    void getReturnsDecision() {
        when(decisionService.get("d1")).thenReturn(Optional.of(decision("d1", 1)));
        assertThat(controller.get("d1").getBody().title()).isEqualTo("Decision 1");
    }
}
