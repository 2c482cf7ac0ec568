package villagecompute.inspections.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import villagecompute.inspections.data.models.Regulation.RankedRegulation;
import villagecompute.inspections.integration.ai.Confidence;
import villagecompute.inspections.integration.ai.PotentialViolation;
import villagecompute.inspections.integration.ai.Severity;

/**
 * Unit tests for {@link ViolationService} regulation linking.
 */
class ViolationServiceTest {

    @Mock
    RegulationService regulationService;

    @InjectMocks
    ViolationService service;

    private final UUID violationId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(regulationService.linkToViolation(any(), any(), any(), anyString(), anyBoolean())).thenReturn(true);
    }

    private static PotentialViolation finding(List<String> suggestions) {
        return new PotentialViolation("Worker on scaffold without guardrail", "north elevation, level 3", null,
                Confidence.HIGH, "Fall Protection", Severity.SERIOUS, suggestions);
    }

    @Test
    void testSuggestedRegulations_firstMatchIsPrimary() {
        UUID guardrails = UUID.randomUUID();
        UUID scaffolds = UUID.randomUUID();
        when(regulationService.findIdByStandardNumber("1926.451(g)(4)")).thenReturn(Optional.of(guardrails));
        when(regulationService.findIdByStandardNumber("1926.9999")).thenReturn(Optional.empty());
        when(regulationService.findIdByStandardNumber("1926.451")).thenReturn(Optional.of(scaffolds));

        int linked = service.linkRegulations(violationId,
                finding(List.of("1926.9999", "1926.451(g)(4)", "1926.451")));

        assertEquals(2, linked);
        verify(regulationService).linkToViolation(violationId, guardrails, BigDecimal.ONE,
                ViolationService.EXPLANATION_SUGGESTED, true);
        verify(regulationService).linkToViolation(violationId, scaffolds, BigDecimal.ONE,
                ViolationService.EXPLANATION_SUGGESTED, false);
        verify(regulationService, never()).search(anyString(), anyInt());
    }

    @Test
    void testNoSuggestionMatches_fallsBackToSearch() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        when(regulationService.findIdByStandardNumber(anyString())).thenReturn(Optional.empty());
        when(regulationService.search("Worker on scaffold without guardrail Fall Protection",
                ViolationService.SEARCH_FALLBACK_LIMIT))
                .thenReturn(List.of(new RankedRegulation(first, new BigDecimal("1.73")),
                        new RankedRegulation(second, new BigDecimal("0.061234"))));

        int linked = service.linkRegulations(violationId, finding(List.of("1926.9999")));

        assertEquals(2, linked);
        verify(regulationService).linkToViolation(violationId, first, new BigDecimal("1.0000"),
                ViolationService.EXPLANATION_SEARCH, true);
        verify(regulationService).linkToViolation(violationId, second, new BigDecimal("0.0612"),
                ViolationService.EXPLANATION_SEARCH, false);
    }

    @Test
    void testSearchFailure_isSwallowed() {
        when(regulationService.search(anyString(), anyInt())).thenThrow(new IllegalStateException("db down"));

        assertEquals(0, service.linkRegulations(violationId, finding(List.of())));
    }

    @Test
    void testSingleLinkFailure_doesNotStopOthers() {
        UUID broken = UUID.randomUUID();
        UUID ok = UUID.randomUUID();
        when(regulationService.findIdByStandardNumber("A")).thenReturn(Optional.of(broken));
        when(regulationService.findIdByStandardNumber("B")).thenReturn(Optional.of(ok));
        when(regulationService.linkToViolation(eq(violationId), eq(broken), any(), anyString(), anyBoolean()))
                .thenThrow(new IllegalStateException("constraint violation"));

        assertEquals(1, service.linkRegulations(violationId, finding(List.of("A", "B"))));
        verify(regulationService).linkToViolation(violationId, ok, BigDecimal.ONE,
                ViolationService.EXPLANATION_SUGGESTED, true);
    }

    @Test
    void testExistingLink_isNotCounted() {
        UUID regulation = UUID.randomUUID();
        when(regulationService.findIdByStandardNumber("1926.501")).thenReturn(Optional.of(regulation));
        when(regulationService.linkToViolation(eq(violationId), eq(regulation), any(), anyString(), anyBoolean()))
                .thenReturn(false);
        when(regulationService.search(anyString(), anyInt())).thenReturn(List.of());

        assertEquals(0, service.linkRegulations(violationId, finding(List.of("1926.501"))));
    }

    @Test
    void testAiDescription_appendsLocation() {
        assertEquals("Worker on scaffold without guardrail (Location: north elevation, level 3)",
                ViolationService.aiDescription(finding(List.of())));
        PotentialViolation noLocation = new PotentialViolation("Missing hard hat", " ", null, Confidence.LOW, null,
                Severity.OTHER, List.of());
        assertEquals("Missing hard hat", ViolationService.aiDescription(noLocation));
        assertEquals("Missing hard hat", ViolationService.searchQuery(noLocation));
    }

    @Test
    void testRelevance_isClampedAndScaled() {
        assertEquals(new BigDecimal("1.0000"), ViolationService.relevance(new BigDecimal("3.2")));
        assertEquals(new BigDecimal("0.0000"), ViolationService.relevance(new BigDecimal("-0.5")));
        assertEquals(new BigDecimal("0.1235"), ViolationService.relevance(new BigDecimal("0.12345")));
    }
}
