package villagecompute.inspections.services;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;

import org.jboss.logging.Logger;

import villagecompute.inspections.data.models.Regulation;
import villagecompute.inspections.data.models.Regulation.RankedRegulation;
import villagecompute.inspections.data.models.ViolationRegulation;

/**
 * Lookup and full-text search over the OSHA regulation catalog, and violation links.
 */
@ApplicationScoped
public class RegulationService {

    private static final Logger LOG = Logger.getLogger(RegulationService.class);

    @Transactional
    public Optional<UUID> findIdByStandardNumber(String standardNumber) {
        if (standardNumber == null || standardNumber.isBlank()) {
            return Optional.empty();
        }
        return Regulation.findByStandardNumber(standardNumber.strip()).map(regulation -> regulation.id);
    }

    /**
     * Ranks regulations against free text with PostgreSQL {@code websearch_to_tsquery}.
     */
    @Transactional
    public List<RankedRegulation> search(String query, int limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        return Regulation.search(query, limit);
    }

    /**
     * Links a regulation to a violation unless the pair is already linked.
     *
     * @return true if a link was created
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public boolean linkToViolation(UUID violationId, UUID regulationId, BigDecimal relevanceScore, String explanation,
            boolean primary) {
        if (ViolationRegulation.exists(violationId, regulationId)) {
            return false;
        }
        ViolationRegulation link = new ViolationRegulation();
        link.id = UUID.randomUUID();
        link.violationId = violationId;
        link.regulationId = regulationId;
        link.relevanceScore = relevanceScore;
        link.aiExplanation = explanation;
        link.isPrimary = primary;
        link.createdAt = Instant.now();
        link.persist();
        LOG.debugf("Linked regulation %s to violation %s (relevance %s)", regulationId, violationId, relevanceScore);
        return true;
    }
}
