package villagecompute.inspections.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

import org.jboss.logging.Logger;

import villagecompute.inspections.data.models.Regulation.RankedRegulation;
import villagecompute.inspections.data.models.Violation;
import villagecompute.inspections.integration.ai.PotentialViolation;

/**
 * Persists AI findings as reviewable violations and links them to regulations.
 *
 * <p>
 * <b>Regulation linking:</b> standard numbers suggested by the model are matched exactly first, in order, with the
 * first match marked primary. When none of them is in the catalog, the finding's description and category are run
 * through full-text search and the top hits are linked with their rank as relevance.
 */
@ApplicationScoped
public class ViolationService {

    private static final Logger LOG = Logger.getLogger(ViolationService.class);

    static final int SEARCH_FALLBACK_LIMIT = 3;
    static final String EXPLANATION_SUGGESTED = "Suggested by AI image analysis";
    static final String EXPLANATION_SEARCH = "Matched by full-text search of the violation description";

    @Inject
    RegulationService regulationService;

    @Inject
    ObjectMapper objectMapper;

    /**
     * Creates a {@code pending} violation from one finding.
     *
     * @param sortOrder
     *            1-based position of the finding within its image
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public UUID createFromFinding(UUID inspectionId, UUID imageId, PotentialViolation finding, int sortOrder) {
        Violation violation = new Violation();
        violation.id = UUID.randomUUID();
        violation.inspectionId = inspectionId;
        violation.imageId = imageId;
        violation.description = finding.description();
        violation.aiDescription = aiDescription(finding);
        violation.confidence = finding.confidence().getValue();
        violation.severity = finding.severity().getValue();
        violation.boundingBox = boundingBoxJson(finding);
        violation.status = Violation.STATUS_PENDING;
        violation.sortOrder = sortOrder;
        violation.createdAt = Instant.now();
        violation.persist();

        LOG.infof("Created violation %s (confidence: %s, severity: %s)", violation.id, violation.confidence,
                violation.severity);
        return violation.id;
    }

    /**
     * Links regulations to a violation. Failures of single links are logged and skipped.
     *
     * @return number of links created
     */
    public int linkRegulations(UUID violationId, PotentialViolation finding) {
        int linked = 0;
        for (String standardNumber : finding.suggestedRegulations()) {
            try {
                Optional<UUID> regulationId = regulationService.findIdByStandardNumber(standardNumber);
                if (regulationId.isEmpty()) {
                    LOG.debugf("Suggested regulation %s not in catalog", standardNumber);
                    continue;
                }
                if (regulationService.linkToViolation(violationId, regulationId.get(), BigDecimal.ONE,
                        EXPLANATION_SUGGESTED, linked == 0)) {
                    linked++;
                }
            } catch (RuntimeException e) {
                LOG.warnf(e, "Failed to link regulation %s to violation %s", standardNumber, violationId);
            }
        }
        if (linked > 0) {
            return linked;
        }

        String query = searchQuery(finding);
        try {
            for (RankedRegulation hit : regulationService.search(query, SEARCH_FALLBACK_LIMIT)) {
                if (regulationService.linkToViolation(violationId, hit.regulationId(), relevance(hit.rank()),
                        EXPLANATION_SEARCH, linked == 0)) {
                    linked++;
                }
            }
        } catch (RuntimeException e) {
            LOG.warnf(e, "Regulation search failed for violation %s", violationId);
        }
        return linked;
    }

    static String aiDescription(PotentialViolation finding) {
        if (finding.location() == null || finding.location().isBlank()) {
            return finding.description();
        }
        return finding.description() + " (Location: " + finding.location() + ")";
    }

    static String searchQuery(PotentialViolation finding) {
        if (finding.category() == null || finding.category().isBlank()) {
            return finding.description();
        }
        return finding.description() + " " + finding.category();
    }

    // relevance_score is numeric(5,4)
    static BigDecimal relevance(BigDecimal rank) {
        BigDecimal capped = rank.min(BigDecimal.ONE).max(BigDecimal.ZERO);
        return capped.setScale(4, RoundingMode.HALF_UP);
    }

    private String boundingBoxJson(PotentialViolation finding) {
        if (finding.boundingBox() == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(finding.boundingBox());
        } catch (JsonProcessingException e) {
            LOG.warnf(e, "Failed to serialize bounding box, storing violation without it");
            return null;
        }
    }
}
