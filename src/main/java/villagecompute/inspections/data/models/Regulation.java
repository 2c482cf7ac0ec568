package villagecompute.inspections.data.models;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * OSHA construction standard (29 CFR 1926) used to back up a violation.
 */
@Entity
@Table(
        name = "regulations")
public class Regulation extends PanacheEntityBase {

    /**
     * Full-text search over standard number, title, category, summary and text, ranked by {@code ts_rank}.
     */
    static final String QUERY_SEARCH = "SELECT r.id, ts_rank(to_tsvector('english', coalesce(r.standard_number, '') "
            + "|| ' ' || coalesce(r.title, '') || ' ' || coalesce(r.category, '') || ' ' || coalesce(r.summary, '') "
            + "|| ' ' || coalesce(r.full_text, '')), websearch_to_tsquery('english', :query)) AS rank "
            + "FROM regulations r WHERE to_tsvector('english', coalesce(r.standard_number, '') || ' ' "
            + "|| coalesce(r.title, '') || ' ' || coalesce(r.category, '') || ' ' || coalesce(r.summary, '') || ' ' "
            + "|| coalesce(r.full_text, '')) @@ websearch_to_tsquery('english', :query) ORDER BY rank DESC LIMIT :limit";

    @Id
    public UUID id;

    @Column(
            name = "standard_number",
            nullable = false,
            unique = true,
            length = 50)
    public String standardNumber;

    @Column(
            nullable = false)
    public String title;

    @Column(
            nullable = false,
            length = 100)
    public String category;

    @Column(
            length = 100)
    public String subcategory;

    @Column(
            columnDefinition = "text")
    public String summary;

    @Column(
            name = "full_text",
            nullable = false,
            columnDefinition = "text")
    public String fullText;

    public static Optional<Regulation> findByStandardNumber(String standardNumber) {
        return find("standardNumber", standardNumber).firstResultOptional();
    }

    /**
     * Runs the full-text search and returns regulation ids with their rank, best first.
     */
    @SuppressWarnings("unchecked")
    public static List<RankedRegulation> search(String query, int limit) {
        List<Object[]> rows = getEntityManager().createNativeQuery(QUERY_SEARCH).setParameter("query", query)
                .setParameter("limit", limit).getResultList();
        List<RankedRegulation> results = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            results.add(new RankedRegulation((UUID) row[0], new BigDecimal(row[1].toString())));
        }
        return results;
    }

    /**
     * Search hit: regulation id and its {@code ts_rank}.
     */
    public record RankedRegulation(UUID regulationId, BigDecimal rank) {
    }
}
