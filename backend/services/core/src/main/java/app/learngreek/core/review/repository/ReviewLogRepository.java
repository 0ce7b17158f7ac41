package app.learngreek.core.review.repository;

import app.learngreek.core.review.domain.ItemKind;
import app.learngreek.core.review.entity.ReviewLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface ReviewLogRepository extends JpaRepository<ReviewLogEntity, Long> {

    @Query("""
            select count(r.id) from ReviewLogEntity r
            where r.learnerId = :learnerId
              and r.itemKind = :kind
              and r.answeredAt >= :from
              and r.answeredAt < :to
            """)
    long countAnsweredBetween(@Param("learnerId") UUID learnerId,
                              @Param("kind") ItemKind kind,
                              @Param("from") Instant from,
                              @Param("to") Instant to);

    @Query("""
            select r.answeredAt from ReviewLogEntity r
            where r.learnerId = :learnerId
              and r.answeredAt >= :from
            order by r.answeredAt desc
            """)
    List<Instant> findAnsweredAtSince(@Param("learnerId") UUID learnerId,
                                      @Param("from") Instant from);

    @Query("""
            select count(r.id) as total,
                   coalesce(sum(case when r.quality >= 3 then 1 else 0 end), 0) as correct
            from ReviewLogEntity r
            where r.learnerId = :learnerId
              and r.itemKind = :kind
              and r.itemId in :itemIds
            """)
    AnswerTallyProjection tallyAnswers(@Param("learnerId") UUID learnerId,
                                       @Param("kind") ItemKind kind,
                                       @Param("itemIds") Collection<UUID> itemIds);

    interface AnswerTallyProjection {
        long getTotal();

        long getCorrect();
    }
}
