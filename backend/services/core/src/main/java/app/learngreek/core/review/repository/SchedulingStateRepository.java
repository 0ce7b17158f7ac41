package app.learngreek.core.review.repository;

import app.learngreek.core.review.domain.ItemKind;
import app.learngreek.core.review.domain.Stage;
import app.learngreek.core.review.entity.SchedulingStateEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SchedulingStateRepository extends JpaRepository<SchedulingStateEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select s from SchedulingStateEntity s
            where s.learnerId = :learnerId
              and s.itemKind = :kind
              and s.itemId = :itemId
            """)
    Optional<SchedulingStateEntity> findForUpdate(@Param("learnerId") UUID learnerId,
                                                  @Param("kind") ItemKind kind,
                                                  @Param("itemId") UUID itemId);

    Optional<SchedulingStateEntity> findByLearnerIdAndItemKindAndItemId(UUID learnerId, ItemKind itemKind, UUID itemId);

    List<SchedulingStateEntity> findByLearnerIdAndItemKindAndItemIdIn(UUID learnerId,
                                                                      ItemKind itemKind,
                                                                      Collection<UUID> itemIds);

    @Query("""
            select s from SchedulingStateEntity s
            where s.learnerId = :learnerId
              and s.itemKind = :kind
              and s.nextReviewDate <= :today
            order by s.nextReviewDate asc, s.createdAt asc, s.itemId asc
            """)
    List<SchedulingStateEntity> findDue(@Param("learnerId") UUID learnerId,
                                        @Param("kind") ItemKind kind,
                                        @Param("today") LocalDate today,
                                        Pageable pageable);

    @Query("""
            select s from SchedulingStateEntity s
            where s.learnerId = :learnerId
              and s.itemKind = :kind
              and s.deckId = :deckId
              and s.nextReviewDate <= :today
            order by s.nextReviewDate asc, s.createdAt asc, s.itemId asc
            """)
    List<SchedulingStateEntity> findDueInDeck(@Param("learnerId") UUID learnerId,
                                              @Param("kind") ItemKind kind,
                                              @Param("deckId") UUID deckId,
                                              @Param("today") LocalDate today,
                                              Pageable pageable);

    @Query("""
            select s from SchedulingStateEntity s
            where s.learnerId = :learnerId
              and s.itemKind = :kind
              and s.nextReviewDate > :today
              and s.stage in :stages
            order by s.nextReviewDate asc, s.createdAt asc, s.itemId asc
            """)
    List<SchedulingStateEntity> findUpcoming(@Param("learnerId") UUID learnerId,
                                             @Param("kind") ItemKind kind,
                                             @Param("today") LocalDate today,
                                             @Param("stages") Collection<Stage> stages,
                                             Pageable pageable);

    @Query("""
            select s from SchedulingStateEntity s
            where s.learnerId = :learnerId
              and s.itemKind = :kind
              and s.deckId = :deckId
              and s.nextReviewDate > :today
              and s.stage in :stages
            order by s.nextReviewDate asc, s.createdAt asc, s.itemId asc
            """)
    List<SchedulingStateEntity> findUpcomingInDeck(@Param("learnerId") UUID learnerId,
                                                   @Param("kind") ItemKind kind,
                                                   @Param("deckId") UUID deckId,
                                                   @Param("today") LocalDate today,
                                                   @Param("stages") Collection<Stage> stages,
                                                   Pageable pageable);

    @Query("""
            select count(s.id) from SchedulingStateEntity s
            where s.learnerId = :learnerId
              and s.itemKind = :kind
              and s.nextReviewDate <= :today
            """)
    long countDue(@Param("learnerId") UUID learnerId,
                  @Param("kind") ItemKind kind,
                  @Param("today") LocalDate today);

    @Query("""
            select s.stage as stage, count(s.id) as total
            from SchedulingStateEntity s
            where s.learnerId = :learnerId
              and s.itemKind = :kind
            group by s.stage
            """)
    List<StageCountProjection> countByStage(@Param("learnerId") UUID learnerId,
                                            @Param("kind") ItemKind kind);

    interface StageCountProjection {
        Stage getStage();

        long getTotal();
    }
}
