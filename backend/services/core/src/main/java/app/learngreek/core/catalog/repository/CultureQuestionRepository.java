package app.learngreek.core.catalog.repository;

import app.learngreek.core.catalog.domain.entity.CultureQuestionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface CultureQuestionRepository extends JpaRepository<CultureQuestionEntity, UUID> {

    @Query(value = """
            select q.*
            from app_core.culture_questions q
            join app_core.decks d on d.deck_id = q.deck_id
            where d.is_active = true
              and not exists (
                  select 1 from app_core.item_scheduling_states s
                  where s.learner_id = :learnerId
                    and s.item_kind = 'CULTURE_QUESTION'
                    and s.item_id = q.question_id
              )
            order by q.order_index asc, q.created_at asc, q.question_id asc
            limit :limit
            """, nativeQuery = true)
    List<CultureQuestionEntity> findUnseen(@Param("learnerId") UUID learnerId,
                                           @Param("limit") int limit);

    @Query(value = """
            select q.*
            from app_core.culture_questions q
            join app_core.decks d on d.deck_id = q.deck_id
            where d.is_active = true
              and q.deck_id = :deckId
              and not exists (
                  select 1 from app_core.item_scheduling_states s
                  where s.learner_id = :learnerId
                    and s.item_kind = 'CULTURE_QUESTION'
                    and s.item_id = q.question_id
              )
            order by q.order_index asc, q.created_at asc, q.question_id asc
            limit :limit
            """, nativeQuery = true)
    List<CultureQuestionEntity> findUnseenInDeck(@Param("learnerId") UUID learnerId,
                                                 @Param("deckId") UUID deckId,
                                                 @Param("limit") int limit);

    @Query("""
            select q.questionId as questionId,
                   q.deckId as deckId,
                   d.category as category,
                   q.orderIndex as orderIndex
            from CultureQuestionEntity q, DeckEntity d
            where d.deckId = q.deckId
              and d.active = true
              and d.category in :categories
            order by q.orderIndex asc, q.questionId asc
            """)
    List<CategorizedQuestionProjection> findInCategories(@Param("categories") Collection<String> categories);

    @Query("""
            select count(q.questionId) from CultureQuestionEntity q, DeckEntity d
            where d.deckId = q.deckId
              and d.active = true
            """)
    long countActive();

    interface CategorizedQuestionProjection {
        UUID getQuestionId();

        UUID getDeckId();

        String getCategory();

        int getOrderIndex();
    }
}
