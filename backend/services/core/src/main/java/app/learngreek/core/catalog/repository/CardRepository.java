package app.learngreek.core.catalog.repository;

import app.learngreek.core.catalog.domain.entity.CardEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CardRepository extends JpaRepository<CardEntity, UUID> {

    @Query(value = """
            select c.*
            from app_core.cards c
            join app_core.decks d on d.deck_id = c.deck_id
            where d.is_active = true
              and not exists (
                  select 1 from app_core.item_scheduling_states s
                  where s.learner_id = :learnerId
                    and s.item_kind = 'VOCABULARY_CARD'
                    and s.item_id = c.card_id
              )
            order by c.order_index asc, c.created_at asc, c.card_id asc
            limit :limit
            """, nativeQuery = true)
    List<CardEntity> findUnseen(@Param("learnerId") UUID learnerId,
                                @Param("limit") int limit);

    @Query(value = """
            select c.*
            from app_core.cards c
            join app_core.decks d on d.deck_id = c.deck_id
            where d.is_active = true
              and c.deck_id = :deckId
              and not exists (
                  select 1 from app_core.item_scheduling_states s
                  where s.learner_id = :learnerId
                    and s.item_kind = 'VOCABULARY_CARD'
                    and s.item_id = c.card_id
              )
            order by c.order_index asc, c.created_at asc, c.card_id asc
            limit :limit
            """, nativeQuery = true)
    List<CardEntity> findUnseenInDeck(@Param("learnerId") UUID learnerId,
                                      @Param("deckId") UUID deckId,
                                      @Param("limit") int limit);

    @Query("""
            select count(c.cardId) from CardEntity c, DeckEntity d
            where d.deckId = c.deckId
              and d.active = true
            """)
    long countActive();
}
