package com.tennis.features.api.repository.readonly;

import com.tennis.features.api.model.readonly.PlayerDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

/**
 * Read-only repository for players.
 */
@Repository
public interface PlayerReadRepository extends MongoRepository<PlayerDocument, String> {
}
