package com.tennis.features.api.repository.readonly;

import com.tennis.features.api.model.readonly.MatchDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

/**
 * Read-only repository for finished matches.
 * Note: Write operations will fail with MongoDB authorization error.
 */
@Repository
public interface MatchReadRepository extends MongoRepository<MatchDocument, String> {
}
