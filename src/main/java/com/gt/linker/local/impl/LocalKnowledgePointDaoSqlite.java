package com.gt.linker.local.impl;

import com.gt.linker.exception.LocalPersistenceException;
import com.gt.linker.local.LocalKnowledgePointDao;
import com.gt.linker.local.LocalKnowledgePointRow;
import com.gt.linker.model.CompositeKnowledgePointId;
import com.gt.linker.model.KnowledgePoint;
import com.gt.linker.model.Origin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public class LocalKnowledgePointDaoSqlite implements LocalKnowledgePointDao {

    private static final Logger log = LoggerFactory.getLogger(LocalKnowledgePointDaoSqlite.class);

    private static final String ALL_COLUMNS =
            "row_id, owner_id, sequence_id, legacy_id, ancient_id, category, subcategory, correct_phrase, explanation, " +
            "user_context_sentence, incorrect_phrase_in_context, key_point_summary, mastery_level, mistake_count, " +
            "correct_count, review_streak, next_review_date, last_ai_review_date, ai_review_notes, is_archived, origin, last_modified";

    private static final String LOAD_ALL_SQL =
            "SELECT " + ALL_COLUMNS + " FROM knowledge_point ORDER BY row_id";

    private static final String INSERT_SQL =
            "INSERT INTO knowledge_point " +
                    "(owner_id, sequence_id, legacy_id, ancient_id, category, subcategory, correct_phrase, explanation, " +
                    "user_context_sentence, incorrect_phrase_in_context, key_point_summary, mastery_level, mistake_count, " +
                    "correct_count, review_streak, next_review_date, last_ai_review_date, ai_review_notes, is_archived, origin, last_modified) " +
            "VALUES (:ownerId, :sequenceId, :legacyId, :ancientId, :category, :subcategory, :correctPhrase, :explanation, " +
                    ":userContextSentence, :incorrectPhraseInContext, :keyPointSummary, :masteryLevel, :mistakeCount, " +
                    ":correctCount, :reviewStreak, :nextReviewDate, :lastAiReviewDate, :aiReviewNotes, :archived, :origin, :lastModified)";

    // IS gives null-safe equality in SQLite, guest points may have no category
    private static final String UPDATE_LOCAL_BY_CONTENT_KEY_SQL =
            "UPDATE knowledge_point " +
            "SET subcategory = :subcategory, explanation = :explanation, user_context_sentence = :userContextSentence, " +
                "incorrect_phrase_in_context = :incorrectPhraseInContext, key_point_summary = :keyPointSummary, " +
                "mastery_level = :masteryLevel, mistake_count = :mistakeCount, correct_count = :correctCount, " +
                "review_streak = :reviewStreak, next_review_date = :nextReviewDate, last_ai_review_date = :lastAiReviewDate, " +
                "ai_review_notes = :aiReviewNotes, is_archived = :archived, last_modified = :lastModified " +
            "WHERE origin = 'Local' AND category IS :category AND correct_phrase = :correctPhrase";

    private static final String COUNT_BY_ORIGIN_SQL =
            "SELECT COUNT(*) FROM knowledge_point WHERE origin = :origin";

    private static final String DELETE_ROWS_SQL =
            "DELETE FROM knowledge_point WHERE row_id IN (:rowIds)";

    private static final String DELETE_BY_ORIGIN_SQL =
            "DELETE FROM knowledge_point WHERE origin = :origin";

    private static final String DELETE_CACHED_REMOTE_SQL =
            "DELETE FROM knowledge_point WHERE origin = 'Remote' AND is_archived = :archived";

    private final NamedParameterJdbcTemplate template;
    private final TransactionTemplate transactionTemplate;

    public LocalKnowledgePointDaoSqlite(NamedParameterJdbcTemplate namedParameterJdbcTemplate, TransactionTemplate transactionTemplate) {
        this.template = namedParameterJdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public List<LocalKnowledgePointRow> loadAll() {
        try {
            return template.query(LOAD_ALL_SQL, LocalKnowledgePointDaoSqlite::getRowFromResultSet);
        } catch (DataAccessException ex) {
            throw persistenceFailure("Error loading knowledge points from local store", ex);
        }
    }

    @Override
    public int insert(KnowledgePoint point) {
        try {
            return template.update(INSERT_SQL, toParams(point));
        } catch (DataAccessException ex) {
            throw persistenceFailure("Error saving knowledge point \"" + point.correctPhrase() + "\" to local store", ex);
        }
    }

    @Override
    public int updateLocalByContentKey(KnowledgePoint point) {
        try {
            return template.update(UPDATE_LOCAL_BY_CONTENT_KEY_SQL, toParams(point));
        } catch (DataAccessException ex) {
            throw persistenceFailure("Error updating knowledge point \"" + point.correctPhrase() + "\" in local store", ex);
        }
    }

    @Override
    public int countByOrigin(Origin origin) {
        try {
            Integer count = template.queryForObject(COUNT_BY_ORIGIN_SQL, Map.of("origin", origin.name()), Integer.class);
            return count == null ? 0 : count;
        } catch (DataAccessException ex) {
            throw persistenceFailure("Error counting " + origin + " knowledge points in local store", ex);
        }
    }

    @Override
    public int deleteRows(Collection<Long> rowIds) {
        if (rowIds == null || rowIds.isEmpty()) {
            return 0;  // empty IN list is a syntax error
        }

        try {
            return template.update(DELETE_ROWS_SQL, Map.of("rowIds", rowIds));
        } catch (DataAccessException ex) {
            throw persistenceFailure("Error deleting rows " + rowIds + " from local store", ex);
        }
    }

    @Override
    public int deleteByOrigin(Origin origin) {
        try {
            return template.update(DELETE_BY_ORIGIN_SQL, Map.of("origin", origin.name()));
        } catch (DataAccessException ex) {
            throw persistenceFailure("Error deleting " + origin + " knowledge points from local store", ex);
        }
    }

    @Override
    public void replaceCachedRemotePoints(boolean archived, List<KnowledgePoint> points) {
        SqlParameterSource[] paramsArray = new SqlParameterSource[points.size()];

        for (int index = 0; index < points.size(); index++) {
            paramsArray[index] = toParams(points.get(index));
        }

        // the old partition is kept if any insert fails
        try {
            transactionTemplate.executeWithoutResult(status -> {
                template.update(DELETE_CACHED_REMOTE_SQL, Map.of("archived", archived ? 1 : 0));
                if (paramsArray.length > 0) {
                    template.batchUpdate(INSERT_SQL, paramsArray);
                }
            });
        } catch (DataAccessException ex) {
            throw persistenceFailure("Error refreshing cached remote knowledge points", ex);
        }
    }

    private LocalPersistenceException persistenceFailure(String errMsg, DataAccessException ex) {
        log.error(errMsg, ex);
        return new LocalPersistenceException(errMsg, ex);
    }

    private static MapSqlParameterSource toParams(KnowledgePoint point) {
        CompositeKnowledgePointId compositeId = point.compositeId();

        return new MapSqlParameterSource()
                .addValue("ownerId", compositeId == null ? null : compositeId.ownerId())
                .addValue("sequenceId", compositeId == null ? null : compositeId.sequenceId())
                .addValue("legacyId", point.legacyId())
                .addValue("ancientId", point.ancientId())
                .addValue("category", point.category())
                .addValue("subcategory", point.subcategory())
                .addValue("correctPhrase", point.correctPhrase())
                .addValue("explanation", point.explanation())
                .addValue("userContextSentence", point.userContextSentence())
                .addValue("incorrectPhraseInContext", point.incorrectPhraseInContext())
                .addValue("keyPointSummary", point.keyPointSummary())
                .addValue("masteryLevel", point.masteryLevel())
                .addValue("mistakeCount", point.mistakeCount())
                .addValue("correctCount", point.correctCount())
                .addValue("reviewStreak", point.reviewStreak())
                .addValue("nextReviewDate", toEpochMilli(point.nextReviewDate()))
                .addValue("lastAiReviewDate", toEpochMilli(point.lastAiReviewDate()))
                .addValue("aiReviewNotes", point.aiReviewNotes())
                .addValue("archived", point.archived() ? 1 : 0)
                .addValue("origin", point.origin() == null ? Origin.Local.name() : point.origin().name())
                .addValue("lastModified", toEpochMilli(point.lastModified()));
    }

    private static LocalKnowledgePointRow getRowFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        Long ownerId = getNullableLong(rs, "owner_id");
        Long sequenceId = getNullableLong(rs, "sequence_id");
        String aiReviewNotes = rs.getString("ai_review_notes");
        Origin origin = toOrigin(rs.getString("origin"));

        if (LEGACY_LOCAL_MARKER.equals(aiReviewNotes)) {
            aiReviewNotes = null;
        }

        KnowledgePoint point = new KnowledgePoint(
                ownerId != null && sequenceId != null ? new CompositeKnowledgePointId(ownerId, sequenceId) : null,
                getNullableLong(rs, "legacy_id"),
                getNullableLong(rs, "ancient_id"),
                rs.getString("category"),
                rs.getString("subcategory"),
                rs.getString("correct_phrase"),
                rs.getString("explanation"),
                rs.getString("user_context_sentence"),
                rs.getString("incorrect_phrase_in_context"),
                rs.getString("key_point_summary"),
                rs.getDouble("mastery_level"),
                rs.getInt("mistake_count"),
                rs.getInt("correct_count"),
                rs.getInt("review_streak"),
                toInstant(getNullableLong(rs, "next_review_date")),
                toInstant(getNullableLong(rs, "last_ai_review_date")),
                aiReviewNotes,
                rs.getInt("is_archived") != 0,
                origin,
                toInstant(getNullableLong(rs, "last_modified")));

        return new LocalKnowledgePointRow(rs.getLong("row_id"), point);
    }

    private static Origin toOrigin(String storedOrigin) {
        if (storedOrigin == null || storedOrigin.isBlank()) {
            // rows written before the origin column existed were all guest rows
            return Origin.Local;
        }

        try {
            return Origin.valueOf(storedOrigin);
        } catch (IllegalArgumentException ex) {
            String errMsg = "Unknown origin \"" + storedOrigin + "\" in local knowledge point store";
            log.error(errMsg);
            throw new LocalPersistenceException(errMsg, ex);
        }
    }

    private static Long getNullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Long toEpochMilli(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }

    private static Instant toInstant(Long epochMilli) {
        return epochMilli == null ? null : Instant.ofEpochMilli(epochMilli);
    }
}
