package com.gt.linker.remote.impl;

import com.gt.linker.exception.NotAuthenticatedException;
import com.gt.linker.exception.RemoteRejectedException;
import com.gt.linker.exception.RemoteUnreachableException;
import com.gt.linker.model.BatchAction;
import com.gt.linker.model.CompositeKnowledgePointId;
import com.gt.linker.model.KnowledgePoint;
import com.gt.linker.remote.RemoteKnowledgePointKey;
import com.gt.linker.remote.RemoteKnowledgePointStore;
import com.gt.linker.remote.converter.RemoteKnowledgePointConverter;
import com.gt.linker.remote.model.BatchActionRequest;
import com.gt.linker.remote.model.FinalizeKnowledgePointResponse;
import com.gt.linker.remote.model.KnowledgePointListResponse;
import com.gt.linker.session.AuthSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Clock;
import java.util.List;
import java.util.function.Supplier;

public class RemoteKnowledgePointStoreHttp implements RemoteKnowledgePointStore {

    private static final Logger log = LoggerFactory.getLogger(RemoteKnowledgePointStoreHttp.class);

    private static final String FINALIZE_PATH = "/api/data/session/finalize";
    private static final String DASHBOARD_PATH = "/api/data/get_dashboard";
    private static final String ARCHIVED_PATH = "/api/data/archived_knowledge_points";
    private static final String COMPOSITE_POINT_PATH = "/api/v2/data/knowledge_point/{ownerId}/{sequenceId}";
    private static final String LEGACY_POINT_PATH = "/api/data/knowledge_point/{id}";
    private static final String BATCH_ACTION_PATH = "/api/v2/data/knowledge_points/batch_action";
    private static final String ARCHIVE_SUFFIX = "/archive";
    private static final String UNARCHIVE_SUFFIX = "/unarchive";

    private final RestClient restClient;
    private final AuthSession authSession;
    private final Clock clock;

    public RemoteKnowledgePointStoreHttp(RestClient restClient, AuthSession authSession, Clock clock) {
        this.restClient = restClient;
        this.authSession = authSession;
        this.clock = clock;
    }

    @Override
    public CompositeKnowledgePointId create(KnowledgePoint point) {
        FinalizeKnowledgePointResponse response = execute("finalize knowledge point", () -> restClient.post()
                .uri(FINALIZE_PATH)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .body(RemoteKnowledgePointConverter.convertToFinalizeRequest(point, clock.instant()))
                .retrieve()
                .body(FinalizeKnowledgePointResponse.class));

        if (response == null || response.savedCount() < 1 || response.compositeIds() == null || response.compositeIds().isEmpty()) {
            String errMsg = "Server did not save knowledge point \"" + point.correctPhrase() + "\""
                    + (response != null && response.message() != null ? ": " + response.message() : "");

            log.warn(errMsg);
            throw new RemoteRejectedException(errMsg, 200);
        }

        return response.compositeIds().get(0);
    }

    @Override
    public List<KnowledgePoint> fetchActive() {
        KnowledgePointListResponse response = execute("fetch dashboard", () -> restClient.get()
                .uri(DASHBOARD_PATH)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .body(KnowledgePointListResponse.class));

        // the dashboard has historically included archived entries
        return toKnowledgePoints(response).stream().filter(point -> !point.archived()).toList();
    }

    @Override
    public List<KnowledgePoint> fetchArchived() {
        KnowledgePointListResponse response = execute("fetch archived knowledge points", () -> restClient.get()
                .uri(ARCHIVED_PATH)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .body(KnowledgePointListResponse.class));

        return toKnowledgePoints(response).stream()
                .map(point -> point.archived() ? point : point.withArchived(true, point.lastModified()))
                .toList();
    }

    @Override
    public void archive(RemoteKnowledgePointKey key) {
        postToPoint(key, ARCHIVE_SUFFIX, "archive");
    }

    @Override
    public void unarchive(RemoteKnowledgePointKey key) {
        postToPoint(key, UNARCHIVE_SUFFIX, "unarchive");
    }

    @Override
    public void delete(RemoteKnowledgePointKey key) {
        execute("delete knowledge point " + describe(key), () -> restClient.delete()
                .uri(pointPath(key, ""), pathVariables(key))
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public void updateMastery(RemoteKnowledgePointKey key, KnowledgePoint updatedPoint) {
        execute("update mastery of knowledge point " + describe(key), () -> restClient.put()
                .uri(pointPath(key, ""), pathVariables(key))
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .body(RemoteKnowledgePointConverter.convertToMasteryUpdate(updatedPoint))
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public void batchAction(BatchAction action, List<RemoteKnowledgePointKey> keys) {
        if (keys == null || keys.isEmpty()) {
            return;
        }

        BatchActionRequest request = new BatchActionRequest(
                action.getCode(),
                keys.stream().filter(RemoteKnowledgePointKey::isComposite).map(RemoteKnowledgePointKey::compositeId).toList(),
                keys.stream().filter(key -> !key.isComposite()).map(RemoteKnowledgePointKey::legacyId).toList());

        execute("batch " + action.getCode() + " of " + keys.size() + " knowledge points", () -> restClient.post()
                .uri(BATCH_ACTION_PATH)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .body(request)
                .retrieve()
                .toBodilessEntity());
    }

    private void postToPoint(RemoteKnowledgePointKey key, String suffix, String description) {
        execute(description + " knowledge point " + describe(key), () -> restClient.post()
                .uri(pointPath(key, suffix), pathVariables(key))
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .toBodilessEntity());
    }

    private List<KnowledgePoint> toKnowledgePoints(KnowledgePointListResponse response) {
        if (response == null) {
            return List.of();
        }

        return RemoteKnowledgePointConverter.convertRemoteKnowledgePoints(response.knowledgePoints(), clock.instant());
    }

    private <T> T execute(String description, Supplier<T> call) {
        try {
            return call.get();
        } catch (RestClientResponseException ex) {
            int status = ex.getStatusCode().value();

            if (ex.getStatusCode().is5xxServerError()) {
                String errMsg = "Server error " + status + " while trying to " + description;
                log.warn(errMsg);
                throw new RemoteUnreachableException(errMsg, ex);
            }

            String errMsg = "Server rejected request to " + description + " with status " + status;
            log.warn(errMsg + ": " + ex.getResponseBodyAsString());
            throw new RemoteRejectedException(errMsg, status, ex);
        } catch (ResourceAccessException ex) {
            String errMsg = "Server unreachable while trying to " + description;
            log.warn(errMsg, ex);
            throw new RemoteUnreachableException(errMsg, ex);
        } catch (RestClientException ex) {
            String errMsg = "Unable to " + description + ", unreadable exchange with server";
            log.warn(errMsg, ex);
            throw new RemoteUnreachableException(errMsg, ex);
        }
    }

    private String bearer() {
        return "Bearer " + authSession.getAccessToken()
                .orElseThrow(() -> new NotAuthenticatedException("Remote knowledge point store requires an authenticated session"));
    }

    private static String pointPath(RemoteKnowledgePointKey key, String suffix) {
        return (key.isComposite() ? COMPOSITE_POINT_PATH : LEGACY_POINT_PATH) + suffix;
    }

    private static Object[] pathVariables(RemoteKnowledgePointKey key) {
        if (key.isComposite()) {
            return new Object[] { key.compositeId().ownerId(), key.compositeId().sequenceId() };
        }

        return new Object[] { key.legacyId() };
    }

    private static String describe(RemoteKnowledgePointKey key) {
        return key.isComposite() ? key.compositeId().canonical() : String.valueOf(key.legacyId());
    }
}
