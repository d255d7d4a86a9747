package com.dailybrief.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One fetched piece of content, its annotation once available, and the ranking
 * fields derived from it. The URL is the identity of an item.
 */
public record ContentItem(
        String url,
        String title,
        String sourceId,
        String sourceName,
        String sourceCategory,
        String publishedDate,
        Instant fetchedAt,
        String contentType,
        String rawText,
        Enrichment enrichment,
        Double relevanceScore,
        Integer clusterId,
        String clusterTopic,
        boolean noveltyFlag,
        ProcessingStatus status
) {
    public ContentItem {
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(fetchedAt, "fetchedAt is required");
        status = status == null ? ProcessingStatus.PENDING_ENRICHMENT : status;
    }

    public static ContentItem fetched(
            String url,
            String title,
            String sourceId,
            String sourceName,
            String sourceCategory,
            String publishedDate,
            Instant fetchedAt,
            String contentType,
            String rawText
    ) {
        return new ContentItem(url, title, sourceId, sourceName, sourceCategory, publishedDate, fetchedAt,
                contentType, rawText, null, null, null, null, false, ProcessingStatus.PENDING_ENRICHMENT);
    }

    public ContentItem withRawText(String text) {
        return new ContentItem(url, title, sourceId, sourceName, sourceCategory, publishedDate, fetchedAt,
                contentType, text, enrichment, relevanceScore, clusterId, clusterTopic, noveltyFlag, status);
    }

    public ContentItem withFetchedAt(Instant at) {
        return new ContentItem(url, title, sourceId, sourceName, sourceCategory, publishedDate, at,
                contentType, rawText, enrichment, relevanceScore, clusterId, clusterTopic, noveltyFlag, status);
    }

    public ContentItem withEnrichment(Enrichment value) {
        return new ContentItem(url, title, sourceId, sourceName, sourceCategory, publishedDate, fetchedAt,
                contentType, rawText, value, relevanceScore, clusterId, clusterTopic, noveltyFlag,
                advance(ProcessingStatus.ENRICHED));
    }

    public ContentItem withRelevanceScore(double score) {
        return new ContentItem(url, title, sourceId, sourceName, sourceCategory, publishedDate, fetchedAt,
                contentType, rawText, enrichment, score, clusterId, clusterTopic, noveltyFlag, status);
    }

    public ContentItem withCluster(int id, String topic) {
        return new ContentItem(url, title, sourceId, sourceName, sourceCategory, publishedDate, fetchedAt,
                contentType, rawText, enrichment, relevanceScore, id, topic, noveltyFlag, status);
    }

    public ContentItem ranked(double score, int id, String topic, boolean novelty) {
        return new ContentItem(url, title, sourceId, sourceName, sourceCategory, publishedDate, fetchedAt,
                contentType, rawText, enrichment, score, id, topic, novelty, advance(ProcessingStatus.RANKED));
    }

    public ContentItem withStatus(ProcessingStatus next) {
        return new ContentItem(url, title, sourceId, sourceName, sourceCategory, publishedDate, fetchedAt,
                contentType, rawText, enrichment, relevanceScore, clusterId, clusterTopic, noveltyFlag, advance(next));
    }

    public double laneScore(String lane) {
        return enrichment == null ? 0.0 : enrichment.laneScore(lane);
    }

    public List<String> topics() {
        return enrichment == null ? List.of() : enrichment.topics();
    }

    public double scoreOrZero() {
        return relevanceScore == null ? 0.0 : relevanceScore;
    }

    private ProcessingStatus advance(ProcessingStatus next) {
        if (!status.canAdvanceTo(next)) {
            throw new IllegalStateException("Item " + url + " cannot move from " + status + " back to " + next);
        }
        return next;
    }
}
