package com.delta.digest.tracker.notify;

import com.delta.digest.config.TrackerProperties;
import com.delta.digest.tracker.model.Item;
import com.delta.digest.tracker.model.ItemGroup;
import com.delta.digest.tracker.model.ItemStatus;
import com.delta.digest.tracker.model.JobStatus;
import org.jsoup.nodes.Entities;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

@Component
public class DigestRenderer {
    private final TrackerProperties properties;

    public DigestRenderer(TrackerProperties properties) {
        this.properties = properties;
    }

    public String renderDigest(List<ItemGroup> groups, Instant generatedAt) {
        int total = ItemGroups.totalItems(groups);
        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html><html><head><meta charset=\"utf-8\"></head>")
            .append("<body style=\"font-family: sans-serif; max-width: 800px; margin: 0 auto; padding: 20px;\">")
            .append("<h2>Digest: ").append(total).append(" new posts</h2>");
        appendGroups(html, groups);
        html.append("<hr><p style=\"color: #999; font-size: 11px;\">Generated at ")
            .append(generatedAt)
            .append("</p></body></html>");
        return html.toString();
    }

    public String renderPreview(List<ItemGroup> groups, String jobId, JobStatus status, Instant generatedAt) {
        int total = ItemGroups.totalItems(groups);
        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html><html><head><meta charset=\"utf-8\"><title>Digest preview</title></head>")
            .append("<body style=\"font-family: sans-serif; max-width: 800px; margin: 0 auto; padding: 20px;\">");
        String badge = status == null ? "" : " <span class=\"status\">" + status.wireName() + "</span>";
        if (total == 0) {
            html.append("<h2>No posts found").append(badge).append("</h2>")
                .append("<p>")
                .append(jobId == null ? "No job has run yet. Trigger /api/cron first." : "Job: " + escape(jobId))
                .append("</p>");
        } else {
            html.append("<h2>Preview: ").append(total).append(" posts").append(badge).append("</h2>")
                .append("<p>Job: ").append(escape(jobId)).append("</p>");
            appendGroups(html, groups);
        }
        html.append("<p style=\"color: #666;\">Checked at ").append(generatedAt).append("</p></body></html>");
        return html.toString();
    }

    private void appendGroups(StringBuilder html, List<ItemGroup> groups) {
        for (ItemGroup group : groups) {
            if (group.items().isEmpty()) {
                continue;
            }
            html.append("<h3>").append(escape(group.groupKey()))
                .append(" (").append(group.items().size()).append(" new)</h3>");
            for (Item item : group.items()) {
                appendItem(html, item);
            }
        }
    }

    private void appendItem(StringBuilder html, Item item) {
        String title = item.title() == null || item.title().isBlank() ? "(no title)" : item.title();
        html.append("<div class=\"item\"><strong>&bull;</strong> <a href=\"")
            .append(escape(item.sourceUrl()))
            .append("\">")
            .append(escape(title))
            .append("</a>");
        if (item.channel() != null && !item.channel().isBlank()) {
            html.append(" <span>[").append(escape(item.channel())).append("]</span>");
        }
        if (item.author() != null && !item.author().isBlank()) {
            html.append(" <span>").append(escape(item.author())).append("</span>");
        }
        html.append(" <span style=\"color: #999; font-size: 12px;\">(")
            .append(escape(item.publishedDate()))
            .append(")</span></div>");

        int limit = properties.getNotification().getPreviewChars();
        if (item.content() != null && !item.content().isBlank()) {
            String content = item.content();
            html.append("<div style=\"margin: 8px 0 16px 20px; white-space: pre-wrap;\">")
                .append(escape(content.length() > limit ? content.substring(0, limit) : content))
                .append(content.length() > limit ? "..." : "")
                .append("</div>");
        } else if (item.fetchError() != null) {
            html.append("<div style=\"margin: 8px 0 16px 20px; color: #dc3545;\">Failed to fetch: ")
                .append(escape(item.fetchError()))
                .append("</div>");
        } else if (item.status() == ItemStatus.PENDING) {
            html.append("<div style=\"margin: 8px 0 16px 20px; color: #6c757d;\">Content pending</div>");
        }
    }

    private static String escape(String value) {
        return value == null ? "" : Entities.escape(value);
    }
}
