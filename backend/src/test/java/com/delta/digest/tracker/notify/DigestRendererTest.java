package com.delta.digest.tracker.notify;

import com.delta.digest.config.TrackerProperties;
import com.delta.digest.tracker.model.DiscoveredItem;
import com.delta.digest.tracker.model.Item;
import com.delta.digest.tracker.model.ItemGroup;
import com.delta.digest.tracker.model.ItemStatus;
import com.delta.digest.tracker.model.JobStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DigestRendererTest {
    private static final Instant NOW = Instant.parse("2025-12-20T09:00:00Z");

    private final TrackerProperties properties = new TrackerProperties();
    private final DigestRenderer renderer = new DigestRenderer(properties);

    @Test
    void digestListsGroupsWithEscapedFields() {
        Item fetched = item("1", "alpha", 0, ItemStatus.PENDING).fetched("Hello <b>world</b>");
        Item failed = item("2", "alpha", 1, ItemStatus.PENDING).skipped("HTTP 404");
        Item small = item("3", "beta", 2, ItemStatus.SKIPPED);

        String html = renderer.renderDigest(ItemGroups.group(List.of(fetched, failed, small)), NOW);

        assertThat(html).contains("<h2>Digest: 3 new posts</h2>");
        assertThat(html).contains("<h3>alpha (2 new)</h3>");
        assertThat(html).contains("<h3>beta (1 new)</h3>");
        assertThat(html.indexOf("alpha (2 new)")).isLessThan(html.indexOf("beta (1 new)"));
        assertThat(html).contains("Hello &lt;b&gt;world&lt;/b&gt;");
        assertThat(html).contains("Failed to fetch: HTTP 404");
        assertThat(html).contains("href=\"http://forum.test/posts/1.html\"");
        assertThat(html).contains("[finance]");
        assertThat(html).contains("Generated at 2025-12-20T09:00:00Z");
    }

    @Test
    void longContentIsTruncated() {
        properties.getNotification().setPreviewChars(5);
        Item fetched = item("1", "alpha", 0, ItemStatus.PENDING).fetched("abcdefghij");

        String html = renderer.renderDigest(ItemGroups.group(List.of(fetched)), NOW);

        assertThat(html).contains(">abcde...</div>");
        assertThat(html).doesNotContain("abcdef");
    }

    @Test
    void previewShowsPendingItemsAndStatus() {
        Item pending = item("1", "alpha", 0, ItemStatus.PENDING);

        String html = renderer.renderPreview(ItemGroups.group(List.of(pending)), "job-1", JobStatus.FETCHING, NOW);

        assertThat(html).contains("Preview: 1 posts");
        assertThat(html).contains("fetching");
        assertThat(html).contains("Content pending");
        assertThat(html).contains("Job: job-1");
    }

    @Test
    void emptyPreviewExplainsWhatToDo() {
        assertThat(renderer.renderPreview(List.of(), null, null, NOW))
            .contains("No posts found")
            .contains("No job has run yet. Trigger /api/cron first.");
        assertThat(renderer.renderPreview(List.of(), "job-1", JobStatus.COMPLETE, NOW))
            .contains("No posts found")
            .contains("Job: job-1")
            .contains("complete");
    }

    @Test
    void groupingKeepsFirstAppearanceOrderAndSortsWithinGroup() {
        List<ItemGroup> groups = ItemGroups.group(List.of(
            item("c", "beta", 3, ItemStatus.SKIPPED),
            item("a", "alpha", 1, ItemStatus.SKIPPED),
            item("b", "beta", 0, ItemStatus.SKIPPED)));

        assertThat(groups).extracting(ItemGroup::groupKey).containsExactly("beta", "alpha");
        assertThat(groups.get(0).items()).extracting(Item::id).containsExactly("b", "c");
        assertThat(ItemGroups.totalItems(groups)).isEqualTo(3);
    }

    private static Item item(String id, String group, int order, ItemStatus status) {
        DiscoveredItem discovered = new DiscoveredItem(id, "Post " + id, "http://forum.test/posts/" + id + ".html",
            "author-" + id, "2025-12-19", 100, "finance");
        return Item.discovered(discovered, group, order, status);
    }
}
