package com.delta.digest.tracker.scrape;

import com.delta.digest.tracker.http.PoliteHttpClient;
import com.delta.digest.tracker.model.DiscoveredItem;
import com.delta.digest.tracker.model.HttpFetchResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads forum archive listings, blog month pages and post bodies. Forum rows look like
 * {@code • #跟帖# <a>title</a> [channel] - <strong><em>author</em></strong>(1234 bytes) <i>date</i>}.
 */
@Service
public class JsoupSourceScraper implements SourceScraper {
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8";
    private static final String REPLY_MARKER = "#跟帖#";
    private static final String BLOG_CHANNEL = "博客";
    private static final int BLOG_SIZE_HINT = 1000;

    private static final Pattern FORUM_POST_ID = Pattern.compile("/(\\d+)\\.html");
    private static final Pattern BLOG_POST_ID = Pattern.compile("/myblog/(\\d+)/(\\d+)/(\\d+)\\.html");
    private static final Pattern CHANNEL = Pattern.compile("\\[([^\\]]+)\\]");
    private static final Pattern SIZE = Pattern.compile("\\((\\d+)\\s*bytes?\\s*\\)", Pattern.CASE_INSENSITIVE);

    private static final List<String> CONTENT_SELECTORS = List.of(
        "#msgbodyContent",
        ".articalContent",
        "#articleBody",
        "#postbody",
        ".post-content"
    );

    private final PoliteHttpClient httpClient;

    public JsoupSourceScraper(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public List<DiscoveredItem> listItems(String sourceUrl) throws IOException {
        Document document = load(sourceUrl);
        if (isBlogUrl(sourceUrl)) {
            return parseBlogPage(document);
        }
        return parseArchivePage(document);
    }

    @Override
    public String fetchContent(String itemUrl) throws IOException {
        return extractContent(load(itemUrl));
    }

    static boolean isBlogUrl(String url) {
        return url != null && url.contains("/myblog/");
    }

    static List<DiscoveredItem> parseArchivePage(Document document) {
        List<DiscoveredItem> items = new ArrayList<>();
        for (Element row : document.select("tr")) {
            Element cell = row.selectFirst("td.cnLarge");
            if (cell == null) {
                continue;
            }
            Element link = null;
            for (Element candidate : cell.select("a")) {
                if (!candidate.hasClass("linkdot")) {
                    link = candidate;
                    break;
                }
            }
            if (link == null || link.attr("href").isBlank()) {
                continue;
            }
            String href = link.attr("href");
            Matcher idMatcher = FORUM_POST_ID.matcher(href);
            if (!idMatcher.find()) {
                continue;
            }
            String cellText = cell.text();
            String title = link.text().trim();
            if (cell.html().contains(REPLY_MARKER)) {
                title = REPLY_MARKER + " " + title;
            }
            Matcher channel = CHANNEL.matcher(cellText);
            Matcher size = SIZE.matcher(cellText);
            Element author = cell.selectFirst("strong em");
            Element date = cell.selectFirst("i");
            items.add(new DiscoveredItem(
                idMatcher.group(1),
                title,
                absolute(link),
                author == null ? "" : author.text().trim(),
                date == null ? "" : date.text().trim(),
                size.find() ? Integer.parseInt(size.group(1)) : 0,
                channel.find() ? channel.group(1) : ""
            ));
        }
        return items;
    }

    static List<DiscoveredItem> parseBlogPage(Document document) {
        List<DiscoveredItem> items = new ArrayList<>();
        for (Element cell : document.select(".articleCell")) {
            Element link = cell.selectFirst(".atc_title a");
            if (link == null) {
                continue;
            }
            String href = link.attr("href");
            String title = link.text().trim();
            if (href.isBlank() || title.isEmpty()) {
                continue;
            }
            Matcher idMatcher = BLOG_POST_ID.matcher(href);
            if (!idMatcher.find()) {
                continue;
            }
            Element date = cell.selectFirst(".atc_tm");
            items.add(new DiscoveredItem(
                "blog_" + idMatcher.group(1) + "_" + idMatcher.group(3),
                title,
                absolute(link),
                "",
                date == null ? "" : date.text().trim(),
                BLOG_SIZE_HINT,
                BLOG_CHANNEL
            ));
        }
        return items;
    }

    static String extractContent(Document document) {
        for (String selector : CONTENT_SELECTORS) {
            Elements matches = document.select(selector);
            if (matches.isEmpty()) {
                continue;
            }
            String text = matches.text().trim();
            if (!text.isEmpty()) {
                return text;
            }
        }
        return "";
    }

    private Document load(String url) throws IOException {
        HttpFetchResult result = httpClient.get(url, HTML_ACCEPT);
        if (!result.isSuccessful() || result.body() == null) {
            throw new IOException("Failed to fetch " + url + ": " + result.describeFailure());
        }
        return Jsoup.parse(result.body(), result.finalUrlOrRequested());
    }

    private static String absolute(Element link) {
        String resolved = link.absUrl("href");
        return resolved.isBlank() ? link.attr("href") : resolved;
    }
}
