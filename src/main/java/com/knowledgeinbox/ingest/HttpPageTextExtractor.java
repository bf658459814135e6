package com.knowledgeinbox.ingest;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Downloads a page with OkHttp and turns HTML into plain text with jsoup, skipping page chrome such as navigation,
 * headers and footers.
 */
public class HttpPageTextExtractor implements PageTextExtractor {
    private static final Logger log = LoggerFactory.getLogger(HttpPageTextExtractor.class);
    private static final String DISCARDED_ELEMENTS = "script, style, noscript, nav, footer, header";

    private final OkHttpClient httpClient;
    private final String userAgent;

    public HttpPageTextExtractor(OkHttpClient httpClient, Duration timeout, String userAgent) {
        this.httpClient = httpClient.newBuilder()
                .callTimeout(timeout)
                .build();
        this.userAgent = userAgent;
    }

    @Override
    public String extract(String url) {
        Request request;
        try {
            request = new Request.Builder()
                    .url(url)
                    .header("User-Agent", userAgent)
                    .get()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ExtractionFailedException("Not a fetchable URL: " + url, e);
        }

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new ExtractionFailedException("Failed to fetch " + url + ": HTTP " + response.code());
            }
            String text = normalizeWhitespace(toText(body, url));
            if (text.isEmpty()) {
                throw new ExtractionFailedException("No text content found at " + url);
            }
            log.info("Extracted {} characters from {}", text.length(), url);
            return text;
        } catch (IOException e) {
            log.error("Error fetching {}: {}", url, e.getMessage());
            throw new ExtractionFailedException("Failed to fetch " + url + ": " + e.getMessage(), e);
        }
    }

    private String toText(ResponseBody body, String url) throws IOException {
        MediaType contentType = body.contentType();
        String subtype = contentType == null ? "html" : contentType.subtype().toLowerCase(Locale.ROOT);
        if (contentType != null && "text".equals(contentType.type()) && "plain".equals(subtype)) {
            return body.string();
        }
        if (!subtype.contains("html")) {
            throw new ExtractionFailedException("Unsupported content type " + contentType);
        }

        Document document = Jsoup.parse(body.string(), url);
        document.select(DISCARDED_ELEMENTS).remove();
        return document.body().text();
    }

    static String normalizeWhitespace(String text) {
        return text.replaceAll("\\s+", " ").strip();
    }
}
