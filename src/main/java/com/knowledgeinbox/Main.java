package com.knowledgeinbox;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.knowledgeinbox.inference.Answer;
import com.knowledgeinbox.inference.Citation;
import com.knowledgeinbox.ingest.RebuildReport;
import com.knowledgeinbox.runtime.AppConfig;
import com.knowledgeinbox.runtime.KnowledgeInboxFactory;
import com.knowledgeinbox.store.Item;
import com.knowledgeinbox.store.SourceKind;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "knowledge-inbox",
        mixinStandardHelpOptions = true,
        version = "knowledge-inbox 0.1.0",
        description = "Collect notes and web pages, then ask questions answered from them.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_STORAGE_FAILURE = 1;
    static final int EXIT_USAGE_ERROR = 2;
    static final int EXIT_EXTRACTION_FAILURE = 3;
    static final int EXIT_EMBEDDING_UNAVAILABLE = 4;
    static final int EXIT_GENERATION_UNAVAILABLE = 5;
    static final int EXIT_NOT_FOUND = 6;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "chat")
    Mode mode;

    @Option(names = "--source-kind", description = "Item kind (note or url); filters list mode, selects ingest input")
    String sourceKind;

    @Option(names = "--content", description = "Note text, or the page URL when --source-kind is url")
    String content;

    @Option(names = "--item-id", description = "Item id for show and delete modes")
    Long itemId;

    @Option(names = "--question", description = "Question for ask mode")
    String question;

    @Option(names = "--max-results", description = "Number of sources to retrieve (defaults to query.defaultMaxResults)")
    Integer maxResults;

    private final OkHttpClient httpClient = new OkHttpClient();
    private final InputStream in;
    private final PrintStream out;

    enum Mode {
        ingest,
        list,
        show,
        delete,
        ask,
        stats,
        chat
    }

    public Main() {
        this(System.in, System.out);
    }

    Main(InputStream in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        log.info("Starting knowledge inbox in {} mode", mode);
        log.info("Using config file: {}", configPath);
        try {
            AppConfig config = loadConfig(Path.of(configPath));
            KnowledgeInbox inbox = KnowledgeInboxFactory.create(config, httpClient);
            int resolvedMaxResults = maxResults == null ? config.getQuery().getDefaultMaxResults() : maxResults;
            RebuildReport report = inbox.rebuildIndexFromStore();
            log.info("Index ready: items={} chunks={} in {} ms", report.indexedItems(), report.indexedChunks(), report.elapsedMs());
            return switch (mode) {
                case ingest -> runIngest(inbox);
                case list -> runList(inbox);
                case show -> runShow(inbox);
                case delete -> runDelete(inbox);
                case ask -> runAsk(inbox, resolvedMaxResults);
                case stats -> runStats(inbox);
                case chat -> runChat(inbox, resolvedMaxResults);
            };
        } catch (KnowledgeInboxException e) {
            log.error("{} failed: {}", mode, e.getMessage());
            out.println(describeFailure(e));
            return exitCodeFor(e.kind());
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            out.println("Invalid arguments: " + e.getMessage());
            return EXIT_USAGE_ERROR;
        } catch (IOException e) {
            log.error("I/O failure while reading configuration or the item store", e);
            out.println("Storage failure: " + e.getMessage());
            return EXIT_STORAGE_FAILURE;
        }
    }

    private int runIngest(KnowledgeInbox inbox) throws IOException {
        if (sourceKind == null || content == null) {
            log.error("--source-kind and --content are required in ingest mode");
            return EXIT_USAGE_ERROR;
        }
        Item item = inbox.ingest(SourceKind.fromWireName(sourceKind), content);
        out.printf("Successfully ingested %s with ID %d%n", item.sourceKind().wireName(), item.id());
        return EXIT_OK;
    }

    private int runList(KnowledgeInbox inbox) throws IOException {
        SourceKind filter = sourceKind == null ? null : SourceKind.fromWireName(sourceKind);
        List<Item> items = inbox.list(filter);
        for (Item item : items) {
            out.printf("#%d [%s] %s %s%n",
                    item.id(),
                    item.sourceKind().wireName(),
                    DateTimeFormatter.ISO_INSTANT.format(item.createdAt()),
                    item.originUrl() != null ? item.originUrl() : abbreviate(item.rawText(), 80));
        }
        out.printf("%d item(s)%n", items.size());
        return EXIT_OK;
    }

    private int runShow(KnowledgeInbox inbox) throws IOException {
        if (itemId == null) {
            log.error("--item-id is required in show mode");
            return EXIT_USAGE_ERROR;
        }
        Optional<Item> item = inbox.get(itemId);
        if (item.isEmpty()) {
            out.printf("Item %d not found%n", itemId);
            return EXIT_NOT_FOUND;
        }
        Item found = item.get();
        out.printf("#%d [%s] created %s%n", found.id(), found.sourceKind().wireName(),
                DateTimeFormatter.ISO_INSTANT.format(found.createdAt()));
        if (found.originUrl() != null) {
            out.println("URL: " + found.originUrl());
        }
        out.println(found.rawText());
        return EXIT_OK;
    }

    private int runDelete(KnowledgeInbox inbox) throws IOException {
        if (itemId == null) {
            log.error("--item-id is required in delete mode");
            return EXIT_USAGE_ERROR;
        }
        if (!inbox.delete(itemId)) {
            out.printf("Item %d not found%n", itemId);
            return EXIT_NOT_FOUND;
        }
        out.printf("Item %d deleted successfully%n", itemId);
        return EXIT_OK;
    }

    private int runAsk(KnowledgeInbox inbox, int resolvedMaxResults) {
        if (question == null) {
            log.error("--question is required in ask mode");
            return EXIT_USAGE_ERROR;
        }
        Answer answer = inbox.answer(question, resolvedMaxResults);
        printAnswer(answer);
        printSources(answer.citations());
        return EXIT_OK;
    }

    private int runStats(KnowledgeInbox inbox) throws IOException {
        InboxStats stats = inbox.stats();
        out.printf("items=%d indexedChunks=%d%n", stats.itemCount(), stats.indexedChunks());
        return EXIT_OK;
    }

    private int runChat(KnowledgeInbox inbox, int resolvedMaxResults) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        List<Citation> lastSources = List.of();

        out.println("Knowledge inbox ready. Ask a question, or type /help for commands.");
        while (true) {
            out.print("you> ");
            out.flush();
            String line = reader.readLine();
            if (line == null || "/exit".equals(line.strip()) || "/quit".equals(line.strip())) {
                break;
            }
            String input = line.strip();
            if (input.isEmpty()) {
                continue;
            }
            if ("/help".equals(input)) {
                out.println("Commands: /help, /sources, /stats, /exit");
                continue;
            }
            if ("/sources".equals(input)) {
                if (lastSources.isEmpty()) {
                    out.println("No sources for the last answer.");
                } else {
                    printSources(lastSources);
                }
                continue;
            }
            if ("/stats".equals(input)) {
                runStats(inbox);
                continue;
            }

            try {
                Answer answer = inbox.answer(input, resolvedMaxResults);
                lastSources = answer.citations();
                printAnswer(answer);
            } catch (KnowledgeInboxException e) {
                log.warn("Question failed with {}: {}", e.kind(), e.getMessage());
                out.println(describeFailure(e));
            }
        }
        return EXIT_OK;
    }

    private void printAnswer(Answer answer) {
        out.println("assistant> " + answer.text());
    }

    private void printSources(List<Citation> citations) {
        for (int i = 0; i < citations.size(); i++) {
            Citation citation = citations.get(i);
            out.printf(Locale.ROOT, "[%d] item #%d (%s%s) relevance=%.2f %s%n",
                    i + 1,
                    citation.itemId(),
                    citation.sourceKind().wireName(),
                    citation.originUrl() == null ? "" : " " + citation.originUrl(),
                    citation.relevanceScore(),
                    citation.preview().replaceAll("\\s+", " "));
        }
    }

    static String describeFailure(KnowledgeInboxException e) {
        String stage = switch (e.kind()) {
            case INVALID_CONTENT -> "Invalid content";
            case INVALID_QUERY -> "Invalid question";
            case EXTRACTION_FAILED -> "Could not read the page";
            case EMBEDDING_UNAVAILABLE -> "Embedding provider unavailable";
            case GENERATION_UNAVAILABLE -> "Generation provider unavailable";
        };
        String message = stage + ": " + e.getMessage();
        return e.kind().isProviderFailure() ? message + " (try again later)" : message;
    }

    static int exitCodeFor(FailureKind kind) {
        return switch (kind) {
            case INVALID_CONTENT, INVALID_QUERY -> EXIT_USAGE_ERROR;
            case EXTRACTION_FAILED -> EXIT_EXTRACTION_FAILURE;
            case EMBEDDING_UNAVAILABLE -> EXIT_EMBEDDING_UNAVAILABLE;
            case GENERATION_UNAVAILABLE -> EXIT_GENERATION_UNAVAILABLE;
        };
    }

    private static String abbreviate(String text, int maxLength) {
        String singleLine = text.replaceAll("\\s+", " ").strip();
        return singleLine.length() > maxLength ? singleLine.substring(0, maxLength) + "..." : singleLine;
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }
}
