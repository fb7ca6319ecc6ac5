package com.yourapp.chatshell.shell;

import com.yourapp.chatshell.conversation.ContextMessage;
import com.yourapp.chatshell.conversation.ConversationManager;
import com.yourapp.chatshell.conversation.ConversationNotFoundException;
import com.yourapp.chatshell.model.Conversation;
import com.yourapp.chatshell.model.ConversationSummary;
import com.yourapp.chatshell.model.MessageRole;
import com.yourapp.chatshell.responder.Responder;
import com.yourapp.chatshell.store.ConversationStore;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Interactive read-eval loop. Slash commands manage conversations; any other line is sent to the
 * assistant as part of the current conversation. Failures are reported on a single line and the
 * loop keeps going until {@code /quit} or end of input.
 */
@Component
@ConditionalOnProperty(name = "app.shell.enabled", havingValue = "true", matchIfMissing = true)
public class ChatShell implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ChatShell.class);

    private static final String MDC_KEY = "conversationId";
    private static final int PICK_LIMIT = 10;
    private static final int LIST_LIMIT = 20;

    private final ConversationManager conversations;
    private final Responder responder;
    private final ConsolePrinter printer;
    private final boolean typingIndicator;

    private BufferedReader input;
    private String currentConversationId;
    private List<ConversationSummary> lastListing = List.of();
    private boolean running;
    private boolean debug;

    public ChatShell(
            ConversationManager conversations,
            Responder responder,
            ConsolePrinter printer,
            @Value("${app.ui.typing-indicator:true}") boolean typingIndicator) {
        this.conversations = conversations;
        this.responder = responder;
        this.printer = printer;
        this.typingIndicator = typingIndicator;
    }

    @Override
    public void run(String... args) {
        runSession(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    void runSession(BufferedReader reader) {
        this.input = reader;
        this.running = true;

        printer.printHeader();
        printer.printWelcome(conversations.backendName());

        currentConversationId = conversations.createConversation(null);
        log.info("Started new conversation: {}", currentConversationId);

        while (running) {
            printer.printPrompt();
            String line = readLine();
            if (line == null) {
                break;
            }
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                if (!handleCommand(trimmed)) {
                    processChatMessage(trimmed);
                }
            } catch (RuntimeException e) {
                printer.printError("An error occurred: " + e.getMessage());
                log.error("Runtime error", e);
            }
        }
        printer.printInfo("Goodbye!");
    }

    String currentConversationId() {
        return currentConversationId;
    }

    boolean handleCommand(String line) {
        if (!line.startsWith("/")) {
            return false;
        }
        int space = line.indexOf(' ');
        String command = (space < 0 ? line : line.substring(0, space)).toLowerCase(Locale.ROOT);
        String argument = space < 0 ? "" : line.substring(space + 1).strip();

        switch (command) {
            case "/help", "/h" -> printer.printHelp();
            case "/clear", "/c" -> printer.clearScreen();
            case "/new", "/n" -> startNewConversation(argument);
            case "/history", "/hist" -> showHistory();
            case "/save", "/s" -> saveConversation();
            case "/load", "/l" -> loadConversation();
            case "/list" -> listConversations();
            case "/search" -> searchConversations(argument);
            case "/delete" -> deleteConversation(argument);
            case "/stats" -> showStats();
            case "/cleanup" -> cleanupConversations(argument);
            case "/debug" -> toggleDebug();
            case "/colors" -> printer.printColorStatus();
            case "/sysinfo" -> showSystemInfo();
            case "/quit", "/q", "/exit" -> running = false;
            default -> printer.printError("Unknown command: " + command + " (type /help)");
        }
        return true;
    }

    private void processChatMessage(String userInput) {
        MDC.put(MDC_KEY, currentConversationId);
        try {
            conversations.addMessage(currentConversationId, MessageRole.USER, userInput);

            TypingIndicator indicator = typingIndicator
                    ? new TypingIndicator(printer.out(), printer.theme())
                    : null;
            String response;
            if (indicator != null) {
                indicator.start();
            }
            try {
                List<ContextMessage> context = conversations.getContext(currentConversationId);
                response = responder.respond(context);
            } finally {
                if (indicator != null) {
                    indicator.stop();
                }
            }

            printer.printAssistantResponse(response);
            conversations.addMessage(currentConversationId, MessageRole.ASSISTANT, response);
            log.debug("Processed message exchange in conversation {}", currentConversationId);
        } catch (ConversationNotFoundException e) {
            printer.printError("Conversation no longer exists; start a new one with /new");
            log.warn("Lost conversation {}", e.getConversationId());
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    private void startNewConversation(String title) {
        currentConversationId = conversations.createConversation(title);
        printer.printSuccess("Started new conversation");
        log.info("Started new conversation: {}", currentConversationId);
    }

    private void showHistory() {
        printer.printHistory(conversations.getMessages(currentConversationId));
    }

    private void saveConversation() {
        if (conversations.saveConversation(currentConversationId)) {
            printer.printSuccess("Conversation saved successfully");
        } else {
            printer.printError("Failed to save conversation");
        }
    }

    private void loadConversation() {
        List<ConversationSummary> recent = conversations.listConversations(PICK_LIMIT, 0);
        if (recent.isEmpty()) {
            printer.printInfo("No saved conversations found");
            return;
        }
        lastListing = recent;
        printer.printInfo("Recent conversations:");
        printNumbered(recent);

        printer.out().print("Enter conversation number to load (or press Enter to cancel): ");
        printer.out().flush();
        ConversationSummary choice = pick(readLine());
        if (choice == null) {
            return;
        }
        if (conversations.loadConversation(choice.id())) {
            currentConversationId = choice.id();
            printer.printSuccess("Loaded conversation: " + choice.title());
        } else {
            printer.printError("Failed to load conversation");
        }
    }

    private void listConversations() {
        List<ConversationSummary> found = conversations.listConversations(LIST_LIMIT, 0);
        if (found.isEmpty()) {
            printer.printInfo("No conversations found");
            return;
        }
        lastListing = found;
        printer.printInfo("Found " + found.size() + " conversations:");
        printNumbered(found);
    }

    private void searchConversations(String query) {
        if (query.isEmpty()) {
            printer.out().print("Enter search query: ");
            printer.out().flush();
            String typed = readLine();
            query = typed == null ? "" : typed.strip();
        }
        if (query.isEmpty()) {
            printer.printError("Search query cannot be empty");
            return;
        }
        List<ConversationSummary> results = conversations.searchConversations(query, PICK_LIMIT);
        if (results.isEmpty()) {
            printer.printInfo("No conversations found matching '" + query + "'");
            return;
        }
        lastListing = results;
        printer.printInfo("Found " + results.size() + " conversations matching '" + query + "':");
        printNumbered(results);
    }

    private void deleteConversation(String argument) {
        ConversationSummary target;
        if (argument.isEmpty()) {
            target = conversations.getConversation(currentConversationId)
                    .map(Conversation::summary)
                    .orElse(null);
        } else {
            target = pick(argument);
        }
        if (target == null) {
            printer.printError("Nothing to delete");
            return;
        }
        if (!confirm("Delete conversation '" + target.title() + "'?")) {
            return;
        }
        if (conversations.deleteConversation(target.id())) {
            printer.printSuccess("Deleted conversation: " + target.title());
        } else {
            printer.printError("Failed to delete conversation");
        }
        if (target.id().equals(currentConversationId)) {
            startNewConversation(null);
        }
    }

    private void showStats() {
        Map<String, Object> stats = conversations.storageStats();
        if (stats.isEmpty()) {
            printer.printError("Could not retrieve statistics");
            return;
        }
        printer.printInfo("Storage Statistics:");
        stats.forEach((key, value) -> printer.printInfo("- " + humanize(key) + ": " + value));
    }

    private void cleanupConversations(String argument) {
        int days = ConversationStore.DEFAULT_CLEANUP_DAYS;
        if (!argument.isEmpty()) {
            try {
                days = Integer.parseInt(argument);
            } catch (NumberFormatException e) {
                printer.printError("Invalid number of days: " + argument);
                return;
            }
            if (days < 0) {
                printer.printError("Number of days must not be negative");
                return;
            }
        }
        if (confirm("Delete conversations older than " + days + " days?")) {
            int deleted = conversations.cleanupOldConversations(days);
            printer.printSuccess("Cleaned up " + deleted + " old conversations");
        }
    }

    private void toggleDebug() {
        debug = !debug;
        printer.printInfo("Debug mode: " + (debug ? "ON" : "OFF"));
    }

    private void showSystemInfo() {
        printer.printInfo("System Information:");
        printer.printInfo("- Platform: " + System.getProperty("os.name") + " " + System.getProperty("os.version"));
        printer.printInfo("- Architecture: " + System.getProperty("os.arch"));
        printer.printInfo("- Java: " + System.getProperty("java.version"));
        Map<String, Object> stats = conversations.storageStats();
        Object redisVersion = stats.get("redis_version");
        if (redisVersion != null) {
            printer.printInfo("- Redis: v" + redisVersion);
        } else {
            printer.printInfo("- Storage: " + conversations.backendName());
        }
        if (debug) {
            printer.printInfo("- Current conversation: " + conversations.conversationSummary(currentConversationId));
        }
    }

    private void printNumbered(List<ConversationSummary> summaries) {
        int index = 1;
        for (ConversationSummary summary : summaries) {
            printer.printInfo(index + ". " + summary.title() + " (" + summary.messageCount()
                    + " messages, updated: " + printer.dateTime(summary.updatedAt()) + ")");
            index++;
        }
    }

    private ConversationSummary pick(String choice) {
        if (choice == null || choice.isBlank()) {
            return null;
        }
        try {
            int index = Integer.parseInt(choice.strip()) - 1;
            if (index >= 0 && index < lastListing.size()) {
                return lastListing.get(index);
            }
            printer.printError("Invalid conversation number");
        } catch (NumberFormatException e) {
            printer.printError("Invalid input");
        }
        return null;
    }

    private boolean confirm(String question) {
        printer.printConfirm(question);
        String answer = readLine();
        if (answer == null) {
            return false;
        }
        String normalized = answer.strip().toLowerCase(Locale.ROOT);
        return normalized.equals("y") || normalized.equals("yes");
    }

    private String readLine() {
        try {
            return input.readLine();
        } catch (IOException e) {
            log.error("Cannot read from terminal", e);
            running = false;
            return null;
        }
    }

    private static String humanize(String key) {
        StringBuilder text = new StringBuilder();
        for (String part : key.split("_")) {
            if (part.isEmpty()) {
                continue;
            }
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return text.toString();
    }
}
