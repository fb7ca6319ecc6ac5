package com.yourapp.chatshell.shell;

import com.yourapp.chatshell.model.Message;
import com.yourapp.chatshell.model.MessageRole;
import java.io.PrintStream;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

public class ConsolePrinter {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final DateTimeFormatter DATE_TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final PrintStream out;
    private final ShellTheme theme;
    private final boolean showTimestamps;
    private final int width;
    private final Clock clock;

    public ConsolePrinter(PrintStream out, ShellTheme theme, boolean showTimestamps, int width, Clock clock) {
        this.out = out;
        this.theme = theme;
        this.showTimestamps = showTimestamps;
        this.width = width;
        this.clock = clock;
    }

    public ShellTheme theme() {
        return theme;
    }

    public PrintStream out() {
        return out;
    }

    public void printHeader() {
        out.println(theme.header() + """

                +------------------------------------------------------------+
                |                        Chat Shell                          |
                |          Terminal assistant with saved conversations       |
                +------------------------------------------------------------+
                """ + theme.reset());
    }

    public void printWelcome(String backendName) {
        out.println(theme.success() + "Welcome to Chat Shell!" + theme.reset());
        out.println("Conversations are stored using " + backendName + " storage.");
        out.println(theme.info() + "Type your message and press Enter to start chatting." + theme.reset());
        out.println("Type " + theme.bold() + "/help" + theme.reset() + " for available commands.");
        out.println();
    }

    public void printHelp() {
        String command = theme.success();
        String reset = theme.reset();
        out.println(theme.warning() + "Available Commands:" + reset);
        out.println();
        out.println(theme.bold() + "Chat Commands:" + reset);
        out.println("  " + command + "/help, /h" + reset + "          - Show this help message");
        out.println("  " + command + "/clear, /c" + reset + "         - Clear the screen");
        out.println("  " + command + "/new, /n [title]" + reset + "   - Start a new conversation");
        out.println("  " + command + "/quit, /q, /exit" + reset + "   - Exit the application");
        out.println();
        out.println(theme.bold() + "Conversation Management:" + reset);
        out.println("  " + command + "/history, /hist" + reset + "    - Show current conversation history");
        out.println("  " + command + "/save, /s" + reset + "          - Save current conversation");
        out.println("  " + command + "/load, /l" + reset + "          - Load a saved conversation");
        out.println("  " + command + "/list" + reset + "              - List all conversations");
        out.println("  " + command + "/search [query]" + reset + "    - Search conversations");
        out.println("  " + command + "/delete [n]" + reset + "        - Delete a conversation");
        out.println("  " + command + "/stats" + reset + "             - Show storage statistics");
        out.println("  " + command + "/cleanup [days]" + reset + "    - Delete conversations older than N days");
        out.println();
        out.println(theme.bold() + "System:" + reset);
        out.println("  " + command + "/debug" + reset + "             - Toggle debug mode");
        out.println("  " + command + "/colors" + reset + "            - Show color status");
        out.println("  " + command + "/sysinfo" + reset + "           - Show system information");
        out.println();
        out.println(theme.dim() + "Simply type your message to chat with the assistant." + reset);
    }

    public void printPrompt() {
        out.print(theme.user() + "You:" + theme.reset() + " ");
        out.flush();
    }

    public void printAssistantResponse(String response) {
        String stamp = showTimestamps ? " " + theme.dim() + "(" + time(clock.instant()) + "):" + theme.reset() : ":";
        out.println();
        out.println(theme.assistant() + "Assistant" + theme.reset() + stamp);
        for (String line : wrap(response, width - 4)) {
            out.println("  " + line);
        }
        out.println();
    }

    public void printHistory(List<Message> messages) {
        if (messages.isEmpty()) {
            printInfo("No messages in current conversation");
            return;
        }
        out.println();
        out.println(theme.warning() + "Conversation History:" + theme.reset());
        out.println("=".repeat(50));
        int index = 1;
        for (Message message : messages) {
            boolean user = message.role() == MessageRole.USER;
            String roleColor = user ? theme.user() : theme.assistant();
            String roleName = user ? "You" : "Assistant";
            out.println();
            out.println(theme.bold() + index + "." + theme.reset() + " " + roleColor + roleName + theme.reset()
                    + " " + theme.dim() + "(" + time(message.timestamp()) + "):" + theme.reset());
            for (String line : wrap(message.content(), width - 4)) {
                out.println("   " + line);
            }
            index++;
        }
        out.println();
        out.println("=".repeat(50));
    }

    public void printInfo(String message) {
        out.println(theme.info() + "i " + message + theme.reset());
    }

    public void printSuccess(String message) {
        out.println(theme.success() + "+ " + message + theme.reset());
    }

    public void printWarning(String message) {
        out.println(theme.warning() + "! " + message + theme.reset());
    }

    public void printError(String message) {
        out.println(theme.error() + "x " + message + theme.reset());
    }

    public void printConfirm(String message) {
        out.print(theme.warning() + message + " (y/N): " + theme.reset());
        out.flush();
    }

    public void clearScreen() {
        if (theme.colorsEnabled()) {
            out.print("\u001B[H\u001B[2J");
            out.flush();
        }
        printHeader();
    }

    public void printColorStatus() {
        printInfo("Colors enabled: " + theme.colorsEnabled());
        if (theme.colorsEnabled()) {
            printSuccess("Colors should be working");
        }
    }

    public String dateTime(Instant instant) {
        return instant == null ? "unknown" : DATE_TIME_FORMAT.format(instant.atZone(zone()));
    }

    private String time(Instant instant) {
        return instant == null ? "--:--:--" : TIME_FORMAT.format(instant.atZone(zone()));
    }

    private ZoneId zone() {
        return ZoneId.systemDefault();
    }

    static List<String> wrap(String text, int width) {
        if (text == null || text.isEmpty()) {
            return List.of("");
        }
        if (width <= 0 || text.length() <= width) {
            return List.of(text.split("\n", -1));
        }
        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String word : text.split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (current.length() > 0 && current.length() + 1 + word.length() > width) {
                lines.add(current.toString());
                current.setLength(0);
            }
            if (current.length() > 0) {
                current.append(' ');
            }
            current.append(word);
        }
        if (current.length() > 0) {
            lines.add(current.toString());
        }
        return lines;
    }
}
