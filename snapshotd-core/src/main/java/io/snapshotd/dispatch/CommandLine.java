package io.snapshotd.dispatch;

import io.snapshotd.CommandMalformedException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Expands a command string into an argument vector using shell word rules, without
 * running a shell.
 *
 * <p>Supported: blank-separated words, single and double quotes, backslash escapes,
 * {@code $NAME} and {@code ${NAME}} taken from the configured environment (undefined names
 * expand to nothing, unquoted results are split on blanks), and a leading {@code ~}
 * replaced by {@code HOME}. Unlike {@code wordexp}, {@code ~user} is not looked up in the
 * user database and stays as written.
 *
 * <p>Rejected, with the matching {@code wordexp} code:
 * <ul>
 *   <li>unquoted {@code | & ; < > ( ) { }} or newline: {@link CommandMalformedException#BAD_CHARACTER}</li>
 *   <li>{@code $(...)} or backquotes: {@link CommandMalformedException#COMMAND_SUBSTITUTION}</li>
 *   <li>unterminated quotes, bad {@code ${...}}, trailing backslash, or no words at all:
 *       {@link CommandMalformedException#SYNTAX}</li>
 * </ul>
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class CommandLine {
    private static final String SPECIAL = "|&;<>(){}";
    private static final String DOUBLE_QUOTE_ESCAPABLE = "$`\"\\\n";

    private final Map<String, String> environment;

    /**
     * Creates an expander backed by the process environment.
     */
    public CommandLine() {
        this(System.getenv());
    }

    public CommandLine(Map<String, String> environment) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
    }

    /**
     * Expands {@code command} into words.
     *
     * @param command the command string as received in the request
     * @return at least one word
     * @throws CommandMalformedException if the command cannot be expanded
     */
    public List<String> expand(String command) throws CommandMalformedException {
        Objects.requireNonNull(command, "command");
        List<String> words = new Expansion(command).run();
        if (words.isEmpty()) {
            throw new CommandMalformedException(CommandMalformedException.SYNTAX);
        }
        return List.copyOf(words);
    }

    private final class Expansion {
        private final String input;
        private final List<String> words = new ArrayList<>();
        private final StringBuilder current = new StringBuilder();
        // set once the current word contained quotes, so an empty "" still counts as a word
        private boolean quoted;
        private int pos;

        Expansion(String input) {
            this.input = input;
        }

        List<String> run() throws CommandMalformedException {
            while (pos < input.length()) {
                char c = input.charAt(pos);
                if (c == ' ' || c == '\t') {
                    endWord();
                    pos++;
                    continue;
                }
                if (c == '\n' || SPECIAL.indexOf(c) >= 0) {
                    throw new CommandMalformedException(CommandMalformedException.BAD_CHARACTER);
                }
                switch (c) {
                    case '\\' -> escaped();
                    case '\'' -> singleQuoted();
                    case '"' -> doubleQuoted();
                    case '`' -> throw new CommandMalformedException(CommandMalformedException.COMMAND_SUBSTITUTION);
                    case '$' -> variable(true);
                    case '~' -> tilde();
                    default -> {
                        current.append(c);
                        pos++;
                    }
                }
            }
            endWord();
            return words;
        }

        private void escaped() throws CommandMalformedException {
            if (pos + 1 >= input.length()) {
                throw new CommandMalformedException(CommandMalformedException.SYNTAX);
            }
            char next = input.charAt(pos + 1);
            if (next != '\n') {
                current.append(next);
                quoted = true;
            }
            pos += 2;
        }

        private void singleQuoted() throws CommandMalformedException {
            int end = input.indexOf('\'', pos + 1);
            if (end < 0) {
                throw new CommandMalformedException(CommandMalformedException.SYNTAX);
            }
            current.append(input, pos + 1, end);
            quoted = true;
            pos = end + 1;
        }

        private void doubleQuoted() throws CommandMalformedException {
            quoted = true;
            pos++;
            while (pos < input.length()) {
                char c = input.charAt(pos);
                if (c == '"') {
                    pos++;
                    return;
                }
                if (c == '\\' && pos + 1 < input.length()
                        && DOUBLE_QUOTE_ESCAPABLE.indexOf(input.charAt(pos + 1)) >= 0) {
                    char next = input.charAt(pos + 1);
                    if (next != '\n') {
                        current.append(next);
                    }
                    pos += 2;
                } else if (c == '`') {
                    throw new CommandMalformedException(CommandMalformedException.COMMAND_SUBSTITUTION);
                } else if (c == '$') {
                    variable(false);
                } else {
                    current.append(c);
                    pos++;
                }
            }
            throw new CommandMalformedException(CommandMalformedException.SYNTAX);
        }

        private void variable(boolean split) throws CommandMalformedException {
            int next = pos + 1;
            if (next >= input.length()) {
                current.append('$');
                pos++;
                return;
            }
            char c = input.charAt(next);
            String value;
            if (c == '(') {
                throw new CommandMalformedException(CommandMalformedException.COMMAND_SUBSTITUTION);
            } else if (c == '{') {
                int close = input.indexOf('}', next + 1);
                if (close < 0) {
                    throw new CommandMalformedException(CommandMalformedException.SYNTAX);
                }
                String name = input.substring(next + 1, close);
                if (!isName(name)) {
                    throw new CommandMalformedException(CommandMalformedException.SYNTAX);
                }
                value = environment.getOrDefault(name, "");
                pos = close + 1;
            } else if (isNameStart(c)) {
                int end = next + 1;
                while (end < input.length() && isNamePart(input.charAt(end))) {
                    end++;
                }
                value = environment.getOrDefault(input.substring(next, end), "");
                pos = end;
            } else {
                current.append('$');
                pos++;
                return;
            }

            if (!split) {
                current.append(value);
                return;
            }
            for (int i = 0; i < value.length(); i++) {
                char v = value.charAt(i);
                if (v == ' ' || v == '\t' || v == '\n') {
                    endWord();
                } else {
                    current.append(v);
                }
            }
        }

        private void tilde() {
            boolean wordStart = current.length() == 0 && !quoted;
            int next = pos + 1;
            boolean bare = next >= input.length() || input.charAt(next) == '/'
                    || input.charAt(next) == ' ' || input.charAt(next) == '\t';
            String home = environment.get("HOME");
            if (wordStart && bare && home != null) {
                current.append(home);
            } else {
                current.append('~');
            }
            pos++;
        }

        private void endWord() {
            if (current.length() > 0 || quoted) {
                words.add(current.toString());
            }
            current.setLength(0);
            quoted = false;
        }
    }

    private static boolean isName(String name) {
        if (name.isEmpty() || !isNameStart(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            if (!isNamePart(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isNameStart(char c) {
        return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isNamePart(char c) {
        return isNameStart(c) || (c >= '0' && c <= '9');
    }
}
