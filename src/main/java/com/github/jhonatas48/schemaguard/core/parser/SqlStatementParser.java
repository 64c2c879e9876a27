package com.github.jhonatas48.schemaguard.core.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Divide um script SQL em instruções executáveis, na ordem em que aparecem.
 *
 * Máquina de estados:
 *  - NORMAL: ';' fecha a instrução corrente;
 *  - IN_TRIGGER_BODY: dentro de BEGIN ... END de um CREATE TRIGGER, ';' faz parte do corpo;
 *  - IN_LINE_COMMENT: de '--' até o fim da linha (descartado, a quebra de linha é mantida);
 *  - IN_STRING_LITERAL: dentro de '...' ou "...", nada é interpretado.
 *
 * Nunca lança exceção: a validade de cada instrução fica a cargo do SQLite na execução.
 */
public final class SqlStatementParser {

    private static final String LINE_COMMENT_MARKER = "--";
    private static final char TERMINATOR = ';';

    private static final Pattern CREATE_TRIGGER =
            Pattern.compile("^\\s*CREATE\\s+(?:TEMP\\s+|TEMPORARY\\s+)?TRIGGER\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRIGGER_END =
            Pattern.compile("^END\\s*;", Pattern.CASE_INSENSITIVE);

    private enum State {
        NORMAL,
        IN_TRIGGER_BODY,
        IN_LINE_COMMENT,
        IN_STRING_LITERAL
    }

    /**
     * @param script conteúdo bruto do script (pode ser nulo ou vazio)
     * @return instruções não vazias e sem espaços nas pontas
     */
    public List<String> parse(String script) {
        if (script == null || script.isBlank()) {
            return Collections.emptyList();
        }

        final String cleaned = stripCommentOnlyLines(script);
        final List<String> statements = new ArrayList<>();
        final StringBuilder current = new StringBuilder();

        State state = State.NORMAL;
        // estado para onde voltar ao sair de comentário/literal
        State resumeState = State.NORMAL;
        char quote = 0;
        int caseDepth = 0;

        int i = 0;
        while (i < cleaned.length()) {
            final char ch = cleaned.charAt(i);

            switch (state) {
                case IN_LINE_COMMENT -> {
                    if (ch == '\n') {
                        current.append(ch);
                        state = resumeState;
                    }
                    i++;
                }
                case IN_STRING_LITERAL -> {
                    current.append(ch);
                    if (ch == quote) {
                        if (i + 1 < cleaned.length() && cleaned.charAt(i + 1) == quote) {
                            current.append(quote);
                            i += 2;
                            continue;
                        }
                        state = resumeState;
                    }
                    i++;
                }
                case NORMAL -> {
                    if (startsLineComment(cleaned, i)) {
                        resumeState = State.NORMAL;
                        state = State.IN_LINE_COMMENT;
                        i += LINE_COMMENT_MARKER.length();
                    } else if (isQuote(ch)) {
                        quote = ch;
                        resumeState = State.NORMAL;
                        state = State.IN_STRING_LITERAL;
                        current.append(ch);
                        i++;
                    } else if (ch == TERMINATOR) {
                        flush(current, statements);
                        i++;
                    } else if (startsWord(cleaned, i, "BEGIN") && CREATE_TRIGGER.matcher(current).find()) {
                        state = State.IN_TRIGGER_BODY;
                        caseDepth = 0;
                        current.append(cleaned, i, i + 5);
                        i += 5;
                    } else {
                        current.append(ch);
                        i++;
                    }
                }
                case IN_TRIGGER_BODY -> {
                    if (startsLineComment(cleaned, i)) {
                        resumeState = State.IN_TRIGGER_BODY;
                        state = State.IN_LINE_COMMENT;
                        i += LINE_COMMENT_MARKER.length();
                    } else if (isQuote(ch)) {
                        quote = ch;
                        resumeState = State.IN_TRIGGER_BODY;
                        state = State.IN_STRING_LITERAL;
                        current.append(ch);
                        i++;
                    } else if (startsWord(cleaned, i, "CASE")) {
                        caseDepth++;
                        current.append(cleaned, i, i + 4);
                        i += 4;
                    } else if (startsWord(cleaned, i, "END")) {
                        final Matcher end = TRIGGER_END.matcher(cleaned.substring(i));
                        if (caseDepth == 0 && end.find()) {
                            current.append(end.group());
                            i += end.end();
                            flush(current, statements);
                            state = State.NORMAL;
                        } else {
                            if (caseDepth > 0) caseDepth--;
                            current.append(cleaned, i, i + 3);
                            i += 3;
                        }
                    } else {
                        current.append(ch);
                        i++;
                    }
                }
            }
        }

        flush(current, statements);
        return statements;
    }

    /** Apaga o conteúdo das linhas que são só comentário, mantendo as quebras de linha. */
    static String stripCommentOnlyLines(String script) {
        final String[] lines = script.split("\n", -1);
        final StringBuilder out = new StringBuilder(script.length());
        for (int i = 0; i < lines.length; i++) {
            if (!lines[i].trim().startsWith(LINE_COMMENT_MARKER)) {
                out.append(lines[i]);
            }
            if (i < lines.length - 1) {
                out.append('\n');
            }
        }
        return out.toString();
    }

    private static void flush(StringBuilder current, List<String> statements) {
        final String statement = current.toString().trim();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
        current.setLength(0);
    }

    private static boolean startsLineComment(String text, int index) {
        return text.startsWith(LINE_COMMENT_MARKER, index);
    }

    private static boolean isQuote(char ch) {
        return ch == '\'' || ch == '"';
    }

    /** Palavra-chave inteira (case-insensitive) começando em {@code index}. */
    private static boolean startsWord(String text, int index, String keyword) {
        final int end = index + keyword.length();
        if (end > text.length()) return false;
        if (!text.substring(index, end).toUpperCase(Locale.ROOT).equals(keyword)) return false;
        if (index > 0 && isIdentifierChar(text.charAt(index - 1))) return false;
        return end == text.length() || !isIdentifierChar(text.charAt(end));
    }

    private static boolean isIdentifierChar(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_' || ch == '$';
    }
}
