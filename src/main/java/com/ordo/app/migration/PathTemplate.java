package com.ordo.app.migration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import com.ordo.app.exception.ConfigurationException;

/**
 * Template de caminho relativo, como {@code Financial/Invoices/{YYYY}/{MM}/{filename}}.
 * Validado na construção; valores substituídos nunca criam diretórios novos.
 */
public final class PathTemplate {

    public static final String UNKNOWN = "Unknown";

    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_\\-]+");
    private static final Pattern DRIVE = Pattern.compile("^[A-Za-z]:.*");
    private static final Pattern UNSAFE = Pattern.compile("[<>:\"/\\\\|?*\\p{Cntrl}]");

    private final String raw;
    private final List<Token> tokens;
    private final Set<String> placeholders;

    private record Token(String text, boolean placeholder) {}

    /** Resultado do preenchimento; {@code unresolved} lista o que caiu em valor padrão. */
    public record Rendered(String relativePath, boolean requiresReview, List<String> unresolved) {}

    private PathTemplate(String raw, List<Token> tokens) {
        this.raw = raw;
        this.tokens = List.copyOf(tokens);
        Set<String> names = new LinkedHashSet<>();
        for (Token t : tokens) if (t.placeholder()) names.add(t.text());
        this.placeholders = Collections.unmodifiableSet(names);
    }

    public static PathTemplate parse(String raw) {
        if (StringUtils.isBlank(raw)) {
            throw new ConfigurationException("Template vazio");
        }
        String t = raw.strip();
        if (t.startsWith("/") || t.startsWith("\\") || DRIVE.matcher(t).matches()) {
            throw new ConfigurationException("Template não pode ser absoluto: " + raw);
        }

        List<Token> tokens = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < t.length()) {
            char c = t.charAt(i);
            if (c == '}') {
                throw new ConfigurationException("Chave '}' sem abertura em: " + raw);
            }
            if (c != '{') {
                literal.append(c);
                i++;
                continue;
            }
            int close = t.indexOf('}', i + 1);
            int nested = t.indexOf('{', i + 1);
            if (close < 0 || (nested >= 0 && nested < close)) {
                throw new ConfigurationException("Chaves desbalanceadas em: " + raw);
            }
            String name = t.substring(i + 1, close);
            if (!NAME.matcher(name).matches()) {
                throw new ConfigurationException("Placeholder inválido '{" + name + "}' em: " + raw);
            }
            if (literal.length() > 0) {
                tokens.add(new Token(literal.toString(), false));
                literal.setLength(0);
            }
            tokens.add(new Token(name, true));
            i = close + 1;
        }
        if (literal.length() > 0) tokens.add(new Token(literal.toString(), false));

        for (String segment : t.split("[/\\\\]")) {
            if (segment.equals("..") || segment.equals(".")) {
                throw new ConfigurationException("Segmento relativo não permitido em: " + raw);
            }
        }
        if (t.endsWith("/") || t.endsWith("\\")) {
            throw new ConfigurationException("Template precisa terminar em nome de arquivo: " + raw);
        }
        return new PathTemplate(t, tokens);
    }

    public String raw() {
        return raw;
    }

    public Set<String> placeholders() {
        return placeholders;
    }

    /**
     * @param values       valores conhecidos por placeholder
     * @param fallbackKeys valores presentes mas inferidos (ex.: data de descoberta); usá-los pede revisão
     * @param defaults     substitutos configurados para chaves ausentes
     */
    public Rendered render(Map<String, String> values, Set<String> fallbackKeys, Map<String, String> defaults) {
        StringBuilder out = new StringBuilder();
        boolean review = false;
        List<String> unresolved = new ArrayList<>();

        for (Token token : tokens) {
            if (!token.placeholder()) {
                out.append(token.text());
                continue;
            }
            String name = token.text();
            String value = values.get(name);
            if (StringUtils.isNotBlank(value)) {
                if (fallbackKeys.contains(name)) {
                    review = true;
                    unresolved.add(name);
                }
            } else {
                value = defaults.get(name);
                if (StringUtils.isBlank(value)) value = UNKNOWN;
                review = true;
                unresolved.add(name);
            }
            out.append(sanitizeSegment(value));
        }

        List<String> segments = new ArrayList<>();
        for (String s : out.toString().split("[/\\\\]+")) {
            String seg = s.strip();
            if (!seg.isEmpty()) segments.add(seg);
        }
        return new Rendered(String.join("/", segments), review, List.copyOf(unresolved));
    }

    /** Deixa o valor seguro como um único segmento de caminho. */
    public static String sanitizeSegment(String value) {
        String s = UNSAFE.matcher(value).replaceAll("_").strip();
        s = StringUtils.stripEnd(s, ". ");
        return s.isEmpty() ? UNKNOWN : s;
    }

    @Override
    public String toString() {
        return raw;
    }
}
