package com.queryhub.domain.service;

import com.queryhub.domain.error.InvalidQueryException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Local read-only check of query text, run before any quota or credential work.
 *
 * Structural checks run on the text with comments removed and string literals
 * blanked. Dangerous keywords are searched in that text and again in the text
 * with its comments kept, so {@code SELECT 1 -- DROP TABLE x} is rejected.
 * Keywords inside string literals ({@code WHERE event = 'delete'}) pass.
 *
 * Keywords match as whole words in any position, so functions that share a
 * name ({@code truncate(x)}, {@code replace(s, 'a', 'b')}) are rejected as well;
 * {@code replaceAll} and {@code replaceOne} are not affected.
 */
@Component
public class QueryValidator {

    private static final Pattern LINE_COMMENT = Pattern.compile("--[^\\n]*");
    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^'\\\\]|\\\\.|'')*'");

    private static final Pattern DANGEROUS_KEYWORD = Pattern.compile(
            "\\b(DROP|DELETE|TRUNCATE|ALTER|CREATE|INSERT|UPDATE|GRANT|REVOKE|EXEC|EXECUTE|MERGE|REPLACE)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> INJECTION_PATTERNS = List.of(
            Pattern.compile("\\bUNION\\s+(ALL\\s+)?SELECT\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bINTO\\s+OUTFILE\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bLOAD_FILE\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("'\\s*OR\\s*'1'\\s*=\\s*'1", Pattern.CASE_INSENSITIVE),
            Pattern.compile("'\\s*;\\s*--"));

    private final int maxLength;

    public QueryValidator(@Value("${app.query.max-length:10000}") int maxLength) {
        this.maxLength = maxLength;
    }

    public void validate(String queryText) {
        if (queryText == null || queryText.isBlank()) {
            throw new InvalidQueryException("query text is empty");
        }
        if (queryText.length() > maxLength) {
            throw new InvalidQueryException("query exceeds " + maxLength + " characters");
        }

        for (Pattern pattern : INJECTION_PATTERNS) {
            if (pattern.matcher(queryText).find()) {
                throw new InvalidQueryException("query contains a disallowed pattern");
            }
        }

        String structural = structuralText(queryText);
        if (structural.isEmpty()) {
            throw new InvalidQueryException("query contains only comments");
        }

        String body = structural.endsWith(";")
                ? structural.substring(0, structural.length() - 1).trim()
                : structural;
        if (body.contains(";")) {
            throw new InvalidQueryException("only a single statement is allowed");
        }

        if (!body.toUpperCase(Locale.ROOT).startsWith("SELECT")) {
            throw new InvalidQueryException("only SELECT queries are allowed");
        }

        rejectDangerousKeyword(body);
        rejectDangerousKeyword(STRING_LITERAL.matcher(queryText).replaceAll("''"));
    }

    private static void rejectDangerousKeyword(String text) {
        Matcher keyword = DANGEROUS_KEYWORD.matcher(text);
        if (keyword.find()) {
            throw new InvalidQueryException("keyword " + keyword.group(1).toUpperCase(Locale.ROOT) + " is not allowed");
        }
    }

    static String structuralText(String queryText) {
        String text = BLOCK_COMMENT.matcher(queryText).replaceAll(" ");
        text = STRING_LITERAL.matcher(text).replaceAll("''");
        text = LINE_COMMENT.matcher(text).replaceAll(" ");
        return text.trim();
    }
}
