package com.social.feed.backend.feed.scoring;

import java.util.regex.Pattern;

/**
 * SQL LIKE 매칭을 자바에서 재현. '%' = 0개 이상 문자, '_' = 정확히 1문자, 대소문자 구분.
 * 이스케이프 문자는 지원하지 않는다.
 */
public final class LikePattern {

    private final String source;
    private final Pattern compiled;

    private LikePattern(String source) {
        this.source = source;
        this.compiled = Pattern.compile(toRegex(source), Pattern.DOTALL);
    }

    public static LikePattern compile(String likePattern) {
        return new LikePattern(likePattern == null ? "" : likePattern);
    }

    public boolean matches(String value) {
        if (value == null) return false;
        return compiled.matcher(value).matches();
    }

    public String source() {
        return source;
    }

    private static String toRegex(String like) {
        StringBuilder regex = new StringBuilder(like.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < like.length(); i++) {
            char ch = like.charAt(i);
            if (ch == '%' || ch == '_') {
                flush(literal, regex);
                regex.append(ch == '%' ? ".*" : ".");
            } else {
                literal.append(ch);
            }
        }
        flush(literal, regex);
        return regex.toString();
    }

    private static void flush(StringBuilder literal, StringBuilder regex) {
        if (literal.length() == 0) return;
        regex.append(Pattern.quote(literal.toString()));
        literal.setLength(0);
    }
}
