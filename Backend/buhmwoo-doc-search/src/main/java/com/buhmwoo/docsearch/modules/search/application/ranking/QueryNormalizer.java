package com.buhmwoo.docsearch.modules.search.application.ranking;

import com.buhmwoo.docsearch.modules.search.application.source.QueryExpansion;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 질의 문자열을 가중치가 붙은 검색어 목록으로 바꾸고, 청크 본문 토큰화도 담당합니다.
 * <p>
 * 따옴표 구문을 먼저 꺼내 하나의 검색어로 취급한 뒤, 나머지를 공백/구두점(태국어 구분 기호 포함) 기준으로 나눕니다.
 * 상태가 없으므로 여러 스레드에서 동시에 호출해도 됩니다.
 */
@Component
public class QueryNormalizer {

    // ✅ 공백, 유니코드 구두점(태국어 ๏ ๚ ๛ 포함), 반복 기호 ๆ, 약어 기호 ฯ 를 구분자로 봅니다.
    private static final Pattern TOKEN = Pattern.compile("[^\\s\\p{P}\\u0E2F\\u0E46]+");
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]*)\"");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * 원문 기준 시작 오프셋을 함께 가진 토큰입니다.
     */
    public record Token(String text, int offset) {
    }

    /**
     * 소문자 토큰 목록만 필요할 때 사용합니다.
     */
    public List<String> tokenize(String text) {
        return tokenizeWithOffsets(text).stream().map(Token::text).toList();
    }

    public List<Token> tokenizeWithOffsets(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<Token> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(text);
        while (m.find()) {
            tokens.add(new Token(m.group().toLowerCase(Locale.ROOT), m.start()));
        }
        return tokens;
    }

    /**
     * 질의를 검색어 목록으로 변환합니다. 빈 질의는 빈 목록을 돌려줍니다.
     */
    public List<SearchTerm> parse(String query, RankingSettings settings) {
        if (query == null || query.isBlank()) {
            return List.of();
        }

        List<SearchTerm> terms = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();

        // 1) 따옴표 구문 → 높은 가중치의 단일 검색어
        Matcher quoted = QUOTED.matcher(query);
        StringBuilder remaining = new StringBuilder();
        while (quoted.find()) {
            String phrase = normalizePhrase(quoted.group(1));
            if (!phrase.isEmpty() && seen.add(phrase)) {
                terms.add(new SearchTerm(phrase, settings.phraseWeight(),
                        isFuzzyEligible(phrase, settings), TermSource.ORIGINAL));
            }
            quoted.appendReplacement(remaining, " ");
        }
        quoted.appendTail(remaining);

        // 2) 나머지 토큰
        for (String token : tokenize(remaining.toString())) {
            if (token.length() <= 1 || settings.stopWords().contains(token) || !seen.add(token)) {
                continue;
            }
            double weight = token.length() < 3 ? settings.shortTermWeight() : settings.termWeight();
            terms.add(new SearchTerm(token, weight, isFuzzyEligible(token, settings), TermSource.ORIGINAL));
        }
        return List.copyOf(terms);
    }

    /**
     * 확장 서비스가 돌려준 검색어를 원래 검색어 뒤에 덧붙입니다. 이미 있는 검색어와 기능어는 건너뜁니다.
     */
    public List<SearchTerm> mergeExpansion(List<SearchTerm> original, QueryExpansion expansion, RankingSettings settings) {
        if (expansion == null || expansion.expandedTerms().isEmpty()) {
            return original;
        }
        TermSource source = expansion.contextual() ? TermSource.CONTEXTUAL : TermSource.EXPANDED;
        Set<String> seen = new LinkedHashSet<>();
        original.forEach(term -> seen.add(term.text()));

        List<SearchTerm> merged = new ArrayList<>(original);
        for (String raw : expansion.expandedTerms()) {
            String text = normalizePhrase(raw);
            if (text.length() <= 1 || settings.stopWords().contains(text) || !seen.add(text)) {
                continue;
            }
            merged.add(new SearchTerm(text, settings.expandedTermWeight(), isFuzzyEligible(text, settings), source));
        }
        return List.copyOf(merged);
    }

    private boolean isFuzzyEligible(String text, RankingSettings settings) {
        return text.length() >= settings.fuzzy().minTermLength();
    }

    private String normalizePhrase(String raw) {
        if (raw == null) {
            return "";
        }
        return WHITESPACE.matcher(raw.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }
}
