package com.jreinhal.quarry.rag.channel;

import com.jreinhal.quarry.QueryTag;
import com.jreinhal.quarry.constant.StopWords;
import com.jreinhal.quarry.model.ChannelQuerySet;
import com.jreinhal.quarry.model.DenseQuery;
import com.jreinhal.quarry.util.TextTokens;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Default channel strategy: keyword extraction for the short and title channels, the cleaned
 * question for the lexical channel, and the keyword text for the vector channel.
 */
@Component
public class KeywordQueryChannelBuilder implements QueryChannelBuilder {
    private static final Pattern QUOTED = Pattern.compile("\"([^\"\\n]{2,})\"");
    private static final Pattern DOC_SLUG = Pattern.compile("(?<![a-z0-9_])(\\d{3}_[a-z0-9][a-z0-9_\\-]*[a-z0-9])(?:\\.md)?");
    private static final int TITLE_TERM_LIMIT = 6;
    @Value(value="${quarry.retrieval.vector-enabled:true}")
    private boolean vectorEnabled = true;

    @Override
    public ChannelQuerySet build(String question, QueryTag tag) {
        if (question == null || question.isBlank()) {
            return ChannelQuerySet.empty();
        }
        QueryTag effectiveTag = tag != null ? tag : QueryTag.GENERAL;
        String lexical = TextTokens.collapseWhitespace(question.replace('\u0000', ' '));
        if (lexical.isEmpty()) {
            return ChannelQuerySet.empty();
        }
        List<String> keywords = this.keywords(lexical);
        String shortQuery = this.shortQuery(keywords, effectiveTag, lexical);
        String titleQuery = this.titleQuery(keywords, shortQuery);
        Optional<DenseQuery> dense = Optional.empty();
        if (this.vectorEnabled) {
            String denseText = keywords.isEmpty() ? lexical : String.join(" ", keywords);
            dense = Optional.of(new DenseQuery(denseText));
        }
        return new ChannelQuerySet(shortQuery, titleQuery, lexical, dense, this.phraseHints(lexical, effectiveTag), this.docHint(lexical));
    }

    private List<String> keywords(String text) {
        ArrayList<String> keywords = new ArrayList<String>();
        for (String token : TextTokens.tokens(text, StopWords.CHANNEL_KEYWORDS)) {
            if (token.length() < 2) continue;
            keywords.add(token);
        }
        return keywords;
    }

    private String shortQuery(List<String> keywords, QueryTag tag, String lexical) {
        if (keywords.isEmpty()) {
            return lexical;
        }
        LinkedHashSet<String> terms = new LinkedHashSet<String>(keywords);
        terms.addAll(tag.getHintTerms());
        return String.join(" ", terms);
    }

    private String titleQuery(List<String> keywords, String shortQuery) {
        if (keywords.isEmpty()) {
            return shortQuery;
        }
        LinkedHashSet<String> terms = new LinkedHashSet<String>();
        for (String keyword : keywords) {
            if (!isIdentifierLike(keyword)) continue;
            terms.add(keyword);
        }
        terms.addAll(keywords);
        return String.join(" ", terms.stream().limit(TITLE_TERM_LIMIT).toList());
    }

    private List<String> phraseHints(String lexical, QueryTag tag) {
        LinkedHashSet<String> hints = new LinkedHashSet<String>();
        Matcher matcher = QUOTED.matcher(lexical);
        while (matcher.find()) {
            String phrase = matcher.group(1).trim();
            if (phrase.isEmpty()) continue;
            hints.add(phrase.toLowerCase(Locale.ROOT));
        }
        hints.addAll(tag.getPhraseHints());
        return List.copyOf(hints);
    }

    private Optional<String> docHint(String lexical) {
        Matcher matcher = DOC_SLUG.matcher(lexical.toLowerCase(Locale.ROOT));
        if (matcher.find()) {
            return Optional.of(matcher.group(1));
        }
        return Optional.empty();
    }

    private static boolean isIdentifierLike(String token) {
        return token.indexOf('_') >= 0 || token.indexOf('.') >= 0 || token.indexOf('-') >= 0;
    }
}
