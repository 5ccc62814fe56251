package com.threatintel.auth.inside;

import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class UrlPatternMatcherTest {

    @Test
    void translatesGlobWildcards() {
        Pattern star = Pattern.compile(UrlPatternMatcher.translateGlob("http://*/a?c"));

        assertThat(star.matcher("http://host/path/abc").matches()).isTrue();
        assertThat(star.matcher("http://host/ac").matches()).isFalse();
    }

    @Test
    void translatesCharacterSets() {
        Pattern set = Pattern.compile(UrlPatternMatcher.translateGlob("file[0-9].txt"));
        Pattern negated = Pattern.compile(UrlPatternMatcher.translateGlob("file[!0-9].txt"));

        assertThat(set.matcher("file7.txt").matches()).isTrue();
        assertThat(set.matcher("fileX.txt").matches()).isFalse();
        assertThat(negated.matcher("fileX.txt").matches()).isTrue();
        assertThat(negated.matcher("file7.txt").matches()).isFalse();
    }

    @Test
    void unclosedBracketIsLiteral() {
        Pattern pattern = Pattern.compile(UrlPatternMatcher.translateGlob("a[b"));

        assertThat(pattern.matcher("a[b").matches()).isTrue();
    }

    @Test
    void regexSpecialCharactersOutsideSetsAreLiteral() {
        Pattern pattern = Pattern.compile(UrlPatternMatcher.translateGlob("http://a.example/x+y"));

        assertThat(pattern.matcher("http://a.example/x+y").matches()).isTrue();
        assertThat(pattern.matcher("http://aXexample/xxy").matches()).isFalse();
    }

    @Test
    void regexReadingMatchesAnywhere() {
        UrlPatternMatcher matcher = UrlPatternMatcher.compile("evil\\.example");

        assertThat(matcher.matches("http://www.evil.example/login")).isTrue();
        assertThat(matcher.matches("http://www.good.example/")).isFalse();
    }

    @Test
    void globReadingMustMatchWholeUrl() {
        UrlPatternMatcher matcher = UrlPatternMatcher.compile("*.example/login");

        assertThat(matcher.matches("http://a.example/login")).isTrue();
        assertThat(matcher.getPattern()).isEqualTo("*.example/login");
    }

    @Test
    void invalidRegexFallsBackToGlob() {
        UrlPatternMatcher matcher = UrlPatternMatcher.compile("http://a.example/[[");

        assertThat(matcher).isNotNull();
        assertThat(matcher.matches("http://a.example/[[")).isTrue();
        assertThat(matcher.matches("http://a.example/x")).isFalse();
    }

    @Test
    void regexCharacterClassesCoverNonAsciiLetters() {
        UrlPatternMatcher matcher = UrlPatternMatcher.compile("^https://\\w+\\.example/$");

        assertThat(matcher.matches("https://zażółć.example/")).isTrue();
        assertThat(matcher.matches("https://a-b.example/")).isFalse();
    }
}
