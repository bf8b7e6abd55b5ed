package com.polyglot.pipeline.markdown;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TokenizerTest {

    @Test
    void tokenize_emptyInput_returnsNoTokens() {
        assertThat(Tokenizer.tokenize("")).isEmpty();
        assertThat(Tokenizer.tokenize(null)).isEmpty();
    }

    @Test
    void tokenize_headingTextAndBlank() {
        List<Token> tokens = Tokenizer.tokenize("## Setup\n\nplain words");

        assertThat(tokens).containsExactly(
                new Token.Heading(2, "Setup", 1),
                new Token.Blank(2),
                new Token.TextLine(3, "plain words"));
    }

    @Test
    void tokenize_codeFence_capturesLangMetaAndContent() {
        List<Token> tokens = Tokenizer.tokenize("```dockerfile title=app\nFROM alpine\n```");

        assertThat(tokens).containsExactly(
                new Token.CodeFenceStart("dockerfile", "title=app", 1),
                new Token.CodeContent(2, "FROM alpine"),
                new Token.CodeFenceEnd(3));
    }

    @Test
    void tokenize_headingInsideFence_isCodeContent() {
        List<Token> tokens = Tokenizer.tokenize("```bash\n# not a heading\n```");

        assertThat(tokens.get(1)).isEqualTo(new Token.CodeContent(2, "# not a heading"));
        assertThat(tokens).noneMatch(t -> t instanceof Token.Heading);
    }

    @Test
    void tokenize_singleLineComment_isOneToken() {
        List<Token> tokens = Tokenizer.tokenize("<!-- polyglot:executable -->");

        assertThat(tokens).containsExactly(new Token.HtmlComment(1, "<!-- polyglot:executable -->"));
    }

    @Test
    void tokenize_multiLineComment_wrapsFenceLikeLines() {
        List<Token> tokens = Tokenizer.tokenize("<!--\n```bash\n# hidden\n-->\ntext");

        assertThat(tokens).containsExactly(
                new Token.HtmlCommentStart(1, "<!--"),
                new Token.HtmlCommentContent(2, "```bash"),
                new Token.HtmlCommentContent(3, "# hidden"),
                new Token.HtmlCommentEnd(4, "-->"),
                new Token.TextLine(5, "text"));
    }

    @Test
    void tokenize_commentMarkerInsideFence_doesNotOpenComment() {
        List<Token> tokens = Tokenizer.tokenize("```html\n<!-- inside\n```\nafter");

        assertThat(tokens).containsExactly(
                new Token.CodeFenceStart("html", "", 1),
                new Token.CodeContent(2, "<!-- inside"),
                new Token.CodeFenceEnd(3),
                new Token.TextLine(4, "after"));
    }

    @Test
    void tokenize_crlfLineEndings_areSplit() {
        List<Token> tokens = Tokenizer.tokenize("# Title\r\nbody");

        assertThat(tokens).containsExactly(
                new Token.Heading(1, "Title", 1),
                new Token.TextLine(2, "body"));
    }
}
