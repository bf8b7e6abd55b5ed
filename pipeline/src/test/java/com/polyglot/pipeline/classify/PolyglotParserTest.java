package com.polyglot.pipeline.classify;

import com.polyglot.pipeline.markdown.AstNode;
import com.polyglot.pipeline.markdown.MarkdownParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end parse: tree enhancement with classification data.
 */
class PolyglotParserTest {

    @Test
    void parse_executableDirective_attachesToFollowingCode() {
        Polyglot p = PolyglotParser.parse("""
                # Run me

                <!-- polyglot:executable -->

                ```bash
                echo hi
                ```
                """);

        assertThat(p.language()).isEqualTo(Language.EXECUTABLE);
        AstNode.Code code = codeNode(p.ast());
        Map<String, Object> kyozo = kyozo(code);
        assertThat(kyozo)
                .containsEntry("artifact", "bash")
                .containsEntry("executable", true)
                .containsKey("directives");
    }

    @Test
    void parse_htmlNodeHoldingDirective_carriesIt() {
        Polyglot p = PolyglotParser.parse("<!-- kyozo:deploy env=prod -->\n\nText");

        AstNode html = p.ast().children().get(0);
        assertThat(html.type()).isEqualTo("html");
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> directives = (List<Map<String, Object>>) kyozo(html).get("directives");
        assertThat(directives).singleElement().satisfies(d -> assertThat(d).containsEntry("name", "deploy"));
    }

    @Test
    void parse_jsonDirective_marksEnlightenedCode() {
        Polyglot p = PolyglotParser.parse("""
                <!-- kyozo:{"executable": true, "enlighten": true, "owner": "ops"} -->
                ```python
                print(1)
                ```
                """);

        Map<String, Object> kyozo = kyozo(codeNode(p.ast()));
        assertThat(kyozo)
                .containsEntry("enlightened", true)
                .containsEntry("executable", true);
        assertThat(kyozo.get("metadata")).isEqualTo(Map.of("executable", true, "enlighten", true, "owner", "ops"));
    }

    @Test
    void parse_paragraphBetweenDirectiveAndCode_breaksAttachment() {
        Polyglot p = PolyglotParser.parse("<!-- kyozo:note -->\nprose\n```python\nx = 1\n```");

        assertThat(codeNode(p.ast()).data()).isNull();
    }

    @Test
    void parse_fileBlock_recordsLocation() {
        Polyglot p = PolyglotParser.parse("```file:docs/a.md\nA\n```");

        assertThat(kyozo(codeNode(p.ast())))
                .containsEntry("artifact", "file")
                .containsEntry("location", "docs/a.md")
                .containsEntry("executable", false);
    }

    @Test
    void parse_plainDocument_leavesTreeUntouched() {
        String doc = "# T\n\nbody\n\n```python\nx = 1\n```";

        Polyglot p = PolyglotParser.parse(doc);

        assertThat(p.language()).isEqualTo(Language.NONE);
        assertThat(p.ast()).isEqualTo(MarkdownParser.parse(doc));
    }

    @Test
    void enhance_keepsKyozoEntriesAlreadyOnTheNode() {
        String doc = "```dockerfile\nFROM alpine\n```";
        AstNode.Root tree = MarkdownParser.parse(doc);
        AstNode annotated = tree.children().get(0)
                .withData(Map.of(KyozoEnhancer.DATA_KEY, Map.of("owner", "ops")));
        AstNode.Root seeded = new AstNode.Root(List.of(annotated), tree.position(), tree.data());

        AstNode.Root enhanced = KyozoEnhancer.enhance(seeded, MetadataExtractor.classify(doc));

        assertThat(kyozo(codeNode(enhanced)))
                .containsEntry("owner", "ops")
                .containsEntry("artifact", "dockerfile");
    }

    @Test
    void metadataMap_copiesNestedMapAndIsEmptyWhenAbsent() {
        Polyglot p = PolyglotParser.parse("<!-- polyglot:env STAGE=dev -->\n```dockerfile\nFROM alpine\n```");

        assertThat(p.metadataMap(MetadataExtractor.ENVIRONMENT)).containsExactly(Map.entry("STAGE", "dev"));
        assertThat(p.metadataMap("no-such-key")).isEmpty();
    }

    private static AstNode.Code codeNode(AstNode.Root root) {
        return root.children().stream()
                .filter(AstNode.Code.class::isInstance)
                .map(AstNode.Code.class::cast)
                .findFirst()
                .orElseThrow();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> kyozo(AstNode node) {
        assertThat(node.data()).containsKey(KyozoEnhancer.DATA_KEY);
        return (Map<String, Object>) node.data().get(KyozoEnhancer.DATA_KEY);
    }
}
