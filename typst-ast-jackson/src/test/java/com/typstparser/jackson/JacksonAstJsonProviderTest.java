package com.typstparser.jackson;

import com.typstparser.ParseOptions;
import com.typstparser.TypstParser;
import com.typstparser.ast.AstNode;
import com.typstparser.ast.AstParseResult;
import com.typstparser.cst.CstParseResult;
import com.typstparser.json.AstJsonException;
import com.typstparser.json.AstJsonProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    @Test
    void testProviderIsDiscovered() {
        AstJsonProvider provider = AstJsonProvider.getProvider();
        assertInstanceOf(JacksonAstJsonProvider.class, provider);
        assertEquals("Jackson", provider.getName());
        assertSame(JacksonAstJsonProvider.class, AstJsonProvider.getProvider("Jackson").getClass());
        assertSame(JacksonAstJsonProvider.class, AstJsonProvider.getProvider("jackson").getClass());
    }

    @Test
    void testUnknownProviderNameFails() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> AstJsonProvider.getProvider("Gson"));
        assertTrue(e.getMessage().contains("'Gson'"), e.getMessage());
    }

    /**
     * Reading back what was written yields an equal result, placeholders and
     * nested unions included.
     */
    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '~', value = {
        "markup | = Intro <intro>\\n\\nSee @intro[chapter], *bold* _it_ \"quoted\" -- `raw` https://typst.app",
        "markup | - item\\n+ 3. numbered\\n/ Term: desc\\n```py\\nprint(1)\\n```",
        "markup | $ sum_(i=0)^n x_i'' / 2 $ and $sqrt(x) + abs(y) -> ∛ 8$",
        "markup | #set text(size: 12pt) if x > 1\\n#show heading: it => [*#it*]",
        "markup | #show:\\n#for x in",
        "code   | let f(x, y: 2, ..rest) = x + y; f(1, y: 3, ..z)[body]",
        "code   | let (a, (b, _), c: d, ..e) = v; (a, b) = (b, a)",
        "code   | import \"m.typ\" as m: a, b.c as d; include \"x.typ\"",
        "code   | for k in (a: 1, \"b\": 2, ..c) { if k not in d { continue } else { break } }",
        "code   | context { while true { return 0x1F + 1e3 * 50% } }",
        "math   | x_1^2 + f(a, b; c) & = 1/2 \\ 1.5"
    })
    void testRoundTrip(String mode, String escaped) {
        String source = escaped.replace("\\n", "\n");
        AstJsonProvider provider = new JacksonAstJsonProvider();
        ParseOptions options = ParseOptions.of(mode);

        AstParseResult ast = TypstParser.parseAst(source, options);
        String astJson = provider.getSerializer().serialize(ast);
        assertEquals(ast, provider.getDeserializer().deserializeAst(astJson));

        CstParseResult cst = TypstParser.parse(source, options);
        String cstJson = provider.getSerializer().serializePretty(cst);
        assertEquals(cst, provider.getDeserializer().deserializeCst(cstJson));
    }

    @Test
    void testSingleNodeCarriesItsKind() throws Exception {
        JacksonAstJsonProvider provider = new JacksonAstJsonProvider();
        AstParseResult result = TypstParser.parseAst("let x = (1, 2); x.len()", ParseOptions.of("code"));

        for (AstNode node : result.root()) {
            String json = provider.getSerializer().serialize(node);
            assertEquals(node.kind(), provider.getObjectMapper().readTree(json).get("kind").asText());
            assertEquals(node, provider.getDeserializer().deserialize(json, AstNode.class));
        }
    }

    @Test
    void testMalformedJson() {
        AstJsonProvider provider = new JacksonAstJsonProvider();
        AstJsonException e = assertThrows(AstJsonException.class,
            () -> provider.getDeserializer().deserializeAst("{\"root\": [{\"kind\": \"heading\""));
        assertNotNull(e.getCause());
    }
}
