package com.typstparser.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typstparser.ParseOptions;
import com.typstparser.TypstParser;
import com.typstparser.ast.AstNode;
import com.typstparser.ast.AstParseResult;
import com.typstparser.ast.ByteRange;
import com.typstparser.ast.FloatLiteral;
import com.typstparser.ast.Heading;
import com.typstparser.ast.Text;
import com.typstparser.cst.CstParseResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonTest {

    private static final ObjectMapper mapper = TypstJackson.createObjectMapper();

    private static JsonNode astJson(String source, String mode) throws Exception {
        AstParseResult result = TypstParser.parseAst(source, ParseOptions.of(mode));
        return mapper.readTree(mapper.writeValueAsString(result));
    }

    private static JsonNode firstNode(String source, String mode) throws Exception {
        return astJson(source, mode).get("root").get(0);
    }

    @Test
    void testSerializeHeading() throws Exception {
        JsonNode json = astJson("= Hello", "markup");
        System.out.println("Serialized AST:\n" + json.toPrettyString());

        assertTrue(json.get("errors").isArray());
        assertEquals(0, json.get("errors").size());

        JsonNode heading = json.get("root").get(0);
        assertEquals("heading", heading.get("kind").asText());
        assertEquals(mapper.readTree("[0, 7]"), heading.get("range"));
        assertEquals(1, heading.get("depth").asInt());
        assertEquals(mapper.readTree("{\"kind\": \"text\", \"range\": [2, 7], \"text\": \"Hello\"}"),
            heading.get("body").get(0));
    }

    @Test
    void testAbsentFieldsAreNull() throws Exception {
        JsonNode raw = firstNode("`x`", "markup");
        assertEquals("raw", raw.get("kind").asText());
        assertTrue(raw.has("lang"), "absent optional fields are written");
        assertTrue(raw.get("lang").isNull());
        assertFalse(raw.get("block").asBoolean());
    }

    @Test
    void testPlaceholderHasNullRange() throws Exception {
        JsonNode show = firstNode("#show:", "markup");
        assertEquals("showRule", show.get("kind").asText());
        assertTrue(show.get("selector").isNull());
        assertEquals(mapper.readTree("{\"kind\": \"none\", \"range\": null}"), show.get("transform"));
    }

    @Test
    void testSmartQuoteField() throws Exception {
        JsonNode quote = firstNode("\"", "markup");
        assertEquals("smartQuote", quote.get("kind").asText());
        assertTrue(quote.get("double").asBoolean());
        assertFalse(quote.has("doubleQuote"));
    }

    @ParameterizedTest
    @CsvSource({
        "a != b, neq",
        "a not in b, notIn",
        "a += 1, addAssign",
        "a and b, and"
    })
    void testOperatorNames(String source, String op) throws Exception {
        JsonNode binary = firstNode(source, "code");
        assertEquals("binary", binary.get("kind").asText());
        assertEquals(op, binary.get("op").asText());
    }

    @Test
    void testNumbers() throws Exception {
        JsonNode percent = firstNode("50%", "code");
        assertEquals("numeric", percent.get("kind").asText());
        assertEquals("percent", percent.get("unit").asText());
        assertTrue(percent.get("value").isIntegralNumber(), "integral floats are written without a fraction");
        assertEquals(50, percent.get("value").asInt());

        JsonNode half = firstNode("1.5", "code");
        assertEquals("float", half.get("kind").asText());
        assertEquals(1.5, half.get("value").asDouble());

        String nan = mapper.writerFor(AstNode.class).writeValueAsString(new FloatLiteral(null, Double.NaN));
        assertEquals(mapper.readTree("{\"kind\": \"float\", \"range\": null, \"value\": null}"), mapper.readTree(nan));
    }

    @Test
    void testNestedUnionTags() throws Exception {
        JsonNode let = firstNode("#let (a, ..rest) = arr", "markup");
        assertEquals("letBinding", let.get("kind").asText());

        JsonNode bindingKind = let.get("bindingKind");
        assertEquals("normal", bindingKind.get("kind").asText());

        JsonNode pattern = bindingKind.get("pattern");
        assertEquals("destructuring", pattern.get("kind").asText());
        assertEquals(mapper.readTree("""
            [
              {"kind": "pattern", "pattern": {"kind": "normal", "expr": {"kind": "ident", "range": [6, 7], "name": "a"}}},
              {"kind": "spread", "sinkIdent": "rest"}
            ]
            """), pattern.get("items"));
    }

    @Test
    void testMathText() throws Exception {
        JsonNode number = firstNode("1.5", "math");
        assertEquals("mathText", number.get("kind").asText());
        assertEquals(mapper.readTree("{\"kind\": \"number\", \"value\": \"1.5\"}"), number.get("text"));
    }

    @Test
    void testConcreteTreeShape() throws Exception {
        CstParseResult result = TypstParser.parse("*b*");
        JsonNode json = mapper.readTree(mapper.writeValueAsString(result));

        JsonNode root = json.get("root");
        assertEquals("Markup", root.get("kind").asText());
        assertFalse(root.has("text"), "inner nodes carry no text");
        assertFalse(root.has("terminal"));

        JsonNode star = root.get("children").get(0).get("children").get(0);
        assertEquals(mapper.readTree("{\"kind\": \"Star\", \"range\": [0, 1], \"text\": \"*\", \"children\": []}"), star);
    }

    @Test
    void testErrorsShape() throws Exception {
        JsonNode errors = astJson("#show:", "markup").get("errors");
        assertEquals(mapper.readTree("[{\"message\": \"expected expression\", \"range\": [6, 6]}]"), errors);
    }

    @Test
    void testDeserializeNode() throws Exception {
        String json = """
            {
              "kind": "heading",
              "range": [0, 7],
              "depth": 1,
              "body": [{"kind": "text", "range": [2, 7], "text": "Hello"}]
            }
            """;

        AstNode node = mapper.readValue(json, AstNode.class);
        assertEquals(new Heading(new ByteRange(0, 7), 1, List.of(new Text(new ByteRange(2, 7), "Hello"))), node);
    }

    @Test
    void testRejectMalformedRange() {
        assertThrows(Exception.class, () -> mapper.readValue("[1]", ByteRange.class));
        assertThrows(Exception.class, () -> mapper.readValue("[5, 2]", ByteRange.class));
        assertThrows(Exception.class, () -> mapper.readValue("{\"start\": 1, \"end\": 2}", ByteRange.class));
    }

    @Test
    void testUnknownKind() {
        assertThrows(Exception.class, () -> mapper.readValue("{\"kind\": \"paragraph\"}", AstNode.class));
    }
}
