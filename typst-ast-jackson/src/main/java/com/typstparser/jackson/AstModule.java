package com.typstparser.jackson;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.typstparser.ast.*;
import com.typstparser.cst.CstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Jackson module that maps the typed and concrete trees onto their JSON wire shape.
 *
 * Nodes and the sub-unions inside them are tagged with a camelCase "kind"
 * property. Ranges are written as two-element arrays.
 */
public class AstModule extends SimpleModule {

    private static final Logger logger = LoggerFactory.getLogger(AstModule.class);

    /**
     * Type ids of every node and sub-union record. Ids repeat across
     * sub-unions ("named", "spread"); they are resolved per base type.
     */
    static final List<NamedType> NODE_TYPES = List.of(
        // Markup
        new NamedType(Text.class, "text"),
        new NamedType(Space.class, "space"),
        new NamedType(Linebreak.class, "linebreak"),
        new NamedType(Parbreak.class, "parbreak"),
        new NamedType(Escape.class, "escape"),
        new NamedType(Shorthand.class, "shorthand"),
        new NamedType(SmartQuote.class, "smartQuote"),
        new NamedType(Strong.class, "strong"),
        new NamedType(Emph.class, "emph"),
        new NamedType(Raw.class, "raw"),
        new NamedType(Link.class, "link"),
        new NamedType(Label.class, "label"),
        new NamedType(Ref.class, "ref"),
        new NamedType(Heading.class, "heading"),
        new NamedType(ListItem.class, "listItem"),
        new NamedType(EnumItem.class, "enumItem"),
        new NamedType(TermItem.class, "termItem"),
        new NamedType(Equation.class, "equation"),

        // Math
        new NamedType(MathContent.class, "math"),
        new NamedType(MathText.class, "mathText"),
        new NamedType(MathIdent.class, "mathIdent"),
        new NamedType(MathShorthand.class, "mathShorthand"),
        new NamedType(MathAlignPoint.class, "mathAlignPoint"),
        new NamedType(MathDelimited.class, "mathDelimited"),
        new NamedType(MathAttach.class, "mathAttach"),
        new NamedType(MathPrimes.class, "mathPrimes"),
        new NamedType(MathFrac.class, "mathFrac"),
        new NamedType(MathRoot.class, "mathRoot"),

        // Literals
        new NamedType(NoneLiteral.class, "none"),
        new NamedType(AutoLiteral.class, "auto"),
        new NamedType(BoolLiteral.class, "bool"),
        new NamedType(IntLiteral.class, "int"),
        new NamedType(FloatLiteral.class, "float"),
        new NamedType(NumericLiteral.class, "numeric"),
        new NamedType(StrLiteral.class, "str"),

        // Code
        new NamedType(Ident.class, "ident"),
        new NamedType(CodeBlock.class, "codeBlock"),
        new NamedType(ContentBlock.class, "contentBlock"),
        new NamedType(Parenthesized.class, "parenthesized"),
        new NamedType(ArrayExpr.class, "array"),
        new NamedType(DictExpr.class, "dict"),
        new NamedType(Unary.class, "unary"),
        new NamedType(Binary.class, "binary"),
        new NamedType(FieldAccess.class, "fieldAccess"),
        new NamedType(FuncCall.class, "funcCall"),
        new NamedType(Closure.class, "closure"),
        new NamedType(LetBinding.class, "letBinding"),
        new NamedType(DestructAssignment.class, "destructAssignment"),
        new NamedType(SetRule.class, "setRule"),
        new NamedType(ShowRule.class, "showRule"),
        new NamedType(Contextual.class, "contextual"),
        new NamedType(Conditional.class, "conditional"),
        new NamedType(WhileLoop.class, "whileLoop"),
        new NamedType(ForLoop.class, "forLoop"),
        new NamedType(ModuleImport.class, "moduleImport"),
        new NamedType(ModuleInclude.class, "moduleInclude"),
        new NamedType(LoopBreak.class, "loopBreak"),
        new NamedType(LoopContinue.class, "loopContinue"),
        new NamedType(FuncReturn.class, "funcReturn"),

        // Sub-unions
        new NamedType(Pattern.Normal.class, "normal"),
        new NamedType(Pattern.Placeholder.class, "placeholder"),
        new NamedType(Pattern.Parenthesized.class, "parenthesized"),
        new NamedType(Pattern.Destructuring.class, "destructuring"),
        new NamedType(DestructuringItem.PatternItem.class, "pattern"),
        new NamedType(DestructuringItem.Named.class, "named"),
        new NamedType(DestructuringItem.Spread.class, "spread"),
        new NamedType(Arg.Pos.class, "pos"),
        new NamedType(Arg.Named.class, "named"),
        new NamedType(Arg.Spread.class, "spread"),
        new NamedType(ArrayItem.Pos.class, "pos"),
        new NamedType(ArrayItem.Spread.class, "spread"),
        new NamedType(DictItem.Named.class, "named"),
        new NamedType(DictItem.Keyed.class, "keyed"),
        new NamedType(DictItem.Spread.class, "spread"),
        new NamedType(Param.Pos.class, "pos"),
        new NamedType(Param.Named.class, "named"),
        new NamedType(Param.Spread.class, "spread"),
        new NamedType(LetBindingKind.Normal.class, "normal"),
        new NamedType(LetBindingKind.Closure.class, "closure"),
        new NamedType(Imports.Wildcard.class, "wildcard"),
        new NamedType(Imports.Items.class, "items"),
        new NamedType(ImportItem.Simple.class, "simple"),
        new NamedType(ImportItem.Renamed.class, "renamed"),
        new NamedType(MathTextKind.Character.class, "character"),
        new NamedType(MathTextKind.Number.class, "number")
    );

    public AstModule() {
        super("TypstAstModule", new Version(1, 0, 0, null, "com.typstparser", "typst-ast-jackson"));

        addSerializer(ByteRange.class, new ByteRangeSerializer());
        addDeserializer(ByteRange.class, new ByteRangeDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Tagged unions
        context.setMixInAnnotations(AstNode.class, TaggedMixin.class);
        context.setMixInAnnotations(Pattern.class, TaggedMixin.class);
        context.setMixInAnnotations(DestructuringItem.class, TaggedMixin.class);
        context.setMixInAnnotations(Arg.class, TaggedMixin.class);
        context.setMixInAnnotations(ArrayItem.class, TaggedMixin.class);
        context.setMixInAnnotations(DictItem.class, TaggedMixin.class);
        context.setMixInAnnotations(Param.class, TaggedMixin.class);
        context.setMixInAnnotations(LetBindingKind.class, TaggedMixin.class);
        context.setMixInAnnotations(Imports.class, TaggedMixin.class);
        context.setMixInAnnotations(ImportItem.class, TaggedMixin.class);
        context.setMixInAnnotations(MathTextKind.class, TaggedMixin.class);
        context.registerSubtypes(NODE_TYPES.toArray(new NamedType[0]));
        logger.debug("Registered {} tagged record types", NODE_TYPES.size());

        // Field renames and number formatting
        context.setMixInAnnotations(SmartQuote.class, SmartQuoteMixin.class);
        context.setMixInAnnotations(FloatLiteral.class, JavaScriptValueMixin.class);
        context.setMixInAnnotations(NumericLiteral.class, JavaScriptValueMixin.class);

        // Operators and units are written by name
        context.setMixInAnnotations(BinOp.class, LabeledMixin.class);
        context.setMixInAnnotations(UnOp.class, LabeledMixin.class);
        context.setMixInAnnotations(Unit.class, LabeledMixin.class);

        context.setMixInAnnotations(CstNode.class, CstNodeMixin.class);
    }

    // ==================== Mixins ====================

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
    abstract static class TaggedMixin {
        @JsonIgnore
        abstract String kind();
    }

    abstract static class SmartQuoteMixin {
        @JsonProperty("double")
        abstract boolean doubleQuote();
    }

    abstract static class JavaScriptValueMixin {
        @JsonSerialize(using = JavaScriptNumberSerializer.class)
        abstract double value();
    }

    abstract static class LabeledMixin {
        @JsonValue
        abstract String label();
    }

    abstract static class CstNodeMixin {
        @JsonInclude(JsonInclude.Include.NON_NULL)
        abstract String text();

        @JsonIgnore
        abstract boolean isTerminal();
    }

    // ==================== Ranges ====================

    static class ByteRangeSerializer extends JsonSerializer<ByteRange> {
        @Override
        public void serialize(ByteRange value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeStartArray();
            gen.writeNumber(value.start());
            gen.writeNumber(value.end());
            gen.writeEndArray();
        }
    }

    static class ByteRangeDeserializer extends JsonDeserializer<ByteRange> {
        @Override
        public ByteRange deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() != JsonToken.START_ARRAY) {
                return (ByteRange) ctxt.handleUnexpectedToken(ByteRange.class, p);
            }
            int start = nextInt(p, ctxt);
            int end = nextInt(p, ctxt);
            if (p.nextToken() != JsonToken.END_ARRAY) {
                return (ByteRange) ctxt.reportInputMismatch(ByteRange.class,
                    "Expected a range of exactly two offsets");
            }
            try {
                return new ByteRange(start, end);
            } catch (IllegalArgumentException e) {
                return (ByteRange) ctxt.reportInputMismatch(ByteRange.class, e.getMessage());
            }
        }

        private static int nextInt(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.nextToken() != JsonToken.VALUE_NUMBER_INT) {
                ctxt.reportInputMismatch(ByteRange.class, "Expected an integer offset");
            }
            return p.getIntValue();
        }
    }
}
