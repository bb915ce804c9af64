package com.typstparser.ast;

/**
 * Nodes that make up document markup.
 */
public sealed interface MarkupNode extends AstNode permits
    Text,
    Space,
    Linebreak,
    Parbreak,
    Escape,
    Shorthand,
    SmartQuote,
    Strong,
    Emph,
    Raw,
    Link,
    Label,
    Ref,
    Heading,
    ListItem,
    EnumItem,
    TermItem,
    Equation {
}
