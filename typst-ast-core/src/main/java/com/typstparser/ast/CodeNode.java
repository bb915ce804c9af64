package com.typstparser.ast;

/**
 * Code expressions and statements.
 */
public sealed interface CodeNode extends AstNode permits
    CodeBlock,
    ContentBlock,
    Parenthesized,
    ArrayExpr,
    DictExpr,
    Unary,
    Binary,
    FieldAccess,
    FuncCall,
    Closure,
    LetBinding,
    DestructAssignment,
    SetRule,
    ShowRule,
    Contextual,
    Conditional,
    WhileLoop,
    ForLoop,
    ModuleImport,
    ModuleInclude,
    LoopBreak,
    LoopContinue,
    FuncReturn {
}
