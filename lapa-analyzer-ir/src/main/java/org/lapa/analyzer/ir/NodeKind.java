package org.lapa.analyzer.ir;

/*
Closed set of node kinds. Every pass dispatches on this enum; the helper predicates below use exhaustive
switch expressions, so adding a kind fails compilation until each of them has been revisited.
 */
public enum NodeKind {
    PROGRAM,
    FUNCTION_DEF,
    FUNCTION,
    CLASS_DEF,
    CLASS,
    METHOD,
    VARIABLE,
    LITERAL,
    FIELD,
    NAMESPACE,
    CONSTRUCTOR,
    DESTRUCTOR,
    TEMPLATE,
    USING,
    FRIEND,
    IMPORT,
    EXPORT,
    MODULE,
    PACKAGE,
    RETURN,
    ASSIGNMENT,
    CONTROL_FLOW,
    LOOP,
    CALL,
    FUNCTION_CALL,
    OPERATOR,
    NO_OP,
    BLOCK,
    BINARY_OP,
    UNARY_OP,
    CONDITIONAL,
    TRY,
    EXCEPT_HANDLER,
    COLLECTION,
    STRUCT,
    ENUM,
    TRAIT,
    MACRO,
    IMPLEMENTATION,
    TYPE,
    ALIAS,
    WHILE,
    FOR,
    IF,
    IMPORT_FROM,
    ARRAY_ACCESS,
    PHI,
    STATEMENT;

    /**
     * @return true for the kinds that introduce a named symbol, and therefore take part in the symbol table
     * and in the duplicate-name check of {@link Ir#validate()}.
     */
    public boolean isSymbol() {
        return switch (this) {
            case FUNCTION_DEF, FUNCTION, CLASS_DEF, CLASS, VARIABLE, STRUCT, ENUM, TRAIT, MACRO -> true;
            case PROGRAM, METHOD, LITERAL, FIELD, NAMESPACE, CONSTRUCTOR, DESTRUCTOR, TEMPLATE, USING, FRIEND,
                 IMPORT, EXPORT, MODULE, PACKAGE, RETURN, ASSIGNMENT, CONTROL_FLOW, LOOP, CALL, FUNCTION_CALL,
                 OPERATOR, NO_OP, BLOCK, BINARY_OP, UNARY_OP, CONDITIONAL, TRY, EXCEPT_HANDLER, COLLECTION,
                 IMPLEMENTATION, TYPE, ALIAS, WHILE, FOR, IF, IMPORT_FROM, ARRAY_ACCESS, PHI, STATEMENT -> false;
        };
    }

    /**
     * @return true for function-shaped nodes, the ones that receive a control flow graph.
     */
    public boolean isFunction() {
        return switch (this) {
            case FUNCTION_DEF, FUNCTION -> true;
            case PROGRAM, CLASS_DEF, CLASS, METHOD, VARIABLE, LITERAL, FIELD, NAMESPACE, CONSTRUCTOR, DESTRUCTOR,
                 TEMPLATE, USING, FRIEND, IMPORT, EXPORT, MODULE, PACKAGE, RETURN, ASSIGNMENT, CONTROL_FLOW, LOOP,
                 CALL, FUNCTION_CALL, OPERATOR, NO_OP, BLOCK, BINARY_OP, UNARY_OP, CONDITIONAL, TRY,
                 EXCEPT_HANDLER, COLLECTION, STRUCT, ENUM, TRAIT, MACRO, IMPLEMENTATION, TYPE, ALIAS, WHILE, FOR,
                 IF, IMPORT_FROM, ARRAY_ACCESS, PHI, STATEMENT -> false;
        };
    }

    public boolean isCall() {
        return switch (this) {
            case CALL, FUNCTION_CALL -> true;
            case PROGRAM, FUNCTION_DEF, FUNCTION, CLASS_DEF, CLASS, METHOD, VARIABLE, LITERAL, FIELD, NAMESPACE,
                 CONSTRUCTOR, DESTRUCTOR, TEMPLATE, USING, FRIEND, IMPORT, EXPORT, MODULE, PACKAGE, RETURN,
                 ASSIGNMENT, CONTROL_FLOW, LOOP, OPERATOR, NO_OP, BLOCK, BINARY_OP, UNARY_OP, CONDITIONAL, TRY,
                 EXCEPT_HANDLER, COLLECTION, STRUCT, ENUM, TRAIT, MACRO, IMPLEMENTATION, TYPE, ALIAS, WHILE, FOR,
                 IF, IMPORT_FROM, ARRAY_ACCESS, PHI, STATEMENT -> false;
        };
    }
}
