package org.lapa.analyzer.ir;

/*
Attribute keys that front ends populate and that the passes read.
There is no schema: a pass that does not find a key, or finds a value of an unexpected type, skips it.

Some constructs are described twice, once in the statement-level vocabulary used by the control and data flow
passes (target/value, left_operand/right_operand) and once in the expression-level vocabulary used by
dependency analysis and type inference (left/right). Front ends fill in whichever their consumers need.
 */
public final class AttributeKeys {

    private AttributeKeys() {
    }

    // whole-tree queries
    public static final String TYPE = "type";
    public static final String RETURN_TYPE = "return_type";
    public static final String SOURCE = "source";

    // declarations
    public static final String NAME = "name";
    public static final String PARAMETERS = "parameters";
    public static final String BODY = "body";
    public static final String DECORATORS = "decorators";
    public static final String DECLARATION = "declaration";
    public static final String DEFINITION = "definition";
    public static final String INITIALIZER = "initializer";
    public static final String ANNOTATIONS = "annotations";
    public static final String OWNERSHIP = "ownership";
    public static final String BASES = "bases";
    public static final String TYPE_PARAMS = "type_params";
    public static final String MEMBERS = "members";
    public static final String FIELDS = "fields";
    public static final String VARIANTS = "variants";
    public static final String ITEMS = "items";
    public static final String METHODS = "methods";

    // statements and expressions
    public static final String TARGET = "target";
    public static final String VALUE = "value";
    public static final String LEFT = "left";
    public static final String RIGHT = "right";
    public static final String TYPE_ANNOTATION = "type_annotation";
    public static final String OPERATOR = "operator";
    public static final String LEFT_OPERAND = "left_operand";
    public static final String RIGHT_OPERAND = "right_operand";
    public static final String OPERAND = "operand";
    public static final String OPERANDS = "operands";
    public static final String FUNCTION = "function";
    public static final String ARGUMENTS = "arguments";
    public static final String TYPE_ARGS = "type_args";
    public static final String ARRAY = "array";
    public static final String INDEX = "index";
    public static final String COLLECTION_TYPE = "collection_type";
    public static final String ELEMENTS = "elements";
    public static final String SOURCES = "sources";

    // control flow
    public static final String CONDITION = "condition";
    public static final String TEST = "test";
    public static final String ELSE = "else";
    public static final String ITER = "iter";
    public static final String HANDLERS = "handlers";
    public static final String FINALLY = "finally";
    public static final String TRUE_BRANCH = "true_branch";
    public static final String FALSE_BRANCH = "false_branch";

    // imports
    public static final String MODULE_NAME = "module_name";
    public static final String ALIASES = "aliases";
    public static final String FROM_LIST = "from_list";
    public static final String ORIGINAL_NAME = "original_name";
    public static final String MODULE = "module";

    // values of the TYPE attribute of CONTROL_FLOW markers
    public static final String CF_IF = "if";
    public static final String CF_ELSE = "else";
    public static final String CF_TRY = "try";
    public static final String CF_EXCEPT = "except";
    public static final String CF_FINALLY = "finally";
}
