package com.pyparser;

import com.pyparser.ast.*;
import com.pyparser.ast.Module;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fault-tolerant recursive-descent parser for Python source.
 *
 * <p>The parser never rejects input. Missing colons and brackets are tolerated, tokens
 * that fit nowhere on a line are collected into an {@link Symbol#ERROR_NODE}, and every
 * token ends up in the tree so that {@code parse().getCode()} returns the source
 * unchanged.
 *
 * <p>Blocks are recognized by comparing token columns with the column of the statement
 * that opened them.
 */
public class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    public static final int DEFAULT_MAX_NESTING_DEPTH = 100;

    private static final Set<String> ATOM_KEYWORDS = Set.of("None", "True", "False");

    private static final Set<String> AUGMENTED_ASSIGNMENTS = Set.of(
        "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", "**=", "//=", "@=");

    private static final Set<String> COMPARISON_OPERATORS = Set.of(
        "<", ">", "==", ">=", "<=", "!=", "<>");

    // Binary operator levels from loosest to tightest, ending just above factor.
    private static final Symbol[] BINARY_LEVELS = {
        Symbol.EXPR, Symbol.XOR_EXPR, Symbol.AND_EXPR, Symbol.SHIFT_EXPR, Symbol.ARITH_EXPR, Symbol.TERM
    };

    private static final List<Set<String>> BINARY_OPERATORS = List.of(
        Set.of("|"), Set.of("^"), Set.of("&"), Set.of("<<", ">>"), Set.of("+", "-"),
        Set.of("*", "/", "%", "//", "@"));

    private final List<Token> tokens;
    private final String path;
    private final int maxNestingDepth;
    private int current = 0;
    private int expressionDepth = 0;
    private int blockDepth = 0;

    public Parser(String source) {
        this(source, null);
    }

    public Parser(String source, String path) {
        this(source, path, DEFAULT_MAX_NESTING_DEPTH);
    }

    public Parser(String source, String path, int maxNestingDepth) {
        this(new Tokenizer(source).tokenize(), path, maxNestingDepth);
    }

    /**
     * @param tokens a token list ending with {@link TokenType#ENDMARKER}
     */
    public Parser(List<Token> tokens, String path, int maxNestingDepth) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.ENDMARKER) {
            throw new IllegalArgumentException("Token list must end with ENDMARKER");
        }
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        this.tokens = tokens;
        this.path = path;
        this.maxNestingDepth = maxNestingDepth;
    }

    public Module parse() {
        List<Element> children = new ArrayList<>();
        while (!isAtEnd()) {
            children.add(parseStatement());
        }
        children.add(leaf(peek()));
        return new Module(children, path);
    }

    // Statements

    private Element parseStatement() {
        Token token = peek();
        if (token.type() == TokenType.NAME) {
            switch (token.value()) {
                case "if", "while", "for", "try", "with", "elif", "else", "except", "finally":
                    return parseFlowChain();
                case "def":
                    return parseFunction(new ArrayList<>(), token.start().column());
                case "class":
                    return parseClass(new ArrayList<>(), token.start().column());
                case "async":
                    if (checkAhead(1, "def")) {
                        List<Element> prefix = new ArrayList<>();
                        prefix.add(consume());
                        return parseFunction(prefix, token.start().column());
                    }
                    if (checkAhead(1, "for") || checkAhead(1, "with")) {
                        return parseFlowChain();
                    }
                    break;
                default:
                    break;
            }
        }
        if (check("@")) {
            return parseDecorated();
        }
        return parseSimpleStatement();
    }

    private Element parseDecorated() {
        int indent = peek().start().column();
        List<Element> decorators = new ArrayList<>();
        while (check("@")) {
            List<Element> children = new ArrayList<>();
            children.add(consume());
            Element expression = parseNamedExprTest();
            if (expression != null) {
                children.add(expression);
            }
            finishLine(children);
            decorators.add(new Decorator(children));
        }
        if (check("def")) {
            return parseFunction(decorators, indent);
        }
        if (check("class")) {
            return parseClass(decorators, indent);
        }
        if (check("async") && checkAhead(1, "def")) {
            decorators.add(consume());
            return parseFunction(decorators, indent);
        }
        LOG.debug("Decorators at {} are not followed by a definition", decorators.get(0).start());
        return new Node(Symbol.ERROR_NODE, decorators);
    }

    private Function parseFunction(List<Element> children, int indent) {
        children.add(consume());
        if (isName()) {
            children.add(consume());
        }
        if (check("(")) {
            children.add(parseParameters());
        }
        if (check("->")) {
            children.add(consume());
            Element annotation = parseTest();
            if (annotation != null) {
                children.add(annotation);
            }
        }
        parseBlock(children, indent);
        return new Function(children);
    }

    private Node parseParameters() {
        List<Element> children = new ArrayList<>();
        children.add(consume());
        parseParamList(children, true, ")");
        recoverUntil(")", children);
        Leaf close = match(")");
        if (close != null) {
            children.add(close);
        }
        return new Node(Symbol.PARAMETERS, children);
    }

    /**
     * Parses params up to {@code terminator}. Bare {@code *} and {@code /} markers stay
     * plain operators.
     */
    private void parseParamList(List<Element> children, boolean annotations, String terminator) {
        while (!atStatementEnd() && !check(terminator)) {
            if (check(",") || check("/")) {
                children.add(consume());
                continue;
            }
            if (check(")") || check("]") || check("}")) {
                break;
            }
            List<Element> param = new ArrayList<>();
            if (check("*") || check("**")) {
                param.add(consume());
            }
            if (isName()) {
                param.add(consume());
            } else if (check("(")) {
                param.add(parseAtom());
            } else if (param.size() == 1 && param.get(0).hasValue("*")) {
                children.add(param.get(0));
                continue;
            }
            if (param.isEmpty()) {
                LOG.debug("Unexpected token '{}' in parameter list at {}", peek().value(), peek().start());
                children.add(consume());
                continue;
            }
            if (annotations && check(":")) {
                param.add(consume());
                addIfPresent(param, parseTest());
            }
            if (check("=")) {
                param.add(consume());
                addIfPresent(param, parseTest());
            }
            children.add(new Param(param));
        }
    }

    private ClassDef parseClass(List<Element> children, int indent) {
        children.add(consume());
        if (isName()) {
            children.add(consume());
        }
        if (check("(")) {
            children.add(consume());
            if (!check(")")) {
                addIfPresent(children, parseArglist());
            }
            recoverUntil(")", children);
            Leaf close = match(")");
            if (close != null) {
                children.add(close);
            }
        }
        parseBlock(children, indent);
        return new ClassDef(children);
    }

    /**
     * Parses {@code ':' suite}, or swallows the rest of the line when the colon is missing.
     */
    private void parseBlock(List<Element> children, int indent) {
        Leaf colon = match(":");
        if (colon == null) {
            LOG.debug("Missing ':' at {}", peek().start());
            finishLine(children);
            return;
        }
        children.add(colon);
        Node suite = parseSuite(indent);
        if (suite != null) {
            children.add(suite);
        }
    }

    private Node parseSuite(int parentIndent) {
        if (isAtEnd()) {
            return null;
        }
        if (!checkType(TokenType.NEWLINE)) {
            return new Node(Symbol.SUITE, List.of(parseSimpleStatement()));
        }
        List<Element> children = new ArrayList<>();
        children.add(consume());
        if (blockDepth >= maxNestingDepth) {
            LOG.warn("Blocks nested deeper than {} at {}, collecting the rest as an error node",
                maxNestingDepth, peek().start());
            List<Element> skipped = new ArrayList<>();
            while (!isAtEnd() && peek().start().column() > parentIndent) {
                skipped.add(consume());
                while (!isAtEnd() && !checkType(TokenType.NEWLINE)) {
                    skipped.add(consume());
                }
                if (checkType(TokenType.NEWLINE)) {
                    skipped.add(consume());
                }
            }
            if (!skipped.isEmpty()) {
                children.add(new Node(Symbol.ERROR_NODE, skipped));
            }
            return new Node(Symbol.SUITE, children);
        }
        blockDepth++;
        try {
            while (!isAtEnd() && peek().start().column() > parentIndent) {
                children.add(parseStatement());
            }
        } finally {
            blockDepth--;
        }
        return new Node(Symbol.SUITE, children);
    }

    private FlowChain parseFlowChain() {
        int indent = peek().start().column();
        List<Element> segments = new ArrayList<>();
        Flow head = parseFlowSegment(indent);
        segments.add(head);
        String first = head.command();
        String last = first;
        while (!isAtEnd() && peek().start().column() == indent && continuesChain(first, last)) {
            Flow segment = parseFlowSegment(indent);
            segments.add(segment);
            last = segment.command();
        }
        return new FlowChain(chainSymbol(first), segments);
    }

    private boolean continuesChain(String first, String last) {
        Token next = peek();
        if (next.type() != TokenType.NAME) {
            return false;
        }
        String keyword = next.value();
        switch (first) {
            case "if", "elif":
                return !last.equals("else") && (keyword.equals("elif") || keyword.equals("else"));
            case "while", "for":
                return last.equals(first) && keyword.equals("else");
            case "try", "except":
                if (last.equals("finally")) {
                    return false;
                }
                if (last.equals("else")) {
                    return keyword.equals("finally");
                }
                return keyword.equals("except") || keyword.equals("else") || keyword.equals("finally");
            default:
                return false;
        }
    }

    private static Symbol chainSymbol(String command) {
        switch (command) {
            case "while":
                return Symbol.WHILE_STMT;
            case "for":
                return Symbol.FOR_STMT;
            case "try", "except", "finally":
                return Symbol.TRY_STMT;
            case "with":
                return Symbol.WITH_STMT;
            default:
                return Symbol.IF_STMT;
        }
    }

    private Flow parseFlowSegment(int indent) {
        List<Element> children = new ArrayList<>();
        if (check("async")) {
            children.add(consume());
        }
        String command = peek().value();
        children.add(consume());
        switch (command) {
            case "if", "elif", "while":
                addIfPresent(children, parseNamedExprTest());
                break;
            case "for":
                addIfPresent(children, parseExprlist());
                Leaf in = match("in");
                if (in != null) {
                    children.add(in);
                    addIfPresent(children, parseTestlist());
                }
                break;
            case "except":
                if (check("*")) {
                    children.add(consume());
                }
                if (startsTest()) {
                    children.add(parseTest());
                    if (check("as")) {
                        children.add(consume());
                        if (isName()) {
                            children.add(consume());
                        }
                    }
                }
                break;
            case "with":
                parseWithItems(children);
                break;
            default:
                break;
        }
        parseBlock(children, indent);
        return command.equals("for") ? new ForFlow(children) : new Flow(children);
    }

    private void parseWithItems(List<Element> children) {
        while (startsTest()) {
            Element expression = parseTest();
            if (check("as")) {
                List<Element> item = new ArrayList<>();
                item.add(expression);
                item.add(consume());
                addIfPresent(item, parseExpr());
                children.add(new Node(Symbol.WITH_ITEM, item));
            } else {
                children.add(expression);
            }
            if (!check(",")) {
                break;
            }
            children.add(consume());
        }
    }

    private Node parseSimpleStatement() {
        List<Element> children = new ArrayList<>();
        addIfPresent(children, parseSmallStatement());
        while (check(";")) {
            children.add(consume());
            if (atStatementEnd()) {
                break;
            }
            Element next = parseSmallStatement();
            if (next == null) {
                break;
            }
            children.add(next);
        }
        finishLine(children);
        return new Node(Symbol.SIMPLE_STMT, children);
    }

    private Element parseSmallStatement() {
        Token token = peek();
        if (token.type() == TokenType.NAME) {
            switch (token.value()) {
                case "import":
                    return parseImportName();
                case "from":
                    return parseImportFrom();
                case "pass", "break", "continue":
                    return new KeywordStatement(List.of(consume()));
                case "return": {
                    List<Element> children = new ArrayList<>();
                    children.add(consume());
                    if (startsSequenceItem()) {
                        addIfPresent(children, parseTestlistStarExpr());
                    }
                    return new KeywordStatement(children);
                }
                case "raise": {
                    List<Element> children = new ArrayList<>();
                    children.add(consume());
                    if (startsTest()) {
                        children.add(parseTest());
                        if (check("from")) {
                            children.add(consume());
                            addIfPresent(children, parseTest());
                        }
                    }
                    return new KeywordStatement(children);
                }
                case "global", "nonlocal": {
                    List<Element> children = new ArrayList<>();
                    children.add(consume());
                    while (isName()) {
                        children.add(consume());
                        if (!check(",")) {
                            break;
                        }
                        children.add(consume());
                    }
                    return new KeywordStatement(children);
                }
                case "del": {
                    List<Element> children = new ArrayList<>();
                    children.add(consume());
                    addIfPresent(children, parseExprlist());
                    return new KeywordStatement(children);
                }
                case "assert": {
                    List<Element> children = new ArrayList<>();
                    children.add(consume());
                    addIfPresent(children, parseTest());
                    if (check(",")) {
                        children.add(consume());
                        addIfPresent(children, parseTest());
                    }
                    return new KeywordStatement(children);
                }
                default:
                    break;
            }
        }
        if (!startsSequenceItem() && !check("yield")) {
            return null;
        }
        return parseExprStmt();
    }

    private Element parseExprStmt() {
        List<Element> children = new ArrayList<>();
        Element first = check("yield") ? parseYieldExpr() : parseTestlistStarExpr();
        if (first == null) {
            return null;
        }
        children.add(first);
        if (check(":")) {
            List<Element> annotation = new ArrayList<>();
            annotation.add(consume());
            addIfPresent(annotation, parseTest());
            if (check("=")) {
                annotation.add(consume());
                addIfPresent(annotation, parseYieldOrTestlist());
            }
            children.add(new Node(Symbol.ANNASSIGN, annotation));
        } else if (checkType(TokenType.OP) && AUGMENTED_ASSIGNMENTS.contains(peek().value())) {
            children.add(consume());
            addIfPresent(children, parseYieldOrTestlist());
        } else {
            while (check("=")) {
                children.add(consume());
                Element value = parseYieldOrTestlist();
                if (value == null) {
                    break;
                }
                children.add(value);
            }
        }
        return new ExprStmt(children);
    }

    private Element parseYieldOrTestlist() {
        if (check("yield")) {
            return parseYieldExpr();
        }
        return startsSequenceItem() ? parseTestlistStarExpr() : null;
    }

    private Element parseYieldExpr() {
        Leaf yield = consume();
        List<Element> children = new ArrayList<>();
        children.add(yield);
        if (check("from")) {
            children.add(consume());
            addIfPresent(children, parseTest());
        } else if (startsSequenceItem()) {
            addIfPresent(children, parseTestlistStarExpr());
        }
        return children.size() == 1 ? yield : new Node(Symbol.YIELD_EXPR, children);
    }

    // Imports

    private Import parseImportName() {
        List<Element> children = new ArrayList<>();
        children.add(consume());
        while (true) {
            Element item = parseDottedAsName();
            if (item == null) {
                break;
            }
            children.add(item);
            if (!check(",")) {
                break;
            }
            children.add(consume());
        }
        return new Import(Symbol.IMPORT_NAME, children);
    }

    private Element parseDottedAsName() {
        Element dotted = parseDottedName();
        if (dotted == null || !check("as")) {
            return dotted;
        }
        List<Element> children = new ArrayList<>();
        children.add(dotted);
        children.add(consume());
        if (isName()) {
            children.add(consume());
        }
        return new Node(Symbol.DOTTED_AS_NAME, children);
    }

    private Element parseDottedName() {
        if (!isName()) {
            return null;
        }
        List<Element> children = new ArrayList<>();
        children.add(consume());
        while (check(".")) {
            children.add(consume());
            if (!isName()) {
                break;
            }
            children.add(consume());
        }
        return children.size() == 1 ? children.get(0) : new Node(Symbol.DOTTED_NAME, children);
    }

    private Import parseImportFrom() {
        List<Element> children = new ArrayList<>();
        children.add(consume());
        while (check(".") || check("...")) {
            children.add(consume());
        }
        addIfPresent(children, parseDottedName());
        Leaf keyword = match("import");
        if (keyword == null) {
            LOG.debug("Incomplete from-import at {}", children.get(0).start());
            return new Import(Symbol.IMPORT_FROM, children);
        }
        children.add(keyword);
        if (check("*")) {
            children.add(consume());
            return new Import(Symbol.IMPORT_FROM, children);
        }
        boolean parenthesized = check("(");
        if (parenthesized) {
            children.add(consume());
        }
        while (isName()) {
            Name name = (Name) consume();
            if (check("as")) {
                List<Element> item = new ArrayList<>();
                item.add(name);
                item.add(consume());
                if (isName()) {
                    item.add(consume());
                }
                children.add(new Node(Symbol.IMPORT_AS_NAME, item));
            } else {
                children.add(name);
            }
            if (!check(",")) {
                break;
            }
            children.add(consume());
        }
        if (parenthesized) {
            recoverUntil(")", children);
            Leaf close = match(")");
            if (close != null) {
                children.add(close);
            }
        }
        return new Import(Symbol.IMPORT_FROM, children);
    }

    // Expressions

    private Element parseTestlistStarExpr() {
        return parseSequence(Symbol.TESTLIST_STAR_EXPR, this::parseTestOrStar);
    }

    private Element parseTestlist() {
        return parseSequence(Symbol.TESTLIST_STAR_EXPR, this::parseTest);
    }

    private Element parseExprlist() {
        return parseSequence(Symbol.EXPRLIST, () -> check("*") ? parseStarExpr() : parseExpr());
    }

    private Element parseSequence(Symbol symbol, Supplier<Element> item) {
        return parseSequence(symbol, item, this::startsSequenceItem);
    }

    private Element parseSequence(Symbol symbol, Supplier<Element> item, BooleanSupplier startsItem) {
        Element first = item.get();
        if (first == null || !check(",")) {
            return first;
        }
        List<Element> children = new ArrayList<>();
        children.add(first);
        while (check(",")) {
            children.add(consume());
            if (!startsItem.getAsBoolean()) {
                break;
            }
            Element next = item.get();
            if (next == null) {
                break;
            }
            children.add(next);
        }
        return new Node(symbol, children);
    }

    private Element parseTestOrStar() {
        return check("*") ? parseStarExpr() : parseTest();
    }

    private Element parseStarExpr() {
        List<Element> children = new ArrayList<>();
        children.add(consume());
        addIfPresent(children, parseExpr());
        return new Node(Symbol.STAR_EXPR, children);
    }

    private Element parseNamedExprTest() {
        Element test = parseTest();
        if (test == null || !check(":=")) {
            return test;
        }
        List<Element> children = new ArrayList<>();
        children.add(test);
        children.add(consume());
        addIfPresent(children, parseTest());
        return new Node(Symbol.NAMEDEXPR_TEST, children);
    }

    private Element parseTest() {
        if (expressionDepth >= maxNestingDepth) {
            return skipNestedExpression();
        }
        expressionDepth++;
        try {
            if (check("lambda")) {
                return parseLambdef();
            }
            Element condition = parseOrTest();
            if (condition == null || !check("if")) {
                return condition;
            }
            List<Element> children = new ArrayList<>();
            children.add(condition);
            children.add(consume());
            addIfPresent(children, parseOrTest());
            Leaf orElse = match("else");
            if (orElse != null) {
                children.add(orElse);
                addIfPresent(children, parseTest());
            }
            return new Node(Symbol.TEST, children);
        } finally {
            expressionDepth--;
        }
    }

    /**
     * Collects the rest of the logical line once expressions nest too deeply.
     */
    private Element skipNestedExpression() {
        LOG.warn("Expression nested deeper than {} at {}, collecting the rest of the line as an error node",
            maxNestingDepth, peek().start());
        List<Element> skipped = new ArrayList<>();
        while (!atStatementEnd()) {
            skipped.add(consume());
        }
        return skipped.isEmpty() ? null : new Node(Symbol.ERROR_NODE, skipped);
    }

    private Lambda parseLambdef() {
        List<Element> children = new ArrayList<>();
        children.add(consume());
        List<Element> params = new ArrayList<>();
        parseParamList(params, false, ":");
        if (!params.isEmpty()) {
            children.add(new Node(Symbol.PARAMETERS, params));
        }
        Leaf colon = match(":");
        if (colon != null) {
            children.add(colon);
            addIfPresent(children, parseTest());
        }
        return new Lambda(children);
    }

    private Element parseOrTest() {
        return parseKeywordOperation(Symbol.OR_TEST, "or", this::parseAndTest);
    }

    private Element parseAndTest() {
        return parseKeywordOperation(Symbol.AND_TEST, "and", this::parseNotTest);
    }

    private Element parseKeywordOperation(Symbol symbol, String keyword, Supplier<Element> operand) {
        Element first = operand.get();
        if (first == null || !check(keyword)) {
            return first;
        }
        List<Element> children = new ArrayList<>();
        children.add(first);
        while (check(keyword)) {
            children.add(consume());
            Element next = operand.get();
            if (next == null) {
                break;
            }
            children.add(next);
        }
        return new Node(symbol, children);
    }

    private Element parseNotTest() {
        List<Leaf> nots = new ArrayList<>();
        while (check("not")) {
            nots.add(consume());
        }
        Element inner = parseComparison();
        for (int i = nots.size() - 1; i >= 0; i--) {
            inner = inner == null
                ? new Node(Symbol.NOT_TEST, List.of(nots.get(i)))
                : new Node(Symbol.NOT_TEST, List.of(nots.get(i), inner));
        }
        return inner;
    }

    private Element parseComparison() {
        Element first = parseExpr();
        if (first == null || !startsComparison()) {
            return first;
        }
        List<Element> children = new ArrayList<>();
        children.add(first);
        while (startsComparison()) {
            if (check("not") || check("is")) {
                boolean is = check("is");
                children.add(consume());
                if (is && check("not") || !is && check("in")) {
                    children.add(consume());
                }
            } else {
                children.add(consume());
            }
            Element next = parseExpr();
            if (next == null) {
                break;
            }
            children.add(next);
        }
        return new Node(Symbol.COMPARISON, children);
    }

    private boolean startsComparison() {
        Token token = peek();
        if (token.type() == TokenType.OP) {
            return COMPARISON_OPERATORS.contains(token.value());
        }
        return check("in") || check("is") || check("not") && checkAhead(1, "in");
    }

    private Element parseExpr() {
        return parseBinary(0);
    }

    private Element parseBinary(int level) {
        if (level == BINARY_LEVELS.length) {
            return parseFactor();
        }
        Element first = parseBinary(level + 1);
        if (first == null || !checkOperator(level)) {
            return first;
        }
        List<Element> children = new ArrayList<>();
        children.add(first);
        while (checkOperator(level)) {
            children.add(consume());
            Element next = parseBinary(level + 1);
            if (next == null) {
                break;
            }
            children.add(next);
        }
        return new Node(BINARY_LEVELS[level], children);
    }

    private boolean checkOperator(int level) {
        return checkType(TokenType.OP) && BINARY_OPERATORS.get(level).contains(peek().value());
    }

    /**
     * Parses {@code factor: ('+'|'-'|'~') factor | power} where {@code power} is
     * {@code [await] atom trailer* ['**' factor]}. The right-associative {@code **} chain
     * is collected in a loop and folded from the right.
     */
    private Element parseFactor() {
        List<List<Leaf>> operators = new ArrayList<>();
        List<List<Element>> powers = new ArrayList<>();
        while (true) {
            List<Leaf> unary = new ArrayList<>();
            while (check("+") || check("-") || check("~")) {
                unary.add(consume());
            }
            List<Element> power = parsePowerOperand();
            operators.add(unary);
            powers.add(power);
            if (power.isEmpty() || power.get(power.size() - 1).hasValue("await") || !check("**")) {
                break;
            }
            power.add(consume());
        }
        Element inner = null;
        for (int i = powers.size() - 1; i >= 0; i--) {
            List<Element> children = powers.get(i);
            if (inner != null) {
                children.add(inner);
            }
            inner = children.isEmpty() ? null
                : children.size() == 1 ? children.get(0) : new Node(Symbol.POWER, children);
            List<Leaf> unary = operators.get(i);
            for (int j = unary.size() - 1; j >= 0; j--) {
                inner = inner == null
                    ? new Node(Symbol.FACTOR, List.of(unary.get(j)))
                    : new Node(Symbol.FACTOR, List.of(unary.get(j), inner));
            }
        }
        return inner;
    }

    /**
     * {@code [await] atom trailer*}; empty when there is no atom, just {@code await}
     * when the atom is missing after it.
     */
    private List<Element> parsePowerOperand() {
        List<Element> children = new ArrayList<>();
        if (check("await")) {
            children.add(consume());
        }
        Element atom = parseAtom();
        if (atom == null) {
            return children;
        }
        children.add(atom);
        while (check("(") || check("[") || check(".")) {
            children.add(parseTrailer());
        }
        return children;
    }

    private Node parseTrailer() {
        List<Element> children = new ArrayList<>();
        Leaf open = consume();
        children.add(open);
        switch (open.value()) {
            case ".":
                if (checkType(TokenType.NAME)) {
                    children.add(consume());
                }
                break;
            case "(":
                if (!check(")")) {
                    addIfPresent(children, parseArglist());
                }
                closeBracket(")", children);
                break;
            default:
                if (!check("]")) {
                    addIfPresent(children, parseSubscriptlist());
                }
                closeBracket("]", children);
                break;
        }
        return new Node(Symbol.TRAILER, children);
    }

    private Element parseArglist() {
        List<Element> children = new ArrayList<>();
        while (true) {
            Element argument = parseArgument();
            if (argument == null) {
                break;
            }
            children.add(argument);
            if (!check(",")) {
                break;
            }
            children.add(consume());
        }
        if (children.size() == 1) {
            return children.get(0);
        }
        return children.isEmpty() ? null : new Node(Symbol.ARGLIST, children);
    }

    private Element parseArgument() {
        if (check("*") || check("**")) {
            List<Element> children = new ArrayList<>();
            children.add(consume());
            addIfPresent(children, parseTest());
            return new Node(Symbol.ARGUMENT, children);
        }
        Element test = parseNamedExprTest();
        if (test == null) {
            return null;
        }
        if (check("=")) {
            List<Element> children = new ArrayList<>();
            children.add(test);
            children.add(consume());
            addIfPresent(children, parseTest());
            return new Node(Symbol.ARGUMENT, children);
        }
        if (startsComprehension()) {
            return parseComprehension(test);
        }
        return test;
    }

    private Element parseSubscriptlist() {
        return parseSequence(Symbol.SUBSCRIPTLIST, this::parseSubscript, () -> startsSequenceItem() || check(":"));
    }

    private Element parseSubscript() {
        if (check("*")) {
            return parseStarExpr();
        }
        if (!check(":") && !startsTest()) {
            return null;
        }
        List<Element> children = new ArrayList<>();
        if (!check(":")) {
            Element first = parseNamedExprTest();
            if (!check(":")) {
                return first;
            }
            addIfPresent(children, first);
        }
        children.add(consume());
        if (startsTest()) {
            children.add(parseTest());
        }
        if (check(":")) {
            children.add(consume());
            if (startsTest()) {
                children.add(parseTest());
            }
        }
        return new Node(Symbol.SUBSCRIPT, children);
    }

    private Element parseAtom() {
        Token token = peek();
        switch (token.type()) {
            case NUMBER:
            case ERRORTOKEN:
                return consume();
            case STRING: {
                List<Element> strings = new ArrayList<>();
                while (checkType(TokenType.STRING)) {
                    strings.add(consume());
                }
                return strings.size() == 1 ? strings.get(0) : new Node(Symbol.STRINGS, strings);
            }
            case NAME:
                if (!Keyword.RESERVED.contains(token.value()) || ATOM_KEYWORDS.contains(token.value())) {
                    return consume();
                }
                return null;
            case OP:
                switch (token.value()) {
                    case "(", "[", "{":
                        return parseBracketAtom();
                    case "...":
                        return consume();
                    default:
                        return null;
                }
            default:
                return null;
        }
    }

    private Node parseBracketAtom() {
        List<Element> children = new ArrayList<>();
        Leaf open = consume();
        children.add(open);
        String close;
        switch (open.value()) {
            case "(":
                close = ")";
                if (check("yield")) {
                    children.add(parseYieldExpr());
                } else if (!check(close)) {
                    addIfPresent(children, parseTestlistComp());
                }
                break;
            case "[":
                close = "]";
                if (!check(close)) {
                    addIfPresent(children, parseTestlistComp());
                }
                break;
            default:
                close = "}";
                if (!check(close)) {
                    addIfPresent(children, parseDictOrSetMaker());
                }
                break;
        }
        closeBracket(close, children);
        return new Node(Symbol.ATOM, children);
    }

    private Element parseTestlistComp() {
        Element first = check("*") ? parseStarExpr() : parseNamedExprTest();
        if (first == null) {
            return null;
        }
        if (startsComprehension()) {
            return parseComprehension(first);
        }
        if (!check(",")) {
            return first;
        }
        List<Element> children = new ArrayList<>();
        children.add(first);
        while (check(",")) {
            children.add(consume());
            if (!startsSequenceItem()) {
                break;
            }
            Element next = check("*") ? parseStarExpr() : parseNamedExprTest();
            if (next == null) {
                break;
            }
            children.add(next);
        }
        return new Node(Symbol.TESTLIST_COMP, children);
    }

    private boolean startsComprehension() {
        return check("for") || check("async") && checkAhead(1, "for");
    }

    private ListComprehension parseComprehension(Element result) {
        List<Element> children = new ArrayList<>();
        children.add(result);
        while (startsComprehension() || check("if")) {
            List<Element> clause = new ArrayList<>();
            if (check("if")) {
                clause.add(consume());
                addIfPresent(clause, parseOrTest());
                children.add(new Node(Symbol.COMP_IF, clause));
                continue;
            }
            if (check("async")) {
                clause.add(consume());
            }
            clause.add(consume());
            addIfPresent(clause, parseExprlist());
            Leaf in = match("in");
            if (in != null) {
                clause.add(in);
                addIfPresent(clause, parseOrTest());
            }
            children.add(new Node(Symbol.COMP_FOR, clause));
        }
        return new ListComprehension(children);
    }

    private Element parseDictOrSetMaker() {
        List<Element> first = parseDictOrSetItem();
        if (first.isEmpty()) {
            return null;
        }
        if (startsComprehension()) {
            Element result = first.size() == 1 ? first.get(0) : new Node(Symbol.DICT_ENTRY, first);
            return parseComprehension(result);
        }
        if (first.size() == 1 && !check(",")) {
            return first.get(0);
        }
        List<Element> children = new ArrayList<>(first);
        while (check(",")) {
            children.add(consume());
            List<Element> item = parseDictOrSetItem();
            if (item.isEmpty()) {
                break;
            }
            children.addAll(item);
        }
        return new Node(Symbol.DICTORSETMAKER, children);
    }

    private List<Element> parseDictOrSetItem() {
        List<Element> item = new ArrayList<>();
        if (check("**")) {
            item.add(consume());
            addIfPresent(item, parseExpr());
            return item;
        }
        if (check("*")) {
            item.add(parseStarExpr());
            return item;
        }
        Element key = parseTest();
        if (key == null) {
            return item;
        }
        item.add(key);
        if (check(":")) {
            item.add(consume());
            addIfPresent(item, parseTest());
        }
        return item;
    }

    // Recovery

    private void closeBracket(String close, List<Element> children) {
        recoverUntil(close, children);
        Leaf leaf = match(close);
        if (leaf != null) {
            children.add(leaf);
        }
    }

    /**
     * Collects stray tokens up to {@code close} (respecting nested brackets) into an
     * error node. Stops at the end of the logical line.
     */
    private void recoverUntil(String close, List<Element> children) {
        List<Element> stray = new ArrayList<>();
        int nesting = 0;
        while (!atStatementEnd()) {
            if (nesting == 0 && check(close)) {
                break;
            }
            if (checkType(TokenType.OP)) {
                String value = peek().value();
                if (value.equals("(") || value.equals("[") || value.equals("{")) {
                    nesting++;
                } else if (value.equals(")") || value.equals("]") || value.equals("}")) {
                    if (nesting == 0) {
                        break;
                    }
                    nesting--;
                }
            }
            stray.add(consume());
        }
        if (!stray.isEmpty()) {
            LOG.debug("Skipped {} unexpected token(s) before '{}' at {}", stray.size(), close, stray.get(0).start());
            children.add(new Node(Symbol.ERROR_NODE, stray));
        }
    }

    /**
     * Puts every remaining token of the logical line into an error node, then adds the
     * NEWLINE.
     */
    private void finishLine(List<Element> children) {
        List<Element> stray = new ArrayList<>();
        while (!atStatementEnd()) {
            stray.add(consume());
        }
        if (!stray.isEmpty()) {
            LOG.debug("Unexpected '{}' at {}", stray.get(0).getCode(false), stray.get(0).start());
            children.add(new Node(Symbol.ERROR_NODE, stray));
        }
        if (checkType(TokenType.NEWLINE)) {
            children.add(consume());
        }
    }

    // Helper methods

    private static void addIfPresent(List<Element> children, Element element) {
        if (element != null) {
            children.add(element);
        }
    }

    private Leaf leaf(Token token) {
        switch (token.type()) {
            case NAME:
                return Keyword.RESERVED.contains(token.value())
                    ? new Keyword(token.value(), token.start(), token.prefix())
                    : new Name(token.value(), token.start(), token.prefix());
            case NUMBER:
            case STRING:
                return new Literal(token.value(), token.start(), token.prefix());
            case OP:
                return new Operator(token.value(), token.start(), token.prefix());
            case NEWLINE:
            case ENDMARKER:
                return new Whitespace(token.value(), token.start(), token.prefix());
            default:
                return new ErrorLeaf(token.value(), token.start(), token.prefix());
        }
    }

    private Leaf consume() {
        if (isAtEnd()) {
            throw new IllegalStateException("Cannot consume ENDMARKER");
        }
        return leaf(tokens.get(current++));
    }

    private Leaf match(String value) {
        return check(value) ? consume() : null;
    }

    private boolean check(String value) {
        Token token = peek();
        return (token.type() == TokenType.OP || token.type() == TokenType.NAME) && token.value().equals(value);
    }

    private boolean checkAhead(int offset, String value) {
        int pos = Math.min(current + offset, tokens.size() - 1);
        Token token = tokens.get(pos);
        return (token.type() == TokenType.OP || token.type() == TokenType.NAME) && token.value().equals(value);
    }

    private boolean checkType(TokenType type) {
        return peek().type() == type;
    }

    private boolean isName() {
        return checkType(TokenType.NAME) && !Keyword.RESERVED.contains(peek().value());
    }

    private boolean startsTest() {
        Token token = peek();
        switch (token.type()) {
            case NUMBER:
            case STRING:
            case ERRORTOKEN:
                return true;
            case NAME:
                return !Keyword.RESERVED.contains(token.value()) || ATOM_KEYWORDS.contains(token.value())
                    || token.value().equals("not") || token.value().equals("lambda") || token.value().equals("await");
            case OP:
                switch (token.value()) {
                    case "(", "[", "{", "...", "-", "+", "~":
                        return true;
                    default:
                        return false;
                }
            default:
                return false;
        }
    }

    private boolean startsSequenceItem() {
        return startsTest() || check("*");
    }

    private boolean atStatementEnd() {
        return isAtEnd() || checkType(TokenType.NEWLINE);
    }

    private boolean isAtEnd() {
        return current >= tokens.size() - 1;
    }

    private Token peek() {
        return tokens.get(current);
    }

    public static Module parse(String source) {
        return new Parser(source).parse();
    }

    public static Module parse(String source, String path) {
        return new Parser(source, path).parse();
    }
}
