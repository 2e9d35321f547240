package org.fastbuild.lsp.evaluator.frontend.parser;

import org.fastbuild.lsp.evaluator.api.ParseException;
import org.fastbuild.lsp.evaluator.api.SourceRange;
import org.fastbuild.lsp.evaluator.frontend.directive.DirectiveHandlerRegistry;
import org.fastbuild.lsp.evaluator.frontend.directive.IDirectiveHandler;
import org.fastbuild.lsp.evaluator.frontend.lexer.Token;
import org.fastbuild.lsp.evaluator.frontend.lexer.TokenType;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.ArrayLiteralNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.AstNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.BinaryOperator;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.BooleanLiteralNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.EvaluatedVariableNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.IntegerLiteralNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.StringLiteralNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.StringTemplateNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.StructLiteralNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.SumNode;
import org.fastbuild.lsp.evaluator.frontend.parser.ast.VariableLhs;
import org.fastbuild.lsp.evaluator.frontend.parser.features.assignment.BinaryOperatorNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.assignment.UnnamedBinaryOperatorNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.assignment.VariableDefinitionNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.BooleanConditionNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.ComparisonConditionNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.ComparisonOperator;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.ConditionNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.IfNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.InConditionNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.LogicalConditionNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.condition.LogicalOperator;
import org.fastbuild.lsp.evaluator.frontend.parser.features.foreach.ForEachIterator;
import org.fastbuild.lsp.evaluator.frontend.parser.features.foreach.ForEachNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.function.ErrorNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.function.GenericFunctionNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.function.PrintNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.function.SettingsNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.scope.ScopedStatementsNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.userfunction.ParameterNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.userfunction.UserFunctionCallNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.userfunction.UserFunctionDeclarationNode;
import org.fastbuild.lsp.evaluator.frontend.parser.features.using.UsingNode;
import org.fastbuild.lsp.evaluator.functions.GenericFunction;
import org.fastbuild.lsp.evaluator.scope.ScopeLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The parser for the BFF language. It consumes the tokens from the
 * {@link org.fastbuild.lsp.evaluator.frontend.lexer.Lexer} and produces the statement tree.
 * <p>
 * Line breaks matter in two places: a {@code +}/{@code -} continues a sum only on the same line (on a
 * new line it starts an unnamed modification), and a preprocessor directive ends with its line.
 * The parser stops at the first syntax error.
 */
public class Parser implements ParsingContext {

    private final List<Token> tokens;
    private final String uri;
    private final DirectiveHandlerRegistry directiveRegistry;
    private int current = 0;
    private boolean inArrayLiteral = false;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, ending with {@link TokenType#END_OF_FILE}.
     * @param uri The uri of the file being parsed.
     */
    public Parser(List<Token> tokens, String uri) {
        this.tokens = tokens;
        this.uri = uri;
        this.directiveRegistry = DirectiveHandlerRegistry.initialize();
    }

    /**
     * Parses the entire token stream.
     * @return The top-level statements.
     * @throws ParseException at the first syntax error.
     */
    public List<AstNode> parse() throws ParseException {
        List<AstNode> statements = new ArrayList<>();
        while (!isAtEnd()) {
            statements.add(statement());
        }
        return statements;
    }

    // Statements

    private AstNode statement() throws ParseException {
        Token token = peek();
        switch (token.type()) {
            case VARIABLE:
            case DYNAMIC_VARIABLE:
                return variableStatement();
            case PLUS:
            case MINUS:
                return unnamedModification();
            case LEFT_BRACE: {
                Token open = advance();
                List<AstNode> statements = statementsUntil(TokenType.RIGHT_BRACE, "'}'");
                return new ScopedStatementsNode(statements, SourceRange.between(open.range(), previous().range()));
            }
            case DIRECTIVE:
                return directive();
            case IDENTIFIER:
                return functionStatement();
            default:
                throw error(token, "Unexpected " + describe(token) + ". Expected a statement.");
        }
    }

    private AstNode variableStatement() throws ParseException {
        VariableLhs lhs = variableLhs();
        if (match(TokenType.EQUALS)) {
            AstNode rhs = expression();
            return new VariableDefinitionNode(lhs, rhs, SourceRange.between(lhs.range(), rhs.range()));
        }
        if (match(TokenType.PLUS, TokenType.MINUS)) {
            BinaryOperator operator = toOperator(previous());
            AstNode rhs = expression();
            return new BinaryOperatorNode(lhs, operator, rhs, SourceRange.between(lhs.range(), rhs.range()));
        }
        throw error(peek(), "Expected '=', '+' or '-' after variable, but found " + describe(peek()) + ".");
    }

    private AstNode unnamedModification() throws ParseException {
        Token operatorToken = advance();
        AstNode rhs = expression();
        return new UnnamedBinaryOperatorNode(toOperator(operatorToken), rhs, SourceRange.between(operatorToken.range(), rhs.range()));
    }

    private AstNode directive() throws ParseException {
        Token directiveToken = peek();
        String name = (String) directiveToken.value();
        if (name.equals("else") || name.equals("endif")) {
            throw error(directiveToken, "'#" + name + "' without a matching '#if'.");
        }
        Optional<IDirectiveHandler> handler = directiveRegistry.get(name);
        if (handler.isEmpty()) {
            throw error(directiveToken, "Unknown directive '#" + name + "'.");
        }
        return handler.get().parse(this);
    }

    private AstNode functionStatement() throws ParseException {
        Token name = advance();
        switch (name.text()) {
            case "function":
                return userFunctionDeclaration(name);
            case "Using":
                return using(name);
            case "ForEach":
                return forEach(name);
            case "If":
                return ifStatement(name);
            case "Print": {
                AstNode value = singleArgument(name);
                return new PrintNode(value, SourceRange.between(name.range(), previous().range()));
            }
            case "Error": {
                AstNode value = singleArgument(name);
                return new ErrorNode(value, SourceRange.between(name.range(), previous().range()));
            }
            case "Settings": {
                List<AstNode> statements = block("Settings");
                return new SettingsNode(statements, SourceRange.between(name.range(), previous().range()));
            }
            default:
                break;
        }

        Optional<GenericFunction> genericFunction = GenericFunction.fromName(name.text());
        if (genericFunction.isPresent()) {
            AstNode targetName = singleArgument(name);
            List<AstNode> statements = block(name.text());
            return new GenericFunctionNode(genericFunction.get(), targetName, statements, SourceRange.between(name.range(), previous().range()));
        }
        if (check(TokenType.LEFT_PAREN)) {
            return userFunctionCall(name);
        }
        throw error(name, "Unknown function \"" + name.text() + "\". Expected '(' after a function name.");
    }

    private AstNode using(Token name) throws ParseException {
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'Using'.");
        if (!check(TokenType.VARIABLE) && !check(TokenType.DYNAMIC_VARIABLE)) {
            throw error(peek(), "'Using' parameter must be an evaluated variable.");
        }
        EvaluatedVariableNode struct = evaluatedVariable(advance());
        Token close = consume(TokenType.RIGHT_PAREN, "Expected ')' after 'Using' parameter.");
        return new UsingNode(struct, SourceRange.between(name.range(), close.range()));
    }

    private AstNode forEach(Token name) throws ParseException {
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'ForEach'.");
        List<ForEachIterator> iterators = new ArrayList<>();
        while (!check(TokenType.RIGHT_PAREN)) {
            if (match(TokenType.COMMA)) {
                continue;
            }
            if (!check(TokenType.VARIABLE) && !check(TokenType.DYNAMIC_VARIABLE)) {
                throw error(peek(), "Expected a loop variable in 'ForEach', but found " + describe(peek()) + ".");
            }
            VariableLhs loopVariable = variableLhs();
            if (!check(TokenType.IDENTIFIER) || !peek().text().equals("in")) {
                throw error(peek(), "Expected 'in' after the 'ForEach' loop variable.");
            }
            advance();
            if (!check(TokenType.VARIABLE) && !check(TokenType.DYNAMIC_VARIABLE)) {
                throw error(peek(), "'ForEach' variable to loop over must be an evaluated variable.");
            }
            iterators.add(new ForEachIterator(loopVariable, evaluatedVariable(advance())));
        }
        if (iterators.isEmpty()) {
            throw error(peek(), "'ForEach' requires at least one loop variable.");
        }
        advance(); // ')'
        List<AstNode> statements = block("ForEach");
        return new ForEachNode(iterators, statements, SourceRange.between(name.range(), previous().range()));
    }

    private AstNode ifStatement(Token name) throws ParseException {
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'If'.");
        ConditionNode condition = orCondition();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after 'If' condition.");
        List<AstNode> statements = block("If");
        return new IfNode(condition, statements, SourceRange.between(name.range(), previous().range()));
    }

    private AstNode userFunctionDeclaration(Token keyword) throws ParseException {
        Token name = consume(TokenType.IDENTIFIER, "Expected a function name after 'function'.");
        consume(TokenType.LEFT_PAREN, "Expected '(' after the function name.");
        List<ParameterNode> parameters = new ArrayList<>();
        while (!check(TokenType.RIGHT_PAREN)) {
            if (match(TokenType.COMMA)) {
                continue;
            }
            Token parameter = peek();
            if (parameter.type() != TokenType.VARIABLE || parameter.text().charAt(0) != '.') {
                throw error(parameter, "Expected a parameter of the form '.Name', but found " + describe(parameter) + ".");
            }
            advance();
            parameters.add(new ParameterNode((String) parameter.value(), parameter.range()));
        }
        advance(); // ')'
        List<AstNode> statements = block("function " + name.text());
        return new UserFunctionDeclarationNode(name.text(), name.range(), parameters, statements,
                SourceRange.between(keyword.range(), previous().range()));
    }

    private AstNode userFunctionCall(Token name) throws ParseException {
        advance(); // '('
        List<AstNode> arguments = new ArrayList<>();
        while (!check(TokenType.RIGHT_PAREN)) {
            if (isAtEnd()) {
                throw error(peek(), "Expected ')' to close the call of \"" + name.text() + "\".");
            }
            if (match(TokenType.COMMA)) {
                continue;
            }
            arguments.add(expression());
        }
        Token close = advance();
        return new UserFunctionCallNode(name.text(), name.range(), arguments, SourceRange.between(name.range(), close.range()));
    }

    private AstNode singleArgument(Token function) throws ParseException {
        consume(TokenType.LEFT_PAREN, "Expected '(' after '" + function.text() + "'.");
        AstNode value = expression();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after the '" + function.text() + "' argument.");
        return value;
    }

    private List<AstNode> block(String owner) throws ParseException {
        consume(TokenType.LEFT_BRACE, "Expected '{' to start the body of '" + owner + "'.");
        return statementsUntil(TokenType.RIGHT_BRACE, "'}'");
    }

    private List<AstNode> statementsUntil(TokenType closing, String closingText) throws ParseException {
        boolean wasInArrayLiteral = inArrayLiteral;
        inArrayLiteral = false;
        try {
            List<AstNode> statements = new ArrayList<>();
            while (!check(closing)) {
                if (isAtEnd()) {
                    throw error(peek(), "Expected " + closingText + ", but reached the end of the file.");
                }
                statements.add(statement());
            }
            advance();
            return statements;
        } finally {
            inArrayLiteral = wasInArrayLiteral;
        }
    }

    // If conditions

    private ConditionNode orCondition() throws ParseException {
        ConditionNode left = andCondition();
        while (match(TokenType.OR_OR)) {
            ConditionNode right = andCondition();
            left = new LogicalConditionNode(left, LogicalOperator.OR, right, SourceRange.between(left.range(), right.range()));
        }
        return left;
    }

    private ConditionNode andCondition() throws ParseException {
        ConditionNode left = primaryCondition();
        while (match(TokenType.AND_AND)) {
            ConditionNode right = primaryCondition();
            left = new LogicalConditionNode(left, LogicalOperator.AND, right, SourceRange.between(left.range(), right.range()));
        }
        return left;
    }

    private ConditionNode primaryCondition() throws ParseException {
        if (match(TokenType.LEFT_PAREN)) {
            ConditionNode inner = orCondition();
            consume(TokenType.RIGHT_PAREN, "Expected ')' in 'If' condition.");
            return inner;
        }
        if (match(TokenType.BANG)) {
            Token bang = previous();
            AstNode value = operand();
            return new BooleanConditionNode(value, true, SourceRange.between(bang.range(), value.range()));
        }

        AstNode lhs = operand();
        Optional<ComparisonOperator> comparison = comparisonOperator(peek());
        if (comparison.isPresent()) {
            Token operatorToken = advance();
            AstNode rhs = operand();
            return new ComparisonConditionNode(lhs, comparison.get(), operatorToken.range(), rhs, SourceRange.between(lhs.range(), rhs.range()));
        }
        if (checkKeyword("in")) {
            advance();
            AstNode rhs = operand();
            return new InConditionNode(lhs, rhs, false, SourceRange.between(lhs.range(), rhs.range()));
        }
        if (checkKeyword("not") && current + 1 < tokens.size()
                && tokens.get(current + 1).type() == TokenType.IDENTIFIER && tokens.get(current + 1).text().equals("in")) {
            advance();
            advance();
            AstNode rhs = operand();
            return new InConditionNode(lhs, rhs, true, SourceRange.between(lhs.range(), rhs.range()));
        }
        return new BooleanConditionNode(lhs, false, lhs.range());
    }

    private static Optional<ComparisonOperator> comparisonOperator(Token token) {
        switch (token.type()) {
            case EQUAL_EQUAL: return Optional.of(ComparisonOperator.EQUAL);
            case BANG_EQUAL: return Optional.of(ComparisonOperator.NOT_EQUAL);
            case LESS: return Optional.of(ComparisonOperator.LESS);
            case LESS_EQUAL: return Optional.of(ComparisonOperator.LESS_OR_EQUAL);
            case GREATER: return Optional.of(ComparisonOperator.GREATER);
            case GREATER_EQUAL: return Optional.of(ComparisonOperator.GREATER_OR_EQUAL);
            default: return Optional.empty();
        }
    }

    // Expressions

    /**
     * Parses an operand optionally followed by {@code +}/{@code -} operations on the same line.
     * @return The operand, or a {@link SumNode} if there are operations.
     * @throws ParseException if the expression is malformed.
     */
    public AstNode expression() throws ParseException {
        AstNode first = operand();
        List<SumNode.Summand> summands = new ArrayList<>();
        AstNode last = first;
        while ((check(TokenType.PLUS) || check(TokenType.MINUS)) && peek().line() == previous().line()) {
            BinaryOperator operator = toOperator(advance());
            AstNode value = operand();
            summands.add(new SumNode.Summand(operator, value));
            last = value;
        }
        if (summands.isEmpty()) {
            return first;
        }
        return new SumNode(first, summands, SourceRange.between(first.range(), last.range()));
    }

    private AstNode operand() throws ParseException {
        Token token = peek();
        switch (token.type()) {
            case STRING:
                advance();
                return stringContents((String) token.value(), token, token.column() + 1);
            case INTEGER:
                advance();
                return new IntegerLiteralNode((Integer) token.value(), token.range());
            case MINUS: {
                Token next = current + 1 < tokens.size() ? tokens.get(current + 1) : null;
                if (next != null && next.type() == TokenType.INTEGER && next.line() == token.line() && next.column() == token.endColumn()) {
                    advance();
                    advance();
                    return new IntegerLiteralNode(-((Integer) next.value()), SourceRange.between(token.range(), next.range()));
                }
                break;
            }
            case IDENTIFIER:
                if (token.text().equals("true") || token.text().equals("false")) {
                    advance();
                    return new BooleanLiteralNode(token.text().equals("true"), token.range());
                }
                break;
            case VARIABLE:
            case DYNAMIC_VARIABLE:
                return evaluatedVariable(advance());
            case LEFT_BRACE:
                return arrayLiteral();
            case LEFT_BRACKET: {
                Token open = advance();
                List<AstNode> statements = statementsUntil(TokenType.RIGHT_BRACKET, "']'");
                return new StructLiteralNode(statements, SourceRange.between(open.range(), previous().range()));
            }
            default:
                break;
        }
        throw error(token, "Unexpected " + describe(token) + ". Expected a value.");
    }

    private AstNode arrayLiteral() throws ParseException {
        Token open = advance();
        boolean wasInArrayLiteral = inArrayLiteral;
        inArrayLiteral = true;
        try {
            List<AstNode> items = new ArrayList<>();
            while (!check(TokenType.RIGHT_BRACE)) {
                if (isAtEnd()) {
                    throw error(peek(), "Expected '}' to close the Array, but reached the end of the file.");
                }
                if (match(TokenType.COMMA)) {
                    continue;
                }
                items.add(arrayItem());
            }
            Token close = advance();
            return new ArrayLiteralNode(items, SourceRange.between(open.range(), close.range()));
        } finally {
            inArrayLiteral = wasInArrayLiteral;
        }
    }

    private AstNode arrayItem() throws ParseException {
        if (check(TokenType.DIRECTIVE)) {
            if (!isDirective("if")) {
                throw error(peek(), "Only '#if' directives are allowed inside an Array.");
            }
            return directive();
        }
        return operand();
    }

    private VariableLhs variableLhs() throws ParseException {
        Token token = advance();
        return new VariableLhs(variableName(token), scopeOf(token), token.range());
    }

    private EvaluatedVariableNode evaluatedVariable(Token token) throws ParseException {
        return new EvaluatedVariableNode(variableName(token), scopeOf(token), token.range());
    }

    private AstNode variableName(Token token) throws ParseException {
        if (token.type() == TokenType.DYNAMIC_VARIABLE) {
            return stringContents((String) token.value(), token, token.column() + 2);
        }
        return new StringLiteralNode((String) token.value(), token.range());
    }

    private static ScopeLocation scopeOf(Token token) {
        return token.text().charAt(0) == '^' ? ScopeLocation.PARENT : ScopeLocation.CURRENT;
    }

    /**
     * Splits the raw contents of a string into literal parts and {@code $Name$} variables.
     * @param raw The contents between the quotes, escapes unresolved.
     * @param token The string token.
     * @param contentColumn The column of the first content character.
     */
    private AstNode stringContents(String raw, Token token, int contentColumn) throws ParseException {
        List<AstNode> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int literalStart = contentColumn;
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c == StringContents.ESCAPE && i + 1 < raw.length()) {
                literal.append(raw.charAt(i + 1));
                i += 2;
                continue;
            }
            if (c == '$') {
                int close = raw.indexOf('$', i + 1);
                if (close < 0) {
                    throw new ParseException("Unterminated variable in string: missing closing '$'.",
                            SourceRange.of(uri, token.line(), contentColumn + i, token.line(), contentColumn + raw.length()));
                }
                SourceRange variableRange = SourceRange.of(uri, token.line(), contentColumn + i, token.line(), contentColumn + close + 1);
                String name = raw.substring(i + 1, close);
                if (!isValidVariableName(name)) {
                    throw new ParseException("Invalid variable name \"" + name + "\" in string.", variableRange);
                }
                if (literal.length() > 0) {
                    parts.add(new StringLiteralNode(literal.toString(),
                            SourceRange.of(uri, token.line(), literalStart, token.line(), contentColumn + i)));
                    literal.setLength(0);
                }
                parts.add(new EvaluatedVariableNode(new StringLiteralNode(name, variableRange), ScopeLocation.CURRENT, variableRange));
                i = close + 1;
                literalStart = contentColumn + i;
                continue;
            }
            literal.append(c);
            i++;
        }

        if (parts.isEmpty()) {
            return new StringLiteralNode(literal.toString(), token.range());
        }
        if (literal.length() > 0) {
            parts.add(new StringLiteralNode(literal.toString(),
                    SourceRange.of(uri, token.line(), literalStart, token.line(), contentColumn + raw.length())));
        }
        return new StringTemplateNode(parts, token.range());
    }

    private static boolean isValidVariableName(String name) {
        if (name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return false;
            }
        }
        return true;
    }

    private static BinaryOperator toOperator(Token token) {
        return token.type() == TokenType.PLUS ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
    }

    private boolean checkKeyword(String keyword) {
        return check(TokenType.IDENTIFIER) && peek().text().equals(keyword);
    }

    private static String describe(Token token) {
        if (token.type() == TokenType.END_OF_FILE) {
            return "end of file";
        }
        return "'" + token.text() + "'";
    }

    // ParsingContext

    @Override
    public List<AstNode> parseConditionalBranch() throws ParseException {
        List<AstNode> nodes = new ArrayList<>();
        while (!isDirective("else") && !isDirective("endif")) {
            if (isAtEnd()) {
                throw error(peek(), "Expected '#endif', but reached the end of the file.");
            }
            if (inArrayLiteral && match(TokenType.COMMA)) {
                continue;
            }
            nodes.add(inArrayLiteral ? arrayItem() : statement());
        }
        return nodes;
    }

    @Override
    public boolean isDirective(String directiveName) {
        return check(TokenType.DIRECTIVE) && directiveName.equals(peek().value());
    }

    @Override
    public boolean isOnLine(int line) {
        return !isAtEnd() && peek().line() == line;
    }

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    @Override
    public Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token previous() {
        return tokens.get(current - 1);
    }

    @Override
    public Token consume(TokenType type, String errorMessage) throws ParseException {
        if (check(type)) return advance();
        throw error(peek(), errorMessage);
    }

    @Override
    public ParseException error(Token token, String message) {
        return new ParseException(message, token.range());
    }

    @Override
    public String getUri() {
        return uri;
    }
}
