package org.jpp.parser;

import org.jpp.ast.*;
import org.jpp.lexer.Token;
import org.jpp.lexer.TokenType;
import org.jpp.semantic.TypeTags;
import org.jpp.util.Debug;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser producing a {@link Program}.
 * <p>
 * Statements end at an optional newline or semicolon. Blocks have no closing token:
 * a block runs until end of input or until an {@code else} keyword, so a block swallows
 * every statement that follows it at the top level.
 */
public class Parser
{
	private static final String KW_IF = "if";
	private static final String KW_ELSE = "else";
	private static final String KW_WHILE = "while";
	private static final String KW_FOR = "for";
	private static final String KW_DEF = "def";
	private static final String KW_RETURN = "return";
	private static final String KW_RANGE = "range";

	private final List<Token> tokens;
	private int pos = 0;
	private Token curr;

	public Parser(List<Token> tokens)
	{
		if (tokens.isEmpty())
		{
			throw new IllegalArgumentException("Token list must at least contain EOF.");
		}
		this.tokens = tokens;
		this.curr = tokens.get(0);
	}

	public Program parseProgram()
	{
		List<Node> stmts = new ArrayList<>();

		while (!curr.is(TokenType.EOF))
		{
			if (curr.is(TokenType.NEWLINE))
			{
				advance();
				continue;
			}

			Node stmt = parseStatement();
			if (stmt != null)
			{
				stmts.add(stmt);
			}
		}

		Debug.logDebug("Parser: " + stmts.size() + " top-level statement(s).");
		return new Program(stmts);
	}

	// --- Cursor ---

	private void advance()
	{
		pos++;
		curr = pos < tokens.size() ? tokens.get(pos) : new Token(TokenType.EOF, "", curr.line(), curr.column());
	}

	private String match(TokenType type)
	{
		if (!curr.is(type))
		{
			throw new SyntaxException(type, curr);
		}
		String lexeme = curr.lexeme();
		advance();
		return lexeme;
	}

	private void matchOp(String op)
	{
		if (!curr.is(TokenType.OP, op))
		{
			throw new SyntaxException("Expected '" + op + "', got " + describe(curr), curr);
		}
		advance();
	}

	private void consumeStatementEnd()
	{
		if (curr.is(TokenType.NEWLINE) || curr.is(TokenType.SEMICOLON))
		{
			advance();
		}
	}

	private static String describe(Token token)
	{
		if (token.is(TokenType.EOF) || token.is(TokenType.NEWLINE))
		{
			return token.type().toString();
		}
		return token.type() + " '" + token.lexeme() + "'";
	}

	// --- Statements ---

	private Node parseStatement()
	{
		if (curr.is(TokenType.ID))
		{
			switch (curr.lexeme())
			{
				case KW_IF:
					return parseIf();
				case KW_WHILE:
					return parseWhile();
				case KW_FOR:
					return parseFor();
				case KW_DEF:
					return parseFunction();
				case KW_RETURN:
					return parseReturn();
				default:
					return parseAssignOrCall();
			}
		}

		if (curr.is(TokenType.NEWLINE))
		{
			advance();
			return null;
		}

		throw new SyntaxException("Unexpected token: " + describe(curr), curr);
	}

	private Return parseReturn()
	{
		match(TokenType.ID);
		Node expr = null;
		if (!curr.is(TokenType.NEWLINE) && !curr.is(TokenType.SEMICOLON) && !curr.is(TokenType.EOF))
		{
			expr = parseExpression();
		}
		consumeStatementEnd();
		return new Return(expr);
	}

	private IfStmt parseIf()
	{
		match(TokenType.ID);
		Node cond = parseExpression();
		match(TokenType.COLON);
		List<Node> body = parseBlock();

		List<Node> orElse = null;
		if (curr.isKeyword(KW_ELSE))
		{
			advance();
			match(TokenType.COLON);
			orElse = parseBlock();
		}

		return new IfStmt(cond, body, orElse);
	}

	private WhileStmt parseWhile()
	{
		match(TokenType.ID);
		Node cond = parseExpression();
		match(TokenType.COLON);
		List<Node> body = parseBlock();
		return new WhileStmt(cond, body);
	}

	private ForStmt parseFor()
	{
		match(TokenType.ID);
		String var = match(TokenType.ID);
		match(TokenType.COLON);
		if (!curr.isKeyword(KW_RANGE))
		{
			throw new SyntaxException("Expected 'range', got " + describe(curr), curr);
		}
		advance();
		match(TokenType.LPAREN);
		Node start = parseExpression();
		match(TokenType.COMMA);
		Node end = parseExpression();
		match(TokenType.RPAREN);
		match(TokenType.COLON);
		List<Node> body = parseBlock();
		return new ForStmt(var, start, end, body);
	}

	private FuncDef parseFunction()
	{
		match(TokenType.ID);
		String name = match(TokenType.ID);

		match(TokenType.LPAREN);
		List<String> params = new ArrayList<>();
		List<String> paramTypes = new ArrayList<>();

		while (!curr.is(TokenType.RPAREN))
		{
			String paramName = match(TokenType.ID);
			String paramType = TypeTags.UNTYPED;

			if (curr.is(TokenType.COLON))
			{
				advance();
				paramType = parseTypeAnnotation();
			}

			params.add(paramName);
			paramTypes.add(paramType);

			if (curr.is(TokenType.COMMA))
			{
				advance();
			}
		}

		match(TokenType.RPAREN);

		String returnType = TypeTags.VOID;
		if (curr.is(TokenType.COLON))
		{
			advance();
			// "def f():" has no return annotation: the colon is followed by the body
			if (curr.is(TokenType.ID))
			{
				returnType = parseTypeAnnotation();
				match(TokenType.COLON);
			}
		}
		else
		{
			match(TokenType.COLON);
		}

		List<Node> body = parseBlock();
		return new FuncDef(name, params, paramTypes, returnType, body);
	}

	/**
	 * A type name, optionally followed by {@code []}.
	 */
	private String parseTypeAnnotation()
	{
		String type = match(TokenType.ID);
		if (curr.is(TokenType.LBRACK))
		{
			advance();
			match(TokenType.RBRACK);
			type = TypeTags.arrayOf(type);
		}
		return type;
	}

	/**
	 * Statements up to end of input or an {@code else} at this level.
	 */
	private List<Node> parseBlock()
	{
		List<Node> stmts = new ArrayList<>();

		if (curr.is(TokenType.NEWLINE))
		{
			advance();
		}

		while (!curr.is(TokenType.EOF))
		{
			if (curr.is(TokenType.NEWLINE))
			{
				advance();
				continue;
			}

			if (curr.isKeyword(KW_ELSE))
			{
				break;
			}

			Node stmt = parseStatement();
			if (stmt != null)
			{
				stmts.add(stmt);
			}
		}

		return stmts;
	}

	private Node parseAssignOrCall()
	{
		String name = match(TokenType.ID);

		if (curr.is(TokenType.LBRACK))
		{
			advance();
			Node index = parseExpression();
			match(TokenType.RBRACK);
			matchOp("=");
			Node expr = parseExpression();
			consumeStatementEnd();
			return new Assign(new ArrayAccess(name, index), expr);
		}

		if (curr.is(TokenType.OP, "="))
		{
			advance();
			Node expr = parseExpression();
			consumeStatementEnd();
			return new Assign(name, expr);
		}

		// A bare name is a call without arguments
		List<Node> args = new ArrayList<>();
		if (curr.is(TokenType.LPAREN))
		{
			advance();
			args = parseArguments();
		}

		consumeStatementEnd();
		return new Call(name, args);
	}

	// --- Expressions ---

	public Node parseExpression()
	{
		return parseBinary(0);
	}

	/**
	 * Precedence climbing. Operands of an operator are parsed with a minimum precedence one
	 * higher than the operator's own, which makes every level left-associative.
	 */
	private Node parseBinary(int minPrecedence)
	{
		Node left = parsePrimary();

		while (curr.is(TokenType.OP) && precedence(curr.lexeme()) >= minPrecedence)
		{
			String op = curr.lexeme();
			int prec = precedence(op);
			advance();
			Node right = parseBinary(prec + 1);
			left = new BinOp(left, op, right);
		}

		return left;
	}

	private Node parsePrimary()
	{
		Token tok = curr;

		if (tok.is(TokenType.INT_LITERAL))
		{
			advance();
			try
			{
				return new IntLiteral(Integer.parseInt(tok.lexeme()));
			}
			catch (NumberFormatException e)
			{
				throw new SyntaxException("Integer literal out of range: " + tok.lexeme(), tok);
			}
		}

		if (tok.is(TokenType.FLOAT_LITERAL))
		{
			advance();
			return new FloatLiteral(Double.parseDouble(tok.lexeme()));
		}

		if (tok.is(TokenType.STRING_LITERAL))
		{
			advance();
			String text = tok.lexeme();
			return new StringLiteral(text.substring(1, text.length() - 1));
		}

		if (tok.is(TokenType.ID))
		{
			advance();
			String name = tok.lexeme();

			if (curr.is(TokenType.OP, "?."))
			{
				advance();
				String field = match(TokenType.ID);
				return new SafeNav(new Var(name), field);
			}

			if (curr.is(TokenType.LBRACK))
			{
				advance();
				Node index = parseExpression();
				match(TokenType.RBRACK);
				return new ArrayAccess(name, index);
			}

			if (curr.is(TokenType.LPAREN))
			{
				advance();
				return new Call(name, parseArguments());
			}

			return new Var(name);
		}

		if (tok.is(TokenType.LPAREN))
		{
			advance();
			Node expr = parseExpression();
			match(TokenType.RPAREN);
			return expr;
		}

		throw new SyntaxException("Unexpected token in expression: " + describe(tok), tok);
	}

	/**
	 * Arguments after an opening parenthesis, through the closing one. Commas are optional.
	 */
	private List<Node> parseArguments()
	{
		List<Node> args = new ArrayList<>();
		while (!curr.is(TokenType.RPAREN))
		{
			args.add(parseExpression());
			if (curr.is(TokenType.COMMA))
			{
				advance();
			}
		}
		match(TokenType.RPAREN);
		return args;
	}

	private static int precedence(String op)
	{
		switch (op)
		{
			case "*":
			case "/":
			case "%":
				return 3;
			case "+":
			case "-":
				return 2;
			case "==":
			case "!=":
			case ">":
			case "<":
			case ">=":
			case "<=":
				return 1;
			// Chained assignment inside an expression: x = y = 3
			case "=":
				return 0;
			default:
				return -1;
		}
	}
}
