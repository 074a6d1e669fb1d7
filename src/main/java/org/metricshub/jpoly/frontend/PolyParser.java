package org.metricshub.jpoly.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jpoly
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.jpoly.frontend.ast.AddExpr;
import org.metricshub.jpoly.frontend.ast.AssignStatement;
import org.metricshub.jpoly.frontend.ast.CallExpr;
import org.metricshub.jpoly.frontend.ast.ConstExpr;
import org.metricshub.jpoly.frontend.ast.Expr;
import org.metricshub.jpoly.frontend.ast.InputStatement;
import org.metricshub.jpoly.frontend.ast.MulExpr;
import org.metricshub.jpoly.frontend.ast.OutputStatement;
import org.metricshub.jpoly.frontend.ast.ParserException;
import org.metricshub.jpoly.frontend.ast.PolynomialDeclaration;
import org.metricshub.jpoly.frontend.ast.PowExpr;
import org.metricshub.jpoly.frontend.ast.Statement;
import org.metricshub.jpoly.frontend.ast.SubExpr;
import org.metricshub.jpoly.frontend.ast.VarExpr;
import org.metricshub.jpoly.util.PolyLogger;
import org.metricshub.jpoly.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Converts a polynomial program into syntax trees, one per polynomial
 * declaration and one per statement of the execution section.
 * <p>
 * The parser is a recursive descent over a {@link TokenStream}, one method
 * per production, deciding between alternatives with {@link TokenStream#peek(int)}
 * and never backtracking. The first grammar violation throws a
 * {@link ParserException}. Semantic findings (undeclared parameters in a
 * polynomial body, calls to unknown polynomials, calls with the wrong number
 * of arguments, duplicate declarations) do not stop the parser: they are
 * recorded in the {@link CompilationContext} for the semantic gate.
 */
public class PolyParser {

	private static final Logger LOG = PolyLogger.getLogger(PolyParser.class);

	/** Parameter list of a polynomial declared without one. */
	private static final List<String> DEFAULT_PARAMETERS = Collections.singletonList("x");

	/**
	 * Name, declaration line and parameters of a polynomial, as read before its body.
	 */
	private static final class PolynomialHeader {
		private final String name;
		private final int lineNumber;
		private final List<String> parameters;

		private PolynomialHeader(String name, int lineNumber, List<String> parameters) {
			this.name = name;
			this.lineNumber = lineNumber;
			this.parameters = parameters;
		}
	}

	private TokenStream tokens;
	private String sourceDescription;
	private CompilationContext context;

	/**
	 * Parameters of the polynomial whose body is being parsed; identifiers of
	 * the body must be among them.
	 */
	private List<String> currentParameters;

	/**
	 * Parses the whole program read from the specified source.
	 *
	 * @param source the program text
	 * @return the context holding everything that was parsed and every semantic finding
	 * @throws IOException upon an IO error
	 * @throws ParserException upon the first syntax error
	 */
	public CompilationContext parse(ScriptSource source) throws IOException {
		if (source == null) {
			throw new IOException("No program source supplied");
		}
		return parse(new PolyLexer(source), source.getDescription());
	}

	/**
	 * Parses the whole program from a token stream.
	 *
	 * @param tokenStream the tokens of the program
	 * @param description name of the program source, used in diagnostics
	 * @return the context holding everything that was parsed and every semantic finding
	 * @throws IOException upon an IO error
	 * @throws ParserException upon the first syntax error
	 */
	public CompilationContext parse(TokenStream tokenStream, String description) throws IOException {
		this.tokens = tokenStream;
		this.sourceDescription = description;
		this.context = new CompilationContext();
		this.currentParameters = null;
		PROGRAM();
		LOG.debug("Parsed {}", sourceDescription);
		return context;
	}

	// SUPPORTING FUNCTIONS/METHODS
	private Token expect(TokenType expected) throws IOException {
		Token t = tokens.getToken();
		if (t.getType() != expected) {
			throw parserException("Expecting " + expected.name() + ". Found: " + t, t);
		}
		return t;
	}

	private TokenType peekType(int offset) throws IOException {
		return tokens.peek(offset).getType();
	}

	private ParserException parserException(String msg, Token at) {
		return new ParserException(msg, sourceDescription, at.getLine());
	}

	private ParserException unexpected(String what) throws IOException {
		Token t = tokens.peek(1);
		return parserException("Expecting " + what + ". Found: " + t, t);
	}

	private int toInt(Token numeral) {
		// numerals wrap around like any other int arithmetic
		return new BigInteger(numeral.getLexeme()).intValue();
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName
	// PROGRAM : TASKS_SECTION POLY_SECTION EXECUTE_SECTION INPUTS_SECTION END_OF_FILE
	void PROGRAM() throws IOException {
		TASKS_SECTION();
		POLY_SECTION();
		EXECUTE_SECTION();
		INPUTS_SECTION();
		if (peekType(1) != TokenType.END_OF_FILE) {
			throw unexpected("end of program");
		}
		expect(TokenType.END_OF_FILE);
	}

	// TASKS_SECTION : TASKS NUM { NUM }
	void TASKS_SECTION() throws IOException {
		expect(TokenType.KW_TASKS);
		selectTask(expect(TokenType.NUM));
		while (peekType(1) == TokenType.NUM) {
			selectTask(expect(TokenType.NUM));
		}
	}

	// task numbers are matched exactly, never wrapped
	private void selectTask(Token numeral) {
		BigInteger number = new BigInteger(numeral.getLexeme());
		if (number.bitLength() >= Integer.SIZE) {
			LOG.debug("Ignoring task number {} on line {}", number, numeral.getLine());
			return;
		}
		context.selectTask(number.intValue());
	}

	// POLY_SECTION : POLY POLY_DECL { POLY_DECL }
	void POLY_SECTION() throws IOException {
		expect(TokenType.KW_POLY);
		POLY_DECL();
		while (peekType(1) == TokenType.ID) {
			POLY_DECL();
		}
	}

	// POLY_DECL : POLY_HEADER = POLY_BODY ;
	void POLY_DECL() throws IOException {
		PolynomialHeader header = POLY_HEADER();
		expect(TokenType.EQUAL);
		currentParameters = header.parameters;
		Expr body = EXPRESSION(true);
		currentParameters = null;
		expect(TokenType.SEMICOLON);
		if (!context.declare(header.name, header.parameters, header.lineNumber, body)) {
			LOG.debug("Duplicate declaration of {} at line {}", header.name, header.lineNumber);
		}
	}

	// POLY_HEADER : ID [ ( ID_LIST ) ]
	PolynomialHeader POLY_HEADER() throws IOException {
		Token name = expect(TokenType.ID);
		List<String> parameters;
		if (peekType(1) == TokenType.LPAREN) {
			expect(TokenType.LPAREN);
			parameters = ID_LIST();
			expect(TokenType.RPAREN);
		} else {
			parameters = DEFAULT_PARAMETERS;
		}
		return new PolynomialHeader(name.getLexeme(), name.getLine(), parameters);
	}

	// ID_LIST : ID { , ID }
	List<String> ID_LIST() throws IOException {
		List<String> ids = new ArrayList<String>();
		ids.add(expect(TokenType.ID).getLexeme());
		while (peekType(1) == TokenType.COMMA) {
			expect(TokenType.COMMA);
			ids.add(expect(TokenType.ID).getLexeme());
		}
		return ids;
	}

	// EXPRESSION : TERM { + TERM } [ - EXPRESSION ]
	// Used for polynomial bodies (inPolynomial) and for the execution script.
	// A trailing subtraction recurses, so a - b - c is a - (b - c).
	Expr EXPRESSION(boolean inPolynomial) throws IOException {
		Expr left = TERM(inPolynomial);
		while (peekType(1) == TokenType.PLUS) {
			expect(TokenType.PLUS);
			left = new AddExpr(left, TERM(inPolynomial));
		}
		if (peekType(1) == TokenType.MINUS) {
			expect(TokenType.MINUS);
			left = new SubExpr(left, EXPRESSION(inPolynomial));
		}
		return left;
	}

	// TERM : FACTOR { FACTOR }
	// Juxtaposed factors multiply. A factor may only be continued by an ID or a (.
	// In the execution script a call is never continued.
	Expr TERM(boolean inPolynomial) throws IOException {
		Expr left = FACTOR(inPolynomial);
		while (peekType(1) == TokenType.ID || peekType(1) == TokenType.LPAREN) {
			if (!inPolynomial && left instanceof CallExpr) {
				break;
			}
			left = new MulExpr(left, FACTOR(inPolynomial));
		}
		return left;
	}

	// FACTOR : ( NUM | ID | CALL | '(' EXPRESSION ')' ) [ ^ NUM ]
	Expr FACTOR(boolean inPolynomial) throws IOException {
		Expr expr;
		boolean parenthesized = false;
		TokenType type = peekType(1);
		if (type == TokenType.NUM) {
			expr = new ConstExpr(toInt(expect(TokenType.NUM)));
		} else if (type == TokenType.ID) {
			Token id = expect(TokenType.ID);
			if (inPolynomial) {
				if (!currentParameters.contains(id.getLexeme())) {
					context.recordInvalidMonomial(id.getLine());
				}
				expr = new VarExpr(id.getLexeme(), id.getLine());
			} else if (peekType(1) == TokenType.LPAREN) {
				expr = CALL(id);
			} else {
				expr = new VarExpr(id.getLexeme(), id.getLine());
			}
		} else if (type == TokenType.LPAREN) {
			expect(TokenType.LPAREN);
			expr = EXPRESSION(inPolynomial);
			expect(TokenType.RPAREN);
			parenthesized = true;
		} else {
			throw unexpected("a numeral, an identifier or (");
		}

		if (peekType(1) == TokenType.POWER) {
			expect(TokenType.POWER);
			Token exponent = expect(TokenType.NUM);
			BigInteger value = new BigInteger(exponent.getLexeme());
			if (value.bitLength() >= Integer.SIZE) {
				throw parserException("Exponent too large: " + exponent.getLexeme(), exponent);
			}
			expr = new PowExpr(expr, value.intValue());
		} else if (inPolynomial && parenthesized && peekType(1) == TokenType.NUM) {
			// (x + 1) 2 is neither an exponent nor a product in a polynomial body
			throw unexpected("^ after a parenthesized factor");
		}
		return expr;
	}

	// CALL : ID ( EXPRESSION { , EXPRESSION } )
	// The ID has already been consumed by the caller.
	Expr CALL(Token id) throws IOException {
		expect(TokenType.LPAREN);
		List<Expr> arguments = new ArrayList<Expr>();
		arguments.add(EXPRESSION(false));
		while (peekType(1) == TokenType.COMMA) {
			expect(TokenType.COMMA);
			arguments.add(EXPRESSION(false));
		}
		expect(TokenType.RPAREN);

		PolynomialDeclaration declaration = context.getDeclaration(id.getLexeme());
		if (declaration == null) {
			context.recordUndeclaredCall(id.getLine());
		} else if (declaration.getParameters().size() != arguments.size()) {
			context.recordArityMismatch(id.getLine());
		}
		return new CallExpr(id.getLexeme(), id.getLine(), arguments);
	}

	// EXECUTE_SECTION : EXECUTE STATEMENT { STATEMENT }
	void EXECUTE_SECTION() throws IOException {
		expect(TokenType.KW_EXECUTE);
		context.addStatement(STATEMENT());
		TokenType next = peekType(1);
		while (next == TokenType.KW_INPUT || next == TokenType.KW_OUTPUT || next == TokenType.ID) {
			context.addStatement(STATEMENT());
			next = peekType(1);
		}
	}

	// STATEMENT : INPUT ID ; | OUTPUT ID ; | ID = EXPRESSION ;
	Statement STATEMENT() throws IOException {
		TokenType type = peekType(1);
		if (type == TokenType.KW_INPUT) {
			expect(TokenType.KW_INPUT);
			Token id = expect(TokenType.ID);
			expect(TokenType.SEMICOLON);
			return new InputStatement(id.getLexeme(), id.getLine());
		} else if (type == TokenType.KW_OUTPUT) {
			expect(TokenType.KW_OUTPUT);
			Token id = expect(TokenType.ID);
			expect(TokenType.SEMICOLON);
			return new OutputStatement(id.getLexeme(), id.getLine());
		} else if (type == TokenType.ID) {
			Token id = expect(TokenType.ID);
			expect(TokenType.EQUAL);
			Expr value = EXPRESSION(false);
			expect(TokenType.SEMICOLON);
			return new AssignStatement(id.getLexeme(), id.getLine(), value);
		} else {
			throw unexpected("INPUT, OUTPUT or an assignment");
		}
	}

	// INPUTS_SECTION : INPUTS NUM { NUM }
	void INPUTS_SECTION() throws IOException {
		expect(TokenType.KW_INPUTS);
		context.addInput(toInt(expect(TokenType.NUM)));
		while (peekType(1) == TokenType.NUM) {
			context.addInput(toInt(expect(TokenType.NUM)));
		}
	}
	// CHECKSTYLE.ON: MethodName
}
