package org.metricshub.jtmpl.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jtmpl
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.jtmpl.frontend.ast.ActionNode;
import org.metricshub.jtmpl.frontend.ast.BoolNode;
import org.metricshub.jtmpl.frontend.ast.ChainNode;
import org.metricshub.jtmpl.frontend.ast.CommandNode;
import org.metricshub.jtmpl.frontend.ast.DotNode;
import org.metricshub.jtmpl.frontend.ast.ElseNode;
import org.metricshub.jtmpl.frontend.ast.EndNode;
import org.metricshub.jtmpl.frontend.ast.FieldNode;
import org.metricshub.jtmpl.frontend.ast.IdentifierNode;
import org.metricshub.jtmpl.frontend.ast.IfNode;
import org.metricshub.jtmpl.frontend.ast.ListNode;
import org.metricshub.jtmpl.frontend.ast.NilNode;
import org.metricshub.jtmpl.frontend.ast.Node;
import org.metricshub.jtmpl.frontend.ast.NodeType;
import org.metricshub.jtmpl.frontend.ast.NumberNode;
import org.metricshub.jtmpl.frontend.ast.ParserException;
import org.metricshub.jtmpl.frontend.ast.ParserException.ErrorKind;
import org.metricshub.jtmpl.frontend.ast.PipeNode;
import org.metricshub.jtmpl.frontend.ast.RangeNode;
import org.metricshub.jtmpl.frontend.ast.StringNode;
import org.metricshub.jtmpl.frontend.ast.TemplateNode;
import org.metricshub.jtmpl.frontend.ast.TextNode;
import org.metricshub.jtmpl.frontend.ast.VariableNode;
import org.metricshub.jtmpl.frontend.ast.WithNode;
import org.metricshub.jtmpl.util.Literals;
import org.metricshub.jtmpl.util.MalformedLiteralException;
import org.metricshub.jtmpl.util.ParserSettings;
import org.metricshub.jtmpl.util.TemplateLogger;
import org.slf4j.Logger;

/**
 * Converts template text into {@link Tree}s by recursive descent.
 * <p>
 * One parse produces a tree for the top-level text, registered under the
 * parser's name, plus one tree for every <code>define</code> and
 * <code>block</code> it contains. While a nested definition is being parsed
 * the enclosing tree is suspended on a stack, and resumed once the definition
 * has been registered.
 * <p>
 * Identifiers are checked against the set of known functions as soon as they
 * are read: calling an unknown function is a parse error.
 * <p>
 * Instances keep state during a parse and are not thread-safe. They may be
 * reused for consecutive parses.
 */
public class TemplateParser {

	private static final Logger LOG = TemplateLogger.getLogger(TemplateParser.class);

	private static final String RANGE_CONTEXT = "range";

	private final String name;
	private final Set<String> functions;
	private final boolean dynamicTemplateNames;
	private final String leftDelimiter;
	private final String rightDelimiter;

	private TokenBuffer tokens;
	private Tree tree;
	private final Deque<Tree> suspendedTrees = new ArrayDeque<Tree>();
	private int maxTreeId;
	private Map<String, Tree> trees = new LinkedHashMap<String, Tree>();

	/**
	 * Creates a parser for templates named {@code name}.
	 *
	 * @param name name the top-level template is registered under, and
	 *        that errors outside any definition refer to
	 * @param settings known functions, delimiters and options
	 */
	public TemplateParser(String name, ParserSettings settings) {
		this.name = name;
		this.functions = Collections.unmodifiableSet(settings.getFunctions());
		this.dynamicTemplateNames = settings.isDynamicTemplateNames();
		this.leftDelimiter = settings.getLeftDelimiter();
		this.rightDelimiter = settings.getRightDelimiter();
	}

	/**
	 * Creates a parser with default settings and the given known functions.
	 *
	 * @param name name of the top-level template
	 * @param functions names of the functions templates may call
	 */
	public TemplateParser(String name, Collection<String> functions) {
		this(name, settingsWith(functions));
	}

	private static ParserSettings settingsWith(Collection<String> functions) {
		ParserSettings settings = new ParserSettings();
		settings.setFunctions(functions);
		return settings;
	}

	public String getName() {
		return name;
	}

	/**
	 * Parses template text with the configured delimiters.
	 *
	 * @param text the template
	 * @return the templates found, by name, in order of registration
	 * @throws ParserException on the first syntax error
	 */
	public Map<String, Tree> parse(String text) {
		return parse(new Lexer(text, leftDelimiter, rightDelimiter));
	}

	/**
	 * Parses the tokens of a template.
	 *
	 * @param source the tokens
	 * @return the templates found, by name, in order of registration
	 * @throws ParserException on the first syntax error
	 */
	public Map<String, Tree> parse(TokenSource source) {
		reset(source);
		LOG.debug("Parsing template {}", name);
		TREE();
		LOG.debug("Parsed template {} into {} tree(s)", name, trees.size());
		return Collections.unmodifiableMap(trees);
	}

	void reset(TokenSource source) {
		tokens = new TokenBuffer(source);
		tree = null;
		suspendedTrees.clear();
		maxTreeId = 0;
		trees = new LinkedHashMap<String, Tree>();
	}

	/**
	 * Suspends the active tree, if any, and makes a new one active.
	 */
	void startParse(String treeName, int id) {
		if (tree != null) {
			suspendedTrees.push(tree);
		}
		maxTreeId = Math.max(maxTreeId, id);
		tree = new Tree(treeName, id);
	}

	/**
	 * Registers the active tree and resumes the tree it suspended.
	 */
	void stopParse() {
		Tree completed = activeTree();
		String treeName = completed.getName();
		Tree existing = trees.get(treeName);
		// only an empty definition may be registered over
		if (existing != null && !Tree.isEmptyTree(existing.getRoot())) {
			throw error(ErrorKind.MULTIPLE_DEFINITION, "multiple definitions of template " + treeName);
		}
		trees.put(treeName, completed);
		LOG.debug("Registered {}", completed);
		tree = suspendedTrees.isEmpty() ? null : suspendedTrees.pop();
	}

	Tree activeTree() {
		if (tree == null) {
			throw error(ErrorKind.NO_TREE, "no tree");
		}
		return tree;
	}

	Map<String, Tree> getTrees() {
		return Collections.unmodifiableMap(trees);
	}

	private int treeId() {
		return activeTree().getId();
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName

	// TREE : BODY EOF
	private void TREE() {
		startParse(name, 1);
		BODY();
		stopParse();
	}

	// BODY : { DEFINE | TEXT_OR_ACTION }
	private void BODY() {
		Tree current = activeTree();
		ListNode root = new ListNode(current.getId(), peekMust("input").getOffset());
		current.setRoot(root);
		while (peekMust("input").getType() != TokenType.EOF) {
			if (peekMust("input").getType() == TokenType.LEFT_DELIM) {
				Token delim = next();
				Token afterDelim = nextNonSpaceMust("action");
				if (afterDelim.getType() == TokenType.DEFINE) {
					DEFINE();
					continue;
				}
				tokens.backup2(delim, afterDelim);
			}
			Node node = TEXT_OR_ACTION();
			if (node.getType() == NodeType.END || node.getType() == NodeType.ELSE) {
				throw error(ErrorKind.UNEXPECTED_TOKEN, "unexpected " + node);
			}
			root.append(node);
		}
	}

	// DEFINE : define STRING } ITEM_LIST end
	private void DEFINE() {
		String context = "define clause";
		Token token = nextNonSpaceMust(context);
		String definitionName = templateName(token, context);
		expect(TokenType.RIGHT_DELIM, "define end");
		startParse(definitionName, maxTreeId + 1);
		ItemList body = ITEM_LIST();
		activeTree().setRoot(body.list);
		if (body.terminator.getType() != NodeType.END) {
			throw unexpected(body.terminator, context);
		}
		stopParse();
	}

	// ITEM_LIST : { TEXT_OR_ACTION } (end | else)
	private ItemList ITEM_LIST() {
		ListNode list = new ListNode(treeId(), peekNonSpaceMust("item list").getOffset());
		while (peekNonSpaceMust("item list").getType() != TokenType.EOF) {
			Node node = TEXT_OR_ACTION();
			if (node.getType() == NodeType.END || node.getType() == NodeType.ELSE) {
				return new ItemList(list, node);
			}
			list.append(node);
		}
		throw error(ErrorKind.UNEXPECTED_EOF, "unexpected EOF");
	}

	// TEXT_OR_ACTION : TEXT | { ACTION
	private Node TEXT_OR_ACTION() {
		Token token = nextNonSpaceMust("input");
		switch (token.getType()) {
		case TEXT:
			return new TextNode(treeId(), token.getOffset(), token.getText());
		case LEFT_DELIM:
			return ACTION();
		default:
			throw unexpected(token, "input");
		}
	}

	// ACTION : BLOCK | ELSE | END | IF | RANGE | TEMPLATE | WITH | PIPELINE }
	private Node ACTION() {
		Token token = nextNonSpaceMust("action");
		switch (token.getType()) {
		case BLOCK:
			return BLOCK();
		case ELSE:
			return ELSE();
		case END:
			return END();
		case IF:
			return IF();
		case RANGE:
			return RANGE();
		case TEMPLATE:
			return TEMPLATE();
		case WITH:
			return WITH();
		default:
			tokens.backup(token);
			return new ActionNode(treeId(), token.getOffset(), PIPELINE("command"));
		}
	}

	// CONTROL : PIPELINE ITEM_LIST [ else ( IF | ITEM_LIST ) ] end
	private Control CONTROL(boolean allowElseIf, String context) {
		Tree current = activeTree();
		int scopeDepth = current.variableCount();
		PipeNode pipe = PIPELINE(context);
		ItemList body = ITEM_LIST();
		ListNode elseList;
		switch (body.terminator.getType()) {
		case END:
			elseList = null;
			break;
		case ELSE:
			if (allowElseIf && peekMust("else if").getType() == TokenType.IF) {
				// {{else if ...}} is {{else}}{{if ...}} sharing the same {{end}}
				nextMust("else if");
				elseList = new ListNode(treeId(), body.terminator.getPosition());
				elseList.append(IF());
			} else {
				ItemList elseBody = ITEM_LIST();
				if (elseBody.terminator.getType() != NodeType.END) {
					throw error(ErrorKind.UNEXPECTED_TOKEN, "expected end; found " + elseBody.terminator);
				}
				elseList = elseBody.list;
			}
			break;
		default:
			throw error(ErrorKind.UNEXPECTED_TOKEN, "expected end; found " + body.terminator);
		}
		current.popVariables(scopeDepth);
		return new Control(pipe, body.list, elseList);
	}

	// IF : if CONTROL
	private Node IF() {
		Control control = CONTROL(true, "if");
		return new IfNode(treeId(), control.pipe.getPosition(), control.pipe, control.list, control.elseList);
	}

	// RANGE : range CONTROL
	private Node RANGE() {
		Control control = CONTROL(false, RANGE_CONTEXT);
		return new RangeNode(treeId(), control.pipe.getPosition(), control.pipe, control.list, control.elseList);
	}

	// WITH : with CONTROL
	private Node WITH() {
		Control control = CONTROL(false, "with");
		return new WithNode(treeId(), control.pipe.getPosition(), control.pipe, control.list, control.elseList);
	}

	// END : end }
	private Node END() {
		return new EndNode(treeId(), expect(TokenType.RIGHT_DELIM, "end").getOffset());
	}

	// ELSE : else } | else <if left in the stream>
	private Node ELSE() {
		Token peek = peekNonSpaceMust("else");
		if (peek.getType() == TokenType.IF) {
			return new ElseNode(treeId(), peek.getOffset());
		}
		return new ElseNode(treeId(), expect(TokenType.RIGHT_DELIM, "else").getOffset());
	}

	// BLOCK : block STRING PIPELINE ITEM_LIST end
	private Node BLOCK() {
		String context = "block clause";
		Token token = nextNonSpaceMust(context);
		String blockName = templateName(token, context);
		PipeNode pipe = PIPELINE(context);

		startParse(blockName, maxTreeId + 1);
		ItemList body = ITEM_LIST();
		activeTree().setRoot(body.list);
		if (body.terminator.getType() != NodeType.END) {
			throw unexpected(body.terminator, context);
		}
		stopParse();
		return new TemplateNode(treeId(), token.getOffset(), blockName, pipe);
	}

	// TEMPLATE : template ( STRING | '(' PIPELINE ')' ) [ PIPELINE ] }
	private Node TEMPLATE() {
		String context = "template clause";
		Token token = nextNonSpaceMust(context);
		String templateName = null;
		PipeNode namePipe = null;
		if (token.getType() == TokenType.LEFT_PAREN) {
			if (!dynamicTemplateNames) {
				throw error(ErrorKind.DYNAMIC_TEMPLATE_NAME, "dynamic template names are not enabled");
			}
			namePipe = PIPELINE("template name");
			Token close = nextMust("template name");
			if (close.getType() != TokenType.RIGHT_PAREN) {
				throw error(ErrorKind.UNCLOSED_PAREN, "unclosed right paren: unexpected " + close);
			}
		} else {
			templateName = templateName(token, context);
		}
		Token next = nextNonSpaceMust(context);
		PipeNode pipe = null;
		if (next.getType() != TokenType.RIGHT_DELIM) {
			tokens.backup(next);
			pipe = PIPELINE(context);
		}
		if (namePipe != null) {
			return new TemplateNode(treeId(), token.getOffset(), namePipe, pipe);
		}
		return new TemplateNode(treeId(), token.getOffset(), templateName, pipe);
	}

	// PIPELINE : [ DECLARATIONS ] COMMAND { '|' COMMAND } ( } | <')' left in the stream> )
	private PipeNode PIPELINE(String context) {
		List<VariableNode> declarations = new ArrayList<VariableNode>();
		Token token = nextNonSpaceMust("pipeline");
		int position = token.getOffset();
		if (token.getType() == TokenType.VARIABLE) {
			DECLARATIONS(token, declarations, context);
		} else {
			tokens.backup(token);
		}
		PipeNode pipe = new PipeNode(treeId(), position, declarations);
		while (true) {
			token = nextNonSpaceMust("pipeline");
			switch (token.getType()) {
			case RIGHT_DELIM:
			case RIGHT_PAREN:
				checkPipeline(pipe, context);
				if (token.getType() == TokenType.RIGHT_PAREN) {
					tokens.backup(token);
				}
				return pipe;
			case BOOL:
			case CHAR_CONSTANT:
			case DOT:
			case FIELD:
			case IDENTIFIER:
			case NUMBER:
			case NIL:
			case RAW_STRING:
			case STRING:
			case VARIABLE:
			case LEFT_PAREN:
				tokens.backup(token);
				pipe.append(COMMAND());
				break;
			default:
				throw unexpected(token, context);
			}
		}
	}

	// DECLARATIONS : $x := | $x , $y :=   (the second form only in range)
	private void DECLARATIONS(Token first, List<VariableNode> declarations, String context) {
		Token variable = first;
		while (true) {
			Token afterVariable = nextMust("variable");
			Token next = afterVariable;
			if (afterVariable.getType() == TokenType.SPACE) {
				next = nextNonSpaceMust("variable");
			}
			if (next.getType() != TokenType.DECLARE && next.getType() != TokenType.COMMA) {
				// not a declaration: the variable is the first operand
				if (next == afterVariable) {
					tokens.backup2(variable, next);
				} else {
					tokens.backup3(variable, afterVariable, next);
				}
				return;
			}
			Tree current = activeTree();
			declarations.add(new VariableNode(current.getId(), variable.getOffset(), variable.getText()));
			current.pushVariable(variable.getText());
			if (next.getType() == TokenType.DECLARE) {
				return;
			}
			if (!RANGE_CONTEXT.equals(context) || declarations.size() >= 2) {
				throw error(ErrorKind.TOO_MANY_DECLARATIONS, "too many declarations in " + context);
			}
			variable = nextNonSpaceMust("variable");
			if (variable.getType() != TokenType.VARIABLE) {
				throw error(ErrorKind.UNEXPECTED_TOKEN, "range can only initialize variables");
			}
		}
	}

	private void checkPipeline(PipeNode pipe, String context) {
		List<CommandNode> commands = pipe.getCommands();
		if (commands.isEmpty()) {
			throw error(ErrorKind.MISSING_VALUE, "missing value for " + context);
		}
		// only the first stage may be a constant
		for (int i = 1; i < commands.size(); i++) {
			switch (commands.get(i).getArgs().get(0).getType()) {
			case BOOL:
			case DOT:
			case NIL:
			case NUMBER:
			case STRING:
				throw error(ErrorKind.NON_EXECUTABLE_COMMAND, "non executable command in pipeline stage " + (i + 1));
			default:
				break;
			}
		}
	}

	// COMMAND : OPERAND { ' ' OPERAND } ( '|' | <} or ')' left in the stream> )
	private CommandNode COMMAND() {
		CommandNode command = new CommandNode(treeId(), peekNonSpaceMust("command").getOffset());
		while (true) {
			peekNonSpaceMust("operand");
			Node operand = OPERAND();
			if (operand != null) {
				command.append(operand);
			}
			Token token = nextMust("command");
			if (token.getType() == TokenType.SPACE) {
				continue;
			}
			if (token.getType() == TokenType.RIGHT_DELIM || token.getType() == TokenType.RIGHT_PAREN) {
				tokens.backup(token);
			} else if (token.getType() != TokenType.PIPE) {
				throw error(ErrorKind.UNEXPECTED_TOKEN, "unexpected " + token + " in operand");
			}
			break;
		}
		if (command.getArgs().isEmpty()) {
			throw error(ErrorKind.EMPTY_COMMAND, "empty command");
		}
		return command;
	}

	// OPERAND : TERM { .FIELD }
	private Node OPERAND() {
		Node node = TERM();
		if (node == null) {
			return null;
		}
		Token next = nextMust("operand");
		if (next.getType() != TokenType.FIELD) {
			tokens.backup(next);
			return node;
		}
		switch (node.getType()) {
		case BOOL:
		case STRING:
		case NUMBER:
		case NIL:
		case DOT:
			throw error(ErrorKind.UNEXPECTED_TOKEN, "unexpected . after term " + Literals.quote(node.toString()));
		default:
			break;
		}
		ChainNode chain = new ChainNode(treeId(), next.getOffset(), node);
		chain.add(next.getText());
		Token peek = peek();
		while (peek != null && peek.getType() == TokenType.FIELD) {
			chain.add(next().getText());
			peek = peek();
		}
		// .a.b and $x.a.b stay fields and variables, anything else is a chain
		switch (node.getType()) {
		case FIELD:
			String path = chain.toString();
			activeTree().addField(path);
			return new FieldNode(treeId(), chain.getPosition(), path);
		case VARIABLE:
			return new VariableNode(treeId(), chain.getPosition(), chain.toString());
		default:
			return chain;
		}
	}

	// TERM : IDENTIFIER | . | nil | $VARIABLE | .FIELD | BOOL | NUMBER | '(' PIPELINE ')' | STRING
	private Node TERM() {
		Token token = nextNonSpaceMust("operand");
		int id = treeId();
		switch (token.getType()) {
		case IDENTIFIER:
			if (!functions.contains(token.getText())) {
				throw error(ErrorKind.UNDEFINED_FUNCTION, "function " + token.getText() + " not defined");
			}
			return new IdentifierNode(id, token.getOffset(), token.getText());
		case DOT:
			return new DotNode(id, token.getOffset());
		case NIL:
			return new NilNode(id, token.getOffset());
		case VARIABLE:
			return useVariable(token);
		case FIELD:
			activeTree().addField(token.getText());
			return new FieldNode(id, token.getOffset(), token.getText());
		case BOOL:
			return new BoolNode(id, token.getOffset(), "true".equals(token.getText()));
		case CHAR_CONSTANT:
		case NUMBER:
			try {
				return NumberNode.parse(id, token.getOffset(), token.getText(), token.getType() == TokenType.CHAR_CONSTANT);
			} catch (MalformedLiteralException e) {
				throw error(ErrorKind.MALFORMED_LITERAL, e.getMessage());
			}
		case LEFT_PAREN:
			PipeNode pipe = PIPELINE("parenthesized pipeline");
			Token close = nextMust("parenthesized pipeline");
			if (close.getType() != TokenType.RIGHT_PAREN) {
				throw error(ErrorKind.UNCLOSED_PAREN, "unclosed right paren: unexpected " + close);
			}
			return pipe;
		case STRING:
		case RAW_STRING:
			try {
				return new StringNode(id, token.getOffset(), token.getText(), Literals.unquote(token.getText()));
			} catch (MalformedLiteralException e) {
				throw error(ErrorKind.MALFORMED_LITERAL, e.getMessage());
			}
		default:
			tokens.backup(token);
			return null;
		}
	}

	// CHECKSTYLE.ON: MethodName

	private VariableNode useVariable(Token token) {
		String variable = token.getText();
		// $ is the data passed to the template, always in scope
		if (!"$".equals(variable) && !activeTree().hasVariable(variable)) {
			throw error(ErrorKind.UNDEFINED_VARIABLE, "undefined variable " + variable);
		}
		return new VariableNode(treeId(), token.getOffset(), variable);
	}

	private String templateName(Token token, String context) {
		if (token.getType() != TokenType.STRING && token.getType() != TokenType.RAW_STRING) {
			throw unexpected(token, context);
		}
		try {
			return Literals.unquote(token.getText());
		} catch (MalformedLiteralException e) {
			throw error(ErrorKind.MALFORMED_LITERAL, e.getMessage());
		}
	}

	private Token checked(Token token) {
		if (token != null && token.getType() == TokenType.ERROR) {
			throw error(ErrorKind.LEXICAL, token.getText());
		}
		return token;
	}

	private Token next() {
		return checked(tokens.next());
	}

	private Token peek() {
		return checked(tokens.peek());
	}

	private Token nextMust(String context) {
		return must(next(), context);
	}

	private Token peekMust(String context) {
		return must(peek(), context);
	}

	private Token nextNonSpaceMust(String context) {
		return must(checked(tokens.nextNonSpace()), context);
	}

	private Token peekNonSpaceMust(String context) {
		return must(checked(tokens.peekNonSpace()), context);
	}

	private Token must(Token token, String context) {
		if (token == null) {
			throw error(ErrorKind.UNEXPECTED_EOF, "unexpected end in " + context);
		}
		return token;
	}

	private Token expect(TokenType expected, String context) {
		Token token = nextNonSpaceMust(context);
		if (token.getType() != expected) {
			throw unexpected(token, context);
		}
		return token;
	}

	private ParserException unexpected(Object what, String context) {
		return error(ErrorKind.UNEXPECTED_TOKEN, "unexpected " + what + " in " + context);
	}

	private ParserException error(ErrorKind kind, String message) {
		return new ParserException(kind, tree == null ? name : tree.getName(), tokens == null ? 0 : tokens.getLine(), message);
	}

	/**
	 * Body of a nested list and the {@code end} or {@code else} that closed it.
	 */
	private static final class ItemList {
		private final ListNode list;
		private final Node terminator;

		private ItemList(ListNode list, Node terminator) {
			this.list = list;
			this.terminator = terminator;
		}
	}

	/**
	 * What <code>if</code>, <code>range</code> and <code>with</code> share.
	 */
	private static final class Control {
		private final PipeNode pipe;
		private final ListNode list;
		private final ListNode elseList;

		private Control(PipeNode pipe, ListNode list, ListNode elseList) {
			this.pipe = pipe;
			this.list = list;
			this.elseList = elseList;
		}
	}
}
