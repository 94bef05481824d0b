package org.metricshub.jtmpl.frontend;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import org.metricshub.jtmpl.frontend.ast.ActionNode;
import org.metricshub.jtmpl.frontend.ast.ChainNode;
import org.metricshub.jtmpl.frontend.ast.CommandNode;
import org.metricshub.jtmpl.frontend.ast.FieldNode;
import org.metricshub.jtmpl.frontend.ast.IfNode;
import org.metricshub.jtmpl.frontend.ast.ListNode;
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
import org.metricshub.jtmpl.util.ParserSettings;

public class TemplateParserTest {

	private static Map<String, Tree> parse(String text, String... functions) {
		return new TemplateParser("test", Arrays.asList(functions)).parse(text);
	}

	private static ListNode root(String text, String... functions) {
		return parse(text, functions).get("test").getRoot();
	}

	private static ParserException failure(String text, String... functions) {
		return assertThrows(text, ParserException.class, () -> parse(text, functions));
	}

	private static PipeNode actionPipe(ListNode root, int index) {
		return ((ActionNode) root.getNodes().get(index)).getPipe();
	}

	private static Node firstArg(PipeNode pipe) {
		return pipe.getCommands().get(0).getArgs().get(0);
	}

	@Test
	public void testTextOnly() {
		String input = "hello\n  world {not an action}";
		Map<String, Tree> trees = parse(input);
		assertEquals(1, trees.size());
		ListNode root = trees.get("test").getRoot();
		StringBuilder text = new StringBuilder();
		for (Node node : root.getNodes()) {
			assertEquals(NodeType.TEXT, node.getType());
			text.append(((TextNode) node).getText());
		}
		assertEquals(input, text.toString());
	}

	@Test
	public void testEmptyTemplate() {
		Tree tree = parse("").get("test");
		assertEquals(1, tree.getId());
		assertTrue(tree.getRoot().getNodes().isEmpty());
		assertTrue(Tree.isEmptyTree(tree.getRoot()));
	}

	@Test
	public void testIfElse() {
		String input = "{{if .}}2000{{else}} 3000 {{end}}";
		ListNode root = root(input);
		assertEquals(1, root.getNodes().size());
		IfNode ifNode = (IfNode) root.getNodes().get(0);
		assertEquals(NodeType.DOT, firstArg(ifNode.getPipe()).getType());
		assertEquals(1, ifNode.getList().getNodes().size());
		assertEquals("2000", ((TextNode) ifNode.getList().getNodes().get(0)).getText());
		assertEquals(1, ifNode.getElseList().getNodes().size());
		assertEquals(" 3000 ", ((TextNode) ifNode.getElseList().getNodes().get(0)).getText());
		assertEquals(input, root.toString());
	}

	@Test
	public void testWithDeclaration() {
		ListNode root = root("{{ with $bar := \"foo\" }}{{ $bar }}{{ end }}");
		WithNode with = (WithNode) root.getNodes().get(0);
		List<VariableNode> declarations = with.getPipe().getDeclarations();
		assertEquals(1, declarations.size());
		assertEquals("$bar", declarations.get(0).getName());
		StringNode value = (StringNode) firstArg(with.getPipe());
		assertEquals("foo", value.getText());
		assertNull(with.getElseList());

		PipeNode body = ((ActionNode) with.getList().getNodes().get(0)).getPipe();
		VariableNode bar = (VariableNode) firstArg(body);
		assertEquals("$bar", bar.getName());
		assertEquals("{{with $bar := \"foo\"}}{{$bar}}{{end}}", root.toString());
	}

	@Test
	public void testUnknownFunction() {
		String input = "{{ if eq .foo \"bar\" }} 2000 {{ end }}";
		ParserException e = failure(input);
		assertEquals(ErrorKind.UNDEFINED_FUNCTION, e.getKind());
		assertEquals("template: test:1:function eq not defined", e.getMessage());
		assertEquals("function eq not defined", e.getDetail());

		Tree tree = parse(input, "eq").get("test");
		IfNode ifNode = (IfNode) tree.getRoot().getNodes().get(0);
		CommandNode command = ifNode.getPipe().getCommands().get(0);
		assertEquals(3, command.getArgs().size());
		assertEquals(NodeType.IDENTIFIER, command.getArgs().get(0).getType());
		assertTrue(tree.getFields().contains(".foo"));
	}

	@Test
	public void testUndefinedVariable() {
		ParserException e = failure("{{$x}}");
		assertEquals(ErrorKind.UNDEFINED_VARIABLE, e.getKind());
		assertEquals("template: test:1:undefined variable $x", e.getMessage());

		ListNode root = root("{{$x := 1}}{{$x}}");
		assertEquals("$x", ((VariableNode) firstArg(actionPipe(root, 1))).getName());
	}

	@Test
	public void testDollarIsAlwaysDefined() {
		assertEquals("{{$}}{{$.a}}", root("{{$}}{{$.a}}").toString());
	}

	@Test
	public void testControlScopeEndsWithItsEnd() {
		parse("{{if $x := 1}}{{$x}}{{else}}{{$x}}{{end}}");
		ParserException e = failure("{{with $x := 1}}{{end}}{{$x}}");
		assertEquals(ErrorKind.UNDEFINED_VARIABLE, e.getKind());
		// a declaration outside any control stays visible
		parse("{{$x := 1}}{{if .}}{{end}}{{$x}}");
	}

	@Test
	public void testDefinitionsHaveTheirOwnScope() {
		ParserException e = failure("{{$x := 1}}{{define \"d\"}}{{$x}}{{end}}");
		assertEquals("template: d:1:undefined variable $x", e.getMessage());
	}

	@Test
	public void testRangeDeclarations() {
		RangeNode range = (RangeNode) root("{{range $i, $e := .}}{{$i}}{{$e}}{{end}}").getNodes().get(0);
		assertEquals(2, range.getPipe().getDeclarations().size());
		assertEquals("$e", range.getPipe().getDeclarations().get(1).getName());

		ParserException e = failure("{{range $a, $b, $c := .}}{{end}}");
		assertEquals(ErrorKind.TOO_MANY_DECLARATIONS, e.getKind());
		assertEquals("template: test:1:too many declarations in range", e.getMessage());

		assertEquals(ErrorKind.TOO_MANY_DECLARATIONS, failure("{{if $a, $b := .}}{{end}}").getKind());
		assertEquals("too many declarations in with", failure("{{with $a, $b := .}}{{end}}").getDetail());
		assertEquals("range can only initialize variables", failure("{{range $a, 1}}{{end}}").getDetail());
	}

	@Test
	public void testRangeSelfReference() {
		// the variable is in scope in the rest of its own pipeline
		parse("{{range $x := $x}}{{end}}");
	}

	@Test
	public void testRangeElse() {
		RangeNode range = (RangeNode) root("{{range .}}x{{else}}y{{end}}").getNodes().get(0);
		assertEquals("y", range.getElseList().toString());
	}

	@Test
	public void testElseIfChain() {
		String input = "{{if .a}}A{{else if .b}}B{{else}}C{{end}}";
		IfNode outer = (IfNode) root(input).getNodes().get(0);
		assertEquals(1, outer.getElseList().getNodes().size());
		IfNode inner = (IfNode) outer.getElseList().getNodes().get(0);
		assertEquals(".b", firstArg(inner.getPipe()).toString());
		assertEquals("C", inner.getElseList().toString());
		assertEquals("{{if .a}}A{{else}}{{if .b}}B{{else}}C{{end}}{{end}}", outer.toString());
	}

	@Test
	public void testElseIfOnlyForIf() {
		ParserException e = failure("{{range .}}{{else if .x}}{{end}}");
		assertEquals("template: test:1:unexpected <if> in input", e.getMessage());
	}

	@Test
	public void testMisplacedEndAndElse() {
		assertEquals("template: test:1:unexpected {{end}}", failure("{{end}}").getMessage());
		assertEquals("template: test:1:unexpected {{else}}", failure("a{{else}}").getMessage());
		assertEquals(
				"template: test:1:expected end; found {{else}}",
				failure("{{if .}}x{{else}}y{{else}}z{{end}}").getMessage());
		assertEquals("unexpected \"x\" in end", failure("{{if .}}{{end x}}").getDetail());
	}

	@Test
	public void testUnclosedControl() {
		ParserException e = failure("{{if .}}abc");
		assertEquals(ErrorKind.UNEXPECTED_EOF, e.getKind());
		assertEquals("template: test:1:unexpected EOF", e.getMessage());
	}

	@Test
	public void testDefine() {
		Map<String, Tree> trees = parse("{{define \"a\"}}A{{.x}}{{end}}text");
		assertEquals(Arrays.asList("a", "test"), Arrays.asList(trees.keySet().toArray()));
		Tree a = trees.get("a");
		assertEquals(2, a.getId());
		assertEquals("A{{.x}}", a.getRoot().toString());
		assertEquals(2, a.getRoot().getNodes().get(0).getTreeId());
		assertTrue(a.getFields().contains(".x"));
		assertFalse(trees.get("test").getFields().contains(".x"));
		assertEquals("text", trees.get("test").getRoot().toString());
	}

	@Test
	public void testDefineErrors() {
		assertEquals(
				"template: test:1:unexpected \"1\" in define clause",
				failure("{{define 1}}{{end}}").getMessage());
		assertEquals(
				"template: a:1:unexpected {{else}} in define clause",
				failure("{{define \"a\"}}x{{else}}y{{end}}").getMessage());
		assertEquals(ErrorKind.UNEXPECTED_EOF, failure("{{define \"a\"}}x").getKind());
	}

	@Test
	public void testMultipleDefinitions() {
		ParserException e = failure("{{define \"a\"}}x{{end}}{{define \"a\"}}y{{end}}");
		assertEquals(ErrorKind.MULTIPLE_DEFINITION, e.getKind());
		assertEquals("template: a:1:multiple definitions of template a", e.getMessage());

		// an empty definition may be replaced
		assertEquals("y", parse("{{define \"a\"}} {{end}}{{define \"a\"}}y{{end}}").get("a").getRoot().toString());
		assertEquals("", parse("{{define \"a\"}}{{end}}{{define \"a\"}}\n{{end}}").get("a").getRoot().toString().trim());
	}

	@Test
	public void testEmptyRedefinitionIsRejected() {
		ParserException e = failure("{{define \"a\"}}x{{end}}{{define \"a\"}} {{end}}");
		assertEquals(ErrorKind.MULTIPLE_DEFINITION, e.getKind());
		assertEquals("template: a:1:multiple definitions of template a", e.getMessage());
		assertEquals(ErrorKind.MULTIPLE_DEFINITION, failure("{{define \"a\"}}x{{end}}{{define \"a\"}}{{end}}").getKind());
	}

	@Test
	public void testDefinitionNamedLikeTheTopLevel() {
		// the top level registers last, over a non-empty definition of the same name
		ParserException e = failure("{{define \"test\"}}body{{end}}\n");
		assertEquals(ErrorKind.MULTIPLE_DEFINITION, e.getKind());
		assertEquals("test", e.getTemplateName());

		Tree tree = parse("{{define \"test\"}} {{end}}body").get("test");
		assertEquals("body", tree.getRoot().toString());
		assertEquals(1, tree.getId());
	}

	@Test
	public void testBlock() {
		Map<String, Tree> trees = parse("{{define \"a\"}}A{{end}}{{block \"b\" .}}B{{end}}{{define \"c\"}}C{{end}}");
		assertEquals(Arrays.asList("a", "b", "c", "test"), Arrays.asList(trees.keySet().toArray()));
		assertEquals(2, trees.get("a").getId());
		assertEquals(3, trees.get("b").getId());
		assertEquals(4, trees.get("c").getId());
		assertEquals(1, trees.get("test").getId());

		ListNode root = trees.get("test").getRoot();
		TemplateNode invocation = (TemplateNode) root.getNodes().get(0);
		assertEquals("b", invocation.getName());
		assertEquals(1, invocation.getTreeId());
		assertEquals("{{template \"b\" .}}", root.toString());
		assertEquals("B", trees.get("b").getRoot().toString());
	}

	@Test
	public void testBlockInsideDefine() {
		Map<String, Tree> trees = parse("{{define \"a\"}}<{{block \"b\" .x}}x{{end}}>{{end}}");
		assertEquals(2, trees.get("a").getId());
		assertEquals(3, trees.get("b").getId());
		assertEquals("<{{template \"b\" .x}}>", trees.get("a").getRoot().toString());
		assertEquals(
				"template: b:1:function f not defined",
				failure("{{define \"a\"}}{{block \"b\" .}}{{f}}{{end}}{{end}}").getMessage());
	}

	@Test
	public void testTemplateInvocation() {
		ListNode root = root("{{template \"x\"}}{{template `y` .a}}");
		TemplateNode x = (TemplateNode) root.getNodes().get(0);
		assertEquals("x", x.getName());
		assertNull(x.getPipe());
		assertFalse(x.isDynamic());
		TemplateNode y = (TemplateNode) root.getNodes().get(1);
		assertEquals("y", y.getName());
		assertEquals(".a", y.getPipe().toString());
		assertEquals("unexpected <nil> in template clause", failure("{{template nil}}").getDetail());
	}

	@Test
	public void testDynamicTemplateName() {
		ParserException e = failure("{{template (\"x\") .}}");
		assertEquals(ErrorKind.DYNAMIC_TEMPLATE_NAME, e.getKind());

		ParserSettings settings = new ParserSettings();
		settings.setDynamicTemplateNames(true);
		ListNode root = new TemplateParser("test", settings).parse("{{template (\"x\") .}}").get("test").getRoot();
		TemplateNode node = (TemplateNode) root.getNodes().get(0);
		assertTrue(node.isDynamic());
		assertEquals("\"x\"", node.getNamePipe().toString());
		assertEquals("{{template (\"x\") .}}", root.toString());
	}

	@Test
	public void testPipelines() {
		PipeNode pipe = actionPipe(root("{{. | printf \"%s\" | html}}", "printf", "html"), 0);
		assertEquals(3, pipe.getCommands().size());
		assertEquals(2, pipe.getCommands().get(1).getArgs().size());

		ParserException e = failure("{{printf | 3}}", "printf");
		assertEquals(ErrorKind.NON_EXECUTABLE_COMMAND, e.getKind());
		assertEquals("template: test:1:non executable command in pipeline stage 2", e.getMessage());
		assertEquals("non executable command in pipeline stage 3", failure("{{. | printf | .}}", "printf").getDetail());

		e = failure("{{}}");
		assertEquals(ErrorKind.MISSING_VALUE, e.getKind());
		assertEquals("missing value for command", e.getDetail());
		assertEquals("missing value for if", failure("{{if}}{{end}}").getDetail());
		assertEquals("unexpected \"|\" in command", failure("{{|}}").getDetail());
	}

	@Test
	public void testParenthesizedPipeline() {
		PipeNode pipe = actionPipe(root("{{len (index . 1)}}", "len", "index"), 0);
		Node inner = pipe.getCommands().get(0).getArgs().get(1);
		assertEquals(NodeType.PIPE, inner.getType());
		assertEquals("index . 1", inner.toString());
		assertEquals("{{len (index . 1)}}", root("{{len (index . 1)}}", "len", "index").toString());
	}

	@Test
	public void testFieldsAndChains() {
		Tree tree = parse("{{.a.b}}{{$v := .}}{{$v.c.d}}{{(.).e}}").get("test");
		ListNode root = tree.getRoot();
		FieldNode field = (FieldNode) firstArg(actionPipe(root, 0));
		assertEquals(Arrays.asList("a", "b"), field.getIdent());
		VariableNode variable = (VariableNode) firstArg(actionPipe(root, 2));
		assertEquals(Arrays.asList("$v", "c", "d"), variable.getIdent());
		ChainNode chain = (ChainNode) firstArg(actionPipe(root, 3));
		assertEquals(NodeType.PIPE, chain.getNode().getType());
		assertEquals(Arrays.asList("e"), chain.getFields());
		assertEquals(Arrays.asList(".a", ".a.b"), Arrays.asList(tree.getFields().toArray()));
	}

	@Test
	public void testNoFieldOnConstants() {
		ParserException e = failure("{{true.a}}");
		assertEquals(ErrorKind.UNEXPECTED_TOKEN, e.getKind());
		assertEquals("unexpected . after term \"true\"", e.getDetail());
		assertEquals("unexpected . after term \".\"", failure("{{..a}}").getDetail());
	}

	@Test
	public void testLiterals() {
		CommandNode command = actionPipe(root("{{1 2.5 0x10 'a' \"x\\ty\" `r` nil true}}"), 0).getCommands().get(0);
		List<Node> args = command.getArgs();
		assertEquals(8, args.size());
		NumberNode one = (NumberNode) args.get(0);
		assertTrue(one.isInt() && one.isUint() && one.isFloat());
		NumberNode half = (NumberNode) args.get(1);
		assertFalse(half.isInt());
		assertEquals(2.5, half.getFloatValue(), 0.0);
		assertEquals(16, ((NumberNode) args.get(2)).getIntValue());
		assertEquals('a', ((NumberNode) args.get(3)).getIntValue());
		assertEquals("x\ty", ((StringNode) args.get(4)).getText());
		assertEquals("r", ((StringNode) args.get(5)).getText());
		assertEquals(NodeType.NIL, args.get(6).getType());
		assertEquals(NodeType.BOOL, args.get(7).getType());
	}

	@Test
	public void testMalformedLiterals() {
		ParserException e = failure("{{99999999999999999999}}");
		assertEquals(ErrorKind.MALFORMED_LITERAL, e.getKind());
		assertEquals("integer overflow: \"99999999999999999999\"", e.getDetail());
		assertEquals("illegal number syntax: \"08\"", failure("{{08}}").getDetail());
		assertEquals("unable to unquote string: \"\\z\"", failure("{{\"\\z\"}}").getDetail());
		assertEquals("illegal number syntax: \"1e400\"", failure("{{1e400}}").getDetail());
		assertEquals(ErrorKind.MALFORMED_LITERAL, failure("{{\"\\x\u0663\u0663\"}}").getKind());
	}

	@Test
	public void testLexicalErrors() {
		ParserException e = failure("abc\n{{ \"unterminated }}");
		assertEquals(ErrorKind.LEXICAL, e.getKind());
		assertEquals("template: test:2:unterminated quoted string", e.getMessage());
		assertEquals("template: test:1:unclosed left paren", failure("{{(.}}").getMessage());
	}

	@Test
	public void testErrorLineAndTreeName() {
		ParserException e = failure("line1\n{{define \"inner\"}}\n\n{{undefinedFn}}{{end}}");
		assertEquals("inner", e.getTemplateName());
		assertEquals(4, e.getLineNumber());
		assertEquals("template: inner:4:function undefinedFn not defined", e.getMessage());

		e = failure("{{define \"x\"}}{{end}}\n{{$y}}");
		assertEquals("template: test:2:undefined variable $y", e.getMessage());
	}

	@Test
	public void testTrimAndComments() {
		ListNode root = root("a {{- if . -}} b {{- end}}{{/* note */}}c");
		assertEquals("a{{if .}}b{{end}}c", root.toString());
	}

	@Test
	public void testCustomDelimiters() {
		ParserSettings settings = new ParserSettings();
		settings.setDelimiters("[[", "]]");
		ListNode root = new TemplateParser("test", settings).parse("[[if .]]x[[end]]{{.}}").get("test").getRoot();
		assertEquals(NodeType.IF, root.getNodes().get(0).getType());
		assertEquals("{{.}}", ((TextNode) root.getNodes().get(1)).getText());
	}

	@Test
	public void testParserIsReusable() {
		TemplateParser parser = new TemplateParser("test", Arrays.asList("f"));
		Map<String, Tree> first = parser.parse("{{define \"a\"}}x{{end}}");
		Map<String, Tree> second = parser.parse("{{define \"a\"}}y{{end}}");
		assertEquals("x", first.get("a").getRoot().toString());
		assertEquals("y", second.get("a").getRoot().toString());
		assertEquals(2, second.get("a").getId());
	}

	@Test
	public void testPositions() {
		ListNode root = root("ab{{.x}}");
		assertEquals(0, root.getNodes().get(0).getPosition());
		assertEquals(4, firstArg(actionPipe(root, 1)).getPosition());
	}
}
