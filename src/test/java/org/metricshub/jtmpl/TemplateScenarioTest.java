package org.metricshub.jtmpl;

import static org.metricshub.jtmpl.TemplateTestSupport.templateTest;

import org.junit.Test;
import org.metricshub.jtmpl.frontend.ast.ParserException.ErrorKind;

/**
 * End-to-end parsing scenarios, from template text to registered trees.
 */
public class TemplateScenarioTest {

	@Test
	public void testFunctionMustBeKnown() throws Exception {
		templateTest("eq is not declared")
				.name("foo")
				.template("{{ if eq .foo \"bar\" }} 2000 {{ end }}")
				.expectError(ErrorKind.UNDEFINED_FUNCTION, "template: foo:1:function eq not defined")
				.runAndAssert();
		templateTest("eq is declared")
				.name("foo")
				.functions("eq")
				.template("{{ if eq .foo \"bar\" }} 2000 {{ end }}")
				.expectTrees("foo")
				.expectRendering("{{if eq .foo \"bar\"}} 2000 {{end}}")
				.runAndAssert();
	}

	@Test
	public void testIfElseDisplay() throws Exception {
		templateTest("if/else renders back")
				.name("")
				.template("{{if .}}2000{{else}} 3000 {{end}}")
				.expectRendering("{{if .}}2000{{else}} 3000 {{end}}")
				.runAndAssert();
	}

	@Test
	public void testWithDeclaration() throws Exception {
		templateTest("with declares a variable for its body")
				.template("{{ with $bar := \"foo\" }}{{ $bar }}{{ end }}")
				.expectRendering("{{with $bar := \"foo\"}}{{$bar}}{{end}}")
				.runAndAssert();
		templateTest("the variable is gone after end")
				.template("{{ with $bar := \"foo\" }}{{ end }}{{ $bar }}")
				.expectError(ErrorKind.UNDEFINED_VARIABLE, "template: test:1:undefined variable $bar")
				.runAndAssert();
	}

	@Test
	public void testDefineAndBlock() throws Exception {
		templateTest("define and block register their own trees")
				.template("{{define \"a\"}}A{{end}}{{block \"b\" .}}B{{end}}")
				.expectTrees("a", "b", "test")
				.expectRendering("{{template \"b\" .}}")
				.expectRendering("a", "A")
				.expectRendering("b", "B")
				.runAndAssert();
		templateTest("two non-empty definitions clash")
				.template("{{define \"a\"}}x{{end}}{{define \"a\"}}y{{end}}")
				.expectError(ErrorKind.MULTIPLE_DEFINITION, "template: a:1:multiple definitions of template a")
				.runAndAssert();
	}

	@Test
	public void testCustomDelimiters() throws Exception {
		templateTest("default delimiters are plain text")
				.delimiters("[[", "]]")
				.template("x[[.Y]]{{.Z}}")
				.expectRendering("x{{.Y}}{{.Z}}")
				.runAndAssert();
	}

	@Test
	public void testDynamicTemplateNames() throws Exception {
		templateTest("dynamic names disabled")
				.template("{{template (.X)}}")
				.expectError(ErrorKind.DYNAMIC_TEMPLATE_NAME, "template: test:1:dynamic template names are not enabled")
				.runAndAssert();
		templateTest("dynamic names enabled")
				.dynamicTemplateNames()
				.template("{{template (.X)}}")
				.expectRendering("{{template (.X)}}")
				.runAndAssert();
	}

	@Test
	public void testTrimMarkersAndComments() throws Exception {
		templateTest("trim markers eat surrounding spaces")
				.template("a  {{- .X -}}  b")
				.expectRendering("a{{.X}}b")
				.runAndAssert();
		templateTest("comments leave no node")
				.template("a{{/* c */}}b")
				.expectRendering("ab")
				.runAndAssert();
	}

	@Test
	public void testPipelineChecks() throws Exception {
		templateTest("constant after a pipe")
				.template("{{.X | \"s\"}}")
				.expectError(ErrorKind.NON_EXECUTABLE_COMMAND, "template: test:1:non executable command in pipeline stage 2")
				.runAndAssert();
		templateTest("empty if")
				.template("{{if}}{{end}}")
				.expectError(ErrorKind.MISSING_VALUE, "template: test:1:missing value for if")
				.runAndAssert();
		templateTest("declaration in with")
				.template("{{with $a, $b := .}}{{end}}")
				.expectError(ErrorKind.TOO_MANY_DECLARATIONS, "template: test:1:too many declarations in with")
				.runAndAssert();
	}
}
