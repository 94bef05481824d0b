package org.metricshub.jtmpl;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.metricshub.jtmpl.frontend.Tree;
import org.metricshub.jtmpl.frontend.ast.ParserException;
import org.metricshub.jtmpl.util.Literals;
import org.metricshub.jtmpl.util.ParserSettings;
import org.metricshub.jtmpl.util.TemplateFileSource;
import org.metricshub.jtmpl.util.TemplateSource;

/**
 * Command-line interface for Jtmpl.
 * <p>
 * Parses templates given inline, in files or on the standard input, and
 * prints the templates they define.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "Jtmpl.jar";
		}
		JAR_NAME = myName;
	}

	private final ParserSettings settings = new ParserSettings();
	private final InputStream in;
	private final PrintStream out;

	private final List<TemplateSource> templateSources = new ArrayList<TemplateSource>();
	private String templateName = TemplateSource.DESCRIPTION_COMMAND_LINE_TEMPLATE;

	private boolean render;
	private boolean dumpSyntaxTree;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard input and output streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams. The error stream is
	 * currently unused but kept for API symmetry with typical Java main methods.
	 *
	 * @param in stream from which the template is read when none is given
	 * @param out stream where the templates are printed
	 * @param err stream where error messages could be written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, @SuppressWarnings("unused") PrintStream err) {
		this.in = in;
		this.out = out;
	}

	/**
	 * Returns the mutable {@link ParserSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public ParserSettings getSettings() {
		return settings;
	}

	/**
	 * Returns the list of template sources specified on the command line.
	 *
	 * @return defensive copy of the template sources list
	 */
	public List<TemplateSource> getTemplateSources() {
		return new ArrayList<TemplateSource>(templateSources);
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Parse the arguments
		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options: the remaining arg is the template itself
				break;
			} else if (arg.equals("-")) {
				// single dash indicates end of options as well
				++argIdx;
				break;
			} else if (arg.equals("-F")) {
				// -F name : declare a function templates may call
				checkParameterHasArgument(args, argIdx);
				settings.addFunction(args[++argIdx]);
			} else if (arg.equals("-f")) {
				// -f filename : load template from file
				checkParameterHasArgument(args, argIdx);
				templateSources.add(new TemplateFileSource(args[++argIdx]));
			} else if (arg.equals("-n")) {
				// -n name : name of the template given inline or on stdin
				checkParameterHasArgument(args, argIdx);
				templateName = args[++argIdx];
			} else if (arg.equals("--delims")) {
				// --delims left right : custom action delimiters
				if (argIdx + 2 >= args.length) {
					throw new IllegalArgumentException("Need two additional arguments for " + arg);
				}
				settings.setDelimiters(args[argIdx + 1], args[argIdx + 2]);
				argIdx += 2;
			} else if (arg.equals("--dynamic-names")) {
				settings.setDynamicTemplateNames(true);
			} else if (arg.equals("--render")) {
				render = true;
			} else if (arg.equals("--dump-syntax")) {
				dumpSyntaxTree = true;
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (render && dumpSyntaxTree) {
			throw new IllegalArgumentException("--render and --dump-syntax cannot be combined.");
		}

		if (argIdx < args.length) {
			if (!templateSources.isEmpty()) {
				throw new IllegalArgumentException("Template text cannot be combined with -f: " + args[argIdx]);
			}
			templateSources.add(new TemplateSource(templateName, args[argIdx++]));
		} else if (templateSources.isEmpty()) {
			templateSources
					.add(
							new TemplateSource(
									templateName,
									new InputStreamReader(in, StandardCharsets.UTF_8)));
		}

		if (argIdx < args.length) {
			throw new IllegalArgumentException("Unexpected argument: " + args[argIdx]);
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws Exception if a template cannot be read or parsed
	 */
	public void run() throws Exception {
		if (printUsage) {
			usage(out);
			return;
		}
		Jtmpl jtmpl = new Jtmpl(settings);
		for (TemplateSource source : templateSources) {
			Map<String, Tree> trees = jtmpl.parse(source);
			for (Tree tree : trees.values()) {
				if (render) {
					printSource(tree, source.getTemplateName());
				} else if (dumpSyntaxTree) {
					out.println(tree + ":");
					tree.getRoot().dump(out);
				} else {
					printSummary(tree);
				}
			}
		}
	}

	private void printSummary(Tree tree) {
		StringBuilder line = new StringBuilder(tree.toString()).append(" fields:");
		for (String field : tree.getFields()) {
			line.append(' ').append(field);
		}
		out.println(line);
	}

	/**
	 * Prints a tree so that the output parses back to the same templates:
	 * nested templates are wrapped in a define.
	 */
	private void printSource(Tree tree, String topLevelName) {
		if (tree.getName().equals(topLevelName)) {
			out.println(tree.getRoot());
		} else {
			out.println("{{define " + Literals.quote(tree.getName()) + "}}" + tree.getRoot() + "{{end}}");
		}
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-F function]..." +
								" [-f template-filename]..." +
								" [-n name]" +
								" [--delims left right]" +
								" [--dynamic-names]" +
								" [--render|--dump-syntax]" +
								" [template]");
		dest.println();
		dest.println(" -F function = Declare a function templates may call.");
		dest.println(" -f filename = Use contents of filename for template, named after the file.");
		dest.println(" -n name = Name of the template given on the command line or on stdin.");
		dest.println(" --delims left right = Use left and right as action delimiters instead of {{ and }}.");
		dest.println(" --dynamic-names = Accept {{template (pipeline)}}.");
		dest.println(" --render = Print the templates back as template source.");
		dest.println(" --dump-syntax = Print the syntax trees.");
		dest.println();
		dest.println(" Without template or -f, the template is read from the standard input.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param is input stream for the template when none is given
	 * @param os output stream for the printed templates
	 * @param es error stream for diagnostic messages
	 * @return configured and executed CLI instance
	 * @throws Exception if execution fails
	 */
	public static Cli create(String[] args, InputStream is, PrintStream os, PrintStream es) throws Exception {
		Cli cli = new Cli(is, os, es);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		try {
			Cli cli = new Cli();
			cli.parse(args);
			cli.run();
		} catch (ParserException e) {
			System.err.println(e.getMessage());
			System.exit(1);
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			e.printStackTrace(System.err);
			System.exit(1);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		}
	}
}
