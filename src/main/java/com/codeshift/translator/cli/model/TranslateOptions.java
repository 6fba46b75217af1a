package com.codeshift.translator.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "translate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class TranslateOptions {

	@Parameters(index = "0", arity = "0..1", paramLabel = "TREE", description = "Syntax tree document (JSON) produced by the parser")
	private Path inputFile;

	@Option(names = { "--output", "-o" }, description = "Output file (defaults to the input path with a .ts extension)")
	private Path outputFile;

	@Option(names = { "--indent" }, defaultValue = "4", description = "Spaces per nesting level (default: 4)")
	private int indentWidth;

	@Option(names = {
			"--line-separator" }, defaultValue = "SYSTEM", description = "Line terminator: LF, CRLF or SYSTEM (default: SYSTEM)")
	private LineEnding lineEnding;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
	private boolean force;

	@Option(names = { "--dry-run" }, description = "Print the translation instead of writing it")
	private boolean dryRun;

}
